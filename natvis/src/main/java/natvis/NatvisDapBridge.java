package natvis;

import java.util.ArrayList;

import org.eclipse.lsp4j.debug.EvaluateResponse;
import org.eclipse.lsp4j.debug.Variable;
import org.eclipse.lsp4j.debug.VariablePresentationHint;
import org.eclipse.lsp4j.debug.VariablesArguments;
import org.eclipse.lsp4j.debug.VariablesResponse;

import natvis.engine.VariableTracker;
import natvis.view.VisualizerWrapper;

/**
 * Maps visualized values onto Debug Adapter Protocol objects. A host's `variables` and `evaluate`
 * request handlers delegate here; the host still owns the protocol connection itself.
 */
public class NatvisDapBridge {
    private final INatvis natvis;
    private final VariableTracker tracker;

    public NatvisDapBridge(INatvis natvis) {
        this(natvis, new VariableTracker());
    }

    public NatvisDapBridge(INatvis natvis, VariableTracker tracker) {
        this.natvis = natvis;
        this.tracker = tracker;
    }

    public Variable toDapVariable(IVariable variable) {
        final var dapVariable = new Variable();
        dapVariable.setName(variable.getName());
        dapVariable.setValue(variable.isError() ? variable.getValue() : natvis.formatDisplayString(variable).text);
        dapVariable.setType(variable.getTypeName());
        dapVariable.setEvaluateName(variable.getFullName());
        dapVariable.setVariablesReference(variablesReferenceFor(variable));
        if (variable instanceof VisualizerWrapper) {
            final var hint = new VariablePresentationHint();
            hint.setKind("virtual");
            dapVariable.setPresentationHint(hint);
        }
        return dapVariable;
    }

    /**
     * Unknown (or collected) references yield no variables.
     */
    public VariablesResponse variables(VariablesArguments args) {
        var variables = new ArrayList<Variable>();
        final var tagged = tracker.maybeNull_getFromId(args.getVariablesReference());
        if (tagged != null) {
            for (var child : natvis.expand(tagged.variable)) {
                variables.add(toDapVariable(child));
            }
        }
        var result = new VariablesResponse();
        result.setVariables(variables.toArray(size -> new Variable[size]));
        return result;
    }

    public EvaluateResponse evaluate(IExpressionContext frame, String expression) {
        final var variable = natvis.getVariable(expression, frame);
        final Either</*err*/String, /*ok*/IVariable> result = variable.isError()
            ? Either.Left(variable.getValue())
            : Either.Right(variable);

        final var response = new EvaluateResponse();
        return result.collapse(
            err -> {
                response.setResult(err);
                response.setVariablesReference(0);
                return response;
            },
            ok -> {
                final var dapVariable = toDapVariable(ok);
                response.setResult(dapVariable.getValue());
                response.setType(dapVariable.getType());
                response.setVariablesReference(dapVariable.getVariablesReference());
                return response;
            }
        );
    }

    /**
     * Forget all handed-out references; call when the debuggee resumes.
     */
    public void invalidate() {
        tracker.clear();
    }

    private int variablesReferenceFor(IVariable variable) {
        final boolean hasChildren = variable.getChildCount() > 0
            || natvis.resolve(variable).map(binding -> binding.visualizer.hasExpandRules()).orElse(false);
        return hasChildren ? tracker.idempotentRegisterVariable(variable).id : 0;
    }
}
