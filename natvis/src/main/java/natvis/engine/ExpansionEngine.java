package natvis.engine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import natvis.IVariable;
import natvis.NatvisConfig;
import natvis.VisualizerBinding;
import natvis.rules.ExpandRule;
import natvis.view.VisualizerWrapper;

/**
 * Produces the children of a value from its visualizer's `<Expand>` rules.
 *
 * A value that isn't being shown visualized gets a "[Visualizer View]" child in front of its native children;
 * a visualized expansion gets a trailing "[Raw View]" child. Every rule kind is capped at
 * {@link NatvisConfig#MAX_EXPAND} children, and nested `<ExpandedItem>` expansion at {@link NatvisConfig#MAX_EXPAND_DEPTH} levels.
 */
public class ExpansionEngine {
    private static final Logger LOG = LoggerFactory.getLogger(ExpansionEngine.class);

    private final NatvisConfig config;
    private final VisualizerResolver resolver;
    private final ExpressionSubstitution substitution;
    private final DisplayStringFormatter formatter;
    private int depth = 0;

    public ExpansionEngine(NatvisConfig config, VisualizerResolver resolver, ExpressionSubstitution substitution, DisplayStringFormatter formatter) {
        this.config = config;
        this.resolver = resolver;
        this.substitution = substitution;
        this.formatter = formatter;
    }

    public IVariable[] expand(IVariable variable) {
        try {
            depth++;
            if (depth > NatvisConfig.MAX_EXPAND_DEPTH) {
                // <ExpandedItem> chains that lead back to themselves
                return variable.getChildren();
            }
            if (variable.isVisualized()
                || (config.getShowDisplayStrings() == NatvisConfig.DisplayStringsMode.ON && !(variable instanceof VisualizerWrapper))
            ) {
                // visualize right away, but never for a [Raw View] node
                return expandVisualized(variable);
            }
            final var visView = maybeNull_getVisualizationWrapper(variable);
            if (visView == null) {
                return variable.getChildren();
            }
            final var children = new ArrayList<IVariable>();
            children.add(visView);
            children.addAll(Arrays.asList(variable.getChildren()));
            return children.toArray(new IVariable[0]);
        }
        catch (Exception e) {
            LOG.debug("natvis expand: {}", e.getMessage());
            return variable.getChildren();
        }
        finally {
            depth--;
        }
    }

    /**
     * @return a "[Visualizer View]" node for `variable`, or null if it has no expand rules (or is already a view node)
     */
    public IVariable maybeNull_getVisualizationWrapper(IVariable variable) {
        if (variable.isPreformatted() || variable instanceof VisualizerWrapper) {
            return null; // don't stack wrappers
        }
        final var visualizer = resolver.maybeNull_findType(variable);
        if (visualizer == null || !visualizer.visualizer.hasExpandRules()) {
            return null;
        }
        return new VisualizerWrapper(VisualizerWrapper.VISUALIZED_VIEW, variable, visualizer, true);
    }

    private IVariable[] expandVisualized(IVariable variable) {
        final var visualizer = resolver.maybeNull_findType(variable);
        if (visualizer == null || !visualizer.visualizer.hasExpandRules()) {
            return variable.getChildren();
        }

        final var children = new ArrayList<IVariable>();
        final var expander = new RuleExpander(variable, visualizer, children);
        for (var rule : visualizer.visualizer.maybeNull_expandRules) {
            try {
                rule.accept(expander);
            }
            catch (SizeParseException e) {
                // only this rule is abandoned
                LOG.debug("natvis expand: {} in <{}> of '{}'", e.getMessage(), rule.getClass().getSimpleName(), visualizer.visualizer.name);
            }
        }

        if (!(variable instanceof VisualizerWrapper)) {
            children.add(new VisualizerWrapper(VisualizerWrapper.RAW_VIEW, variable, visualizer, false));
        }
        return children.toArray(new IVariable[0]);
    }

    private class RuleExpander implements ExpandRule.Visitor<Void> {
        private final IVariable variable;
        private final Map<String, String> scopedNames;
        private final List<IVariable> children;

        RuleExpander(IVariable variable, VisualizerBinding visualizer, List<IVariable> children) {
            this.variable = variable;
            this.scopedNames = visualizer.getScopedNames();
            this.children = children;
        }

        private boolean evalCondition(String maybeNull_condition) {
            return formatter.evalCondition(maybeNull_condition, variable, scopedNames);
        }

        @Override
        public Void visitItem(ExpandRule.Item item) {
            if (evalCondition(item.maybeNull_condition)) {
                children.add(substitution.getExpression(item.value, variable, scopedNames, item.maybeNull_name));
            }
            return null;
        }

        @Override
        public Void visitArrayItems(ExpandRule.ArrayItems item) {
            if (!evalCondition(item.maybeNull_condition)) {
                return null;
            }
            final var val = formatter.getExpressionValue(item.size, variable, scopedNames);
            final int size = Numbers.clampToMaxExpand(Numbers.parseUintOrThrow(val));
            for (var vp : item.valuePointers) {
                if (!evalCondition(vp.maybeNull_condition)) {
                    continue;
                }
                final var elementType = substitution.getExpression("*(" + vp.value + ")", variable, scopedNames).getTypeName();
                if (elementType == null || elementType.trim().isEmpty()) {
                    continue;
                }
                final var arrayExpr = substitution.getExpression(
                    "(" + elementType + "[" + size + "])*(" + vp.value + ")",
                    variable,
                    scopedNames
                );
                if (arrayExpr.getChildCount() != 0) {
                    children.addAll(Arrays.asList(arrayExpr.getChildren()));
                }
                break;
            }
            return null;
        }

        @Override
        public Void visitTreeItems(ExpandRule.TreeItems item) {
            if (!evalCondition(item.maybeNull_condition)) {
                return null;
            }
            if (isBlank(item.maybeNull_size)
                || isBlank(item.maybeNull_headPointer)
                || isBlank(item.maybeNull_leftPointer)
                || isBlank(item.maybeNull_rightPointer)
                || item.maybeNull_valueNode == null
                || isBlank(item.maybeNull_valueNode.value)
            ) {
                return null;
            }
            final var val = formatter.getExpressionValue(item.maybeNull_size, variable, scopedNames);
            final int size = Numbers.clampToMaxExpand(Numbers.parseUintOrThrow(val));
            final var headVal = substitution.getExpression(item.maybeNull_headPointer, variable, scopedNames);
            final long head = Numbers.parseAddr(headVal.getValue());
            if (head == 0 || size == 0) {
                return null;
            }

            final var goLeft = NodeStep.maybeNull_forField(item.maybeNull_leftPointer, headVal);
            final var goRight = NodeStep.maybeNull_forField(item.maybeNull_rightPointer, headVal);
            final var getValue = maybeNull_valueAccessor(item.maybeNull_valueNode.value, headVal, false);
            if (goLeft == null || goRight == null || getValue == null) {
                return null;
            }
            Traversal.walkTree(headVal, goLeft, goRight, getValue, children, size);
            return null;
        }

        @Override
        public Void visitLinkedListItems(ExpandRule.LinkedListItems item) {
            // e.g.
            //    <LinkedListItems>
            //      <Size>m_nElements</Size>    -- optional, will go until NextPointer is 0 or == HeadPointer
            //      <HeadPointer>m_pHead</HeadPointer>
            //      <NextPointer>m_pNext</NextPointer>
            //      <ValueNode>m_element</ValueNode>
            //    </LinkedListItems>
            if (!evalCondition(item.maybeNull_condition)) {
                return null;
            }
            if (isBlank(item.maybeNull_headPointer) || isBlank(item.maybeNull_nextPointer) || isBlank(item.maybeNull_valueNode)) {
                return null;
            }
            int size = NatvisConfig.MAX_EXPAND;
            if (!isBlank(item.maybeNull_size)) {
                final var val = formatter.getExpressionValue(item.maybeNull_size, variable, scopedNames);
                size = Numbers.clampToMaxExpand(Numbers.parseUint(val));
            }
            final var headVal = substitution.getExpression(item.maybeNull_headPointer, variable, scopedNames);
            final long head = Numbers.parseAddr(headVal.getValue());
            if (head == 0 || size == 0) {
                return null;
            }

            final var goNext = NodeStep.maybeNull_forField(item.maybeNull_nextPointer, headVal);
            final var getValue = maybeNull_valueAccessor(item.maybeNull_valueNode, headVal, true);
            if (goNext == null || getValue == null) {
                return null;
            }
            Traversal.walkList(headVal, goNext, getValue, children, size, item.noValueHeadPointer);
            return null;
        }

        @Override
        public Void visitIndexListItems(ExpandRule.IndexListItems item) {
            // e.g.
            //    <IndexListItems>
            //      <Size>_M_vector._M_index</Size>
            //      <ValueNode>*(_M_vector._M_array[$i])</ValueNode>
            //    </IndexListItems>
            if (!evalCondition(item.maybeNull_condition)) {
                return null;
            }
            int size = 0;
            for (var s : item.sizes) {
                if (isBlank(s.value)) {
                    continue;
                }
                if (evalCondition(s.maybeNull_condition)) {
                    final var val = formatter.getExpressionValue(s.value, variable, scopedNames);
                    size = Numbers.clampToMaxExpand(Numbers.parseUint(val));
                    break;
                }
            }
            for (var v : item.valueNodes) {
                if (isBlank(v.value)) {
                    continue;
                }
                if (evalCondition(v.maybeNull_condition)) {
                    final var processedExpr = substitution.replaceNamesInExpression(v.value, variable, scopedNames);
                    final var indexDic = new HashMap<String, String>();
                    for (int index = 0; index < size; ++index) {
                        indexDic.put("$i", Integer.toString(index));
                        final var finalExpr = substitution.replaceNamesInExpression(processedExpr, null, indexDic);
                        children.add(variable.evaluate(finalExpr, "[" + index + "]"));
                    }
                    break;
                }
            }
            return null;
        }

        @Override
        public Void visitExpandedItem(ExpandRule.ExpandedItem item) {
            // e.g.
            //    <Type Name="std::auto_ptr&lt;*&gt;">
            //      <DisplayString>auto_ptr {*_Myptr}</DisplayString>
            //      <Expand>
            //        <ExpandedItem>_Myptr</ExpandedItem>
            //      </Expand>
            //    </Type>
            if (!evalCondition(item.maybeNull_condition)) {
                return null;
            }
            final var expanded = substitution.getExpression(item.value, variable, scopedNames);
            children.addAll(Arrays.asList(expand(expanded)));
            return null;
        }

        /**
         * How to get a node's payload: the node itself (`this`), one of its fields, or an expression evaluated against it.
         * @param requireNoError for lists an expression that fails on the head node disqualifies the rule
         */
        private NodeStep maybeNull_valueAccessor(String valueNode, IVariable headVal, boolean requireNoError) {
            if (valueNode.equals("this")) {
                return NodeStep.identity();
            }
            if (headVal.findChildByName(valueNode) != null) {
                return v -> v.findChildByName(valueNode);
            }
            final var value = substitution.getExpression(valueNode, headVal, scopedNames);
            if (value != null && (!requireNoError || !value.isError())) {
                return v -> substitution.getExpression(valueNode, v, scopedNames);
            }
            return null;
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
