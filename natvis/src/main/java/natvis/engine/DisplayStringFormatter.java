package natvis.engine;

import java.util.Map;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import natvis.FormattedValue;
import natvis.IVariable;
import natvis.NatvisConfig;
import natvis.VisualizerBinding;
import natvis.view.VisualizerWrapper;

/**
 * Produces the one-line summary of a value from the first applicable `<DisplayString>`.
 *
 * Evaluating a `{expr}` span formats the result too, so rules can recurse into each other (or themselves);
 * past {@link NatvisConfig#MAX_FORMAT_DEPTH} nested calls the raw value is used instead.
 * Not thread safe; a session serves one request at a time.
 */
public class DisplayStringFormatter {
    private static final Logger LOG = LoggerFactory.getLogger(DisplayStringFormatter.class);

    private static final Pattern expression = Pattern.compile("^\\{[^}]*\\}");

    private final NatvisConfig config;
    private final VisualizerResolver resolver;
    private final ExpressionSubstitution substitution;
    private final VisualizationCache cache;
    private int depth = 0;

    public DisplayStringFormatter(NatvisConfig config, VisualizerResolver resolver, ExpressionSubstitution substitution, VisualizationCache cache) {
        this.config = config;
        this.resolver = resolver;
        this.substitution = substitution;
        this.cache = cache;
    }

    public FormattedValue formatDisplayString(IVariable variable) {
        VisualizerBinding visualizer = null;
        try {
            depth++;
            if (depth < NatvisConfig.MAX_FORMAT_DEPTH && shouldFormat(variable)) {
                visualizer = resolver.maybeNull_findType(variable);
                if (visualizer == null) {
                    return new FormattedValue(variable.getValue(), null);
                }

                cache.add(variable);
                for (var display : visualizer.visualizer.displayStrings) {
                    // e.g. <DisplayString>{{ size={_Mylast - _Myfirst} }}</DisplayString>
                    if (!evalCondition(display.maybeNull_condition, variable, visualizer.getScopedNames())) {
                        continue;
                    }
                    return new FormattedValue(
                        formatValue(display.template, variable, visualizer.getScopedNames()),
                        visualizer.getUiVisualizers()
                    );
                }
            }
        }
        catch (Exception e) {
            // don't allow a visualizer to mess up debugging, fall back to the native value
            LOG.debug("natvis formatDisplayString: {}", e.getMessage());
        }
        finally {
            depth--;
        }
        return new FormattedValue(variable.getValue(), visualizer == null ? null : visualizer.getUiVisualizers());
    }

    private boolean shouldFormat(IVariable variable) {
        if (variable instanceof VisualizerWrapper) {
            return false; // no display string for [Raw View]/[Visualizer View] nodes
        }
        final var mode = config.getShowDisplayStrings();
        final boolean enabled = mode == NatvisConfig.DisplayStringsMode.ON
            || (mode == NatvisConfig.DisplayStringsMode.FOR_VISUALIZED_ITEMS && variable.isVisualized());
        return enabled && !variable.isPreformatted();
    }

    String formatValue(String format, IVariable variable, Map<String, String> scopedNames) {
        if (format == null || format.trim().isEmpty()) {
            return "";
        }
        final var value = new StringBuilder();
        for (int i = 0; i < format.length(); ++i) {
            final char c = format.charAt(i);
            if (c == '{') {
                if (i + 1 < format.length() && format.charAt(i + 1) == '{') {
                    value.append('{');
                    i++;
                    continue;
                }
                // start of expression
                final var m = expression.matcher(format.substring(i));
                if (m.find()) {
                    final var exprValue = getExpressionValue(format.substring(i + 1, i + m.end() - 1), variable, scopedNames);
                    value.append(exprValue);
                    i += m.end() - 1;
                }
            }
            else if (c == '}') {
                if (i + 1 < format.length() && format.charAt(i + 1) == '}') {
                    value.append('}');
                    i++;
                    continue;
                }
                // unmatched closing brace
                return variable.getValue();
            }
            else {
                value.append(c);
            }
        }
        return value.toString();
    }

    /**
     * Substitutes and evaluates `expr`, returning the result's display string.
     */
    public String getExpressionValue(String expr, IVariable variable, Map<String, String> scopedNames) {
        final var result = substitution.getExpression(expr, variable, scopedNames);
        return formatDisplayString(result).text;
    }

    /**
     * A condition passes if it evaluates to "true" or to an integer > 0. A missing condition always passes.
     */
    public boolean evalCondition(String maybeNull_condition, IVariable variable, Map<String, String> scopedNames) {
        if (maybeNull_condition == null || maybeNull_condition.trim().isEmpty()) {
            return true;
        }
        final var exprValue = getExpressionValue(maybeNull_condition, variable, scopedNames);
        if (exprValue == null || exprValue.isEmpty()) {
            return false;
        }
        if (exprValue.trim().equalsIgnoreCase("true")) {
            return true;
        }
        try {
            return Integer.parseInt(exprValue.trim()) > 0;
        }
        catch (NumberFormatException e) {
            return false;
        }
    }
}
