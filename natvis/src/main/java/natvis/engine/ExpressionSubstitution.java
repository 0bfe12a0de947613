package natvis.engine;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import natvis.IVariable;
import natvis.view.VisualizerWrapper;

/**
 * Rewrites rule expressions so they can be evaluated outside of the visualized value's scope:
 * `_size` becomes `(list._size)`, `this` becomes `(&list)`, `$T1` becomes the bound template argument.
 *
 * An identifier together with the `.x` / `->x` chain directly following it is one token; the chain
 * is copied as-is after whatever the leading identifier was replaced with.
 */
public class ExpressionSubstitution {
    private static final Pattern variableName = Pattern.compile("[a-zA-Z$_][a-zA-Z$_0-9]*");
    private static final Pattern subfieldNames = Pattern.compile("((\\.|->)[a-zA-Z$_][a-zA-Z$_0-9]*)+");

    @FunctionalInterface
    interface Substitute {
        /**
         * @return the replacement, or null if this substitution doesn't apply
         */
        String maybeNull_replace(String name);
    }

    String processNamesInString(String expression, List<Substitute> processors) {
        final var result = new StringBuilder();
        final var nameMatcher = variableName.matcher(expression);
        final var subfieldMatcher = subfieldNames.matcher(expression);
        int pos = 0;
        while (pos < expression.length() && nameMatcher.find(pos)) {
            result.append(expression, pos, nameMatcher.start());

            String replacement = null;
            for (var p : processors) {
                replacement = p.maybeNull_replace(nameMatcher.group());
                if (replacement != null) {
                    break;
                }
            }
            result.append(replacement != null ? replacement : nameMatcher.group());
            pos = nameMatcher.end();

            subfieldMatcher.region(pos, expression.length());
            if (subfieldMatcher.lookingAt()) {
                result.append(expression, pos, subfieldMatcher.end());
                pos = subfieldMatcher.end();
            }
        }
        if (pos < expression.length()) {
            result.append(expression, pos, expression.length());
        }
        return result.toString();
    }

    /**
     * @param maybeNull_variable the value field names are resolved against; if null only `scopedNames` are substituted
     * @param maybeNull_scopedNames placeholder -> replacement, e.g. "$T1" -> "int" or "$i" -> "3"
     */
    public String replaceNamesInExpression(String expression, IVariable maybeNull_variable, Map<String, String> maybeNull_scopedNames) {
        return processNamesInString(expression, List.of(
            name -> {
                if (maybeNull_variable == null) {
                    return null;
                }

                if (name.equals("this")) {
                    final var target = maybeNull_variable instanceof VisualizerWrapper
                        ? ((VisualizerWrapper)maybeNull_variable).getWrapped()
                        : maybeNull_variable;
                    final var typeName = target.getTypeName() == null ? "" : target.getTypeName().trim();
                    return (typeName.endsWith("*") ? "(" : "(&") + target.getFullName() + ")";
                }

                final var child = maybeNull_variable.findChildByName(name);
                if (child != null) {
                    return "(" + child.getFullName() + ")";
                }

                return null;
            },
            name -> maybeNull_scopedNames == null ? null : maybeNull_scopedNames.get(name)
        ));
    }

    /**
     * Substitutes names in `expression` and evaluates the result in `variable`'s context.
     */
    public IVariable getExpression(String expression, IVariable variable, Map<String, String> scopedNames, String maybeNull_displayName) {
        final var processed = replaceNamesInExpression(expression, variable, scopedNames);
        return variable.evaluate(processed, maybeNull_displayName);
    }

    public IVariable getExpression(String expression, IVariable variable, Map<String, String> scopedNames) {
        return getExpression(expression, variable, scopedNames, null);
    }
}
