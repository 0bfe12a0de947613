package natvis.typename;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import natvis.ITypePatternMatcher;

/**
 * Parser/matcher for C++ style type names as reported by gdb/lldb and written in natvis `Name` attributes.
 *
 * Wildcards: a template argument of `*` matches any one argument, or, in last position, all remaining arguments.
 * A pattern that is just `*` matches any type.
 */
public class CppTypePatternMatcher implements ITypePatternMatcher {
    private static final String[] leadingKeywords = { "const", "volatile", "struct", "class", "union", "enum", "typename" };
    private static final String[] trailingKeywords = { "const", "volatile" };

    @Override
    public Optional<TypeName> parse(String rawTypeName) {
        if (rawTypeName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(maybeNull_parse(rawTypeName.trim()));
    }

    @Override
    public boolean match(TypeName candidate, TypeName pattern) {
        if (pattern.isWildcard()) {
            return true;
        }
        if (candidate.getQualifiers().size() != pattern.getQualifiers().size()) {
            return false;
        }
        for (int i = 0; i < pattern.getQualifiers().size(); ++i) {
            if (!match(candidate.getQualifiers().get(i), pattern.getQualifiers().get(i))) {
                return false;
            }
        }
        return candidate.getBaseName().equals(pattern.getBaseName())
            && argsMatch(candidate.getArgs(), pattern.getArgs())
            && candidate.getSuffix().equals(pattern.getSuffix());
    }

    private boolean argsMatch(List<TypeName> candidateArgs, List<TypeName> patternArgs) {
        for (int i = 0; i < patternArgs.size(); ++i) {
            final var p = patternArgs.get(i);
            if (p.isWildcard() && i == patternArgs.size() - 1) {
                return candidateArgs.size() > i;
            }
            if (i >= candidateArgs.size() || !match(candidateArgs.get(i), p)) {
                return false;
            }
        }
        return candidateArgs.size() == patternArgs.size();
    }

    /**
     * @return TypeName | null
     */
    private TypeName maybeNull_parse(String text) {
        if (text.isEmpty()) {
            return null;
        }
        if (text.equals(TypeName.WILDCARD)) {
            return TypeName.wildcard();
        }

        final var core = new StringBuilder(stripLeadingKeywords(text));
        final var suffix = stripSuffix(core);
        final var coreText = core.toString().trim();
        if (coreText.isEmpty()) {
            return null;
        }

        final var segments = splitTopLevel(coreText, "::");
        if (segments == null) {
            return null;
        }
        if (segments.size() > 1 && segments.get(0).trim().isEmpty()) {
            segments.remove(0); // leading "::" (global scope)
        }

        final var parsedSegments = new ArrayList<TypeName>();
        for (var segment : segments) {
            final var parsed = maybeNull_parseSegment(segment.trim());
            if (parsed == null) {
                return null;
            }
            parsedSegments.add(parsed);
        }

        final var innermost = parsedSegments.remove(parsedSegments.size() - 1);
        return new TypeName(parsedSegments, innermost.getBaseName(), innermost.getArgs(), suffix, text);
    }

    /**
     * `name` or `name<arg, ...>`
     */
    private TypeName maybeNull_parseSegment(String segment) {
        if (segment.isEmpty()) {
            return null;
        }
        final int open = indexOfTopLevel(segment, '<');
        if (open < 0) {
            if (segment.indexOf('>') >= 0) {
                return null;
            }
            return new TypeName(List.of(), segment, List.of(), "", segment);
        }
        if (segment.charAt(segment.length() - 1) != '>') {
            return null;
        }
        final var name = segment.substring(0, open).trim();
        if (name.isEmpty()) {
            return null;
        }
        final var argsText = segment.substring(open + 1, segment.length() - 1);
        final var args = new ArrayList<TypeName>();
        if (!argsText.trim().isEmpty()) {
            final var rawArgs = splitTopLevel(argsText, ",");
            if (rawArgs == null) {
                return null;
            }
            for (var rawArg : rawArgs) {
                final var arg = maybeNull_parse(rawArg.trim());
                if (arg == null) {
                    return null;
                }
                args.add(arg);
            }
        }
        return new TypeName(List.of(), name, args, "", segment);
    }

    private static String stripLeadingKeywords(String text) {
        var result = text;
        boolean again = true;
        while (again) {
            again = false;
            for (var kw : leadingKeywords) {
                if (result.startsWith(kw + " ")) {
                    result = result.substring(kw.length() + 1).trim();
                    again = true;
                }
            }
        }
        return result;
    }

    /**
     * removes trailing `*`, `&`, cv-qualifiers and `[N]` extents from `core`, returning them (whitespace removed, original order)
     */
    private static String stripSuffix(StringBuilder core) {
        final var removed = new ArrayList<String>();
        while (true) {
            var s = core.toString();
            final var trimmed = s.stripTrailing();
            if (trimmed.isEmpty()) {
                break;
            }
            final char last = trimmed.charAt(trimmed.length() - 1);
            if (last == '*' || last == '&') {
                removed.add(0, String.valueOf(last));
                core.setLength(trimmed.length() - 1);
                continue;
            }
            if (last == ']') {
                final int open = trimmed.lastIndexOf('[');
                if (open <= 0) {
                    break;
                }
                removed.add(0, trimmed.substring(open).replaceAll("\\s", ""));
                core.setLength(open);
                continue;
            }
            boolean strippedKeyword = false;
            for (var kw : trailingKeywords) {
                if (trimmed.endsWith(kw) && trimmed.length() > kw.length()) {
                    final char before = trimmed.charAt(trimmed.length() - kw.length() - 1);
                    if (Character.isWhitespace(before) || before == '*' || before == '&' || before == '>') {
                        removed.add(0, kw);
                        core.setLength(trimmed.length() - kw.length());
                        strippedKeyword = true;
                        break;
                    }
                }
            }
            if (!strippedKeyword) {
                break;
            }
        }
        return String.join("", removed);
    }

    private static int indexOfTopLevel(String s, char c) {
        int depth = 0;
        for (int i = 0; i < s.length(); ++i) {
            final char ch = s.charAt(i);
            if (ch == c && depth == 0) {
                return i;
            }
            if (ch == '(' || ch == '[') {
                depth++;
            }
            else if (ch == ')' || ch == ']') {
                depth--;
            }
        }
        return -1;
    }

    /**
     * Splits on `separator` where it isn't nested in <>, (), or [].
     * @return List | null if brackets are unbalanced
     */
    private static List<String> splitTopLevel(String s, String separator) {
        final var result = new ArrayList<String>();
        int depth = 0;
        int start = 0;
        int i = 0;
        while (i < s.length()) {
            final char ch = s.charAt(i);
            if (ch == '<' || ch == '(' || ch == '[') {
                depth++;
            }
            else if (ch == '>' || ch == ')' || ch == ']') {
                depth--;
                if (depth < 0) {
                    return null;
                }
            }
            else if (depth == 0 && s.startsWith(separator, i)) {
                result.add(s.substring(start, i));
                i += separator.length();
                start = i;
                continue;
            }
            i++;
        }
        if (depth != 0) {
            return null;
        }
        result.add(s.substring(start));
        return result;
    }
}
