package com.reduction.core;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/** {@code {name}} token substitution; doubled braces stand for literal braces. */
public final class Placeholders {
    private Placeholders() {}

    /** Substitutes every token, failing on a token with no value. */
    public static String format(String template, Map<String, String> values) {
        Objects.requireNonNull(values, "values");
        return substitute(template, name -> {
            String value = values.get(name);
            if (value == null) throw new IllegalArgumentException("Unknown placeholder '{" + name + "}' in '" + template + "'");
            return value;
        });
    }

    /** Substitutes tokens {@code lookup} knows, leaving the others as written. */
    public static String render(String template, Function<String, String> lookup) {
        Objects.requireNonNull(lookup, "lookup");
        return substitute(template, name -> {
            String value = lookup.apply(name);
            return value == null ? "{" + name + "}" : value;
        });
    }

    private static String substitute(String template, Function<String, String> resolver) {
        Objects.requireNonNull(template, "template");
        StringBuilder out = new StringBuilder(template.length());
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if ((c == '{' || c == '}') && i + 1 < template.length() && template.charAt(i + 1) == c) {
                out.append(c);
                i += 2;
                continue;
            }
            if (c == '{') {
                int close = template.indexOf('}', i + 1);
                if (close < 0) throw new IllegalArgumentException("Unterminated placeholder in '" + template + "'");
                out.append(resolver.apply(template.substring(i + 1, close).trim()));
                i = close + 1;
                continue;
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }
}
