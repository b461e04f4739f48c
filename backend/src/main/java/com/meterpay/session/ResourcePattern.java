package com.meterpay.session;

import java.util.regex.Pattern;

/**
 * Matches resource identifiers against a session's resource pattern.
 * {@code *} matches any run of characters, {@code {name}} one path segment, everything else literally.
 * A null, blank or "*" pattern matches every resource; leading slashes are ignored on both sides.
 */
public final class ResourcePattern {

    private ResourcePattern() {
    }

    public static boolean matches(String pattern, String resource) {
        if (pattern == null || pattern.isBlank() || "*".equals(pattern.trim())) {
            return true;
        }
        if (resource == null) {
            return false;
        }
        return compile(strip(pattern.trim())).matcher(strip(resource.trim())).matches();
    }

    /** Pattern covering every resource of one service, e.g. {@code api/weather-svc/*}. */
    public static String forService(String serviceType, String serviceId) {
        return serviceType.toLowerCase() + "/" + serviceId + "/*";
    }

    static Pattern compile(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            int close = c == '{' ? glob.indexOf('}', i) : -1;
            if (c == '*' || close > i) {
                flush(literal, regex);
                if (c == '*') {
                    regex.append(".*");
                    i++;
                } else {
                    regex.append("[^/]+");
                    i = close + 1;
                }
            } else {
                literal.append(c);
                i++;
            }
        }
        flush(literal, regex);
        return Pattern.compile(regex.toString());
    }

    private static void flush(StringBuilder literal, StringBuilder regex) {
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }

    private static String strip(String value) {
        int start = 0;
        while (start < value.length() && value.charAt(start) == '/') {
            start++;
        }
        return value.substring(start);
    }
}
