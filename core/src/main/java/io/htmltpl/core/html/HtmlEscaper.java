package io.htmltpl.core.html;

import java.util.function.IntFunction;

/**
 * Escapes placeholder output for the context it is written into: HTML text and quoted attribute
 * values, {@code script} bodies and {@code style} bodies.
 *
 * <p>No escaped result contains {@code <}, so placeholder output can never close the element it
 * appears in.
 */
public final class HtmlEscaper {

    private HtmlEscaper() {
        // utility class
    }

    /** Replaces {@code & < > " '} with character references. */
    public static String escape(String text) {
        return replace(text, c -> switch (c) {
            case '&' -> "&amp;";
            case '<' -> "&lt;";
            case '>' -> "&gt;";
            case '"' -> "&quot;";
            case '\'' -> "&#39;";
            default -> null;
        });
    }

    /**
     * Escapes for a JavaScript string literal inside a {@code script} element. Markup characters,
     * quotes and line terminators become four-digit unicode escapes and backslashes are doubled.
     */
    public static String escapeScript(String text) {
        return replace(text, c -> switch (c) {
            case '\\' -> "\\\\";
            case '<', '>', '&', '"', '\'', '`', '\n', '\r', '\u2028', '\u2029' -> unicodeEscape(c);
            default -> null;
        });
    }

    /**
     * Escapes for a CSS string or value inside a {@code style} element, using CSS hex escapes
     * ({@code \3c }).
     */
    public static String escapeStyle(String text) {
        return replace(text, c -> switch (c) {
            case '<', '>', '&', '"', '\'', '\\', '\n', '\r', '{', '}', ';' -> "\\" + Integer.toHexString(c) + " ";
            default -> null;
        });
    }

    private static String unicodeEscape(int c) {
        return String.format("\\u%04X", c);
    }

    private static String replace(String text, IntFunction<String> replacements) {
        StringBuilder sb = null;
        for (int i = 0; i < text.length(); i++) {
            String replacement = replacements.apply(text.charAt(i));
            if (replacement != null) {
                if (sb == null) {
                    sb = new StringBuilder(text.length() + 16).append(text, 0, i);
                }
                sb.append(replacement);
            } else if (sb != null) {
                sb.append(text.charAt(i));
            }
        }
        return sb != null ? sb.toString() : text;
    }
}
