package io.htmltpl.core.engine.path;

import com.fasterxml.jackson.databind.JsonNode;
import io.htmltpl.core.error.ExpressionCompileException;
import io.htmltpl.core.error.ExpressionEvalException;
import io.htmltpl.core.model.Position;
import io.htmltpl.core.model.Scope;
import io.htmltpl.core.spi.CompiledExpression;
import io.htmltpl.core.spi.ExpressionEngine;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * The default placeholder language: a dotted path into the render data.
 *
 * <pre>
 *   name
 *   user.name
 *   items[0].label
 *   items.0.label
 * </pre>
 *
 * <p>Whitespace around the path is ignored. The first segment names a top-level binding; each
 * further segment selects an object field or an array element. A numeric dotted segment selects
 * an element of an array and a field of an object.
 */
public final class PathExpressionEngine implements ExpressionEngine {

    /** Engine identifier used in configuration. */
    public static final String ENGINE_ID = "path";

    @Override
    public String id() {
        return ENGINE_ID;
    }

    @Override
    public CompiledExpression compile(String expression, Position start) {
        return new PathExpression(expression.strip(), parse(expression, start));
    }

    private static List<Segment> parse(String expression, Position start) {
        int i = 0;
        int end = expression.length();
        while (i < end && Character.isWhitespace(expression.charAt(i))) {
            i++;
        }
        while (end > i && Character.isWhitespace(expression.charAt(end - 1))) {
            end--;
        }
        if (i == end) {
            throw new ExpressionCompileException("Empty expression", start);
        }

        List<Segment> segments = new ArrayList<>();
        boolean expectName = true;
        while (i < end) {
            char c = expression.charAt(i);
            if (expectName) {
                int from = i;
                while (i < end && isNameChar(expression.charAt(i))) {
                    i++;
                }
                if (i == from) {
                    throw unexpected(expression, from, start, "a name");
                }
                segments.add(Segment.field(expression.substring(from, i)));
                expectName = false;
            } else if (c == '.') {
                i++;
                if (i == end) {
                    throw new ExpressionCompileException(
                            "Expected a name after '.'", start.advance(expression.substring(0, i)));
                }
                expectName = true;
            } else if (c == '[') {
                int from = ++i;
                while (i < end && Character.isDigit(expression.charAt(i))) {
                    i++;
                }
                if (i == from) {
                    throw unexpected(expression, from, start, "an index");
                }
                if (i == end || expression.charAt(i) != ']') {
                    throw unexpected(expression, i, start, "']'");
                }
                segments.add(Segment.index(parseIndex(expression.substring(from, i), start.advance(expression.substring(0, from)))));
                i++;
            } else {
                throw unexpected(expression, i, start, "'.' or '['");
            }
        }
        return List.copyOf(segments);
    }

    private static int parseIndex(String digits, Position at) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new ExpressionCompileException("Index out of range: " + digits, e, at);
        }
    }

    private static ExpressionCompileException unexpected(String expression, int index, Position start, String expected) {
        Position at = start.advance(expression.substring(0, index));
        String found = index < expression.length() ? "'" + expression.charAt(index) + "'" : "end of expression";
        return new ExpressionCompileException("Expected " + expected + " but found " + found, at);
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }

    /** One path step: a field name (possibly numeric) or a bracketed index. */
    private record Segment(String name, int index) {

        static Segment field(String name) {
            return new Segment(name, -1);
        }

        static Segment index(int index) {
            return new Segment(null, index);
        }

        boolean isIndex() {
            return name == null;
        }

        @Override
        public String toString() {
            return isIndex() ? "[" + index + "]" : name;
        }
    }

    /** Immutable compiled path. */
    private static final class PathExpression implements CompiledExpression {

        private final String source;
        private final List<Segment> segments;

        PathExpression(String source, List<Segment> segments) {
            this.source = source;
            this.segments = segments;
        }

        @Override
        public JsonNode evaluate(Scope scope, Position start) {
            String root = segments.get(0).name();
            JsonNode node = scope.lookup(root);
            if (node == null) {
                throw new ExpressionEvalException("no binding for '" + root + "'", start);
            }
            StringBuilder walked = new StringBuilder(root);
            for (int i = 1; i < segments.size(); i++) {
                Segment segment = segments.get(i);
                node = step(node, segment, walked.toString(), start);
                if (segment.isIndex()) {
                    walked.append(segment);
                } else {
                    walked.append('.').append(segment);
                }
            }
            return node;
        }

        private static JsonNode step(JsonNode node, Segment segment, String walked, Position start) {
            if (segment.isIndex()) {
                return element(node, segment.index(), walked, start);
            }
            if (node.isArray() && isDigits(segment.name())) {
                return element(node, Integer.parseInt(segment.name()), walked, start);
            }
            if (!node.isObject()) {
                throw new ExpressionEvalException(
                        "cannot read field '" + segment.name() + "' of " + describe(node) + " '" + walked + "'", start);
            }
            JsonNode child = node.get(segment.name());
            if (child == null) {
                throw new ExpressionEvalException("no binding for '" + walked + "." + segment.name() + "'", start);
            }
            return child;
        }

        private static JsonNode element(JsonNode node, int index, String walked, Position start) {
            if (!node.isArray()) {
                throw new ExpressionEvalException(
                        "cannot index " + describe(node) + " '" + walked + "' with [" + index + "]", start);
            }
            if (index >= node.size()) {
                throw new ExpressionEvalException(
                        "index " + index + " out of bounds for '" + walked + "' (size " + node.size() + ")", start);
            }
            return node.get(index);
        }

        private static boolean isDigits(String s) {
            if (s.isEmpty() || s.length() > 9) {
                return false;
            }
            for (int i = 0; i < s.length(); i++) {
                if (!Character.isDigit(s.charAt(i))) {
                    return false;
                }
            }
            return true;
        }

        private static String describe(JsonNode node) {
            return node.getNodeType().name().toLowerCase(Locale.ROOT);
        }

        @Override
        public String toString() {
            return "path(" + source + ")";
        }
    }
}
