package io.htmltpl.core.engine.jslt;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.schibsted.spt.data.jslt.Expression;
import com.schibsted.spt.data.jslt.JsltException;
import com.schibsted.spt.data.jslt.Parser;
import io.htmltpl.core.error.ExpressionCompileException;
import io.htmltpl.core.error.ExpressionEvalException;
import io.htmltpl.core.model.Position;
import io.htmltpl.core.model.Scope;
import io.htmltpl.core.spi.CompiledExpression;
import io.htmltpl.core.spi.ExpressionEngine;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * JSLT placeholder language, backed by the Schibsted JSLT library.
 *
 * <p>The render data is the JSLT input, so {@code ${.user.name}} reads a field. Every top-level
 * binding is also exposed as an external variable: {@code ${$user.name}} is equivalent.
 */
public final class JsltExpressionEngine implements ExpressionEngine {

    /** Engine identifier used in configuration. */
    public static final String ENGINE_ID = "jslt";

    @Override
    public String id() {
        return ENGINE_ID;
    }

    @Override
    public CompiledExpression compile(String expression, Position start) {
        if (expression.isBlank()) {
            throw new ExpressionCompileException("Empty expression", start);
        }
        try {
            return new JsltCompiledExpression(expression, Parser.compileString(expression));
        } catch (JsltException e) {
            throw new ExpressionCompileException("Failed to compile JSLT expression: " + e.getMessage(), e, start);
        }
    }

    /** Thread-safe compiled JSLT expression handle. */
    private static final class JsltCompiledExpression implements CompiledExpression {

        private final String source;
        private final Expression jsltExpression;

        JsltCompiledExpression(String source, Expression jsltExpression) {
            this.source = source;
            this.jsltExpression = jsltExpression;
        }

        @Override
        public JsonNode evaluate(Scope scope, Position start) {
            try {
                JsonNode result = jsltExpression.apply(buildVariables(scope), scope.root());
                return result != null ? result : NullNode.getInstance();
            } catch (JsltException e) {
                throw new ExpressionEvalException("JSLT evaluation failed: " + e.getMessage(), e, start);
            }
        }

        private static Map<String, JsonNode> buildVariables(Scope scope) {
            Map<String, JsonNode> vars = new HashMap<>();
            for (Iterator<String> names = scope.names(); names.hasNext(); ) {
                String name = names.next();
                vars.put(name, scope.lookup(name));
            }
            return vars;
        }

        @Override
        public String toString() {
            return "jslt(" + source + ")";
        }
    }
}
