package io.htmltpl.core.engine.jslt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.htmltpl.core.error.ExpressionCompileException;
import io.htmltpl.core.error.ExpressionEvalException;
import io.htmltpl.core.html.Attribute;
import io.htmltpl.core.html.AttributeParser;
import io.htmltpl.core.html.ValueTokenizer;
import io.htmltpl.core.model.Position;
import io.htmltpl.core.model.Scope;
import io.htmltpl.core.spi.CompiledExpression;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsltExpressionEngineTest {

    private static final Position AT = new Position(2, 1, 3);

    private final JsltExpressionEngine engine = new JsltExpressionEngine();
    private final Scope scope = Scope.of(Map.of("user", Map.of("name", "Ann", "age", 41), "n", 2));

    @Test
    void idIsJslt() {
        assertThat(engine.id()).isEqualTo("jslt");
    }

    @Test
    void readsScopeAsInput() {
        JsonNode result = engine.compile(".user.name", AT).evaluate(scope, AT);
        assertThat(result.asText()).isEqualTo("Ann");
    }

    @Test
    void bindingsAreVariables() {
        JsonNode result = engine.compile("$user.age + $n", AT).evaluate(scope, AT);
        assertThat(result.asInt()).isEqualTo(43);
    }

    @Test
    void computesExpressions() {
        JsonNode result = engine.compile("if (.n > 1) \"many\" else \"one\"", AT).evaluate(scope, AT);
        assertThat(result.asText()).isEqualTo("many");
    }

    @Test
    void missingFieldIsNull() {
        JsonNode result = engine.compile(".nope", AT).evaluate(scope, AT);
        assertThat(result.isNull()).isTrue();
    }

    @Test
    void missingFieldRendersAsNullText() {
        Attribute attribute = Attribute.builder()
                .name("title", Position.START, new Position(5, 1, 6))
                .value("${.nope}", new Position(7, 1, 8), new Position(15, 1, 16), new ValueTokenizer(engine))
                .build();

        assertThat(attribute.evaluate(scope)).isEqualTo("null");
    }

    @Test
    void syntaxErrorIsCompileError() {
        assertThatThrownBy(() -> engine.compile(".a +", AT))
                .isInstanceOf(ExpressionCompileException.class)
                .hasMessageStartingWith("Failed to compile JSLT expression")
                .extracting(e -> ((ExpressionCompileException) e).position())
                .isEqualTo(AT);
    }

    @Test
    void emptyExpressionIsCompileError() {
        assertThatThrownBy(() -> engine.compile(" ", AT))
                .isInstanceOf(ExpressionCompileException.class)
                .hasMessageContaining("Empty expression");
    }

    @Test
    void runtimeFailureIsEvalError() {
        CompiledExpression expression = engine.compile("error(\"boom\")", AT);

        assertThatThrownBy(() -> expression.evaluate(scope, AT))
                .isInstanceOf(ExpressionEvalException.class)
                .hasMessageContaining("boom");
    }

    @Test
    void worksBehindTheTokenizer() {
        List<Attribute> attributes = new AttributeParser(new ValueTokenizer(engine))
                .parse("title=\"${.user.name} (${$user.age})\"", Position.START);

        assertThat(attributes.get(0).evaluate(scope)).isEqualTo("Ann (41)");
    }
}
