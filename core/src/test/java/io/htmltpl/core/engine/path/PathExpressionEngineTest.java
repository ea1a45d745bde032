package io.htmltpl.core.engine.path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.htmltpl.core.error.ExpressionCompileException;
import io.htmltpl.core.error.ExpressionEvalException;
import io.htmltpl.core.model.Position;
import io.htmltpl.core.model.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PathExpressionEngineTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Position AT = new Position(5, 1, 6);

    private final PathExpressionEngine engine = new PathExpressionEngine();
    private Scope scope;

    @BeforeEach
    void setUp() throws Exception {
        scope = Scope.of(MAPPER.readTree("""
                {
                  "user": {"name": "Ann", "tags": ["x", "y"], "address": null},
                  "items": [{"label": "first"}, {"label": "second"}],
                  "count": 3,
                  "nothing": null,
                  "map": {"0": "zero"}
                }
                """));
    }

    private JsonNode eval(String expression) {
        return engine.compile(expression, AT).evaluate(scope, AT);
    }

    @Test
    void idIsPath() {
        assertThat(engine.id()).isEqualTo("path");
    }

    @Nested
    @DisplayName("Evaluation")
    class Evaluation {

        @Test
        void topLevelName() {
            assertThat(eval("count").asInt()).isEqualTo(3);
        }

        @Test
        void dottedPath() {
            assertThat(eval("user.name").asText()).isEqualTo("Ann");
        }

        @Test
        void bracketIndex() {
            assertThat(eval("items[1].label").asText()).isEqualTo("second");
            assertThat(eval("user.tags[0]").asText()).isEqualTo("x");
        }

        @Test
        void dottedIndex() {
            assertThat(eval("items.0.label").asText()).isEqualTo("first");
        }

        @Test
        void numericSegmentOnObjectIsAFieldName() {
            assertThat(eval("map.0").asText()).isEqualTo("zero");
        }

        @Test
        void surroundingWhitespaceIgnored() {
            assertThat(eval("  user.name \t").asText()).isEqualTo("Ann");
        }

        @Test
        void boundNullIsAValue() {
            assertThat(eval("nothing").isNull()).isTrue();
            assertThat(eval("user.address").isNull()).isTrue();
        }

        @Test
        void objectValueIsReturnedWhole() {
            assertThat(eval("user").get("name").asText()).isEqualTo("Ann");
        }
    }

    @Nested
    @DisplayName("Evaluation errors")
    class EvaluationErrors {

        @Test
        void missingTopLevelBinding() {
            assertThatThrownBy(() -> eval("missing"))
                    .isInstanceOf(ExpressionEvalException.class)
                    .hasMessage("no binding for 'missing' (at 1:6)");
        }

        @Test
        void missingField() {
            assertThatThrownBy(() -> eval("user.email"))
                    .isInstanceOf(ExpressionEvalException.class)
                    .hasMessageContaining("no binding for 'user.email'");
        }

        @Test
        void indexOutOfBounds() {
            assertThatThrownBy(() -> eval("user.tags[5]"))
                    .isInstanceOf(ExpressionEvalException.class)
                    .hasMessageContaining("index 5 out of bounds for 'user.tags' (size 2)");
        }

        @Test
        void fieldOfScalar() {
            assertThatThrownBy(() -> eval("user.name.first"))
                    .isInstanceOf(ExpressionEvalException.class)
                    .hasMessageContaining("cannot read field 'first' of string 'user.name'");
        }

        @Test
        void indexOfObject() {
            assertThatThrownBy(() -> eval("user[0]"))
                    .isInstanceOf(ExpressionEvalException.class)
                    .hasMessageContaining("cannot index object 'user' with [0]");
        }

        @Test
        void errorIsAnchoredAtEvaluationStart() {
            Position elsewhere = new Position(40, 3, 2);
            assertThatThrownBy(() -> engine.compile("missing", AT).evaluate(scope, elsewhere))
                    .isInstanceOf(ExpressionEvalException.class)
                    .extracting(e -> ((ExpressionEvalException) e).position())
                    .isEqualTo(elsewhere);
        }
    }

    @Nested
    @DisplayName("Compile errors")
    class CompileErrors {

        @Test
        void emptyExpression() {
            assertThatThrownBy(() -> engine.compile("", AT))
                    .isInstanceOf(ExpressionCompileException.class)
                    .hasMessage("Empty expression (at 1:6)");
            assertThatThrownBy(() -> engine.compile("   ", AT)).isInstanceOf(ExpressionCompileException.class);
        }

        @Test
        void doubleDotIsAnchoredAtOffendingCharacter() {
            assertThatThrownBy(() -> engine.compile("a..b", AT))
                    .isInstanceOf(ExpressionCompileException.class)
                    .hasMessageContaining("Expected a name but found '.'")
                    .extracting(e -> ((ExpressionCompileException) e).position())
                    .isEqualTo(new Position(7, 1, 8));
        }

        @Test
        void trailingDot() {
            assertThatThrownBy(() -> engine.compile("a.", AT))
                    .isInstanceOf(ExpressionCompileException.class)
                    .hasMessageContaining("Expected a name after '.'");
        }

        @Test
        void nonNumericIndex() {
            assertThatThrownBy(() -> engine.compile("items[x]", AT))
                    .isInstanceOf(ExpressionCompileException.class)
                    .hasMessageContaining("Expected an index but found 'x'");
        }

        @Test
        void unclosedIndex() {
            assertThatThrownBy(() -> engine.compile("items[0", AT))
                    .isInstanceOf(ExpressionCompileException.class)
                    .hasMessageContaining("Expected ']' but found end of expression");
        }

        @Test
        void innerWhitespace() {
            assertThatThrownBy(() -> engine.compile("a b", AT))
                    .isInstanceOf(ExpressionCompileException.class)
                    .hasMessageContaining("Expected '.' or '['")
                    .extracting(e -> ((ExpressionCompileException) e).position())
                    .isEqualTo(new Position(6, 1, 7));
        }

        @Test
        void leadingBracket() {
            assertThatThrownBy(() -> engine.compile("[0]", AT))
                    .isInstanceOf(ExpressionCompileException.class)
                    .hasMessageContaining("Expected a name");
        }
    }
}
