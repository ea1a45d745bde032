package io.htmltpl.standalone.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RenderHandlerTest {

    @Nested
    class TemplateName {

        @Test
        void appendsSuffix() {
            assertThat(RenderHandler.templateName("/users/list", ".html")).isEqualTo("users/list.html");
        }

        @Test
        void keepsExistingSuffix() {
            assertThat(RenderHandler.templateName("/users/list.html", ".html")).isEqualTo("users/list.html");
        }

        @Test
        void rootIsIndex() {
            assertThat(RenderHandler.templateName("/", ".html")).isEqualTo("index.html");
        }

        @Test
        void trailingSlashIsDirectoryIndex() {
            assertThat(RenderHandler.templateName("/users/", ".tpl")).isEqualTo("users/index.tpl");
        }
    }

    @Nested
    class QueryData {

        @Test
        void singleValuesAreStringsRepeatedAreLists() {
            Map<String, List<String>> params = new LinkedHashMap<>();
            params.put("name", List.of("Ann"));
            params.put("tag", List.of("a", "b"));

            Map<String, Object> data = RenderHandler.queryData(params);

            assertThat(data).containsEntry("name", "Ann").containsEntry("tag", List.of("a", "b"));
        }
    }

    @Nested
    class BodyData {

        @Test
        void blankBodyIsEmptyObject() {
            JsonNode data = RenderHandler.bodyData("  ");

            assertThat(data.isObject()).isTrue();
            assertThat(data.size()).isZero();
        }

        @Test
        void objectBody() {
            assertThat(RenderHandler.bodyData("{\"a\": 1}").get("a").asInt()).isEqualTo(1);
        }

        @Test
        void arrayIsRejected() {
            assertThatThrownBy(() -> RenderHandler.bodyData("[1]"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Request body must be a JSON object, got ARRAY");
        }

        @Test
        void malformedIsRejected() {
            assertThatThrownBy(() -> RenderHandler.bodyData("{oops"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageStartingWith("Request body is not valid JSON");
        }
    }
}
