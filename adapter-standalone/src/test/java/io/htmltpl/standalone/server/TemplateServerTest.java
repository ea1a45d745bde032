package io.htmltpl.standalone.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.htmltpl.core.error.ExpressionCompileException;
import io.htmltpl.core.error.TemplateSourceException;
import io.htmltpl.standalone.config.ConfigLoadException;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("Template server over HTTP")
class TemplateServerTest extends ServerTestHarness {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path templatesDir;

    @BeforeEach
    void writeTemplates() throws Exception {
        writeTemplate(templatesDir, "index.html", "<h1>${title}</h1>");
        writeTemplate(templatesDir, "hello.html", "<p>Hello, ${name}!</p>");
        writeTemplate(templatesDir, "users/card.html", "<div class=\"card\" data-id=\"${user.id}\">${user.name}</div>");
        writeTemplate(templatesDir, "tags.html", "<p>${tag}</p>");
    }

    @AfterEach
    void tearDown() {
        stopServer();
    }

    @Nested
    @DisplayName("GET")
    class Get {

        @BeforeEach
        void start() throws Exception {
            startServer(templatesDir);
        }

        @Test
        void queryParametersAreData() throws Exception {
            HttpResponse<String> response = get("/hello?name=Ann%20%3CA%3E");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).isEqualTo("<p>Hello, Ann &lt;A&gt;!</p>");
            assertThat(contentType(response)).startsWith("text/html");
        }

        @Test
        void suffixMayBeGiven() throws Exception {
            assertThat(get("/hello.html?name=Bo").body()).isEqualTo("<p>Hello, Bo!</p>");
        }

        @Test
        void rootRendersIndex() throws Exception {
            HttpResponse<String> response = get("/?title=Home");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).isEqualTo("<h1>Home</h1>");
        }

        @Test
        void repeatedParameterIsList() throws Exception {
            assertThat(get("/tags?tag=a&tag=b").body()).isEqualTo("<p>[&quot;a&quot;,&quot;b&quot;]</p>");
        }

        @Test
        void unknownTemplateIs404Problem() throws Exception {
            HttpResponse<String> response = get("/nope");

            assertThat(response.statusCode()).isEqualTo(404);
            assertThat(contentType(response)).startsWith(ProblemDetail.CONTENT_TYPE);
            JsonNode problem = MAPPER.readTree(response.body());
            assertThat(problem.get("type").asText()).isEqualTo("urn:html-tpl:server:template-not-found");
            assertThat(problem.get("status").asInt()).isEqualTo(404);
            assertThat(problem.get("detail").asText()).contains("nope.html");
            assertThat(problem.get("instance").asText()).isEqualTo("/nope");
        }

        @Test
        void missingBindingIs500Problem() throws Exception {
            HttpResponse<String> response = get("/hello");

            assertThat(response.statusCode()).isEqualTo(500);
            JsonNode problem = MAPPER.readTree(response.body());
            assertThat(problem.get("type").asText()).isEqualTo("urn:html-tpl:server:render-error");
            assertThat(problem.get("detail").asText()).contains("no binding for 'name'");
        }

        @Test
        void healthEndpoint() throws Exception {
            HttpResponse<String> response = get("/health");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(MAPPER.readTree(response.body()).get("status").asText()).isEqualTo("UP");
        }
    }

    @Nested
    @DisplayName("POST")
    class Post {

        @BeforeEach
        void start() throws Exception {
            startServer(templatesDir);
        }

        @Test
        void jsonBodyIsData() throws Exception {
            HttpResponse<String> response = post("/users/card", "{\"user\": {\"id\": 42, \"name\": \"Eve\"}}");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).isEqualTo("<div class=\"card\" data-id=\"42\">Eve</div>");
        }

        @Test
        void nonObjectBodyIs400() throws Exception {
            HttpResponse<String> response = post("/hello", "[1, 2]");

            assertThat(response.statusCode()).isEqualTo(400);
            JsonNode problem = MAPPER.readTree(response.body());
            assertThat(problem.get("type").asText()).isEqualTo("urn:html-tpl:server:bad-request");
            assertThat(problem.get("detail").asText()).contains("JSON object");
        }

        @Test
        void invalidJsonIs400() throws Exception {
            assertThat(post("/hello", "{name").statusCode()).isEqualTo(400);
        }
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        void healthCanBeDisabled() throws Exception {
            startServer(templatesDir, b -> b.healthEnabled(false));

            // falls through to the template route
            assertThat(get("/health").statusCode()).isEqualTo(404);
        }

        @Test
        void customHealthPath() throws Exception {
            startServer(templatesDir, b -> b.healthPath("/healthz"));

            assertThat(get("/healthz").statusCode()).isEqualTo(200);
        }

        @Test
        void jsltEngine() throws Exception {
            writeTemplate(templatesDir, "sum.html", "<p>${.a + .b}</p>");
            startServer(templatesDir, b -> b.templatesEngine("jslt"));

            assertThat(post("/sum", "{\"a\": 2, \"b\": 3}").body()).isEqualTo("<p>5</p>");
        }

        @Test
        void unknownEngineFailsStartup() {
            assertThatThrownBy(() -> startServer(templatesDir, b -> b.templatesEngine("mustache")))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("templates.engine: No expression engine registered for id: 'mustache'");
        }

        @Test
        void brokenTemplateFailsStartup() throws Exception {
            writeTemplate(templatesDir, "broken.html", "<p>${oops</p>");

            assertThatThrownBy(() -> startServer(templatesDir))
                    .isInstanceOf(ExpressionCompileException.class)
                    .satisfies(e -> assertThat(((ExpressionCompileException) e).source()).isEqualTo("broken.html"));
        }

        @Test
        void missingDirectoryFailsStartup() {
            assertThatThrownBy(() -> startServer(templatesDir.resolve("absent")))
                    .isInstanceOf(TemplateSourceException.class);
        }
    }
}
