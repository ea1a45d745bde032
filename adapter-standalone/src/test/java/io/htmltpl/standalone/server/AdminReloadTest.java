package io.htmltpl.standalone.server;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * {@code POST /admin/reload} swaps in a rebuilt template set, or answers 500 and keeps the old
 * one.
 */
class AdminReloadTest extends ServerTestHarness {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path templatesDir;

    @AfterEach
    void tearDown() {
        stopServer();
    }

    @Test
    void reloadPicksUpNewTemplate() throws Exception {
        writeTemplate(templatesDir, "a.html", "A");
        startServer(templatesDir);
        assertEquals(404, get("/b").statusCode());

        writeTemplate(templatesDir, "b.html", "B");
        HttpResponse<String> response = post("/admin/reload", "");

        assertEquals(200, response.statusCode());
        assertEquals("application/json", contentType(response));
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("reloaded", body.get("status").asText());
        assertEquals(2, body.get("templates").asInt());
        assertEquals("B", get("/b").body());
    }

    @Test
    void failedReloadKeepsServingOldTemplates() throws Exception {
        writeTemplate(templatesDir, "page.html", "<p>v1</p>");
        startServer(templatesDir);

        writeTemplate(templatesDir, "page.html", "<p>${v2</p>");
        HttpResponse<String> response = post("/admin/reload", "");

        assertEquals(500, response.statusCode());
        assertTrue(contentType(response).startsWith(ProblemDetail.CONTENT_TYPE));
        JsonNode problem = MAPPER.readTree(response.body());
        assertEquals("urn:html-tpl:server:internal-error", problem.get("type").asText());
        assertTrue(problem.get("detail").asText().startsWith("Reload failed: Unterminated expression"));

        HttpResponse<String> page = get("/page");
        assertEquals(200, page.statusCode());
        assertEquals("<p>v1</p>", page.body());
    }

    @Test
    void customReloadPath() throws Exception {
        writeTemplate(templatesDir, "a.html", "A");
        startServer(templatesDir, b -> b.adminReloadPath("/ops/reload"));

        assertEquals(200, post("/ops/reload", "").statusCode());
    }
}
