package io.htmltpl.standalone.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.htmltpl.core.engine.HtmlRenderer;
import io.htmltpl.core.engine.TemplateSet;
import io.htmltpl.core.spi.TemplateManager;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code POST /admin/reload}: rebuilds the template set and swaps it in.
 *
 * <pre>
 * 200 OK
 * {"status": "reloaded", "templates": N}
 * </pre>
 *
 * <p>On failure the previous templates stay active and the response is a 500 problem detail
 * naming the broken template and position.
 */
public final class AdminReloadHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(AdminReloadHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HtmlRenderer renderer;

    public AdminReloadHandler(HtmlRenderer renderer) {
        this.renderer = renderer;
    }

    @Override
    public void handle(Context ctx) {
        LOG.info("Admin reload triggered via POST {}", ctx.path());

        try {
            renderer.reload();
            int count = templateCount(renderer.currentManager());

            ObjectNode response = MAPPER.createObjectNode();
            response.put("status", "reloaded");
            response.put("templates", count);

            ctx.status(200);
            ctx.contentType("application/json");
            ctx.result(response.toString());

            LOG.info("Reload successful: templates={}", count);
        } catch (RuntimeException e) {
            LOG.error("Reload failed: {}", e.getMessage(), e);

            JsonNode problem = ProblemDetail.internalError("Reload failed: " + e.getMessage(), ctx.path());
            ctx.status(500);
            ctx.contentType(ProblemDetail.CONTENT_TYPE);
            ctx.result(problem.toString());
        }
    }

    static int templateCount(TemplateManager manager) {
        return manager instanceof TemplateSet set ? set.size() : -1;
    }
}
