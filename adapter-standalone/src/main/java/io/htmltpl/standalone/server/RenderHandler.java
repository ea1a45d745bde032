package io.htmltpl.standalone.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.htmltpl.core.error.TemplateException;
import io.htmltpl.core.error.TemplateNotFoundException;
import io.htmltpl.core.spi.HtmlRender;
import io.htmltpl.core.spi.Render;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.javalin.http.HandlerType;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves {@code GET|POST /<path>} by rendering the template named by the path.
 *
 * <p>The template name is the request path without its leading slash, with the template suffix
 * appended when missing; {@code /} maps to {@code index}. GET renders with the query parameters
 * as data (a repeated parameter becomes a list). POST renders with the request body, which must
 * be a JSON object; an empty body means no data.
 *
 * <p>Unknown templates answer 404, render failures 500 and a bad body 400, all as RFC 9457
 * problem details.
 */
public final class RenderHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(RenderHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HtmlRender render;
    private final String suffix;

    public RenderHandler(HtmlRender render, String suffix) {
        this.render = render;
        this.suffix = suffix;
    }

    @Override
    public void handle(Context ctx) throws Exception {
        String name = templateName(ctx.path(), suffix);

        Object data;
        if (ctx.method() == HandlerType.POST) {
            try {
                data = bodyData(ctx.body());
            } catch (IllegalArgumentException e) {
                LOG.debug("Rejected request body for {}: {}", name, e.getMessage());
                problem(ctx, ProblemDetail.badRequest(e.getMessage(), ctx.path()), 400);
                return;
            }
        } else {
            data = queryData(ctx.queryParamMap());
        }

        BufferedResponseSink sink = new BufferedResponseSink();
        Render pending = render.instance(name, data);
        try {
            pending.render(sink);
        } catch (TemplateNotFoundException e) {
            LOG.debug("Template not found: {}", name);
            problem(ctx, ProblemDetail.templateNotFound(e.getMessage(), ctx.path()), 404);
            return;
        } catch (TemplateException e) {
            LOG.warn("Render failed: template={}, phase={}, error={}", name, e.phase(), e.getMessage());
            problem(ctx, ProblemDetail.renderError(e.getMessage(), ctx.path()), 500);
            return;
        }

        ctx.status(200);
        sink.headers().forEach(ctx::header);
        ctx.result(sink.bytes());
        LOG.debug("Rendered template: name={}, bytes={}", name, sink.bytes().length);
    }

    /** Maps a request path to a template name. */
    static String templateName(String path, String suffix) {
        String name = path.startsWith("/") ? path.substring(1) : path;
        if (name.isEmpty() || name.endsWith("/")) {
            name = name + "index";
        }
        return name.endsWith(suffix) ? name : name + suffix;
    }

    static Map<String, Object> queryData(Map<String, List<String>> params) {
        Map<String, Object> data = new LinkedHashMap<>();
        params.forEach((key, values) -> {
            if (values.size() == 1) {
                data.put(key, values.get(0));
            } else {
                data.put(key, List.copyOf(values));
            }
        });
        return data;
    }

    /**
     * Parses a request body into render data.
     *
     * @throws IllegalArgumentException if the body is not a JSON object
     */
    static JsonNode bodyData(String body) {
        if (body == null || body.isBlank()) {
            return MAPPER.createObjectNode();
        }
        JsonNode node;
        try {
            node = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request body is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("Request body must be a JSON object, got " + node.getNodeType());
        }
        return node;
    }

    private static void problem(Context ctx, JsonNode problem, int status) {
        ctx.status(status);
        ctx.contentType(ProblemDetail.CONTENT_TYPE);
        ctx.result(problem.toString());
    }
}
