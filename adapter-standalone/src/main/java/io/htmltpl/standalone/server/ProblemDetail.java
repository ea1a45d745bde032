package io.htmltpl.standalone.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builds RFC 9457 problem details for server errors.
 *
 * <pre>{@code
 * {
 *   "type": "urn:html-tpl:server:render-error",
 *   "title": "Render Error",
 *   "status": 500,
 *   "detail": "no binding for 'user' (at 3:15)",
 *   "instance": "/profile"
 * }
 * }</pre>
 */
public final class ProblemDetail {

    /** Media type of problem responses. */
    public static final String CONTENT_TYPE = "application/problem+json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String URN_TEMPLATE_NOT_FOUND = "urn:html-tpl:server:template-not-found";
    static final String URN_RENDER_ERROR = "urn:html-tpl:server:render-error";
    static final String URN_BAD_REQUEST = "urn:html-tpl:server:bad-request";
    static final String URN_INTERNAL_ERROR = "urn:html-tpl:server:internal-error";

    private ProblemDetail() {
        // utility class
    }

    public static JsonNode templateNotFound(String detail, String instancePath) {
        return build(URN_TEMPLATE_NOT_FOUND, "Template Not Found", 404, detail, instancePath);
    }

    /** A template failed to compile or evaluate while serving a request. */
    public static JsonNode renderError(String detail, String instancePath) {
        return build(URN_RENDER_ERROR, "Render Error", 500, detail, instancePath);
    }

    /** Malformed request data, such as a body that is not a JSON object. */
    public static JsonNode badRequest(String detail, String instancePath) {
        return build(URN_BAD_REQUEST, "Bad Request", 400, detail, instancePath);
    }

    /** Internal error for admin operations (reload failure). */
    public static JsonNode internalError(String detail, String instancePath) {
        return build(URN_INTERNAL_ERROR, "Internal Server Error", 500, detail, instancePath);
    }

    static JsonNode build(String type, String title, int status, String detail, String instancePath) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        node.put("title", title);
        node.put("status", status);
        node.put("detail", detail);
        if (instancePath != null) {
            node.put("instance", instancePath);
        } else {
            node.putNull("instance");
        }
        return node;
    }
}
