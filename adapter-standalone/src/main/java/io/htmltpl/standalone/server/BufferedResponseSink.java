package io.htmltpl.standalone.server;

import io.htmltpl.core.spi.ResponseSink;
import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A {@link ResponseSink} that collects headers and body in memory; {@link RenderHandler} copies
 * them onto the Javalin response once the render has succeeded.
 *
 * <p>Only headers set through this sink are visible to {@link #header(String)}; container
 * defaults are not, so a render always gets to choose its content type.
 */
final class BufferedResponseSink implements ResponseSink {

    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final ByteArrayOutputStream body = new ByteArrayOutputStream();

    @Override
    public String header(String name) {
        return headers.get(name);
    }

    @Override
    public void header(String name, String value) {
        headers.put(name, value);
    }

    @Override
    public OutputStream body() {
        return body;
    }

    Map<String, String> headers() {
        return Collections.unmodifiableMap(headers);
    }

    byte[] bytes() {
        return body.toByteArray();
    }
}
