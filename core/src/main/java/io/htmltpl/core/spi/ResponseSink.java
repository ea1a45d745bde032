package io.htmltpl.core.spi;

import java.io.IOException;
import java.io.OutputStream;

/**
 * The writable side of an HTTP response, as seen by a {@link Render}. Each HTTP integration
 * provides its own implementation (the standalone server wraps a Javalin {@code Context}).
 */
public interface ResponseSink {

    /**
     * @param name header name, case-insensitive
     * @return the header value already set on the response, or {@code null}
     */
    String header(String name);

    /** Sets a response header, replacing any previous value. */
    void header(String name, String value);

    /** Returns the response body stream. */
    OutputStream body() throws IOException;
}
