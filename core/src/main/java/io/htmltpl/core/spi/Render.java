package io.htmltpl.core.spi;

import java.io.IOException;

/** One pending template render, bound to a template name and its data. */
public interface Render {

    /**
     * Writes the rendered body.
     *
     * @param sink the response
     * @throws IOException if the sink fails
     * @throws io.htmltpl.core.error.TemplateException if lookup or evaluation failed
     */
    void render(ResponseSink sink) throws IOException;

    /** Sets the response content type, unless one is already present. */
    void writeContentType(ResponseSink sink);
}
