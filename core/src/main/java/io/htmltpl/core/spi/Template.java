package io.htmltpl.core.spi;

import java.io.IOException;
import java.io.Writer;

/** A compiled template that can be executed any number of times, concurrently. */
public interface Template {

    /**
     * Renders this template with the given data.
     *
     * @param out  the sink the rendered text is written to
     * @param data render data; a {@code Map}, a bean, a JSON object node or a {@code Scope}
     * @throws IOException if writing to {@code out} fails
     * @throws io.htmltpl.core.error.TemplateRenderException if evaluation fails; nothing has been
     *     written to {@code out} in that case
     */
    void execute(Writer out, Object data) throws IOException;
}
