package io.htmltpl.core.engine;

import io.htmltpl.core.spi.Template;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;

/** Static helpers around {@link Template}. */
public final class Renders {

    private Renders() {
        // utility class
    }

    /**
     * Renders {@code template} with {@code data} into a string.
     *
     * @throws io.htmltpl.core.error.TemplateRenderException if evaluation fails
     */
    public static String renderToString(Template template, Object data) {
        StringWriter out = new StringWriter();
        try {
            template.execute(out, data);
        } catch (IOException e) {
            // StringWriter does not fail; a custom Template might
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }
}
