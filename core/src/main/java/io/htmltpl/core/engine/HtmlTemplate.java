package io.htmltpl.core.engine;

import io.htmltpl.core.error.ExpressionCompileException;
import io.htmltpl.core.html.Attribute;
import io.htmltpl.core.html.HtmlEscaper;
import io.htmltpl.core.html.MarkupScanner;
import io.htmltpl.core.html.TemplateNode;
import io.htmltpl.core.html.ValueEvaluator;
import io.htmltpl.core.html.ValueTokenizer;
import io.htmltpl.core.model.Scope;
import io.htmltpl.core.spi.ExpressionEngine;
import io.htmltpl.core.spi.Template;
import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A compiled HTML template.
 *
 * <p>Compiled once from source; every render walks the same immutable node list, so one
 * instance serves any number of concurrent renders. A render is assembled in memory and written
 * only once it has fully succeeded.
 *
 * <p>Placeholder output is escaped for where it lands. HTML text and attribute values get
 * character references; {@code script} and {@code style} bodies get JavaScript or CSS escapes.
 * Start tags are re-serialized: attributes are separated by one space and values are quoted.
 * Everything else is copied verbatim.
 */
public final class HtmlTemplate implements Template {

    private static final UnaryOperator<String> ESCAPE = HtmlEscaper::escape;

    private final String name;
    private final List<TemplateNode> nodes;

    private HtmlTemplate(String name, List<TemplateNode> nodes) {
        this.name = name;
        this.nodes = List.copyOf(nodes);
    }

    /**
     * Compiles {@code source} with placeholders in the given expression language.
     *
     * @param name   the template name, attached to compile errors
     * @param source template source
     * @param engine the placeholder expression engine
     * @return the compiled template
     * @throws ExpressionCompileException if the markup is malformed or a placeholder does not
     *     compile; {@link ExpressionCompileException#source()} is {@code name}
     */
    public static HtmlTemplate compile(String name, String source, ExpressionEngine engine) {
        return compile(name, source, new MarkupScanner(new ValueTokenizer(engine)));
    }

    /** Same as {@link #compile(String, String, ExpressionEngine)} with a shared scanner. */
    public static HtmlTemplate compile(String name, String source, MarkupScanner scanner) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(source, "source");
        try {
            return new HtmlTemplate(name, scanner.scan(source));
        } catch (ExpressionCompileException e) {
            throw e.source() != null ? e : e.withSource(name);
        }
    }

    public String name() {
        return name;
    }

    /** The scanned nodes in source order. */
    public List<TemplateNode> nodes() {
        return nodes;
    }

    @Override
    public void execute(Writer out, Object data) throws IOException {
        Scope scope = Scope.of(data);
        StringBuilder rendered = new StringBuilder();
        for (TemplateNode node : nodes) {
            renderNode(node, scope, rendered);
        }
        out.write(rendered.toString());
        out.flush();
    }

    private static void renderNode(TemplateNode node, Scope scope, StringBuilder out) {
        if (node instanceof TemplateNode.Text text) {
            if (text.tokens().isEmpty()) {
                out.append(text.source());
            } else {
                out.append(ValueEvaluator.evaluate(text.tokens(), scope, text.context().escaper()));
            }
        } else if (node instanceof TemplateNode.Raw raw) {
            out.append(raw.text());
        } else if (node instanceof TemplateNode.StartTag tag) {
            out.append('<').append(tag.name());
            for (Attribute attribute : tag.attributes()) {
                out.append(' ').append(attribute.name());
                if (attribute.hasValue()) {
                    appendQuoted(attribute.evaluate(scope, ESCAPE), out);
                }
            }
            out.append(tag.selfClosing() ? "/>" : ">");
        }
    }

    private static void appendQuoted(String value, StringBuilder out) {
        boolean hasDouble = value.indexOf('"') >= 0;
        if (!hasDouble) {
            out.append("=\"").append(value).append('"');
        } else if (value.indexOf('\'') < 0) {
            out.append("='").append(value).append('\'');
        } else {
            out.append("=\"").append(value.replace("\"", "&quot;")).append('"');
        }
    }

    /**
     * Writes the compiled structure without evaluating anything: text and markup as written, start
     * tags with their attributes in minimal form (see {@link Attribute#print(Writer)}).
     *
     * @param out the sink
     * @throws IOException if the sink fails
     */
    public void dump(Writer out) throws IOException {
        for (TemplateNode node : nodes) {
            if (node instanceof TemplateNode.Text text) {
                out.write(text.source());
            } else if (node instanceof TemplateNode.Raw raw) {
                out.write(raw.text());
            } else if (node instanceof TemplateNode.StartTag tag) {
                out.write("<" + tag.name());
                for (Attribute attribute : tag.attributes()) {
                    attribute.print(out);
                }
                out.write(tag.selfClosing() ? "/>" : ">");
            }
        }
    }

    @Override
    public String toString() {
        return "HtmlTemplate[" + name + ", nodes=" + nodes.size() + "]";
    }
}
