package io.htmltpl.core.html;

import io.htmltpl.core.model.CodeToken;
import io.htmltpl.core.model.Position;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/** A top-level piece of scanned template source. Immutable. */
public sealed interface TemplateNode permits TemplateNode.Text, TemplateNode.Raw, TemplateNode.StartTag {

    /** Where this node begins in the template source. */
    Position start();

    /** Where a piece of text sits, which decides how placeholder results are escaped. */
    enum TextContext {
        HTML(HtmlEscaper::escape),
        SCRIPT(HtmlEscaper::escapeScript),
        STYLE(HtmlEscaper::escapeStyle);

        private final UnaryOperator<String> escaper;

        TextContext(UnaryOperator<String> escaper) {
            this.escaper = escaper;
        }

        public UnaryOperator<String> escaper() {
            return escaper;
        }
    }

    /**
     * Character data between tags, possibly with placeholders.
     *
     * @param source  the raw text
     * @param tokens  compiled tokens, empty when {@code source} has no placeholder
     * @param context element content the text belongs to
     * @param start   where the text begins
     */
    record Text(String source, List<CodeToken> tokens, TextContext context, Position start) implements TemplateNode {

        public Text {
            Objects.requireNonNull(source, "source");
            tokens = List.copyOf(tokens);
            Objects.requireNonNull(context, "context");
            Objects.requireNonNull(start, "start");
        }
    }

    /** Markup copied through verbatim: comments, end tags, declarations. */
    record Raw(String text, Position start) implements TemplateNode {

        public Raw {
            Objects.requireNonNull(text, "text");
            Objects.requireNonNull(start, "start");
        }
    }

    /**
     * A start tag with its compiled attributes.
     *
     * @param name        the tag name as written
     * @param attributes  attributes in source order
     * @param selfClosing whether the tag ends with {@code />}
     * @param start       position of the {@code <}
     * @param end         position just past the {@code >}
     */
    record StartTag(String name, List<Attribute> attributes, boolean selfClosing, Position start, Position end)
            implements TemplateNode {

        public StartTag {
            Objects.requireNonNull(name, "name");
            attributes = List.copyOf(attributes);
            Objects.requireNonNull(start, "start");
            Objects.requireNonNull(end, "end");
        }
    }
}
