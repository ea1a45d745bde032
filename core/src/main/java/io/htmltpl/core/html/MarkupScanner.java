package io.htmltpl.core.html;

import io.htmltpl.core.error.ExpressionCompileException;
import io.htmltpl.core.model.Position;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Splits template source into text, verbatim markup and start tags.
 *
 * <p>This is a flat scan: it builds no element tree and does not check that tags nest or close.
 * Placeholders are recognized in text and in attribute values; comments, end tags and
 * declarations are passed through untouched. The bodies of {@code script} and {@code style}
 * elements are text up to the matching end tag, marked with their own {@link
 * TemplateNode.TextContext}.
 *
 * <p>Thread-safe: all scan state is local to {@link #scan(String)}.
 */
public final class MarkupScanner {

    private static final Map<String, TemplateNode.TextContext> RAW_TEXT_ELEMENTS =
            Map.of("script", TemplateNode.TextContext.SCRIPT, "style", TemplateNode.TextContext.STYLE);

    private final ValueTokenizer tokenizer;
    private final AttributeParser attributeParser;

    public MarkupScanner(ValueTokenizer tokenizer) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.attributeParser = new AttributeParser(tokenizer);
    }

    /**
     * Scans and compiles a whole template.
     *
     * @param source template source
     * @return nodes in source order
     * @throws ExpressionCompileException on unterminated markup or a placeholder that does not
     *     compile
     */
    public List<TemplateNode> scan(String source) {
        return new Scan(source).run();
    }

    private final class Scan {

        private final SourceCursor cursor;
        private final List<TemplateNode> nodes = new ArrayList<>();
        private int textFrom;
        private Position textStart;

        Scan(String source) {
            this.cursor = new SourceCursor(source, Position.START);
            this.textFrom = 0;
            this.textStart = Position.START;
        }

        List<TemplateNode> run() {
            while (!cursor.atEnd()) {
                if (cursor.skipPlaceholder()) {
                    continue;
                }
                if (cursor.peek() == '<' && scanMarkup()) {
                    continue;
                }
                cursor.next();
            }
            flushText(TemplateNode.TextContext.HTML);
            return Collections.unmodifiableList(nodes);
        }

        /** Returns {@code true} if a markup construct was consumed at the cursor. */
        private boolean scanMarkup() {
            char next = cursor.peek(1);
            if (cursor.startsWith("<!--")) {
                flushText(TemplateNode.TextContext.HTML);
                scanVerbatim("-->", "Unterminated comment: missing '-->'");
                return true;
            }
            if (next == '/' || next == '!' || next == '?') {
                flushText(TemplateNode.TextContext.HTML);
                scanVerbatim(">", "Unterminated markup: missing '>'");
                return true;
            }
            if (Character.isLetter(next)) {
                flushText(TemplateNode.TextContext.HTML);
                TemplateNode.StartTag tag = scanStartTag();
                nodes.add(tag);
                TemplateNode.TextContext rawText = RAW_TEXT_ELEMENTS.get(tag.name().toLowerCase(Locale.ROOT));
                if (!tag.selfClosing() && rawText != null) {
                    scanRawText(tag.name(), rawText);
                }
                markTextStart();
                return true;
            }
            return false;
        }

        private void scanVerbatim(String terminator, String error) {
            Position start = cursor.position();
            int end = cursor.indexOf(terminator);
            if (end < 0) {
                throw new ExpressionCompileException(error, start);
            }
            nodes.add(new TemplateNode.Raw(cursor.advanceTo(end + terminator.length()), start));
            markTextStart();
        }

        private TemplateNode.StartTag scanStartTag() {
            Position start = cursor.position();
            cursor.next();
            StringBuilder name = new StringBuilder();
            while (!cursor.atEnd() && isTagNameChar(cursor.peek())) {
                name.append(cursor.next());
            }
            List<Attribute> attributes = attributeParser.parseUntilTagEnd(cursor, name.toString(), start);
            boolean selfClosing = cursor.startsWith("/>");
            cursor.skip(selfClosing ? 2 : 1);
            return new TemplateNode.StartTag(name.toString(), attributes, selfClosing, start, cursor.position());
        }

        /** Reads a script/style body up to its end tag (or the end of input) as one text node. */
        private void scanRawText(String tagName, TemplateNode.TextContext context) {
            markTextStart();
            String endTag = "</" + tagName;
            String source = cursor.source();
            int end = cursor.index();
            while (end < source.length() && !source.regionMatches(true, end, endTag, 0, endTag.length())) {
                end++;
            }
            cursor.advanceTo(end);
            flushText(context);
        }

        private void flushText(TemplateNode.TextContext context) {
            if (cursor.index() > textFrom) {
                String text = cursor.source().substring(textFrom, cursor.index());
                nodes.add(new TemplateNode.Text(text, tokenizer.tokenize(text, textStart), context, textStart));
            }
            markTextStart();
        }

        private void markTextStart() {
            textFrom = cursor.index();
            textStart = cursor.position();
        }
    }

    private static boolean isTagNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '-' || c == ':' || c == '_';
    }
}
