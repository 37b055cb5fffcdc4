package org.dxworks.docframe.tokenizer;

import org.commonmark.ext.front.matter.YamlFrontMatterBlock;
import org.commonmark.ext.front.matter.YamlFrontMatterExtension;
import org.commonmark.ext.front.matter.YamlFrontMatterNode;
import org.commonmark.ext.gfm.tables.TableBlock;
import org.commonmark.ext.gfm.tables.TableBody;
import org.commonmark.ext.gfm.tables.TableCell;
import org.commonmark.ext.gfm.tables.TableHead;
import org.commonmark.ext.gfm.tables.TableRow;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.ext.task.list.items.TaskListItemMarker;
import org.commonmark.ext.task.list.items.TaskListItemsExtension;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.BulletList;
import org.commonmark.node.Code;
import org.commonmark.node.CustomBlock;
import org.commonmark.node.CustomNode;
import org.commonmark.node.Emphasis;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Heading;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.HtmlInline;
import org.commonmark.node.Image;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Link;
import org.commonmark.node.LinkReferenceDefinition;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.SourceSpan;
import org.commonmark.node.StrongEmphasis;
import org.commonmark.node.Text;
import org.commonmark.node.ThematicBreak;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;
import org.dxworks.docframe.token.Container;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;
import org.dxworks.docframe.token.TokenSequenceBuilder;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Flattens a commonmark document into the open/close/leaf token sequence the warehouse indexes.
 * The parser is immutable, so one instance can be shared across threads.
 */
public class CommonmarkTokenizer {

    private final Parser parser;

    public CommonmarkTokenizer() {
        this.parser = Parser.builder()
                .extensions(List.of(
                        TablesExtension.create(),
                        YamlFrontMatterExtension.create(),
                        TaskListItemsExtension.create()
                ))
                .includeSourceSpans(IncludeSourceSpans.BLOCKS_AND_INLINES)
                .build();
    }

    public List<Token> tokenize(String markdown) {
        String source = markdown == null ? "" : markdown;
        // Remove BOM if present
        if (source.startsWith("\uFEFF")) {
            source = source.substring(1);
        }
        Node document = parser.parse(source);
        FlatteningVisitor visitor = new FlatteningVisitor();
        for (Node child = document.getFirstChild(); child != null; child = child.getNext()) {
            child.accept(visitor);
        }
        return visitor.out.build();
    }

    private static class FlatteningVisitor extends AbstractVisitor {
        private final TokenSequenceBuilder out = new TokenSequenceBuilder();

        @Override
        public void visit(Heading heading) {
            Map<String, Object> attrs = new HashMap<>();
            attrs.put("level", heading.getLevel());
            container(heading, Container.HEADING, attrs);
        }

        @Override
        public void visit(Paragraph paragraph) {
            container(paragraph, Container.PARAGRAPH, null);
        }

        @Override
        public void visit(BlockQuote blockQuote) {
            container(blockQuote, Container.BLOCKQUOTE, null);
        }

        @Override
        public void visit(BulletList bulletList) {
            container(bulletList, Container.BULLET_LIST, null);
        }

        @Override
        public void visit(OrderedList orderedList) {
            Map<String, Object> attrs = new HashMap<>();
            attrs.put("start", orderedList.getStartNumber());
            container(orderedList, Container.ORDERED_LIST, attrs);
        }

        @Override
        public void visit(ListItem listItem) {
            container(listItem, Container.LIST_ITEM, null);
        }

        @Override
        public void visit(FencedCodeBlock codeBlock) {
            Map<String, Object> attrs = new HashMap<>();
            attrs.put("info", codeBlock.getInfo() == null ? "" : codeBlock.getInfo());
            raw(codeBlock, Container.FENCE, codeBlock.getLiteral(), attrs);
        }

        @Override
        public void visit(IndentedCodeBlock codeBlock) {
            raw(codeBlock, Container.CODE_BLOCK, codeBlock.getLiteral(), null);
        }

        @Override
        public void visit(HtmlBlock htmlBlock) {
            raw(htmlBlock, Container.HTML_BLOCK, htmlBlock.getLiteral(), null);
        }

        @Override
        public void visit(Code code) {
            raw(code, Container.CODE_INLINE, code.getLiteral(), null);
        }

        @Override
        public void visit(ThematicBreak thematicBreak) {
            int[] lines = lineRange(thematicBreak);
            out.leaf(TokenKind.HR, null, line(lines, 0), line(lines, 1), null);
        }

        @Override
        public void visit(Text text) {
            int[] lines = lineRange(text);
            out.leaf(TokenKind.TEXT, text.getLiteral(), line(lines, 0), line(lines, 1), null);
        }

        @Override
        public void visit(SoftLineBreak softLineBreak) {
            out.leaf(TokenKind.SOFTBREAK, "\n", null, null, null);
        }

        @Override
        public void visit(HardLineBreak hardLineBreak) {
            out.leaf(TokenKind.HARDBREAK, "\n", null, null, null);
        }

        @Override
        public void visit(HtmlInline htmlInline) {
            int[] lines = lineRange(htmlInline);
            out.leaf(TokenKind.HTML_INLINE, htmlInline.getLiteral(), line(lines, 0), line(lines, 1), null);
        }

        @Override
        public void visit(Emphasis emphasis) {
            container(emphasis, Container.EM, null);
        }

        @Override
        public void visit(StrongEmphasis strongEmphasis) {
            container(strongEmphasis, Container.STRONG, null);
        }

        @Override
        public void visit(Link link) {
            Map<String, Object> attrs = new HashMap<>();
            attrs.put("href", link.getDestination());
            attrs.put("title", link.getTitle());
            container(link, Container.LINK, attrs);
        }

        @Override
        public void visit(Image image) {
            Map<String, Object> attrs = new HashMap<>();
            attrs.put("src", image.getDestination());
            attrs.put("title", image.getTitle());
            container(image, Container.IMAGE, attrs);
        }

        @Override
        public void visit(LinkReferenceDefinition definition) {
            // Definitions are resolved into links by the parser and leave no trace in the output.
        }

        @Override
        public void visit(CustomBlock customBlock) {
            if (customBlock instanceof YamlFrontMatterBlock) {
                container(customBlock, Container.FRONTMATTER, null);
            } else if (customBlock instanceof TableBlock) {
                container(customBlock, Container.TABLE, null);
            } else {
                super.visit(customBlock);
            }
        }

        @Override
        public void visit(CustomNode customNode) {
            if (customNode instanceof YamlFrontMatterNode entry) {
                Map<String, Object> attrs = new HashMap<>();
                attrs.put("key", entry.getKey());
                attrs.put("values", List.copyOf(entry.getValues()));
                out.leaf(TokenKind.FRONTMATTER_ENTRY, null, null, null, attrs);
            } else if (customNode instanceof TaskListItemMarker marker) {
                Map<String, Object> attrs = new HashMap<>();
                attrs.put("checked", marker.isChecked());
                out.leaf(TokenKind.TASK_MARKER, null, null, null, attrs);
            } else if (customNode instanceof TableHead) {
                container(customNode, Container.THEAD, null);
            } else if (customNode instanceof TableBody) {
                container(customNode, Container.TBODY, null);
            } else if (customNode instanceof TableRow) {
                container(customNode, Container.TR, null);
            } else if (customNode instanceof TableCell cell) {
                Map<String, Object> attrs = new HashMap<>();
                if (cell.getAlignment() != null) {
                    attrs.put("align", cell.getAlignment().name().toLowerCase(Locale.ROOT));
                }
                container(customNode, cell.isHeader() ? Container.TH : Container.TD, attrs);
            } else {
                super.visit(customNode);
            }
        }

        private void container(Node node, Container container, Map<String, Object> attrs) {
            int[] lines = lineRange(node);
            out.open(container, line(lines, 0), line(lines, 1), attrs);
            visitChildren(node);
            out.close(container);
        }

        private void raw(Node node, Container container, String literal, Map<String, Object> attrs) {
            int[] lines = lineRange(node);
            out.open(container, line(lines, 0), line(lines, 1), attrs);
            out.leaf(TokenKind.TEXT, literal == null ? "" : literal, line(lines, 0), line(lines, 1), null);
            out.close(container);
        }

        private static Integer line(int[] lines, int which) {
            return lines == null ? null : lines[which];
        }

        private static int[] lineRange(Node node) {
            if (node == null || node.getSourceSpans() == null || node.getSourceSpans().isEmpty()) {
                return null;
            }

            int minLine = Integer.MAX_VALUE;
            int maxLine = Integer.MIN_VALUE;

            for (SourceSpan span : node.getSourceSpans()) {
                int line = span.getLineIndex();
                minLine = Math.min(minLine, line);
                maxLine = Math.max(maxLine, line);
            }

            return new int[]{minLine, maxLine};
        }
    }
}
