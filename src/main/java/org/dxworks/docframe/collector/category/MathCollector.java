package org.dxworks.docframe.collector.category;

import org.dxworks.docframe.collector.Collector;
import org.dxworks.docframe.model.Categories;
import org.dxworks.docframe.model.MathResult;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;
import org.dxworks.docframe.warehouse.Warehouse;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Math from {@code math} fences, {@code $$...$$} paragraphs and {@code $...$} spans in plain text.
 * Text inside code and HTML never yields inline math.
 */
public class MathCollector implements Collector {

    public static final Pattern INLINE_MATH = Pattern.compile("(?<!\\$)\\$([^$\\n]+?)\\$(?!\\$)");
    private static final String DISPLAY_DELIMITER = "$$";

    private final MathResult math = new MathResult();

    @Override
    public String name() {
        return Categories.MATH;
    }

    @Override
    public Set<TokenKind> interest() {
        return Set.of(TokenKind.FENCE_OPEN, TokenKind.PARAGRAPH_OPEN, TokenKind.TEXT);
    }

    @Override
    public boolean shouldProcess(Token token, Warehouse warehouse) {
        return !warehouse.isIgnored(token.getIndex());
    }

    @Override
    public void onToken(Token token, Warehouse warehouse) {
        switch (token.getKind()) {
            case FENCE_OPEN -> {
                if (isMathFence(token.attrString("info"))) {
                    addBlock("fenced", warehouse.textOf(token.getIndex()).strip(), token);
                }
            }
            case PARAGRAPH_OPEN -> {
                String display = displayContent(warehouse.textOf(token.getIndex()));
                if (display != null) {
                    addBlock("display", display, token);
                }
            }
            case TEXT -> {
                if (token.getContent() == null) {
                    return;
                }
                Matcher matcher = INLINE_MATH.matcher(token.getContent());
                while (matcher.find()) {
                    MathResult.Inline inline = new MathResult.Inline();
                    inline.id = "math_inline_" + math.inline.size();
                    inline.content = matcher.group(1);
                    inline.line = token.getLine();
                    math.inline.add(inline);
                }
            }
            default -> {
            }
        }
    }

    private void addBlock(String kind, String content, Token token) {
        MathResult.Block block = new MathResult.Block();
        block.id = "math_block_" + math.blocks.size();
        block.kind = kind;
        block.content = content;
        block.startLine = token.getLine();
        block.endLine = token.getEndLine();
        math.blocks.add(block);
    }

    public static boolean isMathFence(String info) {
        return info != null && info.trim().equalsIgnoreCase("math");
    }

    /** Inner content of a paragraph wrapped in {@code $$}, or {@code null}. */
    public static String displayContent(String paragraphText) {
        String text = paragraphText == null ? "" : paragraphText.strip();
        if (text.length() >= 4 && text.startsWith(DISPLAY_DELIMITER) && text.endsWith(DISPLAY_DELIMITER)) {
            return text.substring(2, text.length() - 2).strip();
        }
        return null;
    }

    @Override
    public Object finish(Warehouse warehouse) {
        return math;
    }

    @Override
    public Object emptyResult() {
        return new MathResult();
    }
}
