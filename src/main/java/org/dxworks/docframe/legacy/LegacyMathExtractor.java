package org.dxworks.docframe.legacy;

import org.dxworks.docframe.collector.category.MathCollector;
import org.dxworks.docframe.model.Categories;
import org.dxworks.docframe.model.MathResult;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;

import java.util.List;
import java.util.regex.Matcher;

class LegacyMathExtractor implements LegacyExtractor {

    @Override
    public String category() {
        return Categories.MATH;
    }

    @Override
    public Object extract(List<Token> tokens) {
        MathResult math = new MathResult();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            TokenKind kind = token.getKind();
            if (kind != TokenKind.FENCE_OPEN && kind != TokenKind.PARAGRAPH_OPEN && kind != TokenKind.TEXT) {
                continue;
            }
            if (LegacyTokenScans.insideRaw(tokens, i)) {
                continue;
            }
            if (kind == TokenKind.FENCE_OPEN && MathCollector.isMathFence(token.attrString("info"))) {
                addBlock(math, "fenced", LegacyTokenScans.textOf(tokens, i).strip(), token);
            } else if (kind == TokenKind.PARAGRAPH_OPEN) {
                String display = MathCollector.displayContent(LegacyTokenScans.textOf(tokens, i));
                if (display != null) {
                    addBlock(math, "display", display, token);
                }
            } else if (kind == TokenKind.TEXT && token.getContent() != null) {
                Matcher matcher = MathCollector.INLINE_MATH.matcher(token.getContent());
                while (matcher.find()) {
                    MathResult.Inline inline = new MathResult.Inline();
                    inline.id = "math_inline_" + math.inline.size();
                    inline.content = matcher.group(1);
                    inline.line = token.getLine();
                    math.inline.add(inline);
                }
            }
        }
        return math;
    }

    private static void addBlock(MathResult math, String kind, String content, Token token) {
        MathResult.Block block = new MathResult.Block();
        block.id = "math_block_" + math.blocks.size();
        block.kind = kind;
        block.content = content;
        block.startLine = token.getLine();
        block.endLine = token.getEndLine();
        math.blocks.add(block);
    }

    @Override
    public Object emptyResult() {
        return new MathResult();
    }
}
