package org.mtgl.grapher;

import java.util.List;

import org.mtgl.common.tag.Symbols;
import org.mtgl.common.tag.TagCode;
import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.TokenPattern;
import org.mtgl.common.tag.Tokens;
import org.mtgl.common.util.TokenLists;
import org.mtgl.grammar.CatalogException;

/**
 * A leveler block: "level N1 to N2" or "level N or more", then the block's
 * power/toughness and abilities, each introduced by a bullet.
 */
class LevelRecognizer extends Recognizer<Parts> {

    static final TokenPattern[] RANGE = {
        TokenPattern.NUMBER, TokenPattern.tag(TagCode.PREPOSITION, "to"), TokenPattern.NUMBER};

    @Override
    Parts match(GraphContext ctx, List<Token> tokens) {
        if (tokens.size()<2 || !tokens.get(0).isWord("level"))
            return null;
        Parts parts = new Parts("level");
        int i;
        if (TokenLists.matchesAt(tokens, 1, RANGE)) {
            parts.attr("range", tokens.get(1).getValue()+"-"+tokens.get(3).getValue());
            i = 1+RANGE.length;
        } else if (Tokens.isNumber(tokens.get(1)) && tokens.get(1).getValue().startsWith(Symbols.GE)) {
            parts.attr("range", tokens.get(1).getValue().substring(Symbols.GE.length())+"+");
            i = 2;
        } else
            return null;

        for (List<Token> piece:TokenLists.split(TokenLists.sub(tokens, i), Spans.BULLET)) {
            if (piece.isEmpty())
                continue;
            if (parts.size()==0 && !parts.attrs.containsKey("p/t") && piece.size()==1
                    && piece.get(0).is(TagCode.CHARACTERISTIC, "p/t") && piece.get(0).getTag().hasAttr("val")) {
                parts.attr("p/t", piece.get(0).getTag().getAttr("val"));
                continue;
            }
            if (TokenLists.matchesAt(piece, 0, TokenPattern.KEYWORD) && Spans.PERIOD.matches(piece.get(piece.size()-1))
                    && TokenLists.count(piece, TokenPattern.KEYWORD)==piece.size()-1-TokenLists.count(piece, Spans.COMMA))
                piece = Spans.stripPeriod(piece);
            parts.add(piece);
        }
        return parts;
    }

    @Override
    String build(GraphContext ctx, String parent, Parts match) throws CatalogException {
        String id = ctx.tree.addNode(parent, "level", match.attrs);
        if (match.size()>0) {
            String abilities = ctx.tree.addNode(id, "level-abilities");
            for (List<Token> ability:match.pieces)
                ctx.grapher.graphLine(ctx, abilities, ability);
        }
        return id;
    }
}
