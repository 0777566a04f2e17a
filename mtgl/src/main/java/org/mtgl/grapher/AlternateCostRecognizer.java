package org.mtgl.grapher;

import java.util.List;

import org.mtgl.common.tag.TagCode;
import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.TokenPattern;
import org.mtgl.common.tag.Tokens;
import org.mtgl.common.util.TokenLists;
import org.mtgl.grammar.CatalogException;

/**
 * "[If CONDITION,] PLAYER [may] pay COST rather than pay ORIGINAL". Without
 * "may" the alternate cost is mandatory.
 */
class AlternateCostRecognizer extends Recognizer<Parts> {

    static final TokenPattern RATHER_THAN = TokenPattern.tag(TagCode.CONDITIONAL, "rather_than");
    static final TokenPattern PAY = TokenPattern.tag(TagCode.LITUUS_ACTION, "pay");

    static final String CONDITION = "cond-condition";
    static final String COST = "cost";
    static final String ORIGINAL = "original";

    @Override
    Parts match(GraphContext ctx, List<Token> tokens) {
        List<Token> span = Spans.trim(tokens);
        if (Spans.isTriggered(span))
            return null;
        int rather = Spans.indexOutsideQuotes(span, RATHER_THAN);
        if (rather<2)
            return null;
        int pay = TokenLists.lastIndexOf(TokenLists.sub(span, 0, rather), PAY);
        if (pay<0 || pay+1>=rather)
            return null;

        Parts parts = new Parts("alternate-cost");
        List<Token> before = TokenLists.sub(span, 0, pay);
        List<Token> condition = null;
        if (!before.isEmpty() && ReplacementRecognizer.IF.matches(before.get(0))) {
            int comma = Spans.indexOutsideQuotes(before, Spans.COMMA);
            if (comma<2)
                return null;
            condition = TokenLists.sub(before, 1, comma);
            before = TokenLists.sub(before, comma+1);
        }
        parts.attr("optional", TokenLists.indexOf(before, ReplacementRecognizer.MAY)>=0?"yes":"no");
        if (!before.isEmpty() && Tokens.isPlayer(before.get(0)))
            parts.attr("player", before.get(0).getValue());
        if (condition!=null)
            parts.add(CONDITION, condition);
        parts.add(COST, TokenLists.sub(span, pay+1, rather));

        List<Token> original = TokenLists.sub(span, rather+1);
        if (!original.isEmpty() && PAY.matches(original.get(0)))
            original = TokenLists.sub(original, 1);
        if (!original.isEmpty())
            parts.add(ORIGINAL, original);
        return parts;
    }

    @Override
    String build(GraphContext ctx, String parent, Parts match) throws CatalogException {
        String id = ctx.tree.addNode(parent, "alternate-cost", match.attrs);
        for (int i=0; i<match.size(); ++i) {
            if (COST.equals(match.role(i)))
                ctx.cost(id, match.get(i));
            else if (CONDITION.equals(match.role(i)))
                ctx.phrase(ctx.tree.addNode(id, CONDITION), match.get(i));
            else
                ctx.rolePhrase(id, match.role(i), match.get(i));
        }
        return id;
    }
}
