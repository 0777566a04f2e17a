package org.mtgl.grapher;

import java.util.List;

import org.mtgl.common.tag.TagCode;
import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.TokenPattern;
import org.mtgl.common.util.TokenLists;
import org.mtgl.grammar.CatalogException;

/**
 * "As an additional cost to cast ~, COST".
 */
class AdditionalCostRecognizer extends Recognizer<Parts> {

    static final TokenPattern ADDITIONAL = TokenPattern.tag(TagCode.QUALIFIER, "additional");

    @Override
    Parts match(GraphContext ctx, List<Token> tokens) {
        List<Token> span = Spans.trim(tokens);
        if (span.isEmpty() || !span.get(0).isWord("as"))
            return null;
        int comma = Spans.indexOutsideQuotes(span, Spans.COMMA);
        if (comma<2 || comma==span.size()-1)
            return null;
        List<Token> head = TokenLists.sub(span, 1, comma);
        int additional = TokenLists.indexOf(head, ADDITIONAL);
        if (additional<0)
            return null;
        List<Token> appliesTo = TokenLists.sub(head, additional+1);
        if (!appliesTo.isEmpty() && "cost".equals(appliesTo.get(0).getValue()))
            appliesTo = TokenLists.sub(appliesTo, 1);
        return new Parts("additional-cost").add(appliesTo).add(TokenLists.sub(span, comma+1));
    }

    @Override
    String build(GraphContext ctx, String parent, Parts match) throws CatalogException {
        String id = ctx.tree.addNode(parent, "additional-cost");
        if (!match.get(0).isEmpty())
            ctx.rolePhrase(id, "applies-to", match.get(0));
        ctx.cost(id, match.get(1));
        return id;
    }
}
