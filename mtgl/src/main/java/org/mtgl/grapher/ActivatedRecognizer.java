package org.mtgl.grapher;

import java.util.List;

import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.Tokens;
import org.mtgl.common.util.TokenLists;
import org.mtgl.grammar.CatalogException;

/**
 * An activated ability, "cost: effect. instructions". The effect ends at the
 * first period after the colon unless it is modal; every later sentence is
 * an activation instruction. A colon after a quote belongs to a granted
 * ability and does not make the line activated, and keyword or ability
 * word lines that embed an activated ability are left to their own
 * recognizers.
 */
class ActivatedRecognizer extends Recognizer<Parts> {

    @Override
    Parts match(GraphContext ctx, List<Token> tokens) {
        if (tokens.isEmpty() || Tokens.isKeyword(tokens.get(0)) || Tokens.isAbilityWord(tokens.get(0)))
            return null;
        int colon = TokenLists.indexOf(tokens, Spans.COLON);
        if (colon<1 || colon==tokens.size()-1)
            return null;
        int quote = TokenLists.indexOf(tokens, Spans.QUOTE);
        int single = TokenLists.indexOf(tokens, Spans.SINGLE_QUOTE);
        if ((quote>=0 && quote<colon) || (single>=0 && single<colon))
            return null;
        return split("activated", TokenLists.sub(tokens, 0, colon), TokenLists.sub(tokens, colon+1));
    }

    /**
     * @return parts holding the head, the effect and the instruction sentences
     */
    static Parts split(String kind, List<Token> head, List<Token> rest) {
        Parts parts = new Parts(kind).add(head);
        if (ModalRecognizer.isModal(rest)) {
            parts.add(rest);
            return parts;
        }
        int end = Spans.firstSentenceLength(rest);
        parts.add(TokenLists.sub(rest, 0, end));
        for (List<Token> sentence:Spans.sentences(TokenLists.sub(rest, end)))
            if (!Spans.isEmptySpan(sentence))
                parts.add(sentence);
        return parts;
    }

    @Override
    String build(GraphContext ctx, String parent, Parts match) throws CatalogException {
        String id = ctx.tree.addNode(parent, "activated-ability");
        ctx.cost(ctx.tree.addNode(id, "activated-cost"), match.get(0));
        ctx.ability(ctx.tree.addNode(id, "activated-effect"), match.get(1));
        if (match.size()>2) {
            String instructions = ctx.tree.addNode(id, "activated-instructions");
            for (int i=2; i<match.size(); ++i)
                ctx.ability(ctx.tree.addNode(instructions, "instruction"), match.get(i));
        }
        return id;
    }
}
