package org.mtgl.grapher;

import java.util.List;

import org.mtgl.common.tag.TagCode;
import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.TokenPattern;
import org.mtgl.common.tag.Tokens;
import org.mtgl.common.util.TokenLists;
import org.mtgl.grammar.CatalogException;

/**
 * A triggered ability, "PREAMBLE condition, effect. instructions".
 * <p>
 * The condition runs to the comma before the first piece that reads like
 * an effect: one opening with an action, with a thing and its action, or
 * with "PLAYER may" and an action. A condition ending with a phase or step
 * is one piece long, an "if" piece stays with the condition and a "where X"
 * piece pulls the piece before it into the effect.
 */
class TriggeredRecognizer extends Recognizer<Parts> {

    static final TokenPattern[] THING_ACTION = {TokenPattern.THING, TokenPattern.ACTION};
    static final TokenPattern[] PLAYER_MAY_ACTION = {
        TokenPattern.PLAYER, TokenPattern.tag(TagCode.CONDITIONAL, "may"), TokenPattern.ACTION};

    @Override
    Parts match(GraphContext ctx, List<Token> tokens) {
        if (tokens.isEmpty() || !Tokens.isTriggerPreamble(tokens.get(0)))
            return null;
        return split(tokens);
    }

    /**
     * @return the preamble attribute and the condition, effect and instruction
     * pieces, or null if there is no comma ending the condition
     */
    static Parts split(List<Token> tokens) {
        List<Token> rest = TokenLists.sub(tokens, 1);
        List<Token> firstSentence = TokenLists.sub(rest, 0, Spans.firstSentenceLength(rest));
        List<List<Token>> pieces = Spans.split(firstSentence, Spans.COMMA);
        if (pieces.size()<2)
            return null;

        int split = -1;
        for (int i=0; i<pieces.size() && split<0; ++i) {
            List<Token> piece = pieces.get(i);
            if (i==0) {
                if (!piece.isEmpty() && Tokens.isPhase(piece.get(piece.size()-1)))
                    split = 1;
                continue;
            }
            if (piece.isEmpty())
                continue;
            if (TokenLists.startsWith(piece, THING_ACTION) || TokenLists.startsWith(piece, PLAYER_MAY_ACTION)
                    || Tokens.isAction(piece.get(0)))
                split = i;
            else if (piece.get(0).is(TagCode.CONDITIONAL, "if"))
                split = i+1;
            else if (piece.get(0).isWord("where") && Tokens.isVariable(ActionGrapher.at(piece, 1)))
                split = i-1;
        }
        if (split<1 || split>=pieces.size())
            split = pieces.size()-1;

        List<Token> condition = TokenLists.join(pieces.subList(0, split), Spans.COMMA_TOKEN);
        if (condition.isEmpty())
            return null;
        int conditionLength = condition.size()+1;
        Parts body = ActivatedRecognizer.split("triggered", condition, TokenLists.sub(rest, conditionLength));
        body.attr("value", Spans.sentenceCase(tokens.get(0).getValue()));
        return body;
    }

    @Override
    String build(GraphContext ctx, String parent, Parts match) throws CatalogException {
        return fill(ctx, ctx.tree.addNode(parent, "triggered-ability"), match);
    }

    /** fills an ability node with preamble, condition, effect and instructions */
    static String fill(GraphContext ctx, String id, Parts match) throws CatalogException {
        ctx.tree.addNode(id, "triggered-preamble", ActionGrapher.singleton("value", match.attrs.get("value")));
        ctx.phrase(ctx.tree.addNode(id, "triggered-condition"), match.get(0));
        ctx.ability(ctx.tree.addNode(id, "triggered-effect"), match.opt(1));
        if (match.size()>2) {
            String instructions = ctx.tree.addNode(id, "triggered-instructions");
            for (int i=2; i<match.size(); ++i)
                ctx.ability(ctx.tree.addNode(instructions, "instruction"), match.get(i));
        }
        return id;
    }
}
