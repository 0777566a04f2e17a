package org.mtgl.grapher;

import java.util.ArrayList;
import java.util.List;

import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.Tokens;
import org.mtgl.common.util.TokenLists;
import org.mtgl.grammar.CatalogException;

/**
 * Phrases joined by "and" or "or": "Draw a card and lose 1 life", "Destroy
 * target creature and its controller loses 2 life", "Draw a card, lose 1
 * life, and discard a card". A coordinator or a comma only joins phrases
 * when the piece before it has an action and what follows is an action or a
 * thing doing one; anything else is a list of things and is left to the
 * clause. Commas join nothing unless a coordinator does too.
 */
class ConjunctionRecognizer extends Recognizer<Parts> {

    @Override
    Parts match(GraphContext ctx, List<Token> tokens) {
        List<Token> span = Spans.trim(tokens);
        if (Spans.isTriggered(span))
            return null;
        boolean[] quoted = Spans.quoted(span);
        List<List<Token>> items = new ArrayList<List<Token>>();
        String coordinator = null;
        int prev = 0;
        for (int i=1; i<span.size()-1; ++i) {
            Token token = span.get(i);
            boolean comma = Spans.COMMA.matches(token);
            if (quoted[i] || !(comma || token.isWord("and") || token.isWord("or")))
                continue;
            Token next = span.get(i+1);
            if (!Tokens.isAction(next) && !(Tokens.isThing(next) && Tokens.isAction(ActionGrapher.at(span, i+2))))
                continue;
            List<Token> item = Spans.trim(TokenLists.sub(span, prev, i));
            if (!hasAction(item))
                continue;
            if (coordinator==null && !comma)
                coordinator = token.getText();
            items.add(item);
            prev = i+1;
        }
        if (coordinator==null)
            return null;
        List<Token> last = Spans.trim(TokenLists.sub(span, prev));
        if (last.isEmpty())
            return null;
        items.add(last);

        Parts parts = new Parts("conjunction").attr("coordinator", coordinator).attr("item_type", "phrase");
        for (List<Token> item:items)
            parts.add(item);
        return parts;
    }

    static boolean hasAction(List<Token> tokens) {
        for (Token token:tokens)
            if (Tokens.isAction(token))
                return true;
        return false;
    }

    @Override
    String build(GraphContext ctx, String parent, Parts match) throws CatalogException {
        String id = ctx.tree.addNode(parent, "conjunction", match.attrs);
        for (List<Token> item:match.pieces)
            ctx.phrase(ctx.tree.addNode(id, "item"), item);
        return id;
    }
}
