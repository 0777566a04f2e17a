package org.mtgl.grapher;

import java.util.List;

import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.Tokens;
import org.mtgl.common.util.TokenLists;
import org.mtgl.grammar.CatalogException;

/**
 * "[THING] may EFFECT". The thing, usually a player, is the one making the
 * choice.
 */
class OptionalRecognizer extends Recognizer<Parts> {

    @Override
    Parts match(GraphContext ctx, List<Token> tokens) {
        List<Token> span = Spans.trim(tokens);
        if (Spans.isTriggered(span))
            return null;
        int may = Spans.indexOutsideQuotes(span, ReplacementRecognizer.MAY);
        if (may<0 || may==span.size()-1)
            return null;
        List<Token> subject = TokenLists.sub(span, 0, may);
        for (Token token:subject)
            if (!Tokens.isThing(token) && !Tokens.isCoordinator(token) && !Spans.COMMA.matches(token))
                return null;
        return new Parts("optional").add(subject).add(TokenLists.sub(span, may+1));
    }

    @Override
    String build(GraphContext ctx, String parent, Parts match) throws CatalogException {
        String id = ctx.tree.addNode(parent, "optional-phrase");
        if (!match.get(0).isEmpty()) {
            ThingGrapher.Collated subject = ctx.things().collate(ctx.tree, match.get(0), 0);
            if (subject!=null) {
                ctx.tree.addAttr(subject.id, "role", "subject");
                ctx.tree.attach(id, subject.id);
            }
        }
        ctx.phrase(id, match.get(1));
        return id;
    }
}
