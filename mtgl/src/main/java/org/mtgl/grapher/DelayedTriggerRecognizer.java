package org.mtgl.grapher;

import java.util.List;

import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.Tokens;
import org.mtgl.common.util.TokenLists;
import org.mtgl.grammar.CatalogException;

/**
 * A trigger set up by an effect. Either it leads, shaped like a triggered
 * ability ("At the beginning of the next end step, sacrifice it"), or it
 * trails the effect ("Return it to the battlefield at the beginning of the
 * next end step").
 */
class DelayedTriggerRecognizer extends Recognizer<Parts> {

    static final String TRAILING = "trailing";

    @Override
    Parts match(GraphContext ctx, List<Token> tokens) {
        if (tokens.isEmpty())
            return null;
        if (Tokens.isTriggerPreamble(tokens.get(0)))
            return TriggeredRecognizer.split(tokens);

        List<Token> span = Spans.trim(tokens);
        boolean[] quoted = Spans.quoted(span);
        for (int i=1; i<span.size()-1; ++i) {
            if (quoted[i] || !Tokens.isTriggerPreamble(span.get(i)))
                continue;
            List<Token> effect = Spans.trim(TokenLists.sub(span, 0, i));
            if (effect.isEmpty())
                return null;
            return new Parts(TRAILING).attr("value", Spans.sentenceCase(span.get(i).getValue()))
                    .add(TokenLists.sub(span, i+1)).add(effect);
        }
        return null;
    }

    @Override
    String build(GraphContext ctx, String parent, Parts match) throws CatalogException {
        String id = ctx.tree.addNode(parent, "delayed-trigger");
        if (!TRAILING.equals(match.kind))
            return TriggeredRecognizer.fill(ctx, id, match);
        ctx.tree.addNode(id, "triggered-preamble", ActionGrapher.singleton("value", match.attrs.get("value")));
        ctx.phrase(ctx.tree.addNode(id, "triggered-condition"), match.get(0));
        ctx.phrase(ctx.tree.addNode(id, "triggered-effect"), match.get(1));
        return id;
    }
}
