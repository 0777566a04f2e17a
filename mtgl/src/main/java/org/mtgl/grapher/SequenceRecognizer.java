package org.mtgl.grapher;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.mtgl.common.tag.TagCode;
import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.TokenPattern;
import org.mtgl.common.util.TokenLists;
import org.mtgl.grammar.CatalogException;

/**
 * Ordering words. "A, then B" splits at "then"; "during|until|after|before|
 * as long as" split a span into an effect and the time frame it is bound to,
 * whether the frame leads ("Until end of turn, A") or trails ("A until end of
 * turn").
 */
class SequenceRecognizer extends Recognizer<Parts> {

    static final TokenPattern THEN = TokenPattern.tag(TagCode.SEQUENCE, "then");
    static final Set<String> FRAMES = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
            "during", "until", "after", "before", "as_long_as")));

    static final TokenPattern FRAME = new TokenPattern() {
        @Override
        public boolean matches(Token token) {
            return token.is(TagCode.SEQUENCE) && FRAMES.contains(token.getValue());
        }
        @Override
        public String toString() {
            return "FRAME";
        }
    };

    @Override
    Parts match(GraphContext ctx, List<Token> tokens) {
        List<Token> span = Spans.trim(tokens);
        if (Spans.isTriggered(span))
            return null;
        if (span.size()<2)
            return null;
        int last = span.size()-1;

        int then = Spans.indexOutsideQuotes(span, THEN);
        if (then==0)
            return new Parts("then").attr("type", "then").add("then", TokenLists.sub(span, 1));
        if (then>0 && then<last) {
            List<Token> first = Spans.trim(TokenLists.sub(span, 0, then));
            if (!first.isEmpty())
                return new Parts("then").attr("type", "then")
                        .add("first", first).add("then", TokenLists.sub(span, then+1));
        }

        if (FRAME.matches(span.get(0))) {
            Parts parts = new Parts("frame").attr("type", span.get(0).getValue());
            int comma = Spans.indexOutsideQuotes(span, Spans.COMMA);
            if (comma>1 && comma<last)
                return parts.add("condition", TokenLists.sub(span, 1, comma)).add("effect", TokenLists.sub(span, comma+1));
            return parts.add("condition", TokenLists.sub(span, 1));
        }

        int frame = Spans.indexOutsideQuotes(span, FRAME);
        if (frame>0 && frame<last) {
            List<Token> effect = Spans.trim(TokenLists.sub(span, 0, frame));
            if (!effect.isEmpty())
                return new Parts("frame").attr("type", span.get(frame).getValue())
                        .add("effect", effect).add("condition", TokenLists.sub(span, frame+1));
        }
        return null;
    }

    @Override
    String build(GraphContext ctx, String parent, Parts match) throws CatalogException {
        String id = ctx.tree.addNode(parent, "sequence-phrase", match.attrs);
        ctx.roles(id, match);
        return id;
    }
}
