package org.mtgl.grapher;

import java.util.List;

import org.mtgl.common.tag.TagCode;
import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.TokenPattern;
import org.mtgl.common.tag.Tokens;
import org.mtgl.common.util.TokenLists;
import org.mtgl.grammar.CatalogException;

/**
 * Conditional phrases:
 * <ul>
 * <li>if-would: "If EVENT would HAPPEN, EFFECT [instead]". With "instead" the
 * effect is a replacement of the event.</li>
 * <li>if, unless, for-each: leading "If CONDITION, EFFECT" or trailing
 * "EFFECT if CONDITION"</li>
 * <li>otherwise: "Otherwise, EFFECT"</li>
 * </ul>
 */
class ConditionalRecognizer extends Recognizer<Parts> {

    static final TokenPattern IF = ReplacementRecognizer.IF;
    static final TokenPattern WOULD = TokenPattern.tag(TagCode.CONDITIONAL, "would");
    static final TokenPattern UNLESS = RestrictionRecognizer.UNLESS;
    static final TokenPattern OTHERWISE = TokenPattern.tag(TagCode.CONDITIONAL, "otherwise");
    static final TokenPattern INSTEAD = ReplacementRecognizer.INSTEAD;

    static final String CONDITION = "cond-condition";
    static final String EFFECT = "cond-effect";
    static final String REPLACEMENT = "replacement";

    @Override
    Parts match(GraphContext ctx, List<Token> tokens) {
        List<Token> span = Spans.trim(tokens);
        if (Spans.isTriggered(span))
            return null;
        if (span.size()<2)
            return null;
        Token first = span.get(0);
        int comma = Spans.indexOutsideQuotes(span, Spans.COMMA);
        boolean split = comma>1 && comma<span.size()-1;

        if (IF.matches(first) && split) {
            List<Token> condition = TokenLists.sub(span, 1, comma);
            List<Token> effect = TokenLists.sub(span, comma+1);
            int would = TokenLists.indexOf(condition, WOULD);
            if (would<0)
                return leading("if", condition, effect);
            List<Token> event = TokenLists.sub(condition, 0, would);
            event.addAll(TokenLists.sub(condition, would+1));
            Parts parts = new Parts("if-would").attr("type", "if-would").add(CONDITION, event);
            int instead = Spans.indexOutsideQuotes(effect, INSTEAD);
            if (instead<0)
                return parts.add(EFFECT, effect);
            List<Token> replacement = TokenLists.sub(effect, 0, instead);
            replacement.addAll(TokenLists.sub(effect, instead+1));
            replacement = Spans.trim(replacement);
            return replacement.isEmpty()?null:parts.add(REPLACEMENT, replacement);
        }
        if (UNLESS.matches(first) && split)
            return leading("unless", TokenLists.sub(span, 1, comma), TokenLists.sub(span, comma+1));
        if (OTHERWISE.matches(first)) {
            List<Token> effect = Spans.trim(TokenLists.sub(span, 1));
            return effect.isEmpty()?null:new Parts("otherwise").attr("type", "otherwise").add(EFFECT, effect);
        }
        if (isForEach(span, 0) && split)
            return leading("for-each", TokenLists.sub(span, 1, comma), TokenLists.sub(span, comma+1));

        boolean[] quoted = Spans.quoted(span);
        for (int i=1; i<span.size()-1; ++i) {
            if (quoted[i])
                continue;
            String type = null;
            if (IF.matches(span.get(i)))
                type = "if";
            else if (UNLESS.matches(span.get(i)))
                type = "unless";
            else if (isForEach(span, i))
                type = "for-each";
            if (type==null)
                continue;
            List<Token> effect = Spans.trim(TokenLists.sub(span, 0, i));
            if (effect.isEmpty())
                return null;
            return new Parts(type).attr("type", type).add(EFFECT, effect).add(CONDITION, TokenLists.sub(span, i+1));
        }
        return null;
    }

    static Parts leading(String type, List<Token> condition, List<Token> effect) {
        return new Parts(type).attr("type", type).add(CONDITION, condition).add(EFFECT, effect);
    }

    /** "for each THING", the quantifier possibly grouped onto the thing */
    static boolean isForEach(List<Token> span, int i) {
        Token token = span.get(i);
        if (!token.isWord("for") && !token.is(TagCode.PREPOSITION, "for"))
            return false;
        Token next = ActionGrapher.at(span, i+1);
        if (next==null)
            return false;
        if (next.is(TagCode.QUANTIFIER, "each"))
            return true;
        return Tokens.isThing(next) && "each".equals(next.getTag().getAttr("quantifier"));
    }

    @Override
    String build(GraphContext ctx, String parent, Parts match) throws CatalogException {
        String id = ctx.tree.addNode(parent, "conditional-phrase", match.attrs);
        for (int i=0; i<match.size(); ++i) {
            String role = match.role(i);
            if (CONDITION.equals(role)) {
                ctx.phrase(ctx.tree.addNode(id, CONDITION, match.attrs), match.get(i));
            } else if (EFFECT.equals(role)) {
                ctx.phrase(ctx.tree.addNode(id, EFFECT), match.get(i));
            } else {
                String effect = ctx.tree.addNode(id, EFFECT);
                String replacement = ctx.tree.addNode(effect, "replacement-effect", ActionGrapher.singleton("type", "instead"));
                ctx.phrase(ctx.tree.addNode(replacement, "new-event"), match.get(i));
            }
        }
        return id;
    }
}
