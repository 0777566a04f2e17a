package org.mtgl.grapher;

import java.util.List;

import org.mtgl.common.tag.TagCode;
import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.TokenPattern;
import org.mtgl.common.tag.Tokens;
import org.mtgl.common.util.TokenLists;
import org.mtgl.grammar.CatalogException;

/**
 * Replacement effects that are not introduced by "if":
 * <ul>
 * <li>face-up: "As ~ is turned face up, EVENT"</li>
 * <li>as-enters: "As THING enters the battlefield, EVENT"</li>
 * <li>enters-with, enters-tapped: "THING enters the battlefield with|STATUS ..."</li>
 * <li>skip: "PLAYER [may] skip EVENT"</li>
 * <li>prevention: "Prevent DAMAGE that would be dealt ..."</li>
 * <li>instead: "NEW instead of ORIGINAL", "NEW instead [if CONDITION]"</li>
 * </ul>
 * A replacement of the if-would form is a conditional phrase.
 */
class ReplacementRecognizer extends Recognizer<Parts> {

    static final TokenPattern ENTER = TokenPattern.tag(TagCode.LITUUS_ACTION, "enter");
    static final TokenPattern SKIP = TokenPattern.tag(TagCode.LITUUS_ACTION, "skip");
    static final TokenPattern PREVENT = TokenPattern.tag(TagCode.LITUUS_ACTION, "prevent");
    static final TokenPattern INSTEAD = TokenPattern.tag(TagCode.CONDITIONAL, "instead");
    static final TokenPattern IF = TokenPattern.tag(TagCode.CONDITIONAL, "if");
    static final TokenPattern MAY = TokenPattern.tag(TagCode.CONDITIONAL, "may");
    static final TokenPattern WITH = TokenPattern.tag(TagCode.PREPOSITION, "with");

    static final String ORIGINAL = "original-event";
    static final String NEW = "new-event";
    static final String CONDITION = "cond-condition";

    @Override
    Parts match(GraphContext ctx, List<Token> tokens) {
        if (tokens.isEmpty() || Tokens.isTriggerPreamble(tokens.get(0)) || IF.matches(tokens.get(0)))
            return null;
        List<Token> span = Spans.trim(tokens);
        if (span.isEmpty())
            return null;
        Parts parts = anchored(span);
        if (parts==null)
            parts = enters(span);
        if (parts==null)
            parts = skip(span);
        if (parts==null)
            parts = prevention(span);
        if (parts==null)
            parts = instead(span);
        return parts;
    }

    /** As ~ is turned face up, ... / As ~ enters the battlefield, ... */
    static Parts anchored(List<Token> span) {
        if (!span.get(0).isWord("as"))
            return null;
        int comma = Spans.indexOutsideQuotes(span, Spans.COMMA);
        if (comma<2 || comma==span.size()-1)
            return null;
        List<Token> event = TokenLists.sub(span, 1, comma);
        String type;
        if (TokenLists.indexOf(event, TokenPattern.tag(TagCode.STATUS, "face_up"))>=0
                || TokenLists.contains(event, TokenPattern.word("face"), TokenPattern.word("up")))
            type = "face-up";
        else if (TokenLists.indexOf(event, ENTER)>=0)
            type = "as-enters";
        else
            return null;
        return new Parts(type).attr("type", type)
                .add(ORIGINAL, event).add(NEW, TokenLists.sub(span, comma+1));
    }

    /** THING enters the battlefield with N counters / tapped */
    static Parts enters(List<Token> span) {
        int enter = TokenLists.indexOf(span, ENTER);
        if (enter<1 || !Tokens.isThing(span.get(enter-1)))
            return null;
        int next = enter+1;
        if (Tokens.isZone(ActionGrapher.at(span, next)))
            ++next;
        Token after = ActionGrapher.at(span, next);
        if (after==null)
            return null;
        List<Token> original = TokenLists.sub(span, 0, next);
        if (WITH.matches(after) && next<span.size()-1)
            return new Parts("enters-with").attr("type", "enters-with")
                    .add(ORIGINAL, original).add(NEW, TokenLists.sub(span, next+1));
        if (Tokens.isState(after))
            return new Parts("enters-tapped").attr("type", "enters-tapped")
                    .add(ORIGINAL, original).add(NEW, TokenLists.sub(span, next));
        return null;
    }

    /** PLAYER [may] skip EVENT */
    static Parts skip(List<Token> span) {
        int skip = TokenLists.indexOf(span, SKIP);
        if (skip<0 || skip==span.size()-1)
            return null;
        List<Token> before = TokenLists.sub(span, 0, skip);
        for (Token token:before)
            if (!Tokens.isThing(token) && !MAY.matches(token))
                return null;
        Parts parts = new Parts("skip").attr("type", "skip");
        if (!before.isEmpty() && Tokens.isThing(before.get(0)))
            parts.attr("player", before.get(0).getValue());
        if (TokenLists.indexOf(before, MAY)>=0)
            parts.attr("optional", "yes");
        return parts.add(ORIGINAL, TokenLists.sub(span, skip+1));
    }

    /** Prevent DAMAGE ... */
    static Parts prevention(List<Token> span) {
        if (!PREVENT.matches(span.get(0)) || span.size()<2)
            return null;
        return new Parts("prevention").attr("type", "prevention")
                .add(ORIGINAL, TokenLists.sub(span, 1));
    }

    /** NEW instead of ORIGINAL / NEW instead [if CONDITION] */
    static Parts instead(List<Token> span) {
        int instead = Spans.indexOutsideQuotes(span, INSTEAD);
        if (instead<1)
            return null;
        List<Token> replacement = Spans.trim(TokenLists.sub(span, 0, instead));
        if (replacement.isEmpty())
            return null;
        Parts parts = new Parts("instead").attr("type", "instead").add(NEW, replacement);
        List<Token> rest = TokenLists.sub(span, instead+1);
        if (rest.isEmpty())
            return parts;
        if (rest.get(0).isWord("of") && rest.size()>1)
            return parts.add(ORIGINAL, TokenLists.sub(rest, 1));
        if (IF.matches(rest.get(0)) && rest.size()>1)
            return parts.add(CONDITION, TokenLists.sub(rest, 1));
        return null;
    }

    @Override
    String build(GraphContext ctx, String parent, Parts match) throws CatalogException {
        String id = ctx.tree.addNode(parent, "replacement-effect", match.attrs);
        ctx.roles(id, match);
        return id;
    }
}
