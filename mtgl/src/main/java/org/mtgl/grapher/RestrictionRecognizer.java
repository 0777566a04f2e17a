package org.mtgl.grapher;

import java.util.List;

import org.mtgl.common.tag.TagCode;
import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.TokenPattern;
import org.mtgl.common.util.TokenLists;
import org.mtgl.grammar.CatalogException;

/**
 * Restrictions, tried in this order:
 * <ul>
 * <li>cannot-unless: "THING can't ACTION unless CONDITION"</li>
 * <li>only-if: "RULE only if CONDITION"</li>
 * <li>but: "RULE, but RESTRICTION"</li>
 * <li>only: "RULE only RESTRICTION" ("Activate only as a sorcery")</li>
 * </ul>
 */
class RestrictionRecognizer extends Recognizer<Parts> {

    static final TokenPattern CANNOT = TokenPattern.tag(TagCode.CONDITIONAL, "cannot");
    static final TokenPattern UNLESS = TokenPattern.tag(TagCode.CONDITIONAL, "unless");
    static final TokenPattern ONLY_IF = TokenPattern.tag(TagCode.CONDITIONAL, "only_if");
    static final TokenPattern ONLY = TokenPattern.tag(TagCode.CONDITIONAL, "only");
    static final TokenPattern BUT = TokenPattern.word("but");

    @Override
    Parts match(GraphContext ctx, List<Token> tokens) {
        List<Token> span = Spans.trim(tokens);
        if (Spans.isTriggered(span))
            return null;
        int last = span.size()-1;

        int cannot = Spans.indexOutsideQuotes(span, CANNOT);
        if (cannot>=0) {
            int unless = Spans.indexOutsideQuotes(span, UNLESS, cannot+1);
            if (unless>cannot && unless<last)
                return new Parts("cannot-unless").attr("type", "cannot-unless")
                        .add("restriction", Spans.trim(TokenLists.sub(span, 0, unless)))
                        .add("cond-condition", TokenLists.sub(span, unless+1));
        }

        int onlyIf = Spans.indexOutsideQuotes(span, ONLY_IF);
        if (onlyIf>0 && onlyIf<last)
            return new Parts("only-if").attr("type", "only-if")
                    .add("rule", Spans.trim(TokenLists.sub(span, 0, onlyIf)))
                    .add("cond-condition", TokenLists.sub(span, onlyIf+1));

        int comma = Spans.indexOutsideQuotes(span, Spans.COMMA);
        while (comma>0 && comma<last-1) {
            if (BUT.matches(span.get(comma+1)))
                return new Parts("but").attr("type", "but")
                        .add("rule", TokenLists.sub(span, 0, comma))
                        .add("restriction", TokenLists.sub(span, comma+2));
            comma = Spans.indexOutsideQuotes(span, Spans.COMMA, comma+1);
        }

        int only = Spans.indexOutsideQuotes(span, ONLY);
        if (only>0 && only<last)
            return new Parts("only").attr("type", "only")
                    .add("rule", Spans.trim(TokenLists.sub(span, 0, only)))
                    .add("restriction", TokenLists.sub(span, only+1));
        return null;
    }

    @Override
    String build(GraphContext ctx, String parent, Parts match) throws CatalogException {
        String id = ctx.tree.addNode(parent, "restriction-phrase", match.attrs);
        ctx.roles(id, match);
        return id;
    }
}
