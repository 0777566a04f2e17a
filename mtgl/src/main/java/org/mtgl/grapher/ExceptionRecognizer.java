package org.mtgl.grapher;

import java.util.List;

import org.mtgl.common.tag.TagCode;
import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.TokenPattern;
import org.mtgl.common.util.TokenLists;
import org.mtgl.grammar.CatalogException;

/**
 * "RULE[,] except [for] EXCEPTION".
 */
class ExceptionRecognizer extends Recognizer<Parts> {

    static final TokenPattern EXCEPT = TokenPattern.tag(TagCode.CONDITIONAL, "except");

    @Override
    Parts match(GraphContext ctx, List<Token> tokens) {
        List<Token> span = Spans.trim(tokens);
        if (Spans.isTriggered(span))
            return null;
        int except = Spans.indexOutsideQuotes(span, EXCEPT);
        if (except<1)
            return null;
        List<Token> rule = Spans.trim(TokenLists.sub(span, 0, except));
        List<Token> exception = TokenLists.sub(span, except+1);
        if (!exception.isEmpty() && (exception.get(0).isWord("for") || exception.get(0).is(TagCode.PREPOSITION, "for")))
            exception = TokenLists.sub(exception, 1);
        if (rule.isEmpty() || exception.isEmpty())
            return null;
        return new Parts("exception").add("rule", rule).add("exception", exception);
    }

    @Override
    String build(GraphContext ctx, String parent, Parts match) throws CatalogException {
        String id = ctx.tree.addNode(parent, "exception-phrase");
        ctx.roles(id, match);
        return id;
    }
}
