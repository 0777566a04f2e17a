package org.mtgl.grapher;

import java.util.Collections;
import java.util.List;

import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.Tokens;
import org.mtgl.grammar.CatalogException;

/**
 * A line of keyword clauses. Either a single keyword with a long hyphen
 * ending in a period ("Buyback—Sacrifice a land."), or comma separated
 * clauses that each start with a keyword and no closing period or quote.
 */
class KeywordLineRecognizer extends Recognizer<List<List<Token>>> {

    @Override
    List<List<Token>> match(GraphContext ctx, List<Token> tokens) {
        if (tokens.isEmpty())
            return null;
        Token last = tokens.get(tokens.size()-1);
        if (Tokens.isKeyword(tokens.get(0)) && Spans.containsOutsideQuotes(tokens, Spans.HYPHEN) && Spans.PERIOD.matches(last))
            return Collections.singletonList(tokens);
        if (Spans.PERIOD.matches(last) || Spans.QUOTE.matches(last))
            return null;
        List<List<Token>> clauses = ctx.keywords().clauses(tokens);
        for (List<Token> clause:clauses)
            if (clause.isEmpty() || !Tokens.isKeyword(clause.get(0)))
                return null;
        return clauses;
    }

    @Override
    String build(GraphContext ctx, String parent, List<List<Token>> match) throws CatalogException {
        String id = ctx.tree.addNode(parent, "keywords");
        for (List<Token> clause:match)
            ctx.keywords().graph(ctx, id, clause);
        return id;
    }
}
