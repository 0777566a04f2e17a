package org.mtgl.grapher;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

import org.mtgl.common.tag.Symbols;
import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.Tokens;
import org.mtgl.common.tree.MTGTree;
import org.mtgl.common.util.TokenLists;
import org.mtgl.grammar.CatalogException;

/**
 * Graphs a cost as its sub-costs. Comma separated pieces are sub-costs,
 * except that pieces not starting with a symbol or an action continue the
 * sub-cost before them ("sacrifice a creature, an artifact, or a land").
 */
class CostGrapher {

    String graph(GraphContext ctx, String parent, List<Token> tokens) throws CatalogException {
        List<List<Token>> subcosts = subcosts(tokens);
        MTGTree tree = ctx.tree;
        if (subcosts.size()==1)
            return subcost(ctx, parent, subcosts.get(0));

        Map<String, String> attrs = new LinkedHashMap<String, String>();
        attrs.put("coordinator", "and");
        attrs.put("item_type", "cost");
        String id = tree.addNode(parent, "conjunction", attrs);
        for (List<Token> subcost:subcosts)
            subcost(ctx, id, subcost);
        return id;
    }

    static List<List<Token>> subcosts(List<Token> tokens) {
        List<Token> cost = tokens;
        if (!cost.isEmpty() && Spans.HYPHEN.matches(cost.get(0)))
            cost = TokenLists.sub(cost, 1);
        cost = Spans.stripPeriod(cost);

        List<List<Token>> ret = new ArrayList<List<Token>>();
        List<List<Token>> running = new ArrayList<List<Token>>();
        for (List<Token> piece:Spans.split(cost, Spans.COMMA)) {
            if (piece.isEmpty())
                continue;
            Token first = piece.get(0);
            if (first.isSymbol() || Tokens.isLoyaltyCost(first)) {
                if (!running.isEmpty())
                    ret.add(TokenLists.join(running, Spans.COMMA_TOKEN));
                running.clear();
                ret.add(piece);
            } else if (Tokens.isAction(first)) {
                if (!running.isEmpty())
                    ret.add(TokenLists.join(running, Spans.COMMA_TOKEN));
                running.clear();
                running.add(piece);
            } else
                running.add(piece);
        }
        if (!running.isEmpty())
            ret.add(TokenLists.join(running, Spans.COMMA_TOKEN));
        if (ret.isEmpty())
            ret.add(cost);
        return ret;
    }

    String subcost(GraphContext ctx, String parent, List<Token> tokens) throws CatalogException {
        MTGTree tree = ctx.tree;
        Map<String, String> attrs = new LinkedHashMap<String, String>();
        if (tokens.size()==1) {
            Token token = tokens.get(0);
            if (Tokens.isManaString(token)) {
                attrs.put("type", "mana");
                attrs.put("value", token.getText());
                return tree.addNode(parent, "sub-cost", attrs);
            }
            if (Tokens.isLoyaltyCost(token)) {
                attrs.put("type", "loyalty");
                attrs.put("value", loyaltyValue(token));
                return tree.addNode(parent, "sub-cost", attrs);
            }
            if (token.isSymbol()) {
                attrs.put("type", "symbol");
                attrs.put("value", token.getText());
                return tree.addNode(parent, "sub-cost", attrs);
            }
        }
        attrs.put("type", "action");
        String id = tree.addNode(parent, "sub-cost", attrs);
        if (!tokens.isEmpty())
            ctx.clause(id, tokens);
        return id;
    }

    /** +nu&lt;1&gt; → +1 */
    static String loyaltyValue(Token token) {
        Matcher matcher = Symbols.LOYALTY_COST.matcher(token.getText());
        return matcher.matches()?matcher.group(1)+matcher.group(2):token.getText();
    }
}
