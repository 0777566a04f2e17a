package org.mtgl.grapher;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.mtgl.common.tag.Symbols;
import org.mtgl.common.tag.TagCode;
import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.TokenPattern;
import org.mtgl.common.tag.Tokens;
import org.mtgl.common.tree.MTGTree;
import org.mtgl.common.util.TokenLists;
import org.mtgl.grammar.CatalogException;
import org.mtgl.grammar.GrammarCatalog;
import org.mtgl.grammar.KeywordTemplate;

/**
 * Graphs keyword clauses against their catalog templates. A clause whose
 * parameters are missing or left over after the template is applied is a
 * catalog error.
 */
class KeywordGrapher {

    static final TokenPattern AND_OR = TokenPattern.tag(TagCode.OPERATOR, Symbols.AOR);

    final GrammarCatalog catalog;

    KeywordGrapher(GrammarCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Splits a keyword line into clauses, each starting at a keyword. A
     * keyword after "has" or "gain" stays in its clause, as does the sunburst
     * of "modular—sunburst". Keywords written after their quality (swamp
     * landwalk, plainscycling) are moved in front of it.
     */
    List<List<Token>> clauses(List<Token> line) {
        List<Token> ordered = new ArrayList<Token>(line.size());
        for (Token token:line) {
            if (Tokens.isKeyword(token) && catalog.isKeywordVariation(token.getValue())
                    && !ordered.isEmpty() && Tokens.isQuality(ordered.get(ordered.size()-1))) {
                Token quality = ordered.remove(ordered.size()-1);
                ordered.add(token);
                ordered.add(quality);
            } else
                ordered.add(token);
        }

        List<List<Token>> clauses = new ArrayList<List<Token>>();
        List<Token> clause = new ArrayList<Token>();
        for (Token token:ordered) {
            if (!Tokens.isKeyword(token) || clause.isEmpty() || continuesClause(clause, token)) {
                clause.add(token);
                continue;
            }
            clauses.add(TokenLists.stripTrailing(clause, Spans.COMMA));
            clause = new ArrayList<Token>();
            clause.add(token);
        }
        if (!clause.isEmpty())
            clauses.add(TokenLists.stripTrailing(clause, Spans.COMMA));
        return clauses;
    }

    static boolean continuesClause(List<Token> clause, Token keyword) {
        Token prev = clause.get(clause.size()-1);
        if ("sunburst".equals(keyword.getValue()) && clause.size()==2
                && "modular".equals(clause.get(0).getValue()) && Spans.HYPHEN.matches(prev))
            return true;
        return Tokens.isAction(prev) && ("has".equals(prev.getValue()) || "gain".equals(prev.getValue()));
    }

    /**
     * @return the kw-clause node created under parent
     * @throws CatalogException if the keyword has no template or the
     * parameters do not fit it
     */
    String graph(GraphContext ctx, String parent, List<Token> clause) throws CatalogException {
        MTGTree tree = ctx.tree;
        KeywordTemplate template = catalog.template(clause.get(0).getValue());
        List<Token> params = TokenLists.sub(clause, 1);
        String id = tree.addNode(parent, "kw-clause", ActionGrapher.singleton("keyword", template.getName()));

        int i = 0;
        switch (template.getShape()) {
        case EMPTY:
            break;
        case THING:
            i = thing(ctx, id, template, params, i);
            break;
        case FOR_THING:
            i = expect(template, params, i, "for");
            i = thing(ctx, id, template, params, i);
            break;
        case QUALITY:
            i = quality(tree, id, template, params, i, false);
            break;
        case FROM_QUALITY:
            i = fromQualities(tree, id, template, params, i);
            break;
        case N:
            i = number(tree, id, template, params, i);
            if (TokenLists.matchesAt(params, i, Spans.COMMA) && i+1<params.size() && params.get(i+1).isWord("where")) {
                ctx.phrase(id, TokenLists.sub(params, i+1));
                i = params.size();
            }
            break;
        case COST:
            i = cost(ctx, id, template, params, i, params.size());
            break;
        case COST_OR_COST:
            int or = TokenLists.indexOf(params, AND_OR);
            if (or<0)
                i = cost(ctx, id, template, params, i, params.size());
            else {
                Map<String, String> attrs = new LinkedHashMap<String, String>();
                attrs.put("coordinator", "and/or");
                attrs.put("item_type", "cost");
                String conjunction = tree.addNode(id, "conjunction", attrs);
                cost(ctx, conjunction, template, params, 0, or);
                i = cost(ctx, conjunction, template, params, or+1, params.size());
            }
            break;
        case N_COST:
            i = number(tree, id, template, params, i);
            i = cost(ctx, id, template, params, i, params.size());
            break;
        case QUALITY_COST:
            if (Tokens.isQuality(at(params, i)))
                i = quality(tree, id, template, params, i, false);
            else if (!template.isOptional())
                throw unfit(template, params);
            i = cost(ctx, id, template, params, i, params.size());
            break;
        case ONTO_COST:
            i = expect(template, params, i, "onto");
            i = quality(tree, id, template, params, i, true);
            i = cost(ctx, id, template, params, i, params.size());
            break;
        case SUB_LINE:
            if (Spans.HYPHEN.matches(at(params, i)))
                ++i;
            if (i>=params.size())
                throw unfit(template, params);
            ctx.ability(id, TokenLists.sub(params, i));
            i = params.size();
            break;
        }
        if (i<params.size())
            throw unfit(template, params);
        return id;
    }

    int thing(GraphContext ctx, String id, KeywordTemplate template, List<Token> params, int i) throws CatalogException {
        ThingGrapher.Collated thing = ctx.things().collate(ctx.tree, params, i);
        if (thing==null)
            throw unfit(template, params);
        ctx.tree.attach(id, thing.id);
        return i+thing.length;
    }

    /**
     * @param anyToken take any tagged or literal token as the quality (splice onto Arcane)
     */
    int quality(MTGTree tree, String id, KeywordTemplate template, List<Token> params, int i, boolean anyToken) throws CatalogException {
        Token token = at(params, i);
        if (token==null || !(Tokens.isQuality(token) || (anyToken && !token.isPunctuation() && !token.isSymbol())))
            throw unfit(template, params);
        tree.addAttr(id, "quality", qualityOf(token));
        return i+1;
    }

    /**
     * Protection from A, from B and from C. Each quality is a characteristic,
     * an object with characteristics, "ATTRIBUTE OP N", "QUANTIFIER ATTRIBUTE"
     * or, failing those, the words up to the next "from".
     */
    int fromQualities(MTGTree tree, String id, KeywordTemplate template, List<Token> params, int i) throws CatalogException {
        List<String> qualities = new ArrayList<String>();
        while (isFrom(at(params, i))) {
            ++i;
            Token token = at(params, i);
            if (token==null)
                throw unfit(template, params);
            if (Tokens.isMetaCharacteristic(token) && Tokens.isOperator(at(params, i+1)) && Tokens.isNumber(at(params, i+2))) {
                qualities.add(token.getValue()+params.get(i+1).getValue()+params.get(i+2).getValue());
                i += 3;
            } else if (Tokens.isQuantifier(token) && Tokens.isMetaCharacteristic(at(params, i+1))) {
                qualities.add(params.get(i+1).getValue()+Symbols.EQ+token.getValue());
                i += 2;
            } else if (Tokens.isQuality(token)) {
                qualities.add(qualityOf(token));
                ++i;
            } else {
                List<String> words = new ArrayList<String>();
                while (i<params.size() && !isFrom(params.get(i)) && !isListBreak(params, i))
                    words.add(params.get(i++).getValue());
                qualities.add(ActionGrapher.join(words, "_"));
            }
            while (isListBreak(params, i))
                ++i;
        }
        if (qualities.isEmpty()) {
            if (!template.isOptional())
                throw unfit(template, params);
        } else if (qualities.size()==1)
            tree.addAttr(id, "quality", qualities.get(0));
        else {
            Map<String, String> attrs = new LinkedHashMap<String, String>();
            attrs.put("coordinator", "and");
            attrs.put("item_type", "quality");
            String conjunction = tree.addNode(id, "conjunction", attrs);
            for (String quality:qualities)
                tree.addNode(conjunction, "item", ActionGrapher.singleton("quality", quality));
        }
        return i;
    }

    /** a number, or the sunburst standing in for it (modular—sunburst) */
    int number(MTGTree tree, String id, KeywordTemplate template, List<Token> params, int i) throws CatalogException {
        Token token = at(params, i);
        if (Tokens.isNumber(token)) {
            tree.addAttr(id, "n", token.getValue());
            return i+1;
        }
        if (Spans.HYPHEN.matches(token) && Tokens.isKeyword(at(params, i+1))) {
            tree.addAttr(id, "n", params.get(i+1).getValue());
            return i+2;
        }
        throw unfit(template, params);
    }

    int cost(GraphContext ctx, String id, KeywordTemplate template, List<Token> params, int from, int to) throws CatalogException {
        List<Token> cost = TokenLists.sub(params, from, to);
        if (Spans.isEmptySpan(cost))
            throw unfit(template, params);
        ctx.cost(id, cost);
        return to;
    }

    static int expect(KeywordTemplate template, List<Token> params, int i, String preposition) throws CatalogException {
        Token token = at(params, i);
        if (!Tokens.isPreposition(token) || !preposition.equals(token.getValue()))
            throw unfit(template, params);
        return i+1;
    }

    static String qualityOf(Token token) {
        if (Tokens.isObject(token) && token.getTag().hasAttr("characteristics"))
            return token.getTag().getAttr("characteristics");
        return token.getValue();
    }

    static boolean isFrom(Token token) {
        return Tokens.isPreposition(token) && "from".equals(token.getValue());
    }

    static boolean isListBreak(List<Token> params, int i) {
        Token token = at(params, i);
        return token!=null && (Spans.COMMA.matches(token) || token.isWord("and"));
    }

    static Token at(List<Token> tokens, int i) {
        return i>=0 && i<tokens.size()?tokens.get(i):null;
    }

    static CatalogException unfit(KeywordTemplate template, List<Token> params) {
        return new CatalogException("keyword "+template+" does not fit '"+TokenLists.toString(params)+"'");
    }
}
