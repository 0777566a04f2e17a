package org.mtgl.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.mtgl.common.tag.Symbols;
import org.mtgl.common.tag.Tag;
import org.mtgl.common.tag.TagCode;
import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.TokenPattern;
import org.mtgl.common.tag.Tokens;
import org.mtgl.common.util.TokenLists;

import static org.mtgl.common.tag.TokenPattern.anyOf;
import static org.mtgl.common.tag.TokenPattern.tag;
import static org.mtgl.common.tag.TokenPattern.word;

/**
 * Fixes tags that can only be decided from context: copy as an action or an
 * object, target as a quantifier, object or action, exile as a zone, counter
 * as an action or a counter. Also merges coordinated bare objects and
 * "N or more" style numbers.
 */
public class Rectifier extends ResolverPass {

    static final TokenPattern IT_OR_THEIR = anyOf(tag(TagCode.LITUUS_OBJECT, "it"), tag(TagCode.PLAYER, "their"));
    static final TokenPattern LESS_OR_MORE = anyOf(word("less"), word("more"), word("greater"));

    @Override
    public List<Token> apply(List<Token> olds) {
        List<Token> tokens = TokenLists.replace(olds,
                Collections.singletonList(token(TagCode.LITUUS_STATUS, "activated"+Symbols.OR+"triggered")),
                tag(TagCode.LITUUS_STATUS, "activated"), word("or"), tag(TagCode.LITUUS_STATUS, "triggered"));

        // its owner, their controller
        int idx;
        while ((idx=TokenLists.match(tokens, IT_OR_THEIR, TokenPattern.PLAYER))>=0) {
            Tag player = tokens.get(idx+1).getTag();
            String of = tokens.get(idx).is(TagCode.LITUUS_OBJECT)?"it":"them";
            tokens.set(idx, Token.of(player.withAttr("of", of)));
            tokens.remove(idx+1);
        }

        List<Token> news = new ArrayList<Token>(tokens.size());
        for (int i=0; i<tokens.size(); ++i) {
            Token tkn = tokens.get(i);

            if (Tokens.isObject(tkn)) {
                // token acts like a characteristic, move it after any that follow
                if (tkn.getValue().replace(Symbols.NOT, "").equals("token") && Tokens.isCharacteristic(at(tokens, i+1))) {
                    int j = i+1;
                    while (j<tokens.size() && Tokens.isCharacteristic(tokens.get(j)))
                        news.add(tokens.get(j++));
                    news.add(tkn);
                    i = j-1;
                    continue;
                }
                // spell or ability
                if (!tkn.getTag().hasAttrs() && TokenLists.matchesAt(tokens, i+1, TokenPattern.COORDINATOR, TokenPattern.OBJECT)
                        && !tokens.get(i+2).getTag().hasAttrs()) {
                    news.add(token(TagCode.OBJECT, tkn.getValue()+Tokens.operatorOf(tokens.get(i+1))+tokens.get(i+2).getValue()));
                    i += 2;
                    continue;
                }
            }

            if (tkn.is(TagCode.OBJECT, "copy") && !tkn.getTag().hasAttrs()) {
                news.add(copy(tokens, i, news));
                continue;
            }
            if (tkn.is(TagCode.QUANTIFIER, "target")) {
                news.add(target(tkn, news));
                continue;
            }
            if (tkn.is(TagCode.KEYWORD_ACTION, "exile")) {
                news.add(Tokens.isPreposition(last(news))?token(TagCode.ZONE, "exile"):tkn);
                continue;
            }
            if (tkn.is(TagCode.KEYWORD_ACTION, "counter")) {
                news.add(counter(tkn, tokens, i, news));
                continue;
            }
            if (tkn.is(TagCode.KEYWORD_ACTION, "vote")) {
                Token prev = last(news);
                if (prev!=null && (prev.isWord("most") || prev.isWord("more"))
                        || TokenLists.matchesAt(tokens, i+1, word("is"), word("tied")))
                    news.add(Token.word("vote"));
                else
                    news.add(tkn);
                continue;
            }
            if (tkn.is(TagCode.LITUUS_STATUS, "activated") || tkn.is(TagCode.LITUUS_STATUS, "triggered")) {
                if (Tokens.isObject(at(tokens, i+1)))
                    news.add(tkn);
                else if (tkn.getValue().equals("activated"))
                    news.add(token(TagCode.KEYWORD_ACTION, "activate"));
                else
                    news.add(token(TagCode.LITUUS_ACTION, "trigger"));
                continue;
            }
            if (Tokens.isNumber(tkn) && TokenLists.matchesAt(tokens, i+1, word("or"), LESS_OR_MORE)) {
                String op = tokens.get(i+2).isWord("less")?Symbols.LE:Symbols.GE;
                news.add(token(TagCode.NUMBER, op+tkn.getValue()));
                i += 2;
                continue;
            }
            news.add(tkn);
        }
        return news;
    }

    /**
     * copy is an action when it takes an object, else the object a copy.
     */
    static Token copy(List<Token> tokens, int i, List<Token> news) {
        Token action = token(TagCode.LITUUS_ACTION, "copy");
        if (TokenLists.matchesAt(tokens, i+1, TokenPattern.QUANTIFIER, TokenPattern.OBJECT)
                || TokenLists.matchesAt(tokens, i+1, TokenPattern.QUANTIFIER, TokenPattern.CHARACTERISTIC)
                || TokenLists.matchesAt(tokens, i+1, tag(TagCode.LITUUS_OBJECT, "it")))
            return action;
        if (TokenLists.endsWith(news, tag(TagCode.PLAYER, "you"), tag(TagCode.CONDITIONAL, "may"))
                || TokenLists.endsWith(news, tag(TagCode.OBJECT, "spell"), TokenPattern.text(Symbols.CMA)))
            return action;
        Token next = at(tokens, i+2);
        if (TokenLists.matchesAt(tokens, i+1, word("the"), TokenPattern.OBJECT) && next.getValue().equals("spell"))
            return action;
        return tokens.get(i);
    }

    /**
     * target is an object in "cannot be the target of", an action after
     * "that", "could" or "copy" and a quantifier otherwise.
     */
    static Token target(Token tkn, List<Token> news) {
        if (TokenLists.endsWith(news, tag(TagCode.CONDITIONAL, "cannot"), word("be"), word("the"))
                || TokenLists.endsWith(news, anyOf(word("becomes"), word("change")), word("the"))
                || TokenLists.endsWith(news, tag(TagCode.PREPOSITION, "with"), word("a"), tag(TagCode.QUALIFIER, "single"))
                || TokenLists.endsWith(news, tag(TagCode.QUALIFIER, "new")))
            return token(TagCode.LITUUS_OBJECT, "target");
        if (TokenLists.endsWith(news, anyOf(tag(TagCode.QUANTIFIER, "that"), word("could"), tag(TagCode.OBJECT, "copy"))))
            return token(TagCode.LITUUS_ACTION, "target");
        return tkn;
    }

    /**
     * counter the spell, cannot be countered: the action. Otherwise a counter
     * placed on a permanent.
     */
    static Token counter(Token tkn, List<Token> tokens, int i, List<Token> news) {
        Token next = at(tokens, i+1);
        if (Tokens.isQuantifier(next)
                || (Tokens.isThing(next) && (next.getTag().hasAttr("quantifier") || next.is(TagCode.LITUUS_OBJECT, "it")))
                || TokenLists.endsWith(news, tag(TagCode.CONDITIONAL, "cannot"), word("be")))
            return tkn;
        return token(TagCode.LITUUS_OBJECT, "ctr");
    }
}
