package org.mtgl.parser;

import java.util.ArrayList;
import java.util.List;

import org.mtgl.common.tag.Symbols;
import org.mtgl.common.tag.TagCode;
import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.TokenPattern;
import org.mtgl.common.tag.Tokens;
import org.mtgl.common.util.TokenLists;

import static org.mtgl.common.tag.TokenPattern.anyOf;
import static org.mtgl.common.tag.TokenPattern.text;
import static org.mtgl.common.tag.TokenPattern.word;

/**
 * Joins coordinated zones: "graveyard and library", "hand and/or library",
 * "hand, library, and graveyard".
 */
public class ZoneChainer extends ResolverPass {

    static final TokenPattern AND_OR = anyOf(word("and"), TokenPattern.tag(TagCode.OPERATOR, Symbols.AOR));

    @Override
    public List<Token> apply(List<Token> olds) {
        List<Token> news = new ArrayList<Token>(olds.size());
        for (int i=0; i<olds.size(); ++i) {
            Token tkn = olds.get(i);
            if (Tokens.isZone(tkn)) {
                if (TokenLists.matchesAt(olds, i+1, AND_OR, TokenPattern.ZONE)) {
                    String op = olds.get(i+1).isWord("and")?Symbols.AND:Symbols.AOR;
                    news.add(token(TagCode.ZONE, tkn.getValue()+op+olds.get(i+2).getValue()));
                    i += 2;
                    continue;
                }
                if (TokenLists.matchesAt(olds, i+1, text(Symbols.CMA), TokenPattern.ZONE, text(Symbols.CMA),
                        word("and"), TokenPattern.ZONE)) {
                    news.add(token(TagCode.ZONE, tkn.getValue()+Symbols.AND+olds.get(i+2).getValue()
                            +Symbols.AND+olds.get(i+5).getValue()));
                    i += 5;
                    continue;
                }
            }
            news.add(tkn);
        }
        return news;
    }
}
