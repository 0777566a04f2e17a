package org.mtgl.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.mtgl.common.tag.Symbols;
import org.mtgl.common.tag.Tag;
import org.mtgl.common.tag.TagCode;
import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.TokenPattern;
import org.mtgl.common.tag.Tokens;
import org.mtgl.common.util.TokenLists;

import static org.mtgl.common.tag.TokenPattern.tag;
import static org.mtgl.common.tag.TokenPattern.word;

/**
 * Attaches what hangs after an object: "with flying", "without flying",
 * "with power 2 or less", trailing statuses, "in exile", and folds
 * "your devotion to black" into the player.
 */
public class HangingAttacher extends ResolverPass {

    @Override
    public List<Token> apply(List<Token> olds) {
        List<Token> news = new ArrayList<Token>(olds.size());
        for (int i=0; i<olds.size(); ++i) {
            Token tkn = olds.get(i);
            Token prev = last(news);

            if ((tkn.is(TagCode.PREPOSITION, "with") || tkn.is(TagCode.PREPOSITION, "without")) && Tokens.isObject(prev)) {
                Tag object = prev.getTag();
                String neg = tkn.getValue().equals("with")?"":Symbols.NOT;
                if (TokenLists.matchesAt(olds, i+1, TokenPattern.KEYWORD, word("and"), TokenPattern.KEYWORD)) {
                    String meta = neg+olds.get(i+1).getValue()+Symbols.AND+neg+olds.get(i+3).getValue();
                    news.set(news.size()-1, Token.of(object.withJoinedAttr("meta", meta, Symbols.AND)));
                    i += 3;
                    continue;
                }
                if (TokenLists.matchesAt(olds, i+1, TokenPattern.KEYWORD)) {
                    news.set(news.size()-1, Token.of(object.withJoinedAttr("meta", neg+olds.get(i+1).getValue(), Symbols.AND)));
                    i += 1;
                    continue;
                }
                if (TokenLists.matchesAt(olds, i+1, TokenPattern.META_CHARACTERISTIC, TokenPattern.OPERATOR, TokenPattern.NUMBER)) {
                    String meta = olds.get(i+1).getValue()+olds.get(i+2).getValue()+olds.get(i+3).getValue();
                    news.set(news.size()-1, Token.of(object.withJoinedAttr("meta", meta, Symbols.AND)));
                    i += 3;
                    continue;
                }
            } else if (Tokens.isState(tkn) && Tokens.isObject(prev)) {
                List<String> statuses = new ArrayList<String>();
                statuses.add(tkn.getValue());
                String op = Symbols.AND;
                int j = i+1;
                while (j<olds.size()) {
                    Token next = olds.get(j);
                    if (Tokens.isState(next))
                        statuses.add(next.getValue());
                    else if (next.isWord("or") && Tokens.isState(at(olds, j+1)))
                        op = Symbols.OR;
                    else if (!(next.isWord("and") && Tokens.isState(at(olds, j+1))))
                        break;
                    ++j;
                }
                news.set(news.size()-1, Token.of(prev.getTag().withJoinedAttr("status", Grouper.join(statuses, op), Symbols.AND)));
                i = j-1;
                continue;
            } else if (tkn.is(TagCode.LITUUS_CHARACTERISTIC, "devotion") && Tokens.isPlayer(prev)
                    && TokenLists.matchesAt(olds, i+1, tag(TagCode.PREPOSITION, "to"), TokenPattern.OBJECT)) {
                String colors = olds.get(i+2).getTag().getAttr("characteristics");
                if (colors!=null) {
                    news.set(news.size()-1, Token.of(prev.getTag().withAttr("devotion", colors)));
                    i += 2;
                    continue;
                }
            } else if (Tokens.isZone(tkn) && news.size()>=2 && prev.is(TagCode.PREPOSITION, "in")
                    && Tokens.isObject(at(news, news.size()-2))) {
                Tag zone = tkn.getTag();
                String owner = zone.hasAttr("quantifier")?zone.getAttr("quantifier"):zone.getAttr("player");
                pop(news);
                Tag object = pop(news).getTag();
                Map<String, String> attrs = new LinkedHashMap<String, String>(object.getAttrs());
                attrs.put("zone", owner==null?zone.getValue():zone.getValue()+Symbols.ARW+owner);
                news.add(token(object.getCode(), object.getValue(), attrs));
                continue;
            }
            news.add(tkn);
        }
        return news;
    }
}
