package org.mtgl.parser;

import java.util.ArrayList;
import java.util.List;

import org.mtgl.common.tag.Symbols;
import org.mtgl.common.tag.Tag;
import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.TokenPattern;
import org.mtgl.common.tag.Tokens;
import org.mtgl.common.util.TokenLists;

/**
 * Folds possession into objects and zones: "creature you control" gets a
 * controller, "cards an opponent owns" an owner, "your graveyard" a player.
 */
public class PossessiveMerger extends ResolverPass {

    static final TokenPattern POSSESSIVE = TokenPattern.POSSESSIVE;

    @Override
    public List<Token> apply(List<Token> olds) {
        List<Token> news = new ArrayList<Token>(olds.size());
        for (int i=0; i<olds.size(); ++i) {
            Token tkn = olds.get(i);
            if (Tokens.isObject(tkn) && TokenLists.matchesAt(olds, i+1, TokenPattern.PLAYER, POSSESSIVE)) {
                Tag player = olds.get(i+1).getTag();
                String possessive = olds.get(i+2).getValue();
                boolean negated = possessive.startsWith(Symbols.NOT);
                String property = possessive.replace(Symbols.NOT, "").equals("control")?"controller":"owner";

                String value;
                if (player.getValue().equals("you")) {
                    value = negated?"opponent":"you";
                } else {
                    value = player.hasAttr("quantifier")?player.getAttr("quantifier")+Symbols.AND+player.getValue():player.getValue();
                    if (player.hasAttr("status"))
                        value = player.getAttr("status")+Symbols.AND+value;
                }
                news.add(Token.of(tkn.getTag().withAttr(property, value)));
                i += 2;
                continue;
            }
            if (Tokens.isPlayer(tkn) && Tokens.isZone(at(olds, i+1))) {
                Tag player = tkn.getTag();
                String value = player.hasAttr("quantifier")?player.getAttr("quantifier")+Symbols.AND+player.getValue():player.getValue();
                if (player.hasAttr("of"))
                    value = player.getAttr("of")+Symbols.ARW+value;
                news.add(Token.of(olds.get(i+1).getTag().withAttr("player", value)));
                ++i;
                continue;
            }
            news.add(tkn);
        }
        return news;
    }
}
