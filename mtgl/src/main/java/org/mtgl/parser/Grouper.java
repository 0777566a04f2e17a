package org.mtgl.parser;

import java.util.ArrayList;
import java.util.List;

import org.mtgl.common.tag.Symbols;
import org.mtgl.common.tag.Tag;
import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.Tokens;

/**
 * Attaches the number, quantifiers and statuses preceding a thing to it:
 * "target tapped creature", "each opponent", "two cards".
 */
public class Grouper extends ResolverPass {

    @Override
    public List<Token> apply(List<Token> olds) {
        List<Token> news = new ArrayList<Token>(olds.size());
        for (Token tkn:olds) {
            if (!Tokens.isThing(tkn)) {
                news.add(tkn);
                continue;
            }
            List<String> quantifiers = new ArrayList<String>();
            List<String> statuses = new ArrayList<String>();
            String statusOp = Symbols.AND;
            String number = null;
            while (!news.isEmpty()) {
                Token prev = last(news);
                if (Tokens.isNumber(prev)) {
                    number = pop(news).getValue();
                } else if (prev.isWord("a")) {
                    quantifiers.add(0, pop(news).getText());
                } else if (Tokens.isQuantifier(prev)) {
                    quantifiers.add(0, pop(news).getValue());
                } else if (Tokens.isState(prev)) {
                    statuses.add(0, pop(news).getValue());
                    while (!news.isEmpty()) {
                        if (Tokens.isState(last(news))) {
                            statuses.add(0, pop(news).getValue());
                        } else if (last(news).isWord("or") && Tokens.isState(at(news, news.size()-2))) {
                            pop(news);
                            statusOp = Symbols.OR;
                        } else if (last(news).isWord("and") && Tokens.isState(at(news, news.size()-2))) {
                            pop(news);
                        } else
                            break;
                    }
                } else
                    break;
            }

            if (quantifiers.isEmpty() && statuses.isEmpty() && number==null) {
                news.add(tkn);
                continue;
            }
            Tag tag = tkn.getTag();
            if (!quantifiers.isEmpty())
                tag = tag.withJoinedAttr("quantifier", join(quantifiers, Symbols.AND), Symbols.AND);
            if (!statuses.isEmpty())
                tag = tag.withJoinedAttr("status", join(statuses, statusOp), Symbols.AND);
            if (number!=null)
                tag = tag.withAttr("num", number);
            news.add(Token.of(tag));
        }
        return news;
    }

    static String join(List<String> values, String op) {
        StringBuilder builder = new StringBuilder();
        for (String value:values) {
            if (builder.length()>0)
                builder.append(op);
            builder.append(value);
        }
        return builder.toString();
    }
}
