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
import org.mtgl.grammar.GrammarCatalog;

import static org.mtgl.common.tag.TokenPattern.word;

/**
 * Folds runs of characteristics into the object they describe, creating the
 * implied object (permanent or card) when none follows. Characteristics in
 * a run are either all and'ed or all or'ed: "or" and a comma followed by an
 * or'ed list make the run an or, "and" continues it only in front of another
 * property, anything else closes it.
 */
public class Chainer extends ResolverPass {

    static final String CHARACTERISTICS = "characteristics";
    static final String META = "meta";
    static final String POWER_TOUGHNESS = "p/t";

    final GrammarCatalog catalog;

    public Chainer(GrammarCatalog catalog) {
        this.catalog = catalog;
    }

    /** the open run of characteristics */
    class Chain {
        List<String> characteristics = new ArrayList<String>();
        String pt = null;
        String op = Symbols.AND;

        boolean isOpen() {
            return !characteristics.isEmpty();
        }

        Token close() {
            Map<String, String> attrs = new LinkedHashMap<String, String>();
            attrs.put(CHARACTERISTICS, join());
            if (pt!=null)
                attrs.put(META, POWER_TOUGHNESS+Symbols.EQ+pt);
            Token implied = token(TagCode.OBJECT, impliedObject(characteristics), attrs);
            reset();
            return implied;
        }

        Token absorbInto(Token object) {
            Tag tag = object.getTag().withJoinedAttr(CHARACTERISTICS, join(), Symbols.AND);
            if (pt!=null)
                tag = tag.withJoinedAttr(META, POWER_TOUGHNESS+Symbols.EQ+pt, Symbols.AND);
            reset();
            return Token.of(tag);
        }

        String join() {
            StringBuilder builder = new StringBuilder();
            for (String characteristic:characteristics) {
                if (builder.length()>0)
                    builder.append(op);
                builder.append(characteristic);
            }
            return builder.toString();
        }

        void reset() {
            characteristics.clear();
            pt = null;
            op = Symbols.AND;
        }
    }

    @Override
    public List<Token> apply(List<Token> olds) {
        List<Token> news = new ArrayList<Token>(olds.size());
        Chain chain = new Chain();

        for (int i=0; i<olds.size(); ++i) {
            Token tkn = olds.get(i);
            if (Tokens.isCharacteristic(tkn)) {
                if (!Tokens.isMetaCharacteristic(tkn))
                    chain.characteristics.add(tkn.getValue());
                else if (tkn.getValue().equals(POWER_TOUGHNESS) && !news.isEmpty()
                        && !Tokens.isLituusAction(last(news)) && Tokens.isCharacteristic(at(olds, i+1))
                        && !Tokens.isMetaCharacteristic(at(olds, i+1))) {
                    // the p/t of a token about to be described: 2/2 black Zombie
                    chain.pt = tkn.getTag().getAttr("val");
                } else {
                    if (chain.isOpen())
                        news.add(chain.close());
                    news.add(tkn);
                }
            } else if (!chain.isOpen()) {
                news.add(tkn);
            } else if (tkn.isWord(Symbols.CMA)) {
                String op = commaReadAhead(olds, i+1);
                if (op.equals(Symbols.OR))
                    chain.op = Symbols.OR;
                else {
                    news.add(chain.close());
                    news.add(tkn);
                }
            } else if (tkn.isWord("or")) {
                chain.op = Symbols.OR;
            } else if (tkn.isWord("and")) {
                if (Tokens.isProperty(at(olds, i+1)))
                    chain.op = Symbols.AND;
                else {
                    news.add(chain.close());
                    news.add(tkn);
                }
            } else if (Tokens.isObject(tkn)) {
                news.add(chain.absorbInto(tkn));
            } else {
                news.add(chain.close());
                news.add(tkn);
            }
        }
        if (chain.isOpen())
            news.add(chain.close());

        return mergeNamed(news);
    }

    /**
     * Decides what a comma inside a chain means by reading ahead past further
     * commas and characteristics.
     * @return OR for an or'ed list, AND for an and'ed one, CMA otherwise
     */
    static String commaReadAhead(List<Token> tokens, int from) {
        for (int i=from; i<tokens.size(); ++i) {
            Token tkn = tokens.get(i);
            if (tkn.isWord("or")) {
                if (TokenLists.matchesAt(tokens, i+1, TokenPattern.CHARACTERISTIC, TokenPattern.OBJECT))
                    return Symbols.OR;
                return Symbols.CMA;
            }
            if (tkn.isWord("and"))
                return Symbols.AND;
            if (tkn.isWord(Symbols.CMA))
                continue;
            if (!Tokens.isCharacteristic(tkn))
                return Symbols.CMA;
        }
        return Symbols.CMA;
    }

    /**
     * A type or subtype without card, spell or source means a permanent.
     */
    String impliedObject(List<String> characteristics) {
        for (String characteristic:characteristics)
            if (catalog.isTypeOrSubtype(characteristic.replace(Symbols.NOT, "")))
                return "permanent";
        return "card";
    }

    /**
     * "creature named ob&lt;card ref=...&gt;" becomes the referenced object
     * carrying the first object's characteristics.
     */
    static List<Token> mergeNamed(List<Token> tokens) {
        List<Token> merged = new ArrayList<Token>(tokens);
        int i = 0;
        while ((i=TokenLists.match(merged, i, TokenPattern.OBJECT, word("named"), TokenPattern.OBJECT))>=0) {
            Tag first = merged.get(i).getTag();
            Tag named = merged.get(i+2).getTag();
            if (!named.hasAttr("ref")) {
                ++i;
                continue;
            }
            Map<String, String> attrs = new LinkedHashMap<String, String>(named.getAttrs());
            String characteristics = first.getAttr(CHARACTERISTICS);
            if (characteristics!=null)
                attrs.put(CHARACTERISTICS, attrs.containsKey(CHARACTERISTICS)
                        ?attrs.get(CHARACTERISTICS)+Symbols.AND+characteristics:characteristics);
            merged.set(i, token(first.getCode(), first.getValue(), attrs));
            merged.remove(i+2);
            merged.remove(i+1);
        }
        return merged;
    }
}
