package org.mtgl.grapher;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.mtgl.common.tag.Tag;
import org.mtgl.common.tag.TagCode;
import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.TokenPattern;
import org.mtgl.common.tag.Tokens;
import org.mtgl.common.tree.MTGTree;
import org.mtgl.common.util.TokenLists;

/**
 * Graphs references to things and their attributes. Nodes are created
 * unrooted; the caller decides where they hang.
 */
class ThingGrapher {

    static final TokenPattern COMMA = Spans.COMMA;

    static final TokenPattern[] QUAD_CHAIN = {
        TokenPattern.OBJECT, COMMA, TokenPattern.OBJECT, COMMA, TokenPattern.OBJECT, COMMA,
        TokenPattern.COORDINATOR, TokenPattern.OBJECT};
    static final TokenPattern[] TRI_CHAIN = {
        TokenPattern.OBJECT, COMMA, TokenPattern.OBJECT, COMMA, TokenPattern.COORDINATOR, TokenPattern.OBJECT};
    static final TokenPattern[] BI_CHAIN = {
        TokenPattern.THING, TokenPattern.COORDINATOR, TokenPattern.THING};

    static final String[] POSSESSORS = {"owner", "controller"};

    /** An unrooted node and the number of tokens it took. */
    static final class Collated {
        final String id;
        final int length;

        Collated(String id, int length) {
            this.id = id;
            this.length = length;
        }
    }

    /**
     * @return the length of the comma separated list of things ("A, B, and
     * C") starting at tokens[start], or 0 if none starts there
     */
    static int chainLength(List<Token> tokens, int start) {
        if (TokenLists.matchesAt(tokens, start, QUAD_CHAIN))
            return QUAD_CHAIN.length;
        if (TokenLists.matchesAt(tokens, start, TRI_CHAIN))
            return TRI_CHAIN.length;
        return 0;
    }

    /**
     * Collects the thing, or the chain of things, starting at tokens[start].
     * @return the unrooted node, or null if no thing starts there
     */
    Collated collate(MTGTree tree, List<Token> tokens, int start) {
        int chain = chainLength(tokens, start);
        if (chain==QUAD_CHAIN.length) {
            Token[] items = {tokens.get(start), tokens.get(start+2), tokens.get(start+4), tokens.get(start+7)};
            return new Collated(conjoin(tree, items, tokens.get(start+6)), QUAD_CHAIN.length);
        }
        if (chain==TRI_CHAIN.length) {
            Token[] items = {tokens.get(start), tokens.get(start+2), tokens.get(start+5)};
            return new Collated(conjoin(tree, items, tokens.get(start+4)), TRI_CHAIN.length);
        }
        if (TokenLists.matchesAt(tokens, start, BI_CHAIN) && conjoinable(tokens, start+BI_CHAIN.length)) {
            Token[] items = {tokens.get(start), tokens.get(start+2)};
            return new Collated(conjoin(tree, items, tokens.get(start+1)), BI_CHAIN.length);
        }
        Token token = start<tokens.size()?tokens.get(start):null;
        if (!Tokens.isThing(token))
            return null;

        String id = single(tree, token);
        int length = 1;
        Collated attribute = attributeOf(tree, tokens, start+1);
        if (attribute!=null) {
            tree.attach(id, attribute.id);
            length += attribute.length;
        }
        return new Collated(id, length);
    }

    /**
     * A bi-chain is not conjoined when the token after it starts a new
     * construct: an action, a conditional, a negation or a property.
     */
    static boolean conjoinable(List<Token> tokens, int next) {
        if (next>=tokens.size())
            return true;
        Token token = tokens.get(next);
        return !Tokens.isAction(token) && !Tokens.isConditional(token)
                && !token.isWord("doesnt") && !Tokens.isProperty(token);
    }

    /** a thing or a counter */
    String single(MTGTree tree, Token token) {
        Tag tag = token.getTag();
        if (tag.is(TagCode.LITUUS_OBJECT, "ctr")) {
            Map<String, String> attrs = new LinkedHashMap<String, String>(tag.getAttrs());
            return tree.addUnrootedNode("counter", attrs);
        }
        return tree.addUnrootedNode("thing", thingAttrs(tag));
    }

    static Map<String, String> thingAttrs(Tag tag) {
        Map<String, String> attrs = new LinkedHashMap<String, String>();
        attrs.put("code", tag.getCode().getCode());
        attrs.put("value", tag.getValue());
        attrs.putAll(tag.getAttrs());
        return attrs;
    }

    /**
     * Combines things under a conjunction. A quantifier or number on the
     * first thing and an owner or controller on the last apply to them all
     * and move up to the conjunction.
     */
    String conjoin(MTGTree tree, Token[] items, Token coordinator) {
        Map<String, String> attrs = new LinkedHashMap<String, String>();
        attrs.put("coordinator", coordinator.isWord("and")||coordinator.isWord("or")?coordinator.getText():"and/or");
        attrs.put("item_type", "thing");

        List<Tag> tags = new ArrayList<Tag>(items.length);
        for (Token item:items)
            tags.add(item.getTag());

        Tag first = tags.get(0);
        if (first.hasAttr("quantifier"))
            attrs.put("quantifier", first.getAttr("quantifier"));
        if (first.hasAttr("num")) {
            attrs.put("n", first.getAttr("num"));
            tags.set(0, first.withoutAttr("num"));
        }
        Tag last = tags.get(tags.size()-1);
        for (String possessor:POSSESSORS)
            if (last.hasAttr(possessor)) {
                attrs.put(possessor, last.getAttr(possessor));
                tags.set(tags.size()-1, last.withoutAttr(possessor));
                break;
            }

        String id = tree.addUnrootedNode("conjunction", attrs);
        for (Tag tag:tags)
            tree.addNode(id, "item", thingAttrs(tag.withoutAttr("quantifier")));
        return id;
    }

    /**
     * Attributes: "ATTRIBUTE OP NUMBER", "ATTRIBUTE of THING" or a bare
     * attribute.
     * @return the unrooted attribute node, or null if no meta characteristic
     * starts at start
     */
    Collated attribute(MTGTree tree, List<Token> tokens, int start) {
        return metaAttribute(tree, tokens, start, true);
    }

    /** THING's ATTRIBUTE, the possessive already dropped by the tagger */
    Collated attributeOf(MTGTree tree, List<Token> tokens, int start) {
        return metaAttribute(tree, tokens, start, false);
    }

    Collated metaAttribute(MTGTree tree, List<Token> tokens, int start, boolean withOf) {
        Token token = start<tokens.size()?tokens.get(start):null;
        if (!Tokens.isMetaCharacteristic(token))
            return null;
        Map<String, String> attrs = new LinkedHashMap<String, String>();
        attrs.put("name", token.getValue());
        attrs.putAll(token.getTag().getAttrs());
        if (TokenLists.matchesAt(tokens, start+1, TokenPattern.OPERATOR, TokenPattern.NUMBER)) {
            attrs.put("op", tokens.get(start+1).getValue());
            attrs.put("value", tokens.get(start+2).getValue());
            return new Collated(tree.addUnrootedNode("attribute", attrs), 3);
        }
        String id = tree.addUnrootedNode("attribute", attrs);
        if (withOf && start+2<tokens.size() && tokens.get(start+1).isWord("of") && Tokens.isThing(tokens.get(start+2))) {
            Collated of = collate(tree, tokens, start+2);
            tree.attach(id, of.id);
            return new Collated(id, 2+of.length);
        }
        return new Collated(id, 1);
    }
}
