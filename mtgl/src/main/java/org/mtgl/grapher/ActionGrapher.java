package org.mtgl.grapher;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.mtgl.common.tag.Symbols;
import org.mtgl.common.tag.TagCode;
import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.Tokens;
import org.mtgl.common.tree.MTGTree;
import org.mtgl.common.util.TokenLists;
import org.mtgl.grammar.ActionShape;
import org.mtgl.grammar.GrammarCatalog;

/**
 * Graphs an action and the parameters after it. The catalog maps the
 * action to an {@link ActionShape}; actions it does not know keep their
 * parameter text in an act-parameter leaf.
 */
class ActionGrapher {

    final GrammarCatalog catalog;
    final ThingGrapher things;

    ActionGrapher(GrammarCatalog catalog, ThingGrapher things) {
        this.catalog = catalog;
        this.things = things;
    }

    /**
     * Graphs the action at tokens[start] under parent.
     * @param subject unrooted node acting as the subject, or null
     * @param modifiers conditional words between subject and action (may, cannot), or null
     * @return the number of tokens taken, the action included
     */
    int graph(MTGTree tree, String parent, String subject, List<Token> modifiers, List<Token> tokens, int start) {
        Token action = tokens.get(start);
        Map<String, String> attrs = new LinkedHashMap<String, String>();
        attrs.put("value", action.getValue());
        attrs.putAll(action.getTag().getAttrs());
        if (modifiers!=null && !modifiers.isEmpty())
            attrs.put("modifier", joinValues(modifiers));
        String id = tree.addNode(parent,
                action.is(TagCode.KEYWORD_ACTION)?"keyword-action":"lituus-action", attrs);
        if (subject!=null) {
            tree.addAttr(subject, "role", "subject");
            tree.attach(id, subject);
        }

        ActionShape shape = catalog.actionShape(action.getValue());
        int i = start+1;
        if (shape==null) {
            int end = parameterEnd(tokens, i);
            if (end>i)
                tree.addNode(id, "act-parameter", singleton(ClauseGrapher.TOKENS,
                        TokenLists.toString(TokenLists.sub(tokens, i, end))));
            return end-start;
        }

        switch (shape) {
        case NONE:
            break;
        case COUNT:
            if (Tokens.isNumber(at(tokens, i)))
                tree.addAttr(id, "n", tokens.get(i++).getValue());
            break;
        case CANDIDATES:
            i = candidates(tree, id, tokens, i);
            break;
        case MANA:
            i = mana(tree, id, tokens, i);
            break;
        case SUBJECT_ZONE:
            i = parameters(tree, id, tokens, i, "zone");
            break;
        default:
            i = parameters(tree, id, tokens, i, "object");
        }
        return i-start;
    }

    /**
     * Walks things, prepositions, numbers, attributes and mana until a token
     * that cannot be a parameter. A preposition names the role of the thing
     * after it.
     */
    int parameters(MTGTree tree, String action, List<Token> tokens, int start, String defaultRole) {
        String role = defaultRole;
        int i = start;
        while (i<tokens.size()) {
            Token token = tokens.get(i);
            if (Tokens.isPreposition(token) || token.isWord("among")) {
                if (i+1>=tokens.size() || isStop(tokens.get(i+1)))
                    break;
                role = token.getValue();
                ++i;
            } else if (Tokens.isOperator(token)) {
                role = token.getValue();
                ++i;
            } else if (Tokens.isThing(token)) {
                ThingGrapher.Collated thing = things.collate(tree, tokens, i);
                tree.addAttr(thing.id, "role", role);
                tree.attach(action, thing.id);
                role = defaultRole;
                i += thing.length;
            } else if (Tokens.isMetaCharacteristic(token)) {
                ThingGrapher.Collated attribute = things.attribute(tree, tokens, i);
                tree.addAttr(attribute.id, "role", role);
                tree.attach(action, attribute.id);
                role = defaultRole;
                i += attribute.length;
            } else if (Tokens.isProperty(token)) {
                Map<String, String> attrs = new LinkedHashMap<String, String>();
                attrs.put("name", token.getValue());
                attrs.putAll(token.getTag().getAttrs());
                attrs.put("role", role);
                tree.addNode(action, "attribute", attrs);
                role = defaultRole;
                ++i;
            } else if (Tokens.isNumber(token) && tree.attr(action, "n")==null) {
                tree.addAttr(action, "n", token.getValue());
                ++i;
            } else if (Tokens.isManaString(token)) {
                tree.addNode(action, "mana", singleton("value", token.getText()));
                ++i;
            } else
                break;
        }
        return i;
    }

    /** vote for A or B */
    int candidates(MTGTree tree, String action, List<Token> tokens, int start) {
        int i = start;
        if (!Tokens.isPreposition(at(tokens, i)) || !"for".equals(tokens.get(i).getValue()))
            return i;
        List<Token> names = new ArrayList<Token>();
        for (++i; i<tokens.size() && !isStop(tokens.get(i)); ++i)
            if (!tokens.get(i).isWord("or"))
                names.add(tokens.get(i));
        if (!names.isEmpty()) {
            List<String> values = new ArrayList<String>();
            for (Token name:names)
                values.add(name.getValue());
            tree.addAttr(action, "candidates", join(values, Symbols.OR));
        }
        return i;
    }

    /** add {G}, add {R} or {G}, or a description of the mana */
    int mana(MTGTree tree, String action, List<Token> tokens, int start) {
        List<String> symbols = new ArrayList<String>();
        boolean or = false;
        int i = start;
        for (; i<tokens.size(); ++i) {
            Token token = tokens.get(i);
            if (Tokens.isManaString(token))
                symbols.add(token.getText());
            else if (token.isWord("or") && !symbols.isEmpty())
                or = true;
            else if (!(token.isWord(Symbols.CMA) && Tokens.isManaString(at(tokens, i+1))))
                break;
        }
        if (symbols.isEmpty()) {
            int end = parameterEnd(tokens, start);
            if (end>start)
                tree.addNode(action, "act-parameter", singleton(ClauseGrapher.TOKENS,
                        TokenLists.toString(TokenLists.sub(tokens, start, end))));
            return end;
        }
        String parent = action;
        if (symbols.size()>1) {
            Map<String, String> attrs = new LinkedHashMap<String, String>();
            attrs.put("coordinator", or?"or":"and");
            attrs.put("item_type", "mana");
            parent = tree.addNode(action, "conjunction", attrs);
        }
        for (String symbol:symbols)
            tree.addNode(parent, "mana", singleton("value", symbol));
        return i;
    }

    /** the end of an unmapped action's parameters: the next punctuation, action or conditional */
    static int parameterEnd(List<Token> tokens, int start) {
        boolean[] quoted = Spans.quoted(tokens);
        int i = start;
        while (i<tokens.size() && (quoted[i] || !isStop(tokens.get(i))))
            ++i;
        return i;
    }

    static boolean isStop(Token token) {
        return token.isPunctuation() || Tokens.isAction(token) || Tokens.isConditional(token)
                || Tokens.isSequence(token) || Tokens.isTriggerPreamble(token)
                || token.isWord("and") || token.isWord("or") || token.isWord("then");
    }

    static Token at(List<Token> tokens, int i) {
        return i>=0 && i<tokens.size()?tokens.get(i):null;
    }

    static Map<String, String> singleton(String key, String value) {
        Map<String, String> attrs = new LinkedHashMap<String, String>();
        attrs.put(key, value);
        return attrs;
    }

    static String joinValues(List<Token> tokens) {
        List<String> values = new ArrayList<String>();
        for (Token token:tokens)
            values.add(token.getValue());
        return join(values, " ");
    }

    static String join(List<String> values, String separator) {
        StringBuilder builder = new StringBuilder();
        for (String value:values) {
            if (builder.length()>0)
                builder.append(separator);
            builder.append(value);
        }
        return builder.toString();
    }
}
