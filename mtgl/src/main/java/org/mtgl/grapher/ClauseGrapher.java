package org.mtgl.grapher;

import java.util.ArrayList;
import java.util.List;

import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.Tokens;
import org.mtgl.common.tree.MTGTree;
import org.mtgl.common.util.TokenLists;
import org.mtgl.grammar.CatalogException;

/**
 * The end of every recursion: graphs a single clause left to right. Things
 * and attributes become nodes, a thing directly before an action becomes its
 * subject, quoted text is graphed as an ability of its own, and the words
 * in between are kept as token runs. A clause with no structure at all is
 * a single leaf holding its text.
 */
class ClauseGrapher {

    public static final String TOKENS = "tokens";

    String graph(GraphContext ctx, String parent, List<Token> tokens) throws CatalogException {
        MTGTree tree = ctx.tree;
        List<Token> body = Spans.stripPeriod(tokens);
        String clause = tree.addNode(parent, "clause");

        List<Token> pending = new ArrayList<Token>();
        String subject = null;
        int i = 0;
        while (i<body.size()) {
            Token token = body.get(i);
            if (Spans.QUOTE.matches(token)) {
                int close = TokenLists.indexOf(body, Spans.QUOTE, i+1);
                if (close<0) {
                    pending.add(token);
                    ++i;
                    continue;
                }
                subject = flush(tree, clause, subject, pending);
                quoted(ctx, clause, TokenLists.sub(body, i+1, close));
                i = close+1;
            } else if (Tokens.isAction(token)) {
                List<Token> modifiers = null;
                if (subject!=null && isModifierRun(pending)) {
                    modifiers = new ArrayList<Token>(pending);
                    pending.clear();
                } else
                    subject = flush(tree, clause, subject, pending);
                i += ctx.actions().graph(tree, clause, subject, modifiers, body, i);
                subject = null;
            } else if (Tokens.isThing(token)) {
                subject = flush(tree, clause, subject, pending);
                ThingGrapher.Collated thing = ctx.things().collate(tree, body, i);
                subject = thing.id;
                i += thing.length;
            } else if (Tokens.isMetaCharacteristic(token)) {
                subject = flush(tree, clause, subject, pending);
                ThingGrapher.Collated attribute = ctx.things().attribute(tree, body, i);
                subject = attribute.id;
                i += attribute.length;
            } else if (Tokens.isManaString(token)) {
                subject = flush(tree, clause, subject, pending);
                tree.addNode(clause, "mana", ActionGrapher.singleton("value", token.getText()));
                ++i;
            } else if (token.isPunctuation()) {
                subject = flush(tree, clause, subject, pending);
                tree.addNode(clause, "punctuation", ActionGrapher.singleton("symbol", token.getText()));
                ++i;
            } else if (isModifier(token) && subject!=null) {
                pending.add(token);
                ++i;
            } else {
                subject = flush(tree, clause, subject, pending);
                pending.add(token);
                ++i;
            }
        }
        flush(tree, clause, subject, pending);

        // nothing recognized: the clause is a leaf with its text
        List<String> children = tree.children(clause);
        if (children.size()==1 && "clause".equals(tree.type(children.get(0)))
                && tree.attr(children.get(0), TOKENS)!=null) {
            String text = tree.attr(children.get(0), TOKENS);
            tree.deleteNode(children.get(0));
            tree.addAttr(clause, TOKENS, text);
        }
        return clause;
    }

    /**
     * Quoted text is an ability granted by the clause. It is graphed into an
     * unrooted node first and hung from a placeholder that refers to it.
     */
    void quoted(GraphContext ctx, String clause, List<Token> tokens) throws CatalogException {
        MTGTree tree = ctx.tree;
        String ability = tree.addUnrootedNode("quoted-ability");
        if (!tokens.isEmpty())
            ctx.grapher.graphLine(ctx, ability, tokens);
        String placeholder = tree.addNode(clause, "clause", ActionGrapher.singleton("ref", ability));
        tree.attach(placeholder, ability);
    }

    /**
     * Hangs a waiting subject, then the pending words, from the clause.
     * @return null, the subject is consumed
     */
    static String flush(MTGTree tree, String clause, String subject, List<Token> pending) {
        if (subject!=null)
            tree.attach(clause, subject);
        if (!pending.isEmpty()) {
            tree.addNode(clause, "clause", ActionGrapher.singleton(TOKENS, TokenLists.toString(pending)));
            pending.clear();
        }
        return null;
    }

    /** may, cannot, not and does not between a subject and its action */
    static boolean isModifier(Token token) {
        if (token.isWord("doesnt") || token.isWord("dont") || token.isWord("does") || token.isWord("do"))
            return true;
        if (!Tokens.isConditional(token))
            return false;
        String value = token.getValue();
        return value.equals("may") || value.equals("cannot") || value.equals("not") || value.equals("would");
    }

    static boolean isModifierRun(List<Token> tokens) {
        for (Token token:tokens)
            if (!isModifier(token))
                return false;
        return true;
    }
}
