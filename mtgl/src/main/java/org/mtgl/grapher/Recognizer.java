package org.mtgl.grapher;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.mtgl.common.tag.TagFormatException;
import org.mtgl.common.tag.Token;
import org.mtgl.common.util.TokenLists;
import org.mtgl.grammar.CatalogException;

/**
 * One construct of the grammar. Recognition happens in two steps: match
 * inspects the span without touching the tree, build creates the nodes. A
 * span that does not have the construct's shape yields no match and leaves
 * the tree as it was.
 *
 * @param <M> what match extracts for build
 */
public abstract class Recognizer<M> {

    private static Logger logger = Logger.getLogger(Recognizer.class.getPackage().getName());

    /**
     * @return the extracted parts, or null if tokens do not have this shape
     * @throws TagFormatException if a token's tag cannot be read, treated as no match
     */
    abstract M match(GraphContext ctx, List<Token> tokens) throws TagFormatException;

    /**
     * @return the id of the node created under parent
     */
    abstract String build(GraphContext ctx, String parent, M match) throws CatalogException;

    /** whether the construct may cover more than one sentence */
    boolean spansSentences() {
        return false;
    }

    public String getName() {
        return getClass().getSimpleName();
    }

    /**
     * @return the new node's id, or null if the span is not this construct
     */
    public String recognize(GraphContext ctx, String parent, List<Token> tokens) throws CatalogException {
        M match;
        try {
            match = match(ctx, tokens);
        } catch (TagFormatException e) {
            logger.fine(getName()+" declined "+TokenLists.toString(tokens)+": "+e.getMessage());
            return null;
        }
        if (match==null)
            return null;
        if (logger.isLoggable(Level.FINEST))
            logger.finest(getName()+": "+TokenLists.toString(tokens));
        return build(ctx, parent, match);
    }
}
