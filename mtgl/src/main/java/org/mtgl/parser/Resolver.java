package org.mtgl.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.mtgl.common.tag.Token;
import org.mtgl.common.util.TokenLists;
import org.mtgl.grammar.GrammarCatalog;

/**
 * Runs the contextual passes over each tokenized line, in order: rectify,
 * chain, chain zones, group, add hanging, merge possessive. Lines mentioning
 * the draft only matter during a draft and are dropped.
 */
public class Resolver {

    private static Logger logger = Logger.getLogger(Resolver.class.getPackage().getName());

    final List<ResolverPass> passes;

    public Resolver(GrammarCatalog catalog) {
        passes = Collections.unmodifiableList(Arrays.asList(
                new Rectifier(),
                new Chainer(catalog),
                new ZoneChainer(),
                new Grouper(),
                new HangingAttacher(),
                new PossessiveMerger()));
    }

    public List<ResolverPass> getPasses() {
        return passes;
    }

    public List<Token> resolve(List<Token> line) {
        List<Token> tokens = line;
        for (ResolverPass pass:passes) {
            tokens = pass.apply(tokens);
            if (logger.isLoggable(Level.FINEST))
                logger.finest(pass.getName()+": "+TokenLists.toString(tokens));
        }
        return tokens;
    }

    public List<List<Token>> resolveAll(List<List<Token>> lines) {
        List<List<Token>> resolved = new ArrayList<List<Token>>(lines.size());
        for (List<Token> line:lines) {
            if (mentionsDraft(line)) {
                logger.fine("dropping draft line: "+TokenLists.toString(line));
                continue;
            }
            resolved.add(resolve(line));
        }
        return resolved;
    }

    static boolean mentionsDraft(List<Token> line) {
        for (Token token:line)
            if (!token.isTag() && token.getText().startsWith("draft"))
                return true;
        return false;
    }
}
