package org.mtgl.grapher;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import org.mtgl.common.tag.Token;
import org.mtgl.common.tree.MTGTree;
import org.mtgl.common.util.TokenLists;
import org.mtgl.grammar.CardType;
import org.mtgl.grammar.CatalogException;
import org.mtgl.grammar.GrammarCatalog;

/**
 * Builds the tree of a document from its resolved token lines.
 * <p>
 * Each line is offered to the line recognizers in order: leveler blocks,
 * activated abilities, triggered abilities, saga chapters, keyword lines and
 * ability word lines. The first that matches builds the line. A line none of
 * them takes becomes a spell ability (instants and sorceries) or a static
 * ability whose text goes through the phrase cascade of {@link PhraseGrapher}.
 * <p>
 * A Grapher holds no per-document state and can be shared between threads.
 */
public class Grapher {

    private static Logger logger = Logger.getLogger(Grapher.class.getPackage().getName());

    public static final String SPELL_ABILITY = "spell-ability";
    public static final String STATIC_ABILITY = "static-ability";

    final GrammarCatalog catalog;
    final List<Recognizer<?>> lineRecognizers;
    final PhraseGrapher phraseGrapher;
    final ClauseGrapher clauseGrapher;
    final CostGrapher costGrapher;
    final ThingGrapher thingGrapher;
    final ActionGrapher actionGrapher;
    final KeywordGrapher keywordGrapher;

    public Grapher(GrammarCatalog catalog) {
        this.catalog = catalog;
        thingGrapher = new ThingGrapher();
        actionGrapher = new ActionGrapher(catalog, thingGrapher);
        clauseGrapher = new ClauseGrapher();
        costGrapher = new CostGrapher();
        keywordGrapher = new KeywordGrapher(catalog);
        phraseGrapher = new PhraseGrapher();
        lineRecognizers = Collections.unmodifiableList(Arrays.<Recognizer<?>>asList(
                new LevelRecognizer(),
                new ActivatedRecognizer(),
                new TriggeredRecognizer(),
                new SagaRecognizer(),
                new KeywordLineRecognizer(),
                new AbilityWordRecognizer()));
    }

    public List<Recognizer<?>> getLineRecognizers() {
        return lineRecognizers;
    }

    public PhraseGrapher getPhraseGrapher() {
        return phraseGrapher;
    }

    /**
     * Graphs every line of a document under the root of a new tree.
     * @param name document name, stored on the root
     * @param lines resolved token lines
     * @param types the card's types, empty if unknown
     * @throws CatalogException if a keyword clause does not fit the catalog,
     * tagged with the document name
     */
    public MTGTree graph(String name, List<List<Token>> lines, Set<CardType> types) throws CatalogException {
        MTGTree tree = new MTGTree();
        if (name!=null)
            tree.addAttr(tree.root(), "name", name);
        GraphContext ctx = new GraphContext(this, tree, name, types);
        try {
            for (List<Token> line:lines)
                if (!line.isEmpty())
                    graphLine(ctx, tree.root(), line);
        } catch (CatalogException e) {
            throw e.setDocument(name);
        }
        return tree;
    }

    /**
     * @return the id of the node representing the line, created under parent
     */
    public String graphLine(GraphContext ctx, String parent, List<Token> line) throws CatalogException {
        String id = recognizeAbility(ctx, parent, line);
        if (id!=null)
            return id;
        String ability = ctx.tree.addNode(parent, ctx.isSpell()?SPELL_ABILITY:STATIC_ABILITY);
        phraseGraph(ctx, ability, line);
        return ability;
    }

    /**
     * Graphs the body of an ability, effect or instruction: a nested ability
     * line when one matches, the phrase cascade otherwise.
     */
    String graphAbility(GraphContext ctx, String parent, List<Token> tokens) throws CatalogException {
        String id = recognizeAbility(ctx, parent, tokens);
        return id!=null?id:phraseGraph(ctx, parent, tokens);
    }

    String recognizeAbility(GraphContext ctx, String parent, List<Token> tokens) throws CatalogException {
        if (tokens.isEmpty())
            return null;
        for (Recognizer<?> recognizer:lineRecognizers) {
            String id = recognizer.recognize(ctx, parent, tokens);
            if (id!=null)
                return id;
        }
        return null;
    }

    String phraseGraph(GraphContext ctx, String parent, List<Token> tokens) throws CatalogException {
        String id = phraseGrapher.graph(ctx, parent, tokens);
        if (ctx.tree.attr(id, ClauseGrapher.TOKENS)!=null)
            logger.fine((ctx.name==null?"":ctx.name+": ")+"ungraphed "+TokenLists.toString(tokens));
        return id;
    }
}
