package org.mtgl;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

import org.mtgl.common.tag.TagFormatException;
import org.mtgl.common.tag.Token;
import org.mtgl.common.tree.MTGTree;
import org.mtgl.grammar.CardType;
import org.mtgl.grammar.CatalogException;
import org.mtgl.grammar.GrammarCatalog;
import org.mtgl.grapher.Grapher;
import org.mtgl.lexer.Tokenizer;
import org.mtgl.parser.Resolver;
import org.mtgl.tagger.ReferenceTable;
import org.mtgl.tagger.Tagger;

/**
 * Tagger, tokenizer, resolver and grapher run over one card at a time. A
 * pipeline holds no per-card state and may be shared by batch threads.
 */
public class Pipeline {

    private static Logger logger = Logger.getLogger(Pipeline.class.getPackage().getName());

    /** A card with its tree, or the reason it has none. */
    public static class Graphed {
        final Card card;
        final MTGTree tree;
        final String error;

        Graphed(Card card, MTGTree tree, String error) {
            this.card = card;
            this.tree = tree;
            this.error = error;
        }

        public Card getCard() {
            return card;
        }

        public MTGTree getTree() {
            return tree;
        }

        public String getError() {
            return error;
        }
    }

    final Tagger tagger;
    final Tokenizer tokenizer;
    final Resolver resolver;
    final Grapher grapher;

    public Pipeline(GrammarCatalog catalog, ReferenceTable references) {
        tagger = new Tagger(catalog, references);
        tokenizer = new Tokenizer();
        resolver = new Resolver(catalog);
        grapher = new Grapher(catalog);
    }

    /**
     * @return a table of every face name in cards
     */
    public static ReferenceTable references(List<Card> cards) {
        ReferenceTable.Builder builder = ReferenceTable.builder();
        for (Card card:cards)
            builder.addAll(card.getFaceNames());
        return builder.build();
    }

    /** the tagged text of each face */
    public List<String> tag(Card card) {
        List<String> names = card.getFaceNames();
        List<String> texts = card.getFaceTexts();
        List<String> tagged = new ArrayList<String>();
        for (int i=0; i<texts.size(); ++i)
            tagged.add(tagger.tag(i<names.size()?names.get(i):card.getName(), texts.get(i)));
        return tagged;
    }

    public List<List<Token>> resolve(String name, String text) throws TagFormatException {
        return resolver.resolveAll(tokenizer.tokenize(tagger.tag(name, text)));
    }

    /**
     * @return the card's tree, fused from one tree per face for cards with
     * two faces
     */
    public MTGTree graph(Card card) throws CatalogException, TagFormatException {
        Set<CardType> types = card.getTypes();
        if (!card.isSplit())
            return graph(card.getName(), card.getText(), types);
        List<String> names = card.getFaceNames();
        List<String> texts = card.getFaceTexts();
        if (names.size()<2 || texts.size()<2)
            return graph(card.getName(), card.getText(), types);
        MTGTree a = graph(names.get(0), texts.get(0), types);
        MTGTree b = graph(names.get(1), texts.get(1), types);
        return MTGTree.fuse(card.getName(), a, b);
    }

    public MTGTree graph(String name, String text, Set<CardType> types) throws CatalogException, TagFormatException {
        return grapher.graph(name, resolve(name, text), types);
    }

    /**
     * Graphs cards on a pool of threads. A card that fails or runs past the
     * timeout is logged and returned without a tree; the batch goes on.
     * A timed out card is only abandoned: graphing does not check for
     * interrupts, so its worker keeps the thread until the card is done.
     * An interrupt of the calling thread ends the wait for the remaining
     * cards and is restored before returning.
     * @param timeoutSeconds time allowed per card once its turn to be
     * collected comes, 0 for no limit
     * @return one entry per card, in input order
     */
    public List<Graphed> graphAll(List<Card> cards, int threads, long timeoutSeconds) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, threads));
        List<Future<MTGTree>> futures = new ArrayList<Future<MTGTree>>(cards.size());
        for (final Card card:cards)
            futures.add(executor.submit(new Callable<MTGTree>() {
                @Override
                public MTGTree call() throws Exception {
                    return graph(card);
                }
            }));

        List<Graphed> results = new ArrayList<Graphed>(cards.size());
        for (int i=0; i<cards.size(); ++i) {
            Card card = cards.get(i);
            Future<MTGTree> future = futures.get(i);
            String error = null;
            MTGTree tree = null;
            try {
                tree = timeoutSeconds>0?future.get(timeoutSeconds, TimeUnit.SECONDS):future.get();
            } catch (TimeoutException e) {
                future.cancel(true);
                error = "timed out after "+timeoutSeconds+"s";
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                error = "interrupted";
            } catch (ExecutionException e) {
                error = e.getCause()==null?e.getMessage():e.getCause().getMessage();
                if (!(e.getCause() instanceof CatalogException) && !(e.getCause() instanceof TagFormatException))
                    logger.severe(card.getName()+": "+e.getCause());
            }
            if (error!=null)
                logger.warning(card.getName()+": "+error);
            results.add(new Graphed(card, tree, error));
            if ((i+1)%1000==0)
                logger.info("graphed "+(i+1)+" of "+cards.size());
        }

        executor.shutdown();
        while (true) {
            try {
                if (executor.awaitTermination(1, TimeUnit.MINUTES)) break;
            } catch (InterruptedException e) {
                logger.warning("interrupted waiting for graphing threads");
                executor.shutdownNow();
                Thread.currentThread().interrupt();
                break;
            }
        }
        return results;
    }
}
