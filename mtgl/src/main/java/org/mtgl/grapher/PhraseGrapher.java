package org.mtgl.grapher;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.mtgl.common.tag.Token;
import org.mtgl.grammar.CatalogException;

/**
 * Graphs a span of text that is not an ability line of its own.
 * <p>
 * The phrase recognizers are tried in a fixed order and the first match
 * wins: modal, replacement, alternate cost, additional cost, restriction,
 * exception, sequence, conditional, optional, delayed trigger, conjunction.
 * Only modal blocks may cover several sentences; any other span is first
 * broken into sentences, and a sentence nothing matches is broken into
 * comma separated clauses. A single clause ends up in {@link ClauseGrapher},
 * which never fails.
 */
public class PhraseGrapher {

    final List<Recognizer<?>> recognizers;

    PhraseGrapher() {
        recognizers = Collections.unmodifiableList(Arrays.<Recognizer<?>>asList(
                new ModalRecognizer(),
                new ReplacementRecognizer(),
                new AlternateCostRecognizer(),
                new AdditionalCostRecognizer(),
                new RestrictionRecognizer(),
                new ExceptionRecognizer(),
                new SequenceRecognizer(),
                new ConditionalRecognizer(),
                new OptionalRecognizer(),
                new DelayedTriggerRecognizer(),
                new ConjunctionRecognizer()));
    }

    public List<Recognizer<?>> getRecognizers() {
        return recognizers;
    }

    /**
     * @return the id of the node created under parent, never null
     */
    public String graph(GraphContext ctx, String parent, List<Token> tokens) throws CatalogException {
        List<List<Token>> sentences = Spans.sentences(tokens);
        boolean several = sentences.size()>1;
        if (!Spans.isEmptySpan(tokens))
            for (Recognizer<?> recognizer:recognizers) {
                if (several && !recognizer.spansSentences())
                    continue;
                String id = recognizer.recognize(ctx, parent, tokens);
                if (id!=null)
                    return id;
            }

        if (several) {
            String id = ctx.tree.addNode(parent, "sentences");
            for (List<Token> sentence:sentences)
                graph(ctx, id, sentence);
            return id;
        }

        List<List<Token>> clauses = Spans.clauses(Spans.stripPeriod(tokens));
        if (clauses.size()>1) {
            String id = ctx.tree.addNode(parent, "clauses");
            for (List<Token> clause:clauses)
                graph(ctx, id, clause);
            return id;
        }
        return ctx.clause(parent, tokens);
    }
}
