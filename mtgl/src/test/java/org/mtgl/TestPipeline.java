package org.mtgl;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import org.mtgl.common.tree.MTGTree;
import org.mtgl.common.tree.TreePrinter;
import org.mtgl.grammar.GrammarCatalog;
import org.mtgl.grapher.Grapher;
import org.mtgl.tagger.ReferenceTable;

public class TestPipeline {

    GrammarCatalog catalog;

    @Before
    public void setUp() throws Exception {
        catalog = GrammarCatalog.load();
    }

    Pipeline pipeline(List<Card> cards) {
        return new Pipeline(catalog, Pipeline.references(cards));
    }

    @Test
    public void testReferences() {
        List<Card> cards = Arrays.asList(
                new Card("Serra Angel", "Flying, vigilance", "Creature"),
                Card.join(new Card("Fire", "Draw a card.", "Instant"), new Card("Ice", "Draw two cards.", "Instant")));
        ReferenceTable references = Pipeline.references(cards);
        assertEquals(3, references.size());
        assertNotNull(references.lookup("Ice"));
        assertNull(references.lookup("Fire // Ice"));
    }

    @Test
    public void testKeywordCard() throws Exception {
        Card card = new Card("Serra Angel", "Flying, vigilance", "Creature");
        MTGTree tree = pipeline(Arrays.asList(card)).graph(card);
        assertEquals("Serra Angel", tree.attr(tree.root(), "name"));
        assertEquals(2, tree.findAll("kw-clause").size());
    }

    @Test
    public void testTwoFaces() throws Exception {
        Card card = Card.join(new Card("Fire", "Draw a card.", "Instant"), new Card("Ice", "Draw two cards.", "Instant"));
        Pipeline pipeline = pipeline(Arrays.asList(card));
        assertEquals(2, pipeline.tag(card).size());

        MTGTree tree = pipeline.graph(card);
        assertEquals("Fire // Ice", tree.attr(tree.root(), "name"));
        List<String> halves = tree.children(tree.root());
        assertEquals(2, halves.size());
        assertEquals("card-half", tree.type(halves.get(0)));
        assertEquals("a", tree.attr(halves.get(0), "side"));
        assertEquals("Fire", tree.attr(halves.get(0), "name"));
        assertEquals("b", tree.attr(halves.get(1), "side"));
        assertEquals("Ice", tree.attr(halves.get(1), "name"));
        assertEquals(Grapher.SPELL_ABILITY, tree.type(tree.children(halves.get(1)).get(0)));
    }

    @Test
    public void testGraphAll() throws Exception {
        List<Card> cards = Arrays.asList(
                new Card("Serra Angel", "Flying, vigilance", "Creature"),
                new Card("Broken", "Kicker", "Creature"),
                new Card("Divination", "Draw two cards.", "Sorcery"));
        Pipeline pipeline = pipeline(cards);
        List<Pipeline.Graphed> results = pipeline.graphAll(cards, 2, 30);
        assertEquals(3, results.size());
        for (int i=0; i<cards.size(); ++i)
            assertSame(cards.get(i), results.get(i).getCard());

        assertNotNull(results.get(0).getTree());
        assertNull(results.get(0).getError());
        assertNull(results.get(1).getTree());
        assertTrue(results.get(1).getError(), results.get(1).getError().startsWith("Broken: keyword Kicker"));
        assertNotNull(results.get(2).getTree());

        // batch trees match trees graphed one at a time
        assertEquals(TreePrinter.print(pipeline.graph(cards.get(2)), true),
                TreePrinter.print(results.get(2).getTree(), true));
    }

    @Test
    public void testInterruptedBatch() throws Exception {
        List<Card> cards = Arrays.asList(
                new Card("Serra Angel", "Flying, vigilance", "Creature"),
                new Card("Divination", "Draw two cards.", "Sorcery"));
        Pipeline pipeline = pipeline(cards);
        Thread.currentThread().interrupt();
        List<Pipeline.Graphed> results = pipeline.graphAll(cards, 1, 0);
        // the interrupt survives the batch
        assertTrue(Thread.interrupted());
        assertEquals(2, results.size());
        for (Pipeline.Graphed result:results)
            assertTrue(result.getTree()!=null || "interrupted".equals(result.getError()));
    }

    @Test
    public void testPowerToughnessCard() throws Exception {
        Card card = new Card("Raise the Alarm", "Create two 1/1 white Soldier creature tokens.", "Instant");
        List<Pipeline.Graphed> results = pipeline(Arrays.asList(card)).graphAll(Arrays.asList(card), 1, 30);
        assertNull(results.get(0).getError());
        MTGTree tree = results.get(0).getTree();
        assertNotNull(tree);
        assertEquals(1, tree.findAll("keyword-action", tree.root(), "value", "create").size());
    }
}
