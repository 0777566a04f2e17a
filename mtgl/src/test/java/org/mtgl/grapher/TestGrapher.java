package org.mtgl.grapher;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.junit.Before;
import org.junit.Test;

import org.mtgl.common.tag.Token;
import org.mtgl.common.tree.MTGTree;
import org.mtgl.common.tree.TreePrinter;
import org.mtgl.grammar.CardType;
import org.mtgl.grammar.CatalogException;
import org.mtgl.grammar.GrammarCatalog;
import org.mtgl.lexer.Tokenizer;

public class TestGrapher {

    Grapher grapher;
    Tokenizer tokenizer;

    @Before
    public void setUp() throws Exception {
        grapher = new Grapher(GrammarCatalog.load());
        tokenizer = new Tokenizer();
    }

    MTGTree graph(Set<CardType> types, String... lines) throws Exception {
        List<List<Token>> tokenized = new ArrayList<List<Token>>();
        for (String line:lines)
            tokenized.add(tokenizer.tokenizeLine(line));
        return grapher.graph("Test", tokenized, types);
    }

    MTGTree graph(String... lines) throws Exception {
        return graph(EnumSet.noneOf(CardType.class), lines);
    }

    @Test
    public void testKeywordLine() throws Exception {
        MTGTree tree = graph("kw<flying>, kw<vigilance>");
        assertEquals("Test", tree.attr(tree.root(), "name"));
        List<String> lines = tree.children(tree.root());
        assertEquals(1, lines.size());
        assertEquals("keywords", tree.type(lines.get(0)));
        List<String> clauses = tree.findAll("kw-clause");
        assertEquals(2, clauses.size());
        assertEquals("Flying", tree.attr(clauses.get(0), "keyword"));
        assertEquals("Vigilance", tree.attr(clauses.get(1), "keyword"));
    }

    @Test
    public void testUnfitKeyword() throws Exception {
        try {
            graph("kw<flying>", "kw<kicker>");
            fail("kicker without a cost");
        } catch (CatalogException e) {
            assertEquals("Test", e.getDocument());
            assertTrue(e.getMessage().startsWith("Test: "));
        }
    }

    @Test
    public void testActivated() throws Exception {
        MTGTree tree = graph("{2}{W}: ka<destroy> ob<creature quantifier=target>.");
        assertEquals(1, tree.findAll("activated-ability").size());
        List<String> costs = tree.findAll("sub-cost", null, "type", "mana");
        assertEquals(1, costs.size());
        assertEquals("{2}{W}", tree.attr(costs.get(0), "value"));
        assertEquals("activated-cost", tree.type(tree.parent(costs.get(0))));
        assertEquals(1, tree.findAll("activated-effect").size());
        assertTrue(tree.findAll("activated-instructions").isEmpty());
    }

    @Test
    public void testTriggered() throws Exception {
        MTGTree tree = graph("tp<when> ob<card ref=self> xa<enter> zn<battlefield>, xa<draw> a ob<card>.");
        String ability = tree.children(tree.root()).get(0);
        assertEquals("triggered-ability", tree.type(ability));
        List<String> parts = tree.children(ability);
        assertEquals("triggered-preamble", tree.type(parts.get(0)));
        assertEquals("When", tree.attr(parts.get(0), "value"));
        assertEquals("triggered-condition", tree.type(parts.get(1)));
        assertEquals("triggered-effect", tree.type(parts.get(2)));
        assertEquals(3, parts.size());
    }

    @Test
    public void testIfWouldInstead() throws Exception {
        MTGTree tree = graph("cn<if> a ob<creature> cn<would> xa<die>, ka<exile> xo<it> cn<instead>.");
        String ability = tree.children(tree.root()).get(0);
        assertEquals(Grapher.STATIC_ABILITY, tree.type(ability));
        List<String> conditionals = tree.findAll("conditional-phrase");
        assertEquals(1, conditionals.size());
        assertEquals("if-would", tree.attr(conditionals.get(0), "type"));
        assertEquals(1, tree.findAll("cond-condition", conditionals.get(0), "type", "if-would").size());
        List<String> replacements = tree.findAll("replacement-effect", null, "type", "instead");
        assertEquals(1, replacements.size());
        assertEquals("cond-effect", tree.type(tree.parent(replacements.get(0))));
        assertEquals(1, tree.findAll("new-event", replacements.get(0)).size());
    }

    @Test
    public void testModal() throws Exception {
        MTGTree tree = graph(EnumSet.of(CardType.INSTANT),
                "xa<choose> nu<1> — • ka<destroy> ob<artifact quantifier=target>. • xa<draw> a ob<card>.");
        String ability = tree.children(tree.root()).get(0);
        assertEquals(Grapher.SPELL_ABILITY, tree.type(ability));
        List<String> modals = tree.findAll("modal");
        assertEquals(1, modals.size());
        String instruction = tree.findAll("instruction", modals.get(0)).get(0);
        assertEquals("1", tree.attr(instruction, "n"));
        assertEquals("not-repeatable", tree.attr(instruction, "option"));
        assertEquals(2, tree.findAll("mode", modals.get(0)).size());
    }

    @Test
    public void testRestriction() throws Exception {
        MTGTree tree = graph("ka<activate> xo<it> cn<only> as a ob<sorcery>.");
        List<String> restrictions = tree.findAll("restriction-phrase", null, "type", "only");
        assertEquals(1, restrictions.size());
        assertEquals(1, tree.findAll("phrase", restrictions.get(0), "role", "rule").size());
        assertEquals(1, tree.findAll("phrase", restrictions.get(0), "role", "restriction").size());
    }

    @Test
    public void testSequence() throws Exception {
        MTGTree tree = graph(EnumSet.of(CardType.SORCERY),
                "xa<draw> a ob<card>, sq<then> ka<discard> a ob<card>.");
        List<String> sequences = tree.findAll("sequence-phrase", null, "type", "then");
        assertEquals(1, sequences.size());
        assertEquals(1, tree.findAll("phrase", sequences.get(0), "role", "first").size());
        assertEquals(1, tree.findAll("phrase", sequences.get(0), "role", "then").size());
    }

    @Test
    public void testOptional() throws Exception {
        MTGTree tree = graph("xp<you> cn<may> xa<draw> a ob<card>.");
        assertEquals(1, tree.findAll("optional-phrase").size());
    }

    @Test
    public void testFallbackNeverFails() throws Exception {
        MTGTree tree = graph("the quick brown fox.", ", , .", "xq<each> ob<creature> xs<attacking>");
        List<String> lines = tree.children(tree.root());
        assertEquals(3, lines.size());
        for (String line:lines)
            assertEquals(Grapher.STATIC_ABILITY, tree.type(line));
    }

    @Test
    public void testEmptyLinesSkipped() throws Exception {
        List<List<Token>> lines = new ArrayList<List<Token>>();
        lines.add(new ArrayList<Token>());
        lines.add(tokenizer.tokenizeLine("kw<flying>"));
        MTGTree tree = grapher.graph("Test", lines, null);
        assertEquals(1, tree.children(tree.root()).size());
    }

    @Test
    public void testDeterministic() throws Exception {
        String[] lines = {
            "kw<flying>",
            "tp<whenever> ob<card ref=self> xa<attack>, xp<you> cn<may> xa<draw> a ob<card>.",
            "{T}: xa<add> {G}."
        };
        assertEquals(TreePrinter.print(graph(lines), true), TreePrinter.print(graph(lines), true));
    }

    @Test
    public void testAlternateCost() throws Exception {
        MTGTree tree = graph("xp<you> cn<may> xa<pay> {1}{R} cn<rather_than> xa<pay> ob<card ref=self> ch<mana_cost>.");
        List<String> costs = tree.findAll("alternate-cost");
        assertEquals(1, costs.size());
        assertEquals("you", tree.attr(costs.get(0), "player"));
        assertEquals("yes", tree.attr(costs.get(0), "optional"));
        List<String> mana = tree.findAll("sub-cost", costs.get(0), "type", "mana");
        assertEquals(1, mana.size());
        assertEquals("{1}{R}", tree.attr(mana.get(0), "value"));
        assertEquals(1, tree.findAll("phrase", costs.get(0), "role", "original").size());
    }

    @Test
    public void testAdditionalCost() throws Exception {
        MTGTree tree = graph("as a xr<additional> xc<cost> pr<to> ka<cast> ob<card ref=self>, ka<sacrifice> a ob<creature>.");
        List<String> costs = tree.findAll("additional-cost");
        assertEquals(1, costs.size());
        assertEquals(1, tree.findAll("phrase", costs.get(0), "role", "applies-to").size());
        assertEquals(1, tree.findAll("sub-cost", costs.get(0), "type", "action").size());
        assertEquals(1, tree.findAll("keyword-action", costs.get(0), "value", "sacrifice").size());
    }

    @Test
    public void testException() throws Exception {
        MTGTree tree = graph("xq<each> ob<creature> xa<get> ch<p/t val=+1/+1>, cn<except> pr<for> ob<card ref=self>.");
        List<String> exceptions = tree.findAll("exception-phrase");
        assertEquals(1, exceptions.size());
        assertEquals(1, tree.findAll("phrase", exceptions.get(0), "role", "rule").size());
        assertEquals(1, tree.findAll("phrase", exceptions.get(0), "role", "exception").size());
    }

    @Test
    public void testDelayedTrigger() throws Exception {
        MTGTree tree = graph("xa<return> xo<it> pr<to> zn<battlefield> tp<at> the ph<end_step>.");
        List<String> delayed = tree.findAll("delayed-trigger");
        assertEquals(1, delayed.size());
        List<String> parts = tree.children(delayed.get(0));
        assertEquals(3, parts.size());
        assertEquals("triggered-preamble", tree.type(parts.get(0)));
        assertEquals("At", tree.attr(parts.get(0), "value"));
        assertEquals("triggered-condition", tree.type(parts.get(1)));
        assertEquals("triggered-effect", tree.type(parts.get(2)));
        assertEquals(1, tree.findAll("lituus-action", parts.get(2), "value", "return").size());

        // a sentence that opens with the trigger
        tree = graph(EnumSet.of(CardType.INSTANT),
                "ka<exile> ob<creature quantifier=target>. tp<at> the ph<end_step>, xa<return> xo<it> pr<to> zn<battlefield>.");
        assertEquals(1, tree.findAll("sentences").size());
        delayed = tree.findAll("delayed-trigger");
        assertEquals(1, delayed.size());
        assertEquals(1, tree.findAll("triggered-effect", delayed.get(0)).size());
        assertTrue(tree.findAll("triggered-ability").isEmpty());
    }

    @Test
    public void testPhraseConjunction() throws Exception {
        MTGTree tree = graph(EnumSet.of(CardType.SORCERY),
                "xa<draw> a ob<card>, xa<lose> nu<1> xc<life>, and ka<discard> a ob<card>.");
        List<String> conjunctions = tree.findAll("conjunction", null, "item_type", "phrase");
        assertEquals(1, conjunctions.size());
        assertEquals("and", tree.attr(conjunctions.get(0), "coordinator"));
        List<String> items = tree.children(conjunctions.get(0));
        assertEquals(3, items.size());
        for (String item:items)
            assertEquals("item", tree.type(item));
    }

    @Test
    public void testThingChain() throws Exception {
        MTGTree tree = graph(EnumSet.of(CardType.SORCERY),
                "ka<exile> ob<permanent characteristics=artifact quantifier=all>, ob<permanent characteristics=creature>, "
                + "and ob<permanent characteristics=enchantment>.");
        List<String> conjunctions = tree.findAll("conjunction", null, "item_type", "thing");
        assertEquals(1, conjunctions.size());
        String conjunction = conjunctions.get(0);
        assertEquals("all", tree.attr(conjunction, "quantifier"));
        assertEquals("keyword-action", tree.type(tree.parent(conjunction)));
        assertEquals("exile", tree.attr(tree.parent(conjunction), "value"));
        assertEquals(3, tree.findAll("item", conjunction).size());
        assertTrue(tree.findAll("clauses").isEmpty());
    }

    @Test
    public void testSaga() throws Exception {
        MTGTree tree = graph(EnumSet.of(CardType.SAGA),
                "i — xa<draw> a ob<card>.",
                "ii, iii — xp<you> xa<gain> nu<2> xc<life>.");
        List<String> chapters = tree.findAll("saga-chapter");
        assertEquals(2, chapters.size());
        assertEquals("I", tree.attr(chapters.get(0), "chapter"));
        assertEquals("II, III", tree.attr(chapters.get(1), "chapter"));
    }

    @Test
    public void testLevels() throws Exception {
        MTGTree tree = graph("level nu<2> pr<to> nu<6> • ch<p/t val=3/3> • kw<flying>",
                "level nu<≥7> • ch<p/t val=4/4> • kw<flying>, kw<vigilance>");
        List<String> levels = tree.findAll("level");
        assertEquals(2, levels.size());
        assertEquals("2-6", tree.attr(levels.get(0), "range"));
        assertEquals("3/3", tree.attr(levels.get(0), "p/t"));
        assertEquals("7+", tree.attr(levels.get(1), "range"));
        assertEquals(3, tree.findAll("kw-clause").size());
    }

    @Test
    public void testAbilityWord() throws Exception {
        MTGTree tree = graph("aw<landfall> — tp<whenever> ob<land> xa<enter> zn<battlefield>, xp<you> xa<gain> nu<1> xc<life>.");
        List<String> markers = tree.findAll("ability-word");
        assertEquals(1, markers.size());
        assertEquals("Landfall", tree.attr(markers.get(0), "word"));
        String definition = tree.attr(markers.get(0), "definition");
        assertEquals("ability-word-definition", tree.type(definition));
        assertEquals(tree.root(), tree.parent(definition));
        assertEquals(1, tree.findAll("triggered-ability", definition).size());
    }

    @Test
    public void testEntersReplacements() throws Exception {
        MTGTree tree = graph("ob<card ref=self> xa<enter> zn<battlefield> pr<with> nu<2> xo<ctr type=+1/+1> pr<on> xo<it>.");
        List<String> replacements = tree.findAll("replacement-effect", null, "type", "enters-with");
        assertEquals(1, replacements.size());
        assertEquals(1, tree.findAll("original-event", replacements.get(0)).size());
        assertEquals(1, tree.findAll("new-event", replacements.get(0)).size());
        assertEquals(1, tree.findAll("counter", null, "type", "+1/+1").size());

        tree = graph("ob<card ref=self> xa<enter> zn<battlefield> st<tapped>.");
        assertEquals(1, tree.findAll("replacement-effect", null, "type", "enters-tapped").size());
    }

    @Test
    public void testFaceUp() throws Exception {
        MTGTree tree = graph("as ob<card ref=self> is turned st<face_up>, ka<destroy> ob<creature quantifier=target>.");
        assertEquals(1, tree.findAll("replacement-effect", null, "type", "face-up").size());
    }
}
