package org.mtgl.tagger;

import static org.junit.Assert.*;

import org.junit.Before;
import org.junit.Test;

import org.mtgl.grammar.GrammarCatalog;
import org.mtgl.lexer.Tokenizer;

public class TestTagger {

    GrammarCatalog catalog;
    Tagger tagger;

    @Before
    public void setUp() throws Exception {
        catalog = GrammarCatalog.load();
        tagger = new Tagger(catalog, ReferenceTable.builder().add("Lightning Bolt").build());
    }

    @Test
    public void testKeywords() {
        assertEquals("kw<flying>, kw<vigilance>", tagger.tag("Serra Angel", "Flying, vigilance"));
        assertEquals("kw<flying>\nkw<vigilance>", tagger.tag("Serra Angel", "Flying\nVigilance"));
    }

    @Test
    public void testEmpty() {
        assertEquals("", tagger.tag("Grizzly Bears", null));
        assertEquals("", tagger.tag("Grizzly Bears", "  "));
    }

    @Test
    public void testSelfReference() {
        String tagged = tagger.tag("Serra Angel", "When Serra Angel enters the battlefield, draw a card.");
        assertTrue(tagged, tagged.startsWith("tp<when> "+Tagger.SELF_REF));
        assertFalse(tagged, tagged.contains("serra"));
        assertTrue(tagged, tagged.contains("zn<battlefield>"));
        assertTrue(tagged, tagged.contains("xa<draw>"));
        assertTrue(tagged, tagged.endsWith("ob<card>."));

        tagged = tagger.tag("Ana, Sage of Ages", "Ana deals 1 damage to any target.");
        assertTrue(tagged, tagged.startsWith(Tagger.SELF_REF));
    }

    @Test
    public void testNamedReference() {
        String tagged = tagger.tag("Tutor", "Search your library for a card named Lightning Bolt.");
        assertTrue(tagged, tagged.contains("ob<card ref="+ReferenceTable.refId("Lightning Bolt")+">"));
        assertFalse(tagged, tagged.contains("lightning"));
    }

    @Test
    public void testReminderAndMana() {
        String tagged = tagger.tag("Bird", "Flying (This creature can't be blocked except by creatures with flying or reach.)");
        assertEquals("kw<flying>", tagged);

        tagged = tagger.tag("Elves", "{T}: Add {G}.");
        assertTrue(tagged, tagged.startsWith("{T}:"));
        assertTrue(tagged, tagged.contains("{G}"));
        assertTrue(tagged, tagged.contains("xa<add>"));
    }

    @Test
    public void testNumbers() {
        String tagged = tagger.tag("Divination", "Draw two cards.");
        assertTrue(tagged, tagged.contains("nu<2>"));
        assertTrue(tagged, tagged.contains("ob<card>"));
    }

    @Test
    public void testModalLines() {
        String tagged = tagger.tag("Charm", "Choose one —\n• Destroy target artifact.\n• Draw a card.");
        assertEquals(1, tagged.split("\n").length);
        assertTrue(tagged, tagged.startsWith("xa<choose> nu<1>"));
        assertTrue(tagged, tagged.contains("•"));
    }

    @Test
    public void testDeterministic() {
        String text = "When Lightning Bolt enters the battlefield, draw a card.\nFlying";
        assertEquals(tagger.tag("Ana", text), tagger.tag("Ana", text));
    }

    @Test
    public void testPowerToughness() throws Exception {
        String tagged = tagger.tag("Raise the Alarm", "Create two 1/1 white Soldier creature tokens.");
        assertTrue(tagged, tagged.contains("nu<2> ch<p/t val=1/1> ch<white>"));
        assertFalse(tagged, tagged.contains("nu<1>"));
        assertEquals(1, new Tokenizer().tokenize(tagged).size());

        tagged = tagger.tag("Giant Growth", "Target creature gets +2/+0 until end of turn.");
        assertTrue(tagged, tagged.contains("ch<p/t val=+2/+0>"));

        tagged = tagger.tag("Leveler", "LEVEL 2-6\n3/3\nFlying");
        assertEquals("level nu<2> pr<to> nu<6> • ch<p/t val=3/3> • kw<flying>", tagged);
        new Tokenizer().tokenize(tagged);
    }

    @Test
    public void testCounters() throws Exception {
        String tagged = tagger.tag("Anthem", "Put a +1/+1 counter on each creature you control.");
        assertTrue(tagged, tagged.contains("xa<put> a xo<ctr type=+1/+1> pr<on>"));
        assertFalse(tagged, tagged.contains("nu<"));

        tagged = tagger.tag("Clone", "Clone enters the battlefield with two -1/-1 counters on it.");
        assertTrue(tagged, tagged.contains("nu<2> xo<ctr type=-1/-1>"));

        tagged = tagger.tag("Battery", "Put three charge counters on Battery.");
        assertTrue(tagged, tagged.contains("nu<3> xo<ctr type=charge>"));
        new Tokenizer().tokenize(tagged);
    }
}
