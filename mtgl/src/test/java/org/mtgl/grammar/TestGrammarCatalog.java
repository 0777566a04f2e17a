package org.mtgl.grammar;

import static org.junit.Assert.*;

import java.io.StringReader;
import java.util.Arrays;

import org.junit.Before;
import org.junit.Test;

public class TestGrammarCatalog {

    GrammarCatalog catalog;

    @Before
    public void setUp() throws Exception {
        catalog = GrammarCatalog.load();
    }

    @Test
    public void testTemplates() throws Exception {
        KeywordTemplate flying = catalog.template("flying");
        assertEquals(ParamShape.EMPTY, flying.getShape());
        assertEquals("Flying", flying.getName());
        assertFalse(flying.isOptional());

        KeywordTemplate kicker = catalog.template("kicker");
        assertEquals(ParamShape.COST_OR_COST, kicker.getShape());
        assertTrue(kicker.isOptional());

        assertEquals(ParamShape.COST, catalog.template("buyback").getShape());
        assertEquals("First strike", catalog.template("first_strike").getName());
        for (String keyword:Vocabulary.KEYWORDS)
            assertTrue(keyword, catalog.hasTemplate(Vocabulary.tagValue(keyword)));
    }

    @Test(expected=CatalogException.class)
    public void testUnknownKeyword() throws Exception {
        catalog.template("jumping");
    }

    @Test
    public void testMalformedTables() throws Exception {
        String[] tables = {
            "flying = EMPTY\nflying = EMPTY\n",
            "flying = WINGS\n",
            "jumping = EMPTY\n",
            "flying = EMPTY\n"
        };
        for (String table:tables) {
            try {
                GrammarCatalog.load(new StringReader(table));
                fail("loaded "+table);
            } catch (CatalogException e) {
                assertNotNull(e.getMessage());
            }
        }
    }

    @Test
    public void testActionShapes() {
        assertEquals(ActionShape.DIRECT_OBJECT, catalog.actionShape("destroy"));
        assertEquals(ActionShape.SUBJECT_ZONE, catalog.actionShape("enter"));
        assertEquals(ActionShape.MANA, catalog.actionShape("add"));
        assertNull(catalog.actionShape("juggle"));
    }

    @Test
    public void testCardTypes() {
        assertEquals(CardType.INSTANT, CardType.fromLabel("Instant"));
        assertNull(CardType.fromLabel("Legendary"));
        assertTrue(CardType.isSpell(CardType.fromLabels(Arrays.asList("Tribal", "Sorcery"))));
        assertFalse(CardType.isSpell(CardType.fromLabels(Arrays.asList("Creature", "Angel"))));
    }
}
