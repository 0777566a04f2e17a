package org.mtgl;

import static org.junit.Assert.*;

import java.io.StringReader;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;

import org.junit.Test;

import org.mtgl.grammar.CardType;

public class TestCardReader {

    static final String CORPUS = "{"
            + "\"Serra Angel\": {\"text\": \"Flying, vigilance\", \"types\": [\"Creature\"],"
            + " \"subtypes\": [\"Angel\"], \"layout\": \"normal\", \"manaCost\": \"{3}{W}{W}\", \"power\": \"4\"},"
            + "\"Fire\": {\"text\": \"Fire deals 2 damage divided as you choose among one or two targets.\","
            + " \"types\": [\"Instant\"], \"layout\": \"split\", \"names\": [\"Fire\", \"Ice\"]},"
            + "\"Ice\": {\"text\": \"Tap target permanent.\\nDraw a card.\", \"types\": [\"Instant\"],"
            + " \"layout\": \"split\", \"names\": [\"Fire\", \"Ice\"]},"
            + "\"Grizzly Bears\": {\"text\": null, \"types\": [\"Creature\"], \"supertypes\": []}"
            + "}";

    @Test
    public void testRead() throws Exception {
        List<Card> cards = new CardReader().read(new StringReader(CORPUS));
        assertEquals(3, cards.size());

        Card angel = cards.get(0);
        assertEquals("Serra Angel", angel.getName());
        assertEquals("Flying, vigilance", angel.getText());
        assertEquals(EnumSet.of(CardType.CREATURE), angel.getTypes());
        assertTrue(angel.getTypeLabels().contains("Angel"));
        assertFalse(angel.isSplit());

        Card fireIce = cards.get(1);
        assertEquals("Fire // Ice", fireIce.getName());
        assertTrue(fireIce.isSplit());
        assertEquals(Arrays.asList("Fire", "Ice"), fireIce.getFaceNames());
        assertEquals(2, fireIce.getFaceTexts().size());
        assertEquals("Tap target permanent.\nDraw a card.", fireIce.getFaceTexts().get(1));
        assertEquals(EnumSet.of(CardType.INSTANT), fireIce.getTypes());
        assertEquals("split", fireIce.getLayout());

        Card bears = cards.get(2);
        assertEquals("", bears.getText());
        assertEquals("normal", bears.getLayout());
    }

    @Test
    public void testMissingFace() throws Exception {
        String corpus = "{\"Fire\": {\"text\": \"Draw a card.\", \"layout\": \"split\", \"names\": [\"Fire\", \"Ice\"]}}";
        List<Card> cards = new CardReader().read(new StringReader(corpus));
        assertEquals(1, cards.size());
        assertEquals("Fire", cards.get(0).getName());
        assertFalse(cards.get(0).isSplit());
    }

    @Test
    public void testJoin() {
        Card card = Card.join(new Card("Cut", "Destroy target artifact.", "Sorcery"),
                new Card("Ribbons", "Each opponent loses X life.", "Sorcery"));
        assertEquals("Cut // Ribbons", card.getName());
        assertEquals(Arrays.asList("Destroy target artifact.", "Each opponent loses X life."), card.getFaceTexts());
        assertEquals(1, card.getTypeLabels().size());
    }
}
