package org.mtgl.common.tag;

import static org.junit.Assert.*;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Test;

public class TestTag {

    @Test
    public void testParse() throws Exception {
        Tag tag = Tag.parse("ob<permanent characteristics=creature quantifier=target>");
        assertEquals(TagCode.OBJECT, tag.getCode());
        assertEquals("permanent", tag.getValue());
        assertEquals("creature", tag.getAttr("characteristics"));
        assertEquals("target", tag.getAttr("quantifier"));
        assertEquals("ob<permanent characteristics=creature quantifier=target>", tag.toString());

        tag = Tag.parse("zn<hand player=it→owner>");
        assertEquals("it→owner", tag.getAttr("player"));

        tag = Tag.parse("ch<p/t val=+2/+2>");
        assertEquals("p/t", tag.getValue());
        assertEquals("+2/+2", tag.getAttr("val"));

        tag = Tag.parse("xc<¬control>");
        assertTrue(tag.isNegated());
        assertFalse(tag.hasAttrs());

        assertEquals("aw<council's_dilemma>", Tag.parse("aw<council's_dilemma>").toString());
    }

    @Test
    public void testMalformed() {
        String[] bad = {"ob<>", "ob<card", "qq<card>", "ob<card ref>", "card", "ob<two words>"};
        for (String text:bad) {
            try {
                Tag.parse(text);
                fail("parsed "+text);
            } catch (TagFormatException e) {
                assertEquals(text, e.getText());
            }
        }
    }

    @Test
    public void testAttrOrder() {
        Map<String, String> attrs = new LinkedHashMap<String, String>();
        attrs.put("num", "2");
        attrs.put("characteristics", "creature");
        Tag tag = new Tag(TagCode.OBJECT, "card", attrs);
        assertEquals("ob<card num=2 characteristics=creature>", tag.toString());
        assertEquals("ob<card num=2 characteristics=creature quantifier=a>", tag.withAttr("quantifier", "a").toString());
        assertEquals("ob<card characteristics=creature>", tag.withoutAttr("num").toString());
        assertEquals("ob<card num=2 characteristics=creature∧land>",
                tag.withJoinedAttr("characteristics", "land", Symbols.AND).toString());
        // the original is untouched
        assertEquals("ob<card num=2 characteristics=creature>", tag.toString());
    }

    @Test(expected=IllegalArgumentException.class)
    public void testBadKey() {
        new Tag(TagCode.OBJECT, "card").withAttr("bad key", "x");
    }

    @Test
    public void testToken() throws Exception {
        assertTrue(Token.parse("kw<flying>").isTag());
        assertEquals(Token.Type.PUNCTUATION, Token.parse(",").getType());
        assertEquals(Token.Type.SYMBOL, Token.parse("{2}{W}").getType());
        assertEquals(Token.Type.WORD, Token.parse("+nu<1>").getType());
        assertTrue(Tokens.isLoyaltyCost(Token.parse("+nu<1>")));
        assertTrue(Tokens.isManaString(Token.parse("{2}{W}")));
        assertFalse(Tokens.isManaString(Token.parse("{T}")));
        assertTrue(Token.parse("{T}").isSymbol());
        assertTrue(Tokens.isCoordinator(Token.parse("op<⊕>")));
        assertTrue(Tokens.isMetaCharacteristic(Token.parse("ch<power∨toughness>")));
        assertFalse(Tokens.isMetaCharacteristic(Token.parse("ch<creature>")));
        assertTrue(Tokens.isPossessive(Token.parse("xc<¬own>")));
        try {
            Token.parse("ob<broken");
            fail();
        } catch (TagFormatException e) {
            // expected
        }
        try {
            Tokens.untag(Token.word("destroy"));
            fail();
        } catch (TagFormatException e) {
            assertEquals("destroy", e.getText());
        }
    }
}
