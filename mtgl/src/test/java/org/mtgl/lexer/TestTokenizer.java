package org.mtgl.lexer;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Before;
import org.junit.Test;

import org.mtgl.common.tag.TagCode;
import org.mtgl.common.tag.TagFormatException;
import org.mtgl.common.tag.Token;

public class TestTokenizer {

    Tokenizer tokenizer;

    @Before
    public void setUp() throws Exception {
        tokenizer = new Tokenizer();
    }

    @Test
    public void testLine() throws Exception {
        List<Token> tokens = tokenizer.tokenizeLine("xa<draw> a ob<card>.");
        assertEquals(4, tokens.size());
        assertTrue(tokens.get(0).is(TagCode.LITUUS_ACTION, "draw"));
        assertEquals(Token.Type.WORD, tokens.get(1).getType());
        assertTrue(tokens.get(2).is(TagCode.OBJECT, "card"));
        assertEquals(Token.Type.PUNCTUATION, tokens.get(3).getType());
        assertEquals(".", tokens.get(3).getText());
    }

    @Test
    public void testAttributesStayInTag() throws Exception {
        List<Token> tokens = tokenizer.tokenizeLine("ob<creature quantifier=target status=tapped>, xa<draw>");
        assertEquals(3, tokens.size());
        assertEquals("target", tokens.get(0).getTag().getAttr("quantifier"));
        assertEquals("tapped", tokens.get(0).getTag().getAttr("status"));
        assertEquals(",", tokens.get(1).getText());
    }

    @Test
    public void testSymbols() throws Exception {
        List<Token> tokens = tokenizer.tokenizeLine("{2}{W}, {T}: ka<destroy> ob<creature quantifier=target>.");
        assertEquals(Token.Type.SYMBOL, tokens.get(0).getType());
        assertEquals("{2}{W}", tokens.get(0).getText());
        assertEquals(",", tokens.get(1).getText());
        assertEquals("{T}", tokens.get(2).getText());
        assertEquals(":", tokens.get(3).getText());
        assertEquals(7, tokens.size());
    }

    @Test
    public void testModalPunctuation() throws Exception {
        List<Token> tokens = tokenizer.tokenizeLine("xa<choose> nu<1> — • xa<draw> a ob<card>.");
        assertEquals("—", tokens.get(2).getText());
        assertEquals("•", tokens.get(3).getText());
    }

    @Test
    public void testLines() throws Exception {
        List<List<Token>> lines = tokenizer.tokenize("kw<flying>\n\nkw<vigilance>\n");
        assertEquals(2, lines.size());
        assertTrue(tokenizer.tokenize(null).isEmpty());
    }

    @Test(expected=TagFormatException.class)
    public void testMalformed() throws Exception {
        tokenizer.tokenizeLine("xa<draw> ob<card ref>.");
    }
}
