package org.mtgl.common.util;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.mtgl.common.tag.TagCode;
import org.mtgl.common.tag.TagFormatException;
import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.TokenPattern;

public class TestTokenLists {

    static List<Token> tokens(String... texts) throws TagFormatException {
        List<Token> ret = new ArrayList<Token>();
        for (String text:texts)
            ret.add(Token.parse(text));
        return ret;
    }

    @Test
    public void testMatch() throws Exception {
        List<Token> line = tokens("cn<if>", "ob<card>", "cn<would>", "xa<die>", ",", "ka<exile>", "xo<it>", "cn<instead>", ".");
        assertEquals(2, TokenLists.match(line, TokenPattern.tag(TagCode.CONDITIONAL, "would"), TokenPattern.ACTION));
        assertEquals(-1, TokenLists.match(line, TokenPattern.ACTION, TokenPattern.ACTION));
        assertTrue(TokenLists.startsWith(line, TokenPattern.CONDITIONAL, TokenPattern.THING));
        assertTrue(TokenLists.endsWith(line, TokenPattern.word(".")));
        assertEquals(5, TokenLists.indexOf(line, TokenPattern.ACTION, 4));
        assertEquals(7, TokenLists.lastIndexOf(line, TokenPattern.CONDITIONAL));
        assertArrayEquals(new int[]{0, 2, 7}, TokenLists.indicesOf(line, TokenPattern.CONDITIONAL).toArray());
    }

    @Test
    public void testSplitJoin() throws Exception {
        List<Token> line = tokens("kw<flying>", ",", "kw<vigilance>", ",", "kw<haste>");
        List<List<Token>> pieces = TokenLists.split(line, TokenPattern.word(","));
        assertEquals(3, pieces.size());
        assertEquals(line, TokenLists.join(pieces, Token.word(",")));
        assertEquals(Arrays.asList(Token.word("a"), Token.word("b")),
                TokenLists.replace(tokens("x", "y", "b"), tokens("a"), TokenPattern.word("x"), TokenPattern.word("y")));
    }
}
