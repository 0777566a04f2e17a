package org.mtgl.parser;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import org.mtgl.common.tag.Tag;
import org.mtgl.common.tag.Token;
import org.mtgl.grammar.GrammarCatalog;
import org.mtgl.lexer.Tokenizer;

public class TestResolver {

    Tokenizer tokenizer;
    Resolver resolver;

    @Before
    public void setUp() throws Exception {
        tokenizer = new Tokenizer();
        resolver = new Resolver(GrammarCatalog.load());
    }

    @Test
    public void testGrouper() throws Exception {
        List<Token> tokens = new Grouper().apply(tokenizer.tokenizeLine("ka<destroy> xq<target> st<tapped> ob<creature>."));
        assertEquals(3, tokens.size());
        Tag tag = tokens.get(1).getTag();
        assertEquals("creature", tag.getValue());
        assertEquals("target", tag.getAttr("quantifier"));
        assertEquals("tapped", tag.getAttr("status"));

        tokens = new Grouper().apply(tokenizer.tokenizeLine("xa<draw> nu<2> ob<card>."));
        assertEquals(3, tokens.size());
        assertEquals("2", tokens.get(1).getTag().getAttr("num"));

        tokens = new Grouper().apply(tokenizer.tokenizeLine("xa<draw> a ob<card>."));
        assertEquals("a", tokens.get(1).getTag().getAttr("quantifier"));
    }

    @Test
    public void testPassOrder() {
        List<String> names = new ArrayList<String>();
        for (ResolverPass pass:resolver.getPasses())
            names.add(pass.getClass().getSimpleName());
        assertEquals("Rectifier", names.get(0));
        assertEquals("PossessiveMerger", names.get(names.size()-1));
        assertTrue(names.indexOf("Chainer")<names.indexOf("Grouper"));
    }

    @Test
    public void testDraftLinesDropped() throws Exception {
        List<List<Token>> lines = resolver.resolveAll(tokenizer.tokenize(
                "kw<flying>\ndraft ob<card ref=self> face up.\nkw<vigilance>"));
        assertEquals(2, lines.size());
        assertEquals("kw<flying>", lines.get(0).get(0).getText());
        assertEquals("kw<vigilance>", lines.get(1).get(0).getText());
    }

    @Test
    public void testResolveKeepsPunctuation() throws Exception {
        List<Token> tokens = resolver.resolve(tokenizer.tokenizeLine("xa<draw> nu<2> ob<card>."));
        assertEquals(".", tokens.get(tokens.size()-1).getText());
        boolean grouped = false;
        for (Token token:tokens)
            if (token.isTag() && "2".equals(token.getTag().getAttr("num")))
                grouped = true;
        assertTrue(tokens.toString(), grouped);
    }

    @Test
    public void testChainIdempotent() throws Exception {
        Chainer chainer = new Chainer(GrammarCatalog.load());
        List<Token> once = chainer.apply(tokenizer.tokenizeLine("ka<destroy> xq<target> ch<artifact> or ch<enchantment>."));
        assertEquals(4, once.size());
        assertEquals("artifact∨enchantment", once.get(2).getTag().getAttr("characteristics"));
        assertEquals(once, chainer.apply(once));

        List<Token> resolved = resolver.resolve(tokenizer.tokenizeLine("ka<destroy> xq<target> ch<artifact> or ch<enchantment>."));
        assertEquals(resolved, resolver.resolve(resolved));
    }

    @Test
    public void testRectifier() throws Exception {
        Rectifier rectifier = new Rectifier();
        List<Token> tokens = rectifier.apply(tokenizer.tokenizeLine("xa<put> a ka<counter> pr<on> xo<it>."));
        assertEquals("xo<ctr>", tokens.get(2).getText());

        tokens = rectifier.apply(tokenizer.tokenizeLine("ka<counter> xq<target> ob<spell>."));
        assertEquals("ka<counter>", tokens.get(0).getText());

        tokens = rectifier.apply(tokenizer.tokenizeLine("ch<power> nu<2> or less"));
        assertEquals(2, tokens.size());
        assertEquals("≤2", tokens.get(1).getValue());

        tokens = rectifier.apply(tokenizer.tokenizeLine("nu<3> or greater"));
        assertEquals("≥3", tokens.get(0).getValue());

        tokens = rectifier.apply(tokenizer.tokenizeLine("pr<to> xo<it> xp<owner> zn<hand>"));
        Tag owner = tokens.get(1).getTag();
        assertEquals("owner", owner.getValue());
        assertEquals("it", owner.getAttr("of"));
    }

    @Test
    public void testHangingAttacher() throws Exception {
        HangingAttacher attacher = new HangingAttacher();
        List<Token> tokens = attacher.apply(tokenizer.tokenizeLine("xq<target> ob<creature> pr<with> kw<flying>."));
        assertEquals(3, tokens.size());
        assertEquals("flying", tokens.get(1).getTag().getAttr("meta"));

        tokens = attacher.apply(tokenizer.tokenizeLine("ob<creature> pr<without> kw<flying>"));
        assertEquals("¬flying", tokens.get(0).getTag().getAttr("meta"));

        tokens = attacher.apply(tokenizer.tokenizeLine("ob<creature> pr<with> ch<power> op<≤> nu<2>"));
        assertEquals(1, tokens.size());
        assertEquals("power≤2", tokens.get(0).getTag().getAttr("meta"));

        tokens = attacher.apply(tokenizer.tokenizeLine("ob<creature> st<tapped>"));
        assertEquals(1, tokens.size());
        assertEquals("tapped", tokens.get(0).getTag().getAttr("status"));

        tokens = attacher.apply(tokenizer.tokenizeLine("ob<card> pr<in> zn<graveyard player=you>"));
        assertEquals(1, tokens.size());
        assertEquals("graveyard→you", tokens.get(0).getTag().getAttr("zone"));
    }

    @Test
    public void testZoneChainer() throws Exception {
        ZoneChainer chainer = new ZoneChainer();
        List<Token> tokens = chainer.apply(tokenizer.tokenizeLine("pr<from> zn<graveyard> and zn<library>"));
        assertEquals(2, tokens.size());
        assertEquals("zn<graveyard∧library>", tokens.get(1).getText());

        tokens = chainer.apply(tokenizer.tokenizeLine("zn<hand> op<⊕> zn<library>"));
        assertEquals("zn<hand⊕library>", tokens.get(0).getText());

        tokens = chainer.apply(tokenizer.tokenizeLine("zn<hand>, zn<library>, and zn<graveyard>"));
        assertEquals(1, tokens.size());
        assertEquals("zn<hand∧library∧graveyard>", tokens.get(0).getText());
    }

    @Test
    public void testPossessiveMerger() throws Exception {
        PossessiveMerger merger = new PossessiveMerger();
        List<Token> tokens = merger.apply(tokenizer.tokenizeLine("ob<creature> xp<you> xc<control>"));
        assertEquals(1, tokens.size());
        assertEquals("you", tokens.get(0).getTag().getAttr("controller"));

        tokens = merger.apply(tokenizer.tokenizeLine("ob<permanent> xp<you> xc<¬control>"));
        assertEquals("opponent", tokens.get(0).getTag().getAttr("controller"));

        tokens = merger.apply(tokenizer.tokenizeLine("ob<card> xp<opponent quantifier=an> xc<own>"));
        assertEquals("an∧opponent", tokens.get(0).getTag().getAttr("owner"));

        tokens = merger.apply(tokenizer.tokenizeLine("pr<into> xp<you> zn<graveyard>"));
        assertEquals(2, tokens.size());
        assertEquals("zn<graveyard player=you>", tokens.get(1).getText());
    }
}
