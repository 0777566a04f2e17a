package org.mtgl.common.tree;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

public class TestMTGTree {

    MTGTree tree;

    @Before
    public void setUp() throws Exception {
        tree = new MTGTree();
    }

    @Test
    public void testIds() {
        assertEquals("root:0", tree.root());
        String a = tree.addNode(tree.root(), "clause");
        String b = tree.addNode(tree.root(), "clause");
        String c = tree.addNode(a, "thing");
        assertEquals("clause:0", a);
        assertEquals("clause:1", b);
        assertEquals("thing:0", c);

        tree.deleteNode(b);
        assertFalse(tree.hasNode(b));
        // serials are never reused
        assertEquals("clause:2", tree.addNode(tree.root(), "clause"));
    }

    @Test
    public void testChildrenOrder() {
        String a = tree.addNode(tree.root(), "x");
        String b = tree.addNode(tree.root(), "y");
        String c = tree.addNode(tree.root(), "x");
        assertEquals(Arrays.asList(a, b, c), tree.children(tree.root()));
        assertEquals(b, tree.rightSibling(a));
        assertNull(tree.rightSibling(c));
        assertEquals(tree.root(), tree.parent(b));
        assertNull(tree.parent(tree.root()));
        assertTrue(tree.isLeaf(a));
    }

    @Test
    public void testAttrs() {
        String a = tree.addNode(tree.root(), "thing", Collections.singletonMap("value", "card"));
        assertEquals("card", tree.attr(a, "value"));
        tree.addAttr(a, "value", "permanent");
        assertEquals("permanent", tree.attr(a, "value"));
        assertNull(tree.attr(a, "missing"));
        assertEquals(1, tree.attrs(a).size());
    }

    @Test
    public void testUnrooted() {
        String q = tree.addUnrootedNode("quoted-ability");
        String inner = tree.addNode(q, "clause");
        assertNull(tree.parent(q));
        assertFalse(tree.isRooted(inner));
        assertTrue(tree.findAll("clause").isEmpty());

        String holder = tree.addNode(tree.root(), "static-ability");
        tree.attach(holder, q);
        assertTrue(tree.isRooted(inner));
        assertEquals(Collections.singletonList(inner), tree.findAll("clause"));
        assertEquals(Arrays.asList(q, holder, tree.root()), tree.ancestors(inner));
    }

    @Test(expected=TreeException.class)
    public void testSecondParent() {
        String a = tree.addNode(tree.root(), "a");
        String b = tree.addNode(tree.root(), "b");
        tree.attach(a, b);
    }

    @Test(expected=TreeException.class)
    public void testCycle() {
        String a = tree.addUnrootedNode("a");
        String b = tree.addNode(a, "b");
        tree.attach(b, a);
    }

    @Test(expected=TreeException.class)
    public void testMissingNode() {
        tree.addNode("clause:42", "thing");
    }

    @Test(expected=TreeException.class)
    public void testValueWithoutAttr() {
        tree.findAll("thing", null, null, "card");
    }

    @Test
    public void testDelete() {
        String a = tree.addNode(tree.root(), "a");
        String b = tree.addNode(a, "b");
        String c = tree.addNode(b, "c");
        tree.deleteNode(a);
        assertFalse(tree.hasNode(a));
        assertFalse(tree.hasNode(b));
        assertFalse(tree.hasNode(c));
        assertTrue(tree.children(tree.root()).isEmpty());
        assertEquals(1, tree.size());
    }

    @Test
    public void testFindAll() {
        String x = tree.addNode(tree.root(), "x");
        String t1 = tree.addNode(x, "thing", Collections.singletonMap("kind", "object"));
        String late = tree.addUnrootedNode("thing", Collections.singletonMap("kind", "player"));
        String t2 = tree.addNode(tree.root(), "thing", Collections.singletonMap("kind", "object"));
        tree.attach(x, late);

        // creation order, not traversal order
        assertEquals(Arrays.asList(t1, late, t2), tree.findAll("thing"));
        assertEquals(Arrays.asList(t1, late), tree.findAll("thing", x));
        assertEquals(Arrays.asList(t1, t2), tree.findAll("thing", null, "kind", "object"));
        assertEquals(3, tree.findAll("thing", null, "kind", null).size());
        assertEquals(4, tree.findAll(null).size());
    }

    @Test
    public void testFuse() {
        MTGTree a = new MTGTree();
        String def = a.addNode(a.root(), "ability-word-definition");
        a.addNode(a.root(), "ability-word", Collections.singletonMap("definition", def));
        MTGTree b = new MTGTree();
        b.addNode(b.root(), "clause");

        MTGTree fused = MTGTree.fuse("Fire // Ice", a, b);
        List<String> halves = fused.children(fused.root());
        assertEquals(2, halves.size());
        assertEquals("a", fused.attr(halves.get(0), "side"));
        assertEquals("b", fused.attr(halves.get(1), "side"));
        assertEquals("Fire // Ice", fused.attr(fused.root(), "name"));

        String marker = fused.findAll("ability-word", halves.get(0)).get(0);
        String target = fused.attr(marker, "definition");
        assertEquals("ability-word-definition", fused.type(target));
        assertEquals(halves.get(0), fused.parent(target));
        assertEquals(1, fused.findAll("clause", halves.get(1)).size());

        for (String id:fused.descendants(fused.root()))
            assertTrue(fused.isRooted(id));
    }

    @Test
    public void testPrinter() {
        String k = tree.addNode(tree.root(), "keywords");
        tree.addNode(k, "kw-clause", Collections.singletonMap("keyword", "Flying"));
        tree.addNode(k, "kw-clause", Collections.singletonMap("keyword", "Vigilance"));
        tree.addNode(tree.root(), "clause");
        String expected = "root:0\n"
                + "├─ keywords:0\n"
                + "│  ├─ kw-clause:0 [keyword=Flying]\n"
                + "│  └─ kw-clause:1 [keyword=Vigilance]\n"
                + "└─ clause:0\n";
        assertEquals(expected, TreePrinter.print(tree, true));
        assertFalse(TreePrinter.print(tree, false).contains("Flying"));
    }
}
