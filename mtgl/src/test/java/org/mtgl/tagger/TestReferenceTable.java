package org.mtgl.tagger;

import static org.junit.Assert.*;

import java.util.Arrays;

import org.junit.Test;

public class TestReferenceTable {

    @Test
    public void testRefId() {
        String id = ReferenceTable.refId("Lightning Bolt");
        assertTrue(id.matches("[0-9a-f]{32}"));
        assertEquals(id, ReferenceTable.refId("Lightning Bolt"));
        assertFalse(id.equals(ReferenceTable.refId("Lightning Helix")));
    }

    @Test
    public void testLookup() {
        ReferenceTable table = ReferenceTable.builder()
                .add("Sacrifice")
                .addAll(Arrays.asList("Pir, Imaginative Rascal", " ", "Toothy, Imaginary Friend"))
                .build();
        assertEquals(3, table.size());
        assertEquals(ReferenceTable.refId("Sacrifice"), table.lookup("Sacrifice"));
        assertNull(table.lookup("Fire"));
        assertEquals("Sacrifice", table.nameOf(ReferenceTable.refId("Sacrifice")));
        assertEquals(Arrays.asList("Pir, Imaginative Rascal", "Sacrifice", "Toothy, Imaginary Friend"), table.names());
        assertTrue(table.pattern().matcher("partner with Pir, Imaginative Rascal").find());
        assertNull(ReferenceTable.empty().pattern());
    }

    @Test
    public void testRelease() {
        ReferenceTable table = ReferenceTable.builder().add("Sacrifice").build();
        assertFalse(table.isReleased());
        table.release();
        assertTrue(table.isReleased());
        try {
            table.lookup("Sacrifice");
            fail("lookup after release");
        } catch (IllegalStateException e) {
            // expected
        }
    }
}
