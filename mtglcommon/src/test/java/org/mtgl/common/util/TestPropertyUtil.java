package org.mtgl.common.util;

import static org.junit.Assert.*;

import java.util.Properties;

import org.junit.Test;

public class TestPropertyUtil {

    @Test
    public void testFilter() {
        Properties props = new Properties();
        props.setProperty("mtgl.threads", "4");
        props.setProperty("threads", "1");
        props.setProperty("logger.level", "INFO");

        Properties filtered = PropertyUtil.filterProperties(props, "mtgl.", true);
        assertEquals("4", filtered.getProperty("threads"));
        assertEquals("INFO", filtered.getProperty("logger.level"));

        filtered = PropertyUtil.filterProperties(props, "mtgl.");
        assertEquals(1, filtered.size());
        assertEquals(4, PropertyUtil.getInt(filtered, "threads", 1));
        assertEquals(7, PropertyUtil.getInt(filtered, "missing", 7));
        assertTrue(PropertyUtil.getBoolean(filtered, "missing", true));
    }

    @Test
    public void testEnvironment() {
        Properties props = new Properties();
        props.setProperty("path", "${MTGL_SURELY_UNSET_VARIABLE}/cards.json");
        props.setProperty("plain", "value");
        Properties resolved = PropertyUtil.resolveEnvironmentVariables(props);
        assertEquals("/cards.json", resolved.getProperty("path"));
        assertEquals("value", resolved.getProperty("plain"));
        assertEquals("path = /cards.json\nplain = value\n", PropertyUtil.toString(resolved));
    }
}
