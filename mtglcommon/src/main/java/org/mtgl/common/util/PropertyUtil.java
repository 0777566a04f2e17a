package org.mtgl.common.util;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Properties;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class PropertyUtil {

    private static Logger logger = Logger.getLogger(PropertyUtil.class.getPackage().getName());

    /**
     * Filters properties (does not inherit other properties)
     * @see #filterProperties(Properties, String, boolean)
     */
    public static Properties filterProperties(Properties in, String filter)
    {
        return filterProperties(in, filter, false);
    }

    /**
     * Returns the properties whose names begin with filter, with the filter
     * part truncated. If inherit is specified, the other properties are kept
     * as well, unless their name conflicts with a filtered property.
     * @param in input properties object
     * @param filter name prefix to select and truncate
     * @param inherit whether to keep properties that do not begin w/ the filter
     * @return filtered properties
     */
    public static Properties filterProperties(Properties in, String filter, boolean inherit)
    {
        Properties out = new Properties();

        for (String propName:in.stringPropertyNames())
            if (propName.startsWith(filter))
                out.setProperty(propName.substring(filter.length()), in.getProperty(propName));

        if (inherit)
            for (String propName:in.stringPropertyNames())
                if (!propName.startsWith(filter) && out.getProperty(propName) == null)
                    out.setProperty(propName, in.getProperty(propName));

        return out;
    }

    // match ${ENV_VAR_NAME}
    static final Pattern envPattern = Pattern.compile("\\$\\{(\\w+)\\}");

    /**
     * Returns a new properties object with ${ENV_VAR_NAME} references in the
     * values replaced by the environment. Unset variables become empty.
     */
    public static Properties resolveEnvironmentVariables(Properties in)
    {
        Properties out = new Properties();

        for (String propName:in.stringPropertyNames())
        {
            String value = in.getProperty(propName);
            Matcher m = envPattern.matcher(value);
            StringBuffer sb = new StringBuffer();
            while (m.find()) {
                String envVarValue = System.getenv(m.group(1));
                m.appendReplacement(sb, envVarValue == null ? "" : Matcher.quoteReplacement(envVarValue));
            }
            m.appendTail(sb);
            out.setProperty(propName, sb.toString());
        }

        return out;
    }

    /**
     * Loads UTF-8 properties from the classpath resource, then overlays the
     * file if one is given, and resolves environment variables.
     */
    public static Properties load(String resource, File propFile) throws IOException
    {
        Properties props = new Properties();
        if (resource != null) {
            InputStream in = PropertyUtil.class.getClassLoader().getResourceAsStream(resource);
            if (in == null)
                logger.warning("resource "+resource+" not found");
            else
                try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                    props.load(reader);
                }
        }
        if (propFile != null)
            try (Reader reader = new InputStreamReader(new FileInputStream(propFile), StandardCharsets.UTF_8)) {
                props.load(reader);
            }
        return resolveEnvironmentVariables(props);
    }

    public static int getInt(Properties props, String key, int defaultValue)
    {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty())
            return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warning("invalid integer for "+key+": "+value);
            return defaultValue;
        }
    }

    public static boolean getBoolean(Properties props, String key, boolean defaultValue)
    {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty())
            return defaultValue;
        return Boolean.parseBoolean(value.trim());
    }

    public static String toString(Properties props)
    {
        StringBuilder builder = new StringBuilder();

        String[] keys = props.stringPropertyNames().toArray(new String[0]);
        Arrays.sort(keys);
        for (String key:keys)
            builder.append(key+" = "+props.getProperty(key)+"\n");
        return builder.toString();
    }
}
