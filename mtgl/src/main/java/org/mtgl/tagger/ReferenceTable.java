package org.mtgl.tagger;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.mtgl.grammar.Vocabulary;

/**
 * Card names that other cards refer to ("named Sacrifice", "Partner with
 * Pir, Imaginative Rascal"), each with a stable identifier. Built once and
 * shared read-only. {@link #release()} drops the tables after a batch.
 */
public class ReferenceTable {

    public static class Builder {
        Map<String, String> names = new HashMap<String, String>();

        public Builder add(String name) {
            if (name!=null && !name.trim().isEmpty())
                names.put(name.trim(), refId(name.trim()));
            return this;
        }

        public Builder addAll(Collection<String> names) {
            for (String name:names)
                add(name);
            return this;
        }

        public ReferenceTable build() {
            return new ReferenceTable(names);
        }
    }

    volatile Map<String, String> idByName;
    volatile Map<String, String> nameById;
    volatile Pattern namePattern;

    ReferenceTable(Map<String, String> names) {
        idByName = Collections.unmodifiableMap(new HashMap<String, String>(names));
        Map<String, String> reverse = new HashMap<String, String>();
        for (Map.Entry<String, String> entry:names.entrySet())
            reverse.put(entry.getValue(), entry.getKey());
        nameById = Collections.unmodifiableMap(reverse);
        namePattern = names.isEmpty()?null:Vocabulary.wordPattern(names.keySet());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return an empty table, nothing is referenced by name
     */
    public static ReferenceTable empty() {
        return new ReferenceTable(Collections.<String, String>emptyMap());
    }

    /**
     * @return lower case hex md5 of the name, stable across runs
     */
    public static String refId(String name) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            byte[] hash = digest.digest(name.getBytes(StandardCharsets.UTF_8));
            return String.format("%032x", new BigInteger(1, hash));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 unavailable", e);
        }
    }

    /**
     * @return the identifier of the name, or null if the name is not referenced
     */
    public String lookup(String name) {
        return tables().get(name);
    }

    /**
     * @return the name behind an identifier, or null
     */
    public String nameOf(String refId) {
        Map<String, String> reverse = nameById;
        if (reverse==null)
            throw new IllegalStateException("reference table released");
        return reverse.get(refId);
    }

    /**
     * @return pattern matching any referenced name, longest first, or null when empty
     */
    public Pattern pattern() {
        tables();
        return namePattern;
    }

    public List<String> names() {
        List<String> names = new ArrayList<String>(tables().keySet());
        Collections.sort(names);
        return names;
    }

    public int size() {
        return tables().size();
    }

    public boolean isReleased() {
        return idByName==null;
    }

    /**
     * Drops the tables. Any later lookup throws {@link IllegalStateException}.
     */
    public void release() {
        idByName = null;
        nameById = null;
        namePattern = null;
    }

    Map<String, String> tables() {
        Map<String, String> names = idByName;
        if (names==null)
            throw new IllegalStateException("reference table released");
        return names;
    }
}
