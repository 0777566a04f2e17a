package org.mtgl.common.tag;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An annotated span: a category code, a normalized value and an ordered set
 * of attributes. Tags are immutable; the with* methods return modified copies.
 * <p>
 * The textual form is {@code code<value key=val key=val>}. Attributes keep
 * their insertion order so the textual form is exactly reproducible.
 */
public final class Tag {

    static final Pattern TAG_PATTERN = Pattern.compile("^(\\w\\w)<([^\\s<>=]+)((?:\\s\\w+=[^\\s<>]+)*)>$");
    static final Pattern ATTR_PATTERN = Pattern.compile("(\\w+)=([^\\s<>]+)");
    static final Pattern TAG_PREFIX = Pattern.compile("^\\w\\w<");
    static final Pattern KEY_PATTERN = Pattern.compile("^\\w+$");

    final TagCode code;
    final String value;
    final Map<String, String> attrs;

    public Tag(TagCode code, String value) {
        this(code, value, null);
    }

    public Tag(TagCode code, String value, Map<String, String> attrs) {
        if (code==null)
            throw new IllegalArgumentException("tag code is required");
        if (value==null || value.isEmpty() || !isClean(value) || value.indexOf('=')>=0)
            throw new IllegalArgumentException("invalid tag value '"+value+"'");
        this.code = code;
        this.value = value;
        Map<String, String> copy = new LinkedHashMap<String, String>();
        if (attrs!=null)
            for (Map.Entry<String, String> entry:attrs.entrySet()) {
                if (!KEY_PATTERN.matcher(entry.getKey()).matches())
                    throw new IllegalArgumentException("invalid attribute key '"+entry.getKey()+"'");
                if (entry.getValue()==null || entry.getValue().isEmpty() || !isClean(entry.getValue()))
                    throw new IllegalArgumentException("invalid value for attribute "+entry.getKey());
                copy.put(entry.getKey(), entry.getValue());
            }
        this.attrs = Collections.unmodifiableMap(copy);
    }

    static boolean isClean(String text) {
        for (int i=0; i<text.length(); ++i) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c) || c=='<' || c=='>')
                return false;
        }
        return true;
    }

    /**
     * Parses the textual form of a tag.
     * @param text text in tag notation
     * @return the parsed tag
     * @throws TagFormatException if text is not a well formed tag or its code is unknown
     */
    public static Tag parse(String text) throws TagFormatException {
        if (text==null)
            throw new TagFormatException("null");
        Matcher matcher = TAG_PATTERN.matcher(text);
        if (!matcher.matches())
            throw new TagFormatException(text);
        TagCode code = TagCode.fromCode(matcher.group(1));
        if (code==null)
            throw new TagFormatException(text, "unknown tag code "+matcher.group(1));

        Map<String, String> attrs = new LinkedHashMap<String, String>();
        if (matcher.group(3)!=null && !matcher.group(3).isEmpty()) {
            Matcher attrMatcher = ATTR_PATTERN.matcher(matcher.group(3));
            while (attrMatcher.find())
                attrs.put(attrMatcher.group(1), attrMatcher.group(2));
        }
        return new Tag(code, matcher.group(2), attrs);
    }

    /**
     * @return true if text starts like a tag (two word characters and an
     * opening bracket), whether or not the remainder is well formed
     */
    public static boolean looksLikeTag(String text) {
        return text!=null && TAG_PREFIX.matcher(text).find();
    }

    public TagCode getCode() {
        return code;
    }

    public String getValue() {
        return value;
    }

    public Map<String, String> getAttrs() {
        return attrs;
    }

    public String getAttr(String key) {
        return attrs.get(key);
    }

    public boolean hasAttr(String key) {
        return attrs.containsKey(key);
    }

    public boolean hasAttrs() {
        return !attrs.isEmpty();
    }

    public boolean is(TagCode code) {
        return this.code==code;
    }

    public boolean is(TagCode code, String value) {
        return this.code==code && this.value.equals(value);
    }

    public boolean isNegated() {
        return value.startsWith(Symbols.NOT);
    }

    public Tag withValue(String newValue) {
        return new Tag(code, newValue, attrs);
    }

    public Tag withCode(TagCode newCode) {
        return new Tag(newCode, value, attrs);
    }

    public Tag withAttr(String key, String attrValue) {
        Map<String, String> copy = new LinkedHashMap<String, String>(attrs);
        copy.put(key, attrValue);
        return new Tag(code, value, copy);
    }

    /**
     * Adds the attribute, joining it to an existing value with op.
     */
    public Tag withJoinedAttr(String key, String attrValue, String op) {
        String old = attrs.get(key);
        return withAttr(key, old==null?attrValue:old+op+attrValue);
    }

    public Tag withoutAttr(String key) {
        if (!attrs.containsKey(key))
            return this;
        Map<String, String> copy = new LinkedHashMap<String, String>(attrs);
        copy.remove(key);
        return new Tag(code, value, copy);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(code.getCode()).append('<').append(value);
        for (Map.Entry<String, String> entry:attrs.entrySet())
            builder.append(' ').append(entry.getKey()).append('=').append(entry.getValue());
        builder.append('>');
        return builder.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this==obj)
            return true;
        if (!(obj instanceof Tag))
            return false;
        Tag rhs = (Tag)obj;
        return code==rhs.code && value.equals(rhs.value) && attrs.equals(rhs.attrs);
    }

    @Override
    public int hashCode() {
        return (code.hashCode()*31+value.hashCode())*31+attrs.hashCode();
    }
}
