package org.mtgl.common.tag;

/**
 * One atomic unit of a tokenized line: a {@link Tag} or a literal word,
 * game symbol or punctuation mark.
 */
public final class Token {

    public enum Type {
        TAG,
        SYMBOL,
        WORD,
        PUNCTUATION
    }

    final Tag tag;
    final String text;
    final Type type;

    Token(Tag tag, String text) {
        this.tag = tag;
        this.text = text;
        if (tag!=null)
            type = Type.TAG;
        else if (Symbols.isPunctuation(text))
            type = Type.PUNCTUATION;
        else if (Symbols.isMtgSymbol(text))
            type = Type.SYMBOL;
        else
            type = Type.WORD;
    }

    public static Token of(Tag tag) {
        return new Token(tag, tag.toString());
    }

    public static Token word(String text) {
        if (text==null || text.isEmpty())
            throw new IllegalArgumentException("empty token");
        return new Token(null, text);
    }

    /**
     * Converts one piece of annotated text into a token.
     * @throws TagFormatException if the text starts like a tag but is malformed
     */
    public static Token parse(String text) throws TagFormatException {
        if (Tag.looksLikeTag(text))
            return of(Tag.parse(text));
        return word(text);
    }

    public boolean isTag() {
        return tag!=null;
    }

    /**
     * @return the tag, or null for a literal token
     */
    public Tag getTag() {
        return tag;
    }

    public String getText() {
        return text;
    }

    public Type getType() {
        return type;
    }

    public TagCode getCode() {
        return tag==null?null:tag.getCode();
    }

    public String getValue() {
        return tag==null?text:tag.getValue();
    }

    public boolean is(TagCode code) {
        return tag!=null && tag.getCode()==code;
    }

    public boolean is(TagCode code, String value) {
        return tag!=null && tag.is(code, value);
    }

    public boolean isWord(String word) {
        return tag==null && text.equals(word);
    }

    public boolean isPunctuation() {
        return type==Type.PUNCTUATION;
    }

    public boolean isSymbol() {
        return type==Type.SYMBOL;
    }

    @Override
    public String toString() {
        return text;
    }

    @Override
    public boolean equals(Object obj) {
        if (this==obj)
            return true;
        if (!(obj instanceof Token))
            return false;
        return text.equals(((Token)obj).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }
}
