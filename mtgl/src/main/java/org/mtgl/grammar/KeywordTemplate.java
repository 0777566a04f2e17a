package org.mtgl.grammar;

/**
 * A keyword's canonical display name and parameter shape.
 */
public final class KeywordTemplate {

    final String keyword;
    final String name;
    final ParamShape shape;
    final boolean optional;

    KeywordTemplate(String keyword, String name, ParamShape shape, boolean optional) {
        this.keyword = keyword;
        this.name = name;
        this.shape = shape;
        this.optional = optional;
    }

    /** @return the tag value, i.e. first_strike */
    public String getKeyword() {
        return keyword;
    }

    /** @return sentence case display name, i.e. First strike */
    public String getName() {
        return name;
    }

    public ParamShape getShape() {
        return shape;
    }

    /** @return whether the parameters may be absent (Hexproof, Kicker with a single cost) */
    public boolean isOptional() {
        return optional;
    }

    @Override
    public String toString() {
        return name+"("+shape+(optional?"?":"")+")";
    }
}
