package org.mtgl.common.tag;

import java.util.HashMap;
import java.util.Map;

/**
 * The closed set of two character category codes a {@link Tag} may carry.
 */
public enum TagCode {
    OBJECT("ob"),
    PLAYER("xp"),
    LITUUS_OBJECT("xo"),
    ZONE("zn"),
    EFFECT("ef"),
    KEYWORD_ACTION("ka"),
    LITUUS_ACTION("xa"),
    KEYWORD("kw"),
    CHARACTERISTIC("ch"),
    LITUUS_CHARACTERISTIC("xc"),
    STATUS("st"),
    LITUUS_STATUS("xs"),
    PHASE("ph"),
    QUANTIFIER("xq"),
    QUALIFIER("xr"),
    NUMBER("nu"),
    PREPOSITION("pr"),
    CONDITIONAL("cn"),
    SEQUENCE("sq"),
    TRIGGER_PREAMBLE("tp"),
    OPERATOR("op"),
    ABILITY_WORD("aw");

    static final Map<String, TagCode> codeMap = new HashMap<String, TagCode>();
    static {
        for (TagCode code:values())
            codeMap.put(code.code, code);
    }

    final String code;

    TagCode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * @param code two character code
     * @return the matching category or null if code is not part of the set
     */
    public static TagCode fromCode(String code) {
        return codeMap.get(code);
    }

    /** Entities and zones: anything that can be acted upon. */
    public boolean isThing() {
        return this==OBJECT || this==PLAYER || this==LITUUS_OBJECT || this==ZONE || this==EFFECT;
    }

    public boolean isAction() {
        return this==KEYWORD_ACTION || this==LITUUS_ACTION;
    }

    public boolean isProperty() {
        return this==CHARACTERISTIC || this==LITUUS_CHARACTERISTIC;
    }

    public boolean isState() {
        return this==STATUS || this==LITUUS_STATUS;
    }

    @Override
    public String toString() {
        return code;
    }
}
