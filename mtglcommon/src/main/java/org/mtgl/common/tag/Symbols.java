package org.mtgl.common.tag;

import java.util.regex.Pattern;

/**
 * Operator and punctuation symbols of the annotated text, and the patterns
 * used to recognize game symbols.
 */
public final class Symbols {

    // structural operators
    public static final String NOT = "¬";
    public static final String AND = "∧";
    public static final String OR  = "∨";
    public static final String AOR = "⊕";
    public static final String LT  = "⋖";
    public static final String GT  = "⋗";
    public static final String LE  = "≤";
    public static final String GE  = "≥";
    public static final String EQ  = "≡";
    public static final String ARW = "→";

    // punctuation found in rules text
    public static final String HYP = "—";
    public static final String BLT = "•";
    public static final String PER = ".";
    public static final String CMA = ",";
    public static final String DBL = "\"";
    public static final String SNG = "'";
    public static final String COL = ":";
    public static final String MIN = "−";

    public static final String PUNCTUATION = ":,.\"'•—";

    /** one or more braced symbols, e.g. {T} or {2}{W} */
    public static final Pattern MTG_SYMBOL = Pattern.compile("^(\\{[0-9wubrgscpxtqe/]+\\})+$", Pattern.CASE_INSENSITIVE);

    /** one or more braced mana symbols */
    public static final Pattern MANA_STRING = Pattern.compile("^(\\{[0-9wubrgscpx/]+\\})+$", Pattern.CASE_INSENSITIVE);

    /** planeswalker loyalty cost, e.g. +nu<1> or −nu<x> */
    public static final Pattern LOYALTY_COST = Pattern.compile("^([\\+−]?)nu<([\\dx]+)>$");

    private Symbols() {
    }

    public static boolean isPunctuation(String text) {
        return text.length()==1 && PUNCTUATION.indexOf(text.charAt(0))>=0;
    }

    public static boolean isMtgSymbol(String text) {
        return MTG_SYMBOL.matcher(text).matches();
    }

    public static boolean isManaString(String text) {
        return MANA_STRING.matcher(text).matches();
    }

    public static boolean isLoyaltyCost(String text) {
        return LOYALTY_COST.matcher(text).matches();
    }
}
