package org.mtgl.grammar;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The parameter layout a keyword takes. Each shape names the fields that end
 * up as children of the keyword clause, in order.
 */
public enum ParamShape {
    /** Flying */
    EMPTY,
    /** Enchant creature, Champion a Faerie */
    THING("thing"),
    /** Swamp landwalk, Goblin offering */
    QUALITY("quality"),
    /** Protection from red, Hexproof from blue */
    FROM_QUALITY("quality"),
    /** Bushido 2, Crew 3 */
    N("n"),
    /** Flashback {2}{R}, Echo—Discard a card */
    COST("cost"),
    /** Kicker {1}{G} and/or {2}{U} */
    COST_OR_COST("cost", "cost"),
    /** Suspend 4—{1}{U} */
    N_COST("n", "cost"),
    /** Equip legendary creature {3}, Plainscycling {2} */
    QUALITY_COST("quality", "cost"),
    /** Affinity for artifacts */
    FOR_THING("thing"),
    /** Splice onto Arcane {1}{R} */
    ONTO_COST("quality", "cost"),
    /** Forecast—{1}{W}, Reveal this card from your hand: ... */
    SUB_LINE("line");

    final List<String> fields;

    ParamShape(String... fields) {
        this.fields = Collections.unmodifiableList(Arrays.asList(fields));
    }

    public List<String> getFields() {
        return fields;
    }
}
