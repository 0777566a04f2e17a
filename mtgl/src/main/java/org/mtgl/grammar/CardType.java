package org.mtgl.grammar;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Card type labels that change how a card's lines are graphed.
 */
public enum CardType {
    ARTIFACT,
    CREATURE,
    ENCHANTMENT,
    INSTANT,
    LAND,
    PLANESWALKER,
    SORCERY,
    TRIBAL,
    SAGA;

    /**
     * @return the type for a label such as "Instant", or null for labels
     * that play no part in graphing
     */
    public static CardType fromLabel(String label) {
        if (label==null)
            return null;
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public static Set<CardType> fromLabels(Iterable<String> labels) {
        Set<CardType> types = EnumSet.noneOf(CardType.class);
        for (String label:labels) {
            CardType type = fromLabel(label);
            if (type!=null)
                types.add(type);
        }
        return types;
    }

    /** instants and sorceries */
    public static boolean isSpell(Set<CardType> types) {
        return types.contains(INSTANT) || types.contains(SORCERY);
    }
}
