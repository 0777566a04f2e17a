package org.mtgl.grammar;

/**
 * How an action's parameters are laid out in a clause. Actions without a
 * shape keep their parameters as a single opaque child.
 */
public enum ActionShape {
    /** destroy target creature */
    DIRECT_OBJECT,
    /** it dies, target creature attacks */
    SUBJECT,
    /** enters the battlefield, leaves your graveyard */
    SUBJECT_ZONE,
    /** return it to its owner's hand */
    OBJECT_PREP_OBJECT,
    /** scry 2 */
    COUNT,
    /** clash with an opponent */
    WITH_PLAYER,
    /** vote for artifact, creature, or enchantment */
    CANDIDATES,
    /** add {G}{G} */
    MANA,
    /** put a +1/+1 counter on it, put it into your hand */
    PUT,
    /** distribute three +1/+1 counters among */
    DISTRIBUTE,
    /** it fights target creature */
    FIGHT,
    /** deal 3 damage to any target */
    DAMAGE,
    /** gain 3 life, gets +2/+2, has flying */
    AMOUNT,
    /** search your library for a card */
    SEARCH,
    /** shuffle your library */
    SHUFFLE,
    /** proliferate */
    NONE
}
