package org.mtgl.common.tag;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Category predicates over tokens. A null token belongs to no category.
 */
public final class Tokens {

    /** characteristics describing other characteristics rather than a kind of object */
    public static final Set<String> META_CHARACTERISTICS = new HashSet<String>(Arrays.asList(
            "p/t", "everything", "text", "name", "mana_cost", "cmc", "power", "toughness",
            "color_identity", "color", "type"));

    public static final Set<String> VARIABLES = new HashSet<String>(Arrays.asList("x", "y", "z"));

    private Tokens() {
    }

    /**
     * Returns the tag of a token that must be tagged.
     * @throws TagFormatException if the token is a literal
     */
    public static Tag untag(Token token) throws TagFormatException {
        if (token.getTag()==null)
            throw new TagFormatException(token.getText(), "not a tag");
        return token.getTag();
    }

    public static boolean isThing(Token token) {
        return token!=null && token.isTag() && token.getCode().isThing();
    }

    public static boolean isObject(Token token) {
        return token!=null && token.is(TagCode.OBJECT);
    }

    /** mtg objects and lituus objects */
    public static boolean isAnyObject(Token token) {
        return token!=null && (token.is(TagCode.OBJECT) || token.is(TagCode.LITUUS_OBJECT));
    }

    public static boolean isLituusObject(Token token) {
        return token!=null && token.is(TagCode.LITUUS_OBJECT);
    }

    public static boolean isPlayer(Token token) {
        return token!=null && token.is(TagCode.PLAYER);
    }

    public static boolean isZone(Token token) {
        return token!=null && token.is(TagCode.ZONE);
    }

    public static boolean isPhase(Token token) {
        return token!=null && token.is(TagCode.PHASE);
    }

    public static boolean isEffect(Token token) {
        return token!=null && token.is(TagCode.EFFECT);
    }

    public static boolean isProperty(Token token) {
        return token!=null && token.isTag() && token.getCode().isProperty();
    }

    public static boolean isCharacteristic(Token token) {
        return token!=null && token.is(TagCode.CHARACTERISTIC);
    }

    public static boolean isMetaCharacteristic(Token token) {
        if (token==null || !token.is(TagCode.CHARACTERISTIC))
            return false;
        for (String part:token.getValue().split("[∧∨⊕]"))
            if (!META_CHARACTERISTICS.contains(part.replace(Symbols.NOT, "")))
                return false;
        return true;
    }

    public static boolean isLituusCharacteristic(Token token) {
        return token!=null && token.is(TagCode.LITUUS_CHARACTERISTIC);
    }

    /** xc<control> or xc<own>, possibly negated */
    public static boolean isPossessive(Token token) {
        if (token==null || !token.is(TagCode.LITUUS_CHARACTERISTIC))
            return false;
        String value = token.getValue().replace(Symbols.NOT, "");
        return value.equals("control") || value.equals("own");
    }

    /** a characteristic, or an object carrying characteristics */
    public static boolean isQuality(Token token) {
        return token!=null && (token.is(TagCode.CHARACTERISTIC) || (token.is(TagCode.OBJECT) && token.getTag().hasAttr("characteristics")));
    }

    public static boolean isAction(Token token) {
        return token!=null && token.isTag() && token.getCode().isAction();
    }

    public static boolean isKeywordAction(Token token) {
        return token!=null && token.is(TagCode.KEYWORD_ACTION);
    }

    public static boolean isLituusAction(Token token) {
        return token!=null && token.is(TagCode.LITUUS_ACTION);
    }

    public static boolean isState(Token token) {
        return token!=null && token.isTag() && token.getCode().isState();
    }

    public static boolean isQuantifier(Token token) {
        return token!=null && token.is(TagCode.QUANTIFIER);
    }

    public static boolean isSequence(Token token) {
        return token!=null && token.is(TagCode.SEQUENCE);
    }

    public static boolean isPreposition(Token token) {
        return token!=null && token.is(TagCode.PREPOSITION);
    }

    public static boolean isConditional(Token token) {
        return token!=null && token.is(TagCode.CONDITIONAL);
    }

    public static boolean isNumber(Token token) {
        return token!=null && token.is(TagCode.NUMBER);
    }

    public static boolean isVariable(Token token) {
        return token!=null && token.is(TagCode.NUMBER) && VARIABLES.contains(token.getValue());
    }

    public static boolean isOperator(Token token) {
        return token!=null && token.is(TagCode.OPERATOR);
    }

    public static boolean isKeyword(Token token) {
        return token!=null && token.is(TagCode.KEYWORD);
    }

    public static boolean isAbilityWord(Token token) {
        return token!=null && token.is(TagCode.ABILITY_WORD);
    }

    public static boolean isTriggerPreamble(Token token) {
        return token!=null && token.is(TagCode.TRIGGER_PREAMBLE);
    }

    /** and, or, and/or */
    public static boolean isCoordinator(Token token) {
        return token!=null && (token.isWord("and") || token.isWord("or") || token.is(TagCode.OPERATOR, Symbols.AOR));
    }

    public static boolean isLoyaltyCost(Token token) {
        return token!=null && Symbols.isLoyaltyCost(token.getText());
    }

    public static boolean isManaString(Token token) {
        return token!=null && !token.isTag() && Symbols.isManaString(token.getText());
    }

    /** the operator joining a coordinator word */
    public static String operatorOf(Token coordinator) {
        if (coordinator.isWord("or"))
            return Symbols.OR;
        if (coordinator.isWord("and"))
            return Symbols.AND;
        return Symbols.AOR;
    }
}
