package org.mtgl.parser;

import java.util.List;
import java.util.Map;

import org.mtgl.common.tag.Tag;
import org.mtgl.common.tag.TagCode;
import org.mtgl.common.tag.Token;

/**
 * One rewrite of a token line. Passes never modify their input, they build
 * and return a new list.
 */
public abstract class ResolverPass {

    public abstract List<Token> apply(List<Token> tokens);

    public String getName() {
        return getClass().getSimpleName();
    }

    static Token token(TagCode code, String value) {
        return Token.of(new Tag(code, value));
    }

    static Token token(TagCode code, String value, Map<String, String> attrs) {
        return Token.of(new Tag(code, value, attrs));
    }

    /**
     * @return tokens[i], or null when i is out of range
     */
    static Token at(List<Token> tokens, int i) {
        return i>=0 && i<tokens.size()?tokens.get(i):null;
    }

    static Token last(List<Token> tokens) {
        return tokens.isEmpty()?null:tokens.get(tokens.size()-1);
    }

    static Token pop(List<Token> tokens) {
        return tokens.remove(tokens.size()-1);
    }
}
