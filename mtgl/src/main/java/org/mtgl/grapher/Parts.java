package org.mtgl.grapher;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.mtgl.common.tag.Token;

/**
 * What a recognizer pulled out of a span: a kind, the sub-spans in order and
 * the attributes for the node it will create.
 */
final class Parts {

    final String kind;
    final List<List<Token>> pieces;
    final List<String> roles;
    final Map<String, String> attrs;

    Parts(String kind) {
        this.kind = kind;
        pieces = new ArrayList<List<Token>>();
        roles = new ArrayList<String>();
        attrs = new LinkedHashMap<String, String>();
    }

    Parts add(List<Token> piece) {
        return add(null, piece);
    }

    /** adds a piece that becomes a child node of type role */
    Parts add(String role, List<Token> piece) {
        pieces.add(piece);
        roles.add(role);
        return this;
    }

    String role(int i) {
        return roles.get(i);
    }

    Parts attr(String key, String value) {
        attrs.put(key, value);
        return this;
    }

    List<Token> get(int i) {
        return pieces.get(i);
    }

    /** the piece, or an empty list when there are fewer pieces */
    List<Token> opt(int i) {
        return i<pieces.size()?pieces.get(i):new ArrayList<Token>();
    }

    int size() {
        return pieces.size();
    }

    @Override
    public String toString() {
        return kind+attrs+pieces;
    }
}
