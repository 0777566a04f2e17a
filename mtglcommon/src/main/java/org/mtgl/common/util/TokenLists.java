package org.mtgl.common.util;

import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;

import java.util.ArrayList;
import java.util.List;

import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.TokenPattern;

/**
 * Searching, splitting and joining of token sequences. Patterns are arrays
 * of {@link TokenPattern}, each matching exactly one token.
 */
public final class TokenLists {

    private TokenLists() {
    }

    /**
     * @return true if pattern matches tokens beginning at index start
     */
    public static boolean matchesAt(List<Token> tokens, int start, TokenPattern... pattern) {
        if (start<0 || start+pattern.length>tokens.size())
            return false;
        for (int i=0; i<pattern.length; ++i)
            if (!pattern[i].matches(tokens.get(start+i)))
                return false;
        return true;
    }

    public static boolean startsWith(List<Token> tokens, TokenPattern... pattern) {
        return matchesAt(tokens, 0, pattern);
    }

    public static boolean endsWith(List<Token> tokens, TokenPattern... pattern) {
        return matchesAt(tokens, tokens.size()-pattern.length, pattern);
    }

    /**
     * @return the first index at or after start where pattern matches, or -1
     */
    public static int match(List<Token> tokens, int start, TokenPattern... pattern) {
        for (int i=Math.max(start, 0); i+pattern.length<=tokens.size(); ++i)
            if (matchesAt(tokens, i, pattern))
                return i;
        return -1;
    }

    public static int match(List<Token> tokens, TokenPattern... pattern) {
        return match(tokens, 0, pattern);
    }

    public static boolean contains(List<Token> tokens, TokenPattern... pattern) {
        return match(tokens, 0, pattern)>=0;
    }

    public static int indexOf(List<Token> tokens, TokenPattern pattern, int from) {
        for (int i=Math.max(from, 0); i<tokens.size(); ++i)
            if (pattern.matches(tokens.get(i)))
                return i;
        return -1;
    }

    public static int indexOf(List<Token> tokens, TokenPattern pattern) {
        return indexOf(tokens, pattern, 0);
    }

    public static int lastIndexOf(List<Token> tokens, TokenPattern pattern) {
        for (int i=tokens.size()-1; i>=0; --i)
            if (pattern.matches(tokens.get(i)))
                return i;
        return -1;
    }

    public static TIntList indicesOf(List<Token> tokens, TokenPattern pattern) {
        TIntList indices = new TIntArrayList();
        for (int i=0; i<tokens.size(); ++i)
            if (pattern.matches(tokens.get(i)))
                indices.add(i);
        return indices;
    }

    public static int count(List<Token> tokens, TokenPattern pattern) {
        return indicesOf(tokens, pattern).size();
    }

    /**
     * @return a copy of tokens[from,to)
     */
    public static List<Token> sub(List<Token> tokens, int from, int to) {
        from = Math.max(from, 0);
        to = Math.min(to, tokens.size());
        if (from>=to)
            return new ArrayList<Token>();
        return new ArrayList<Token>(tokens.subList(from, to));
    }

    public static List<Token> sub(List<Token> tokens, int from) {
        return sub(tokens, from, tokens.size());
    }

    /**
     * Replaces every occurrence of pattern with replacement.
     * @return a new list
     */
    public static List<Token> replace(List<Token> tokens, List<Token> replacement, TokenPattern... pattern) {
        List<Token> ret = new ArrayList<Token>(tokens.size());
        int i = 0;
        while (i<tokens.size()) {
            if (pattern.length>0 && matchesAt(tokens, i, pattern)) {
                ret.addAll(replacement);
                i += pattern.length;
            } else
                ret.add(tokens.get(i++));
        }
        return ret;
    }

    /**
     * Splits on every token matching delimiter, dropping the delimiters.
     * Empty pieces are kept so positions stay aligned.
     */
    public static List<List<Token>> split(List<Token> tokens, TokenPattern delimiter) {
        List<List<Token>> pieces = new ArrayList<List<Token>>();
        List<Token> piece = new ArrayList<Token>();
        for (Token token:tokens) {
            if (delimiter.matches(token)) {
                pieces.add(piece);
                piece = new ArrayList<Token>();
            } else
                piece.add(token);
        }
        pieces.add(piece);
        return pieces;
    }

    public static List<Token> join(List<List<Token>> pieces, Token delimiter) {
        List<Token> ret = new ArrayList<Token>();
        for (int i=0; i<pieces.size(); ++i) {
            if (i>0 && delimiter!=null)
                ret.add(delimiter);
            ret.addAll(pieces.get(i));
        }
        return ret;
    }

    /**
     * Removes one trailing token matching pattern, if present.
     */
    public static List<Token> stripTrailing(List<Token> tokens, TokenPattern pattern) {
        if (!tokens.isEmpty() && pattern.matches(tokens.get(tokens.size()-1)))
            return sub(tokens, 0, tokens.size()-1);
        return tokens;
    }

    public static String toString(List<Token> tokens) {
        StringBuilder builder = new StringBuilder();
        for (Token token:tokens) {
            if (builder.length()>0)
                builder.append(' ');
            builder.append(token.getText());
        }
        return builder.toString();
    }
}
