package org.mtgl.grapher;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.mtgl.common.tag.Symbols;
import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.TokenPattern;
import org.mtgl.common.tag.Tokens;
import org.mtgl.common.util.TokenLists;

/**
 * Quote aware splitting of token spans into sentences and clauses.
 */
final class Spans {

    static final TokenPattern PERIOD = TokenPattern.word(Symbols.PER);
    static final TokenPattern COMMA = TokenPattern.word(Symbols.CMA);
    static final TokenPattern COLON = TokenPattern.word(Symbols.COL);
    static final TokenPattern QUOTE = TokenPattern.word(Symbols.DBL);
    static final TokenPattern SINGLE_QUOTE = TokenPattern.word(Symbols.SNG);
    static final TokenPattern HYPHEN = TokenPattern.word(Symbols.HYP);
    static final TokenPattern BULLET = TokenPattern.word(Symbols.BLT);

    static final Token COMMA_TOKEN = Token.word(Symbols.CMA);
    static final Token PERIOD_TOKEN = Token.word(Symbols.PER);

    private Spans() {
    }

    /**
     * @return for each token, whether it lies between double quotes. The
     * quote marks themselves count as quoted.
     */
    static boolean[] quoted(List<Token> tokens) {
        boolean[] ret = new boolean[tokens.size()];
        boolean inside = false;
        for (int i=0; i<tokens.size(); ++i) {
            if (QUOTE.matches(tokens.get(i))) {
                ret[i] = true;
                inside = !inside;
            } else
                ret[i] = inside;
        }
        return ret;
    }

    static int indexOutsideQuotes(List<Token> tokens, TokenPattern pattern, int from) {
        boolean[] quoted = quoted(tokens);
        for (int i=Math.max(from, 0); i<tokens.size(); ++i)
            if (!quoted[i] && pattern.matches(tokens.get(i)))
                return i;
        return -1;
    }

    static int indexOutsideQuotes(List<Token> tokens, TokenPattern pattern) {
        return indexOutsideQuotes(tokens, pattern, 0);
    }

    static boolean containsOutsideQuotes(List<Token> tokens, TokenPattern pattern) {
        return indexOutsideQuotes(tokens, pattern)>=0;
    }

    /**
     * Splits on delimiters outside of quotes, dropping them. Empty pieces are
     * kept.
     */
    static List<List<Token>> split(List<Token> tokens, TokenPattern delimiter) {
        boolean[] quoted = quoted(tokens);
        List<List<Token>> pieces = new ArrayList<List<Token>>();
        List<Token> piece = new ArrayList<Token>();
        for (int i=0; i<tokens.size(); ++i) {
            if (!quoted[i] && delimiter.matches(tokens.get(i))) {
                pieces.add(piece);
                piece = new ArrayList<Token>();
            } else
                piece.add(tokens.get(i));
        }
        pieces.add(piece);
        return pieces;
    }

    /**
     * Sentences end with a period outside of quotes, the period stays with
     * its sentence.
     */
    static List<List<Token>> sentences(List<Token> tokens) {
        boolean[] quoted = quoted(tokens);
        List<List<Token>> ret = new ArrayList<List<Token>>();
        int prev = 0;
        for (int i=0; i<tokens.size(); ++i)
            if (!quoted[i] && PERIOD.matches(tokens.get(i))) {
                ret.add(TokenLists.sub(tokens, prev, i+1));
                prev = i+1;
            }
        if (prev<tokens.size())
            ret.add(TokenLists.sub(tokens, prev));
        return ret;
    }

    /**
     * Comma separated clauses; a bare leading "and" is dropped along with
     * empty clauses. Commas inside a list of things ("artifacts, creatures,
     * and enchantments") do not separate clauses.
     */
    static List<List<Token>> clauses(List<Token> tokens) {
        boolean[] quoted = quoted(tokens);
        boolean[] listed = listCommas(tokens);
        List<List<Token>> pieces = new ArrayList<List<Token>>();
        List<Token> piece = new ArrayList<Token>();
        for (int i=0; i<tokens.size(); ++i) {
            if (!quoted[i] && !listed[i] && COMMA.matches(tokens.get(i))) {
                pieces.add(piece);
                piece = new ArrayList<Token>();
            } else
                piece.add(tokens.get(i));
        }
        pieces.add(piece);

        List<List<Token>> ret = new ArrayList<List<Token>>();
        for (List<Token> clause:pieces) {
            if (!clause.isEmpty() && clause.get(0).isWord("and"))
                clause = TokenLists.sub(clause, 1);
            if (!clause.isEmpty())
                ret.add(clause);
        }
        return ret;
    }

    /**
     * @return for each token, whether it is a comma between the items of a
     * list of things
     */
    static boolean[] listCommas(List<Token> tokens) {
        boolean[] ret = new boolean[tokens.size()];
        int i = 0;
        while (i<tokens.size()) {
            int length = ThingGrapher.chainLength(tokens, i);
            if (length==0) {
                ++i;
                continue;
            }
            for (int j=i; j<i+length; ++j)
                ret[j] = COMMA.matches(tokens.get(j));
            i += length;
        }
        return ret;
    }

    /** drops commas at either end and a closing period */
    static List<Token> trim(List<Token> tokens) {
        int from = 0;
        int to = tokens.size();
        while (from<to && COMMA.matches(tokens.get(from)))
            ++from;
        while (to>from && (COMMA.matches(tokens.get(to-1)) || PERIOD.matches(tokens.get(to-1))))
            --to;
        return TokenLists.sub(tokens, from, to);
    }

    /** spans led by a trigger preamble belong to the delayed trigger */
    static boolean isTriggered(List<Token> tokens) {
        return !tokens.isEmpty() && Tokens.isTriggerPreamble(tokens.get(0));
    }

    static List<Token> stripPeriod(List<Token> tokens) {
        return TokenLists.stripTrailing(tokens, PERIOD);
    }

    /**
     * @return the first sentence's length including its period, or the whole
     * span if it has no period outside of quotes
     */
    static int firstSentenceLength(List<Token> tokens) {
        int idx = indexOutsideQuotes(tokens, PERIOD);
        return idx<0?tokens.size():idx+1;
    }

    /** first_strike → First strike */
    static String sentenceCase(String value) {
        String text = value.replace('_', ' ');
        if (text.isEmpty())
            return text;
        return text.substring(0, 1).toUpperCase(Locale.ROOT)+text.substring(1);
    }

    static boolean isEmptySpan(List<Token> tokens) {
        for (Token token:tokens)
            if (!token.isPunctuation())
                return false;
        return true;
    }
}
