package org.mtgl.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.mtgl.common.tag.TagFormatException;
import org.mtgl.common.tag.Token;

/**
 * Splits tagged text into tokens. Punctuation becomes its own token unless
 * it sits inside a tag, whitespace only separates.
 */
public class Tokenizer {

    // a delimiter followed by the rest of a tag is inside that tag
    static final Pattern DELIMITER = Pattern.compile("([:,\\.\"'•—\\s])(?![\\w\\s\\+/\\-=¬∧∨⊕⋖⋗≤≥≡→']+>)");

    /**
     * @return one token list per non empty line
     * @throws TagFormatException if a tag-shaped piece does not parse
     */
    public List<List<Token>> tokenize(String tagged) throws TagFormatException {
        List<List<Token>> lines = new ArrayList<List<Token>>();
        if (tagged==null)
            return lines;
        for (String line:tagged.split("\n")) {
            List<Token> tokens = tokenizeLine(line);
            if (!tokens.isEmpty())
                lines.add(tokens);
        }
        return lines;
    }

    public List<Token> tokenizeLine(String line) throws TagFormatException {
        List<Token> tokens = new ArrayList<Token>();
        Matcher matcher = DELIMITER.matcher(line);
        int last = 0;
        while (matcher.find()) {
            addPiece(tokens, line.substring(last, matcher.start()));
            String delimiter = matcher.group(1);
            if (!delimiter.trim().isEmpty())
                tokens.add(Token.word(delimiter));
            last = matcher.end();
        }
        addPiece(tokens, line.substring(last));
        return tokens;
    }

    static void addPiece(List<Token> tokens, String piece) throws TagFormatException {
        String trimmed = piece.trim();
        if (!trimmed.isEmpty())
            tokens.add(Token.parse(trimmed));
    }
}
