package org.mtgl.grapher;

import java.util.ArrayList;
import java.util.List;

import org.mtgl.common.tag.Symbols;
import org.mtgl.common.tag.TagCode;
import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.TokenPattern;
import org.mtgl.common.tag.Tokens;
import org.mtgl.common.util.TokenLists;
import org.mtgl.grammar.CatalogException;

/**
 * A modal block: an instruction followed by bulleted modes. The instruction
 * is one of
 * <pre>
 *   [PLAYER] choose N —
 *   choose N. You may choose the same mode more than once.
 *   choose one or both —
 *   choose one that hasn't been chosen —
 *   choose N. Each mode must target a different player.
 *   As ~ enters the battlefield, choose A or B.
 * </pre>
 * In the last form each mode is labeled "A — effect".
 */
class ModalRecognizer extends Recognizer<Parts> {

    static final TokenPattern CHOOSE = TokenPattern.tag(TagCode.LITUUS_ACTION, "choose");
    static final TokenPattern OR = TokenPattern.word("or");

    static final String ANCHORED = "anchored";

    @Override
    boolean spansSentences() {
        return true;
    }

    static boolean isModal(List<Token> tokens) {
        return parse(tokens)!=null;
    }

    @Override
    Parts match(GraphContext ctx, List<Token> tokens) {
        return parse(tokens);
    }

    /**
     * @return the instruction attributes with the anchoring clause (possibly
     * empty) followed by one piece per mode, or null
     */
    static Parts parse(List<Token> tokens) {
        int bullet = Spans.indexOutsideQuotes(tokens, Spans.BULLET);
        if (bullet<2)
            return null;
        List<Token> preamble = TokenLists.sub(tokens, 0, bullet);
        Token player = null;
        if (Tokens.isPlayer(preamble.get(0)) && CHOOSE.matches(preamble.get(1))) {
            player = preamble.get(0);
            preamble = TokenLists.sub(preamble, 1);
        }
        Parts parts = instruction(preamble);
        if (parts==null)
            return null;
        if (player!=null)
            parts.attr("player", player.getValue());

        List<List<Token>> modes = Spans.split(TokenLists.sub(tokens, bullet+1), Spans.BULLET);
        for (List<Token> mode:modes) {
            if (Spans.isEmptySpan(mode))
                return null;
            parts.add(mode);
        }
        return parts;
    }

    static Parts instruction(List<Token> preamble) {
        if (TokenLists.matchesAt(preamble, 0, CHOOSE, TokenPattern.NUMBER)) {
            String n = preamble.get(1).getValue();
            if (preamble.size()==3 && Spans.HYPHEN.matches(preamble.get(2)))
                return new Parts("choose").attr("n", n).attr("option", "not-repeatable").add(empty());
            if (TokenLists.matchesAt(preamble, 2, OR, TokenPattern.word("both"), Spans.HYPHEN))
                return new Parts("choose").attr("n", Symbols.GE+"1").attr("option", "one-or-both").add(empty());
            if (TokenLists.contains(preamble, TokenPattern.word("hasnt"), TokenPattern.word("been"), CHOOSE))
                return new Parts("choose").attr("n", n).attr("option", "hasnt-been-chosen").add(empty());
            if (preamble.size()>2 && Spans.PERIOD.matches(preamble.get(2))) {
                if (TokenLists.contains(preamble, TokenPattern.word("once")))
                    return new Parts("choose").attr("n", n).attr("option", "repeatable").add(empty());
                if (TokenLists.contains(preamble, TokenPattern.word("must")))
                    return new Parts("choose").attr("n", Symbols.GE+"1").attr("option", "one-mode-per-player").add(empty());
            }
            return null;
        }
        if (!preamble.isEmpty() && preamble.get(0).isWord("as")) {
            int comma = TokenLists.indexOf(preamble, Spans.COMMA);
            if (comma>1 && CHOOSE.matches(ActionGrapher.at(preamble, comma+1)))
                return new Parts(ANCHORED).attr("n", "1").attr("option", "one-of").add(TokenLists.sub(preamble, 1, comma));
        }
        return null;
    }

    static List<Token> empty() {
        return new ArrayList<Token>();
    }

    @Override
    String build(GraphContext ctx, String parent, Parts match) throws CatalogException {
        String id = ctx.tree.addNode(parent, "modal");
        String instruction = ctx.tree.addNode(id, "instruction", match.attrs);
        if (!match.get(0).isEmpty())
            ctx.clause(instruction, match.get(0));
        for (int i=1; i<match.size(); ++i) {
            List<Token> mode = match.get(i);
            String modeId = ctx.tree.addNode(id, "mode");
            int hyphen = TokenLists.indexOf(mode, Spans.HYPHEN);
            if (ANCHORED.equals(match.kind) && hyphen>0) {
                ctx.tree.addAttr(modeId, "option", label(TokenLists.sub(mode, 0, hyphen)));
                mode = TokenLists.sub(mode, hyphen+1);
            }
            ctx.ability(modeId, mode);
        }
        return id;
    }

    /** Khans, Dragons */
    static String label(List<Token> tokens) {
        StringBuilder builder = new StringBuilder();
        for (Token token:tokens) {
            if (builder.length()>0)
                builder.append(' ');
            builder.append(token.getValue());
        }
        String label = Spans.sentenceCase(builder.toString());
        if (tokens.size()==1 && tokens.get(0).isTag() && !label.endsWith("s"))
            label += "s";
        return label;
    }
}
