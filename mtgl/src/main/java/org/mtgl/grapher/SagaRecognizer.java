package org.mtgl.grapher;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import org.mtgl.common.tag.Token;
import org.mtgl.common.util.TokenLists;
import org.mtgl.grammar.CatalogException;

/**
 * A saga chapter, "I, II — effect". Only tried on saga cards.
 */
class SagaRecognizer extends Recognizer<Parts> {

    static final Pattern ROMAN = Pattern.compile("^[ivx]+$");

    @Override
    Parts match(GraphContext ctx, List<Token> tokens) {
        if (!ctx.isSaga())
            return null;
        int hyphen = TokenLists.indexOf(tokens, Spans.HYPHEN);
        if (hyphen<1)
            return null;
        List<String> chapters = new ArrayList<String>();
        for (int i=0; i<hyphen; ++i) {
            Token token = tokens.get(i);
            if (i%2==1) {
                if (!Spans.COMMA.matches(token))
                    return null;
            } else if (token.isTag() || !ROMAN.matcher(token.getText()).matches())
                return null;
            else
                chapters.add(token.getText().toUpperCase(Locale.ROOT));
        }
        if (hyphen%2==0)
            return null;
        return new Parts("saga").attr("chapter", ActionGrapher.join(chapters, ", ")).add(TokenLists.sub(tokens, hyphen+1));
    }

    @Override
    String build(GraphContext ctx, String parent, Parts match) throws CatalogException {
        String id = ctx.tree.addNode(parent, "saga-chapter", match.attrs);
        ctx.ability(id, match.get(0));
        return id;
    }
}
