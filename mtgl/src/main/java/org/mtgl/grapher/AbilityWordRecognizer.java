package org.mtgl.grapher;

import java.util.List;

import org.mtgl.common.tag.Token;
import org.mtgl.common.tag.Tokens;
import org.mtgl.common.util.TokenLists;
import org.mtgl.grammar.CatalogException;

/**
 * An ability word line, "WORD — definition". The definition is graphed once
 * into its own node and the ability-word marker refers to it by id.
 */
class AbilityWordRecognizer extends Recognizer<Parts> {

    @Override
    Parts match(GraphContext ctx, List<Token> tokens) {
        if (tokens.size()<3 || !Tokens.isAbilityWord(tokens.get(0)) || !Spans.HYPHEN.matches(tokens.get(1)))
            return null;
        return new Parts("ability-word")
                .attr("word", Spans.sentenceCase(tokens.get(0).getValue()))
                .add(TokenLists.sub(tokens, 2));
    }

    @Override
    String build(GraphContext ctx, String parent, Parts match) throws CatalogException {
        String definition = ctx.tree.addUnrootedNode("ability-word-definition");
        ctx.grapher.graphLine(ctx, definition, match.get(0));
        String marker = ctx.tree.addNode(parent, "ability-word", match.attrs);
        ctx.tree.addAttr(marker, "definition", definition);
        ctx.tree.attach(parent, definition);
        return marker;
    }
}
