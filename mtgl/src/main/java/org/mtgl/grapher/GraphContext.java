package org.mtgl.grapher;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.mtgl.common.tag.Token;
import org.mtgl.common.tree.MTGTree;
import org.mtgl.grammar.CardType;
import org.mtgl.grammar.CatalogException;
import org.mtgl.grammar.GrammarCatalog;

/**
 * The state of graphing one document: its tree, name and card types, and
 * the entry points recognizers use to graph the spans they split off.
 */
public final class GraphContext {

    static final Set<String> NODE_ROLES = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
            "original-event", "new-event", "cond-condition", "cond-effect")));

    final Grapher grapher;
    final MTGTree tree;
    final String name;
    final Set<CardType> types;

    GraphContext(Grapher grapher, MTGTree tree, String name, Set<CardType> types) {
        this.grapher = grapher;
        this.tree = tree;
        this.name = name;
        this.types = types==null||types.isEmpty()?Collections.<CardType>emptySet():Collections.unmodifiableSet(EnumSet.copyOf(types));
    }

    public MTGTree getTree() {
        return tree;
    }

    public String getName() {
        return name;
    }

    public Set<CardType> getTypes() {
        return types;
    }

    public GrammarCatalog getCatalog() {
        return grapher.catalog;
    }

    boolean isSpell() {
        return CardType.isSpell(types);
    }

    boolean isSaga() {
        return types.contains(CardType.SAGA);
    }

    /** graphs an ability body: a nested ability if it is one, else a phrase */
    String ability(String parent, List<Token> tokens) throws CatalogException {
        return grapher.graphAbility(this, parent, tokens);
    }

    String phrase(String parent, List<Token> tokens) throws CatalogException {
        return grapher.phraseGrapher.graph(this, parent, tokens);
    }

    /** graphs tokens as a phrase under a new phrase node playing role */
    String rolePhrase(String parent, String role, List<Token> tokens) throws CatalogException {
        String id = tree.addNode(parent, "phrase", Collections.singletonMap("role", role));
        phrase(id, tokens);
        return id;
    }

    /**
     * Graphs each piece as a phrase. A piece whose role is a node type of
     * its own goes under a node of that type, any other under a phrase node
     * carrying the role.
     */
    void roles(String parent, Parts parts) throws CatalogException {
        for (int i=0; i<parts.size(); ++i) {
            String role = parts.role(i);
            if (NODE_ROLES.contains(role))
                phrase(tree.addNode(parent, role), parts.get(i));
            else
                rolePhrase(parent, role, parts.get(i));
        }
    }

    String clause(String parent, List<Token> tokens) throws CatalogException {
        return grapher.clauseGrapher.graph(this, parent, tokens);
    }

    String cost(String parent, List<Token> tokens) throws CatalogException {
        return grapher.costGrapher.graph(this, parent, tokens);
    }

    ThingGrapher things() {
        return grapher.thingGrapher;
    }

    ActionGrapher actions() {
        return grapher.actionGrapher;
    }

    KeywordGrapher keywords() {
        return grapher.keywordGrapher;
    }
}
