package org.mtgl.grammar;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Lookup tables behind tagging and graphing: keyword templates loaded from
 * {@value #TEMPLATE_RESOURCE} and the fixed action to parameter shape table.
 * Immutable once loaded, safe to share between threads.
 */
public class GrammarCatalog {

    private static Logger logger = Logger.getLogger(GrammarCatalog.class.getPackage().getName());

    public static final String TEMPLATE_RESOURCE = "org/mtgl/grammar/keywords.properties";

    static final Map<String, ActionShape> ACTION_SHAPES;
    static {
        Map<String, ActionShape> map = new HashMap<String, ActionShape>();
        for (String act:new String[]{"destroy", "regenerate", "sacrifice", "tap", "untap", "detain",
                "exert", "unattach", "goad", "create", "exile", "manifest", "discard", "reveal",
                "counter", "activate", "cast", "play", "copy", "draw", "flip", "cycle", "choose",
                "transform", "abandon", "pay", "spend", "prevent", "skip", "win", "meld", "reduce"})
            map.put(act, ActionShape.DIRECT_OBJECT);
        for (String act:new String[]{"die", "attack", "block", "phase_in", "phase_out", "explore"})
            map.put(act, ActionShape.SUBJECT);
        for (String act:new String[]{"enter", "leave"})
            map.put(act, ActionShape.SUBJECT_ZONE);
        for (String act:new String[]{"return", "attach", "move", "remove", "look", "exchange"})
            map.put(act, ActionShape.OBJECT_PREP_OBJECT);
        for (String act:new String[]{"scry", "fateseal", "monstrosity", "bolster", "support",
                "surveil", "adapt", "amass"})
            map.put(act, ActionShape.COUNT);
        for (String act:new String[]{"gain", "lose", "get", "has", "have"})
            map.put(act, ActionShape.AMOUNT);
        for (String act:new String[]{"proliferate", "populate", "investigate"})
            map.put(act, ActionShape.NONE);
        map.put("clash", ActionShape.WITH_PLAYER);
        map.put("vote", ActionShape.CANDIDATES);
        map.put("add", ActionShape.MANA);
        map.put("put", ActionShape.PUT);
        map.put("distribute", ActionShape.DISTRIBUTE);
        map.put("fight", ActionShape.FIGHT);
        map.put("deal", ActionShape.DAMAGE);
        map.put("search", ActionShape.SEARCH);
        map.put("shuffle", ActionShape.SHUFFLE);
        ACTION_SHAPES = Collections.unmodifiableMap(map);
    }

    final Map<String, KeywordTemplate> templates;

    GrammarCatalog(Map<String, KeywordTemplate> templates) {
        this.templates = Collections.unmodifiableMap(templates);
    }

    /**
     * Loads the templates shipped with the library.
     * @throws CatalogException if the resource is missing or any keyword lacks a template
     */
    public static GrammarCatalog load() throws CatalogException {
        InputStream in = GrammarCatalog.class.getClassLoader().getResourceAsStream(TEMPLATE_RESOURCE);
        if (in==null)
            throw new CatalogException("missing keyword template resource "+TEMPLATE_RESOURCE);
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return load(reader);
        } catch (IOException e) {
            throw new CatalogException("failed to read "+TEMPLATE_RESOURCE, e);
        }
    }

    /**
     * Loads templates in properties format, {@code keyword = SHAPE} or
     * {@code keyword = SHAPE?} for partly optional parameters.
     * @throws CatalogException on a duplicate, unknown or missing keyword, or an unknown shape
     */
    public static GrammarCatalog load(Reader reader) throws CatalogException, IOException {
        final Map<String, String> entries = new LinkedHashMap<String, String>();
        final StringBuilder duplicates = new StringBuilder();
        Properties props = new Properties() {
            private static final long serialVersionUID = 1L;
            @Override
            public synchronized Object put(Object key, Object value) {
                if (entries.put(key.toString().trim(), value.toString().trim())!=null)
                    duplicates.append(' ').append(key);
                return super.put(key, value);
            }
        };
        props.load(reader);
        if (duplicates.length()>0)
            throw new CatalogException("duplicate keyword templates:"+duplicates);

        Map<String, String> displayNames = new HashMap<String, String>();
        for (String word:Vocabulary.KEYWORDS)
            displayNames.put(Vocabulary.tagValue(word), Character.toUpperCase(word.charAt(0))+word.substring(1));

        Map<String, KeywordTemplate> templates = new HashMap<String, KeywordTemplate>();
        for (Map.Entry<String, String> entry:entries.entrySet()) {
            String keyword = entry.getKey();
            String value = entry.getValue();
            if (!displayNames.containsKey(keyword))
                throw new CatalogException("template for unknown keyword "+keyword);
            boolean optional = value.endsWith("?");
            if (optional)
                value = value.substring(0, value.length()-1);
            ParamShape shape;
            try {
                shape = ParamShape.valueOf(value);
            } catch (IllegalArgumentException e) {
                throw new CatalogException("unknown parameter shape "+value+" for "+keyword, e);
            }
            templates.put(keyword, new KeywordTemplate(keyword, displayNames.get(keyword), shape, optional));
        }
        for (String keyword:displayNames.keySet())
            if (!templates.containsKey(keyword))
                throw new CatalogException("no template for keyword "+keyword);

        logger.fine("loaded "+templates.size()+" keyword templates");
        return new GrammarCatalog(templates);
    }

    /**
     * @param keyword keyword tag value, i.e. first_strike
     * @throws CatalogException if the keyword has no template
     */
    public KeywordTemplate template(String keyword) throws CatalogException {
        KeywordTemplate template = templates.get(keyword);
        if (template==null)
            throw new CatalogException("no template for keyword "+keyword);
        return template;
    }

    public boolean hasTemplate(String keyword) {
        return templates.containsKey(keyword);
    }

    public int size() {
        return templates.size();
    }

    /**
     * @return the parameter shape of a keyword or lituus action, null if it has none
     */
    public ActionShape actionShape(String action) {
        return ACTION_SHAPES.get(action);
    }

    /**
     * @return whether the keyword may follow the quality it refers to (swamp landwalk)
     */
    public boolean isKeywordVariation(String keyword) {
        return Vocabulary.KEYWORD_VARIATIONS.contains(keyword);
    }

    /**
     * @return whether the characteristic is a card type or subtype, the kind
     * that implies a permanent rather than a card
     */
    public boolean isTypeOrSubtype(String characteristic) {
        return Vocabulary.TYPES_AND_SUBTYPES.contains(characteristic);
    }
}
