package org.mtgl.tagger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.mtgl.common.tag.TagCode;
import org.mtgl.grammar.GrammarCatalog;
import org.mtgl.grammar.Vocabulary;

/**
 * Rewrites a card's rules text into annotated text: references to the card
 * itself and to other named cards become object tags, vocabulary words become
 * {@code xx<value>} tags and the remaining words are lower cased. Lines stay
 * separated by newlines. Stateless apart from the shared tables, so one
 * tagger serves any number of threads.
 */
public class Tagger {

    private static Logger logger = Logger.getLogger(Tagger.class.getPackage().getName());

    public static final String SELF_REF = "ob<card ref=self>";

    static final Pattern BULLET_LINE = Pattern.compile("\\n\\s*•");
    static final Pattern LEVEL_RANGE = Pattern.compile("^LEVEL (\\d+)-(\\d+)$", Pattern.MULTILINE);
    static final Pattern LEVEL_OPEN = Pattern.compile("^LEVEL (\\d+)\\+$", Pattern.MULTILINE);
    static final Pattern LEVEL_HEADER = Pattern.compile("^level \\d+ (?:to \\d+|or more)$");
    static final Pattern THIS_OBJECT = Pattern.compile("\\b(?i:this (?:spell|permanent|card))\\b|\\b(?:his|her)\\b");
    static final Pattern MANA_BRACES = Pattern.compile("\\{([0-9a-z/]+)\\}");
    static final Pattern MANA_REMINDER = Pattern.compile("\\((\\{T\\}: add [^()]+)\\)");
    static final Pattern REMINDER = Pattern.compile("\\(.+?\\)");
    static final Pattern NON = Pattern.compile("\\bnon(?!e\\b)(?=[a-z])");
    static final Pattern CYCLING = Pattern.compile("\\b([a-z]+?)cycling\\b");
    static final Pattern LANDWALK = Pattern.compile("\\b([a-z]+?)(?<!\\bland)walk\\b");
    static final Pattern PLURAL_POSSESSIVE = Pattern.compile("(\\w)s'(?!\\w)");
    static final Pattern POSSESSIVE = Pattern.compile("([\\w>])'s\\b");
    static final Pattern NUMBER = Pattern.compile("(?<![\\w{/])(\\d+|x)(?![\\w}/])");
    // power/toughness and counters match raw digits, so they run before NUMBER
    static final Pattern POWER_TOUGHNESS = Pattern.compile("(?<![\\w{/+-])([+-]?)(\\d+|x)/([+-]?)(\\d+|x)(?![\\w}/])(?! counter\\b)");
    static final Pattern PT_COUNTER = Pattern.compile("(?<![\\w{/])([+-])(\\d+|x)/([+-])(\\d+|x) counter\\b");
    static final Pattern NAMED_COUNTER = Pattern.compile(
            Vocabulary.wordPattern(Vocabulary.NAMED_COUNTERS).pattern()+" counter\\b");
    static final Pattern TAG_VALUE = Pattern.compile("(\\w\\w)<([^<>]*?)((?:\\s\\w+=[^\\s<>]+)*)>");
    static final Pattern LESS_EQUAL = Pattern.compile("ch<([^<>\\s]+)> nu<([\\dxyz]+)> or less");
    static final Pattern GREATER_EQUAL = Pattern.compile("ch<([^<>\\s]+)> nu<([\\dxyz]+)> or greater");
    static final Pattern IS_OPERATOR = Pattern.compile("\\bis (op<[⋖⋗≤≥≡]+>)");
    static final Pattern OPERATOR_TO = Pattern.compile("(op<[⋖⋗≤≥≡]+>) pr<to>");
    static final Pattern UP_TO = Pattern.compile("pr<up_to> nu<([\\dxyz]+)>");
    static final Pattern NEGATED_TAG = Pattern.compile("\\bnon-(\\w\\w)<");
    static final Pattern DONT_CONTROL = Pattern.compile("\\bdont xc<(control|own)>");
    static final Pattern PROTECTION_LIST = Pattern.compile(
            "kw<protection> pr<from> ch<([^<>\\s]+)>, pr<from> ch<([^<>\\s]+)>, and pr<from>");

    static final Map<String, String> REPHRASE;
    static {
        Map<String, String> map = new LinkedHashMap<String, String>();
        map.put("xo<mana> xc<cost>", "ch<mana_cost>");
        map.put("ph<combat> ef<damage>", "ef<combat_damage>");
        map.put("xo<mana> ob<ability>", "xo<mana_ability>");
        map.put("xa<declare> xo<blocker> ph<step>", "ph<declare_blockers_step>");
        map.put("xa<declare> xo<attacker> ph<step>", "ph<declare_attackers_step>");
        map.put("ch<power> or ch<toughness>", "ch<power∨toughness>");
        map.put("ch<power> and ch<toughness>", "ch<power∧toughness>");
        map.put("the zn<battlefield>", "zn<battlefield>");
        map.put("xq<any> number of", "nu<y>");
        map.put("a number of", "nu<z>");
        map.put("thats st<tapped> and xs<attacking>", "st<tapped> and xs<attacking>");
        map.put("xq<that> are st<tapped> and xs<attacking>", "st<tapped> and xs<attacking>");
        map.put("ch<aura> swap", "kw<aura_swap>");
        map.put("cumulative ph<upkeep>", "kw<cumulative_upkeep>");
        map.put("council dilemma", "aw<council's_dilemma>");
        map.put("ph<phase> out", "xa<phase_out>");
        map.put("ph<phase> pr<in>", "xa<phase_in>");
        map.put("xa<deal> ka<double> xq<that>", "xa<deal> twice xq<that>");
        map.put("xq<first> strike", "kw<first_strike>");
        map.put("split xq<second>", "kw<split_second>");
        map.put("xo<commander> kw<ninjutsu>", "kw<commander_ninjutsu>");
        REPHRASE = map;
    }

    /** vocabulary passes, in order, each applied outside of earlier tags */
    static final List<Substitution> CATEGORY_PASSES;
    static {
        List<Substitution> passes = new ArrayList<Substitution>();
        passes.add(Substitution.template(PT_COUNTER, "xo<ctr type=$1$2/$3$4>"));
        passes.add(Substitution.template(NAMED_COUNTER, "xo<ctr type=$1>"));
        passes.add(Substitution.template(POWER_TOUGHNESS, "ch<p/t val=$1$2/$3$4>"));
        passes.add(tagPass(Vocabulary.STATUS, TagCode.STATUS));
        passes.add(tagPass(Vocabulary.LITUUS_STATUS, TagCode.LITUUS_STATUS));
        passes.add(tagPass(Vocabulary.PHASES, TagCode.PHASE));
        passes.add(Substitution.tag(NUMBER, TagCode.NUMBER.getCode()));
        passes.add(tagPass(Vocabulary.QUANTIFIERS, TagCode.QUANTIFIER));
        passes.add(tagPass(Vocabulary.QUALIFIERS, TagCode.QUALIFIER));
        passes.add(tagPass(Vocabulary.EFFECTS, TagCode.EFFECT));
        passes.add(tagPass(Vocabulary.PLAYERS, TagCode.PLAYER));
        passes.add(tagPass(Vocabulary.LITUUS_OBJECTS, TagCode.LITUUS_OBJECT));
        passes.add(tagPass(Vocabulary.OBJECTS, TagCode.OBJECT));
        passes.add(tagPass(Vocabulary.CHARACTERISTICS, TagCode.CHARACTERISTIC));
        passes.add(tagPass(Vocabulary.LITUUS_CHARACTERISTICS, TagCode.LITUUS_CHARACTERISTIC));
        passes.add(tagPass(Vocabulary.ABILITY_WORDS, TagCode.ABILITY_WORD));
        passes.add(tagPass(Vocabulary.KEYWORDS, TagCode.KEYWORD));
        passes.add(tagPass(Vocabulary.KEYWORD_ACTIONS, TagCode.KEYWORD_ACTION));
        passes.add(tagPass(Vocabulary.LITUUS_ACTIONS, TagCode.LITUUS_ACTION));
        passes.add(tagPass(Vocabulary.ZONES, TagCode.ZONE));
        passes.add(tagPass(Vocabulary.TRIGGER_PREAMBLES, TagCode.TRIGGER_PREAMBLE));
        passes.add(Substitution.lookup(Vocabulary.wordPattern(Vocabulary.OPERATORS.keySet()),
                Vocabulary.OPERATORS, TagCode.OPERATOR.getCode()));
        passes.add(tagPass(Vocabulary.PREPOSITIONS, TagCode.PREPOSITION));
        passes.add(tagPass(Vocabulary.CONDITIONALS, TagCode.CONDITIONAL));
        passes.add(tagPass(Vocabulary.SEQUENCES, TagCode.SEQUENCE));
        CATEGORY_PASSES = passes;
    }

    static final Substitution WORD_HACKS = Substitution.lookup(
            Vocabulary.wordPattern(Vocabulary.WORD_HACKS.keySet()), Vocabulary.WORD_HACKS, null);
    static final Substitution NUMBER_WORDS = Substitution.lookup(
            Vocabulary.wordPattern(Vocabulary.NUMBER_WORDS.keySet()), Vocabulary.NUMBER_WORDS, null);
    static final Substitution CONJUGATIONS = Substitution.lookup(
            Vocabulary.wordPattern(Vocabulary.ACTION_CONJUGATIONS.keySet()), Vocabulary.ACTION_CONJUGATIONS, null);
    static final Substitution PLURALS = Substitution.lookup(
            Vocabulary.wordPattern(Vocabulary.CHARACTERISTIC_PLURALS.keySet()), Vocabulary.CHARACTERISTIC_PLURALS, null);
    static final Substitution REPHRASES = Substitution.lookup(
            alternation(REPHRASE.keySet()), REPHRASE, null);

    static final Pattern TOKEN_NAMED = Pattern.compile("([Cc]reate\\s.+?\\snamed) "
            +Vocabulary.wordPattern(Vocabulary.TOKEN_NAMES).pattern());
    static final Pattern TOKEN_LEADING = Pattern.compile("([Cc]reate) "
            +Vocabulary.wordPattern(Vocabulary.TOKEN_NAMES).pattern()+"(, .+? token)");
    static final Pattern MELD_NAME = Vocabulary.wordPattern(Vocabulary.MELD_NAMES);

    final GrammarCatalog catalog;
    final ReferenceTable references;
    final Pattern namedReference;

    public Tagger(GrammarCatalog catalog, ReferenceTable references) {
        this.catalog = catalog;
        this.references = references;
        Pattern names = references.pattern();
        namedReference = names==null?null:Pattern.compile("\\b(named|[Pp]artner with) "+names.pattern());
    }

    static Substitution tagPass(List<String> words, TagCode code) {
        return Substitution.tag(Vocabulary.wordPattern(words), code.getCode());
    }

    static Pattern alternation(Iterable<String> phrases) {
        List<String> quoted = new ArrayList<String>();
        for (String phrase:phrases)
            quoted.add(phrase);
        Collections.sort(quoted, new Comparator<String>() {
            @Override
            public int compare(String lhs, String rhs) {
                return rhs.length()-lhs.length();
            }
        });
        StringBuilder builder = new StringBuilder("(?<![\\w<])(");
        for (int i=0; i<quoted.size(); ++i)
            builder.append(i==0?"":"|").append(Pattern.quote(quoted.get(i)));
        return Pattern.compile(builder.append(')').toString());
    }

    /**
     * Tags one face of a card.
     * @param name the face's name, used to find self references
     * @param text the face's rules text, may span several lines
     * @return the tagged text, one line per ability
     */
    public String tag(String name, String text) {
        if (text==null || text.trim().isEmpty())
            return "";
        String tagged = scrub(text);
        tagged = tagSelfReferences(name, tagged);
        tagged = tagNamedReferences(tagged);
        tagged = tagged.toLowerCase(Locale.ROOT);
        tagged = upperCaseMana(tagged);
        tagged = MANA_REMINDER.matcher(tagged).replaceAll("$1");
        tagged = REMINDER.matcher(tagged).replaceAll("");
        tagged = groupLevels(tagged);
        tagged = preprocess(tagged);
        for (Substitution pass:CATEGORY_PASSES)
            tagged = pass.applyOutsideTags(tagged);
        tagged = postprocess(tagged);
        tagged = normalizeSpacing(tagged);
        logger.finer(name+": "+tagged);
        return tagged;
    }

    /**
     * Joins bulleted modes to the line that introduces them and replaces
     * semicolons with commas.
     */
    String scrub(String text) {
        String scrubbed = text.replace("\r", "");
        scrubbed = BULLET_LINE.matcher(scrubbed).replaceAll(" •");
        scrubbed = scrubbed.replace(';', ',');
        scrubbed = LEVEL_RANGE.matcher(scrubbed).replaceAll("level $1 to $2");
        scrubbed = LEVEL_OPEN.matcher(scrubbed).replaceAll("level $1 or more");
        return scrubbed;
    }

    String tagSelfReferences(String name, String text) {
        String tagged = text;
        if (name!=null && !name.trim().isEmpty()) {
            String shortName = name.split(",")[0].trim();
            StringBuilder names = new StringBuilder("\\b(?:").append(Pattern.quote(name.trim()));
            if (!shortName.isEmpty() && !shortName.equals(name.trim()))
                names.append('|').append(Pattern.quote(shortName));
            Pattern self = Pattern.compile(names.append(")(?!\\w)").toString());
            tagged = self.matcher(tagged).replaceAll(Matcher.quoteReplacement(SELF_REF));
        }
        return THIS_OBJECT.matcher(tagged).replaceAll(Matcher.quoteReplacement(SELF_REF));
    }

    String tagNamedReferences(String text) {
        String tagged = new Substitution(TOKEN_NAMED) {
            @Override
            String replace(Matcher matcher) {
                return matcher.group(1)+" ob<token ref="+ReferenceTable.refId(matcher.group(2))+">";
            }
        }.apply(text);
        tagged = new Substitution(TOKEN_LEADING) {
            @Override
            String replace(Matcher matcher) {
                return matcher.group(1)+" ob<token ref="+ReferenceTable.refId(matcher.group(2))+">"+matcher.group(3);
            }
        }.apply(tagged);
        tagged = new Substitution(MELD_NAME) {
            @Override
            String replace(Matcher matcher) {
                return "ob<token ref="+ReferenceTable.refId(matcher.group(1))+">";
            }
        }.applyOutsideTags(tagged);
        if (namedReference!=null) {
            tagged = new Substitution(namedReference) {
                @Override
                String replace(Matcher matcher) {
                    return matcher.group(1)+" ob<card ref="+references.lookup(matcher.group(2))+">";
                }
            }.applyOutsideTags(tagged);
        }
        return tagged;
    }

    static String upperCaseMana(String text) {
        return new Substitution(MANA_BRACES) {
            @Override
            String replace(Matcher matcher) {
                return '{'+matcher.group(1).toUpperCase(Locale.ROOT)+'}';
            }
        }.apply(text);
    }

    /**
     * A leveler's header line absorbs the lines after it up to the next
     * header, separated by bullets.
     */
    static String groupLevels(String text) {
        String[] lines = text.split("\n");
        StringBuilder builder = new StringBuilder();
        boolean inLevel = false;
        for (String line:lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty())
                continue;
            boolean header = LEVEL_HEADER.matcher(trimmed).matches();
            if (builder.length()>0)
                builder.append(inLevel && !header?" • ":"\n");
            builder.append(trimmed);
            if (header)
                inLevel = true;
        }
        return builder.toString();
    }

    String preprocess(String text) {
        String processed = NON.matcher(text).replaceAll("non-");
        processed = CYCLING.matcher(processed).replaceAll("$1 cycling");
        processed = LANDWALK.matcher(processed).replaceAll("$1 landwalk");
        processed = Substitution.template(PLURAL_POSSESSIVE, "$1").applyOutsideTags(processed);
        processed = WORD_HACKS.applyOutsideTags(processed);
        processed = Substitution.template(POSSESSIVE, "$1").apply(processed);
        processed = NUMBER_WORDS.applyOutsideTags(processed);
        processed = CONJUGATIONS.applyOutsideTags(processed);
        return PLURALS.applyOutsideTags(processed);
    }

    String postprocess(String text) {
        String processed = new Substitution(TAG_VALUE) {
            @Override
            String replace(Matcher matcher) {
                return matcher.group(1)+'<'+Vocabulary.tagValue(matcher.group(2))+matcher.group(3)+'>';
            }
        }.apply(text);
        processed = REPHRASES.apply(processed);
        processed = LESS_EQUAL.matcher(processed).replaceAll("ch<$1> op<≤> nu<$2>");
        processed = GREATER_EQUAL.matcher(processed).replaceAll("ch<$1> op<≥> nu<$2>");
        processed = IS_OPERATOR.matcher(processed).replaceAll("$1");
        processed = OPERATOR_TO.matcher(processed).replaceAll("$1");
        processed = UP_TO.matcher(processed).replaceAll("nu<≤$1>");
        processed = NEGATED_TAG.matcher(processed).replaceAll("$1<¬");
        processed = DONT_CONTROL.matcher(processed).replaceAll("xc<¬$1>");
        return PROTECTION_LIST.matcher(processed).replaceAll(
                "kw<protection> pr<from> ch<$1> and pr<from> ch<$2> and pr<from>");
    }

    static String normalizeSpacing(String text) {
        StringBuilder builder = new StringBuilder();
        for (String line:text.split("\n")) {
            String normalized = line.replaceAll("[ \\t]+", " ").replaceAll(" ([.,:])", "$1").trim();
            if (normalized.isEmpty())
                continue;
            if (builder.length()>0)
                builder.append('\n');
            builder.append(normalized);
        }
        return builder.toString();
    }

    public GrammarCatalog getCatalog() {
        return catalog;
    }
}
