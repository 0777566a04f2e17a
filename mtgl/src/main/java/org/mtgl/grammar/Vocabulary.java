package org.mtgl.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Word lists of the rules text sublanguage. Multi-word entries are written
 * with spaces as they appear in text; tag values join them with underscores.
 */
public final class Vocabulary {

    private Vocabulary() {
    }

    static List<String> list(String... words) {
        return Collections.unmodifiableList(Arrays.asList(words));
    }

    // contractions, irregular plurals and phrases with a single short form
    public static final Map<String, String> WORD_HACKS;
    static {
        String[] pairs = {
            "can't", "cannot", "don't", "dont", "didn't", "didnt", "it's", "it is",
            "isn't", "isnt", "haven't", "havent", "hasn't", "hasnt", "its", "it",
            "aren't", "arent", "you're", "youre", "couldn't", "couldnt", "they're", "theyre",
            "doesn't", "doesnt", "you've", "youve", "that's", "thats", "wasn't", "wasnt",
            "weren't", "werent", "an", "a", "werewolves", "werewolf", "allies", "ally",
            "elves", "elf", "end of turn", "eot", "converted mana cost", "cmc",
            "spells", "spell", "abilities", "ability", "cards", "card", "copies", "copy",
            "tokens", "token", "permanents", "permanent", "emblems", "emblem",
            "sorceries", "sorcery", "dealt", "deal", "left", "leave", "lost", "lose",
            "sources", "source", "targets", "target", "controls", "control", "your", "you",
            "opponents", "opponent", "teammates", "teammate", "players", "player",
            "libraries", "library", "owners", "owner", "controllers", "controller",
            "phases", "phase", "turns", "turn", "steps", "step", "spent", "spend",
            "dying", "die", "chosen", "choose", "attackers", "attacker", "blockers", "blocker",
            "graveyards", "graveyard", "hands", "hand"
        };
        Map<String, String> map = new LinkedHashMap<String, String>();
        for (int i=0; i<pairs.length; i+=2)
            map.put(pairs[i], pairs[i+1]);
        WORD_HACKS = Collections.unmodifiableMap(map);
    }

    public static final Map<String, String> NUMBER_WORDS;
    static {
        String[] words = {"one", "two", "three", "four", "five", "six", "seven", "eight",
                "nine", "ten", "eleven", "twelve", "thirteen", "fourteen", "fifteen"};
        Map<String, String> map = new LinkedHashMap<String, String>();
        for (int i=0; i<words.length; ++i)
            map.put(words[i], Integer.toString(i+1));
        NUMBER_WORDS = Collections.unmodifiableMap(map);
    }

    public static final List<String> STATUS = list(
            "tapped", "untapped", "flipped", "unflipped", "face up", "face-up", "face down",
            "face-down", "phased in", "phased-in", "phased out", "phased-out");

    public static final List<String> LITUUS_STATUS = list(
            "attacking", "blocking", "blocked", "defending", "transformed", "enchanted",
            "equipped", "exiled", "attached", "activated", "triggered", "revealed");

    public static final List<String> PHASES = list(
            "untap step", "upkeep step", "draw step", "main phase", "combat phase",
            "beginning of combat step", "beginning of combat", "declare attackers step",
            "declare blockers step", "combat damage step", "end of combat step",
            "end step", "cleanup step", "eot", "turn", "phase", "step", "upkeep", "combat");

    public static final List<String> NAMED_COUNTERS = list(
            "age", "aim", "arrow", "arrowhead", "awakening", "blaze", "blood", "bounty", "bribery",
            "brick", "carrion", "charge", "credit", "corpse", "crystal", "cube", "currency", "death",
            "delay", "depletion", "despair", "devotion", "divinity", "doom", "dream", "echo", "egg",
            "elixir", "energy", "eon", "experience", "eyeball", "fade", "fate", "feather", "filibuster",
            "flood", "fungus", "fuse", "gem", "glyph", "gold", "growth", "hatchling", "healing", "hit",
            "hoofprint", "hour", "hourglass", "hunger", "ice", "incubation", "infection", "intervention",
            "isolation", "javelin", "ki", "level", "lore", "loyalty", "luck", "magnet", "manifestation",
            "mannequin", "mask", "matrix", "mine", "mining", "mire", "music", "muster", "net", "omen",
            "ore", "page", "pain", "paralyzation", "petal", "petrification", "phylactery", "pin",
            "plague", "poison", "polyp", "pressure", "prey", "pupa", "quest", "rust", "scream", "shell",
            "shield", "silver", "shred", "sleep", "sleight", "slime", "slumber", "soot", "spore",
            "storage", "strife", "study", "theft", "tide", "time", "tower", "training", "trap",
            "treasure", "velocity", "verse", "vitality", "volatile", "wage", "winch", "wind", "wish");

    public static final List<String> QUANTIFIERS = list(
            "target", "each", "all", "any", "every", "another", "other", "this", "that", "those",
            "these", "first", "second", "third", "fourth", "fifth", "sixth", "seventh", "eighth",
            "ninth", "tenth");

    public static final List<String> QUALIFIERS = list(
            "additional", "new", "different", "same", "extra", "random", "single");

    public static final List<String> EFFECTS = list("damage");

    public static final List<String> PLAYERS = list(
            "you", "opponent", "teammate", "player", "owner", "controller", "their");

    public static final List<String> LITUUS_OBJECTS = list(
            "city blessing", "game", "mana pool", "commander", "mana", "attacker", "blocker",
            "it", "them", "coin");

    public static final List<String> OBJECTS = list(
            "ability", "card", "copy", "token", "spell", "permanent", "emblem", "source");

    public static final List<String> META_CHARACTERISTICS = list(
            "everything", "text", "name", "mana cost", "cmc", "power", "toughness",
            "color identity", "color", "type");

    public static final List<String> COLOR_CHARACTERISTICS = list(
            "white", "blue", "black", "green", "red", "colorless", "multicolored", "monocolored");

    public static final List<String> SUPER_CHARACTERISTICS = list(
            "legendary", "basic", "snow", "world", "tribal");

    public static final List<String> TYPE_CHARACTERISTICS = list(
            "instant", "creature", "sorcery", "planeswalker", "enchantment", "land", "artifact",
            "historic");

    public static final List<String> SUB_CHARACTERISTICS = list(
            "dryad", "wurm", "wall", "horse", "dovin", "ogre", "shaman", "dragon", "zombie", "human",
            "warrior", "aura", "desert", "beast", "angel", "djinn", "soldier", "spirit", "rhino",
            "cleric", "treefolk", "centaur", "scarecrow", "rat", "drake", "knight", "goblin",
            "rogue", "bird", "monk", "gremlin", "elephant", "naga", "archer", "gargoyle", "lizard",
            "equipment", "golem", "myr", "elemental", "demon", "merfolk", "wizard", "phoenix",
            "nightstalker", "snake", "elf", "druid", "insect", "advisor", "horror", "dwarf",
            "nomad", "crocodile", "construct", "cat", "cephalid", "giant", "volver", "imp",
            "spider", "mercenary", "kiora", "shapeshifter", "pirate", "minotaur", "avatar",
            "scout", "skeleton", "berserker", "nissa", "sliver", "frog", "spellshaper", "atog",
            "kithkin", "swamp", "manticore", "eldrazi", "kor", "arcane", "spike", "mountain",
            "vampire", "leviathan", "artificer", "curse", "metathran", "ally", "hippo", "assassin",
            "plains", "mutant", "ooze", "specter", "fungus", "gnome", "hellion", "karn", "cyclops",
            "pilot", "gorgon", "vedalken", "ape", "hippogriff", "gideon", "carrier", "egg",
            "samurai", "wolf", "minion", "kobold", "vehicle", "kavu", "serpent", "hound",
            "nightmare", "antelope", "salamander", "orc", "werewolf", "plant", "troll", "fish",
            "dinosaur", "eye", "elspeth", "faerie", "shade", "griffin", "juggernaut", "elk",
            "devil", "boar", "aetherborn", "viashino", "tezzeret", "barbarian", "rebel", "pegasus",
            "thopter", "satyr", "thrull", "worm", "aminatou", "illusion", "yeti", "homunculus",
            "drone", "sphinx", "trap", "saga", "nymph", "homarid", "kirin", "bear", "weird",
            "incarnation", "pest", "hydra", "lhurgoyf", "gate", "ajani", "jace", "turtle", "kaya",
            "siren", "liliana", "slith", "god", "chimera", "badger", "camel", "scorpion", "crab",
            "zubera", "teferi", "hag", "squirrel", "samut", "nixilis", "kraken", "nephilim",
            "chandra", "masticore", "wraith", "jackal", "azra", "ninja", "moonfolk", "garruk",
            "orgg", "licid", "cartouche", "ashiok", "archon", "processor", "shrine", "wolverine",
            "praetor", "efreet", "urza", "tower", "dreadnought", "nautilus", "thalakos",
            "nahiri", "ugin", "tibalt", "dauthi", "ouphe", "freyalise", "phelddagrif", "island",
            "teyo", "elder", "forest", "bat", "fox", "ral", "sheep", "sarkhan", "wombat", "hyena",
            "dack", "xenagos", "yanggu", "soltari", "sponge", "aurochs", "ox", "lair", "unicorn",
            "huatli", "slug", "bolas", "squid", "harpy", "octopus", "trilobite", "mystic",
            "windgrace", "davriel", "whale", "basilisk", "assembly-worker", "daretti",
            "jellyfish", "monger", "domri", "monkey", "goat", "sorin", "leech", "saheeli", "tamiyo",
            "bringer", "starfish", "estrid", "sable", "narset", "ferret", "vraska", "power-plant",
            "surrakar", "noggle", "beeble", "mongoose", "rabbit", "cockatrice", "jaya", "lammasu",
            "reflection", "angrath", "kasmina", "rowan", "arlinn", "mine", "spawn", "venser",
            "pangolin", "koth", "vivien", "oyster", "yanling", "flagbearer", "rigger", "lamia",
            "mole", "locus", "brushwagg", "fortification",
            "army", "camarid", "caribou", "citizen", "clue", "deserter", "germ", "graveborn",
            "orb", "pentavite", "pincher", "prism", "sand", "saproling", "scion", "sculpture",
            "serf", "servo", "splinter", "survivor", "tetravite", "triskelavite");

    public static final List<String> LITUUS_CHARACTERISTICS = list(
            "life total", "control", "own", "life", "cost", "hand size", "devotion");

    public static final List<String> ABILITY_WORDS = list(
            "addendum", "battalion", "bloodrush", "channel", "chroma", "cohort", "constellation",
            "converge", "delirium", "domain", "eminence", "enrage", "fateful hour", "ferocious",
            "formidable", "grandeur", "hellbent", "heroic", "imprint", "inspired", "join forces",
            "kinship", "landfall", "lieutenant", "metalcraft", "morbid", "parley", "radiance",
            "raid", "rally", "revolt", "spell mastery", "strive", "sweep", "tempting offer",
            "threshold", "will of the council");

    public static final List<String> KEYWORD_ACTIONS = list(
            "activate", "unattach", "attach", "cast", "counter", "create", "destroy", "discard",
            "double", "exchange", "exile", "fight", "play", "regenerate", "reveal", "sacrifice",
            "scry", "search", "shuffle", "tap", "untap", "fateseal", "clash", "abandon",
            "proliferate", "transform", "detain", "populate", "monstrosity", "vote", "bolster",
            "manifest", "support", "investigate", "meld", "goad", "exert", "explore", "surveil",
            "adapt", "amass");

    public static final List<String> LITUUS_ACTIONS = list(
            "put", "remove", "distribute", "get", "return", "draw", "move", "copy", "look", "pay",
            "paid", "deal", "gain", "lose", "attack", "block", "add", "enter", "leave", "choose", "die",
            "spend", "take", "skip", "cycle", "reduce", "trigger", "prevent", "declare",
            "has", "have", "switch", "phase in", "phase out", "flip", "assign", "win");

    public static final List<String> KEYWORDS = list(
            "deathtouch", "defender", "double strike", "enchant", "equip", "first strike", "flash",
            "flying", "haste", "hexproof", "indestructible", "intimidate", "landwalk", "lifelink",
            "protection", "reach", "shroud", "trample", "vigilance", "banding", "rampage",
            "cumulative upkeep", "flanking", "phasing", "buyback", "shadow", "cycling", "echo",
            "horsemanship", "fading", "kicker", "multikicker", "flashback", "madness", "fear",
            "morph", "megamorph", "amplify", "provoke", "storm", "affinity", "entwine", "modular",
            "sunburst", "bushido", "soulshift", "splice", "offering", "ninjutsu", "commander ninjutsu",
            "epic", "convoke", "dredge", "transmute", "bloodthirst", "haunt", "replicate", "forecast",
            "graft", "recover", "ripple", "split second", "suspend", "vanishing", "absorb",
            "aura swap", "delve", "fortify", "frenzy", "gravestorm", "poisonous", "transfigure",
            "champion", "changeling", "evoke", "hideaway", "prowl", "reinforce", "conspire",
            "persist", "wither", "retrace", "devour", "exalted", "unearth", "cascade", "annihilator",
            "level up", "rebound", "totem armor", "infect", "battle cry", "living weapon",
            "undying", "miracle", "soulbond", "overload", "scavenge", "unleash", "cipher",
            "evolve", "extort", "fuse", "bestow", "tribute", "dethrone", "outlast", "prowess",
            "dash", "exploit", "menace", "renown", "awaken", "devoid", "ingest", "myriad", "surge",
            "skulk", "emerge", "escalate", "melee", "crew", "fabricate", "partner with", "partner",
            "undaunted", "improvise", "aftermath", "embalm", "eternalize", "afflict", "ascend",
            "assist", "jump-start", "mentor", "afterlife", "riot", "spectacle");

    /** keywords that may be preceded by the quality they refer to (swampcycling, goblin offering) */
    public static final List<String> KEYWORD_VARIATIONS = list("cycling", "landwalk", "offering");

    public static final List<String> ZONES = list(
            "library", "hand", "battlefield", "graveyard", "stack", "exile", "command", "anywhere");

    public static final List<String> TRIGGER_PREAMBLES = list("at", "whenever", "when");

    public static final Map<String, String> OPERATORS;
    static {
        Map<String, String> map = new LinkedHashMap<String, String>();
        map.put("less than or equal to", "≤");
        map.put("greater than or equal to", "≥");
        map.put("less than", "⋖");
        map.put("greater than", "⋗");
        map.put("equal to", "≡");
        map.put("equal", "≡");
        map.put("plus", "+");
        map.put("minus", "−");
        map.put("and/or", "⊕");
        OPERATORS = Collections.unmodifiableMap(map);
    }

    public static final List<String> PREPOSITIONS = list(
            "on top of", "up to", "on bottom of", "from", "to", "into", "in", "on", "under", "onto",
            "top of", "top", "bottom of", "bottom", "without", "with", "for");

    public static final List<String> CONDITIONALS = list(
            "only if", "if", "would", "unless", "rather than", "instead", "may", "except", "not",
            "only", "cannot", "otherwise");

    public static final List<String> SEQUENCES = list(
            "before", "next", "after", "until", "begin", "beginning", "end", "ending", "then",
            "during", "as long as");

    /** tokens known by name only, some never printed as cards */
    public static final List<String> TOKEN_NAMES = list(
            "Ajani's Pridemate", "Minor Demon", "Cloud Sprite", "Gold", "Mask", "Rabid Sheep",
            "Twin", "Land Mine", "Goldmeadow Harrier", "Wood", "Kobolds of Kher Keep",
            "Llanowar Elves", "Wolves of the Hunt", "Stoneforged Blade", "Lightning Rager",
            "Festering Goblin", "Metallic Sliver", "Spark Elemental", "Etherium Cell",
            "Carnivore", "Urami", "Crow Storm", "Butterfly", "Hornet", "Wirefly", "Kelp",
            "Tombspawn", "Hive", "Mowu", "Kaldra", "Marit Lage");

    public static final List<String> MELD_NAMES = list(
            "Brisela, Voice of Nightmares", "Chittering Host", "Hanweir, the Writhing Township");

    public static final List<String> CHARACTERISTICS;
    public static final Set<String> TYPES_AND_SUBTYPES;
    static {
        List<String> all = new ArrayList<String>();
        all.addAll(META_CHARACTERISTICS);
        all.addAll(COLOR_CHARACTERISTICS);
        all.addAll(SUPER_CHARACTERISTICS);
        all.addAll(TYPE_CHARACTERISTICS);
        all.addAll(SUB_CHARACTERISTICS);
        CHARACTERISTICS = Collections.unmodifiableList(all);

        Set<String> types = new HashSet<String>();
        for (String word:TYPE_CHARACTERISTICS)
            types.add(tagValue(word));
        for (String word:SUB_CHARACTERISTICS)
            types.add(tagValue(word));
        TYPES_AND_SUBTYPES = Collections.unmodifiableSet(types);
    }

    /**
     * Action conjugations (draws, destroyed, sacrificing) mapped to their base form.
     */
    public static final Map<String, String> ACTION_CONJUGATIONS;
    static {
        Set<String> noD = new HashSet<String>(Arrays.asList("activate", "exile"));
        Set<String> noEd = new HashSet<String>(Arrays.asList("block", "trigger", "reveal", "attach"));
        Set<String> noIng = new HashSet<String>(Arrays.asList("attack", "block"));
        Set<String> noEIng = new HashSet<String>(Arrays.asList("vote", "cycle"));
        Map<String, String> map = new LinkedHashMap<String, String>();
        List<String> acts = new ArrayList<String>(KEYWORD_ACTIONS);
        acts.addAll(LITUUS_ACTIONS);
        for (String act:acts) {
            char last = act.charAt(act.length()-1);
            if (last=='s' || last=='h')
                map.put(act+"es", act);
            else
                map.put(act+"s", act);
            if (last=='e') {
                if (!noD.contains(act))
                    map.put(act+"d", act);
                if (!noEIng.contains(act))
                    map.put(act.substring(0, act.length()-1)+"ing", act);
            } else {
                if (!noEd.contains(act))
                    map.put(act+"ed", act);
                if (!noIng.contains(act))
                    map.put(act+"ing", act);
            }
        }
        ACTION_CONJUGATIONS = Collections.unmodifiableMap(map);
    }

    /**
     * Characteristic plurals mapped to the singular.
     */
    public static final Map<String, String> CHARACTERISTIC_PLURALS;
    static {
        Map<String, String> map = new LinkedHashMap<String, String>();
        List<String> chars = new ArrayList<String>(CHARACTERISTICS);
        chars.addAll(LITUUS_CHARACTERISTICS);
        for (String ch:chars) {
            char last = ch.charAt(ch.length()-1);
            map.put(ch+(last=='s' || last=='h'?"es":"s"), ch);
        }
        CHARACTERISTIC_PLURALS = Collections.unmodifiableMap(map);
    }

    /**
     * @return the tag value for a vocabulary entry: spaces and hyphens joined by underscores
     */
    public static String tagValue(String word) {
        return word.replace(' ', '_').replace('-', '_');
    }

    static final Comparator<String> LONGEST_FIRST = new Comparator<String>() {
        @Override
        public int compare(String lhs, String rhs) {
            if (lhs.length()!=rhs.length())
                return rhs.length()-lhs.length();
            return lhs.compareTo(rhs);
        }
    };

    /**
     * Builds {@code \b(w1|w2|...)\b} with longer alternatives first so a phrase
     * wins over its own prefix.
     */
    public static Pattern wordPattern(Iterable<String> words) {
        List<String> sorted = new ArrayList<String>();
        for (String word:words)
            sorted.add(word);
        Collections.sort(sorted, LONGEST_FIRST);
        StringBuilder builder = new StringBuilder("\\b(");
        for (int i=0; i<sorted.size(); ++i) {
            if (i>0)
                builder.append('|');
            builder.append(Pattern.quote(sorted.get(i)));
        }
        return Pattern.compile(builder.append(")\\b").toString());
    }
}
