package org.mtgl.common.tag;

/**
 * A predicate over a single token, the element type of token sequence
 * patterns.
 */
public abstract class TokenPattern {

    public abstract boolean matches(Token token);

    public static final TokenPattern ANY = new TokenPattern() {
        @Override
        public boolean matches(Token token) {
            return true;
        }
        @Override
        public String toString() {
            return "*";
        }
    };

    public static final TokenPattern THING = new TokenPattern() {
        @Override
        public boolean matches(Token token) {
            return Tokens.isThing(token);
        }
        @Override
        public String toString() {
            return "THING";
        }
    };

    public static final TokenPattern ACTION = new TokenPattern() {
        @Override
        public boolean matches(Token token) {
            return Tokens.isAction(token);
        }
        @Override
        public String toString() {
            return "ACTION";
        }
    };

    public static final TokenPattern COORDINATOR = new TokenPattern() {
        @Override
        public boolean matches(Token token) {
            return Tokens.isCoordinator(token);
        }
        @Override
        public String toString() {
            return "COORDINATOR";
        }
    };

    public static final TokenPattern STATE = new TokenPattern() {
        @Override
        public boolean matches(Token token) {
            return Tokens.isState(token);
        }
        @Override
        public String toString() {
            return "STATE";
        }
    };

    public static final TokenPattern QUALITY = new TokenPattern() {
        @Override
        public boolean matches(Token token) {
            return Tokens.isQuality(token);
        }
        @Override
        public String toString() {
            return "QUALITY";
        }
    };

    public static final TokenPattern PROPERTY = new TokenPattern() {
        @Override
        public boolean matches(Token token) {
            return Tokens.isProperty(token);
        }
        @Override
        public String toString() {
            return "PROPERTY";
        }
    };

    public static final TokenPattern META_CHARACTERISTIC = new TokenPattern() {
        @Override
        public boolean matches(Token token) {
            return Tokens.isMetaCharacteristic(token);
        }
        @Override
        public String toString() {
            return "META";
        }
    };

    public static final TokenPattern POSSESSIVE = new TokenPattern() {
        @Override
        public boolean matches(Token token) {
            return Tokens.isPossessive(token);
        }
        @Override
        public String toString() {
            return "POSSESSIVE";
        }
    };

    public static final TokenPattern VARIABLE = new TokenPattern() {
        @Override
        public boolean matches(Token token) {
            return Tokens.isVariable(token);
        }
        @Override
        public String toString() {
            return "VARIABLE";
        }
    };

    public static final TokenPattern PUNCTUATION = new TokenPattern() {
        @Override
        public boolean matches(Token token) {
            return token.isPunctuation();
        }
        @Override
        public String toString() {
            return "PUNCTUATION";
        }
    };

    public static final TokenPattern MANA = new TokenPattern() {
        @Override
        public boolean matches(Token token) {
            return Tokens.isManaString(token);
        }
        @Override
        public String toString() {
            return "MANA";
        }
    };

    public static final TokenPattern OBJECT = code(TagCode.OBJECT);
    public static final TokenPattern PLAYER = code(TagCode.PLAYER);
    public static final TokenPattern ZONE = code(TagCode.ZONE);
    public static final TokenPattern NUMBER = code(TagCode.NUMBER);
    public static final TokenPattern PHASE = code(TagCode.PHASE);
    public static final TokenPattern KEYWORD = code(TagCode.KEYWORD);
    public static final TokenPattern CHARACTERISTIC = code(TagCode.CHARACTERISTIC);
    public static final TokenPattern QUANTIFIER = code(TagCode.QUANTIFIER);
    public static final TokenPattern CONDITIONAL = code(TagCode.CONDITIONAL);
    public static final TokenPattern PREPOSITION = code(TagCode.PREPOSITION);
    public static final TokenPattern OPERATOR = code(TagCode.OPERATOR);
    public static final TokenPattern SEQUENCE = code(TagCode.SEQUENCE);

    /** matches any tag of the given category */
    public static TokenPattern code(final TagCode code) {
        return new TokenPattern() {
            @Override
            public boolean matches(Token token) {
                return token.is(code);
            }
            @Override
            public String toString() {
                return code.getCode()+"<*>";
            }
        };
    }

    /** matches a tag of the given category and value, ignoring attributes */
    public static TokenPattern tag(final TagCode code, final String value) {
        return new TokenPattern() {
            @Override
            public boolean matches(Token token) {
                return token.is(code, value);
            }
            @Override
            public String toString() {
                return code.getCode()+"<"+value+">";
            }
        };
    }

    /** matches a literal (untagged) word or punctuation mark */
    public static TokenPattern word(final String word) {
        return new TokenPattern() {
            @Override
            public boolean matches(Token token) {
                return token.isWord(word);
            }
            @Override
            public String toString() {
                return word;
            }
        };
    }

    /** matches tokens whose full text equals text, including tag attributes */
    public static TokenPattern text(final String text) {
        return new TokenPattern() {
            @Override
            public boolean matches(Token token) {
                return token.getText().equals(text);
            }
            @Override
            public String toString() {
                return text;
            }
        };
    }

    public static TokenPattern anyOf(final TokenPattern... patterns) {
        return new TokenPattern() {
            @Override
            public boolean matches(Token token) {
                for (TokenPattern pattern:patterns)
                    if (pattern.matches(token))
                        return true;
                return false;
            }
        };
    }

    public static TokenPattern not(final TokenPattern pattern) {
        return new TokenPattern() {
            @Override
            public boolean matches(Token token) {
                return !pattern.matches(token);
            }
        };
    }
}
