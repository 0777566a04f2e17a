package org.mtgl.tagger;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex rewrite of text, optionally restricted to the text between tags so
 * a later pass never rewrites the inside of an earlier pass's tag.
 */
abstract class Substitution {

    static final Pattern TAG_SPAN = Pattern.compile("\\w\\w<[^<>]*>");

    final Pattern pattern;

    Substitution(Pattern pattern) {
        this.pattern = pattern;
    }

    /**
     * @return replacement text for the current match
     */
    abstract String replace(Matcher matcher);

    String apply(String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find())
            return text;
        StringBuffer buffer = new StringBuffer();
        do {
            matcher.appendReplacement(buffer, Matcher.quoteReplacement(replace(matcher)));
        } while (matcher.find());
        matcher.appendTail(buffer);
        return buffer.toString();
    }

    String applyOutsideTags(String text) {
        Matcher tags = TAG_SPAN.matcher(text);
        StringBuilder builder = new StringBuilder();
        int last = 0;
        while (tags.find()) {
            builder.append(apply(text.substring(last, tags.start())));
            builder.append(tags.group());
            last = tags.end();
        }
        builder.append(apply(text.substring(last)));
        return builder.toString();
    }

    /**
     * Wraps group 1 of each match in a tag.
     */
    static Substitution tag(Pattern pattern, final String code) {
        return new Substitution(pattern) {
            @Override
            String replace(Matcher matcher) {
                return code+'<'+matcher.group(1)+'>';
            }
        };
    }

    /**
     * Replaces group 1 with its entry in the map, tagged when code is not null.
     */
    static Substitution lookup(Pattern pattern, final Map<String, String> map, final String code) {
        return new Substitution(pattern) {
            @Override
            String replace(Matcher matcher) {
                String value = map.get(matcher.group(1));
                if (value==null)
                    return matcher.group();
                return code==null?value:code+'<'+value+'>';
            }
        };
    }

    /**
     * Regex replacement where $n refers to group n.
     */
    static Substitution template(Pattern pattern, final String replacement) {
        return new Substitution(pattern) {
            @Override
            String replace(Matcher matcher) {
                StringBuilder builder = new StringBuilder();
                for (int i=0; i<replacement.length(); ++i) {
                    char c = replacement.charAt(i);
                    if (c=='$' && i+1<replacement.length() && Character.isDigit(replacement.charAt(i+1))) {
                        String group = matcher.group(replacement.charAt(++i)-'0');
                        if (group!=null)
                            builder.append(group);
                    } else
                        builder.append(c);
                }
                return builder.toString();
            }
        };
    }
}
