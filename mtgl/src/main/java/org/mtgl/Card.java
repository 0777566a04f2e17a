package org.mtgl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import org.mtgl.grammar.CardType;

/**
 * One document: a card's name, its rules text and type labels. Split,
 * aftermath and adventure cards carry both faces, their names and texts
 * joined with {@link #FACE_SEPARATOR}.
 */
public class Card {

    public static final String FACE_SEPARATOR = " // ";
    static final Pattern FACE_SPLIT = Pattern.compile("\\s*//\\s*");

    final String name;
    final String text;
    final Set<String> typeLabels;
    final String layout;

    public Card(String name, String text, Set<String> typeLabels, String layout) {
        this.name = name;
        this.text = text==null?"":text;
        this.typeLabels = typeLabels==null?Collections.<String>emptySet():Collections.unmodifiableSet(new LinkedHashSet<String>(typeLabels));
        this.layout = layout==null?"normal":layout;
    }

    public Card(String name, String text, String... typeLabels) {
        this(name, text, new LinkedHashSet<String>(Arrays.asList(typeLabels)), null);
    }

    /**
     * Combines the two halves of a split card.
     */
    public static Card join(Card a, Card b) {
        Set<String> labels = new LinkedHashSet<String>(a.typeLabels);
        labels.addAll(b.typeLabels);
        return new Card(a.name+FACE_SEPARATOR+b.name, a.text+FACE_SEPARATOR+b.text, labels, a.layout);
    }

    public String getName() {
        return name;
    }

    public String getText() {
        return text;
    }

    public Set<String> getTypeLabels() {
        return typeLabels;
    }

    public Set<CardType> getTypes() {
        return CardType.fromLabels(typeLabels);
    }

    public String getLayout() {
        return layout;
    }

    public boolean isSplit() {
        return name.contains(FACE_SEPARATOR.trim());
    }

    public List<String> getFaceNames() {
        return split(name);
    }

    public List<String> getFaceTexts() {
        return split(text);
    }

    static List<String> split(String value) {
        List<String> faces = new ArrayList<String>();
        for (String face:FACE_SPLIT.split(value, 2))
            faces.add(face.trim());
        return faces;
    }

    @Override
    public String toString() {
        return name+" "+typeLabels;
    }
}
