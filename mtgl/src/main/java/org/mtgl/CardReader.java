package org.mtgl;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

/**
 * Reads a card corpus: a JSON object keyed by card name, each value holding
 * "text", "types", "supertypes", "subtypes", "layout" and, for cards with
 * two faces, "names". The faces of split, aftermath, adventure, flip and
 * transform cards are combined into one card.
 */
public class CardReader {

    private static Logger logger = Logger.getLogger(CardReader.class.getPackage().getName());

    static final Set<String> TWO_FACED = new HashSet<String>(Arrays.asList(
            "split", "aftermath", "adventure", "flip", "transform"));

    static class Entry {
        String name;
        String text;
        Set<String> labels = new LinkedHashSet<String>();
        String layout;
        List<String> names = new ArrayList<String>();
    }

    public List<Card> read(File file) throws IOException {
        try (Reader reader = new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    /**
     * @return the cards in corpus order, a two faced card at its first face
     */
    public List<Card> read(Reader in) throws IOException {
        Map<String, Entry> entries = new LinkedHashMap<String, Entry>();
        try (JsonReader reader = new JsonReader(in)) {
            reader.beginObject();
            while (reader.hasNext()) {
                Entry entry = readEntry(reader.nextName(), reader);
                entries.put(entry.name, entry);
            }
            reader.endObject();
        }

        List<Card> cards = new ArrayList<Card>();
        Set<String> done = new HashSet<String>();
        for (Entry entry:entries.values()) {
            if (done.contains(entry.name))
                continue;
            if (entry.layout!=null && TWO_FACED.contains(entry.layout) && entry.names.size()==2) {
                Entry a = entries.get(entry.names.get(0));
                Entry b = entries.get(entry.names.get(1));
                if (a!=null && b!=null) {
                    cards.add(Card.join(toCard(a), toCard(b)));
                    done.add(a.name);
                    done.add(b.name);
                    continue;
                }
                logger.warning(entry.name+": missing face of "+entry.names);
            }
            cards.add(toCard(entry));
            done.add(entry.name);
        }
        logger.info("read "+cards.size()+" cards");
        return cards;
    }

    Entry readEntry(String name, JsonReader reader) throws IOException {
        Entry entry = new Entry();
        entry.name = name;
        reader.beginObject();
        while (reader.hasNext()) {
            String field = reader.nextName();
            if (reader.peek()==JsonToken.NULL) {
                reader.skipValue();
                continue;
            }
            if (field.equals("text"))
                entry.text = reader.nextString();
            else if (field.equals("layout"))
                entry.layout = reader.nextString();
            else if (field.equals("types") || field.equals("supertypes") || field.equals("subtypes"))
                entry.labels.addAll(readStrings(reader));
            else if (field.equals("names"))
                entry.names.addAll(readStrings(reader));
            else
                reader.skipValue();
        }
        reader.endObject();
        return entry;
    }

    static List<String> readStrings(JsonReader reader) throws IOException {
        List<String> values = new ArrayList<String>();
        reader.beginArray();
        while (reader.hasNext())
            values.add(reader.nextString());
        reader.endArray();
        return values;
    }

    static Card toCard(Entry entry) {
        return new Card(entry.name, entry.text, entry.labels, entry.layout);
    }
}
