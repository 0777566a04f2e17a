package org.mtgl.common.tree;

import java.util.List;
import java.util.Map;

/**
 * Box drawing dump of a tree, built only from the tree's public read
 * operations.
 */
public final class TreePrinter {

    static final String BRANCH = "├─ ";
    static final String LAST   = "└─ ";
    static final String PIPE   = "│  ";
    static final String BLANK  = "   ";

    private TreePrinter() {
    }

    public static String print(MTGTree tree, boolean withAttrs) {
        return print(tree, tree.root(), withAttrs);
    }

    public static String print(MTGTree tree, String id, boolean withAttrs) {
        StringBuilder builder = new StringBuilder();
        builder.append(label(tree, id, withAttrs)).append('\n');
        List<String> children = tree.children(id);
        for (int i=0; i<children.size(); ++i)
            print(tree, children.get(i), "", i==children.size()-1, withAttrs, builder);
        return builder.toString();
    }

    static void print(MTGTree tree, String id, String prefix, boolean last, boolean withAttrs, StringBuilder builder) {
        builder.append(prefix).append(last?LAST:BRANCH).append(label(tree, id, withAttrs)).append('\n');
        String childPrefix = prefix+(last?BLANK:PIPE);
        List<String> children = tree.children(id);
        for (int i=0; i<children.size(); ++i)
            print(tree, children.get(i), childPrefix, i==children.size()-1, withAttrs, builder);
    }

    static String label(MTGTree tree, String id, boolean withAttrs) {
        Map<String, String> attrs = tree.attrs(id);
        if (!withAttrs || attrs.isEmpty())
            return id;
        StringBuilder builder = new StringBuilder(id).append(" [");
        boolean first = true;
        for (Map.Entry<String, String> entry:attrs.entrySet()) {
            if (!first)
                builder.append(", ");
            builder.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return builder.append(']').toString();
    }
}
