package org.mtgl.common.tree;

import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An ordered, rooted tree of typed nodes with string attributes.
 * <p>
 * Nodes live in an arena and are addressed by ids of the form {@code type:n}
 * where n is a per-type serial number that is never reused, so ids can be
 * stored in attributes as references to other nodes. Children keep their
 * insertion order. Nodes may be created unrooted and attached later; a node
 * can have at most one parent.
 */
public class MTGTree {

    public static final String ROOT = "root";

    static final int NO_PARENT = -1;

    static class Node {
        final int index;
        final String id;
        final String type;
        int parent;
        final TIntArrayList children;
        final Map<String, String> attrs;
        boolean deleted;

        Node(int index, String id, String type) {
            this.index = index;
            this.id = id;
            this.type = type;
            parent = NO_PARENT;
            children = new TIntArrayList();
            attrs = new LinkedHashMap<String, String>();
            deleted = false;
        }
    }

    final List<Node> nodes;
    final TObjectIntMap<String> idIndex;
    final TObjectIntMap<String> serials;
    final String rootId;

    public MTGTree() {
        nodes = new ArrayList<Node>();
        idIndex = new TObjectIntHashMap<String>(64, 0.5f, NO_PARENT);
        serials = new TObjectIntHashMap<String>(32, 0.5f, 0);
        rootId = newNode(ROOT, null).id;
    }

    Node newNode(String type, Map<String, String> attrs) {
        if (type==null || type.isEmpty() || type.indexOf(':')>=0)
            throw new TreeException("invalid node type '"+type+"'");
        int serial = serials.get(type);
        serials.put(type, serial+1);
        Node node = new Node(nodes.size(), type+":"+serial, type);
        if (attrs!=null)
            node.attrs.putAll(attrs);
        nodes.add(node);
        idIndex.put(node.id, node.index);
        return node;
    }

    Node getNode(String id) {
        if (id==null)
            throw new TreeException("null node id");
        int index = idIndex.get(id);
        if (index==NO_PARENT)
            throw new TreeException("no node "+id);
        return nodes.get(index);
    }

    public String root() {
        return rootId;
    }

    public boolean hasNode(String id) {
        return id!=null && idIndex.containsKey(id);
    }

    /** number of live nodes, the root included */
    public int size() {
        return idIndex.size();
    }

    public String addNode(String parent, String type) {
        return addNode(parent, type, null);
    }

    /**
     * Creates a node as the last child of parent.
     * @return the new node's id
     */
    public String addNode(String parent, String type, Map<String, String> attrs) {
        Node parentNode = getNode(parent);
        Node node = newNode(type, attrs);
        node.parent = parentNode.index;
        parentNode.children.add(node.index);
        return node.id;
    }

    public String addUnrootedNode(String type) {
        return addUnrootedNode(type, null);
    }

    /**
     * Creates a node without a parent. It stays out of every traversal from
     * the root until it is attached.
     */
    public String addUnrootedNode(String type, Map<String, String> attrs) {
        return newNode(type, attrs).id;
    }

    /**
     * Makes child, a node without a parent, the last child of parent.
     */
    public void attach(String parent, String child) {
        Node parentNode = getNode(parent);
        Node childNode = getNode(child);
        if (childNode.id.equals(rootId))
            throw new TreeException("cannot attach the root");
        if (childNode.parent!=NO_PARENT)
            throw new TreeException(child+" already has parent "+nodes.get(childNode.parent).id);
        for (Node n=parentNode; n!=null; n=n.parent==NO_PARENT?null:nodes.get(n.parent))
            if (n.index==childNode.index)
                throw new TreeException("attaching "+child+" under "+parent+" creates a cycle");
        childNode.parent = parentNode.index;
        parentNode.children.add(childNode.index);
    }

    /**
     * Removes the node and its whole subtree. Ids are not reused.
     */
    public void deleteNode(String id) {
        Node node = getNode(id);
        if (node.id.equals(rootId))
            throw new TreeException("cannot delete the root");
        if (node.parent!=NO_PARENT)
            nodes.get(node.parent).children.remove(node.index);
        TIntList stack = new TIntArrayList();
        stack.add(node.index);
        while (!stack.isEmpty()) {
            Node n = nodes.get(stack.removeAt(stack.size()-1));
            n.deleted = true;
            idIndex.remove(n.id);
            stack.addAll(n.children);
        }
    }

    public String type(String id) {
        return getNode(id).type;
    }

    /**
     * Sets an attribute; a second write to the same key replaces the value.
     */
    public void addAttr(String id, String key, String value) {
        if (key==null || value==null)
            throw new TreeException("null attribute on "+id);
        getNode(id).attrs.put(key, value);
    }

    /**
     * @return the attribute value, or null if the node does not have it
     */
    public String attr(String id, String key) {
        return getNode(id).attrs.get(key);
    }

    public Map<String, String> attrs(String id) {
        return Collections.unmodifiableMap(getNode(id).attrs);
    }

    /**
     * @return the parent id, or null for the root and unrooted nodes
     */
    public String parent(String id) {
        Node node = getNode(id);
        return node.parent==NO_PARENT?null:nodes.get(node.parent).id;
    }

    public List<String> children(String id) {
        Node node = getNode(id);
        List<String> ret = new ArrayList<String>(node.children.size());
        for (int i=0; i<node.children.size(); ++i)
            ret.add(nodes.get(node.children.get(i)).id);
        return ret;
    }

    public boolean isLeaf(String id) {
        return getNode(id).children.isEmpty();
    }

    public String rightSibling(String id) {
        Node node = getNode(id);
        if (node.parent==NO_PARENT)
            return null;
        TIntArrayList siblings = nodes.get(node.parent).children;
        int pos = siblings.indexOf(node.index);
        return pos+1<siblings.size()?nodes.get(siblings.get(pos+1)).id:null;
    }

    /**
     * @return ancestors from the parent up to the topmost node
     */
    public List<String> ancestors(String id) {
        List<String> ret = new ArrayList<String>();
        Node node = getNode(id);
        while (node.parent!=NO_PARENT) {
            node = nodes.get(node.parent);
            ret.add(node.id);
        }
        return ret;
    }

    /**
     * @return true if the node is the root or hangs from it
     */
    public boolean isRooted(String id) {
        Node node = getNode(id);
        while (node.parent!=NO_PARENT)
            node = nodes.get(node.parent);
        return node.id.equals(rootId);
    }

    /**
     * @return all descendants of id in pre-order, id excluded
     */
    public List<String> descendants(String id) {
        List<String> ret = new ArrayList<String>();
        collect(getNode(id), ret);
        ret.remove(0);
        return ret;
    }

    void collect(Node node, List<String> ids) {
        ids.add(node.id);
        for (int i=0; i<node.children.size(); ++i)
            collect(nodes.get(node.children.get(i)), ids);
    }

    public List<String> findAll(String type) {
        return findAll(type, rootId, null, null);
    }

    public List<String> findAll(String type, String source) {
        return findAll(type, source, null, null);
    }

    /**
     * Finds descendants of source (source excluded) in creation order.
     * @param type node type, null for any
     * @param source node to search under, null for the root
     * @param attr attribute the node must have, null for none
     * @param value required attribute value, null for any
     */
    public List<String> findAll(String type, String source, String attr, String value) {
        if (attr==null && value!=null)
            throw new TreeException("attribute value given without attribute");
        TIntList matches = new TIntArrayList();
        for (String id:descendants(source==null?rootId:source)) {
            Node node = getNode(id);
            if (type!=null && !type.equals(node.type))
                continue;
            if (attr!=null && !node.attrs.containsKey(attr))
                continue;
            if (value!=null && !value.equals(node.attrs.get(attr)))
                continue;
            matches.add(node.index);
        }
        matches.sort();
        List<String> ret = new ArrayList<String>(matches.size());
        for (int i=0; i<matches.size(); ++i)
            ret.add(nodes.get(matches.get(i)).id);
        return ret;
    }

    /**
     * Builds a tree whose root has two card-half children (side=a and side=b)
     * holding copies of the two trees. Attribute values that referenced node
     * ids of a source tree are rewritten to the copied ids.
     */
    public static MTGTree fuse(String name, MTGTree a, MTGTree b) {
        MTGTree fused = new MTGTree();
        if (name!=null)
            fused.addAttr(fused.root(), "name", name);
        fused.copyUnder(fused.addNode(fused.root(), "card-half", Collections.singletonMap("side", "a")), a);
        fused.copyUnder(fused.addNode(fused.root(), "card-half", Collections.singletonMap("side", "b")), b);
        return fused;
    }

    void copyUnder(String parent, MTGTree src) {
        Map<String, String> idMap = new LinkedHashMap<String, String>();
        idMap.put(src.root(), parent);
        for (Map.Entry<String, String> entry:src.attrs(src.root()).entrySet())
            addAttr(parent, entry.getKey(), entry.getValue());
        List<String> copied = new ArrayList<String>();
        for (String srcId:src.descendants(src.root())) {
            String id = addNode(idMap.get(src.parent(srcId)), src.type(srcId), src.attrs(srcId));
            idMap.put(srcId, id);
            copied.add(id);
        }
        for (String id:copied)
            for (Map.Entry<String, String> entry:getNode(id).attrs.entrySet())
                if (idMap.containsKey(entry.getValue()) && !entry.getValue().equals(src.root()))
                    entry.setValue(idMap.get(entry.getValue()));
    }

    @Override
    public String toString() {
        return TreePrinter.print(this, true);
    }
}
