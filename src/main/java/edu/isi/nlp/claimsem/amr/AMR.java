package edu.isi.nlp.claimsem.amr;

import java.util.*;

/**
 * A parsed AMR graph for a single sentence, as handed to us by the graph producer.
 *
 * Nodes are keyed by their variable ref ("c", "c2", ...) and keep the order in which the producer
 * enumerated them. Titles (concept labels) are not unique, and the arcs may form cycles, so anything
 * walking this graph has to carry a visited set.
 *
 * Arc titles keep their leading colon (":ARG0", ":mod", ":ARG1-of").
 */
public class AMR {

    public static class Node {
        public final String ref;
        public final String title;

        public Node(String ref, String title) {
            this.ref = ref;
            this.title = title;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Node)) return false;
            Node node = (Node) o;
            return ref.equals(node.ref) && title.equals(node.title);
        }

        @Override
        public int hashCode() {
            return ref.hashCode() * 31 + title.hashCode();
        }

        @Override
        public String toString() {
            return "(" + ref + " / " + title + ")";
        }
    }

    public static class Arc {
        public final Node head;
        public final String title;
        public final Node tail;

        public Arc(Node head, String title, Node tail) {
            this.head = head;
            this.title = title;
            this.tail = tail;
        }

        public boolean isInverse() {
            return title.endsWith("-of");
        }

        @Override
        public String toString() {
            return head.ref + " " + title + " " + tail.ref;
        }
    }

    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final List<Arc> arcs = new ArrayList<>();
    private Node head;
    private String[] sourceText = new String[0];

    public AMR() {
    }

    public AMR(String[] sourceText) {
        this.sourceText = sourceText;
    }

    public Node addNode(String ref, String title) {
        if (nodes.containsKey(ref)) {
            throw new IllegalArgumentException("Duplicate node ref " + ref);
        }
        Node node = new Node(ref, title);
        nodes.put(ref, node);
        if (head == null) head = node;
        return node;
    }

    public Arc addArc(String headRef, String title, String tailRef) {
        return addArc(nodeWithRef(headRef), title, nodeWithRef(tailRef));
    }

    public Arc addArc(Node head, String title, Node tail) {
        if (head == null || tail == null || !nodes.containsKey(head.ref) || !nodes.containsKey(tail.ref)) {
            throw new IllegalArgumentException("Arc " + title + " references a node outside this graph");
        }
        Arc arc = new Arc(head, title, tail);
        arcs.add(arc);
        return arc;
    }

    public void setHead(String ref) {
        Node node = nodeWithRef(ref);
        if (node == null) {
            throw new IllegalArgumentException("No node with ref " + ref);
        }
        this.head = node;
    }

    /**
     * The designated root of the graph. Defaults to the first node added.
     */
    public Node getHead() {
        return head;
    }

    public String[] getSourceText() {
        return sourceText;
    }

    public String getSourceToken(int i) {
        return sourceText[i];
    }

    public boolean containsToken(String token) {
        for (String s : sourceText) {
            if (s.equals(token)) return true;
        }
        return false;
    }

    public Node nodeWithRef(String ref) {
        return nodes.get(ref);
    }

    /**
     * All nodes, in the producer's enumeration order.
     */
    public Collection<Node> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public List<Arc> getArcs() {
        return Collections.unmodifiableList(arcs);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Node titles in enumeration order, duplicates kept.
     */
    public List<String> getOrderedNodeTitles() {
        List<String> titles = new ArrayList<>();
        for (Node node : nodes.values()) {
            titles.add(node.title);
        }
        return titles;
    }

    /**
     * The first node carrying the given title, or null.
     */
    public Node firstNodeWithTitle(String title) {
        for (Node node : nodes.values()) {
            if (node.title.equals(title)) return node;
        }
        return null;
    }

    /**
     * Distinct parents of a node, in arc order.
     */
    public List<Node> getParents(Node node) {
        Set<Node> parents = new LinkedHashSet<>();
        for (Arc arc : arcs) {
            if (arc.tail.equals(node)) parents.add(arc.head);
        }
        return new ArrayList<>(parents);
    }

    /**
     * Outgoing arcs grouped by role, roles in the order they first appear.
     */
    public Map<String, List<Node>> getChildrenByRole(Node node) {
        Map<String, List<Node>> byRole = new LinkedHashMap<>();
        for (Arc arc : arcs) {
            if (arc.head.equals(node)) {
                byRole.computeIfAbsent(arc.title, k -> new ArrayList<>()).add(arc.tail);
            }
        }
        return byRole;
    }

    public List<Node> getChildren(Node node, String role) {
        List<Node> children = new ArrayList<>();
        for (Arc arc : arcs) {
            if (arc.head.equals(node) && arc.title.equals(role)) children.add(arc.tail);
        }
        return children;
    }

    /**
     * The first child reached over the given role, or null.
     */
    public Node getFirstChild(Node node, String role) {
        for (Arc arc : arcs) {
            if (arc.head.equals(node) && arc.title.equals(role)) return arc.tail;
        }
        return null;
    }

    /**
     * Every arc touching the node, in either direction.
     */
    public List<Arc> getArcsForNode(Node node) {
        List<Arc> incident = new ArrayList<>();
        for (Arc arc : arcs) {
            if (arc.head.equals(node) || arc.tail.equals(node)) incident.add(arc);
        }
        return incident;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("root ").append(head).append("\n");
        for (Arc arc : arcs) {
            sb.append(arc.head).append(" ").append(arc.title).append(" ").append(arc.tail).append("\n");
        }
        return sb.toString();
    }
}
