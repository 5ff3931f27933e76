package com.formulagraph.app.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.*;

/**
 * A closed path [n0, n1, ..., nk, n0] in a dependency graph.
 * Two cycles are equal when one is a rotation of the other.
 */
public final class Cycle {

    private final List<QualifiedAddress> path;

    /**
     * @param members the distinct nodes of the cycle in traversal order, without the closing node
     */
    public Cycle(List<QualifiedAddress> members) {
        if (members.isEmpty()) {
            throw new IllegalArgumentException("A cycle needs at least one node");
        }
        List<QualifiedAddress> closed = new ArrayList<>(members);
        closed.add(members.get(0));
        this.path = Collections.unmodifiableList(closed);
    }

    /**
     * The closed path, first node repeated at the end.
     */
    public List<QualifiedAddress> getPath() {
        return path;
    }

    @JsonIgnore
    public Set<QualifiedAddress> getMembers() {
        return new LinkedHashSet<>(path.subList(0, path.size() - 1));
    }

    public boolean contains(QualifiedAddress node) {
        return path.contains(node);
    }

    public String getDescription() {
        StringJoiner joiner = new StringJoiner(" -> ", "Circular reference detected: ", "");
        for (QualifiedAddress node : path) {
            joiner.add(node.toString());
        }
        return joiner.toString();
    }

    // Rotation starting at the smallest node, used for equality
    private List<QualifiedAddress> canonical() {
        List<QualifiedAddress> members = new ArrayList<>(path.subList(0, path.size() - 1));
        int smallest = 0;
        for (int i = 1; i < members.size(); i++) {
            if (members.get(i).compareTo(members.get(smallest)) < 0) {
                smallest = i;
            }
        }
        Collections.rotate(members, -smallest);
        return members;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Cycle)) {
            return false;
        }
        return canonical().equals(((Cycle) o).canonical());
    }

    @Override
    public int hashCode() {
        return canonical().hashCode();
    }

    @Override
    public String toString() {
        return path.toString();
    }
}
