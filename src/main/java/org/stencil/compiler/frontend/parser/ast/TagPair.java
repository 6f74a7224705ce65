package org.stencil.compiler.frontend.parser.ast;

/**
 * Links the start and end tags of an element whose open and close sit in different node
 * sequences. Opens in sibling branches that close at the same place are unified into one pair.
 */
public final class TagPair {

    private final int ownId;
    private TagPair parent = this;

    /**
     * @param id The identifier of this pair before any union.
     */
    public TagPair(int id) {
        this.ownId = id;
    }

    /**
     * @return The identifier shared by all unified pairs.
     */
    public int id() {
        return root().ownId;
    }

    /**
     * Unifies this pair with another. The smaller identifier survives.
     * @param other The pair to merge with.
     */
    public void union(TagPair other) {
        TagPair a = root();
        TagPair b = other.root();
        if (a == b) return;
        if (a.ownId < b.ownId) {
            b.parent = a;
        } else {
            a.parent = b;
        }
    }

    private TagPair root() {
        TagPair node = this;
        while (node.parent != node) {
            node = node.parent;
        }
        return node;
    }

    @Override
    public String toString() {
        return "TagPair#" + id();
    }
}
