package org.pcc.compiler.frontend.parser.ast;

import org.pcc.compiler.api.SourcePosition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered container of child nodes. Unlike the other node types its slots can be
 * rewritten, which lets optimization passes replace children in place.
 */
public final class ListNode implements AstNode {

    private final AstNodeKind kind;
    private final List<AstNode> elements;
    private final SourcePosition position;

    /**
     * @param kind One of the list kinds, see {@link AstNodeKind#isList()}.
     * @param elements The initial elements; copied.
     * @param position Where the list starts.
     */
    public ListNode(AstNodeKind kind, List<? extends AstNode> elements, SourcePosition position) {
        if (!kind.isList()) {
            throw new IllegalArgumentException("Not a list kind: " + kind);
        }
        this.kind = kind;
        this.elements = new ArrayList<>(elements);
        this.position = position;
    }

    /**
     * Creates an empty list.
     */
    public ListNode(AstNodeKind kind, SourcePosition position) {
        this(kind, List.of(), position);
    }

    @Override
    public AstNodeKind kind() {
        return kind;
    }

    @Override
    public SourcePosition position() {
        return position;
    }

    /**
     * @return An unmodifiable view of the elements.
     */
    public List<AstNode> elements() {
        return Collections.unmodifiableList(elements);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public AstNode get(int index) {
        return elements.get(index);
    }

    public void add(AstNode node) {
        elements.add(Objects.requireNonNull(node, "node"));
    }

    /**
     * Replaces the element in the given slot.
     * @return The element previously in the slot.
     */
    public AstNode set(int index, AstNode node) {
        return elements.set(index, Objects.requireNonNull(node, "node"));
    }

    /**
     * Drops every {@link EmptyNode}.
     * @return The number of removed elements.
     */
    public int removeEmpty() {
        int before = elements.size();
        elements.removeIf(e -> e.kind() == AstNodeKind.EMPTY);
        return before - elements.size();
    }

    @Override
    public List<AstNode> getChildren() {
        return elements();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ListNode)) return false;
        ListNode other = (ListNode) o;
        return kind == other.kind && elements.equals(other.elements) && Objects.equals(position, other.position);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, elements, position);
    }

    @Override
    public String toString() {
        return "ListNode[kind=" + kind + ", elements=" + elements + "]";
    }
}
