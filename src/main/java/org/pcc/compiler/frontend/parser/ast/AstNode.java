package org.pcc.compiler.frontend.parser.ast;

import org.pcc.compiler.api.SourcePosition;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * <p>
 * The AST is a strict tree: every node except the root has exactly one owner
 * and nodes never point back to their parents.
 */
public interface AstNode {

    /**
     * @return The kind tag of this node.
     */
    AstNodeKind kind();

    /**
     * @return Where this node starts in the source.
     */
    SourcePosition position();

    /**
     * Dispatches to the matching {@code visit} overload of the visitor.
     * @param visitor The visitor.
     * @param <R> The visitor's result type.
     * @return The visitor's result.
     */
    <R> R accept(AstVisitor<R> visitor);

    /**
     * Returns a list of the direct child nodes in evaluation order.
     * This allows generic traversals to walk the tree without knowing
     * the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
