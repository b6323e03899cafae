package com.mathtext.model;

/**
 * Visitor pattern interface for traversing the markup AST.
 */
public interface MarkupNodeVisitor<R> {
    R visit(TextNode text);
    R visit(ConstructNode construct);
    R visit(GroupNode group);
    R visit(SpecialNode special);
    R visit(CommentNode comment);
}
