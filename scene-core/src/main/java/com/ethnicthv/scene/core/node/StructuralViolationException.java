package com.ethnicthv.scene.core.node;

/**
 * Unchecked exception raised when an operation would break the single-parent
 * ownership of the node tree: adding a node that already has a parent, adding a
 * node underneath itself, or removing a node from a parent that does not own it.
 * <p>
 * It signals a programming error in the caller. The tree is left unchanged.
 */
public class StructuralViolationException extends RuntimeException {
    public StructuralViolationException(String message) {
        super(message);
    }
}
