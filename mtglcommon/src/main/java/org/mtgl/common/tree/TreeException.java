package org.mtgl.common.tree;

/**
 * Structural misuse of an {@link MTGTree}: a missing node, a second parent,
 * a cycle. Always a programming error.
 */
public class TreeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TreeException(String message) {
        super(message);
    }
}
