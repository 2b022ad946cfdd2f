package com.questrail.testtree.model;

/**
 * Thrown when a suite declares two children with the same name.
 *
 * <p>Raised inside a discovery body, so it surfaces as a build error of the
 * enclosing suite.</p>
 */
public final class DuplicateNodeException extends RuntimeException
{
    public DuplicateNodeException(TestPath id) {
        super("duplicate test node: " + id);
    }
}
