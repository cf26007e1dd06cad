package com.comparechain.validation;

/**
 * Reasons an expression tree is rejected before rewriting.
 */
public enum ValidationErrorKind {
    /** No comparison anywhere in the tree. */
    NO_COMPARISON_FOUND,
    /** Root is neither a comparison nor a combinator. */
    INVALID_ROOT_SHAPE,
    /** A combinator operand is neither a comparison nor a valid combinator. */
    INCOMPLETE_COMBINATOR_BRANCH,
    /** A compare request appears inside another compare request. */
    NESTED_REWRITE_NOT_ALLOWED
}
