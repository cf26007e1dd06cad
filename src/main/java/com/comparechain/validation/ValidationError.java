package com.comparechain.validation;

import com.comparechain.ast.Expression;
import com.comparechain.diagnostics.DiagnosticMessages;

import java.util.Objects;

/**
 * Why a tree was rejected, and the smallest sub-tree responsible.
 *
 * @param kind      Error kind
 * @param offending Offending sub-tree, for rendering
 */
public record ValidationError(ValidationErrorKind kind, Expression offending) {

    public ValidationError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(offending, "offending");
    }

    /**
     * Human readable description.
     */
    public String message() {
        return switch (kind) {
            case NO_COMPARISON_FOUND -> DiagnosticMessages.comparisonRequired();
            case INVALID_ROOT_SHAPE -> DiagnosticMessages.invalidRootShape(offending);
            case INCOMPLETE_COMBINATOR_BRANCH -> DiagnosticMessages.incompleteCombinatorBranch(offending);
            case NESTED_REWRITE_NOT_ALLOWED -> DiagnosticMessages.nestedNotAllowed();
        };
    }
}
