package com.comparechain.diagnostics;

/**
 * Receives advisory notices raised while rewritten expressions are evaluated.
 * Notices never change the result of an evaluation. The sink is invoked once per offending
 * comparator call; implementations called from several threads must be thread-safe themselves.
 */
@FunctionalInterface
public interface DiagnosticsSink {

    /**
     * Sink that drops every notice.
     */
    DiagnosticsSink DISCARD = message -> { };

    /**
     * Report a notice.
     *
     * @param message Human readable notice text
     */
    void notice(String message);
}
