package com.comparechain.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default sink: every notice becomes a WARN log line.
 */
public class LoggingDiagnosticsSink implements DiagnosticsSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingDiagnosticsSink.class);

    @Override
    public void notice(String message) {
        log.warn(message);
    }
}
