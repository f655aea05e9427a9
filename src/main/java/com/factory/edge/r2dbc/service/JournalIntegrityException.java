package com.factory.edge.r2dbc.service;

import com.factory.edge.core.model.IntegrityReport;

/**
 * Raised at startup when chain verification finds violations and the node is
 * configured to refuse to start on a tampered journal.
 */
public class JournalIntegrityException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient IntegrityReport report;

    public JournalIntegrityException(IntegrityReport report) {
        super("Journal integrity check failed: " + report.violations().size() + " violation(s) on events "
                + report.invalidIds());
        this.report = report;
    }

    public IntegrityReport getReport() {
        return report;
    }
}
