package com.flagship.statement_report.exception;

/**
 * Base class for failures that stop a statement run.
 *
 * Record-level problems in the input never raise this; they are defaulted
 * and the run continues.
 */
public class StatementReportException extends RuntimeException {

    public StatementReportException(String message) {
        super(message);
    }

    public StatementReportException(String message, Throwable cause) {
        super(message, cause);
    }
}
