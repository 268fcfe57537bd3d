package com.flagship.statement_report.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * The statement report could not be written. No partial report is left behind.
 */
@Getter
public class StatementWriteException extends StatementReportException {

    private final Path path;

    public StatementWriteException(Path path, Throwable cause) {
        super("Failed to write statement report: " + path, cause);
        this.path = path;
    }
}
