package com.flagship.statement_report.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * An input file (ledger or transaction log) does not exist or cannot be read.
 */
@Getter
public class MissingInputFileException extends StatementReportException {

    private final Path path;

    public MissingInputFileException(String description, Path path) {
        super(String.format("%s not found: %s", description, path));
        this.path = path;
    }

    public MissingInputFileException(String description, Path path, Throwable cause) {
        super(String.format("%s could not be read: %s", description, path), cause);
        this.path = path;
    }
}
