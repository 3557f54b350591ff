package com.di.loannova.exception;

import java.util.List;

/**
 * The source matches none of the recognized column layouts. Never recovered by guessing.
 */
public class SchemaDriftException extends PipelineException {

    private final List<String> missingColumns;
    private final List<String> unexpectedColumns;

    public SchemaDriftException(String message, List<String> missingColumns, List<String> unexpectedColumns) {
        super(message);
        this.missingColumns    = List.copyOf(missingColumns);
        this.unexpectedColumns = List.copyOf(unexpectedColumns);
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }

    public List<String> getUnexpectedColumns() {
        return unexpectedColumns;
    }
}
