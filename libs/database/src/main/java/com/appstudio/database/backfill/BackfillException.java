package com.appstudio.database.backfill;

/**
 * Base type for failures of the current-environment backfill.
 *
 * <p>All subclasses are unchecked and fatal for the run: they propagate to the migration
 * transaction boundary, which rolls back every write made so far.
 */
public class BackfillException extends RuntimeException {

    public BackfillException(String message) {
        super(message);
    }

    public BackfillException(String message, Throwable cause) {
        super(message, cause);
    }
}
