package com.roster.matching.directory;

import java.util.List;

/**
 * Outcome of loading a directory snapshot.
 *
 * @param directory   the loaded directory, containing every valid row
 * @param rowsRead    data rows read, header excluded
 * @param errors      rows that were skipped
 */
public record LoadResult(InMemoryPlayerDirectory directory, long rowsRead, List<LoadError> errors) {

    public LoadResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long playersLoaded() {
        return directory.size();
    }

    public int errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A row that could not be turned into a {@link com.roster.matching.core.model.PlayerRecord}.
     */
    public record LoadError(long lineNumber, String line, String message) {
    }
}
