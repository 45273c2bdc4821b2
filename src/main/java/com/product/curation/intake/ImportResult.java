package com.product.curation.intake;

import java.util.List;

/**
 * Outcome of importing a file of extraction results.
 *
 * @param totalRecords     non-empty lines read
 * @param candidatesStored candidates stored or matched by URL
 * @param claimsAdded      claims attached
 * @param errors           records that were rejected
 */
public record ImportResult(
        long totalRecords,
        long candidatesStored,
        long claimsAdded,
        List<ImportError> errors
) {
    public ImportResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A rejected record.
     *
     * @param lineNumber 1-based line of the record, 0 for errors not tied to a line
     */
    public record ImportError(long lineNumber, String message) {}
}
