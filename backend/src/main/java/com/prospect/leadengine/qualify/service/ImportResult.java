package com.prospect.leadengine.qualify.service;

import com.prospect.leadengine.qualify.model.Lead;

import java.util.List;

/**
 * Leads parsed from an import file plus the rows that could not be read. Row numbers are 1-based data rows.
 */
public record ImportResult(
    List<Lead> leads,
    List<RowError> errors
) {
    public ImportResult {
        leads = leads == null ? List.of() : List.copyOf(leads);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public record RowError(long row, String message) {
    }
}
