package com.prospect.leadengine.qualify.api;

import com.prospect.leadengine.qualify.service.ImportResult;
import com.prospect.leadengine.qualify.service.QualificationSummary;

import java.util.List;

public record LeadImportResponse(
    int parsed,
    List<ImportResult.RowError> rejectedRows,
    QualificationSummary qualification
) {
}
