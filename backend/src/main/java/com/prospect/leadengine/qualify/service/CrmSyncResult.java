package com.prospect.leadengine.qualify.service;

import java.util.List;

public record CrmSyncResult(
    String companyName,
    boolean success,
    String companyId,
    List<String> contactIds,
    String dealId,
    List<String> errors
) {
    public static final String NOT_CONFIGURED = "crm_not_configured";

    public CrmSyncResult {
        contactIds = contactIds == null ? List.of() : List.copyOf(contactIds);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static CrmSyncResult failed(String companyName, String error) {
        return new CrmSyncResult(companyName, false, null, List.of(), null, List.of(error));
    }
}
