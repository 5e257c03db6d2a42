package com.prospect.leadengine.qualify.service;

import com.prospect.leadengine.qualify.model.Lead;

/**
 * Pushes one qualified lead into a CRM: the company, its decision makers as contacts, and an opening deal.
 */
public interface CrmSyncClient {
    CrmSyncResult sync(Lead lead);
}
