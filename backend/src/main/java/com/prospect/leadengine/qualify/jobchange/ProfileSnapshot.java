package com.prospect.leadengine.qualify.jobchange;

/**
 * Company and role read from a contact's public profile. Either may be null.
 */
public record ProfileSnapshot(String company, String role) {
    public boolean isEmpty() {
        return (company == null || company.isBlank()) && (role == null || role.isBlank());
    }
}
