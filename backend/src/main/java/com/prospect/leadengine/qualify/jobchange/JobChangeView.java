package com.prospect.leadengine.qualify.jobchange;

/**
 * A change event joined with the contact it belongs to.
 */
public record JobChangeView(
    JobChangeEvent event,
    String contactName,
    String profileUrl,
    String originalCompany,
    double originalLeadScore
) {
}
