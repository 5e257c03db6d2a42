package com.prospect.leadengine.qualify.techno;

import java.util.List;

/**
 * Observable markers of one technology. Body patterns are matched against the lower-cased page, header patterns
 * against lower-cased {@code name: value} header lines.
 */
public record TechSignature(
    String name,
    TechCategory category,
    List<String> bodyPatterns,
    List<String> headerPatterns
) {
    public TechSignature {
        bodyPatterns = bodyPatterns == null ? List.of() : List.copyOf(bodyPatterns);
        headerPatterns = headerPatterns == null ? List.of() : List.copyOf(headerPatterns);
    }

    public boolean matchesBody(String lowerBody) {
        if (lowerBody == null || lowerBody.isEmpty()) {
            return false;
        }
        for (String pattern : bodyPatterns) {
            if (lowerBody.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    public boolean matchesHeaders(String lowerHeaderText) {
        if (lowerHeaderText == null || lowerHeaderText.isEmpty()) {
            return false;
        }
        for (String pattern : headerPatterns) {
            if (lowerHeaderText.contains(pattern)) {
                return true;
            }
        }
        return false;
    }
}
