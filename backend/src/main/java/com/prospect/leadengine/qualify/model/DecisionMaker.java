package com.prospect.leadengine.qualify.model;

public record DecisionMaker(
    String name,
    String role,
    String profileUrl,
    String email,
    String phone
) {
    public boolean hasProfileUrl() {
        return profileUrl != null && !profileUrl.isBlank();
    }
}
