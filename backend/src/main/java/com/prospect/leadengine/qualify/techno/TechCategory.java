package com.prospect.leadengine.qualify.techno;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TechCategory {
    CLOUD_PROVIDER("cloud_provider"),
    CMS("cms"),
    ECOMMERCE("ecommerce"),
    ANALYTICS("analytics"),
    CDN("cdn"),
    DATABASE("database"),
    FRONTEND("frontend"),
    BACKEND("backend"),
    LIBRARY("library");

    private final String value;

    TechCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
