package com.company.powersense.domain.enums;

public enum VersioningMode {
    SEQUENTIAL("Compare against the latest stored value, versions 1, 2, 3 per key"),
    CONTENT_HASH("Version derived from a hash of value and key, no read before write");

    private final String description;

    VersioningMode(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
