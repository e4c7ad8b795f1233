package org.imbalance.utilities.enums;

import lombok.Getter;

@Getter
public enum FileExtension {
    CSV(".csv"),
    HTML(".html"),
    JSON(".json");

    private final String id;

    FileExtension(String id) {
        this.id = id;
    }
}
