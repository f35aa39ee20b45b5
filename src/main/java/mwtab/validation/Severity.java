package mwtab.validation;

import lombok.Getter;

@Getter
public enum Severity {
    ERROR("Error"),
    WARNING("Warning");

    private final String label;

    Severity(String label) {
        this.label = label;
    }
}
