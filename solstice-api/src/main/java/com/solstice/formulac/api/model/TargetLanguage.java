package com.solstice.formulac.api.model;

/**
 * Output syntax of a generated module.
 */
public enum TargetLanguage {
    PYTHON("py"),
    JAVASCRIPT("js"),
    TYPESCRIPT("ts");

    private final String fileExtension;

    TargetLanguage(String fileExtension) {
        this.fileExtension = fileExtension;
    }

    public String fileExtension() {
        return fileExtension;
    }

    public boolean isStructured() {
        return this != PYTHON;
    }

    public static TargetLanguage fromString(String value) {
        if (value == null) return null;
        return switch (value.trim().toLowerCase()) {
            case "python", "py" -> PYTHON;
            case "javascript", "js" -> JAVASCRIPT;
            case "typescript", "ts" -> TYPESCRIPT;
            default -> null;
        };
    }
}
