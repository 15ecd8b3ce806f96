/*
 * Copyright (c) 2025 Solstice Formula Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.solstice.formulac.api.exceptions;

/**
 * Thrown when a reform document cannot be parsed into parameter overrides.
 * Raised before any closure building or synthesis work starts.
 */
public class InvalidReformException extends CompilationException {

    public InvalidReformException(String message) {
        super(message);
    }

    public InvalidReformException(String message, Throwable cause) {
        super(message, cause);
    }
}
