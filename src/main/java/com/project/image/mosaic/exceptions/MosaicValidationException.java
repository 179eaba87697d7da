package com.project.image.mosaic.exceptions;

import java.util.List;

/** The request was rejected before any work started. */
public class MosaicValidationException extends MosaicException {
    private final List<String> errors;

    public MosaicValidationException(List<String> errors) {
        super("Invalid mosaic request: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public MosaicValidationException(String error) {
        this(List.of(error));
    }

    public List<String> getErrors() {
        return errors;
    }
}
