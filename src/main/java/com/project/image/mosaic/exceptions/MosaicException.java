package com.project.image.mosaic.exceptions;

/** Base of the domain exceptions raised while building a mosaic. */
public class MosaicException extends RuntimeException {
    public MosaicException(String message) { super(message); }
    public MosaicException(String message, Throwable cause) { super(message, cause); }
}
