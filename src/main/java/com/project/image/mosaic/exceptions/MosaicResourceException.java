package com.project.image.mosaic.exceptions;

/** A resource the whole run depends on is missing; the run is aborted without output. */
public class MosaicResourceException extends MosaicException {
    public MosaicResourceException(String message) { super(message); }
    public MosaicResourceException(String message, Throwable cause) { super(message, cause); }
}
