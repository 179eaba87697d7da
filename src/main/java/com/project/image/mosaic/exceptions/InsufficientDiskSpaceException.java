package com.project.image.mosaic.exceptions;

public class InsufficientDiskSpaceException extends MosaicResourceException {
    private final long requiredBytes;
    private final long availableBytes;

    public InsufficientDiskSpaceException(String location, long requiredBytes, long availableBytes) {
        super("Not enough disk space at " + location + ": need " + requiredBytes
                + " bytes, " + availableBytes + " available");
        this.requiredBytes = requiredBytes;
        this.availableBytes = availableBytes;
    }

    public long getRequiredBytes() { return requiredBytes; }
    public long getAvailableBytes() { return availableBytes; }
}
