package com.project.image.mosaic.exceptions;

import java.nio.file.Path;

/** One file could not be decoded. Fatal only for the master image. */
public class ImageDecodeException extends MosaicException {
    private final Path imagePath;

    public ImageDecodeException(Path imagePath, String reason) {
        super("Cannot decode " + imagePath + ": " + reason);
        this.imagePath = imagePath;
    }

    public ImageDecodeException(Path imagePath, String reason, Throwable cause) {
        super("Cannot decode " + imagePath + ": " + reason, cause);
        this.imagePath = imagePath;
    }

    public Path getImagePath() {
        return imagePath;
    }
}
