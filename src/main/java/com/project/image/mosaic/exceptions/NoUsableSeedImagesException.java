package com.project.image.mosaic.exceptions;

public class NoUsableSeedImagesException extends MosaicResourceException {
    private final int skippedFiles;

    public NoUsableSeedImagesException(String source, int skippedFiles) {
        super("No usable seed images in " + source + " (" + skippedFiles + " file(s) could not be decoded)");
        this.skippedFiles = skippedFiles;
    }

    public int getSkippedFiles() {
        return skippedFiles;
    }
}
