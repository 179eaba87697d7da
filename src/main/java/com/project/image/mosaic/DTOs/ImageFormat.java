package com.project.image.mosaic.DTOs;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Formats the engine decodes and encodes, identified by extension and magic bytes. */
public enum ImageFormat {
    JPEG("jpg", List.of("jpg", "jpeg")),
    PNG("png", List.of("png")),
    GIF("gif", List.of("gif")),
    BMP("bmp", List.of("bmp")),
    TIFF("tiff", List.of("tif", "tiff")),
    WEBP("webp", List.of("webp"));

    /** Bytes needed to tell every supported format apart (RIFF....WEBP). */
    public static final int SIGNATURE_LENGTH = 12;

    private final String formatName;
    private final List<String> extensions;

    ImageFormat(String formatName, List<String> extensions) {
        this.formatName = formatName;
        this.extensions = extensions;
    }

    /** Name understood by {@code ImageIO.getImageWritersByFormatName}. */
    public String formatName() {
        return formatName;
    }

    public String defaultExtension() {
        return extensions.get(0);
    }

    public boolean supportsQuality() {
        return this == JPEG || this == WEBP;
    }

    public boolean matchesSignature(byte[] header) {
        if (header == null) return false;
        switch (this) {
            case JPEG:
                return startsWith(header, 0xFF, 0xD8);
            case PNG:
                return startsWith(header, 0x89, 0x50, 0x4E, 0x47);
            case GIF:
                return startsWith(header, 0x47, 0x49, 0x46, 0x38);
            case BMP:
                return startsWith(header, 0x42, 0x4D);
            case TIFF:
                return startsWith(header, 0x49, 0x49) || startsWith(header, 0x4D, 0x4D);
            case WEBP:
                return header.length >= SIGNATURE_LENGTH
                        && startsWith(header, 0x52, 0x49, 0x46, 0x46)
                        && (header[8] & 0xFF) == 0x57 && (header[9] & 0xFF) == 0x45
                        && (header[10] & 0xFF) == 0x42 && (header[11] & 0xFF) == 0x50;
            default:
                return false;
        }
    }

    public static Optional<ImageFormat> fromSignature(byte[] header) {
        return Arrays.stream(values()).filter(f -> f.matchesSignature(header)).findFirst();
    }

    public static Optional<ImageFormat> fromFileName(String fileName) {
        if (fileName == null) return Optional.empty();
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) return Optional.empty();
        String ext = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(f -> f.extensions.contains(ext)).findFirst();
    }

    /** Accepts "jpg", "JPEG", ".png" and the like. */
    public static ImageFormat parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Image format is required");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.startsWith(".")) v = v.substring(1);
        for (ImageFormat f : values()) {
            if (f.name().equalsIgnoreCase(v) || f.extensions.contains(v)) return f;
        }
        throw new IllegalArgumentException("Unsupported image format: " + value);
    }

    private static boolean startsWith(byte[] header, int... signature) {
        if (header.length < signature.length) return false;
        for (int i = 0; i < signature.length; i++) {
            if ((header[i] & 0xFF) != signature[i]) return false;
        }
        return true;
    }
}
