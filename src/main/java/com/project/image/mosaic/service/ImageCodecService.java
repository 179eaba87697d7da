package com.project.image.mosaic.service;

import com.project.image.mosaic.DTOs.ImageFormat;
import com.project.image.mosaic.exceptions.ImageDecodeException;
import com.project.image.mosaic.exceptions.InsufficientDiskSpaceException;
import com.project.image.mosaic.exceptions.MosaicException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.Iterator;
import java.util.Optional;

/**
 * Loads and saves images. Formats are recognized by magic bytes; JPEG, PNG, GIF,
 * BMP and TIFF go through ImageIO, WEBP through OpenCV.
 */
@Service
public class ImageCodecService {
    private static final Logger log = LoggerFactory.getLogger(ImageCodecService.class);

    private final OpenCvImageCodec openCv;
    private final long reserveBytes;

    @Autowired
    public ImageCodecService(OpenCvImageCodec openCv,
                             @Value("${app.mosaic.output.reserve-mb:16}") long reserveMb) {
        this.openCv = openCv;
        this.reserveBytes = Math.max(0, reserveMb) * 1024 * 1024;
    }

    public ImageCodecService() {
        this(new OpenCvImageCodec(), 16);
    }

    /** Extension check only; the content is verified when the file is loaded. */
    public boolean hasSupportedExtension(Path path) {
        return Files.isRegularFile(path) && ImageFormat.fromFileName(path.getFileName().toString()).isPresent();
    }

    public Optional<ImageFormat> sniffFormat(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return ImageFormat.fromSignature(in.readNBytes(ImageFormat.SIGNATURE_LENGTH));
        } catch (IOException e) {
            log.debug("Cannot read signature of {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Decodes the whole file. The caller owns the returned buffer.
     *
     * @throws ImageDecodeException if the file is missing, unrecognized or corrupt
     */
    public BufferedImage loadImage(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ImageDecodeException(path, "file not found");
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new ImageDecodeException(path, "read failed", e);
        }
        ImageFormat format = ImageFormat.fromSignature(Arrays.copyOf(bytes, Math.min(bytes.length, ImageFormat.SIGNATURE_LENGTH)))
                .orElseThrow(() -> new ImageDecodeException(path, "unrecognized image signature"));

        BufferedImage image;
        try {
            image = format == ImageFormat.WEBP ? openCv.decode(bytes) : ImageIO.read(new ByteArrayInputStream(bytes));
        } catch (IOException | RuntimeException e) {
            throw new ImageDecodeException(path, "corrupt " + format + " data", e);
        }
        if (image == null || image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new ImageDecodeException(path, "no decoder accepted the " + format + " data");
        }
        log.debug("Decoded {} ({} {}x{})", path.getFileName(), format, image.getWidth(), image.getHeight());
        return image;
    }

    /**
     * Encodes into a temporary file next to {@code target} and moves it into place, so
     * a failed save leaves any existing file untouched and no partial output behind.
     */
    public Path save(BufferedImage image, Path target, ImageFormat format, int quality) {
        if (quality < 1 || quality > 100) {
            throw new IllegalArgumentException("Quality must be between 1 and 100: " + quality);
        }
        Path temp = null;
        try {
            Path parent = target.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            temp = Files.createTempFile(parent, "." + target.getFileName(), ".part");

            if (format == ImageFormat.WEBP) {
                Files.write(temp, openCv.encode(image, format.formatName(), quality));
            } else {
                writeWithImageIo(image, temp, format, quality);
            }
            moveIntoPlace(temp, target);
            log.info("Saved {} ({}, quality {}, {} bytes)", target, format, quality, Files.size(target));
            return target;
        } catch (IOException | RuntimeException e) {
            deleteQuietly(temp);
            throw new MosaicException("Failed to save image to " + target, e);
        }
    }

    /** Scaled copy that fits in {@code maxWidth x maxHeight}; never enlarges. */
    public BufferedImage createPreview(BufferedImage image, int maxWidth, int maxHeight) {
        if (maxWidth < 1 || maxHeight < 1) {
            throw new IllegalArgumentException("Preview bounds must be positive: " + maxWidth + "x" + maxHeight);
        }
        int w = image.getWidth(), h = image.getHeight();
        double scale = Math.min(1.0, Math.min(maxWidth / (double) w, maxHeight / (double) h));
        int pw = Math.max(1, (int) Math.floor(w * scale));
        int ph = Math.max(1, (int) Math.floor(h * scale));

        BufferedImage preview = new BufferedImage(pw, ph, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = preview.createGraphics();
        graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        graphics.drawImage(image, 0, 0, pw, ph, null);
        graphics.dispose();
        return preview;
    }

    /** {@code out/mosaic.jpg} becomes {@code out/mosaic_thumb.jpg}. */
    public static Path previewPathFor(Path output, ImageFormat format) {
        String name = output.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return output.resolveSibling(stem + "_thumb." + format.defaultExtension());
    }

    /** Raw size of the decoded image plus the configured reserve. */
    public long estimateRequiredBytes(int width, int height) {
        return (long) width * height * 4 + reserveBytes;
    }

    public void ensureDiskSpace(Path target, long requiredBytes) {
        Path existing = target.toAbsolutePath();
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (existing == null) return;
        long available;
        try {
            available = Files.getFileStore(existing).getUsableSpace();
        } catch (IOException e) {
            log.warn("Could not check available disk space at {}: {}", existing, e.getMessage());
            return;
        }
        if (available < requiredBytes) {
            throw new InsufficientDiskSpaceException(existing.toString(), requiredBytes, available);
        }
    }

    private void writeWithImageIo(BufferedImage image, Path target, ImageFormat format, int quality) throws IOException {
        BufferedImage toWrite = needsOpaqueRgb(format) ? toRgb(image) : image;
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.formatName());
        if (!writers.hasNext()) {
            throw new IOException("No ImageIO writer for " + format);
        }
        ImageWriter writer = writers.next();
        try (OutputStream out = Files.newOutputStream(target);
             ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(ios);
            ImageWriteParam param = writer.getDefaultWriteParam();
            if (format.supportsQuality() && param.canWriteCompressed()) {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                param.setCompressionQuality(quality / 100f);
            }
            writer.write(null, new IIOImage(toWrite, null, null), param);
        } finally {
            writer.dispose();
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) return;
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", temp, e.getMessage());
        }
    }

    private static boolean needsOpaqueRgb(ImageFormat format) {
        return format == ImageFormat.JPEG || format == ImageFormat.BMP;
    }

    private static BufferedImage toRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) return image;
        BufferedImage copy = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = copy.createGraphics();
        graphics.drawImage(image, 0, 0, null);
        graphics.dispose();
        return copy;
    }
}
