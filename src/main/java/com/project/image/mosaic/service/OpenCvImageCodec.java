package com.project.image.mosaic.service;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.MatOfInt;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.Graphics;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;

/**
 * WEBP decoding and encoding through OpenCV's codecs; ImageIO has no WEBP plugin.
 * The native library is loaded on first use.
 */
@Component
public class OpenCvImageCodec {
    private static final Logger log = LoggerFactory.getLogger(OpenCvImageCodec.class);

    private static final class NativeLibrary {
        static final boolean LOADED = load();

        private static boolean load() {
            try {
                nu.pattern.OpenCV.loadLocally();
                log.info("OpenCV loaded successfully");
                return true;
            } catch (Exception | LinkageError e) {
                log.error("Failed to load OpenCV, WEBP support disabled", e);
                return false;
            }
        }
    }

    public boolean isAvailable() {
        return NativeLibrary.LOADED;
    }

    /** Returns null when OpenCV cannot make sense of the bytes. */
    public BufferedImage decode(byte[] encoded) {
        if (!isAvailable()) return null;
        MatOfByte buffer = new MatOfByte(encoded);
        Mat image = Imgcodecs.imdecode(buffer, Imgcodecs.IMREAD_COLOR);
        try {
            if (image.empty()) return null;
            return fromBgrMat(image);
        } finally {
            image.release();
            buffer.release();
        }
    }

    public byte[] encode(BufferedImage image, String extension, int quality) {
        if (!isAvailable()) {
            throw new IllegalStateException("OpenCV is not available to encode " + extension);
        }
        Mat mat = toBgrMat(image);
        MatOfByte out = new MatOfByte();
        MatOfInt params = new MatOfInt(Imgcodecs.IMWRITE_WEBP_QUALITY, Math.max(1, Math.min(100, quality)));
        try {
            if (!Imgcodecs.imencode("." + extension, mat, out, params)) {
                throw new IllegalStateException("OpenCV refused to encode " + extension);
            }
            return out.toArray();
        } finally {
            params.release();
            out.release();
            mat.release();
        }
    }

    /** OpenCV wants interleaved BGR bytes; anything else is redrawn into that layout first. */
    private static Mat toBgrMat(BufferedImage image) {
        BufferedImage bgr = image;
        if (image.getType() != BufferedImage.TYPE_3BYTE_BGR || image.getRaster().getParent() != null) {
            bgr = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
            Graphics g = bgr.createGraphics();
            g.drawImage(image, 0, 0, null);
            g.dispose();
        }
        Mat mat = new Mat(bgr.getHeight(), bgr.getWidth(), CvType.CV_8UC3);
        mat.put(0, 0, ((DataBufferByte) bgr.getRaster().getDataBuffer()).getData());
        return mat;
    }

    private static BufferedImage fromBgrMat(Mat mat) {
        int w = mat.cols(), h = mat.rows();
        BufferedImage image = new BufferedImage(w, h, BufferedImage.TYPE_3BYTE_BGR);
        byte[] target = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        mat.get(0, 0, target);
        return image;
    }
}
