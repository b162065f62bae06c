package com.williamcallahan.boxhunt.service.image;

import com.williamcallahan.boxhunt.config.HarvestProperties;
import com.williamcallahan.boxhunt.types.ImageAttemptStatus;
import com.williamcallahan.boxhunt.types.ProcessedImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * Decodes, validates and re-encodes downloaded images
 * - Normalizes every accepted image to a 3-channel RGB raster
 * - Enforces the configured minimum dimensions
 * - Encodes accepted images as JPEG at the configured quality
 */
@Service
public class ImageProcessingService {

    private static final Logger logger = LoggerFactory.getLogger(ImageProcessingService.class);

    private final int minWidth;
    private final int minHeight;
    private final float jpegQuality;

    public ImageProcessingService(HarvestProperties properties) {
        this.minWidth = properties.getImages().getMinWidth();
        this.minHeight = properties.getImages().getMinHeight();
        this.jpegQuality = properties.getImages().getJpegQuality();
    }

    /**
     * Decodes raw bytes and applies the acceptance rules.
     *
     * @param rawImageBytes downloaded body
     * @param urlForLog source URL, used only in log lines
     * @return accepted image, or a rejection with REJECTED_UNDECODABLE / REJECTED_TOO_SMALL
     */
    public ProcessedImage validate(byte[] rawImageBytes, String urlForLog) {
        if (rawImageBytes == null || rawImageBytes.length == 0) {
            logger.warn("{}: Raw image bytes are null or empty. Cannot process.", urlForLog);
            return ProcessedImage.rejected(ImageAttemptStatus.REJECTED_UNDECODABLE, "Raw image bytes are null or empty.");
        }

        BufferedImage decoded;
        try (ByteArrayInputStream bais = new ByteArrayInputStream(rawImageBytes)) {
            decoded = ImageIO.read(bais);
        } catch (IOException | RuntimeException e) {
            logger.warn("{}: Failed to decode image: {}", urlForLog, e.getMessage());
            return ProcessedImage.rejected(ImageAttemptStatus.REJECTED_UNDECODABLE, "Decode error: " + e.getMessage());
        }
        if (decoded == null) {
            logger.warn("{}: Could not read raw bytes into a BufferedImage. Format might be unsupported or corrupt.", urlForLog);
            return ProcessedImage.rejected(ImageAttemptStatus.REJECTED_UNDECODABLE, "Unsupported or corrupt image format.");
        }

        if (decoded.getWidth() < minWidth || decoded.getHeight() < minHeight) {
            logger.debug("{}: Image dimensions ({}x{}) are below the minimum ({}x{}).",
                urlForLog, decoded.getWidth(), decoded.getHeight(), minWidth, minHeight);
            return ProcessedImage.rejected(ImageAttemptStatus.REJECTED_TOO_SMALL,
                "Image too small: " + decoded.getWidth() + "x" + decoded.getHeight());
        }

        return ProcessedImage.accepted(toRgb(decoded));
    }

    /**
     * Drops any alpha channel and converts palette or grayscale rasters to packed RGB
     */
    static BufferedImage toRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        int width = image.getWidth();
        int height = image.getHeight();
        BufferedImage rgb = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            image.getRGB(0, y, width, 1, row, 0, width);
            rgb.setRGB(0, y, width, 1, row, 0, width);
        }
        return rgb;
    }

    /**
     * Encodes an RGB image as JPEG
     *
     * @throws IOException if no JPEG writer is available or encoding fails
     */
    public byte[] encodeJpeg(BufferedImage rgbImage) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG ImageWriters available.");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(baos)) {
            ImageWriteParam jpegParams = writer.getDefaultWriteParam();
            jpegParams.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            jpegParams.setCompressionQuality(jpegQuality);

            writer.setOutput(ios);
            writer.write(null, new IIOImage(rgbImage, null, null), jpegParams);
        } finally {
            writer.dispose();
        }
        return baos.toByteArray();
    }
}
