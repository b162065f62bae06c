package com.williamcallahan.boxhunt.types;

import java.awt.image.BufferedImage;

/**
 * Result of decoding and validating downloaded bytes
 * - Holds the RGB-normalized raster when the image passed validation
 * - Holds the rejection status and reason otherwise
 */
public class ProcessedImage {
    private final BufferedImage image;
    private final int width;
    private final int height;
    private final ImageAttemptStatus status;
    private final String processingError; // Null if successful

    private ProcessedImage(BufferedImage image, int width, int height, ImageAttemptStatus status, String processingError) {
        this.image = image;
        this.width = width;
        this.height = height;
        this.status = status;
        this.processingError = processingError;
    }

    public static ProcessedImage accepted(BufferedImage rgbImage) {
        return new ProcessedImage(rgbImage, rgbImage.getWidth(), rgbImage.getHeight(), ImageAttemptStatus.SUCCESS, null);
    }

    public static ProcessedImage rejected(ImageAttemptStatus status, String processingError) {
        return new ProcessedImage(null, 0, 0, status, processingError);
    }

    public BufferedImage getImage() {
        return image;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public ImageAttemptStatus getStatus() {
        return status;
    }

    public boolean isProcessingSuccessful() {
        return status == ImageAttemptStatus.SUCCESS;
    }

    public String getProcessingError() {
        return processingError;
    }
}
