package com.project.lepidoptera.landmarks.controller;

import com.project.lepidoptera.landmarks.exceptions.LandmarkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import javax.imageio.ImageIO;

/** Checks and decodes uploaded specimen pictures for both controllers. */
@Component
public class SpecimenImageLoader {
    private static final Logger log = LoggerFactory.getLogger(SpecimenImageLoader.class);

    static final List<String> SUPPORTED_FORMATS = List.of(
            "image/jpeg", "image/jpg", "image/png", "image/gif", "image/bmp", "image/tiff"
    );
    private static final long MAX_UPLOAD_BYTES = 10L * 1024 * 1024;
    private static final int MIN_SIDE = 20;
    private static final int MAX_SIDE = 4000;

    public void validate(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Please choose a specimen picture to upload");
        }
        String contentType = file.getContentType();
        if (contentType == null || !SUPPORTED_FORMATS.contains(contentType.toLowerCase())) {
            throw new IllegalArgumentException("Unsupported file type: " + contentType
                    + ". Supported types: " + String.join(", ", SUPPORTED_FORMATS));
        }
        if (file.getSize() > MAX_UPLOAD_BYTES) {
            throw new IllegalArgumentException("File too large. Maximum size: 10MB");
        }
    }

    public BufferedImage load(MultipartFile file) throws IOException {
        BufferedImage input;
        try (InputStream in = file.getInputStream()) {
            input = ImageIO.read(in);
        }
        if (input == null) {
            throw new LandmarkException("The file is not a readable image or is corrupted.");
        }
        if (input.getWidth() < MIN_SIDE || input.getHeight() < MIN_SIDE) {
            throw new LandmarkException("Image too small. Minimum size: " + MIN_SIDE + "x" + MIN_SIDE + " pixels");
        }
        if (input.getWidth() > MAX_SIDE || input.getHeight() > MAX_SIDE) {
            throw new LandmarkException("Image too large. Maximum size: " + MAX_SIDE + "x" + MAX_SIDE + " pixels");
        }
        log.debug("Image loaded: {}x{}", input.getWidth(), input.getHeight());
        return input;
    }

    public static String supportedFormats() {
        return String.join(", ", SUPPORTED_FORMATS);
    }
}
