package com.project.lepidoptera.landmarks.controller;

import com.project.lepidoptera.landmarks.DTOs.LandmarkAnalysis;
import com.project.lepidoptera.landmarks.DTOs.LandmarkResponse;
import com.project.lepidoptera.landmarks.imaging.RgbImage;
import com.project.lepidoptera.landmarks.render.OverlaySurfaces;
import com.project.lepidoptera.landmarks.service.LandmarkPipeline;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/** JSON variant of the upload flow, for scripted measurement runs. */
@RestController
@RequestMapping("/api")
@Validated
public class LandmarkApiController {
    private static final Logger log = LoggerFactory.getLogger(LandmarkApiController.class);

    private final LandmarkPipeline pipeline;
    private final SpecimenImageLoader imageLoader;

    public LandmarkApiController(LandmarkPipeline pipeline, SpecimenImageLoader imageLoader) {
        this.pipeline = pipeline;
        this.imageLoader = imageLoader;
    }

    @PostMapping(value = "/landmarks",
            consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public LandmarkResponse locate(
            @RequestParam("file") MultipartFile file,
            @RequestParam("topRuler") @Min(1) @Max(10000) int topRuler
    ) throws IOException {
        imageLoader.validate(file);
        log.info("API request: {} ({}KB), top_ruler: {}",
                file.getOriginalFilename(), file.getSize() / 1024, topRuler);

        RgbImage image = RgbImage.fromBufferedImage(imageLoader.load(file));
        LandmarkAnalysis analysis = pipeline.analyze(image, topRuler, OverlaySurfaces.none());
        return LandmarkResponse.from(analysis);
    }
}
