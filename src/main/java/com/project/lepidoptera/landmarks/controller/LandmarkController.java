package com.project.lepidoptera.landmarks.controller;

import com.project.lepidoptera.landmarks.DTOs.LandmarkAnalysis;
import com.project.lepidoptera.landmarks.exceptions.LandmarkException;
import com.project.lepidoptera.landmarks.exceptions.NoRegionsFoundException;
import com.project.lepidoptera.landmarks.exceptions.ThresholdingFailedException;
import com.project.lepidoptera.landmarks.imaging.RgbImage;
import com.project.lepidoptera.landmarks.render.BufferedImageSurface;
import com.project.lepidoptera.landmarks.render.OverlaySurfaces;
import com.project.lepidoptera.landmarks.service.LandmarkPipeline;
import com.project.lepidoptera.landmarks.service.StorageService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Controller
@Validated
public class LandmarkController {
    private static final Logger log = LoggerFactory.getLogger(LandmarkController.class);

    private final LandmarkPipeline pipeline;
    private final StorageService storageService;
    private final SpecimenImageLoader imageLoader;

    public LandmarkController(LandmarkPipeline pipeline, StorageService storageService,
                              SpecimenImageLoader imageLoader) {
        this.pipeline = pipeline;
        this.storageService = storageService;
        this.imageLoader = imageLoader;
    }

    @GetMapping("/landmarks")
    public String showForm(Model model) {
        model.addAttribute("supportedFormats", SpecimenImageLoader.supportedFormats());
        return "landmarks";
    }

    @PostMapping(value = "/landmarks", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public String handleUpload(
            @RequestParam("file") @NotNull MultipartFile file,
            @RequestParam("topRuler")
            @Min(value = 1, message = "top_ruler must be a positive row index")
            @Max(value = 10000, message = "top_ruler cannot exceed 10000")
            int topRuler,
            Model model
    ) throws IOException {

        imageLoader.validate(file);
        log.info("Processing file: {} ({}KB), top_ruler: {}",
                file.getOriginalFilename(), file.getSize() / 1024, topRuler);

        var storedOriginal = storageService.store(file);
        BufferedImage input = imageLoader.load(file);

        try {
            BufferedImageSurface overlay = new BufferedImageSurface(input.getWidth(), topRuler);
            LandmarkAnalysis analysis = pipeline.analyze(
                    RgbImage.fromBufferedImage(input), topRuler, OverlaySurfaces.of(null, null, overlay));
            var overlayStored = storageService.storeResultImage(overlay.toPng(), "landmarks");

            populateResultModel(model, storedOriginal, overlayStored, analysis);
            log.info("Landmarks located for {}", file.getOriginalFilename());
            return "result";

        } catch (LandmarkException e) {
            log.warn("Landmark extraction failed for {}: {}", file.getOriginalFilename(), e.getMessage());
            model.addAttribute("error", e.getMessage());
            model.addAttribute("suggestion", suggestionFor(e));
            model.addAttribute("supportedFormats", SpecimenImageLoader.supportedFormats());
            return "landmarks";
        }
    }

    private void populateResultModel(Model model, StorageService.StoredFile original,
                                     StorageService.StoredFile overlay, LandmarkAnalysis analysis) {
        model.addAttribute("originalPath", "/" + original.relativeWebPath());
        model.addAttribute("overlayPath", "/" + overlay.relativeWebPath());
        model.addAttribute("width", analysis.silhouette().width());
        model.addAttribute("height", analysis.silhouette().height());
        model.addAttribute("midline", analysis.midline());
        model.addAttribute("landmarks", landmarkRows(analysis));
    }

    private List<LandmarkRow> landmarkRows(LandmarkAnalysis analysis) {
        List<LandmarkRow> rows = new ArrayList<>();
        for (Map.Entry<String, int[]> e : analysis.landmarks().asMap().entrySet()) {
            rows.add(new LandmarkRow(e.getKey(), e.getValue()[0], e.getValue()[1]));
        }
        return rows;
    }

    private String suggestionFor(LandmarkException e) {
        if (e instanceof ThresholdingFailedException) {
            return "The picture or the area above the ruler looks uniform. Check top_ruler and the lighting.";
        } else if (e instanceof NoRegionsFoundException) {
            return "No specimen or tag was found. Check that the tags sit in the top-right quadrant and top_ruler is correct.";
        }
        return "Try another picture, preferably PNG or TIFF.";
    }

    public record LandmarkRow(String name, int row, int col) {}
}
