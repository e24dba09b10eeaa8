package com.project.image.hairremoval.controller;

import com.project.image.hairremoval.DTOs.HairRemovalOptions;
import com.project.image.hairremoval.DTOs.HairRemovalResult;
import com.project.image.hairremoval.DTOs.InpaintingMode;
import com.project.image.hairremoval.DTOs.PipelineStats;
import com.project.image.hairremoval.DTOs.ThresholdMode;
import com.project.image.hairremoval.exceptions.HairRemovalException;
import com.project.image.hairremoval.exceptions.InvalidImageException;
import com.project.image.hairremoval.service.HairRemovalService;
import com.project.image.hairremoval.service.ImageConversions;
import com.project.image.hairremoval.service.pipeline.ProgressListener;
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
import java.util.Arrays;
import java.util.List;
import javax.imageio.ImageIO;

/**
 * Upload form and result page. Everything stays in memory: the result images are embedded
 * as data URIs and nothing is written to disk.
 */
@Controller
@Validated
public class HairRemovalController {
    private static final Logger log = LoggerFactory.getLogger(HairRemovalController.class);

    private static final List<String> SUPPORTED_FORMATS = Arrays.asList(
            "image/jpeg", "image/jpg", "image/png", "image/bmp", "image/gif"
    );
    private static final long MAX_UPLOAD_BYTES = 10 * 1024 * 1024;
    private static final int MIN_DIMENSION = 8;

    private final HairRemovalService hairRemovalService;

    public HairRemovalController(HairRemovalService hairRemovalService) {
        this.hairRemovalService = hairRemovalService;
    }

    @GetMapping("/remove")
    public String showForm(Model model) {
        populateFormModel(model, hairRemovalService.defaultOptions());
        return "remove";
    }

    @PostMapping(value = "/remove", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public String handleUpload(
            @RequestParam("file") @NotNull MultipartFile file,
            @RequestParam(name = "thresholdMode", required = false) ThresholdMode thresholdMode,
            @RequestParam(name = "multiChannel", required = false) Boolean multiChannel,
            @RequestParam(name = "inpaintingMode", required = false) InpaintingMode inpaintingMode,
            @RequestParam(name = "preserveDetails", required = false) Boolean preserveDetails,
            Model model
    ) throws IOException {

        validateUploadedFile(file);
        HairRemovalOptions options = resolveOptions(thresholdMode, multiChannel, inpaintingMode, preserveDetails);

        log.info("Processing file: {} ({}KB)", file.getOriginalFilename(), file.getSize() / 1024);
        BufferedImage input = loadAndValidateImage(file);

        String name = file.getOriginalFilename();
        ProgressListener progress = checkpoint ->
                log.debug("{}: {} ({}%)", name, checkpoint.label(), checkpoint.percent());

        try {
            HairRemovalResult result = hairRemovalService.removeHairs(input, options, progress);
            populateResultModel(model, input, result);
            log.info("Hair removal completed successfully for {}", name);
            return "result";
        } catch (HairRemovalException e) {
            log.warn("Hair removal failed for {}: {}", name, e.getMessage());
            populateFormModel(model, options);
            model.addAttribute("error", e.getMessage());
            return "remove";
        }
    }

    private HairRemovalOptions resolveOptions(ThresholdMode thresholdMode, Boolean multiChannel,
                                              InpaintingMode inpaintingMode, Boolean preserveDetails) {
        HairRemovalOptions options = hairRemovalService.defaultOptions();
        if (thresholdMode != null) options = options.withThresholdMode(thresholdMode);
        if (multiChannel != null) options = options.withMultiChannel(multiChannel);
        if (inpaintingMode != null) options = options.withInpaintingMode(inpaintingMode);
        if (preserveDetails != null) options = options.withPreserveDetails(preserveDetails);
        return options;
    }

    private void validateUploadedFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Please choose a file to upload");
        }

        String contentType = file.getContentType();
        if (contentType == null || !SUPPORTED_FORMATS.contains(contentType.toLowerCase())) {
            throw new IllegalArgumentException(
                    "Unsupported file format: " + contentType +
                            ". Supported formats: " + String.join(", ", SUPPORTED_FORMATS)
            );
        }

        if (file.getSize() > MAX_UPLOAD_BYTES) {
            throw new IllegalArgumentException("File is too large. Maximum size: 10MB");
        }
    }

    private BufferedImage loadAndValidateImage(MultipartFile file) throws IOException {
        BufferedImage input;
        try (var inputStream = file.getInputStream()) {
            input = ImageIO.read(inputStream);
        }

        if (input == null) {
            throw new InvalidImageException("The file is not a valid image or is corrupted.");
        }
        if (input.getWidth() < MIN_DIMENSION || input.getHeight() < MIN_DIMENSION) {
            throw new InvalidImageException(
                    "Image is too small. Minimum size: " + MIN_DIMENSION + "x" + MIN_DIMENSION + " pixels");
        }

        log.debug("Image loaded successfully: {}x{}", input.getWidth(), input.getHeight());
        return input;
    }

    private void populateFormModel(Model model, HairRemovalOptions options) {
        model.addAttribute("options", options);
        model.addAttribute("thresholdMode", options.thresholdMode().name());
        model.addAttribute("inpaintingMode", options.inpaintingMode().name());
        model.addAttribute("multiChannel", options.multiChannel());
        model.addAttribute("preserveDetails", options.preserveDetails());
        model.addAttribute("supportedFormats", String.join(", ", SUPPORTED_FORMATS));
    }

    private void populateResultModel(Model model, BufferedImage input, HairRemovalResult result) {
        PipelineStats stats = result.stats();

        model.addAttribute("originalImage",
                ImageConversions.toDataUri(ImageConversions.toPng(ImageConversions.toRgbMat(input)), "image/png"));
        model.addAttribute("hairFreeImage",
                ImageConversions.toDataUri(ImageConversions.toPng(result.hairFree()), "image/png"));
        model.addAttribute("maskImage",
                ImageConversions.toDataUri(ImageConversions.toPng(result.mask()), "image/png"));
        model.addAttribute("downloadImage",
                ImageConversions.toDataUri(ImageConversions.toJpeg(result.hairFree()), "image/jpeg"));

        model.addAttribute("width", result.hairFree().cols());
        model.addAttribute("height", result.hairFree().rows());
        model.addAttribute("initialCoverage", String.format("%.2f", stats.initialHairCoverage()));
        model.addAttribute("finalCoverage", String.format("%.2f", stats.finalHairCoverage()));
        model.addAttribute("hairPixels", stats.finalHairPixels());
        model.addAttribute("psnr", stats.identicalToOriginal() ? "∞" : String.format("%.2f", stats.psnr()));
        model.addAttribute("stats", stats);
    }
}
