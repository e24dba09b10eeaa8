package com.project.image.hairremoval.config;

import com.project.image.hairremoval.DTOs.HairRemovalOptions;
import com.project.image.hairremoval.DTOs.InpaintingMode;
import com.project.image.hairremoval.DTOs.ThresholdMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PipelineConfig {
    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Value("${app.hair-removal.working-width:720}")
    private int workingWidth;

    @Value("${app.hair-removal.working-height:720}")
    private int workingHeight;

    @Value("${app.hair-removal.tophat-radius:18}")
    private int topHatRadius;

    @Value("${app.hair-removal.brightening-factor:0.7}")
    private double brighteningFactor;

    @Value("${app.hair-removal.ffc-sigma:30}")
    private double ffcSigma;

    @Value("${app.hair-removal.threshold-mode:OTSU}")
    private ThresholdMode thresholdMode;

    @Value("${app.hair-removal.adaptive-block-size:35}")
    private int adaptiveBlockSize;

    @Value("${app.hair-removal.multi-channel:true}")
    private boolean multiChannel;

    @Value("${app.hair-removal.inpainting-mode:CAREFUL_BLEND}")
    private InpaintingMode inpaintingMode;

    @Value("${app.hair-removal.inpainting-radius:3}")
    private int inpaintingRadius;

    @Value("${app.hair-removal.preserve-details:true}")
    private boolean preserveDetails;

    @Bean
    public HairRemovalOptions hairRemovalOptions() {
        HairRemovalOptions options = new HairRemovalOptions(
                workingWidth, workingHeight,
                topHatRadius, brighteningFactor, ffcSigma,
                thresholdMode, adaptiveBlockSize,
                multiChannel,
                inpaintingMode, inpaintingRadius,
                preserveDetails
        );
        log.info("Default hair removal options: {}", options);
        return options;
    }
}
