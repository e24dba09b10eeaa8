package com.project.image.hairremoval.service;

import com.project.image.hairremoval.DTOs.HairRemovalOptions;
import com.project.image.hairremoval.DTOs.HairRemovalResult;
import com.project.image.hairremoval.DTOs.PipelineStats;
import com.project.image.hairremoval.service.pipeline.ChannelEnhancer;
import com.project.image.hairremoval.service.pipeline.ChannelFuser;
import com.project.image.hairremoval.service.pipeline.DetailRestorer;
import com.project.image.hairremoval.service.pipeline.Inpainter;
import com.project.image.hairremoval.service.pipeline.MaskCleaner;
import com.project.image.hairremoval.service.pipeline.MetricsCollector;
import com.project.image.hairremoval.service.pipeline.PipelineCheckpoint;
import com.project.image.hairremoval.service.pipeline.ProgressListener;
import com.project.image.hairremoval.service.pipeline.Resizer;
import com.project.image.hairremoval.service.pipeline.Thresholder;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Removes hair occlusions from a dermoscopic RGB image.
 *
 * <p>Stages run strictly in order: resize, per-channel enhancement and fusion, thresholding,
 * mask cleaning, inpainting, detail restoration, metrics. A run keeps no state between calls,
 * so the service can be shared freely.
 */
@Service
public class HairRemovalService {
    private static final Logger log = LoggerFactory.getLogger(HairRemovalService.class);

    static {
        OpenCvLoader.ensureLoaded();
    }

    private final HairRemovalOptions defaultOptions;

    public HairRemovalService(HairRemovalOptions defaultOptions) {
        this.defaultOptions = defaultOptions;
    }

    public HairRemovalOptions defaultOptions() {
        return defaultOptions;
    }

    public HairRemovalResult removeHairs(Mat rgb) {
        return removeHairs(rgb, defaultOptions, ProgressListener.NONE);
    }

    public HairRemovalResult removeHairs(BufferedImage input, HairRemovalOptions options, ProgressListener listener) {
        return removeHairs(ImageConversions.toRgbMat(input), options, listener);
    }

    /**
     * @param rgb      8-bit RGB raster of any size
     * @param options  pipeline tuning
     * @param listener progress sink, may be {@code null}
     * @return hair-free image and final mask at working resolution, plus statistics
     */
    public HairRemovalResult removeHairs(Mat rgb, HairRemovalOptions options, ProgressListener listener) {
        Objects.requireNonNull(options, "options");
        ProgressListener progress = listener == null ? ProgressListener.NONE : listener;

        log.info("Starting hair removal for image {} (working size {}x{}), options={}",
                rgb == null ? "<none>" : rgb.size(), options.workingWidth(), options.workingHeight(), options);
        Mat resized = new Resizer(options.workingWidth(), options.workingHeight()).resize(rgb);

        ChannelEnhancer enhancer = new ChannelEnhancer(
                options.topHatRadius(), options.brighteningFactor(), options.ffcSigma());
        Mat hairness = new ChannelFuser(enhancer, options.multiChannel()).fuse(resized);
        notify(progress, PipelineCheckpoint.ENHANCEMENT_DONE);

        Thresholder.Thresholded candidate =
                new Thresholder(options.thresholdMode(), options.adaptiveBlockSize()).apply(hairness);
        notify(progress, PipelineCheckpoint.THRESHOLDING_DONE);

        Mat finalMask = new MaskCleaner().clean(candidate.mask());
        notify(progress, PipelineCheckpoint.CLEANING_DONE);

        notify(progress, PipelineCheckpoint.INPAINTING_STARTED);
        Mat inpainted = new Inpainter(options.inpaintingMode(), options.inpaintingRadius())
                .inpaint(resized, finalMask);
        notify(progress, PipelineCheckpoint.INPAINTING_DONE);

        Mat hairFree = new DetailRestorer(options.preserveDetails()).restore(inpainted, finalMask);
        notify(progress, PipelineCheckpoint.SELECTIVE_ENHANCEMENT_DONE);

        PipelineStats stats = new MetricsCollector()
                .collect(candidate.mask(), finalMask, resized, hairFree, candidate.threshold());
        log.info("Hair removal completed: initial coverage {}%, final coverage {}% ({} px), PSNR {} dB",
                String.format("%.2f", stats.initialHairCoverage()),
                String.format("%.2f", stats.finalHairCoverage()),
                stats.finalHairPixels(),
                String.format("%.2f", stats.psnr()));
        notify(progress, PipelineCheckpoint.COMPLETE);

        return new HairRemovalResult(hairFree, finalMask, stats);
    }

    private static void notify(ProgressListener listener, PipelineCheckpoint checkpoint) {
        log.debug("Checkpoint {} ({}%)", checkpoint, checkpoint.percent());
        try {
            listener.onCheckpoint(checkpoint);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed at {}: {}", checkpoint, e.getMessage(), e);
        }
    }
}
