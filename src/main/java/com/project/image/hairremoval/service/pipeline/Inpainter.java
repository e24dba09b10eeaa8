package com.project.image.hairremoval.service.pipeline;

import com.project.image.hairremoval.DTOs.InpaintingMode;
import com.project.image.hairremoval.exceptions.DimensionMismatchException;
import com.project.image.hairremoval.exceptions.HairRemovalException;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.photo.Photo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Reconstructs the pixels under the hair mask. Pixels outside the mask are always copied
 * from the input unchanged.
 */
public final class Inpainter {
    private static final Logger log = LoggerFactory.getLogger(Inpainter.class);

    static final double CAREFUL_TELEA_RADIUS = 2;
    static final double CAREFUL_NS_RADIUS = 3;
    static final double CAREFUL_WEIGHT = 0.5;

    private final InpaintingMode mode;
    private final int radius;

    public Inpainter(InpaintingMode mode, int radius) {
        this.mode = mode;
        this.radius = radius;
    }

    public Mat inpaint(Mat rgb, Mat mask) {
        if (!rgb.size().equals(mask.size())) {
            throw new DimensionMismatchException("Inpainting mask", rgb.size(), mask.size());
        }
        if (mask.type() != CvType.CV_8UC1) {
            throw new HairRemovalException("Inpainting mask must be single-channel 8-bit, got "
                    + CvType.typeToString(mask.type()));
        }

        Mat result = rgb.clone();
        if (Core.countNonZero(mask) == 0) {
            log.debug("Empty mask, nothing to inpaint");
            return result;
        }

        Mat reconstructed = switch (mode) {
            case CAREFUL_BLEND -> carefulBlend(rgb, mask);
            case SINGLE_FAST -> telea(rgb, mask, radius);
        };
        reconstructed.copyTo(result, mask);
        return result;
    }

    private Mat carefulBlend(Mat rgb, Mat mask) {
        CompletableFuture<Mat> fastMarching =
                CompletableFuture.supplyAsync(() -> telea(rgb, mask, CAREFUL_TELEA_RADIUS));
        Mat navierStokes = new Mat();
        Photo.inpaint(rgb, mask, navierStokes, CAREFUL_NS_RADIUS, Photo.INPAINT_NS);

        Mat blended = new Mat();
        Core.addWeighted(join(fastMarching), CAREFUL_WEIGHT, navierStokes, 1.0 - CAREFUL_WEIGHT, 0, blended);
        return blended;
    }

    private static Mat telea(Mat rgb, Mat mask, double radius) {
        Mat out = new Mat();
        Photo.inpaint(rgb, mask, out, radius, Photo.INPAINT_TELEA);
        return out;
    }

    private static Mat join(CompletableFuture<Mat> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new HairRemovalException("Fast-marching inpainting failed", e.getCause());
        }
    }
}
