package com.project.image.hairremoval.service.pipeline;

import com.project.image.hairremoval.exceptions.DimensionMismatchException;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.CLAHE;
import org.opencv.imgproc.Imgproc;
import org.opencv.photo.Photo;

import java.util.ArrayList;
import java.util.List;

/**
 * Final clean-up of the inpainted image: selective non-local-means denoising around the
 * reconstructed regions, CLAHE on L*, and unsharp masking.
 */
public final class DetailRestorer {

    static final int SEAM_KERNEL_SIZE = 5;
    static final float NLM_H = 3;
    static final float NLM_H_COLOR = 3;
    static final int NLM_TEMPLATE_WINDOW = 7;
    static final int NLM_SEARCH_WINDOW = 21;
    static final double CLAHE_CLIP_LIMIT = 1.5;
    static final Size CLAHE_TILES = new Size(8, 8);
    static final double SHARPEN_SIGMA = 1.0;
    static final double SHARPEN_AMOUNT = 1.3;

    private final boolean preserveDetails;

    public DetailRestorer(boolean preserveDetails) {
        this.preserveDetails = preserveDetails;
    }

    public Mat restore(Mat inpainted, Mat mask) {
        if (!inpainted.size().equals(mask.size())) {
            throw new DimensionMismatchException("Restoration mask", inpainted.size(), mask.size());
        }
        Mat base = preserveDetails ? denoiseSeams(inpainted, mask) : inpainted;
        return sharpen(restoreContrast(base));
    }

    /** Blends a denoised copy in with weight mask/255, the mask grown to cover inpainting seams. */
    Mat denoiseSeams(Mat rgb, Mat mask) {
        if (Core.countNonZero(mask) == 0) {
            return rgb;
        }

        Mat seams = new Mat();
        Imgproc.dilate(mask, seams, Mat.ones(SEAM_KERNEL_SIZE, SEAM_KERNEL_SIZE, CvType.CV_8U));

        Mat denoised = new Mat();
        Photo.fastNlMeansDenoisingColored(rgb, denoised, NLM_H, NLM_H_COLOR, NLM_TEMPLATE_WINDOW, NLM_SEARCH_WINDOW);

        Mat singleWeight = new Mat();
        seams.convertTo(singleWeight, CvType.CV_32F, 1.0 / 255.0);
        Mat weight = new Mat();
        Imgproc.cvtColor(singleWeight, weight, Imgproc.COLOR_GRAY2RGB);
        Mat inverse = new Mat();
        Core.subtract(new Mat(weight.size(), CvType.CV_32FC3, new Scalar(1, 1, 1)), weight, inverse);

        Mat original = new Mat();
        rgb.convertTo(original, CvType.CV_32FC3);
        Mat smoothed = new Mat();
        denoised.convertTo(smoothed, CvType.CV_32FC3);

        Core.multiply(original, inverse, original);
        Core.multiply(smoothed, weight, smoothed);
        Mat blended = new Mat();
        Core.add(original, smoothed, blended);

        return Quantizer.truncate(blended, CvType.CV_8UC3);
    }

    /**
     * CLAHE on lightness only. The Lab conversion is done in floating point; only L is
     * quantised to 8 bits for the equalizer, so chroma is left exactly as it was.
     */
    Mat restoreContrast(Mat rgb) {
        Mat rgbFloat = new Mat();
        rgb.convertTo(rgbFloat, CvType.CV_32FC3, 1.0 / 255.0);
        Mat lab = new Mat();
        Imgproc.cvtColor(rgbFloat, lab, Imgproc.COLOR_RGB2Lab);

        List<Mat> planes = new ArrayList<>(3);
        Core.split(lab, planes);

        // L* is in [0, 100] for float input
        Mat lightness = new Mat();
        planes.get(0).convertTo(lightness, CvType.CV_8U, 255.0 / 100.0);
        CLAHE clahe = Imgproc.createCLAHE(CLAHE_CLIP_LIMIT, CLAHE_TILES);
        Mat equalized = new Mat();
        clahe.apply(lightness, equalized);

        Mat restoredLightness = new Mat();
        equalized.convertTo(restoredLightness, CvType.CV_32F, 100.0 / 255.0);
        planes.set(0, restoredLightness);
        Core.merge(planes, lab);

        Imgproc.cvtColor(lab, rgbFloat, Imgproc.COLOR_Lab2RGB);
        Mat out = new Mat();
        rgbFloat.convertTo(out, CvType.CV_8UC3, 255.0);
        return out;
    }

    Mat sharpen(Mat rgb) {
        Mat blurred = new Mat();
        Imgproc.GaussianBlur(rgb, blurred, new Size(0, 0), SHARPEN_SIGMA);
        Mat sharpened = new Mat();
        Core.addWeighted(rgb, SHARPEN_AMOUNT, blurred, 1.0 - SHARPEN_AMOUNT, 0, sharpened);
        return sharpened;
    }
}
