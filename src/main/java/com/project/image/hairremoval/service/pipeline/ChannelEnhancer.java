package com.project.image.hairremoval.service.pipeline;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns one colour channel into a hairness map:
 * <ol>
 *   <li>black top-hat (closing minus channel) with an elliptical element of the given radius,
 *       which recovers exactly the thin dark structures the closing fills in;</li>
 *   <li>brightening, {@code v + (255 - v) * factor}, truncated to 8 bits;</li>
 *   <li>flat-field correction: divide by a Gaussian estimate of the illumination and rescale
 *       by that field's global mean.</li>
 * </ol>
 * Instances hold no mutable state and may enhance several channels concurrently.
 */
public final class ChannelEnhancer {
    private static final Logger log = LoggerFactory.getLogger(ChannelEnhancer.class);

    private static final double EPSILON = 1e-6;
    private static final int TOPHAT_RESPONSE_FLOOR = 5;

    private final Mat kernel;
    private final double brighteningFactor;
    private final double ffcSigma;

    public ChannelEnhancer(int topHatRadius, double brighteningFactor, double ffcSigma) {
        int diameter = 2 * topHatRadius + 1;
        this.kernel = Imgproc.getStructuringElement(Imgproc.MORPH_ELLIPSE, new Size(diameter, diameter));
        this.brighteningFactor = brighteningFactor;
        this.ffcSigma = ffcSigma;
    }

    public Mat enhance(Mat channel, String channelName) {
        Mat topHat = blackTopHat(channel);
        if (log.isDebugEnabled()) {
            Mat strong = new Mat();
            Imgproc.threshold(topHat, strong, TOPHAT_RESPONSE_FLOOR, 255, Imgproc.THRESH_BINARY);
            log.debug("{} channel: top-hat coverage (>{}) {}%", channelName, TOPHAT_RESPONSE_FLOOR,
                    String.format("%.2f", 100.0 * Core.countNonZero(strong) / topHat.total()));
        }

        Mat brightened = brighten(topHat);
        Mat corrected = flatFieldCorrect(brightened);
        if (log.isDebugEnabled()) {
            log.debug("{} channel: FFC mean intensity {}", channelName,
                    String.format("%.2f", Core.mean(corrected).val[0]));
        }
        return corrected;
    }

    Mat blackTopHat(Mat channel) {
        Mat closed = new Mat();
        Imgproc.morphologyEx(channel, closed, Imgproc.MORPH_CLOSE, kernel);
        Mat topHat = new Mat();
        // saturating, so the difference is clamped at 0
        Core.subtract(closed, channel, topHat);
        return topHat;
    }

    Mat brighten(Mat topHat) {
        return Quantizer.truncate(topHat, CvType.CV_8U, 1.0 - brighteningFactor, 255.0 * brighteningFactor);
    }

    Mat flatFieldCorrect(Mat brightened) {
        Mat signal = new Mat();
        brightened.convertTo(signal, CvType.CV_32F);

        Mat illumination = new Mat();
        Imgproc.GaussianBlur(signal, illumination, new Size(0, 0), ffcSigma);
        double meanIllumination = Core.mean(illumination).val[0];
        Core.add(illumination, new Scalar(EPSILON), illumination);

        Mat ratio = new Mat();
        Core.divide(signal, illumination, ratio, meanIllumination);

        return Quantizer.truncate(ratio, CvType.CV_8U);
    }
}
