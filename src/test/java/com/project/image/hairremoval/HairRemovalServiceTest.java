package com.project.image.hairremoval;

import com.project.image.hairremoval.DTOs.HairRemovalOptions;
import com.project.image.hairremoval.DTOs.HairRemovalResult;
import com.project.image.hairremoval.DTOs.InpaintingMode;
import com.project.image.hairremoval.DTOs.ThresholdMode;
import com.project.image.hairremoval.exceptions.InvalidImageException;
import com.project.image.hairremoval.service.HairRemovalService;
import com.project.image.hairremoval.service.pipeline.PipelineCheckpoint;
import org.junit.jupiter.api.Test;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.project.image.hairremoval.TestImages.bytes;
import static com.project.image.hairremoval.TestImages.onlyZeroOr255;
import static com.project.image.hairremoval.TestImages.value;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HairRemovalServiceTest {
    private final HairRemovalService service = new HairRemovalService(HairRemovalOptions.defaults());
    private final HairRemovalOptions small = HairRemovalOptions.defaults().withWorkingSize(256, 256);

    @Test
    void allWhiteImage_hasNoHairAndIsReturnedUnchanged() {
        Mat white = TestImages.uniform(720, 720, TestImages.WHITE);

        HairRemovalResult result = service.removeHairs(white);

        assertThat(result.stats().initialHairCoverage()).isZero();
        assertThat(result.stats().finalHairCoverage()).isZero();
        assertThat(result.stats().finalHairPixels()).isZero();
        assertThat(result.stats().psnr()).isInfinite();
        assertThat(bytes(result.hairFree())).isEqualTo(bytes(white));
        assertThat(Core.countNonZero(result.mask())).isZero();
    }

    @Test
    void darkLine_survivesCleaningWhileIsolatedPixelDoesNot() {
        Mat img = TestImages.whiteWithDiagonal(720, 3);
        img.put(100, 600, 0, 0, 0);

        HairRemovalResult result = service.removeHairs(img);

        assertThat(result.stats().initialHairCoverage()).isPositive();
        assertThat(value(result.mask(), 360, 360)).isEqualTo(255);
        assertThat(value(result.mask(), 100, 600)).isZero();
        assertThat(result.stats().finalHairCoverage())
                .isPositive()
                .isLessThanOrEqualTo(result.stats().initialHairCoverage());
        assertThat(result.stats().psnr()).isFinite().isGreaterThanOrEqualTo(0);
        assertEveryComponentHasAtLeast(result.mask(), 10);
    }

    @Test
    void onePixelLine_isPickedUpByThresholding() {
        Mat img = TestImages.whiteWithDiagonal(720, 1);

        HairRemovalResult result = service.removeHairs(img);

        assertThat(result.stats().initialHairCoverage()).isPositive();
        assertThat(result.stats().finalHairCoverage()).isLessThanOrEqualTo(result.stats().initialHairCoverage());
        assertThat(onlyZeroOr255(result.mask())).isTrue();
    }

    @Test
    void repeatedRuns_areBitIdentical() {
        Mat img = TestImages.hairySkin(300, 240);

        HairRemovalResult first = service.removeHairs(img, small, null);
        HairRemovalResult second = service.removeHairs(img, small, null);

        assertThat(bytes(second.hairFree())).isEqualTo(bytes(first.hairFree()));
        assertThat(bytes(second.mask())).isEqualTo(bytes(first.mask()));
        assertThat(second.stats()).isEqualTo(first.stats());
    }

    @Test
    void hairySkin_producesBinaryMaskWithinCandidateCoverage() {
        Mat img = TestImages.hairySkin(256, 256);

        HairRemovalResult result = service.removeHairs(img, small, null);

        assertThat(result.hairFree().size()).isEqualTo(new Size(256, 256));
        assertThat(result.hairFree().type()).isEqualTo(CvType.CV_8UC3);
        assertThat(result.mask().size()).isEqualTo(new Size(256, 256));
        assertThat(onlyZeroOr255(result.mask())).isTrue();
        assertThat(result.stats().finalHairPixels()).isPositive();
        assertThat(result.stats().finalHairCoverage()).isLessThanOrEqualTo(result.stats().initialHairCoverage());
        assertThat(result.stats().threshold()).isBetween(0.0, 255.0);
        assertEveryComponentHasAtLeast(result.mask(), 10);
    }

    @Test
    void arbitraryInputSize_isResizedToWorkingSize() {
        Mat img = TestImages.hairySkin(333, 121);

        HairRemovalResult result = service.removeHairs(img);

        assertThat(result.hairFree().size()).isEqualTo(new Size(720, 720));
        assertThat(result.mask().size()).isEqualTo(new Size(720, 720));
    }

    @Test
    void alternativeModes_allProduceValidOutput() {
        Mat img = TestImages.hairySkin(256, 256);
        List<HairRemovalOptions> variants = List.of(
                small.withThresholdMode(ThresholdMode.ADAPTIVE),
                small.withMultiChannel(false),
                small.withInpaintingMode(InpaintingMode.SINGLE_FAST),
                small.withPreserveDetails(false));

        for (HairRemovalOptions options : variants) {
            HairRemovalResult result = service.removeHairs(img, options, null);
            assertThat(onlyZeroOr255(result.mask())).as(options.toString()).isTrue();
            assertThat(result.stats().finalHairCoverage()).as(options.toString())
                    .isLessThanOrEqualTo(result.stats().initialHairCoverage());
        }
    }

    @Test
    void progressListener_seesEveryCheckpointInOrder() {
        List<PipelineCheckpoint> seen = new ArrayList<>();

        service.removeHairs(TestImages.hairySkin(200, 200), small, seen::add);

        assertThat(seen).containsExactlyElementsOf(Arrays.asList(PipelineCheckpoint.values()));
    }

    @Test
    void failingProgressListener_doesNotChangeTheResult() {
        Mat img = TestImages.hairySkin(200, 200);

        HairRemovalResult quiet = service.removeHairs(img, small, null);
        HairRemovalResult noisy = service.removeHairs(img, small, checkpoint -> {
            throw new IllegalStateException("listener down");
        });

        assertThat(bytes(noisy.hairFree())).isEqualTo(bytes(quiet.hairFree()));
        assertThat(noisy.stats()).isEqualTo(quiet.stats());
    }

    @Test
    void invalidInputs_areRejected() {
        assertThatThrownBy(() -> service.removeHairs((Mat) null))
                .isInstanceOf(InvalidImageException.class);
        assertThatThrownBy(() -> service.removeHairs(new Mat()))
                .isInstanceOf(InvalidImageException.class);
        assertThatThrownBy(() -> service.removeHairs(new Mat(50, 50, CvType.CV_8UC1, new Scalar(10))))
                .isInstanceOf(InvalidImageException.class)
                .hasMessageContaining("RGB");
    }

    private static void assertEveryComponentHasAtLeast(Mat mask, int area) {
        Mat labels = new Mat();
        Mat stats = new Mat();
        Mat centroids = new Mat();
        int count = Imgproc.connectedComponentsWithStats(mask, labels, stats, centroids, 8, CvType.CV_32S);
        for (int label = 1; label < count; label++) {
            assertThat(stats.get(label, Imgproc.CC_STAT_AREA)[0]).isGreaterThanOrEqualTo(area);
        }
    }
}
