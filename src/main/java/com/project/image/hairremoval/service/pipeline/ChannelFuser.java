package com.project.image.hairremoval.service.pipeline;

import org.opencv.core.Core;
import org.opencv.core.Mat;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Runs the enhancer on each colour plane and keeps the per-pixel maximum, so a strand that
 * shows up in one channel only is not lost. The planes are enhanced as independent parallel
 * tasks; max is commutative and associative, so completion order cannot change the result.
 */
public final class ChannelFuser {
    private static final String[] CHANNEL_NAMES = {"Red", "Green", "Blue"};

    private final ChannelEnhancer enhancer;
    private final boolean multiChannel;

    public ChannelFuser(ChannelEnhancer enhancer, boolean multiChannel) {
        this.enhancer = enhancer;
        this.multiChannel = multiChannel;
    }

    public Mat fuse(Mat rgb) {
        List<Mat> planes = new ArrayList<>(3);
        Core.split(rgb, planes);

        if (!multiChannel) {
            return enhancer.enhance(planes.get(0), CHANNEL_NAMES[0]);
        }

        List<Mat> maps = IntStream.range(0, planes.size())
                .parallel()
                .mapToObj(i -> enhancer.enhance(planes.get(i), CHANNEL_NAMES[i]))
                .collect(Collectors.toList());
        return maxOf(maps);
    }

    /** Per-pixel maximum of the given maps, in whatever order they come. */
    static Mat maxOf(List<Mat> maps) {
        return maps.stream()
                .reduce(ChannelFuser::max)
                .orElseThrow(() -> new IllegalArgumentException("No maps to fuse"));
    }

    private static Mat max(Mat a, Mat b) {
        Mat out = new Mat();
        Core.max(a, b, out);
        return out;
    }
}
