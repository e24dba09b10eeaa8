package com.project.image.hairremoval.exceptions;

import org.opencv.core.Size;

/** Mask and image handed between stages disagree in size. */
public class DimensionMismatchException extends HairRemovalException {
    public DimensionMismatchException(String what, Size expected, Size actual) {
        super(what + " size " + (int) actual.width + "x" + (int) actual.height
                + " does not match image size " + (int) expected.width + "x" + (int) expected.height);
    }
}
