package com.project.image.hairremoval.exceptions;

/** Null, empty or malformed input raster. Aborts the whole run. */
public class InvalidImageException extends HairRemovalException {
    public InvalidImageException(String message) { super(message); }
}
