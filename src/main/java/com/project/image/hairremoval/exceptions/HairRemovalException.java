package com.project.image.hairremoval.exceptions;

public class HairRemovalException extends RuntimeException {
    public HairRemovalException(String message) { super(message); }
    public HairRemovalException(String message, Throwable cause) { super(message, cause); }
}
