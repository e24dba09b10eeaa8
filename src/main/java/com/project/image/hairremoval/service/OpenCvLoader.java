package com.project.image.hairremoval.service;

import com.project.image.hairremoval.exceptions.HairRemovalException;
import org.opencv.core.Core;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class OpenCvLoader {
    private static final Logger log = LoggerFactory.getLogger(OpenCvLoader.class);

    private static volatile boolean loaded;

    private OpenCvLoader() {}

    public static void ensureLoaded() {
        if (loaded) return;
        synchronized (OpenCvLoader.class) {
            if (loaded) return;
            try {
                nu.pattern.OpenCV.loadLocally();
            } catch (RuntimeException | UnsatisfiedLinkError e) {
                log.error("Failed to load OpenCV", e);
                throw new HairRemovalException("OpenCV native library could not be loaded", e);
            }
            loaded = true;
            log.info("OpenCV {} loaded successfully", Core.VERSION);
        }
    }
}
