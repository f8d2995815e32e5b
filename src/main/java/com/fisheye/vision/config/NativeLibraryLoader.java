package com.fisheye.vision.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Native Library Loader
 * 负责加载 OpenCV JNI 库，必须在创建任何 Mat 之前调用
 */
public class NativeLibraryLoader {

    private static final Logger logger = LoggerFactory.getLogger(NativeLibraryLoader.class);

    private static boolean loaded = false;

    private NativeLibraryLoader() {
    }

    public static synchronized void loadNativeLibraries() {
        if (loaded) {
            return;
        }
        try {
            // openpnp 将平台库解压到临时目录后加载，JDK 17 下不再支持 loadShared
            nu.pattern.OpenCV.loadLocally();
            logger.info("OpenCV loaded successfully via openpnp");
        } catch (UnsatisfiedLinkError e) {
            logger.error("Failed to load OpenCV library", e);
            throw new IllegalStateException("OpenCV native library not available", e);
        }
        loaded = true;
    }

    public static synchronized boolean isLoaded() {
        return loaded;
    }
}
