package com.fisheye.vision;

import com.fisheye.vision.config.NativeLibraryLoader;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FisheyeVisionApplication {

    public static void main(String[] args) {
        // OpenCV 必须在任何 Bean 创建 Mat 之前加载
        NativeLibraryLoader.loadNativeLibraries();
        SpringApplication.run(FisheyeVisionApplication.class, args);
    }
}
