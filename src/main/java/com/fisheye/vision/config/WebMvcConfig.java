package com.fisheye.vision.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;

/**
 * Web MVC 配置
 * <p>
 * 本地存储根目录映射为静态资源，产物可直接通过 HTTP 查看：
 * - 存储地址：local://outputs/session1/frame_N.jpg
 * - 访问 URL：http://服务器地址/api/artifacts/outputs/session1/frame_N.jpg
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    @Autowired
    private YamlConfig config;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String root = Path.of(config.getStorage().getRoot()).toAbsolutePath().normalize().toUri().toString();
        registry.addResourceHandler("/api/artifacts/**")
                .addResourceLocations(root.endsWith("/") ? root : root + "/");
    }
}
