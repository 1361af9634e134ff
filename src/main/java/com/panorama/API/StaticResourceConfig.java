package com.panorama.API;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Paths;

@Configuration
public class StaticResourceConfig implements WebMvcConfigurer {
    private final StitchingProperties properties;

    public StaticResourceConfig(StitchingProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        // panoramas written by StitchingService are served from the output directory
        registry.addResourceHandler("/stitch/**")
                .addResourceLocations(Paths.get(properties.getOutputDir()).toAbsolutePath().toUri().toString());
    }
}
