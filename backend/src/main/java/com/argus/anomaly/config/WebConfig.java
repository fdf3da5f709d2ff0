package com.argus.anomaly.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    /** Servlet async timeout meaning "none". */
    static final long NO_ASYNC_TIMEOUT = -1L;

    private final DetectionProperties properties;

    @Override
    public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
        // An upload answers only after its job is cleaned up; the worker watchdog bounds how long that takes
        configurer.setDefaultTimeout(NO_ASYNC_TIMEOUT);
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String prefix = properties.getStorage().getFrameUrlPrefix();
        String location = properties.getStorage().getFrameDir().toAbsolutePath().toUri().toString();
        registry.addResourceHandler(prefix + "**")
                .addResourceLocations(location.endsWith("/") ? location : location + "/");
    }
}
