package com.walkerbrain.portal.global.web;

import java.util.List;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final ViewContextArgumentResolver viewContextArgumentResolver;

    public WebConfig(ViewContextArgumentResolver viewContextArgumentResolver) {
        this.viewContextArgumentResolver = viewContextArgumentResolver;
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(viewContextArgumentResolver);
    }
}
