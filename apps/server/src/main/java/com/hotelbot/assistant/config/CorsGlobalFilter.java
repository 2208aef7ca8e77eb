package com.hotelbot.assistant.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.Arrays;

@Configuration
public class CorsGlobalFilter {
    @Bean
    public FilterRegistrationBean<CorsFilter> corsFilterRegistration(
            @Value("${cors.allowedOrigins:*}") String allowedOrigins) {
        CorsConfiguration config = new CorsConfiguration();
        // browser chat widget: no cookies, bearer tokens only
        config.setAllowCredentials(false);
        Arrays.stream(allowedOrigins.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(config::addAllowedOriginPattern);
        config.addAllowedHeader("*");
        config.addAllowedMethod("*");
        config.addExposedHeader(RequestLoggingFilter.HEADER_TRACE_ID);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", config);

        FilterRegistrationBean<CorsFilter> bean = new FilterRegistrationBean<>(new CorsFilter(source));
        bean.setOrder(Ordered.HIGHEST_PRECEDENCE); // answer preflight before security
        return bean;
    }
}
