package org.theridian.configuration;

import org.theridian.models.enums.JobStatus;
import org.theridian.models.enums.MetricType;
import org.theridian.models.enums.SourceType;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.PathMatchConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins("*")
                .allowedMethods("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS");
        registry.addMapping("/auth/**")
                .allowedOrigins("*")
                .allowedMethods("POST", "OPTIONS");
    }

    // clients address collections both with and without the trailing slash
    @Override
    @SuppressWarnings("deprecation")
    public void configurePathMatch(PathMatchConfigurer configurer) {
        configurer.setUseTrailingSlashMatch(true);
    }

    // query parameters use the lowercase wire values, e.g. ?status=failed
    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, JobStatus.class, JobStatus::fromValue);
        registry.addConverter(String.class, SourceType.class, SourceType::fromValue);
        registry.addConverter(String.class, MetricType.class, MetricType::fromValue);
    }
}
