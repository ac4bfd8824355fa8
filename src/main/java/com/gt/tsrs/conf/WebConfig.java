package com.gt.tsrs.conf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.Arrays;
import java.util.List;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private static final Logger log = LoggerFactory.getLogger(WebConfig.class);

    static final String TOPIC_API_PATTERN = "/rest/topic/**";

    private final List<String> allowedOrigins;

    @Autowired
    public WebConfig(@Value("${tsrs.cors.allowedOrigins:}") String allowedOrigins) {
        this.allowedOrigins = Arrays.stream(allowedOrigins.split(","))
                .map(String::trim)
                .filter(origin -> !origin.isEmpty())
                .toList();
    }

    // The topic API only reads with GET and changes state with POST
    @Override
    public void addCorsMappings(CorsRegistry registry) {
        if (allowedOrigins.isEmpty()) {
            log.debug("No CORS origins configured for the topic API");
            return;
        }

        log.info("Allowing cross-origin topic API calls from {}", allowedOrigins);
        registry.addMapping(TOPIC_API_PATTERN)
                .allowedOrigins(allowedOrigins.toArray(String[]::new))
                .allowedMethods("GET", "POST");
    }

    List<String> getAllowedOrigins() {
        return allowedOrigins;
    }
}
