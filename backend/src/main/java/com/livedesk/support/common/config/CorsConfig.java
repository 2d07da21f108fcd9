package com.livedesk.support.common.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.ArrayList;
import java.util.List;

@Configuration
public class CorsConfig {

    private final List<String> allowedOrigins;

    public CorsConfig(@Value("${app.cors.allowed-origins:http://localhost:5173}") String allowedOriginsCsv) {
        this.allowedOrigins = parseCsv(allowedOriginsCsv);
    }

    /**
     * The customer widget and the agent dashboard are served from a separate dev server.
     */
    @Bean
    public FilterRegistrationBean<CorsFilter> apiCorsFilter() {
        var cfg = new CorsConfiguration();
        cfg.setAllowedOriginPatterns(allowedOrigins);
        cfg.setAllowedMethods(List.of("GET", "POST", "OPTIONS"));
        cfg.setAllowedHeaders(List.of("*"));
        cfg.setMaxAge(3600L);
        cfg.setAllowCredentials(false);

        var source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/api/**", cfg);

        var bean = new FilterRegistrationBean<>(new CorsFilter(source));
        bean.setOrder(Ordered.HIGHEST_PRECEDENCE);
        return bean;
    }

    private static List<String> parseCsv(String csv) {
        var out = new ArrayList<String>();
        if (csv != null && !csv.isBlank()) {
            for (var raw : csv.split(",")) {
                var t = raw == null ? "" : raw.trim();
                if (!t.isBlank()) out.add(t);
            }
        }
        if (out.isEmpty()) out.add("*");
        return List.copyOf(out);
    }
}
