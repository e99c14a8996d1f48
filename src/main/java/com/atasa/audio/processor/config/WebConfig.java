package com.atasa.audio.processor.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS setup for browser clients.
 *
 * <p>Any origin may call the API; there are no cookies or sessions. The download header is exposed
 * so the browser can read the suggested file name.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    registry
        .addMapping("/**")
        .allowedOriginPatterns("*")
        .allowedMethods("GET", "POST", "OPTIONS")
        .allowedHeaders("*")
        .exposedHeaders("Content-Disposition", "Content-Length")
        .allowCredentials(false);
  }
}
