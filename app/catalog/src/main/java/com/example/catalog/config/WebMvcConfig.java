/*
 * Where: catalog Web configuration
 * What: applies RequestMdcInterceptor and serves stored listing images
 * Why: catalog pages and upload prompts link to images under the public upload prefix
 */
package com.example.catalog.config;

import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@EnableConfigurationProperties(AssetStorageProperties.class)
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;
  private final AssetStorageProperties assetStorageProperties;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor);
  }

  @Override
  public void addResourceHandlers(ResourceHandlerRegistry registry) {
    final String location =
        Path.of(assetStorageProperties.uploadDir()).toAbsolutePath().toUri().toString();
    registry
        .addResourceHandler(assetStorageProperties.publicUrlPrefix() + "/**")
        .addResourceLocations(location.endsWith("/") ? location : location + "/");
  }
}
