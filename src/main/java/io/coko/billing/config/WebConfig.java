package io.coko.billing.config;

import io.coko.billing.api.ApiRateLimitInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  private final ApiRateLimitInterceptor apiRateLimitInterceptor;

  public WebConfig(ApiRateLimitInterceptor apiRateLimitInterceptor) {
    this.apiRateLimitInterceptor = apiRateLimitInterceptor;
  }

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(apiRateLimitInterceptor)
      .addPathPatterns("/api/**")
      .excludePathPatterns("/api/webhooks/**");
  }
}
