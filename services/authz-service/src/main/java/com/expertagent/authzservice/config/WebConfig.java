package com.expertagent.authzservice.config;

import com.expertagent.authz.Authorizer;
import com.expertagent.authzservice.security.AuthorizationInterceptor;
import com.expertagent.observability.SpanHelper;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: CORS for local front-ends and the route authorization guard.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final Authorizer authorizer;
    private final SpanHelper spanHelper;
    private final AuthzServiceProperties properties;

    public WebConfig(Authorizer authorizer, SpanHelper spanHelper, AuthzServiceProperties properties) {
        this.authorizer = authorizer;
        this.spanHelper = spanHelper;
        this.properties = properties;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new AuthorizationInterceptor(authorizer, spanHelper, properties.environment()))
                .addPathPatterns("/api/**");
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        // Local front-end dev servers; production origins come from the edge.
        registry.addMapping("/api/**")
                .allowedOrigins("http://localhost:3000", "http://localhost:5173")
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*")
                .allowCredentials(true)
                .maxAge(3600);
    }
}
