package com.expertagent.authzservice;

import com.expertagent.authzservice.config.AuthzServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Authorization service: hosts the policy decision engine for the Expert Agent platform.
 *
 * <p>On start-up the policy document named by {@code expertagent.authz.policy-location} is loaded
 * and validated. An invalid document aborts start-up. Once running the service provides:
 *
 * <ul>
 *   <li>a decision endpoint other components call with an authorization request
 *   <li>a policy inventory endpoint for operators and internal services
 *   <li>an annotation-driven route guard ({@code @RequiresAuthorization}) for its own routes
 *   <li>actuator health, metrics and Prometheus endpoints
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(AuthzServiceProperties.class)
public class AuthzServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(AuthzServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AuthzServiceApplication.class, args);
        log.info("Authorization service started successfully");
    }
}
