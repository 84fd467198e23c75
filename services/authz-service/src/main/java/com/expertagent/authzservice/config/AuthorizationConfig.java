package com.expertagent.authzservice.config;

import com.expertagent.authz.Authorizer;
import com.expertagent.authz.PolicyEngine;
import com.expertagent.authz.PolicyStore;
import com.expertagent.authz.audit.AuthorizationMetrics;
import com.expertagent.authz.audit.DecisionAuditLogger;
import com.expertagent.authz.policy.PolicyDocument;
import com.expertagent.authz.policy.PolicyDocumentLoader;
import com.expertagent.observability.MetricFactory;
import com.expertagent.observability.SensitiveDataRedactor;
import com.expertagent.observability.SpanHelper;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import java.io.IOException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Wires the policy store, decision engine and {@link Authorizer} facade.
 *
 * <p>The store is loaded once, eagerly, while the context starts. A missing or invalid policy
 * document fails the start-up with every validation error in the message.
 */
@Configuration
public class AuthorizationConfig {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationConfig.class);

    @Bean
    public PolicyStore policyStore(
            AuthzServiceProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        return loadPolicyStore(properties.policyLocation(), resourceLoader, new PolicyDocumentLoader(objectMapper));
    }

    static PolicyStore loadPolicyStore(String location, ResourceLoader resourceLoader, PolicyDocumentLoader loader) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Policy document not found: " + location);
        }
        PolicyDocument document;
        try (InputStream in = resource.getInputStream()) {
            document = loader.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read policy document " + location, e);
        }
        log.info("Loading policy document location={} version={}", location, document.version());
        return PolicyStore.load(document);
    }

    @Bean
    public PolicyEngine policyEngine(PolicyStore policyStore) {
        return new PolicyEngine(policyStore);
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry meterRegistry, AuthzServiceProperties properties) {
        return new MetricFactory(meterRegistry, properties.serviceName());
    }

    @Bean
    public DecisionAuditLogger decisionAuditLogger(AuthzServiceProperties properties) {
        return new DecisionAuditLogger(properties.auditLogging(), new SensitiveDataRedactor());
    }

    @Bean
    public Authorizer authorizer(
            PolicyEngine policyEngine, DecisionAuditLogger auditLogger, MetricFactory metricFactory) {
        return new Authorizer(policyEngine, auditLogger, new AuthorizationMetrics(metricFactory));
    }

    /** No-op unless an SDK-backed {@link OpenTelemetry} bean is provided. */
    @Bean
    @ConditionalOnMissingBean
    public OpenTelemetry openTelemetry() {
        return OpenTelemetry.noop();
    }

    @Bean
    public SpanHelper spanHelper(OpenTelemetry openTelemetry, AuthzServiceProperties properties) {
        return new SpanHelper(openTelemetry.getTracer(properties.serviceName()));
    }
}
