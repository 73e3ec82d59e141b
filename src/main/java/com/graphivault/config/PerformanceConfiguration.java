package com.graphivault.config;

import com.graphivault.infrastructure.crypto.GatewayResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

/**
 * Performance Monitoring Configuration.
 *
 * Tracks:
 * - Store operation latency per method
 * - Encryption gateway latency per outcome
 * - Vault business counters (ingests, duplicates, audit write failures)
 *
 * No hashes, paths or passwords are used as tags.
 */
@Configuration
@Slf4j
public class PerformanceConfiguration {

    /**
     * Aspect for timing store operations.
     */
    @Aspect
    @Component
    @Slf4j
    public static class StorePerformanceAspect {

        private final MeterRegistry meterRegistry;

        public StorePerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        /**
         * Time all JDBC-backed stores, the audit log included.
         */
        @Around("execution(* com.graphivault.infrastructure.persistence.Jdbc*.*(..))"
            + " || execution(* com.graphivault.infrastructure.audit.JdbcAuditLog.*(..))")
        public Object timeStoreMethod(ProceedingJoinPoint joinPoint) throws Throwable {
            String methodName = joinPoint.getSignature().toShortString();

            Timer.Sample sample = Timer.start(meterRegistry);

            try {
                Object result = joinPoint.proceed();

                sample.stop(Timer.builder("vault.store.operation")
                    .tag("method", methodName)
                    .tag("outcome", "success")
                    .description("Vault store operation timing")
                    .register(meterRegistry));

                return result;

            } catch (Exception e) {
                sample.stop(Timer.builder("vault.store.operation")
                    .tag("method", methodName)
                    .tag("outcome", "failure")
                    .description("Vault store operation timing")
                    .register(meterRegistry));

                throw e;
            }
        }
    }

    /**
     * Aspect for timing encryption gateway calls.
     */
    @Aspect
    @Component
    @Slf4j
    public static class GatewayPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public GatewayPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.graphivault.infrastructure.crypto.EncryptionGateway+.execute(..))")
        public Object timeGatewayCall(ProceedingJoinPoint joinPoint) throws Throwable {
            Timer.Sample sample = Timer.start(meterRegistry);
            String outcome = "exception";
            try {
                Object result = joinPoint.proceed();
                if (result instanceof GatewayResult gatewayResult) {
                    outcome = gatewayResult.getOutcome().name().toLowerCase();
                }
                return result;
            } finally {
                sample.stop(Timer.builder("vault.gateway.call")
                    .tag("outcome", outcome)
                    .description("Encryption gateway call timing")
                    .register(meterRegistry));
            }
        }
    }

    /**
     * Custom metrics for vault operations.
     */
    @Component
    @Slf4j
    public static class VaultMetrics {

        private final MeterRegistry meterRegistry;

        public VaultMetrics(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            log.info("Initialized vault metrics");
        }

        /**
         * Record a catalogued asset.
         */
        public void recordAssetAdded() {
            meterRegistry.counter("vault.assets.added").increment();
        }

        /**
         * Record an ingest or insert refused because the content is already catalogued.
         */
        public void recordDuplicateRejected() {
            meterRegistry.counter("vault.assets.duplicates").increment();
        }

        public void recordAssetRemoved(String mode) {
            meterRegistry.counter("vault.assets.removed", "mode", mode).increment();
        }

        /**
         * Record an audit event that did not reach the log.
         */
        public void recordAuditWriteFailure(String eventType) {
            meterRegistry.counter("vault.audit.write_failures", "event_type", eventType).increment();
        }
    }
}
