package com.comanda.orderengine.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.math.BigDecimal;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings of the order engine, bound from {@code comanda.order-engine.*}:
 *
 * <pre>
 * comanda:
 *   order-engine:
 *     name: order-engine
 *     currency: USD
 *     tax-rate: 0.19
 *     location-tax-rates:
 *       LOC2: 0.07
 *     projection-mode: QUEUED
 *     snapshot-interval: 50
 *     missing-item-policy: SKIP
 * </pre>
 *
 * @param name service name used for logging, metrics and event metadata. Required.
 * @param environment deployment environment (development, staging, production)
 * @param currency ISO currency code of new orders
 * @param taxRate default tax rate as a fraction
 * @param locationTaxRates per-location overrides of {@code taxRate}
 * @param projectionMode how events reach the read models
 * @param snapshotInterval events between snapshots; 0 disables snapshots
 * @param missingItemPolicy how conversion treats items missing from the catalog
 * @param maxProjectionBacklog queued events above which projections report degraded health
 */
@ConfigurationProperties(prefix = "comanda.order-engine")
@Validated
public record OrderEngineProperties(
        @NotBlank String name,
        String environment,
        String currency,
        @DecimalMin("0.0") BigDecimal taxRate,
        Map<String, BigDecimal> locationTaxRates,
        ProjectionMode projectionMode,
        @Min(0) Integer snapshotInterval,
        MissingItemPolicy missingItemPolicy,
        @Min(1) Integer maxProjectionBacklog) {

    /** Applies defaults before Bean Validation runs. */
    public OrderEngineProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (currency == null || currency.isBlank()) {
            currency = "USD";
        }
        if (taxRate == null) {
            taxRate = new BigDecimal("0.19");
        }
        locationTaxRates = locationTaxRates == null ? Map.of() : Map.copyOf(locationTaxRates);
        if (projectionMode == null) {
            projectionMode = ProjectionMode.SYNCHRONOUS;
        }
        if (snapshotInterval == null) {
            snapshotInterval = 50;
        }
        if (missingItemPolicy == null) {
            missingItemPolicy = MissingItemPolicy.SKIP;
        }
        if (maxProjectionBacklog == null) {
            maxProjectionBacklog = 1000;
        }
    }

    /** Defaults for everything except the name. */
    public static OrderEngineProperties withDefaults(String name) {
        return new OrderEngineProperties(name, null, null, null, null, null, null, null, null);
    }

    public OrderEngineProperties withMissingItemPolicy(MissingItemPolicy policy) {
        return new OrderEngineProperties(
                name,
                environment,
                currency,
                taxRate,
                locationTaxRates,
                projectionMode,
                snapshotInterval,
                policy,
                maxProjectionBacklog);
    }

    public OrderEngineProperties withSnapshotInterval(int interval) {
        return new OrderEngineProperties(
                name,
                environment,
                currency,
                taxRate,
                locationTaxRates,
                projectionMode,
                interval,
                missingItemPolicy,
                maxProjectionBacklog);
    }
}
