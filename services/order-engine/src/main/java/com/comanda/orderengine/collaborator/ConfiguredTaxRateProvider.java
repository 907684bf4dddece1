package com.comanda.orderengine.collaborator;

import java.math.BigDecimal;
import java.util.Map;

/** Per-location rates from configuration, falling back to the default rate. */
public class ConfiguredTaxRateProvider implements TaxRateProvider {

    private final BigDecimal defaultRate;
    private final Map<String, BigDecimal> locationRates;

    public ConfiguredTaxRateProvider(BigDecimal defaultRate, Map<String, BigDecimal> locationRates) {
        this.defaultRate = defaultRate;
        this.locationRates = Map.copyOf(locationRates);
    }

    @Override
    public BigDecimal taxRate(String locationId) {
        if (locationId == null) {
            return defaultRate;
        }
        return locationRates.getOrDefault(locationId, defaultRate);
    }
}
