package com.comanda.orderengine.collaborator;

import java.math.BigDecimal;

public interface TaxRateProvider {

    /** Tax rate as a fraction, e.g. {@code 0.19}. */
    BigDecimal taxRate(String locationId);
}
