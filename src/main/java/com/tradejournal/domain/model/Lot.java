package com.tradejournal.domain.model;

import java.math.BigDecimal;
import lombok.Getter;
import lombok.ToString;

/**
 * An open quantity at a price, waiting for an offsetting fill.
 *
 * <p>The fee per unit and multiplier are those of the opening fill; they are applied
 * when the lot is later closed.
 */
@Getter
@ToString
public class Lot {

    private BigDecimal quantity;
    private final BigDecimal price;
    private final BigDecimal feePerUnit;
    private final BigDecimal multiplier;

    public Lot(BigDecimal quantity, BigDecimal price, BigDecimal feePerUnit, BigDecimal multiplier) {
        this.quantity = quantity;
        this.price = price;
        this.feePerUnit = feePerUnit;
        this.multiplier = multiplier;
    }

    /**
     * Removes up to {@code requested} units from this lot.
     *
     * @return the quantity actually taken
     */
    public BigDecimal take(BigDecimal requested) {
        BigDecimal matched = requested.min(quantity);
        quantity = quantity.subtract(matched);
        return matched;
    }

    public boolean isEmpty() {
        return quantity.signum() <= 0;
    }
}
