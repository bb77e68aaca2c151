package com.backtestplatform.common.ledger;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Mutable per-ticker holding inside a {@link Portfolio}.
 *
 * <p>Long and short legs are tracked independently; both may be open at once.
 * Cost bases are weighted averages over the currently held quantity and reset to
 * zero when a leg goes flat.
 */
@Data
@NoArgsConstructor
public class Position {

    private long longQuantity;

    private long shortQuantity;

    private double longCostBasis;

    private double shortCostBasis;

    /** Margin reserved against the open short leg. */
    private double shortMarginUsed;

    public Position copy() {
        Position p = new Position();
        p.setLongQuantity(longQuantity);
        p.setShortQuantity(shortQuantity);
        p.setLongCostBasis(longCostBasis);
        p.setShortCostBasis(shortCostBasis);
        p.setShortMarginUsed(shortMarginUsed);
        return p;
    }

    /** Signed market value: long legs add, short legs subtract. */
    public double marketValue(double price) {
        return (longQuantity - shortQuantity) * price;
    }

    public double grossExposure(double price) {
        return (longQuantity + shortQuantity) * price;
    }

    public boolean isFlat() {
        return longQuantity == 0 && shortQuantity == 0;
    }

    public PositionSnapshot snapshot() {
        return new PositionSnapshot(longQuantity, shortQuantity, longCostBasis, shortCostBasis, shortMarginUsed);
    }
}
