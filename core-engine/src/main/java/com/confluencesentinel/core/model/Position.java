package com.confluencesentinel.core.model;

import java.io.Serializable;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * A single open position inside a {@link PositionSnapshot}.
 *
 * <p>
 * Size is signed: positive for long, negative for short. All amounts are
 * fixed-point {@link BigDecimal}s as reported by the exchange; no field is
 * validated here because malformed data is detected by the snapshot validator
 * and must be reported rather than rejected at construction.
 * </p>
 *
 * @since 1.0.0
 */
public final class Position implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String instrumentId;
    private final BigDecimal size;
    private final BigDecimal notionalValue;
    private final BigDecimal entryPrice;

    /**
     * @param instrumentId  exchange instrument id (e.g. {@code ETH})
     * @param size          signed position size
     * @param notionalValue absolute notional value in quote currency
     * @param entryPrice    average entry price; may be {@code null}
     */
    public Position(String instrumentId, BigDecimal size, BigDecimal notionalValue, BigDecimal entryPrice) {
        this.instrumentId = instrumentId;
        this.size = size;
        this.notionalValue = notionalValue;
        this.entryPrice = entryPrice;
    }

    public String getInstrumentId() {
        return instrumentId;
    }

    public BigDecimal getSize() {
        return size;
    }

    public BigDecimal getNotionalValue() {
        return notionalValue;
    }

    public BigDecimal getEntryPrice() {
        return entryPrice;
    }

    /**
     * @return {@code true} if the size is exactly zero
     */
    public boolean isFlat() {
        return size != null && size.signum() == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Position that))
            return false;
        return Objects.equals(instrumentId, that.instrumentId)
                && compare(size, that.size)
                && compare(notionalValue, that.notionalValue)
                && compare(entryPrice, that.entryPrice);
    }

    @Override
    public int hashCode() {
        return Objects.hash(instrumentId,
                size == null ? null : size.stripTrailingZeros());
    }

    @Override
    public String toString() {
        return "Position{" + instrumentId + " size=" + size + " value=" + notionalValue + '}';
    }

    private static boolean compare(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.compareTo(b) == 0;
    }
}
