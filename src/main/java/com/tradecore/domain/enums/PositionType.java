package com.tradecore.domain.enums;

/**
 * Direction of a position, derived from the signed quantity.
 * Positive quantity = LONG, negative quantity = SHORT, zero = FLAT.
 */
public enum PositionType {
    LONG,
    SHORT,
    FLAT
}
