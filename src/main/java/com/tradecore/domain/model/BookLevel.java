package com.tradecore.domain.model;

import lombok.Value;

/** A single price level in the order book depth (bid or ask). */
@Value(staticConstructor = "of")
public class BookLevel {

    double price;

    /** Total quantity resting at this price level. */
    double quantity;
}
