package com.o2o.analytics.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * One reduced measure of a definition.
 *
 * {@code source} is evaluated against each record. Order-level measures are
 * reduced inside every order first and the per-order results are summed, which
 * keeps fees repeated on each line of an order from being counted twice.
 */
@Value
@Builder
public class MeasureSpec {

    String name;
    String source;
    Reducer reducer;
    boolean orderLevel;
}
