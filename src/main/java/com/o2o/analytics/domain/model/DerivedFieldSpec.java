package com.o2o.analytics.domain.model;

import lombok.Value;

/**
 * Field computed from reduced measures (and earlier derived fields).
 */
@Value
public class DerivedFieldSpec {

    String name;
    String formula;
}
