package com.o2o.analytics.domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reduction applied to the per-record values of a measure.
 *
 * Null values are skipped by every reducer. Reducers over no values yield 0.
 */
public enum Reducer {

    SUM {
        @Override
        public double reduce(List<Object> values) {
            double sum = 0.0;
            for (Object v : values) {
                if (v != null) {
                    sum += toDouble(v);
                }
            }
            return sum;
        }
    },

    COUNT {
        @Override
        public double reduce(List<Object> values) {
            return values.stream().filter(v -> v != null).count();
        }
    },

    COUNT_DISTINCT {
        @Override
        public double reduce(List<Object> values) {
            Set<Object> distinct = new HashSet<>();
            for (Object v : values) {
                if (v != null) {
                    distinct.add(v instanceof Number ? (Object) toDouble(v) : v);
                }
            }
            return distinct.size();
        }
    },

    AVG {
        @Override
        public double reduce(List<Object> values) {
            double sum = 0.0;
            int n = 0;
            for (Object v : values) {
                if (v != null) {
                    sum += toDouble(v);
                    n++;
                }
            }
            return n == 0 ? 0.0 : sum / n;
        }
    },

    MIN {
        @Override
        public double reduce(List<Object> values) {
            Double min = null;
            for (Object v : values) {
                if (v != null) {
                    double d = toDouble(v);
                    min = min == null ? d : Math.min(min, d);
                }
            }
            return min == null ? 0.0 : min;
        }
    },

    MAX {
        @Override
        public double reduce(List<Object> values) {
            Double max = null;
            for (Object v : values) {
                if (v != null) {
                    double d = toDouble(v);
                    max = max == null ? d : Math.max(max, d);
                }
            }
            return max == null ? 0.0 : max;
        }
    },

    FIRST {
        @Override
        public double reduce(List<Object> values) {
            for (Object v : values) {
                if (v != null) {
                    return toDouble(v);
                }
            }
            return 0.0;
        }
    };

    public abstract double reduce(List<Object> values);

    public static double toDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1.0 : 0.0;
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble((String) value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not a numeric value: " + value, e);
            }
        }
        throw new IllegalArgumentException("Not a numeric value: " + value);
    }
}
