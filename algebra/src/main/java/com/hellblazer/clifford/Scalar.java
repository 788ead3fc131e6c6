/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.clifford;

import com.hellblazer.clifford.common.Precision;

import java.util.Objects;

/**
 * A grade 0 value. The value is never 0 or 1: {@link #of(double, Precision)} answers {@link Zero} and
 * {@link One} for those.
 *
 * @author hal.hildebrand
 */
public final class Scalar implements AbstractScalar {

    public static AbstractScalar of(double value) {
        return of(value, Precision.DOUBLE);
    }

    /**
     * @param value     - the value, infinities are allowed
     * @param precision - the precision to round the value to
     * @return {@link Zero}, {@link One} or a Scalar
     * @throws IllegalArgumentException if the value is NaN
     */
    public static AbstractScalar of(double value, Precision precision) {
        Objects.requireNonNull(precision, "precision");
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("Scalar value cannot be NaN");
        }
        var rounded = precision.round(value);
        if (rounded == 0.0) {
            return Zero.of(precision);
        }
        if (rounded == 1.0) {
            return One.of(precision);
        }
        return new Scalar(rounded, precision);
    }

    private final Precision precision;
    private final double    value;

    private Scalar(double value, Precision precision) {
        this.value = value;
        this.precision = precision;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Scalar other)) {
            return false;
        }
        return precision == other.precision && Double.compare(value, other.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(precision, value);
    }

    @Override
    public Kind kind() {
        return Kind.SCALAR;
    }

    @Override
    public Precision precision() {
        return precision;
    }

    @Override
    public String toString() {
        return String.format("Scalar [value=%s, precision=%s]", value, precision);
    }

    @Override
    public double value() {
        return value;
    }
}
