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
import com.hellblazer.clifford.common.linear.Matrices;

import java.util.Objects;

/**
 * The top grade value of a dim dimensional space, held as (dim, signed value) rather than an explicit basis.
 * The implied basis is the standard one.
 *
 * @author hal.hildebrand
 */
public final class Pseudoscalar implements AbstractBlade {

    public static AbstractBlade of(int dim, double value) {
        return of(dim, value, Precision.DOUBLE);
    }

    /**
     * @return {@link Zero} if the value rounds to 0, the scalar canonical form when dim is 0, otherwise a
     *         Pseudoscalar
     * @throws IllegalArgumentException if dim is negative or the value is NaN
     */
    public static AbstractBlade of(int dim, double value, Precision precision) {
        Objects.requireNonNull(precision, "precision");
        if (dim < 0) {
            throw new IllegalArgumentException("Dimension must be non-negative: " + dim);
        }
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("Pseudoscalar value cannot be NaN");
        }
        if (dim == 0) {
            return Scalar.of(value, precision);
        }
        var rounded = precision.round(value);
        if (rounded == 0.0) {
            return Zero.of(precision);
        }
        return new Pseudoscalar(dim, rounded, precision);
    }

    private final int       dim;
    private final Precision precision;
    private final double    value;

    private Pseudoscalar(int dim, double value, Precision precision) {
        this.dim = dim;
        this.value = value;
        this.precision = precision;
    }

    @Override
    public double[][] basis() {
        return Matrices.identity(dim);
    }

    @Override
    public int dim() {
        return dim;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Pseudoscalar other)) {
            return false;
        }
        return dim == other.dim && precision == other.precision && Double.compare(value, other.value) == 0;
    }

    @Override
    public int grade() {
        return dim;
    }

    @Override
    public int hashCode() {
        return Objects.hash(dim, precision, value);
    }

    @Override
    public Kind kind() {
        return Kind.PSEUDOSCALAR;
    }

    @Override
    public Precision precision() {
        return precision;
    }

    @Override
    public String toString() {
        return String.format("Pseudoscalar [dim=%s, value=%s, precision=%s]", dim, value, precision);
    }

    public double value() {
        return value;
    }

    @Override
    public double volume() {
        return value;
    }
}
