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

package com.hellblazer.clifford.common;

/**
 * The floating point precision an algebra value is expressed in. Values are always held in
 * <code>double</code> fields; {@link #round(double)} narrows them to the precision on construction.
 *
 * @author hal.hildebrand
 */
public enum Precision {
    SINGLE(Math.ulp(1.0f)) {
        @Override
        public double round(double value) {
            return (float) value;
        }
    },
    DOUBLE(Math.ulp(1.0)) {
        @Override
        public double round(double value) {
            return value;
        }
    };

    /**
     * @return the wider of the two precisions, the precision that binary operations resolve to
     */
    public static Precision widest(Precision a, Precision b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    /**
     * @return the narrower of the two precisions
     */
    public static Precision narrowest(Precision a, Precision b) {
        return a.ordinal() <= b.ordinal() ? a : b;
    }

    private final double epsilon;

    Precision(double epsilon) {
        this.epsilon = epsilon;
    }

    /**
     * Default absolute threshold below which a spanning set is considered to have zero volume
     */
    public double bladeAtol() {
        return 100 * epsilon;
    }

    /**
     * Default relative tolerance for approximate comparison
     */
    public double defaultRtol() {
        return Math.sqrt(epsilon);
    }

    /**
     * @return the machine epsilon of the precision
     */
    public double epsilon() {
        return epsilon;
    }

    /**
     * Round the value to the receiver's precision
     */
    public abstract double round(double value);

    /**
     * Round every element of the matrix, in place
     *
     * @return the supplied matrix
     */
    public double[][] round(double[][] matrix) {
        if (this == DOUBLE) {
            return matrix;
        }
        for (var row : matrix) {
            for (int j = 0; j < row.length; j++) {
                row[j] = round(row[j]);
            }
        }
        return matrix;
    }
}
