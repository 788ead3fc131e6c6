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

/**
 * The closed set of algebra value variants. Operators dispatch on the pair of kinds of their operands.
 *
 * @author hal.hildebrand
 */
public enum Kind {
    /** The additive identity */
    ZERO,
    /** The multiplicative identity */
    ONE,
    /** A grade 0 value other than 0 and 1 */
    SCALAR,
    /** An oriented subspace of grade 0 &lt; k &lt; dim */
    BLADE,
    /** A top grade (grade == dim) value */
    PSEUDOSCALAR,
    /** A sum of at least two terms */
    MULTIVECTOR;

    public boolean isScalar() {
        return this == ZERO || this == ONE || this == SCALAR;
    }
}
