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

import java.util.List;

/**
 * A single homogeneous term: a scalar, a blade or a pseudoscalar
 *
 * @author hal.hildebrand
 */
public sealed interface AbstractBlade extends Multivector permits AbstractScalar, Blade, Pseudoscalar {

    /**
     * @return a copy of the orthonormal basis of the subspace, dim x grade
     */
    double[][] basis();

    @Override
    default List<AbstractBlade> blades() {
        return List.of(this);
    }

    int grade();

    @Override
    default List<Integer> grades() {
        return List.of(grade());
    }

    @Override
    default List<AbstractBlade> kVector(int k) {
        return k == grade() ? List.of(this) : List.of();
    }

    @Override
    default double norm() {
        return Math.abs(volume());
    }

    /**
     * @return the orientation of the receiver relative to its basis: 1, -1, or 0 for {@link Zero}
     */
    default int sign() {
        return (int) Math.signum(volume());
    }

    /**
     * @return the signed norm
     */
    double volume();
}
