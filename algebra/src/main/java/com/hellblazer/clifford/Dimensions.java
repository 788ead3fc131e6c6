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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dimension agreement between operands. Scalar-like values carry no dimension and agree with everything.
 *
 * @author hal.hildebrand
 */
final class Dimensions {
    private static final Logger log = LoggerFactory.getLogger(Dimensions.class);

    static void assertEqual(Multivector x, int dim) {
        if (hasDimension(x) && x.dim() != dim) {
            log.debug("Dimension mismatch: {} against {}", x, dim);
            throw new DimensionMismatchException(x.dim(), dim);
        }
    }

    static void assertEqual(Multivector x, Multivector y) {
        if (hasDimension(x) && hasDimension(y) && x.dim() != y.dim()) {
            log.debug("Dimension mismatch: {} against {}", x, y);
            throw new DimensionMismatchException(x.dim(), y.dim());
        }
    }

    static boolean hasDimension(Multivector x) {
        return !x.kind().isScalar();
    }

    private Dimensions() {
    }
}
