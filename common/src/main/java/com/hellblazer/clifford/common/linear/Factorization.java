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
package com.hellblazer.clifford.common.linear;

/**
 * Result of a thin QR factorization <code>A = Q R</code> of an n x k matrix.
 *
 * @param q        - the n x k matrix of orthonormal columns
 * @param diagonal - the k diagonal entries of the upper triangular factor R, with sign
 * @param rank     - the numerical rank of A
 * @author hal.hildebrand
 */
public record Factorization(double[][] q, double[] diagonal, int rank) {

    /**
     * @return the determinant of R, the signed k-volume spanned by the columns of A relative to the columns of Q
     */
    public double volume() {
        var product = 1.0;
        for (var d : diagonal) {
            product *= d;
        }
        return product;
    }

    public boolean isFullRank() {
        return rank == diagonal.length;
    }
}
