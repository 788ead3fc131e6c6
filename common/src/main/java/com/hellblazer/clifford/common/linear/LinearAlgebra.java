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
 * The dense linear algebra primitives the geometric algebra consumes. Matrices are row major
 * <code>double[rows][columns]</code>; a set of k vectors in an n dimensional space is the n x k matrix whose
 * columns are the vectors.
 *
 * @author hal.hildebrand
 */
public interface LinearAlgebra {

    /**
     * The shared, stateless default implementation
     */
    LinearAlgebra DEFAULT = new CommonsMathLinearAlgebra();

    /**
     * @param square - an n x n matrix, n &gt; 0
     * @return the determinant of the matrix
     */
    double determinant(double[][] square);

    /**
     * @return the Euclidean norm of the vector, computed without intermediate overflow or underflow
     */
    double norm(double[] vector);

    /**
     * Extend an orthonormal set of k column vectors to an orthonormal basis of the whole space and answer the
     * columns that were added.
     *
     * @param orthonormal - n x k matrix with orthonormal columns, 0 &lt; k &lt; n
     * @return the n x (n - k) matrix whose columns span the orthogonal complement
     */
    double[][] orthogonalComplement(double[][] orthonormal);

    /**
     * Thin QR factorization of an n x k matrix, k &lt;= n.
     */
    Factorization qr(double[][] columns);
}
