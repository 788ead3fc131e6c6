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

import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.util.MathArrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link LinearAlgebra} backed by Apache Commons Math Householder QR and LU decompositions
 *
 * @author hal.hildebrand
 */
public class CommonsMathLinearAlgebra implements LinearAlgebra {
    private static final Logger log = LoggerFactory.getLogger(CommonsMathLinearAlgebra.class);

    @Override
    public double determinant(double[][] square) {
        if (square.length == 0 || square.length != square[0].length) {
            throw new IllegalArgumentException("Determinant requires a non-empty square matrix");
        }
        return new LUDecomposition(MatrixUtils.createRealMatrix(square)).getDeterminant();
    }

    @Override
    public double norm(double[] vector) {
        return MathArrays.safeNorm(vector);
    }

    @Override
    public double[][] orthogonalComplement(double[][] orthonormal) {
        var n = orthonormal.length;
        var k = orthonormal[0].length;
        if (k <= 0 || k >= n) {
            throw new IllegalArgumentException("Complement requires 0 < k < n, k: " + k + " n: " + n);
        }
        var q = new QRDecomposition(MatrixUtils.createRealMatrix(orthonormal)).getQ();
        return q.getSubMatrix(0, n - 1, k, n - 1).getData();
    }

    @Override
    public Factorization qr(double[][] columns) {
        var n = columns.length;
        var k = columns[0].length;
        if (k > n) {
            throw new IllegalArgumentException("Thin QR requires k <= n, k: " + k + " n: " + n);
        }
        var decomposition = new QRDecomposition(MatrixUtils.createRealMatrix(columns));
        var q = decomposition.getQ().getSubMatrix(0, n - 1, 0, k - 1).getData();
        var r = decomposition.getR();

        var diagonal = new double[k];
        var largest = 0.0;
        for (int i = 0; i < k; i++) {
            diagonal[i] = r.getEntry(i, i);
            largest = Math.max(largest, Math.abs(diagonal[i]));
        }
        var threshold = Math.max(n, k) * Math.ulp(1.0) * largest;
        var rank = 0;
        for (var d : diagonal) {
            if (Math.abs(d) > threshold) {
                rank++;
            }
        }
        if (rank < k) {
            log.trace("Rank {} of {} columns, threshold: {}", rank, k, threshold);
        }
        return new Factorization(q, diagonal, rank);
    }
}
