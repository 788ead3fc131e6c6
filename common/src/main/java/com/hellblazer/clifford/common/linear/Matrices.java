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

import org.apache.commons.math3.linear.MatrixUtils;

/**
 * Small helpers for the column matrices the algebra passes around
 *
 * @author hal.hildebrand
 */
public final class Matrices {

    /**
     * @return the dimension x k matrix whose columns are the supplied vectors
     * @throws IllegalArgumentException if no vectors are supplied or their lengths differ
     */
    public static double[][] columns(double[]... vectors) {
        if (vectors == null || vectors.length == 0) {
            throw new IllegalArgumentException("At least one vector is required");
        }
        var dimension = vectors[0].length;
        if (dimension == 0) {
            throw new IllegalArgumentException("Vectors must have at least one coordinate");
        }
        var result = new double[dimension][vectors.length];
        for (int j = 0; j < vectors.length; j++) {
            if (vectors[j].length != dimension) {
                throw new IllegalArgumentException(
                "Vector " + j + " has length " + vectors[j].length + ", expected " + dimension);
            }
            for (int i = 0; i < dimension; i++) {
                result[i][j] = vectors[j][i];
            }
        }
        return result;
    }

    public static double[][] copy(double[][] matrix) {
        var result = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            result[i] = matrix[i].clone();
        }
        return result;
    }

    public static double frobeniusNorm(double[][] matrix) {
        return MatrixUtils.createRealMatrix(matrix).getFrobeniusNorm();
    }

    /**
     * Concatenate the columns of a and b
     */
    public static double[][] hcat(double[][] a, double[][] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Row counts differ: " + a.length + " != " + b.length);
        }
        var result = new double[a.length][];
        for (int i = 0; i < a.length; i++) {
            var row = new double[a[i].length + b[i].length];
            System.arraycopy(a[i], 0, row, 0, a[i].length);
            System.arraycopy(b[i], 0, row, a[i].length, b[i].length);
            result[i] = row;
        }
        return result;
    }

    public static double[][] identity(int n) {
        return MatrixUtils.createRealIdentityMatrix(n).getData();
    }

    public static double[][] multiply(double[][] a, double[][] b) {
        return MatrixUtils.createRealMatrix(a).multiply(MatrixUtils.createRealMatrix(b)).getData();
    }

    /**
     * @return the orthogonal projection of the columns of <code>vectors</code> onto the span of the orthonormal
     *         columns of <code>basis</code>, <code>basis basis^T vectors</code>
     */
    public static double[][] project(double[][] vectors, double[][] basis) {
        return multiply(basis, transposeTimes(basis, vectors));
    }

    /**
     * @return the component of the columns of <code>vectors</code> orthogonal to the span of the orthonormal
     *         columns of <code>basis</code>
     */
    public static double[][] reject(double[][] vectors, double[][] basis) {
        var projection = project(vectors, basis);
        var result = new double[vectors.length][];
        for (int i = 0; i < vectors.length; i++) {
            result[i] = new double[vectors[i].length];
            for (int j = 0; j < vectors[i].length; j++) {
                result[i][j] = vectors[i][j] - projection[i][j];
            }
        }
        return result;
    }

    /**
     * @return <code>a^T b</code>
     */
    public static double[][] transposeTimes(double[][] a, double[][] b) {
        return MatrixUtils.createRealMatrix(a).transpose().multiply(MatrixUtils.createRealMatrix(b)).getData();
    }

    private Matrices() {
    }
}
