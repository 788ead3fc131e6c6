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
import com.hellblazer.clifford.common.linear.LinearAlgebra;
import com.hellblazer.clifford.common.linear.Matrices;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.GVector;
import javax.vecmath.Tuple3d;
import java.util.Objects;

/**
 * Factory for blades. Construction canonicalizes: a spanning set that is linearly dependent, has more vectors
 * than the dimension of the space, or spans a volume below the absolute tolerance produces {@link Zero}; a set
 * of dim independent vectors produces a {@link Pseudoscalar}; anything else a {@link Blade}. Callers must
 * dispatch on the kind of the answer.
 * <p>
 * The basis of a constructed blade carries the orientation of the spanning vectors, so the volume of a freshly
 * constructed blade is always positive.
 *
 * @author hal.hildebrand
 */
public final class Blades {
    private static final LinearAlgebra LINEAR_ALGEBRA = LinearAlgebra.DEFAULT;
    private static final Logger        log            = LoggerFactory.getLogger(Blades.class);

    /**
     * Construct the blade spanned by the columns of the dim x k matrix, in double precision with the default
     * absolute tolerance
     */
    public static AbstractBlade fromColumns(double[][] columns) {
        return fromColumns(Precision.DOUBLE, Precision.DOUBLE.bladeAtol(), columns);
    }

    /**
     * Construct the blade spanned by the columns of the dim x k matrix
     *
     * @param precision - the precision of the result
     * @param atol      - volumes below this threshold collapse to {@link Zero}
     * @param columns   - dim x k matrix, not modified
     */
    public static AbstractBlade fromColumns(Precision precision, double atol, double[][] columns) {
        Objects.requireNonNull(precision, "precision");
        if (atol < 0 || Double.isNaN(atol)) {
            throw new IllegalArgumentException("Absolute tolerance must be non-negative: " + atol);
        }
        validate(columns);
        var dim = columns.length;
        var k = columns[0].length;
        if (k > dim) {
            log.trace("{} vectors cannot be independent in dimension {}", k, dim);
            return Zero.of(precision);
        }
        var factorization = LINEAR_ALGEBRA.qr(columns);
        if (!factorization.isFullRank()) {
            log.trace("Spanning set of {} vectors in dimension {} has rank {}", k, dim, factorization.rank());
            return Zero.of(precision);
        }
        var volume = factorization.volume();
        var norm = Math.abs(volume);
        if (norm < atol) {
            log.trace("Spanned volume {} is below tolerance {}", norm, atol);
            return Zero.of(precision);
        }
        if (k == dim) {
            return Pseudoscalar.of(dim, LINEAR_ALGEBRA.determinant(columns), precision);
        }
        var basis = factorization.q();
        if (volume < 0) {
            for (var row : basis) {
                row[0] = -row[0];
            }
        }
        return onBasis(precision.round(basis), precision.round(norm), precision);
    }

    public static AbstractBlade of(double[]... vectors) {
        return of(Precision.DOUBLE, vectors);
    }

    /**
     * Construct the blade spanned by the vectors, with the default absolute tolerance of the precision
     */
    public static AbstractBlade of(Precision precision, double[]... vectors) {
        return of(precision, precision.bladeAtol(), vectors);
    }

    /**
     * Construct the blade spanned by the vectors
     *
     * @param precision - the precision of the result
     * @param atol      - volumes below this threshold collapse to {@link Zero}
     * @param vectors   - the spanning vectors, all of the same length
     */
    public static AbstractBlade of(Precision precision, double atol, double[]... vectors) {
        return fromColumns(precision, atol, Matrices.columns(vectors));
    }

    /**
     * Construct the blade spanned by arbitrary dimension vecmath vectors
     */
    public static AbstractBlade of(GVector... vectors) {
        Objects.requireNonNull(vectors, "vectors");
        var coordinates = new double[vectors.length][];
        for (int j = 0; j < vectors.length; j++) {
            coordinates[j] = new double[vectors[j].getSize()];
            for (int i = 0; i < coordinates[j].length; i++) {
                coordinates[j][i] = vectors[j].getElement(i);
            }
        }
        return of(coordinates);
    }

    /**
     * Construct the blade spanned by three dimensional vecmath tuples
     */
    public static AbstractBlade of(Tuple3d... vectors) {
        Objects.requireNonNull(vectors, "vectors");
        var coordinates = new double[vectors.length][];
        for (int j = 0; j < vectors.length; j++) {
            coordinates[j] = new double[] { vectors[j].x, vectors[j].y, vectors[j].z };
        }
        return of(coordinates);
    }

    public static AbstractBlade vector(double... coordinates) {
        return of(Precision.DOUBLE, coordinates);
    }

    public static AbstractBlade vector(Precision precision, double... coordinates) {
        return of(precision, new double[][] { coordinates });
    }

    /**
     * A blade representing the same subspace as the source, with the given norm and the source's orientation.
     * The basis is copied.
     */
    public static AbstractBlade withNorm(Blade source, double norm) {
        return withNorm(source, norm, true);
    }

    /**
     * A blade representing the same subspace as the source, with the given norm and the source's orientation
     *
     * @param copyBasis - when false the result shares the source's basis array, see {@link Blade#unsafeBasis()}
     */
    public static AbstractBlade withNorm(Blade source, double norm, boolean copyBasis) {
        if (norm < 0 || Double.isNaN(norm)) {
            throw new IllegalArgumentException("Norm must be non-negative: " + norm);
        }
        var sign = source.volume() < 0 ? -1.0 : 1.0;
        return withVolume(source, sign * norm, copyBasis);
    }

    /**
     * A blade on the same basis as the source with the given signed volume. The basis is copied.
     */
    public static AbstractBlade withVolume(Blade source, double volume) {
        return withVolume(source, volume, true);
    }

    /**
     * A blade on the same basis as the source with the given signed volume
     *
     * @param copyBasis - when false the result shares the source's basis array, see {@link Blade#unsafeBasis()}
     */
    public static AbstractBlade withVolume(Blade source, double volume, boolean copyBasis) {
        Objects.requireNonNull(source, "source");
        if (Double.isNaN(volume)) {
            throw new IllegalArgumentException("Volume cannot be NaN");
        }
        var basis = copyBasis ? Matrices.copy(source.unsafeBasis()) : source.unsafeBasis();
        return onBasis(basis, source.precision().round(volume), source.precision());
    }

    /**
     * A blade on the source's basis with the given volume, expressed in the given precision. The basis is shared
     * when the precision is unchanged.
     */
    static AbstractBlade onBasis(Blade source, double volume, Precision precision) {
        var basis = precision == source.precision() ? source.unsafeBasis()
                                                    : precision.round(Matrices.copy(source.unsafeBasis()));
        return onBasis(basis, precision.round(volume), precision);
    }

    /**
     * Wrap an orthonormal basis the caller owns. No copy is made.
     */
    static AbstractBlade onBasis(double[][] orthonormal, double volume, Precision precision) {
        if (volume == 0.0) {
            return Zero.of(precision);
        }
        var dim = orthonormal.length;
        var grade = orthonormal[0].length;
        if (grade == dim) {
            return Pseudoscalar.of(dim, volume * Math.signum(LINEAR_ALGEBRA.determinant(orthonormal)), precision);
        }
        return new Blade(orthonormal, volume, precision);
    }

    private static void validate(double[][] columns) {
        if (columns == null || columns.length == 0 || columns[0].length == 0) {
            throw new IllegalArgumentException("At least one vector of at least one coordinate is required");
        }
        var k = columns[0].length;
        for (var row : columns) {
            if (row.length != k) {
                throw new IllegalArgumentException("Ragged column matrix");
            }
            for (var v : row) {
                if (!Double.isFinite(v)) {
                    throw new IllegalArgumentException("Vector coordinates must be finite: " + v);
                }
            }
        }
    }

    private Blades() {
    }
}
