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
import com.hellblazer.clifford.common.Tolerance;

import java.util.Objects;

/**
 * The operators of the geometric algebra. Every operator accepts any {@link Multivector} and answers the most
 * specific kind representing the result. Binary operators resolve to the wider of the operands' precisions and
 * require non-scalar operands to share a dimension, throwing {@link DimensionMismatchException} otherwise.
 * <p>
 * Raw <code>double</code> operands are treated as scalars and raw <code>double[]</code> operands as vectors, in
 * the precision of the entity they are combined with. A raw vector whose length differs from the dimension of
 * the other operand is rejected before any numeric work.
 *
 * @author hal.hildebrand
 */
public final class Algebra {

    public static Multivector add(double x, Multivector y) {
        return add(scalar(x, y), y);
    }

    public static Multivector add(double[] x, Multivector y) {
        return add(vector(x, y), y);
    }

    public static Multivector add(Multivector x, double y) {
        return add(x, scalar(y, x));
    }

    public static Multivector add(Multivector x, double[] y) {
        return add(x, vector(y, x));
    }

    public static Multivector add(Multivector x, Multivector y) {
        return Arithmetic.add(x, y);
    }

    public static Multivector contractLeft(double x, Multivector y) {
        return contractLeft(scalar(x, y), y);
    }

    public static Multivector contractLeft(double[] x, double[] y) {
        return contractLeft(valueOf(x), valueOf(y));
    }

    public static Multivector contractLeft(double[] x, Multivector y) {
        return contractLeft(vector(x, y), y);
    }

    public static Multivector contractLeft(Multivector x, double y) {
        return contractLeft(x, scalar(y, x));
    }

    public static Multivector contractLeft(Multivector x, double[] y) {
        return contractLeft(x, vector(y, x));
    }

    /**
     * The left contraction x ⌋ y
     */
    public static Multivector contractLeft(Multivector x, Multivector y) {
        return Contraction.left(x, y);
    }

    public static Multivector contractRight(double x, Multivector y) {
        return contractRight(scalar(x, y), y);
    }

    public static Multivector contractRight(double[] x, double[] y) {
        return contractRight(valueOf(x), valueOf(y));
    }

    public static Multivector contractRight(double[] x, Multivector y) {
        return contractRight(vector(x, y), y);
    }

    public static Multivector contractRight(Multivector x, double y) {
        return contractRight(x, scalar(y, x));
    }

    public static Multivector contractRight(Multivector x, double[] y) {
        return contractRight(x, vector(y, x));
    }

    /**
     * The right contraction x ⌊ y, <code>reverse(reverse(y) ⌋ reverse(x))</code>
     */
    public static Multivector contractRight(Multivector x, Multivector y) {
        return Contraction.right(x, y);
    }

    /**
     * Re-express x in the given precision
     */
    public static Multivector convert(Multivector x, Precision precision) {
        Objects.requireNonNull(precision, "precision");
        return Arithmetic.convert(x, precision);
    }

    public static Multivector dot(double x, Multivector y) {
        return dot(scalar(x, y), y);
    }

    public static Multivector dot(double[] x, double[] y) {
        return dot(valueOf(x), valueOf(y));
    }

    public static Multivector dot(double[] x, Multivector y) {
        return dot(vector(x, y), y);
    }

    public static Multivector dot(Multivector x, double y) {
        return dot(x, scalar(y, x));
    }

    public static Multivector dot(Multivector x, double[] y) {
        return dot(x, vector(y, x));
    }

    /**
     * The left contraction
     */
    public static Multivector dot(Multivector x, Multivector y) {
        return dot(x, y, true);
    }

    /**
     * @param left - the left contraction when true, otherwise the right contraction
     */
    public static Multivector dot(Multivector x, Multivector y, boolean left) {
        return left ? contractLeft(x, y) : contractRight(x, y);
    }

    /**
     * The dual of a scalar in a space of the given dimension, a pseudoscalar
     */
    public static Multivector dual(double x, int dim) {
        return dual(Scalar.of(x), dim);
    }

    /**
     * The dual of a vector relative to the unit pseudoscalar of its space
     */
    public static Multivector dual(double[] x) {
        return dual(valueOf(x));
    }

    public static Multivector dual(double[] x, Multivector relativeTo) {
        return dual(vector(x, relativeTo), relativeTo);
    }

    /**
     * The dual of x relative to the unit pseudoscalar of its space
     *
     * @throws UndefinedOperationException for {@link Zero} and for scalars, whose dimension is unknown
     */
    public static Multivector dual(Multivector x) {
        return Duality.dual(x);
    }

    /**
     * The dual of x in a space of the given dimension
     */
    public static Multivector dual(Multivector x, int dim) {
        if (dim < 0) {
            throw new IllegalArgumentException("Dimension must be non-negative: " + dim);
        }
        return Duality.dual(x, dim);
    }

    public static Multivector dual(Multivector x, double relativeTo) {
        return dual(x, scalar(relativeTo, x));
    }

    /**
     * The dual of x relative to the one dimensional subspace spanned by the vector relativeTo
     */
    public static Multivector dual(Multivector x, double[] relativeTo) {
        return dual(x, vector(relativeTo, x));
    }

    /**
     * The dual of x relative to the subspace represented by relativeTo
     *
     * @throws ContainmentException        if x is a blade not contained in relativeTo
     * @throws UndefinedOperationException if either operand is {@link Zero} or relativeTo is a general
     *                                     multivector
     */
    public static Multivector dual(Multivector x, Multivector relativeTo) {
        return Duality.dual(x, relativeTo);
    }

    /**
     * Synonym for {@link #reciprocal(Multivector)}
     */
    public static AbstractBlade inverse(Multivector x) {
        return reciprocal(x);
    }

    public static boolean isApprox(double x, double y) {
        return Tolerance.of(Precision.DOUBLE).isApprox(x, y);
    }

    public static boolean isApprox(double x, Multivector y) {
        return isApprox(scalar(x, y), y);
    }

    public static boolean isApprox(double[] x, double[] y) {
        return Tolerance.of(Precision.DOUBLE).isApprox(x, y);
    }

    public static boolean isApprox(double[] x, Multivector y) {
        return isApprox(y, x);
    }

    public static boolean isApprox(Multivector x, double y) {
        return isApprox(x, scalar(y, x));
    }

    /**
     * @return false, rather than throwing, when the vector's length differs from the dimension of x
     */
    public static boolean isApprox(Multivector x, double[] y) {
        if (Dimensions.hasDimension(x) && x.dim() != y.length) {
            return false;
        }
        return isApprox(x, Blades.vector(x.precision(), y));
    }

    /**
     * Approximate equality with the default tolerance of the operands' precisions: no absolute tolerance and a
     * relative tolerance of the square root of the larger machine epsilon
     */
    public static boolean isApprox(Multivector x, Multivector y) {
        return isApprox(x, y, Tolerance.forComparison(x.precision(), y.precision()));
    }

    public static boolean isApprox(Multivector x, Multivector y, double atol, double rtol) {
        return isApprox(x, y, new Tolerance().withAtol(atol).withRtol(rtol));
    }

    public static boolean isApprox(Multivector x, Multivector y, Tolerance tolerance) {
        Objects.requireNonNull(tolerance, "tolerance");
        return Comparison.isApprox(x, y, tolerance);
    }

    public static Multivector multiplyScalar(AbstractScalar factor, Multivector x) {
        return Arithmetic.scale(x, factor.value(), Precision.widest(factor.precision(), x.precision()));
    }

    public static Multivector multiplyScalar(double factor, Multivector x) {
        return Arithmetic.scale(x, factor, x.precision());
    }

    public static Multivector multiplyScalar(Multivector x, AbstractScalar factor) {
        return multiplyScalar(factor, x);
    }

    public static Multivector multiplyScalar(Multivector x, double factor) {
        return multiplyScalar(factor, x);
    }

    public static Multivector negate(Multivector x) {
        return Arithmetic.negate(x);
    }

    /**
     * @return the multiplicative identity in the precision of x
     */
    public static One one(Multivector x) {
        return One.of(x.precision());
    }

    public static Multivector project(double x, Multivector y) {
        return project(scalar(x, y), y);
    }

    public static Multivector project(double[] x, double[] y) {
        return project(valueOf(x), valueOf(y));
    }

    public static Multivector project(double[] x, Multivector y) {
        return project(vector(x, y), y);
    }

    public static Multivector project(Multivector x, double y) {
        return project(x, scalar(y, x));
    }

    public static Multivector project(Multivector x, double[] y) {
        return project(x, vector(y, x));
    }

    /**
     * The orthogonal projection of x onto the subspace represented by y
     *
     * @throws UndefinedOperationException if y is a general multivector
     */
    public static Multivector project(Multivector x, Multivector y) {
        return Projection.project(x, y);
    }

    /**
     * The multiplicative inverse
     *
     * @throws UndefinedOperationException for {@link Zero} and general multivectors
     */
    public static AbstractBlade reciprocal(Multivector x) {
        return Arithmetic.reciprocal(x);
    }

    /**
     * Reverse the order of the factors of every term: grade k terms are multiplied by (-1)^(k(k-1)/2)
     */
    public static Multivector reverse(Multivector x) {
        return Arithmetic.reverse(x);
    }

    public static Multivector subtract(double x, Multivector y) {
        return subtract(scalar(x, y), y);
    }

    public static Multivector subtract(double[] x, Multivector y) {
        return subtract(vector(x, y), y);
    }

    public static Multivector subtract(Multivector x, double y) {
        return subtract(x, scalar(y, x));
    }

    public static Multivector subtract(Multivector x, double[] y) {
        return subtract(x, vector(y, x));
    }

    public static Multivector subtract(Multivector x, Multivector y) {
        return Arithmetic.subtract(x, y);
    }

    public static AbstractScalar valueOf(double value) {
        return Scalar.of(value);
    }

    public static AbstractBlade valueOf(double[] vector) {
        return Blades.vector(vector);
    }

    public static Multivector wedge(double x, Multivector y) {
        return wedge(scalar(x, y), y);
    }

    /**
     * The bivector spanned by two vectors, <code>Zero</code> when they are parallel
     */
    public static Multivector wedge(double[] x, double[] y) {
        return wedge(valueOf(x), valueOf(y));
    }

    public static Multivector wedge(double[] x, Multivector y) {
        return wedge(vector(x, y), y);
    }

    public static Multivector wedge(Multivector x, double y) {
        return wedge(x, scalar(y, x));
    }

    public static Multivector wedge(Multivector x, double[] y) {
        return wedge(x, vector(y, x));
    }

    /**
     * The outer product x ∧ y
     */
    public static Multivector wedge(Multivector x, Multivector y) {
        return Wedge.wedge(x, y);
    }

    /**
     * @return the additive identity in the precision of x
     */
    public static Zero zero(Multivector x) {
        return Zero.of(x.precision());
    }

    private static AbstractScalar scalar(double value, Multivector context) {
        return Scalar.of(value, context.precision());
    }

    private static AbstractBlade vector(double[] coordinates, Multivector context) {
        Objects.requireNonNull(coordinates, "coordinates");
        Dimensions.assertEqual(context, coordinates.length);
        return Blades.vector(context.precision(), coordinates);
    }

    private Algebra() {
    }
}
