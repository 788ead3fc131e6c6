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

import java.util.ArrayList;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Addition, scaling, reversion, reciprocals and precision conversion
 *
 * @author hal.hildebrand
 */
final class Arithmetic {
    private static final LinearAlgebra LINEAR_ALGEBRA = LinearAlgebra.DEFAULT;
    private static final Logger        log            = LoggerFactory.getLogger(Arithmetic.class);

    static Multivector add(Multivector x, Multivector y) {
        var precision = Precision.widest(x.precision(), y.precision());
        if (x.kind() == Kind.ZERO) {
            return convert(y, precision);
        }
        if (y.kind() == Kind.ZERO) {
            return convert(x, precision);
        }
        Dimensions.assertEqual(x, y);
        if (x instanceof AbstractBlade bx && y instanceof AbstractBlade by) {
            var combined = combine(bx, by);
            if (combined.isPresent()) {
                return combined.get();
            }
        }
        return Multivectors.of(x, y);
    }

    /**
     * Sum two homogeneous terms into a single term, if the sum is homogeneous: scalars, pseudoscalars of the
     * same dimension, vectors, and blades spanning the same subspace
     *
     * @return the single term sum, empty if the sum requires a multivector
     */
    static Optional<AbstractBlade> combine(AbstractBlade x, AbstractBlade y) {
        var precision = Precision.widest(x.precision(), y.precision());
        if (x.kind().isScalar() || y.kind().isScalar()) {
            if (x.kind().isScalar() && y.kind().isScalar()) {
                return Optional.of(Scalar.of(x.volume() + y.volume(), precision));
            }
            return Optional.empty();
        }
        if (x.dim() != y.dim() || x.grade() != y.grade()) {
            return Optional.empty();
        }
        if (x instanceof Pseudoscalar && y instanceof Pseudoscalar) {
            return Optional.of(Pseudoscalar.of(x.dim(), x.volume() + y.volume(), precision));
        }
        var bx = (Blade) x;
        var by = (Blade) y;
        if (x.grade() == 1) {
            var ux = bx.unsafeBasis();
            var uy = by.unsafeBasis();
            var sum = new double[x.dim()];
            for (int i = 0; i < sum.length; i++) {
                sum[i] = bx.volume() * ux[i][0] + by.volume() * uy[i][0];
            }
            return Optional.of(Blades.vector(precision, sum));
        }
        var d = LINEAR_ALGEBRA.determinant(Matrices.transposeTimes(bx.unsafeBasis(), by.unsafeBasis()));
        if (Math.abs(Math.abs(d) - 1.0) > precision.defaultRtol()) {
            return Optional.empty();
        }
        var volume = bx.volume() + by.volume() * Math.signum(d);
        if (Math.abs(volume) < precision.bladeAtol()) {
            return Optional.of(Zero.of(precision));
        }
        return Optional.of(Blades.onBasis(bx, volume, precision));
    }

    static AbstractBlade convert(AbstractBlade x, Precision precision) {
        if (x.precision() == precision) {
            return x;
        }
        return switch (x.kind()) {
        case ZERO -> Zero.of(precision);
        case ONE -> One.of(precision);
        case SCALAR -> Scalar.of(x.volume(), precision);
        case BLADE -> Blades.onBasis((Blade) x, x.volume(), precision);
        case PSEUDOSCALAR -> Pseudoscalar.of(x.dim(), x.volume(), precision);
        case MULTIVECTOR -> throw new IllegalStateException("Not a homogeneous term: " + x);
        };
    }

    static Multivector convert(Multivector x, Precision precision) {
        if (x instanceof AbstractBlade blade) {
            return convert(blade, precision);
        }
        return termwise(x, b -> convert(b, precision));
    }

    static Multivector negate(Multivector x) {
        return scale(x, -1.0, x.precision());
    }

    /**
     * @throws UndefinedOperationException for {@link Zero} and composite multivectors
     */
    static AbstractBlade reciprocal(Multivector x) {
        var precision = x.precision();
        return switch (x.kind()) {
        case ZERO -> {
            log.debug("Reciprocal of {}", x);
            throw new UndefinedOperationException("The reciprocal of Zero is not defined");
        }
        case ONE -> (One) x;
        case SCALAR -> {
            var value = ((Scalar) x).value();
            yield Double.isInfinite(value) ? Zero.of(precision) : Scalar.of(1.0 / value, precision);
        }
        case BLADE -> {
            var blade = (Blade) x;
            yield Blades.onBasis(blade, reversionSign(blade.grade()) / blade.volume(), precision);
        }
        case PSEUDOSCALAR -> Pseudoscalar.of(x.dim(), reversionSign(x.dim()) / ((Pseudoscalar) x).value(),
                                             precision);
        case MULTIVECTOR -> {
            log.debug("Reciprocal of {}", x);
            throw new UndefinedOperationException("The reciprocal of a general multivector is not defined");
        }
        };
    }

    static Multivector reverse(Multivector x) {
        return termwise(x, b -> scale(b, reversionSign(b.grade()), b.precision()));
    }

    /**
     * The sign picked up by reversing the order of the k factors of a blade, (-1)^(k(k-1)/2)
     */
    static int reversionSign(int k) {
        return Math.floorMod(k, 4) < 2 ? 1 : -1;
    }

    static AbstractBlade scale(AbstractBlade x, double factor, Precision precision) {
        if (factor == 0.0) {
            return Zero.of(precision);
        }
        return switch (x.kind()) {
        case ZERO -> Zero.of(precision);
        case ONE, SCALAR -> Scalar.of(x.volume() * factor, precision);
        case BLADE -> Blades.onBasis((Blade) x, x.volume() * factor, precision);
        case PSEUDOSCALAR -> Pseudoscalar.of(x.dim(), x.volume() * factor, precision);
        case MULTIVECTOR -> throw new IllegalStateException("Not a homogeneous term: " + x);
        };
    }

    /**
     * Multiply the volume of every term of x by the factor
     *
     * @param precision - the precision of the result
     */
    static Multivector scale(Multivector x, double factor, Precision precision) {
        if (Double.isNaN(factor)) {
            throw new IllegalArgumentException("Scale factor cannot be NaN");
        }
        if (factor == 0.0) {
            return Zero.of(precision);
        }
        if (x instanceof AbstractBlade blade) {
            return scale(blade, factor, precision);
        }
        return termwise(x, b -> scale(b, factor, precision));
    }

    static Multivector subtract(Multivector x, Multivector y) {
        return add(x, negate(y));
    }

    /**
     * Apply the operation to every blade of x and sum the results
     */
    static Multivector termwise(Multivector x, UnaryOperator<AbstractBlade> operation) {
        if (x instanceof AbstractBlade blade) {
            return operation.apply(blade);
        }
        var terms = new ArrayList<AbstractBlade>();
        for (var blade : x.blades()) {
            terms.add(operation.apply(blade));
        }
        return Multivectors.of(terms);
    }

    private Arithmetic() {
    }
}
