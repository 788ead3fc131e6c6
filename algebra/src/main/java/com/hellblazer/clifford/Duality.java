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

import static com.hellblazer.clifford.Arithmetic.reversionSign;

/**
 * Duals, absolute (relative to the unit pseudoscalar of the space) and relative to a blade.
 * <p>
 * The dual of a blade B of grade k is the blade on the orthogonal complement of B, with the norm of B and the
 * orientation <code>sign(B) * sign det[basis(B) basis(dual B)] * f(k)</code>, where f is the reversion sign.
 * Dualizing twice multiplies by f(dim). Relative to a blade C containing B the dual lives on the complement of
 * B within C and dualizing twice multiplies by f(grade C). A blade of the same grade as C dualizes to the scalar
 * <code>f(grade B) * sign det(basis(C)^T basis(B)) * volume(B)</code>.
 *
 * @author hal.hildebrand
 */
final class Duality {
    private static final LinearAlgebra LINEAR_ALGEBRA = LinearAlgebra.DEFAULT;
    private static final Logger        log            = LoggerFactory.getLogger(Duality.class);

    static Multivector dual(Multivector x) {
        return switch (x.kind()) {
        case ZERO -> throw undefined(x, "The dual of Zero is not well-defined");
        case ONE, SCALAR -> throw undefined(x, "The dual of a scalar is not well-defined if `dim` is not specified");
        case PSEUDOSCALAR -> Scalar.of(((Pseudoscalar) x).value(), x.precision());
        case BLADE -> complement((Blade) x);
        case MULTIVECTOR -> Arithmetic.termwise(x, b -> b.kind().isScalar() ? dual(b, x.dim()) : dual(b));
        };
    }

    static AbstractBlade dual(AbstractBlade x) {
        return (AbstractBlade) dual((Multivector) x);
    }

    /**
     * The dual in a space of the given dimension. Scalars become pseudoscalars of that dimension.
     */
    static Multivector dual(Multivector x, int dim) {
        return switch (x.kind()) {
        case ZERO -> throw undefined(x, "The dual of Zero is not well-defined");
        case ONE, SCALAR -> Pseudoscalar.of(dim, reversionSign(dim) * ((AbstractScalar) x).value(), x.precision());
        case BLADE, PSEUDOSCALAR, MULTIVECTOR -> {
            Dimensions.assertEqual(x, dim);
            yield dual(x);
        }
        };
    }

    static AbstractBlade dual(AbstractBlade x, int dim) {
        return (AbstractBlade) dual((Multivector) x, dim);
    }

    /**
     * The dual of x relative to y
     *
     * @throws ContainmentException if a blade is not contained in the blade it is dualized against
     */
    static Multivector dual(Multivector x, Multivector y) {
        if (y.kind() == Kind.ZERO) {
            throw undefined(y, "The dual of anything relative to Zero is not well-defined");
        }
        if (y.kind() == Kind.MULTIVECTOR) {
            throw undefined(y, "The dual relative to a general multivector is not well-defined");
        }
        if (x.kind() == Kind.ZERO) {
            throw undefined(x, "The dual of Zero is not well-defined");
        }
        Dimensions.assertEqual(x, y);
        var precision = Precision.widest(x.precision(), y.precision());
        return Arithmetic.termwise(x, b -> relative(b, (AbstractBlade) y, precision));
    }

    private static AbstractBlade complement(Blade x) {
        var basis = x.unsafeBasis();
        var complement = LINEAR_ALGEBRA.orthogonalComplement(basis);
        var orientation = Math.signum(LINEAR_ALGEBRA.determinant(Matrices.hcat(basis, complement)));
        var volume = x.sign() * orientation * reversionSign(x.grade()) * x.norm();
        return Blades.onBasis(x.precision().round(complement), volume, x.precision());
    }

    private static AbstractBlade relative(AbstractBlade x, AbstractBlade y, Precision precision) {
        if (x.kind() == Kind.ZERO) {
            return Zero.of(precision);
        }
        return switch (y.kind()) {
        case ONE, SCALAR -> x.kind().isScalar() ? Arithmetic.convert(x, precision) : Zero.of(precision);
        case PSEUDOSCALAR -> switch (x.kind()) {
            case ONE, SCALAR -> Pseudoscalar.of(y.dim(), reversionSign(y.dim()) * x.volume(), precision);
            case PSEUDOSCALAR -> Scalar.of(x.volume(), precision);
            default -> Arithmetic.convert(dual(x), precision);
        };
        case BLADE -> switch (x.kind()) {
            case ONE, SCALAR -> Blades.onBasis((Blade) y, reversionSign(y.grade()) * x.volume(), precision);
            case PSEUDOSCALAR -> Zero.of(precision);
            default -> within((Blade) x, (Blade) y, precision);
        };
        case ZERO, MULTIVECTOR -> throw new IllegalStateException("Not a valid dual target: " + y);
        };
    }

    private static AbstractBlade within(Blade x, Blade y, Precision precision) {
        var ux = x.unsafeBasis();
        var uy = y.unsafeBasis();
        var tolerance = precision.defaultRtol();
        if (x.grade() > y.grade() || Matrices.frobeniusNorm(Matrices.reject(ux, uy)) > tolerance) {
            log.debug("{} is not contained in {}", x, y);
            throw new ContainmentException(x + " is not contained in " + y);
        }
        // coordinates of x in the basis of y
        var coordinates = Matrices.transposeTimes(uy, ux);
        if (x.grade() == y.grade()) {
            var orientation = Math.signum(LINEAR_ALGEBRA.determinant(coordinates));
            return Scalar.of(reversionSign(x.grade()) * orientation * x.volume(), precision);
        }
        var complement = LINEAR_ALGEBRA.orthogonalComplement(coordinates);
        var orientation = Math.signum(LINEAR_ALGEBRA.determinant(Matrices.hcat(coordinates, complement)));
        var volume = x.sign() * orientation * reversionSign(y.grade()) * reversionSign(x.grade()) * x.norm();
        var basis = precision.round(Matrices.multiply(uy, complement));
        return Blades.onBasis(basis, volume, precision);
    }

    private static UndefinedOperationException undefined(Multivector x, String message) {
        log.debug("{}: {}", message, x);
        return new UndefinedOperationException(message);
    }

    private Duality() {
    }
}
