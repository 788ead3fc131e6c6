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

import java.util.ArrayList;

import static com.hellblazer.clifford.Arithmetic.reversionSign;

/**
 * Left and right contraction. The left contraction <code>B ⌋ C</code> of a blade B contained in C is the part
 * of C orthogonal to B, scaled by the volume of B; it vanishes whenever the grade of B exceeds that of C.
 *
 * @author hal.hildebrand
 */
final class Contraction {

    static Multivector left(Multivector x, Multivector y) {
        var precision = Precision.widest(x.precision(), y.precision());
        if (x.kind() == Kind.ZERO || y.kind() == Kind.ZERO) {
            return Zero.of(precision);
        }
        if (x.kind().isScalar()) {
            return Arithmetic.scale(y, ((AbstractScalar) x).value(), precision);
        }
        if (y.kind().isScalar()) {
            return Zero.of(precision);
        }
        Dimensions.assertEqual(x, y);
        if (x.kind() == Kind.MULTIVECTOR || y.kind() == Kind.MULTIVECTOR) {
            var terms = new ArrayList<Multivector>();
            for (var bx : x.blades()) {
                for (var by : y.blades()) {
                    terms.add(left(bx, by));
                }
            }
            return Multivectors.of(terms);
        }
        var bx = (AbstractBlade) x;
        var by = (AbstractBlade) y;
        if (bx.grade() > by.grade()) {
            return Zero.of(precision);
        }
        if (by.kind() == Kind.PSEUDOSCALAR) {
            if (bx.kind() == Kind.PSEUDOSCALAR) {
                return Scalar.of(reversionSign(bx.dim()) * bx.volume() * by.volume(), precision);
            }
            return Arithmetic.scale(Duality.dual(bx), by.volume(), precision);
        }
        var projected = Projection.project(bx, by);
        if (projected.kind() == Kind.ZERO) {
            return Zero.of(precision);
        }
        var scale = reversionSign(by.grade()) * by.volume();
        if (bx.grade() == by.grade()) {
            // the equal grade dual carries f(grade) of its own
            scale *= reversionSign(bx.grade());
        }
        return Arithmetic.scale(Duality.dual(projected, by), scale, precision);
    }

    static Multivector right(Multivector x, Multivector y) {
        return Arithmetic.reverse(left(Arithmetic.reverse(y), Arithmetic.reverse(x)));
    }

    private Contraction() {
    }
}
