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
import com.hellblazer.clifford.common.linear.Matrices;

import java.util.ArrayList;

/**
 * The outer product
 *
 * @author hal.hildebrand
 */
final class Wedge {

    static Multivector wedge(Multivector x, Multivector y) {
        var precision = Precision.widest(x.precision(), y.precision());
        if (x.kind() == Kind.ZERO || y.kind() == Kind.ZERO) {
            return Zero.of(precision);
        }
        if (x.kind().isScalar()) {
            return Arithmetic.scale(y, ((AbstractScalar) x).value(), precision);
        }
        if (y.kind().isScalar()) {
            return Arithmetic.scale(x, ((AbstractScalar) y).value(), precision);
        }
        Dimensions.assertEqual(x, y);
        if (x.kind() == Kind.MULTIVECTOR || y.kind() == Kind.MULTIVECTOR) {
            var terms = new ArrayList<Multivector>();
            for (var bx : x.blades()) {
                for (var by : y.blades()) {
                    terms.add(wedge(bx, by));
                }
            }
            return Multivectors.of(terms);
        }
        if (x.kind() == Kind.PSEUDOSCALAR || y.kind() == Kind.PSEUDOSCALAR) {
            return Zero.of(precision);
        }
        var bx = (Blade) x;
        var by = (Blade) y;
        if (bx.grade() + by.grade() > bx.dim()) {
            return Zero.of(precision);
        }
        var span = Blades.fromColumns(precision, precision.bladeAtol(),
                                      Matrices.hcat(bx.unsafeBasis(), by.unsafeBasis()));
        return Arithmetic.scale(span, bx.volume() * by.volume(), precision);
    }

    private Wedge() {
    }
}
