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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orthogonal projection of one value onto the subspace represented by another. Projecting a blade that lies in
 * the target subspace answers the blade; projecting an orthogonal or lower rank blade answers {@link Zero}.
 *
 * @author hal.hildebrand
 */
final class Projection {
    private static final Logger log = LoggerFactory.getLogger(Projection.class);

    static Multivector project(Multivector x, Multivector y) {
        var precision = Precision.widest(x.precision(), y.precision());
        if (x.kind().isScalar()) {
            return Arithmetic.convert(x, precision);
        }
        return switch (y.kind()) {
        case ZERO, ONE, SCALAR -> Zero.of(precision);
        case MULTIVECTOR -> {
            log.debug("Projection of {} onto {}", x, y);
            throw new UndefinedOperationException("Projection onto a general multivector is not defined");
        }
        case PSEUDOSCALAR -> {
            Dimensions.assertEqual(x, y);
            yield Arithmetic.convert(x, precision);
        }
        case BLADE -> {
            Dimensions.assertEqual(x, y);
            yield Arithmetic.termwise(x, b -> onto(b, (Blade) y, precision));
        }
        };
    }

    private static AbstractBlade onto(AbstractBlade x, Blade y, Precision precision) {
        return switch (x.kind()) {
        case ZERO, ONE, SCALAR -> Arithmetic.convert(x, precision);
        case PSEUDOSCALAR -> Zero.of(precision);
        case BLADE -> {
            if (x.grade() > y.grade()) {
                yield Zero.of(precision);
            }
            var projected = Matrices.project(((Blade) x).unsafeBasis(), y.unsafeBasis());
            var span = Blades.fromColumns(precision, precision.bladeAtol(), projected);
            yield Arithmetic.scale(span, x.volume(), precision);
        }
        case MULTIVECTOR -> throw new IllegalStateException("Not a homogeneous term: " + x);
        };
    }

    private Projection() {
    }
}
