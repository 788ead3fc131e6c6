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

/**
 * The additive identity. There is one instance per precision.
 *
 * @author hal.hildebrand
 */
public final class Zero implements AbstractScalar {
    private static final Zero DOUBLE = new Zero(Precision.DOUBLE);
    private static final Zero SINGLE = new Zero(Precision.SINGLE);

    public static Zero of() {
        return DOUBLE;
    }

    public static Zero of(Precision precision) {
        return switch (precision) {
        case SINGLE -> SINGLE;
        case DOUBLE -> DOUBLE;
        };
    }

    private final Precision precision;

    private Zero(Precision precision) {
        this.precision = precision;
    }

    @Override
    public Kind kind() {
        return Kind.ZERO;
    }

    @Override
    public Precision precision() {
        return precision;
    }

    @Override
    public String toString() {
        return "Zero[" + precision + "]";
    }

    @Override
    public double value() {
        return 0.0;
    }
}
