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

package com.hellblazer.clifford.common;

import com.hellblazer.clifford.common.linear.LinearAlgebra;

import java.util.Objects;

/**
 * Absolute and relative tolerances used for approximate comparison. Two reals <code>x</code> and
 * <code>y</code> are approximately equal when
 * <code>|x - y| &lt;= max(atol, rtol * max(|x|, |y|))</code>.
 * <p>
 * Defaults are derived from a {@link Precision}: <code>atol = 0</code> and
 * <code>rtol = sqrt(eps)</code>.
 *
 * @author hal.hildebrand
 */
public class Tolerance {

    /**
     * The default tolerance for comparing values of the two precisions. The relative tolerance is the
     * looser of the two.
     */
    public static Tolerance forComparison(Precision a, Precision b) {
        return of(Precision.narrowest(a, b));
    }

    public static Tolerance of(Precision precision) {
        Objects.requireNonNull(precision, "precision");
        return new Tolerance().withRtol(precision.defaultRtol());
    }

    private double atol = 0.0;
    private double rtol = 0.0;

    public double getAtol() {
        return atol;
    }

    public double getRtol() {
        return rtol;
    }

    public boolean isApprox(double x, double y) {
        if (x == y) {
            return true;
        }
        if (Double.isInfinite(x) || Double.isInfinite(y) || Double.isNaN(x) || Double.isNaN(y)) {
            return false;
        }
        return Math.abs(x - y) <= Math.max(atol, rtol * Math.max(Math.abs(x), Math.abs(y)));
    }

    /**
     * Compare two coordinate arrays using their Euclidean norms. The norms are scaled so that neither overflows
     * nor underflows.
     */
    public boolean isApprox(double[] x, double[] y) {
        if (x.length != y.length) {
            return false;
        }
        var difference = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            difference[i] = x[i] - y[i];
        }
        var linearAlgebra = LinearAlgebra.DEFAULT;
        var distance = linearAlgebra.norm(difference);
        if (Double.isNaN(distance)) {
            return false;
        }
        var scale = Math.max(linearAlgebra.norm(x), linearAlgebra.norm(y));
        return distance <= Math.max(atol, rtol * scale);
    }

    /**
     * @return true if the magnitude is within the absolute tolerance
     */
    public boolean isNegligible(double magnitude) {
        return Math.abs(magnitude) <= atol;
    }

    @Override
    public String toString() {
        return String.format("Tolerance [atol=%s, rtol=%s]", atol, rtol);
    }

    public Tolerance withAtol(double atol) {
        if (atol < 0 || Double.isNaN(atol)) {
            throw new IllegalArgumentException("Absolute tolerance must be non-negative: " + atol);
        }
        this.atol = atol;
        return this;
    }

    public Tolerance withRtol(double rtol) {
        if (rtol < 0 || Double.isNaN(rtol)) {
            throw new IllegalArgumentException("Relative tolerance must be non-negative: " + rtol);
        }
        this.rtol = rtol;
        return this;
    }
}
