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

import java.util.Arrays;
import java.util.Objects;

/**
 * An oriented subspace of grade 0 &lt; k &lt; dim, held as an orthonormal dim x k basis and a signed volume.
 * Blades are only built through {@link Blades}, which collapses degenerate input to {@link Zero}.
 * <p>
 * The basis array is never mutated after construction and may be shared between blades that represent the
 * same subspace with different magnitudes. {@link #unsafeBasis()} exposes that shared array; writing to it is
 * visible through every blade that shares it.
 *
 * @author hal.hildebrand
 */
public final class Blade implements AbstractBlade {
    private final double[][] basis;
    private final int        dim;
    private final int        grade;
    private final Precision  precision;
    private final double     volume;

    Blade(double[][] basis, double volume, Precision precision) {
        if (basis.length == 0 || basis[0].length == 0 || basis[0].length >= basis.length) {
            throw new IllegalStateException(
            "Blade grade must be in (0, dim): " + (basis.length == 0 ? 0 : basis[0].length) + " in " + basis.length);
        }
        this.basis = basis;
        this.dim = basis.length;
        this.grade = basis[0].length;
        this.volume = volume;
        this.precision = Objects.requireNonNull(precision, "precision");
    }

    @Override
    public double[][] basis() {
        return Matrices.copy(basis);
    }

    @Override
    public int dim() {
        return dim;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Blade other)) {
            return false;
        }
        return precision == other.precision && Double.compare(volume, other.volume) == 0 && Arrays.deepEquals(
        basis, other.basis);
    }

    @Override
    public int grade() {
        return grade;
    }

    @Override
    public int hashCode() {
        return Objects.hash(precision, volume, Arrays.deepHashCode(basis));
    }

    @Override
    public Kind kind() {
        return Kind.BLADE;
    }

    @Override
    public Precision precision() {
        return precision;
    }

    @Override
    public String toString() {
        return String.format("Blade [dim=%s, grade=%s, volume=%s, precision=%s]", dim, grade, volume, precision);
    }

    /**
     * Answer the live basis array shared by this blade and every view created from it with
     * <code>copyBasis == false</code>. Mutating the array mutates all of them; the receiver performs no
     * synchronization.
     *
     * @return the live dim x grade basis
     */
    public double[][] unsafeBasis() {
        return basis;
    }

    @Override
    public double volume() {
        return volume;
    }
}
