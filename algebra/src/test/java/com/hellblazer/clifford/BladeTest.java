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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import javax.vecmath.GVector;
import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@DisplayName("Blade Tests")
public class BladeTest extends AlgebraTestBase {

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("Vector norm, grade and basis")
        void vector() {
            var blade = Blades.vector(3, 4, 0);
            assertEquals(Kind.BLADE, blade.kind());
            assertEquals(3, blade.dim());
            assertEquals(1, blade.grade());
            assertEquals(5.0, blade.norm(), 1e-12);
            assertEquals(5.0, blade.volume(), 1e-12);
            assertEquals(1, blade.sign());
            var basis = blade.basis();
            assertEquals(0.6, basis[0][0], 1e-12);
            assertEquals(0.8, basis[1][0], 1e-12);
            assertEquals(0.0, basis[2][0], 1e-12);
        }

        @Test
        @DisplayName("Degenerate spanning sets collapse to Zero")
        void degenerate() {
            assertSame(Zero.of(), Blades.of(new double[] { 1, 2, 3 }, new double[] { 2, 4, 6 }));
            assertSame(Zero.of(), Blades.of(new double[] { 1, 0 }, new double[] { 0, 1 }, new double[] { 1, 1 }));
            assertSame(Zero.of(), Blades.vector(0, 0, 0));
            assertSame(Zero.of(), Blades.vector(1e-15, 0, 0));
            assertSame(Zero.of(Precision.SINGLE), Blades.vector(Precision.SINGLE, 0, 0));
        }

        @Test
        @DisplayName("Absolute tolerance is configurable")
        void tolerance() {
            var tiny = Blades.of(Precision.DOUBLE, 0.0, new double[] { 1e-15, 0, 0 });
            assertEquals(Kind.BLADE, tiny.kind());
            assertEquals(1e-15, tiny.norm(), 1e-27);
            assertSame(Zero.of(), Blades.of(Precision.DOUBLE, 1.0, new double[] { 0.5, 0, 0 }));
            assertThrows(IllegalArgumentException.class,
                         () -> Blades.of(Precision.DOUBLE, -1.0, new double[] { 1, 0, 0 }));
        }

        @Test
        @DisplayName("Reject malformed input")
        void malformed() {
            assertThrows(IllegalArgumentException.class, () -> Blades.of(new double[0][]));
            assertThrows(IllegalArgumentException.class, () -> Blades.vector());
            assertThrows(IllegalArgumentException.class,
                         () -> Blades.of(new double[] { 1, 2 }, new double[] { 1, 2, 3 }));
            assertThrows(IllegalArgumentException.class, () -> Blades.vector(1, Double.NaN, 0));
            assertThrows(IllegalArgumentException.class, () -> Blades.vector(Double.POSITIVE_INFINITY, 0, 0));
        }

        @Test
        @DisplayName("A blade basis must have fewer columns than rows")
        void gradeBounds() {
            assertThrows(IllegalStateException.class, () -> new Blade(new double[3][3], 1.0, Precision.DOUBLE));
            assertThrows(IllegalStateException.class, () -> new Blade(new double[3][0], 1.0, Precision.DOUBLE));
            assertThrows(IllegalStateException.class, () -> new Blade(new double[0][], 1.0, Precision.DOUBLE));
            assertEquals(2, new Blade(new double[3][2], 1.0, Precision.DOUBLE).grade());
        }

        @Test
        @DisplayName("Orientation follows the order of the spanning vectors")
        void orientation() {
            var e12 = Blades.of(e(3, 0), e(3, 1));
            var e21 = Blades.of(e(3, 1), e(3, 0));
            assertEquals(1.0, e12.volume(), 1e-12);
            assertEquals(1.0, e21.volume(), 1e-12);
            assertTrue(Algebra.isApprox(e12, Algebra.negate(e21)));
            assertFalse(Algebra.isApprox(e12, e21));
        }

        @Test
        @DisplayName("Norm is the spanned volume")
        void spannedVolume() {
            var sheared = Blades.of(new double[] { 1, 0, 0 }, new double[] { 1, 1, 0 });
            assertEquals(2, sheared.grade());
            assertEquals(1.0, sheared.norm(), 1e-12);

            var scaled = Blades.of(new double[] { 2, 0, 0, 0 }, new double[] { 0, 3, 0, 0 },
                                   new double[] { 0, 0, 0, 4 });
            assertEquals(3, scaled.grade());
            assertEquals(24.0, scaled.norm(), 1e-12);
        }

        @Test
        @DisplayName("vecmath inputs")
        void vecmath() {
            var plane = Blades.of(new Vector3d(1, 0, 0), new Point3d(0, 2, 0));
            assertEquals(2, plane.grade());
            assertEquals(3, plane.dim());
            assertEquals(2.0, plane.norm(), 1e-12);

            var vector = Blades.of(new GVector(new double[] { 1, 2 }));
            assertEquals(Math.sqrt(5), vector.norm(), 1e-12);
            assertTrue(Algebra.isApprox(vector, new double[] { 1, 2 }));
        }

        @Test
        @DisplayName("Single precision rounds the basis and volume")
        void singlePrecision() {
            var blade = (Blade) Blades.vector(Precision.SINGLE, 0.1, 0.2, 0.3);
            assertEquals(Precision.SINGLE, blade.precision());
            assertEquals((double) (float) blade.volume(), blade.volume());
            for (var row : blade.unsafeBasis()) {
                assertEquals((double) (float) row[0], row[0]);
            }
        }
    }

    @Nested
    @DisplayName("Copies and views")
    class CopyTests {

        @Test
        @DisplayName("withNorm keeps subspace and orientation")
        void withNorm() {
            var source = (Blade) Algebra.negate(Blades.vector(3, 4, 0));
            var scaled = Blades.withNorm(source, 10);
            assertEquals(10.0, scaled.norm(), 1e-12);
            assertEquals(-1, scaled.sign());
            assertNotSame(source.unsafeBasis(), ((Blade) scaled).unsafeBasis());
            assertArrayEquals(source.unsafeBasis()[0], ((Blade) scaled).unsafeBasis()[0]);

            assertSame(Zero.of(), Blades.withNorm(source, 0));
            assertThrows(IllegalArgumentException.class, () -> Blades.withNorm(source, -1));
        }

        @Test
        @DisplayName("withVolume sets the signed volume")
        void withVolume() {
            var source = (Blade) Blades.vector(3, 4, 0);
            var flipped = Blades.withVolume(source, -2);
            assertEquals(-2.0, flipped.volume());
            assertTrue(Algebra.isApprox(flipped, Blades.vector(-1.2, -1.6, 0)));
            assertThrows(IllegalArgumentException.class, () -> Blades.withVolume(source, Double.NaN));
        }

        @Test
        @DisplayName("Views share the live basis")
        void views() {
            var source = (Blade) Blades.vector(1, 0, 0);
            var view = (Blade) Blades.withNorm(source, 2, false);
            var copy = (Blade) Blades.withNorm(source, 2, true);
            assertSame(source.unsafeBasis(), view.unsafeBasis());

            source.unsafeBasis()[0][0] = 0.0;
            source.unsafeBasis()[1][0] = 1.0;
            assertEquals(1.0, view.basis()[1][0]);
            assertEquals(0.0, copy.basis()[1][0], 1e-12);
        }

        @Test
        @DisplayName("basis() answers a copy")
        void basisCopy() {
            var blade = (Blade) Blades.vector(1, 0, 0);
            var basis = blade.basis();
            basis[0][0] = 5.0;
            assertEquals(1.0, blade.basis()[0][0], 1e-12);
        }

        @Test
        @DisplayName("Structural equality")
        void equality() {
            assertEquals(Blades.vector(1, 2, 3), Blades.vector(1, 2, 3));
            assertEquals(Blades.vector(1, 2, 3).hashCode(), Blades.vector(1, 2, 3).hashCode());
            assertNotEquals(Blades.vector(1, 2, 3), Blades.vector(2, 4, 6));
            assertNotEquals(Blades.vector(1, 2, 3), Blades.vector(Precision.SINGLE, 1, 2, 3));
        }
    }
}
