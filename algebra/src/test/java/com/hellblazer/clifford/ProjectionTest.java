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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class ProjectionTest extends AlgebraTestBase {

    @Test
    public void testBladeOntoBlade() {
        var e12 = Blades.of(e(3, 0), e(3, 1));
        assertApprox(Blades.vector(1, 2, 0), Algebra.project(Blades.vector(1, 2, 3), e12));
        assertApprox(Blades.vector(1, 2, 0), Algebra.project(new double[] { 1, 2, 3 }, e12));
        var e1 = Blades.vector(1, 0, 0);
        assertApprox(e1, Algebra.project(e1, e12));
        assertSame(Zero.of(), Algebra.project(Blades.vector(0, 0, 5), e12));
        assertSame(Zero.of(), Algebra.project(e12, e1));

        var tilted = Blades.of(new double[] { 1, 0, 0 }, new double[] { 0, 1, 1 });
        assertApprox(e12, Algebra.project(tilted, e12));
        assertSame(Zero.of(), Algebra.project(tilted, Blades.vector(0, 1, -1)));
    }

    @Test
    public void testIdempotent() {
        for (int trial = 0; trial < 20; trial++) {
            var target = randomBlade(5, 3);
            var source = randomBlade(5, 1 + random.nextInt(3));
            var projected = Algebra.project(source, target);
            assertApprox(projected, Algebra.project(projected, target));
            assertTrue(projected.norm() <= source.norm() * (1 + 1e-12));
        }
    }

    @Test
    public void testMultivector() {
        var e12 = Blades.of(e(3, 0), e(3, 1));
        var m = Multivectors.of(Scalar.of(2), Blades.vector(1, 2, 3));
        assertApprox(Multivectors.of(Scalar.of(2), Blades.vector(1, 2, 0)), Algebra.project(m, e12));
        assertThrows(UndefinedOperationException.class, () -> Algebra.project(e12, m));
        assertThrows(UndefinedOperationException.class, () -> Algebra.project(m, m));
    }

    @Test
    public void testPseudoscalars() {
        var e12 = Blades.of(e(3, 0), e(3, 1));
        var v = Blades.vector(1, 2, 3);
        assertSame(v, Algebra.project(v, Pseudoscalar.of(3, 2)));
        assertSame(Zero.of(), Algebra.project(Pseudoscalar.of(3, 1), e12));
        assertEquals(Pseudoscalar.of(3, 1), Algebra.project(Pseudoscalar.of(3, 1), Pseudoscalar.of(3, 4)));
        assertThrows(DimensionMismatchException.class, () -> Algebra.project(v, Pseudoscalar.of(4, 1)));
        assertThrows(DimensionMismatchException.class, () -> Algebra.project(Blades.vector(1, 0), e12));
        assertThrows(DimensionMismatchException.class, () -> Algebra.project(e12, new double[] { 1, 0 }));
    }

    @Test
    public void testScalars() {
        var e12 = Blades.of(e(3, 0), e(3, 1));
        assertEquals(Scalar.of(2), Algebra.project(Scalar.of(2), e12));
        assertSame(Zero.of(), Algebra.project(Zero.of(), e12));
        assertSame(Zero.of(), Algebra.project(e12, Scalar.of(2)));
        assertSame(Zero.of(), Algebra.project(e12, Zero.of()));
        assertEquals(Scalar.of(2), Algebra.project(Scalar.of(2), Multivectors.of(Scalar.of(2), e12)));
        assertEquals(Scalar.of(2), Algebra.project(2.0, e12));
        assertSame(Zero.of(), Algebra.project(e12, 2.0));
    }

    @Test
    public void testRawVectors() {
        assertApprox(Blades.vector(1, 0, 0), Algebra.project(new double[] { 1, 2, 3 }, new double[] { 5, 0, 0 }));
        assertApprox(Blades.vector(-1, 0, 0), Algebra.project(new double[] { -1, 2, 3 }, new double[] { 5, 0, 0 }));
        assertSame(Zero.of(), Algebra.project(new double[] { 0, 2, 3 }, new double[] { 1, 0, 0 }));
    }
}
