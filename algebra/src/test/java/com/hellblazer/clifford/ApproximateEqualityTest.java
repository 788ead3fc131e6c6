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
import com.hellblazer.clifford.common.Tolerance;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class ApproximateEqualityTest extends AlgebraTestBase {

    @Test
    public void testBlades() {
        var e12 = Blades.of(e(3, 0), e(3, 1));
        var rotated = Blades.of(new double[] { 1, 1, 0 }, new double[] { -1, 1, 0 });
        assertTrue(Algebra.isApprox(rotated, Algebra.multiplyScalar(2, e12)));
        assertFalse(Algebra.isApprox(rotated, Algebra.multiplyScalar(-2, e12)));
        assertFalse(Algebra.isApprox(rotated, e12));
        assertFalse(Algebra.isApprox(e12, Blades.of(e(3, 1), e(3, 2))));
        assertFalse(Algebra.isApprox(Blades.vector(1, 0, 0), e12));
        assertFalse(Algebra.isApprox(Blades.vector(1, 0), Blades.vector(1, 0, 0)));
        assertTrue(Algebra.isApprox(Blades.vector(1, 2, 3), Blades.vector(1, 2, 3 + 1e-12)));
        assertFalse(Algebra.isApprox(Pseudoscalar.of(3, 1), Pseudoscalar.of(4, 1)));
        assertTrue(Algebra.isApprox(Pseudoscalar.of(3, 1), Pseudoscalar.of(3, 1 + 1e-10)));
    }

    @Test
    public void testComposite() {
        var e1 = Blades.vector(1, 0, 0);
        var e12 = Blades.of(e(3, 0), e(3, 1));
        var m = Multivectors.of(Scalar.of(2), e1, e12);
        assertTrue(Algebra.isApprox(m, Multivectors.of(e12, e1, Scalar.of(2))));
        assertFalse(Algebra.isApprox(m, Multivectors.of(e12, e1, Scalar.of(3))));
        assertFalse(Algebra.isApprox(Multivectors.of(Scalar.of(2), e1), e1));
        assertFalse(Algebra.isApprox(e1, Multivectors.of(Scalar.of(2), e1)));
    }

    @Test
    public void testPlueckerCoordinates() {
        var e12 = Blades.of(e(3, 0), e(3, 1));
        var e13 = Blades.of(e(3, 0), e(3, 2));
        var sum = Multivectors.of(e12, e13);
        assertEquals(Kind.MULTIVECTOR, sum.kind());
        var single = Blades.of(new double[] { 1, 0, 0 }, new double[] { 0, 1, 1 });
        assertTrue(Algebra.isApprox(sum, single));
        assertTrue(Algebra.isApprox(single, sum));
        assertFalse(Algebra.isApprox(sum, Algebra.negate(single)));

        var a = Blades.of(e(4, 0), e(4, 1));
        var b = Blades.of(e(4, 2), e(4, 3));
        assertTrue(Algebra.isApprox(Multivectors.of(a, b), Multivectors.of(b, a)));
        assertFalse(Algebra.isApprox(Multivectors.of(a, b), Multivectors.of(a, Algebra.negate(b))));
    }

    @Test
    public void testCompositeDecompositions() {
        var e12 = Blades.of(e(3, 0), e(3, 1));
        var e13 = Blades.of(e(3, 0), e(3, 2));
        // e12 + e13 == 2 e12 + e1 ^ (e3 - e2)
        var sum = Multivectors.of(e12, e13);
        var regrouped = Multivectors.of(Algebra.multiplyScalar(2, e12),
                                        Blades.of(new double[] { 1, 0, 0 }, new double[] { 0, -1, 1 }));
        var different = Multivectors.of(Algebra.multiplyScalar(2, e12),
                                         Blades.of(new double[] { 1, 0, 0 }, new double[] { 0, 1, 1 }));
        assertEquals(Kind.MULTIVECTOR, regrouped.kind());
        assertTrue(Algebra.isApprox(sum, regrouped));
        assertTrue(Algebra.isApprox(regrouped, sum));
        assertFalse(Algebra.isApprox(sum, different));
        assertFalse(Algebra.isApprox(different, regrouped));

        var single = Blades.of(new double[] { 1, 0, 0 }, new double[] { 0, 1, 1 });
        assertTrue(Algebra.isApprox(regrouped, single));
        assertFalse(Algebra.isApprox(different, single));

        var withVector = Multivectors.of(Blades.vector(0, 0, 1), e12, e13);
        assertFalse(Algebra.isApprox(withVector, single));
        assertFalse(Algebra.isApprox(single, withVector));
    }

    @Test
    public void testCompositeLargeMagnitudes() {
        var e12 = Blades.of(e(3, 0), e(3, 1));
        var e13 = Blades.of(e(3, 0), e(3, 2));
        var sum = Algebra.multiplyScalar(1e200, Multivectors.of(e12, e13));
        var regrouped = Algebra.multiplyScalar(1e200, Multivectors.of(Algebra.multiplyScalar(2, e12),
                                                                      Blades.of(new double[] { 1, 0, 0 },
                                                                                new double[] { 0, -1, 1 })));
        var doubled = Algebra.multiplyScalar(2e200, Multivectors.of(e12, e13));
        assertEquals(Kind.MULTIVECTOR, sum.kind());
        assertFalse(Double.isInfinite(sum.norm()));
        assertEquals(Math.sqrt(2) * 1e200, sum.norm(), 1e188);
        assertTrue(Algebra.isApprox(sum, regrouped));
        assertFalse(Algebra.isApprox(sum, doubled));
        assertFalse(Algebra.isApprox(doubled, regrouped));
    }

    @Test
    public void testRawValues() {
        assertTrue(Algebra.isApprox(Scalar.of(2), 2.0));
        assertFalse(Algebra.isApprox(3.0, Scalar.of(2)));
        assertTrue(Algebra.isApprox(Zero.of(), 0.0));
        assertTrue(Algebra.isApprox(Blades.vector(1, 2, 3), new double[] { 1, 2, 3 }));
        assertTrue(Algebra.isApprox(new double[] { 1, 2, 3 }, Blades.vector(1, 2, 3)));
        assertFalse(Algebra.isApprox(Blades.vector(1, 2, 3), new double[] { 1, 2 }));
        assertFalse(Algebra.isApprox(new double[] { 1, 2, 3, 4 }, Blades.vector(1, 2, 3)));
        assertTrue(Algebra.isApprox(new double[] { 1, 2 }, new double[] { 1, 2 }));
        assertFalse(Algebra.isApprox(new double[] { 1, 2 }, new double[] { 1, 2, 0 }));
        assertFalse(Algebra.isApprox(new double[] { 1e200 }, new double[] { 2e200 }));
        assertFalse(Algebra.isApprox(new double[] { 0, 0 }, new double[] { 1e-300, 0 }));
        assertTrue(Algebra.isApprox(1.0, 1.0 + 1e-12));
        assertFalse(Algebra.isApprox(1.0, 1.001));
    }

    @Test
    public void testReflexiveAndSymmetric() {
        for (int trial = 0; trial < 20; trial++) {
            var dim = 2 + random.nextInt(5);
            var x = randomBlade(dim, 1 + random.nextInt(dim - 1));
            var y = randomBlade(dim, x.grade());
            assertTrue(Algebra.isApprox(x, x));
            assertEquals(Algebra.isApprox(x, y), Algebra.isApprox(y, x));
            var perturbed = Blades.withVolume(x, x.volume() * (1 + 1e-12));
            assertTrue(Algebra.isApprox(x, perturbed));
            assertTrue(Algebra.isApprox(perturbed, x));
        }
    }

    @Test
    public void testScalars() {
        assertTrue(Algebra.isApprox(One.of(), Scalar.of(1 + 1e-10)));
        assertFalse(Algebra.isApprox(One.of(), Scalar.of(1.001)));
        assertTrue(Algebra.isApprox(Scalar.of(0.1, Precision.SINGLE), Scalar.of(0.1)));
        assertTrue(Algebra.isApprox(Scalar.of(1), Scalar.of(1.001), Tolerance.of(Precision.DOUBLE).withRtol(1e-2)));
        assertTrue(Algebra.isApprox(Scalar.of(1), Scalar.of(1.001), 0.01, 0.0));
        assertFalse(Algebra.isApprox(Scalar.of(1), Scalar.of(1.1), 0.01, 0.0));
    }

    @Test
    public void testZero() {
        assertTrue(Algebra.isApprox(Zero.of(), Zero.of()));
        assertTrue(Algebra.isApprox(Zero.of(Precision.SINGLE), Zero.of(Precision.DOUBLE)));
        assertFalse(Algebra.isApprox(Zero.of(), Scalar.of(1e-300)));
        assertFalse(Algebra.isApprox(Scalar.of(1e-300), Zero.of()));
        assertTrue(Algebra.isApprox(Zero.of(), Scalar.of(0.5), 1.0, 0.0));
        assertTrue(Algebra.isApprox(Blades.vector(1e-3, 0, 0), Zero.of(), 1e-2, 0.0));
        assertFalse(Algebra.isApprox(Zero.of(), Blades.vector(1, 0, 0)));
        assertTrue(Algebra.isApprox(Zero.of(), Multivectors.of(Scalar.of(1e-6), Blades.vector(1e-6, 0)), 1e-3,
                                    0.0));
    }
}
