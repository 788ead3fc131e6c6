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

import com.hellblazer.clifford.common.Tolerance;
import com.hellblazer.clifford.common.linear.LinearAlgebra;
import com.hellblazer.clifford.common.linear.Matrices;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Approximate equality. Dimension and grade must agree exactly; magnitudes are compared with the
 * {@link Tolerance}. Blades compare the volume of one against the volume of the other expressed on the first's
 * basis, <code>volume(C) * det(basis(B)^T basis(C))</code>, so blades on different bases of the same subspace
 * compare equal. {@link Zero} is approximately equal to anything whose norm is within the absolute tolerance.
 *
 * @author hal.hildebrand
 */
final class Comparison {
    private static final LinearAlgebra LINEAR_ALGEBRA = LinearAlgebra.DEFAULT;

    static boolean isApprox(Multivector x, Multivector y, Tolerance tolerance) {
        if (x.kind() == Kind.ZERO) {
            return tolerance.isNegligible(y.norm());
        }
        if (y.kind() == Kind.ZERO) {
            return tolerance.isNegligible(x.norm());
        }
        if (Dimensions.hasDimension(x) && Dimensions.hasDimension(y) && x.dim() != y.dim()) {
            return false;
        }
        if (x.kind() == Kind.MULTIVECTOR || y.kind() == Kind.MULTIVECTOR) {
            return byGrade(x, y, tolerance);
        }
        var bx = (AbstractBlade) x;
        var by = (AbstractBlade) y;
        if (bx.grade() != by.grade()) {
            return false;
        }
        if (bx.kind().isScalar() || bx.kind() == Kind.PSEUDOSCALAR) {
            return tolerance.isApprox(bx.volume(), by.volume());
        }
        var d = LINEAR_ALGEBRA.determinant(
        Matrices.transposeTimes(((Blade) bx).unsafeBasis(), ((Blade) by).unsafeBasis()));
        return tolerance.isApprox(bx.volume(), by.volume() * d) && tolerance.isApprox(by.volume(),
                                                                                       bx.volume() * d);
    }

    private static boolean byGrade(Multivector x, Multivector y, Tolerance tolerance) {
        var dim = Math.max(x.dim(), y.dim());
        var grades = new TreeSet<Integer>(x.grades());
        grades.addAll(y.grades());
        for (var k : grades) {
            var xs = x.kVector(k);
            var ys = y.kVector(k);
            if (xs.size() == 1 && ys.size() == 1) {
                if (!isApprox(xs.get(0), ys.get(0), tolerance)) {
                    return false;
                }
            } else if (!tolerance.isApprox(pluecker(xs, dim, k), pluecker(ys, dim, k))) {
                return false;
            }
        }
        return true;
    }

    /**
     * The Plücker coordinates of the sum of the grade k blades: for every k element subset of the coordinate
     * axes, in lexicographic order, the sum of the blades' volume weighted k x k minors
     */
    static double[] pluecker(List<AbstractBlade> blades, int dim, int k) {
        var subsets = subsets(dim, k);
        var coordinates = new double[subsets.size()];
        for (var blade : blades) {
            if (blade.kind().isScalar() || blade.kind() == Kind.PSEUDOSCALAR) {
                coordinates[0] += blade.volume();
                continue;
            }
            var basis = ((Blade) blade).unsafeBasis();
            for (int s = 0; s < coordinates.length; s++) {
                var rows = subsets.get(s);
                var minor = new double[k][];
                for (int i = 0; i < k; i++) {
                    minor[i] = basis[rows[i]];
                }
                coordinates[s] += blade.volume() * LINEAR_ALGEBRA.determinant(minor);
            }
        }
        return coordinates;
    }

    private static void subsets(int from, int dim, int[] current, int depth, List<int[]> result) {
        if (depth == current.length) {
            result.add(current.clone());
            return;
        }
        for (int i = from; i < dim; i++) {
            current[depth] = i;
            subsets(i + 1, dim, current, depth + 1, result);
        }
    }

    private static List<int[]> subsets(int dim, int k) {
        var result = new ArrayList<int[]>();
        subsets(0, dim, new int[k], 0, result);
        return result;
    }

    private Comparison() {
    }
}
