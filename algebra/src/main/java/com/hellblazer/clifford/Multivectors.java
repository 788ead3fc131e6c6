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
import com.hellblazer.clifford.common.linear.LinearAlgebra;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.TreeMap;

/**
 * Factory for sums of blades. The answer is the most specific kind that represents the sum: {@link Zero} for an
 * empty or cancelling sum, a single scalar for an all scalar sum, the term itself when only one term remains,
 * and otherwise a {@link CompositeMultivector}.
 * <p>
 * Terms are grouped by grade in ascending order. Zero volume terms are dropped and the grade 0, 1 and dim parts
 * are each reduced to a single blade. Intermediate grades are kept as supplied.
 *
 * @author hal.hildebrand
 */
public final class Multivectors {
    private static final Logger log = LoggerFactory.getLogger(Multivectors.class);

    public static Multivector of(Multivector... terms) {
        return of(Arrays.asList(terms));
    }

    /**
     * @param terms - the summands; composite multivectors contribute their blades
     * @throws DimensionMismatchException if the non-scalar terms do not share a dimension
     */
    public static Multivector of(Collection<? extends Multivector> terms) {
        var blades = new ArrayList<AbstractBlade>();
        var precision = terms.isEmpty() ? Precision.DOUBLE : null;
        Integer dim = null;
        for (var term : terms) {
            precision = precision == null ? term.precision() : Precision.widest(precision, term.precision());
            for (var blade : term.blades()) {
                if (!blade.kind().isScalar()) {
                    if (dim == null) {
                        dim = blade.dim();
                    } else if (dim != blade.dim()) {
                        throw new DimensionMismatchException("Non-scalar terms have differing dimensions", dim,
                                                             blade.dim());
                    }
                }
                blades.add(blade);
            }
        }

        if (blades.isEmpty()) {
            return Zero.of(precision);
        }
        if (dim == null) {
            var sum = 0.0;
            for (var blade : blades) {
                sum += blade.volume();
            }
            return Scalar.of(sum, precision);
        }

        var parts = new TreeMap<Integer, List<AbstractBlade>>();
        for (var blade : blades) {
            if (blade.volume() == 0.0) {
                continue;
            }
            parts.computeIfAbsent(blade.grade(), k -> new ArrayList<>()).add(Arithmetic.convert(blade, precision));
        }

        for (var k : new LinkedHashSet<>(List.of(0, 1, dim))) {
            var kVectors = parts.get(k);
            if (kVectors == null || kVectors.size() == 1) {
                continue;
            }
            AbstractBlade sum = kVectors.get(0);
            for (int i = 1; i < kVectors.size(); i++) {
                final var augend = sum;
                final var addend = kVectors.get(i);
                sum = Arithmetic.combine(augend, addend)
                                .orElseThrow(() -> new IllegalStateException(
                                "Grade " + addend.grade() + " terms must combine: " + augend + ", " + addend));
            }
            log.trace("Reduced {} grade {} terms to {}", kVectors.size(), k, sum);
            if (sum.volume() == 0.0) {
                parts.remove(k);
            } else {
                parts.put(k, List.of(sum));
            }
        }

        if (parts.isEmpty()) {
            return Zero.of(precision);
        }
        if (parts.size() == 1) {
            var only = parts.firstEntry().getValue();
            if (only.size() == 1) {
                return only.get(0);
            }
        }

        var norms = parts.values().stream().flatMap(List::stream).mapToDouble(AbstractBlade::norm).toArray();
        return new CompositeMultivector(dim, parts, LinearAlgebra.DEFAULT.norm(norms), precision);
    }

    private Multivectors() {
    }
}
