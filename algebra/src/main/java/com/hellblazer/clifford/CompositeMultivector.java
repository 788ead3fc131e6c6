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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A sum of blades of possibly differing grades, grouped by grade. Built by {@link Multivectors}, which
 * guarantees at least two terms and at most one term in each of the grade 0, 1 and dim slots. Intermediate
 * grades may hold several blades.
 *
 * @author hal.hildebrand
 */
public final class CompositeMultivector implements Multivector {
    private final int                                   dim;
    private final double                                norm;
    private final SortedMap<Integer, List<AbstractBlade>> parts;
    private final Precision                             precision;

    CompositeMultivector(int dim, TreeMap<Integer, List<AbstractBlade>> parts, double norm, Precision precision) {
        this.dim = dim;
        var copy = new TreeMap<Integer, List<AbstractBlade>>();
        parts.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        this.parts = Collections.unmodifiableSortedMap(copy);
        this.norm = norm;
        this.precision = precision;
    }

    @Override
    public List<AbstractBlade> blades() {
        var result = new ArrayList<AbstractBlade>();
        parts.values().forEach(result::addAll);
        return Collections.unmodifiableList(result);
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
        if (!(obj instanceof CompositeMultivector other)) {
            return false;
        }
        return dim == other.dim && precision == other.precision && parts.equals(other.parts);
    }

    @Override
    public List<Integer> grades() {
        return List.copyOf(parts.keySet());
    }

    @Override
    public int hashCode() {
        return Objects.hash(dim, precision, parts);
    }

    @Override
    public Kind kind() {
        return Kind.MULTIVECTOR;
    }

    @Override
    public List<AbstractBlade> kVector(int k) {
        return parts.getOrDefault(k, List.of());
    }

    @Override
    public double norm() {
        return norm;
    }

    /**
     * @return the unmodifiable grade to blades mapping, ascending by grade
     */
    public SortedMap<Integer, List<AbstractBlade>> parts() {
        return parts;
    }

    @Override
    public Precision precision() {
        return precision;
    }

    @Override
    public String toString() {
        return String.format("CompositeMultivector [dim=%s, grades=%s, norm=%s, precision=%s]", dim, parts.keySet(),
                             norm, precision);
    }
}
