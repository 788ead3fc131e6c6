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

import java.util.List;

/**
 * An element of the geometric algebra. Every value - scalar, blade, pseudoscalar or sum of blades - is a
 * multivector. Values are immutable; operators live in {@link Algebra} and always answer new values.
 * <p>
 * Factories canonicalize: a constructed value is always of the most specific kind. A
 * {@link CompositeMultivector} therefore always has at least two terms, and a zero valued scalar is always
 * {@link Zero}. Callers dispatch on {@link #kind()} rather than assuming a concrete type.
 *
 * @author hal.hildebrand
 */
public sealed interface Multivector permits AbstractBlade, CompositeMultivector {

    /**
     * @return the blades that sum to the receiver, in ascending grade order
     */
    List<AbstractBlade> blades();

    /**
     * @return the dimension of the ambient space, 0 for scalars
     */
    int dim();

    /**
     * @return the grades of the receiver's terms, ascending
     */
    List<Integer> grades();

    Kind kind();

    /**
     * @return the blades of grade k, empty if the receiver has no grade k part
     */
    List<AbstractBlade> kVector(int k);

    double norm();

    Precision precision();
}
