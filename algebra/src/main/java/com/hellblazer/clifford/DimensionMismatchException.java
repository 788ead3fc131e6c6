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

/**
 * Thrown when a binary operator receives two operands of differing ambient dimension.
 *
 * @author hal.hildebrand
 */
public final class DimensionMismatchException extends GeometricAlgebraException {
    private final int left;
    private final int right;

    public DimensionMismatchException(int left, int right) {
        super("Dimension mismatch: " + left + " != " + right);
        this.left = left;
        this.right = right;
    }

    public DimensionMismatchException(String message, int left, int right) {
        super(message + ": " + left + " != " + right);
        this.left = left;
        this.right = right;
    }

    public int getLeft() {
        return left;
    }

    public int getRight() {
        return right;
    }
}
