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
 * Base of the closed hierarchy of algebra failures. All are contract violations by the caller and are
 * surfaced synchronously; nothing is retried.
 *
 * @author hal.hildebrand
 */
public sealed class GeometricAlgebraException extends RuntimeException
permits DimensionMismatchException, ContainmentException, UndefinedOperationException {

    public GeometricAlgebraException(String message) {
        super(message);
    }

    public GeometricAlgebraException(String message, Throwable cause) {
        super(message, cause);
    }
}
