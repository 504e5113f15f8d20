package io.nosqlbench.phaseinit.operator;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.phaseinit.DimensionMismatchException;
import io.nosqlbench.phaseinit.InvalidInputException;
import io.nosqlbench.phaseinit.linalg.ComplexVector;

import java.util.Objects;
import java.util.OptionalInt;
import java.util.function.UnaryOperator;

/// A [SensingOperator] backed by caller-supplied forward and adjoint functions.
///
/// Nothing is inferred: the signal dimension is given explicitly, and the
/// measurement count is either given or left unknown. Every result is checked
/// against the known dimensions, so a function pair that disagrees with the
/// measurement vector is reported on its first application.
public final class FunctionalOperator implements SensingOperator {

    private final UnaryOperator<ComplexVector> forward;
    private final UnaryOperator<ComplexVector> adjoint;
    private final int domainDimension;
    private final Integer rangeDimension;

    /// @param forward `x -> A x`
    /// @param adjoint `y -> A^H y`
    /// @param domainDimension n
    /// @param rangeDimension m, or null if unknown
    public FunctionalOperator(UnaryOperator<ComplexVector> forward, UnaryOperator<ComplexVector> adjoint,
                              int domainDimension, Integer rangeDimension) {
        this.forward = Objects.requireNonNull(forward, "forward");
        this.adjoint = Objects.requireNonNull(adjoint, "adjoint");
        if (domainDimension <= 0) {
            throw new InvalidInputException("Signal dimension n must be positive, was " + domainDimension);
        }
        if (rangeDimension != null && rangeDimension <= 0) {
            throw new InvalidInputException("Measurement count m must be positive, was " + rangeDimension);
        }
        this.domainDimension = domainDimension;
        this.rangeDimension = rangeDimension;
    }

    /// @param m the measurement count to check results against
    /// @return a copy of this operator with a known range dimension
    public FunctionalOperator withRangeDimension(int m) {
        return new FunctionalOperator(forward, adjoint, domainDimension, m);
    }

    @Override
    public int domainDimension() {
        return domainDimension;
    }

    @Override
    public OptionalInt rangeDimension() {
        return rangeDimension == null ? OptionalInt.empty() : OptionalInt.of(rangeDimension);
    }

    @Override
    public ComplexVector apply(ComplexVector x) {
        if (x.dimension() != domainDimension) {
            throw new DimensionMismatchException("forward operand", domainDimension, x.dimension());
        }
        ComplexVector y = forward.apply(x);
        if (y == null) {
            throw new InvalidInputException("Forward operator returned null");
        }
        if (rangeDimension != null && y.dimension() != rangeDimension) {
            throw new DimensionMismatchException("forward result", rangeDimension, y.dimension());
        }
        return y;
    }

    @Override
    public ComplexVector applyAdjoint(ComplexVector y) {
        if (rangeDimension != null && y.dimension() != rangeDimension) {
            throw new DimensionMismatchException("adjoint operand", rangeDimension, y.dimension());
        }
        ComplexVector x = adjoint.apply(y);
        if (x == null) {
            throw new InvalidInputException("Adjoint operator returned null");
        }
        if (x.dimension() != domainDimension) {
            throw new DimensionMismatchException("adjoint result", domainDimension, x.dimension());
        }
        return x;
    }

    @Override
    public String toString() {
        return "FunctionalOperator{n=" + domainDimension + ", m=" + (rangeDimension == null ? "?" : rangeDimension) + "}";
    }
}
