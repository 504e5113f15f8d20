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

import java.util.OptionalInt;
import java.util.function.UnaryOperator;

/// # SensingOperators
///
/// Normalizes the two accepted operator forms into a [SensingOperator]:
///
/// | Input | Signal dimension | Adjoint |
/// |-------|------------------|---------|
/// | dense matrix | inferred from the column count | conjugate transpose |
/// | function pair | must be supplied | must be supplied |
///
/// After adaptation the rest of the pipeline does not care whether the operator
/// is an explicit matrix or a large implicit transform.
public final class SensingOperators {

    private SensingOperators() {
        // Utility class
    }

    /// @param matrix real m x n matrix, row-major
    /// @return a dense operator with n inferred from the column count
    public static SensingOperator dense(double[][] matrix) {
        return new DenseMatrixOperator(matrix);
    }

    /// @param re real part, row-major
    /// @param im imaginary part, or null
    /// @return a dense complex operator with n inferred from the column count
    public static SensingOperator dense(double[][] re, double[][] im) {
        return new DenseMatrixOperator(re, im);
    }

    /// Adapts a forward/adjoint function pair.
    ///
    /// @param forward `x -> A x`
    /// @param adjoint `y -> A^H y`, required
    /// @param n signal dimension, required
    /// @return a function-backed operator
    /// @throws InvalidInputException if any argument is missing or n is not positive
    public static SensingOperator of(UnaryOperator<ComplexVector> forward,
                                     UnaryOperator<ComplexVector> adjoint,
                                     Integer n) {
        if (forward == null) {
            throw new InvalidInputException("A forward operator is required");
        }
        if (adjoint == null) {
            throw new InvalidInputException("The adjoint operator must be provided when A is given as a function");
        }
        if (n == null) {
            throw new InvalidInputException("The signal dimension n must be provided when A is given as a function");
        }
        return new FunctionalOperator(forward, adjoint, n, null);
    }

    /// Adapts a pair of real-valued functions. Complex arguments are handled by
    /// linearity, applying the function to the real and imaginary parts separately.
    ///
    /// @param forward real `x -> A x`
    /// @param adjoint real `y -> A^T y`, required
    /// @param n signal dimension, required
    /// @return a function-backed operator
    public static SensingOperator ofReal(UnaryOperator<double[]> forward,
                                         UnaryOperator<double[]> adjoint,
                                         Integer n) {
        if (forward == null) {
            throw new InvalidInputException("A forward operator is required");
        }
        if (adjoint == null) {
            throw new InvalidInputException("The adjoint operator must be provided when A is given as a function");
        }
        return of(lift(forward), lift(adjoint), n);
    }

    private static UnaryOperator<ComplexVector> lift(UnaryOperator<double[]> real) {
        return v -> {
            double[] re = real.apply(v.real());
            if (re == null) {
                return null;
            }
            if (v.isReal()) {
                return ComplexVector.wrap(re, new double[re.length]);
            }
            double[] im = real.apply(v.imaginary());
            if (im == null) {
                return null;
            }
            if (im.length != re.length) {
                throw new DimensionMismatchException("imaginary part of lifted result", re.length, im.length);
            }
            return ComplexVector.wrap(re, im);
        };
    }

    /// Binds an operator to a measurement count.
    ///
    /// Operators that know their row count are checked immediately. Function-backed
    /// operators are returned with the range fixed, so that every later application
    /// verifies its result length.
    ///
    /// @param operator the adapted operator
    /// @param m number of measurements
    /// @return an operator whose range is m
    /// @throws DimensionMismatchException if the operator's known row count is not m
    public static SensingOperator withMeasurementCount(SensingOperator operator, int m) {
        OptionalInt range = operator.rangeDimension();
        if (range.isPresent()) {
            if (range.getAsInt() != m) {
                throw new DimensionMismatchException("measurement vector", range.getAsInt(), m);
            }
            return operator;
        }
        if (operator instanceof FunctionalOperator) {
            return ((FunctionalOperator) operator).withRangeDimension(m);
        }
        return new RangeCheckedOperator(operator, m);
    }

    private static final class RangeCheckedOperator implements SensingOperator {
        private final SensingOperator delegate;
        private final int m;

        private RangeCheckedOperator(SensingOperator delegate, int m) {
            this.delegate = delegate;
            this.m = m;
        }

        @Override
        public int domainDimension() {
            return delegate.domainDimension();
        }

        @Override
        public OptionalInt rangeDimension() {
            return OptionalInt.of(m);
        }

        @Override
        public ComplexVector apply(ComplexVector x) {
            ComplexVector y = delegate.apply(x);
            if (y.dimension() != m) {
                throw new DimensionMismatchException("forward result", m, y.dimension());
            }
            return y;
        }

        @Override
        public ComplexVector applyAdjoint(ComplexVector y) {
            if (y.dimension() != m) {
                throw new DimensionMismatchException("adjoint operand", m, y.dimension());
            }
            ComplexVector x = delegate.applyAdjoint(y);
            if (x.dimension() != delegate.domainDimension()) {
                throw new DimensionMismatchException("adjoint result", delegate.domainDimension(), x.dimension());
            }
            return x;
        }
    }
}
