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

import io.nosqlbench.phaseinit.linalg.ComplexVector;

import java.util.OptionalInt;

/// # SensingOperator
///
/// A linear map from an n-dimensional signal space to m measurements, together
/// with its adjoint (conjugate transpose).
///
/// ## Contract
/// - `applyAdjoint` must be the exact adjoint of `apply`:
///   `<A x, y> == <x, A^H y>` for every `x`, `y`.
/// - Implementations must not retain or mutate their arguments.
/// - Both methods should be pure functions of their input, so that a single
///   operator can serve concurrent initializations.
///
/// Dense matrices are adapted by [DenseMatrixOperator]; caller-supplied
/// function pairs by [FunctionalOperator]. See [SensingOperators] for the
/// validating factories.
public interface SensingOperator {

    /// @return n, the signal dimension (column count)
    int domainDimension();

    /// @return m, the measurement count (row count), when the operator knows it
    OptionalInt rangeDimension();

    /// Forward application `A x`.
    /// @param x a vector of dimension [#domainDimension()]
    /// @return a new vector of dimension m
    ComplexVector apply(ComplexVector x);

    /// Adjoint application `A^H y`.
    /// @param y a vector of dimension m
    /// @return a new vector of dimension [#domainDimension()]
    ComplexVector applyAdjoint(ComplexVector y);
}
