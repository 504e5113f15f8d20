package io.nosqlbench.phaseinit.spectral;

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

/// A square linear operator that is Hermitian, known only through its action on
/// vectors. This is all the eigensolver needs; the matrix is never formed.
public interface HermitianOperator {

    /// @return the dimension of the space the operator acts on
    int dimension();

    /// @param x a vector of dimension [#dimension()]
    /// @return `Y x`, a vector the caller may modify
    ComplexVector apply(ComplexVector x);
}
