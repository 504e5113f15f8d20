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

import io.nosqlbench.phaseinit.DimensionMismatchException;
import io.nosqlbench.phaseinit.linalg.ComplexVector;
import io.nosqlbench.phaseinit.operator.SensingOperator;
import io.nosqlbench.phaseinit.select.SelectionMask;

import java.util.OptionalInt;

/// The null operator `Y = A^H diag(I) A`, applied as
/// `x -> applyAdjoint(I .* apply(x))`.
///
/// `Y` is Hermitian and positive semi-definite whenever the sensing operator's
/// adjoint is exact. Its smallest eigenvector is the direction most orthogonal to
/// the selected low-magnitude measurement rows.
public final class MaskedGramOperator implements HermitianOperator {

    private final SensingOperator sensing;
    private final boolean[] included;

    /// @param sensing the sensing operator A
    /// @param mask selection over A's rows
    /// @throws DimensionMismatchException if A's known row count differs from the mask size
    public MaskedGramOperator(SensingOperator sensing, SelectionMask mask) {
        OptionalInt range = sensing.rangeDimension();
        if (range.isPresent() && range.getAsInt() != mask.size()) {
            throw new DimensionMismatchException("selection mask", range.getAsInt(), mask.size());
        }
        this.sensing = sensing;
        this.included = mask.included();
    }

    @Override
    public int dimension() {
        return sensing.domainDimension();
    }

    @Override
    public ComplexVector apply(ComplexVector x) {
        ComplexVector ax = sensing.apply(x);
        if (ax.dimension() != included.length) {
            throw new DimensionMismatchException("forward result", included.length, ax.dimension());
        }
        return sensing.applyAdjoint(ax.retain(included));
    }
}
