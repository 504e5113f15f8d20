package io.nosqlbench.phaseinit;

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
import io.nosqlbench.phaseinit.select.SelectionMask;

/**
 * Outcome of one null initializer run.
 *
 * @param estimate the signal estimate {@code x0}, rescaled unless rescaling was disabled
 * @param mask the measurement subset used to build the null operator
 * @param eigenvalue smallest eigenvalue estimate of {@code A^H diag(I) A}
 * @param residual eigensolver residual norm at convergence
 * @param restarts eigensolver restarts used
 * @param operatorApplications null operator products performed by the eigensolver
 * @param scale magnitude scale applied to the unit eigenvector, 1.0 when not rescaled
 */
public record InitializerResult(
    ComplexVector estimate,
    SelectionMask mask,
    double eigenvalue,
    double residual,
    int restarts,
    int operatorApplications,
    double scale
) {

    /**
     * @return the real part of the estimate, for real-valued problems
     */
    public double[] realEstimate() {
        return estimate.real();
    }
}
