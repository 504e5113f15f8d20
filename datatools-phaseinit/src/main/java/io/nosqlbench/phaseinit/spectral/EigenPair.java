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

/**
 * An approximate eigenpair returned by {@link LanczosEigenSolver}.
 *
 * @param value Rayleigh quotient of {@code vector}
 * @param vector unit-norm eigenvector estimate
 * @param residual true residual norm {@code ||Y v - value v||}
 * @param restarts restart cycles used after the first
 * @param operatorApplications number of {@code Y x} products performed
 */
public record EigenPair(
    double value,
    ComplexVector vector,
    double residual,
    int restarts,
    int operatorApplications
) {
}
