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

/// Thrown when the eigensolver cannot reach its residual tolerance within the
/// configured number of restarts.
public class ConvergenceException extends PhaseInitException {

    private final int restarts;
    private final double residual;

    public ConvergenceException(int restarts, double residual, double threshold) {
        super(String.format("Eigensolver did not converge after %d restarts (residual %.3e, required %.3e)",
            restarts, residual, threshold));
        this.restarts = restarts;
        this.residual = residual;
    }

    public ConvergenceException(String message, Throwable cause) {
        super(message, cause);
        this.restarts = 0;
        this.residual = Double.NaN;
    }

    /// @return restart cycles performed before giving up
    public int getRestarts() {
        return restarts;
    }

    /// @return last measured residual norm, or NaN when the failure was not residual based
    public double getResidual() {
        return residual;
    }
}
