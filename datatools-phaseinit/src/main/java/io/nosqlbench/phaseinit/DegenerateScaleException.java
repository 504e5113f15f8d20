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

/// Thrown when the least-squares magnitude fit has no meaningful solution: the
/// held-out model magnitudes are numerically zero, or the fitted scale is zero or
/// not finite.
public class DegenerateScaleException extends PhaseInitException {

    private final double numerator;
    private final double denominator;

    public DegenerateScaleException(String message, double numerator, double denominator) {
        super(String.format("%s (Ax'b=%.6g, Ax'Ax=%.6g)", message, numerator, denominator));
        this.numerator = numerator;
        this.denominator = denominator;
    }

    public double getNumerator() {
        return numerator;
    }

    public double getDenominator() {
        return denominator;
    }
}
