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

import io.nosqlbench.phaseinit.DegenerateScaleException;
import io.nosqlbench.phaseinit.DimensionMismatchException;
import io.nosqlbench.phaseinit.linalg.ComplexVector;
import io.nosqlbench.phaseinit.operator.SensingOperator;
import io.nosqlbench.phaseinit.select.SelectionMask;

/**
 * Least-squares magnitude fit over the held-out (excluded) measurements.
 *
 * <p>With {@code b = (1-I) .* b0} and {@code Ax = |(1-I) .* A x|}, the real scalar
 * minimizing {@code ||s Ax - b||^2} is
 * <pre>{@code
 *   s = (Ax' b) / (Ax' Ax)
 * }</pre>
 *
 * <p>Because every term is non-negative the fitted scale is never negative. A
 * vector that is already magnitude-matched fits with {@code s = 1}.
 */
public final class MagnitudeRescaler {

    private static final double EPSILON = Math.ulp(1.0);

    private MagnitudeRescaler() {
        // Utility class
    }

    /**
     * Fits the magnitude scale of a candidate signal.
     *
     * @param operator sensing operator A
     * @param mask selection mask; excluded entries take part in the fit
     * @param b0 measurement magnitudes
     * @param x candidate signal
     * @return the least-squares scale
     * @throws DegenerateScaleException if the held-out model magnitudes are numerically
     *                                  zero, or the scale is zero or not finite
     */
    public static double fitScale(SensingOperator operator, SelectionMask mask, double[] b0, ComplexVector x) {
        if (mask.size() != b0.length) {
            throw new DimensionMismatchException("selection mask", b0.length, mask.size());
        }
        double[] magnitudes = operator.apply(x).magnitudes();
        if (magnitudes.length != b0.length) {
            throw new DimensionMismatchException("forward result", b0.length, magnitudes.length);
        }

        double numerator = 0.0;
        double denominator = 0.0;
        double total = 0.0;
        for (int i = 0; i < magnitudes.length; i++) {
            double ax = magnitudes[i];
            total += ax * ax;
            if (!mask.isIncluded(i)) {
                numerator += ax * b0[i];
                denominator += ax * ax;
            }
        }

        if (denominator == 0.0 || denominator <= EPSILON * EPSILON * total) {
            throw new DegenerateScaleException("Held-out model magnitudes are numerically zero", numerator, denominator);
        }
        double scale = numerator / denominator;
        if (scale == 0.0 || !Double.isFinite(scale)) {
            throw new DegenerateScaleException("Fitted magnitude scale is zero or not finite", numerator, denominator);
        }
        return scale;
    }

    /**
     * Returns {@code s * x} where {@code s} is {@link #fitScale}.
     */
    public static ComplexVector rescale(SensingOperator operator, SelectionMask mask, double[] b0, ComplexVector x) {
        return x.scale(fitScale(operator, mask, b0, x));
    }
}
