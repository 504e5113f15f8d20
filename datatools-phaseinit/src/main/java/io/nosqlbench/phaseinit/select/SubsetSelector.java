package io.nosqlbench.phaseinit.select;

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

import io.nosqlbench.phaseinit.InvalidInputException;

import java.util.Arrays;

/// # SubsetSelector
///
/// Ranks measurements by magnitude and marks the low-magnitude fraction.
///
/// ## Policy
/// 1. Sort measurement indices by magnitude, descending. The sort is stable, so
///    equal magnitudes keep their original index order.
/// 2. The first `round(m * gamma)` sorted positions (largest magnitudes) are excluded.
/// 3. The remaining `m - round(m * gamma)` positions are included.
///
/// With `inclusiveBoundary` the included tail starts one position earlier, which
/// keeps one more measurement. This is the boundary a 1-based
/// `idx(round(m*gamma):end)` selection produces.
///
/// Few measurements relative to the signal dimension give a poorly conditioned
/// null operator. That is a quality concern and is not treated as an error here.
public final class SubsetSelector {

    public static final double DEFAULT_GAMMA = 0.5;

    private final double gamma;
    private final boolean inclusiveBoundary;

    public SubsetSelector() {
        this(DEFAULT_GAMMA, false);
    }

    /// @param gamma fraction of measurements to exclude, strictly within (0,1)
    /// @param inclusiveBoundary start the included tail one position earlier
    /// @throws InvalidInputException if gamma is outside (0,1)
    public SubsetSelector(double gamma, boolean inclusiveBoundary) {
        if (!(gamma > 0.0 && gamma < 1.0)) {
            throw new InvalidInputException("gamma must lie strictly between 0 and 1, was " + gamma);
        }
        this.gamma = gamma;
        this.inclusiveBoundary = inclusiveBoundary;
    }

    public double gamma() {
        return gamma;
    }

    public boolean isInclusiveBoundary() {
        return inclusiveBoundary;
    }

    /// @param m measurement count
    /// @return sorted position where the included tail begins
    public int boundary(int m) {
        int start = (int) Math.round(m * gamma);
        if (inclusiveBoundary) {
            start = Math.max(start - 1, 0);
        }
        return Math.min(start, m);
    }

    /// Builds the selection mask for the given measurements.
    ///
    /// @param b0 non-negative measurement magnitudes; not modified
    /// @return mask with ones at the smallest magnitudes
    /// @throws InvalidInputException if b0 is null, empty, or has negative or NaN entries
    public SelectionMask select(double[] b0) {
        validateMeasurements(b0);
        int m = b0.length;

        Integer[] order = new Integer[m];
        for (int i = 0; i < m; i++) {
            order[i] = i;
        }
        // Arrays.sort on objects is a stable merge sort
        Arrays.sort(order, (a, b) -> Double.compare(b0[b], b0[a]));

        boolean[] included = new boolean[m];
        for (int pos = boundary(m); pos < m; pos++) {
            included[order[pos]] = true;
        }
        return new SelectionMask(included);
    }

    /// @param b0 measurement magnitudes
    /// @throws InvalidInputException if b0 is null, empty, or has a negative, NaN, or infinite entry
    public static void validateMeasurements(double[] b0) {
        if (b0 == null || b0.length == 0) {
            throw new InvalidInputException("Measurement vector b0 must not be empty");
        }
        for (int i = 0; i < b0.length; i++) {
            double v = b0[i];
            if (!(v >= 0.0) || Double.isInfinite(v)) {
                throw new InvalidInputException("Measurement b0[" + i + "] must be a finite non-negative value, was " + v);
            }
        }
    }
}
