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

import java.util.Arrays;

/// Immutable 0/1 vector over the measurements. Included entries (1) are the
/// low-magnitude measurements used to build the null operator; excluded entries
/// (0) are held out for the magnitude fit.
public final class SelectionMask {

    private final boolean[] included;
    private final int includedCount;

    /// @param included one flag per measurement; copied
    public SelectionMask(boolean[] included) {
        this.included = included.clone();
        int count = 0;
        for (boolean b : included) {
            if (b) count++;
        }
        this.includedCount = count;
    }

    /// @return m
    public int size() {
        return included.length;
    }

    public boolean isIncluded(int index) {
        return included[index];
    }

    /// @return the number of ones
    public int includedCount() {
        return includedCount;
    }

    public int excludedCount() {
        return included.length - includedCount;
    }

    /// @return a copy of the flags, true where included
    public boolean[] included() {
        return included.clone();
    }

    /// @return a copy of the complementary flags, true where excluded
    public boolean[] excluded() {
        boolean[] out = new boolean[included.length];
        for (int i = 0; i < included.length; i++) {
            out[i] = !included[i];
        }
        return out;
    }

    /// @return the mask as 0.0/1.0 values
    public double[] toDoubleArray() {
        double[] out = new double[included.length];
        for (int i = 0; i < included.length; i++) {
            out[i] = included[i] ? 1.0 : 0.0;
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SelectionMask)) return false;
        return Arrays.equals(included, ((SelectionMask) o).included);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(included);
    }

    @Override
    public String toString() {
        return "SelectionMask{m=" + included.length + ", included=" + includedCount + "}";
    }
}
