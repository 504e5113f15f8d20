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

/// Thrown when vector lengths do not agree with the sensing operator, such as a
/// measurement vector whose length differs from the operator's row count.
public class DimensionMismatchException extends PhaseInitException {

    private final String what;
    private final int expected;
    private final int actual;

    public DimensionMismatchException(String what, int expected, int actual) {
        super(String.format("Dimension mismatch for %s: expected %d but was %d", what, expected, actual));
        this.what = what;
        this.expected = expected;
        this.actual = actual;
    }

    public String getWhat() {
        return what;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
