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

package io.nosqlbench.phaseinit.linalg;

import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class ComplexVectorTest {

    private static final double TOLERANCE = 1e-12;

    @Test
    public void testDotIsConjugateLinearInFirstArgument() {
        ComplexVector a = ComplexVector.of(new double[]{1.0, 0.0}, new double[]{1.0, 2.0});
        ComplexVector b = ComplexVector.of(new double[]{3.0, 1.0}, new double[]{0.0, -1.0});

        // conj(1+i)*3 + conj(2i)*(1-i) = (3-3i) + (-2i)(1-i) = (3-3i) + (-2-2i) = 1-5i
        Complex dot = a.dot(b);
        assertEquals(1.0, dot.getReal(), TOLERANCE);
        assertEquals(-5.0, dot.getImaginary(), TOLERANCE);

        Complex self = a.dot(a);
        assertEquals(a.squaredNorm(), self.getReal(), TOLERANCE);
        assertEquals(0.0, self.getImaginary(), TOLERANCE);
    }

    @Test
    public void testNormAndMagnitudes() {
        ComplexVector v = ComplexVector.of(new double[]{3.0, 0.0}, new double[]{4.0, -2.0});
        assertEquals(Math.sqrt(29.0), v.norm(), TOLERANCE);
        assertArrayEquals(new double[]{5.0, 2.0}, v.magnitudes(), TOLERANCE);
    }

    @Test
    public void testComplexScale() {
        ComplexVector v = ComplexVector.ofReal(1.0, 2.0);
        ComplexVector rotated = v.scale(Complex.I);
        assertArrayEquals(new double[]{0.0, 0.0}, rotated.real(), TOLERANCE);
        assertArrayEquals(new double[]{1.0, 2.0}, rotated.imaginary(), TOLERANCE);
        assertFalse(rotated.isReal());
        assertTrue(v.isReal());
    }

    @Test
    public void testRetainZeroesExcludedEntries() {
        ComplexVector v = ComplexVector.of(new double[]{1.0, 2.0, 3.0}, new double[]{1.0, 1.0, 1.0});
        ComplexVector kept = v.retain(new boolean[]{true, false, true});
        assertArrayEquals(new double[]{1.0, 0.0, 3.0}, kept.real(), 0.0);
        assertArrayEquals(new double[]{1.0, 0.0, 1.0}, kept.imaginary(), 0.0);
    }

    @Test
    public void testInPlaceUpdates() {
        ComplexVector w = ComplexVector.ofReal(1.0, 1.0);
        w.subtractScaled(new Complex(0.0, 1.0), ComplexVector.ofReal(1.0, 0.0));
        assertEquals(new Complex(1.0, -1.0), w.get(0));
        w.addScaled(2.0, ComplexVector.ofReal(0.0, 1.0));
        assertEquals(3.0, w.re(1), TOLERANCE);
        w.scaleInPlace(0.5);
        assertEquals(1.5, w.re(1), TOLERANCE);
    }

    @Test
    public void testFactoriesCopyTheirInput() {
        double[] values = {1.0, 2.0};
        ComplexVector v = ComplexVector.ofReal(values);
        values[0] = 99.0;
        assertEquals(1.0, v.re(0), 0.0);
    }

    @Test
    public void testDimensionMismatch() {
        ComplexVector a = ComplexVector.zeros(2);
        ComplexVector b = ComplexVector.zeros(3);
        assertThrows(IllegalArgumentException.class, () -> a.dot(b));
        assertThrows(IllegalArgumentException.class, () -> ComplexVector.of(new double[2], new double[3]));
    }

    @Test
    public void testNormalizeZeroVector() {
        assertThrows(IllegalStateException.class, () -> ComplexVector.zeros(3).normalize());
    }
}
