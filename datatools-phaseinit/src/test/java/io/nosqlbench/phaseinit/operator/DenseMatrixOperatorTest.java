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

package io.nosqlbench.phaseinit.operator;

import io.nosqlbench.phaseinit.DimensionMismatchException;
import io.nosqlbench.phaseinit.InvalidInputException;
import io.nosqlbench.phaseinit.linalg.ComplexVector;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class DenseMatrixOperatorTest {

    private static final long SEED = 42L;
    private static final double TOLERANCE = 1e-10;

    @Test
    public void testRealForwardAndAdjoint() {
        DenseMatrixOperator a = new DenseMatrixOperator(new double[][]{
            {1, 0}, {0, 1}, {1, 1}, {1, -1}
        });
        assertEquals(2, a.domainDimension());
        assertEquals(4, a.rangeDimension().getAsInt());
        assertTrue(a.isReal());

        ComplexVector y = a.apply(ComplexVector.ofReal(2.0, 3.0));
        assertArrayEquals(new double[]{2.0, 3.0, 5.0, -1.0}, y.real(), TOLERANCE);

        ComplexVector x = a.applyAdjoint(ComplexVector.ofReal(1.0, 1.0, 1.0, 1.0));
        assertArrayEquals(new double[]{3.0, 1.0}, x.real(), TOLERANCE);
    }

    @Test
    public void testComplexAdjointIdentity() {
        Random rng = new Random(SEED);
        int m = 7;
        int n = 4;
        double[][] re = new double[m][n];
        double[][] im = new double[m][n];
        for (int r = 0; r < m; r++) {
            for (int c = 0; c < n; c++) {
                re[r][c] = rng.nextGaussian();
                im[r][c] = rng.nextGaussian();
            }
        }
        DenseMatrixOperator a = new DenseMatrixOperator(re, im);
        assertFalse(a.isReal());

        ComplexVector x = randomComplex(rng, n);
        ComplexVector y = randomComplex(rng, m);

        // <A x, y> == <x, A^H y>
        Complex left = a.apply(x).dot(y);
        Complex right = x.dot(a.applyAdjoint(y));
        assertEquals(left.getReal(), right.getReal(), TOLERANCE);
        assertEquals(left.getImaginary(), right.getImaginary(), TOLERANCE);
    }

    @Test
    public void testMatrixIsCopied() {
        double[][] matrix = {{1, 2}};
        DenseMatrixOperator a = new DenseMatrixOperator(matrix);
        matrix[0][0] = 100;
        assertEquals(1.0, a.apply(ComplexVector.ofReal(1.0, 0.0)).re(0), 0.0);
    }

    @Test
    public void testRaggedMatrixRejected() {
        assertThrows(InvalidInputException.class,
            () -> new DenseMatrixOperator(new double[][]{{1, 2}, {3}}));
        assertThrows(InvalidInputException.class,
            () -> new DenseMatrixOperator(new double[0][]));
        assertThrows(InvalidInputException.class,
            () -> new DenseMatrixOperator(new double[][]{{1, 2}}, new double[][]{{1, 2}, {3, 4}}));
    }

    @Test
    public void testOperandLengthChecked() {
        DenseMatrixOperator a = new DenseMatrixOperator(new double[][]{{1, 2}, {3, 4}, {5, 6}});
        DimensionMismatchException e = assertThrows(DimensionMismatchException.class,
            () -> a.apply(ComplexVector.zeros(3)));
        assertEquals(2, e.getExpected());
        assertEquals(3, e.getActual());
        assertThrows(DimensionMismatchException.class, () -> a.applyAdjoint(ComplexVector.zeros(2)));
    }

    private static ComplexVector randomComplex(Random rng, int n) {
        double[] re = new double[n];
        double[] im = new double[n];
        for (int i = 0; i < n; i++) {
            re[i] = rng.nextGaussian();
            im[i] = rng.nextGaussian();
        }
        return ComplexVector.of(re, im);
    }
}
