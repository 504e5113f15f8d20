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

package io.nosqlbench.phaseinit.spectral;

import io.nosqlbench.phaseinit.DegenerateScaleException;
import io.nosqlbench.phaseinit.DimensionMismatchException;
import io.nosqlbench.phaseinit.linalg.ComplexVector;
import io.nosqlbench.phaseinit.operator.DenseMatrixOperator;
import io.nosqlbench.phaseinit.operator.SensingOperator;
import io.nosqlbench.phaseinit.select.SelectionMask;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;

@Tag("unit")
public class MagnitudeRescalerTest {

    private static final long SEED = 42L;

    private final SensingOperator a = new DenseMatrixOperator(new double[][]{{1, 0}, {0, 1}, {0, 2}});
    private final SelectionMask firstExcluded = new SelectionMask(new boolean[]{false, true, true});

    @Test
    void fitsLeastSquaresScale() {
        // held-out row 0 only: |x0| = 0.5 against b = 2 gives s = 4
        double scale = MagnitudeRescaler.fitScale(a, firstExcluded, new double[]{2.0, 9.0, 9.0},
            ComplexVector.ofReal(0.5, 0.3));
        assertThat(scale).isCloseTo(4.0, within(1e-12));
    }

    @Test
    void rescalingTwiceGivesUnitScale() {
        Random rng = new Random(SEED);
        double[][] matrix = new double[30][5];
        for (double[] row : matrix) {
            for (int c = 0; c < row.length; c++) {
                row[c] = rng.nextGaussian();
            }
        }
        SensingOperator op = new DenseMatrixOperator(matrix);
        double[] b0 = new double[30];
        boolean[] included = new boolean[30];
        for (int i = 0; i < b0.length; i++) {
            b0[i] = Math.abs(rng.nextGaussian()) * 3.0;
            included[i] = i % 2 == 0;
        }
        SelectionMask mask = new SelectionMask(included);

        ComplexVector once = MagnitudeRescaler.rescale(op, mask, b0, ComplexVector.ofReal(1, -1, 0.5, 2, 0).normalize());
        double again = MagnitudeRescaler.fitScale(op, mask, b0, once);
        assertThat(again).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void zeroMeasurementsAreDegenerate() {
        assertThatThrownBy(() -> MagnitudeRescaler.fitScale(a, firstExcluded, new double[3], ComplexVector.ofReal(1.0, 0.0)))
            .isInstanceOf(DegenerateScaleException.class)
            .hasMessageContaining("zero");
    }

    @Test
    void zeroHeldOutModelMagnitudesAreDegenerate() {
        DegenerateScaleException e = assertThrows(DegenerateScaleException.class,
            () -> MagnitudeRescaler.fitScale(a, firstExcluded, new double[]{1.0, 1.0, 1.0}, ComplexVector.ofReal(0.0, 1.0)));
        assertThat(e.getDenominator()).isEqualTo(0.0);
    }

    @Test
    void lengthMismatchRejected() {
        assertThatThrownBy(() -> MagnitudeRescaler.fitScale(a, firstExcluded, new double[]{1.0, 1.0}, ComplexVector.ofReal(1.0, 0.0)))
            .isInstanceOf(DimensionMismatchException.class);
    }
}
