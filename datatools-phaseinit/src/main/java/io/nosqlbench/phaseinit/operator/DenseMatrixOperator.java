package io.nosqlbench.phaseinit.operator;

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

import io.nosqlbench.phaseinit.DimensionMismatchException;
import io.nosqlbench.phaseinit.InvalidInputException;
import io.nosqlbench.phaseinit.linalg.ComplexVector;

import java.util.OptionalInt;

/// Wraps an explicit m x n matrix, real or complex, as a [SensingOperator].
///
/// The forward map is the matrix-vector product and the adjoint is the
/// conjugate-transpose product. The signal dimension is the column count.
/// Matrix rows are copied on construction.
public final class DenseMatrixOperator implements SensingOperator {

    private final int rows;
    private final int cols;
    private final double[][] re;
    private final double[][] im;

    /// @param re real matrix, row-major
    public DenseMatrixOperator(double[][] re) {
        this(re, null);
    }

    /// @param re real part, row-major
    /// @param im imaginary part with the same shape, or null for a real matrix
    /// @throws InvalidInputException if the matrix is empty, ragged, or the parts differ in shape
    public DenseMatrixOperator(double[][] re, double[][] im) {
        if (re == null || re.length == 0 || re[0] == null || re[0].length == 0) {
            throw new InvalidInputException("Sensing matrix must have at least one row and one column");
        }
        this.rows = re.length;
        this.cols = re[0].length;
        this.re = copyChecked(re, rows, cols, "real part");
        if (im != null) {
            if (im.length != rows) {
                throw new InvalidInputException("Imaginary part has " + im.length + " rows, real part has " + rows);
            }
            this.im = copyChecked(im, rows, cols, "imaginary part");
        } else {
            this.im = null;
        }
    }

    private static double[][] copyChecked(double[][] matrix, int rows, int cols, String label) {
        double[][] copy = new double[rows][];
        for (int r = 0; r < rows; r++) {
            if (matrix[r] == null || matrix[r].length != cols) {
                throw new InvalidInputException("Row " + r + " of the " + label + " does not have " + cols + " columns");
            }
            copy[r] = matrix[r].clone();
        }
        return copy;
    }

    public boolean isReal() {
        return im == null;
    }

    @Override
    public int domainDimension() {
        return cols;
    }

    @Override
    public OptionalInt rangeDimension() {
        return OptionalInt.of(rows);
    }

    @Override
    public ComplexVector apply(ComplexVector x) {
        if (x.dimension() != cols) {
            throw new DimensionMismatchException("forward operand", cols, x.dimension());
        }
        double[] yr = new double[rows];
        double[] yi = new double[rows];
        for (int r = 0; r < rows; r++) {
            double[] ar = re[r];
            double[] ai = im == null ? null : im[r];
            double sr = 0.0;
            double si = 0.0;
            for (int c = 0; c < cols; c++) {
                double xr = x.re(c);
                double xi = x.im(c);
                sr += ar[c] * xr;
                si += ar[c] * xi;
                if (ai != null) {
                    sr -= ai[c] * xi;
                    si += ai[c] * xr;
                }
            }
            yr[r] = sr;
            yi[r] = si;
        }
        return ComplexVector.wrap(yr, yi);
    }

    @Override
    public ComplexVector applyAdjoint(ComplexVector y) {
        if (y.dimension() != rows) {
            throw new DimensionMismatchException("adjoint operand", rows, y.dimension());
        }
        double[] xr = new double[cols];
        double[] xi = new double[cols];
        for (int r = 0; r < rows; r++) {
            double yr = y.re(r);
            double yi = y.im(r);
            if (yr == 0.0 && yi == 0.0) {
                continue;
            }
            double[] ar = re[r];
            double[] ai = im == null ? null : im[r];
            for (int c = 0; c < cols; c++) {
                // conj(a_rc) * y_r
                xr[c] += ar[c] * yr;
                xi[c] += ar[c] * yi;
                if (ai != null) {
                    xr[c] += ai[c] * yi;
                    xi[c] -= ai[c] * yr;
                }
            }
        }
        return ComplexVector.wrap(xr, xi);
    }

    @Override
    public String toString() {
        return "DenseMatrixOperator{" + rows + "x" + cols + (im == null ? ", real" : ", complex") + "}";
    }
}
