package io.nosqlbench.phaseinit.linalg;

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

import org.apache.commons.math3.complex.Complex;

import java.util.Arrays;

/// # ComplexVector
///
/// Dense vector over the complex numbers, stored as separate real and imaginary
/// `double[]` arrays.
///
/// ## Purpose
/// Carries signal estimates and measurement vectors through the sensing
/// operators and the eigensolver without boxing each entry:
/// - **Inner products**: conjugate-linear in the first argument, returned as [Complex]
/// - **Norms and magnitudes**: Euclidean norm, element-wise modulus
/// - **Scaling**: real and complex scalar multiples
/// - **In-place updates**: `subtractScaled` and `scaleInPlace`, used by the Lanczos recurrence
///
/// A vector whose imaginary part is all zero is real; real operators applied to
/// real vectors keep it that way.
///
/// ## Usage
/// ```java
/// ComplexVector x = ComplexVector.ofReal(1.0, 0.0);
/// Complex overlap = x.dot(y);
/// double[] b0 = operator.apply(x).magnitudes();
/// ```
public final class ComplexVector {

    private final double[] re;
    private final double[] im;

    private ComplexVector(double[] re, double[] im) {
        this.re = re;
        this.im = im;
    }

    /// Creates an all-zero vector.
    /// @param dimension number of entries
    /// @return a new zero vector
    public static ComplexVector zeros(int dimension) {
        return new ComplexVector(new double[dimension], new double[dimension]);
    }

    /// Creates a real vector from a copy of the given values.
    /// @param values real parts
    /// @return a new vector with zero imaginary part
    public static ComplexVector ofReal(double... values) {
        return new ComplexVector(values.clone(), new double[values.length]);
    }

    /// Creates a vector from copies of the given parts.
    /// @param re real parts
    /// @param im imaginary parts, same length as `re`
    /// @return a new vector
    /// @throws IllegalArgumentException if the parts differ in length
    public static ComplexVector of(double[] re, double[] im) {
        if (re.length != im.length) {
            throw new IllegalArgumentException("Real and imaginary parts must have same dimension");
        }
        return new ComplexVector(re.clone(), im.clone());
    }

    /// Wraps the given arrays without copying. The caller hands over ownership.
    /// @param re real parts
    /// @param im imaginary parts, same length as `re`
    /// @return a vector backed by the arrays
    public static ComplexVector wrap(double[] re, double[] im) {
        if (re.length != im.length) {
            throw new IllegalArgumentException("Real and imaginary parts must have same dimension");
        }
        return new ComplexVector(re, im);
    }

    public int dimension() {
        return re.length;
    }

    public double re(int i) {
        return re[i];
    }

    public double im(int i) {
        return im[i];
    }

    public Complex get(int i) {
        return new Complex(re[i], im[i]);
    }

    /// @return a copy of the real parts
    public double[] real() {
        return re.clone();
    }

    /// @return a copy of the imaginary parts
    public double[] imaginary() {
        return im.clone();
    }

    public boolean isReal() {
        for (double v : im) {
            if (v != 0.0) {
                return false;
            }
        }
        return true;
    }

    public ComplexVector copy() {
        return new ComplexVector(re.clone(), im.clone());
    }

    /// Hermitian inner product `sum(conj(this_i) * other_i)`.
    /// @param other vector of equal dimension
    /// @return the inner product
    /// @throws IllegalArgumentException if dimensions differ
    public Complex dot(ComplexVector other) {
        requireSameDimension(other);
        double sr = 0.0;
        double si = 0.0;
        for (int i = 0; i < re.length; i++) {
            sr += re[i] * other.re[i] + im[i] * other.im[i];
            si += re[i] * other.im[i] - im[i] * other.re[i];
        }
        return new Complex(sr, si);
    }

    public double squaredNorm() {
        double sum = 0.0;
        for (int i = 0; i < re.length; i++) {
            sum += re[i] * re[i] + im[i] * im[i];
        }
        return sum;
    }

    public double norm() {
        return Math.sqrt(squaredNorm());
    }

    /// @return element-wise modulus `|x_i|`
    public double[] magnitudes() {
        double[] out = new double[re.length];
        for (int i = 0; i < re.length; i++) {
            out[i] = Math.hypot(re[i], im[i]);
        }
        return out;
    }

    public ComplexVector scale(double s) {
        double[] r = new double[re.length];
        double[] m = new double[re.length];
        for (int i = 0; i < re.length; i++) {
            r[i] = re[i] * s;
            m[i] = im[i] * s;
        }
        return new ComplexVector(r, m);
    }

    public ComplexVector scale(Complex c) {
        double cr = c.getReal();
        double ci = c.getImaginary();
        double[] r = new double[re.length];
        double[] m = new double[re.length];
        for (int i = 0; i < re.length; i++) {
            r[i] = re[i] * cr - im[i] * ci;
            m[i] = re[i] * ci + im[i] * cr;
        }
        return new ComplexVector(r, m);
    }

    /// @return this vector divided by its norm
    /// @throws IllegalStateException for the zero vector
    public ComplexVector normalize() {
        double norm = norm();
        if (norm == 0.0) {
            throw new IllegalStateException("Cannot normalize a zero vector");
        }
        return scale(1.0 / norm);
    }

    /// Zeroes the entries whose flag is false.
    /// @param keep one flag per entry
    /// @return a new vector
    public ComplexVector retain(boolean[] keep) {
        if (keep.length != re.length) {
            throw new IllegalArgumentException("Mask must have same dimension as vector");
        }
        double[] r = new double[re.length];
        double[] m = new double[re.length];
        for (int i = 0; i < re.length; i++) {
            if (keep[i]) {
                r[i] = re[i];
                m[i] = im[i];
            }
        }
        return new ComplexVector(r, m);
    }

    /// In place: `this -= c * v`.
    public void subtractScaled(Complex c, ComplexVector v) {
        requireSameDimension(v);
        double cr = c.getReal();
        double ci = c.getImaginary();
        for (int i = 0; i < re.length; i++) {
            re[i] -= v.re[i] * cr - v.im[i] * ci;
            im[i] -= v.re[i] * ci + v.im[i] * cr;
        }
    }

    /// In place: `this -= s * v`.
    public void subtractScaled(double s, ComplexVector v) {
        requireSameDimension(v);
        for (int i = 0; i < re.length; i++) {
            re[i] -= v.re[i] * s;
            im[i] -= v.im[i] * s;
        }
    }

    /// In place: `this += s * v`.
    public void addScaled(double s, ComplexVector v) {
        subtractScaled(-s, v);
    }

    /// In place: `this *= s`.
    public void scaleInPlace(double s) {
        for (int i = 0; i < re.length; i++) {
            re[i] *= s;
            im[i] *= s;
        }
    }

    private void requireSameDimension(ComplexVector other) {
        if (other.re.length != re.length) {
            throw new IllegalArgumentException("Vectors must have same dimension");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ComplexVector)) return false;
        ComplexVector that = (ComplexVector) o;
        return Arrays.equals(re, that.re) && Arrays.equals(im, that.im);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(re) + Arrays.hashCode(im);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < re.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(re[i]);
            if (im[i] != 0.0) {
                sb.append(im[i] < 0 ? " - " : " + ").append(Math.abs(im[i])).append('i');
            }
        }
        return sb.append(']').toString();
    }
}
