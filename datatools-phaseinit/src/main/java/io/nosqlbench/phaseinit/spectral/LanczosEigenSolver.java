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

import io.nosqlbench.phaseinit.ConvergenceException;
import io.nosqlbench.phaseinit.InvalidInputException;
import io.nosqlbench.phaseinit.linalg.ComplexVector;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;
import org.apache.commons.rng.simple.RandomSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/// # LanczosEigenSolver
///
/// Finds the eigenpair of smallest algebraic eigenvalue of a [HermitianOperator]
/// using only operator-vector products.
///
/// ## Method
/// Explicitly restarted Lanczos with full re-orthogonalization:
/// 1. Build an orthonormal Krylov basis `Q` of up to `krylovDimension` vectors from
///    the current start vector. Each new direction is orthogonalized twice against
///    the whole basis.
/// 2. The projection `Q^H Y Q` is real symmetric tridiagonal. It is diagonalized
///    with [EigenDecomposition] and the smallest Ritz pair is lifted back to the
///    full space.
/// 3. The true residual `||Y v - theta v||` is measured. The pair is accepted when
///    the residual is at most `tolerance * max|theta|`; otherwise the next cycle
///    restarts from the Ritz vector.
///
/// A vanishing off-diagonal (an invariant subspace was found) does not end the
/// cycle. The basis continues with a random direction orthogonal to it, so the
/// projection still sees the part of the spectrum outside that subspace.
///
/// The start vector is real Gaussian noise from a seeded generator, so results
/// are reproducible and real operators produce real eigenvectors.
///
/// ## Failure
/// Exceeding `maxRestarts` restarts, or a failure of the small tridiagonal
/// decomposition, raises [ConvergenceException].
public final class LanczosEigenSolver {

    private static final Logger logger = LogManager.getLogger(LanczosEigenSolver.class);

    public static final int DEFAULT_KRYLOV_DIMENSION = 20;
    public static final int DEFAULT_MAX_RESTARTS = 300;
    public static final double DEFAULT_TOLERANCE = 1e-10;
    public static final long DEFAULT_SEED = 42L;

    /// Relative size of an off-diagonal below which the recurrence is treated as broken down.
    private static final double BREAKDOWN = 1e-12;

    private final int krylovDimension;
    private final int maxRestarts;
    private final double tolerance;
    private final long seed;

    public LanczosEigenSolver() {
        this(DEFAULT_KRYLOV_DIMENSION, DEFAULT_MAX_RESTARTS, DEFAULT_TOLERANCE, DEFAULT_SEED);
    }

    /// @param krylovDimension basis size per cycle, at least 2
    /// @param maxRestarts restarts allowed after the first cycle, at least 0
    /// @param tolerance relative residual tolerance, positive
    /// @param seed start vector seed
    public LanczosEigenSolver(int krylovDimension, int maxRestarts, double tolerance, long seed) {
        if (krylovDimension < 2) {
            throw new InvalidInputException("krylov dimension must be at least 2, was " + krylovDimension);
        }
        if (maxRestarts < 0) {
            throw new InvalidInputException("max restarts must not be negative, was " + maxRestarts);
        }
        if (!(tolerance > 0.0) || Double.isInfinite(tolerance)) {
            throw new InvalidInputException("tolerance must be a positive finite value, was " + tolerance);
        }
        this.krylovDimension = krylovDimension;
        this.maxRestarts = maxRestarts;
        this.tolerance = tolerance;
        this.seed = seed;
    }

    /// Computes the eigenpair with the smallest eigenvalue.
    ///
    /// @param operator a Hermitian operator
    /// @return the converged eigenpair
    /// @throws ConvergenceException if the residual tolerance is not reached in time
    public EigenPair smallest(HermitianOperator operator) {
        int n = operator.dimension();
        if (n <= 0) {
            throw new InvalidInputException("Operator dimension must be positive, was " + n);
        }
        int k = Math.min(n, krylovDimension);

        UniformRandomProvider rng = RandomSource.XO_SHI_RO_256_PP.create(seed);
        NormalizedGaussianSampler gaussian = ZigguratSampler.NormalizedGaussian.of(rng);

        ComplexVector start = gaussianVector(n, gaussian).normalize();
        double spectralScale = 0.0;
        int applications = 0;
        double residual = Double.NaN;
        double threshold = Double.NaN;

        for (int restart = 0; restart <= maxRestarts; restart++) {
            ComplexVector[] basis = new ComplexVector[k];
            double[] alpha = new double[k];
            double[] beta = new double[k];
            double tridiagonalNorm = 0.0;
            int size = 0;

            basis[0] = start;
            for (int j = 0; j < k; j++) {
                ComplexVector w = operator.apply(basis[j]).copy();
                applications++;
                alpha[j] = basis[j].dot(w).getReal();
                w.subtractScaled(alpha[j], basis[j]);
                if (j > 0) {
                    w.subtractScaled(beta[j - 1], basis[j - 1]);
                }
                orthogonalize(w, basis, j + 1);
                orthogonalize(w, basis, j + 1);
                size = j + 1;
                if (size == k) {
                    break;
                }

                double b = w.norm();
                tridiagonalNorm = Math.max(tridiagonalNorm,
                    Math.abs(alpha[j]) + b + (j > 0 ? beta[j - 1] : 0.0));
                if (b <= BREAKDOWN * tridiagonalNorm) {
                    ComplexVector fresh = orthogonalGaussian(basis, size, gaussian);
                    if (fresh == null) {
                        break;
                    }
                    beta[j] = 0.0;
                    basis[j + 1] = fresh;
                } else {
                    beta[j] = b;
                    w.scaleInPlace(1.0 / b);
                    basis[j + 1] = w;
                }
            }

            double[] coefficients = smallestRitzCoefficients(alpha, beta, size);
            for (double a : alpha) {
                spectralScale = Math.max(spectralScale, Math.abs(a));
            }

            ComplexVector ritz = ComplexVector.zeros(n);
            for (int i = 0; i < size; i++) {
                ritz.addScaled(coefficients[i], basis[i]);
            }
            ritz = ritz.normalize();

            ComplexVector image = operator.apply(ritz).copy();
            applications++;
            double theta = ritz.dot(image).getReal();
            image.subtractScaled(theta, ritz);
            residual = image.norm();
            spectralScale = Math.max(spectralScale, Math.abs(theta));
            threshold = tolerance * Math.max(spectralScale, Double.MIN_NORMAL);

            logger.debug("Lanczos cycle {}: basis={}, theta={}, residual={}, threshold={}",
                restart, size, theta, residual, threshold);

            if (residual <= threshold) {
                return new EigenPair(theta, ritz, residual, restart, applications);
            }
            start = ritz;
        }

        logger.warn("Lanczos eigensolver did not converge after {} restarts, residual {} > {}",
            maxRestarts, residual, threshold);
        throw new ConvergenceException(maxRestarts, residual, threshold);
    }

    /// Eigenvector coefficients of the smallest eigenvalue of the symmetric
    /// tridiagonal matrix with diagonal `alpha[0..size)` and off-diagonal `beta[0..size-1)`.
    private static double[] smallestRitzCoefficients(double[] alpha, double[] beta, int size) {
        if (size == 1) {
            return new double[]{1.0};
        }
        EigenDecomposition decomposition;
        try {
            decomposition = new EigenDecomposition(
                Arrays.copyOf(alpha, size), Arrays.copyOf(beta, size - 1));
        } catch (MathIllegalStateException e) {
            throw new ConvergenceException("Tridiagonal eigen-decomposition failed: " + e.getMessage(), e);
        }
        double[] values = decomposition.getRealEigenvalues();
        int smallest = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] < values[smallest]) {
                smallest = i;
            }
        }
        return decomposition.getEigenvector(smallest).toArray();
    }

    private static void orthogonalize(ComplexVector w, ComplexVector[] basis, int count) {
        for (int i = 0; i < count; i++) {
            Complex projection = basis[i].dot(w);
            w.subtractScaled(projection, basis[i]);
        }
    }

    /// @return a unit vector orthogonal to the basis, or null if the basis spans the space
    private static ComplexVector orthogonalGaussian(ComplexVector[] basis, int count,
                                                    NormalizedGaussianSampler gaussian) {
        ComplexVector candidate = gaussianVector(basis[0].dimension(), gaussian);
        double before = candidate.norm();
        orthogonalize(candidate, basis, count);
        orthogonalize(candidate, basis, count);
        double after = candidate.norm();
        if (after <= 1e-8 * before) {
            return null;
        }
        candidate.scaleInPlace(1.0 / after);
        return candidate;
    }

    private static ComplexVector gaussianVector(int n, NormalizedGaussianSampler gaussian) {
        double[] re = new double[n];
        for (int i = 0; i < n; i++) {
            re[i] = gaussian.sample();
        }
        return ComplexVector.wrap(re, new double[n]);
    }

    public int krylovDimension() {
        return krylovDimension;
    }

    public int maxRestarts() {
        return maxRestarts;
    }

    public double tolerance() {
        return tolerance;
    }

    public long seed() {
        return seed;
    }
}
