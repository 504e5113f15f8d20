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

import io.nosqlbench.phaseinit.config.NullInitializerConfig;
import io.nosqlbench.phaseinit.linalg.ComplexVector;
import io.nosqlbench.phaseinit.operator.SensingOperator;
import io.nosqlbench.phaseinit.operator.SensingOperators;
import io.nosqlbench.phaseinit.select.SelectionMask;
import io.nosqlbench.phaseinit.select.SubsetSelector;
import io.nosqlbench.phaseinit.spectral.EigenPair;
import io.nosqlbench.phaseinit.spectral.LanczosEigenSolver;
import io.nosqlbench.phaseinit.spectral.MagnitudeRescaler;
import io.nosqlbench.phaseinit.spectral.MaskedGramOperator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.function.UnaryOperator;

/// # NullInitializer
///
/// Estimates a signal from magnitude-only measurements `b0 = |A x|`, up to a
/// global sign or phase, as a starting point for iterative phase retrieval.
///
/// ## Pipeline
/// 1. **Select**: hold out the `gamma` fraction of largest measurements. The rest
///    come from rows of `A` nearly orthogonal to the signal.
/// 2. **Solve**: the eigenvector of smallest eigenvalue of `A^H diag(I) A` is the
///    direction most orthogonal to those rows ([LanczosEigenSolver]).
/// 3. **Rescale**: fit the magnitude of that unit vector to the held-out
///    measurements by least squares ([MagnitudeRescaler]).
///
/// No state is kept between calls. An instance may be shared between threads as
/// long as the sensing operators passed to it are pure functions.
///
/// ## Usage
/// ```java
/// // dense matrix, n inferred
/// ComplexVector x0 = NullInitializer.initialize(matrix, b0);
///
/// // implicit operator
/// NullInitializer init = new NullInitializer(config);
/// InitializerResult result = init.estimate(SensingOperators.of(fwd, adj, n), b0);
/// ```
public final class NullInitializer {

    private static final Logger logger = LogManager.getLogger(NullInitializer.class);

    private final NullInitializerConfig config;
    private final SubsetSelector selector;
    private final LanczosEigenSolver solver;
    private final boolean verbose;
    private final boolean rescale;

    public NullInitializer() {
        this(NullInitializerConfig.defaults());
    }

    /// @param config run settings; validated and copied here, so later changes to
    ///     the caller's instance do not affect this initializer
    /// @throws InvalidInputException if a setting is out of range
    public NullInitializer(NullInitializerConfig config) {
        if (config == null) {
            throw new InvalidInputException("Configuration must not be null");
        }
        this.config = NullInitializerConfig.fromJson(config.validate().toJson());
        this.selector = this.config.toSubsetSelector();
        this.solver = this.config.toEigenSolver();
        this.verbose = this.config.isVerbose();
        this.rescale = this.config.isRescale();
    }

    /// @return a copy of the settings this initializer was built with
    public NullInitializerConfig config() {
        return NullInitializerConfig.fromJson(config.toJson());
    }

    /// Runs the null initializer.
    ///
    /// @param operator the sensing operator A
    /// @param b0 non-negative measurement magnitudes, one per row of A
    /// @return the estimate together with solver diagnostics
    /// @throws InvalidInputException if the operator is missing or b0 is malformed
    /// @throws DimensionMismatchException if b0 does not match the operator's rows
    /// @throws ConvergenceException if the eigensolver does not converge
    /// @throws DegenerateScaleException if the magnitude fit is undefined
    public InitializerResult estimate(SensingOperator operator, double[] b0) {
        if (operator == null) {
            throw new InvalidInputException("A sensing operator is required");
        }
        SubsetSelector.validateMeasurements(b0);
        int n = operator.domainDimension();
        int m = b0.length;
        SensingOperator bound = SensingOperators.withMeasurementCount(operator, m);

        if (verbose) {
            logger.info("Estimating signal of length {} using a null initializer with {} measurements...", n, m);
        }

        SelectionMask mask = selector.select(b0);
        if (verbose) {
            logger.info("Null operator built from {} of {} measurements (gamma={})",
                mask.includedCount(), m, selector.gamma());
        }

        EigenPair pair = solver.smallest(new MaskedGramOperator(bound, mask));
        logger.debug("Smallest eigenvalue {} after {} restarts and {} operator applications",
            pair.value(), pair.restarts(), pair.operatorApplications());

        ComplexVector x0 = pair.vector();
        double scale = 1.0;
        if (rescale) {
            scale = MagnitudeRescaler.fitScale(bound, mask, b0, x0);
            x0 = x0.scale(scale);
            if (verbose) {
                logger.info("Rescaled estimate by {}", scale);
            }
        }

        if (verbose) {
            logger.info("Initialization finished.");
        }
        return new InitializerResult(x0, mask, pair.value(), pair.residual(),
            pair.restarts(), pair.operatorApplications(), scale);
    }

    /// Dense real matrix form with progress logging; n is the column count.
    public static ComplexVector initialize(double[][] a, double[] b0) {
        return initialize(a, b0, true);
    }

    /// Dense real matrix form; n is the column count.
    public static ComplexVector initialize(double[][] a, double[] b0, boolean verbose) {
        return initialize(a, null, b0, verbose);
    }

    /// Dense complex matrix form; n is the column count.
    ///
    /// @param re real part of A
    /// @param im imaginary part of A, or null for a real matrix
    public static ComplexVector initialize(double[][] re, double[][] im, double[] b0, boolean verbose) {
        if (re == null) {
            throw new InvalidInputException("A sensing matrix is required");
        }
        return withVerbosity(verbose).estimate(SensingOperators.dense(re, im), b0).estimate();
    }

    /// Function form. The adjoint and the signal dimension cannot be inferred and
    /// must be supplied.
    ///
    /// @param a forward application `x -> A x`
    /// @param at adjoint application `y -> A^H y`
    /// @param b0 measurement magnitudes
    /// @param n signal dimension
    /// @param verbose log progress at INFO
    /// @throws InvalidInputException if `at` or `n` is missing
    public static ComplexVector initialize(UnaryOperator<ComplexVector> a, UnaryOperator<ComplexVector> at,
                                           double[] b0, Integer n, boolean verbose) {
        return withVerbosity(verbose).estimate(SensingOperators.of(a, at, n), b0).estimate();
    }

    private static NullInitializer withVerbosity(boolean verbose) {
        NullInitializerConfig config = NullInitializerConfig.defaults();
        config.setVerbose(verbose);
        return new NullInitializer(config);
    }
}
