/// # Synopsis
/// Spectral initialization for phase retrieval. Given a sensing operator `A` and
/// magnitude-only measurements `b0 = |A x|`, this package estimates `x` up to a
/// global sign or phase so that iterative refinement has a good place to start.
///
/// ## Data Flow
/// 1. [io.nosqlbench.phaseinit.operator]: adapts dense matrices and function pairs
///    into a [io.nosqlbench.phaseinit.operator.SensingOperator].
/// 2. [io.nosqlbench.phaseinit.select]: marks the low-magnitude measurements.
/// 3. [io.nosqlbench.phaseinit.spectral]: extracts the smallest eigenvector of the
///    masked Gram operator and fits its magnitude.
///
/// [io.nosqlbench.phaseinit.NullInitializer] runs the three steps in order.
///
/// ## Reference
/// P. Chen, A. Fannjiang, G.-R. Liu, "Phase Retrieval with One or Two Diffraction
/// Patterns by Alternating Projection with Null Initialization", Algorithm 1.
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
