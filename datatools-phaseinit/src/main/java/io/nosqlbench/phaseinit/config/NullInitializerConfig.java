package io.nosqlbench.phaseinit.config;

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.nosqlbench.phaseinit.InvalidInputException;
import io.nosqlbench.phaseinit.select.SubsetSelector;
import io.nosqlbench.phaseinit.spectral.LanczosEigenSolver;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON-serializable settings for a null initializer run.
 *
 * <h2>JSON Schema</h2>
 *
 * <p>Every key is optional; missing keys take the defaults shown.
 * <pre>{@code
 * {
 *   "gamma": 0.5,                 // fraction of largest measurements held out
 *   "inclusive_boundary": false,  // keep one extra measurement at the subset boundary
 *   "rescale": true,              // apply the least-squares magnitude fit
 *   "verbose": true,              // log progress at INFO
 *   "krylov_dimension": 20,       // Lanczos basis size per cycle
 *   "max_restarts": 300,          // restarts before giving up
 *   "tolerance": 1e-10,           // relative residual tolerance
 *   "seed": 42                    // start vector seed
 * }
 * }</pre>
 *
 * @see io.nosqlbench.phaseinit.NullInitializer
 */
public class NullInitializerConfig {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    @SerializedName("gamma")
    private Double gamma;

    @SerializedName("inclusive_boundary")
    private Boolean inclusiveBoundary;

    @SerializedName("rescale")
    private Boolean rescale;

    @SerializedName("verbose")
    private Boolean verbose;

    @SerializedName("krylov_dimension")
    private Integer krylovDimension;

    @SerializedName("max_restarts")
    private Integer maxRestarts;

    @SerializedName("tolerance")
    private Double tolerance;

    @SerializedName("seed")
    private Long seed;

    public NullInitializerConfig() {
    }

    /**
     * @return a configuration with every value at its default
     */
    public static NullInitializerConfig defaults() {
        return new NullInitializerConfig();
    }

    public double getGamma() {
        return gamma != null ? gamma : SubsetSelector.DEFAULT_GAMMA;
    }

    public void setGamma(Double gamma) {
        this.gamma = gamma;
    }

    public boolean isInclusiveBoundary() {
        return inclusiveBoundary != null && inclusiveBoundary;
    }

    public void setInclusiveBoundary(Boolean inclusiveBoundary) {
        this.inclusiveBoundary = inclusiveBoundary;
    }

    public boolean isRescale() {
        return rescale == null || rescale;
    }

    public void setRescale(Boolean rescale) {
        this.rescale = rescale;
    }

    public boolean isVerbose() {
        return verbose == null || verbose;
    }

    public void setVerbose(Boolean verbose) {
        this.verbose = verbose;
    }

    public int getKrylovDimension() {
        return krylovDimension != null ? krylovDimension : LanczosEigenSolver.DEFAULT_KRYLOV_DIMENSION;
    }

    public void setKrylovDimension(Integer krylovDimension) {
        this.krylovDimension = krylovDimension;
    }

    public int getMaxRestarts() {
        return maxRestarts != null ? maxRestarts : LanczosEigenSolver.DEFAULT_MAX_RESTARTS;
    }

    public void setMaxRestarts(Integer maxRestarts) {
        this.maxRestarts = maxRestarts;
    }

    public double getTolerance() {
        return tolerance != null ? tolerance : LanczosEigenSolver.DEFAULT_TOLERANCE;
    }

    public void setTolerance(Double tolerance) {
        this.tolerance = tolerance;
    }

    public long getSeed() {
        return seed != null ? seed : LanczosEigenSolver.DEFAULT_SEED;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

    /**
     * Checks every value against its allowed range.
     *
     * @return this configuration
     * @throws InvalidInputException naming the first offending key
     */
    public NullInitializerConfig validate() {
        double g = getGamma();
        if (!(g > 0.0 && g < 1.0)) {
            throw new InvalidInputException("gamma must lie strictly between 0 and 1, was " + g);
        }
        if (getKrylovDimension() < 2) {
            throw new InvalidInputException("krylov_dimension must be at least 2, was " + getKrylovDimension());
        }
        if (getMaxRestarts() < 0) {
            throw new InvalidInputException("max_restarts must not be negative, was " + getMaxRestarts());
        }
        double t = getTolerance();
        if (!(t > 0.0) || Double.isInfinite(t)) {
            throw new InvalidInputException("tolerance must be a positive finite value, was " + t);
        }
        return this;
    }

    /**
     * @return a subset selector for these settings
     */
    public SubsetSelector toSubsetSelector() {
        return new SubsetSelector(getGamma(), isInclusiveBoundary());
    }

    /**
     * @return an eigensolver for these settings
     */
    public LanczosEigenSolver toEigenSolver() {
        return new LanczosEigenSolver(getKrylovDimension(), getMaxRestarts(), getTolerance(), getSeed());
    }

    /**
     * Loads a configuration from JSON.
     *
     * @throws InvalidInputException if the text is not a valid configuration object
     */
    public static NullInitializerConfig fromJson(String json) {
        try {
            NullInitializerConfig config = GSON.fromJson(json, NullInitializerConfig.class);
            return config != null ? config : new NullInitializerConfig();
        } catch (JsonParseException e) {
            throw new InvalidInputException("Invalid null initializer configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Loads a configuration from a Reader.
     *
     * @throws InvalidInputException if the content is not a valid configuration object,
     *     or the reader fails; the Gson failure is kept as the cause
     */
    public static NullInitializerConfig fromJson(Reader reader) {
        try {
            NullInitializerConfig config = GSON.fromJson(reader, NullInitializerConfig.class);
            return config != null ? config : new NullInitializerConfig();
        } catch (JsonParseException e) {
            throw new InvalidInputException("Invalid null initializer configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Loads and validates a configuration file.
     */
    public static NullInitializerConfig loadFromFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return fromJson(reader).validate();
        }
    }

    /**
     * Serializes this configuration to JSON.
     */
    public String toJson() {
        return GSON.toJson(this);
    }

    /**
     * Writes this configuration as JSON to a Writer.
     */
    public void toJson(Writer writer) {
        GSON.toJson(this, writer);
    }

    /**
     * Saves this configuration to a JSON file.
     */
    public void saveToFile(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            toJson(writer);
        }
    }

    @Override
    public String toString() {
        return toJson();
    }
}
