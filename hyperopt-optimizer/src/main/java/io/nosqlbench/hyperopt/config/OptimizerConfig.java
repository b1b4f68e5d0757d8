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

package io.nosqlbench.hyperopt.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.nosqlbench.hyperopt.kernel.BinomialKernel;
import io.nosqlbench.hyperopt.kernel.Kernel;
import io.nosqlbench.hyperopt.kernel.KernelFamily;
import io.nosqlbench.hyperopt.kernel.KernelType;
import io.nosqlbench.hyperopt.kernel.UniformKernel;
import io.nosqlbench.hyperopt.numeric.Arithmetic;
import io.nosqlbench.hyperopt.optimizer.Optimizer;
import io.nosqlbench.hyperopt.optimizer.OptimizerOptions;
import io.nosqlbench.hyperopt.random.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON configuration for a single-parameter {@link Optimizer}.
 *
 * <h2>JSON Format</h2>
 *
 * <pre>{@code
 * {
 *   "min": 0.0,
 *   "max": 10.0,
 *   "kernel": "gaussian",
 *   "prior": {
 *     "kernel": "gaussian",
 *     "location": 5.0,
 *     "bandwidth": 2.0
 *   },
 *   "cutoff": 0.1,
 *   "n_candidates": 25,
 *   "bandwidth_multiplier": 1.0,
 *   "seed": 42
 * }
 * }</pre>
 *
 * <p>Only {@code min} and {@code max} are required. Without a prior, or with a
 * prior that names only the {@code uniform} kernel, the prior is uniform over
 * {@code [min, max]}. Omitted tuning values fall back to
 * {@link OptimizerOptions#defaults()}, and an omitted seed yields an unseeded
 * random source.
 *
 * <p>Invalid documents are reported with {@link IllegalArgumentException}
 * when parsed or built.
 */
public class OptimizerConfig {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    @SerializedName("min")
    private Double min;

    @SerializedName("max")
    private Double max;

    /** Kernel family for trial components */
    @SerializedName("kernel")
    private String kernel;

    @SerializedName("prior")
    private PriorConfig prior;

    @SerializedName("cutoff")
    private Double cutoff;

    @SerializedName("n_candidates")
    private Integer candidates;

    @SerializedName("bandwidth_multiplier")
    private Double bandwidthMultiplier;

    @SerializedName("seed")
    private Long seed;

    /**
     * Configuration of the prior kernel.
     */
    public static class PriorConfig {
        @SerializedName("kernel")
        private String kernel;

        @SerializedName("location")
        private Double location;

        @SerializedName("bandwidth")
        private Double bandwidth;

        public PriorConfig() {
        }

        public PriorConfig(String kernel, double location, double bandwidth) {
            this.kernel = kernel;
            this.location = location;
            this.bandwidth = bandwidth;
        }

        public String getKernel() {
            return kernel;
        }

        public void setKernel(String kernel) {
            this.kernel = kernel;
        }

        public Double getLocation() {
            return location;
        }

        public void setLocation(Double location) {
            this.location = location;
        }

        public Double getBandwidth() {
            return bandwidth;
        }

        public void setBandwidth(Double bandwidth) {
            this.bandwidth = bandwidth;
        }

        /**
         * @return true if this prior spans the whole range instead of naming a location
         */
        public boolean isRangeUniform() {
            return location == null && bandwidth == null
                && (kernel == null || KernelType.fromName(kernel) == KernelType.UNIFORM);
        }

        <P extends Comparable<? super P>> Kernel<P> toKernel(Arithmetic<P> arithmetic, P min, P max) {
            if (isRangeUniform()) {
                return UniformKernel.withBounds(arithmetic, min, max);
            }
            if (kernel == null || location == null || bandwidth == null) {
                throw new IllegalArgumentException("prior requires kernel, location and bandwidth unless it is uniform over the range");
            }
            KernelFamily<P> family = KernelType.fromName(kernel).family(arithmetic);
            return family.create(convert(arithmetic, location, "prior.location"),
                convert(arithmetic, bandwidth, "prior.bandwidth"));
        }
    }

    public OptimizerConfig() {
    }

    public Double getMin() {
        return min;
    }

    public void setMin(Double min) {
        this.min = min;
    }

    public Double getMax() {
        return max;
    }

    public void setMax(Double max) {
        this.max = max;
    }

    public String getKernel() {
        return kernel;
    }

    public void setKernel(String kernel) {
        this.kernel = kernel;
    }

    public PriorConfig getPrior() {
        return prior;
    }

    public void setPrior(PriorConfig prior) {
        this.prior = prior;
    }

    public Double getCutoff() {
        return cutoff;
    }

    public void setCutoff(Double cutoff) {
        this.cutoff = cutoff;
    }

    public Integer getCandidates() {
        return candidates;
    }

    public void setCandidates(Integer candidates) {
        this.candidates = candidates;
    }

    public Double getBandwidthMultiplier() {
        return bandwidthMultiplier;
    }

    public void setBandwidthMultiplier(Double bandwidthMultiplier) {
        this.bandwidthMultiplier = bandwidthMultiplier;
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

    /**
     * Returns the component kernel type, defaulting to Gaussian.
     *
     * @return the kernel type
     * @throws IllegalArgumentException if the kernel name is unknown
     */
    public KernelType getKernelType() {
        return kernel == null ? KernelType.GAUSSIAN : KernelType.fromName(kernel);
    }

    /**
     * Converts the tuning values to options, applying defaults for omitted ones.
     *
     * @return the optimizer options
     * @throws IllegalArgumentException if a value is out of range
     */
    public OptimizerOptions toOptions() {
        OptimizerOptions.Builder builder = OptimizerOptions.builder();
        if (cutoff != null) {
            builder.cutoff(cutoff);
        }
        if (candidates != null) {
            builder.candidates(candidates);
        }
        if (bandwidthMultiplier != null) {
            builder.bandwidthMultiplier(bandwidthMultiplier);
        }
        return builder.build();
    }

    /**
     * Builds an optimizer over continuous parameters.
     *
     * @param <M> the metric type
     * @return a new optimizer
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public <M extends Comparable<? super M>> Optimizer<Double, M> buildContinuous() {
        return build(Arithmetic.ofDouble());
    }

    /**
     * Builds an optimizer over integer parameters. Bounds, prior location and
     * prior bandwidth are rounded to the nearest integer.
     *
     * @param <M> the metric type
     * @return a new optimizer
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public <M extends Comparable<? super M>> Optimizer<Long, M> buildDiscrete() {
        return build(Arithmetic.ofLong());
    }

    private <P extends Comparable<? super P>, M extends Comparable<? super M>> Optimizer<P, M> build(Arithmetic<P> arithmetic) {
        if (min == null || max == null) {
            throw new IllegalArgumentException("min and max are required");
        }
        P lower = convert(arithmetic, min, "min");
        P upper = convert(arithmetic, max, "max");
        if (lower.compareTo(upper) >= 0) {
            throw new IllegalArgumentException("min must be less than max: " + lower + " >= " + upper);
        }
        if (getKernelType() == KernelType.BINOMIAL && (min < 0 || max > BinomialKernel.MAX_LOCATION)) {
            throw new IllegalArgumentException("binomial kernels need a range within [0, "
                + BinomialKernel.MAX_LOCATION + "], got [" + min + ", " + max + "]");
        }
        PriorConfig priorConfig = prior != null ? prior : new PriorConfig();
        Kernel<P> priorKernel = priorConfig.toKernel(arithmetic, lower, upper);
        KernelFamily<P> family = getKernelType().family(arithmetic);
        return new Optimizer<>(arithmetic, lower, upper, priorKernel, family, toOptions());
    }

    private static <P extends Comparable<? super P>> P convert(Arithmetic<P> arithmetic, double value, String field) {
        try {
            return arithmetic.fromDouble(value);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(field + " is not representable: " + value, e);
        }
    }

    /**
     * Creates the random source for this configuration.
     *
     * @return a seeded source if a seed is configured, otherwise an unseeded one
     */
    public UniformRandomProvider createRandom() {
        return seed != null ? RandomGenerators.create(seed) : RandomGenerators.create();
    }

    /**
     * Loads an OptimizerConfig from JSON.
     *
     * @param json the JSON string
     * @return the parsed configuration
     * @throws IllegalArgumentException if the JSON is malformed or empty
     */
    public static OptimizerConfig fromJson(String json) {
        try {
            return requireDocument(GSON.fromJson(json, OptimizerConfig.class));
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed optimizer configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Loads an OptimizerConfig from a Reader.
     *
     * @param reader the reader providing JSON
     * @return the parsed configuration
     * @throws IllegalArgumentException if the JSON is malformed or empty
     */
    public static OptimizerConfig fromJson(Reader reader) {
        try {
            return requireDocument(GSON.fromJson(reader, OptimizerConfig.class));
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed optimizer configuration: " + e.getMessage(), e);
        }
    }

    private static OptimizerConfig requireDocument(OptimizerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Empty optimizer configuration");
        }
        return config;
    }

    /**
     * Serializes this configuration to JSON.
     *
     * @return the JSON string
     */
    public String toJson() {
        return GSON.toJson(this);
    }

    /**
     * Writes this configuration as JSON to a Writer.
     *
     * @param writer the target writer
     */
    public void toJson(Writer writer) {
        GSON.toJson(this, writer);
    }

    /**
     * Loads an OptimizerConfig from a JSON file.
     *
     * @param path the path to the JSON file
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     */
    public static OptimizerConfig loadFromFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return fromJson(reader);
        }
    }

    /**
     * Saves this configuration to a JSON file.
     *
     * @param path the path to write to
     * @throws IOException if the file cannot be written
     */
    public void saveToFile(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            toJson(writer);
        }
    }

    @Override
    public String toString() {
        return "OptimizerConfig{min=" + min + ", max=" + max + ", kernel=" + kernel + ", cutoff=" + cutoff
            + ", n_candidates=" + candidates + ", bandwidth_multiplier=" + bandwidthMultiplier + ", seed=" + seed + "}";
    }
}
