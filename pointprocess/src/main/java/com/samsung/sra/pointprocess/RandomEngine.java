/*
* Copyright 2016 Samsung Research America. All rights reserved.
*
* Licensed under the Apache License, Version 2.0 (the "License");
* you may not use this file except in compliance with the License.
* You may obtain a copy of the License at
*
*     http://www.apache.org/licenses/LICENSE-2.0
*
* Unless required by applicable law or agreed to in writing, software
* distributed under the License is distributed on an "AS IS" BASIS,
* WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
* See the License for the specific language governing permissions and
* limitations under the License.
*/
package com.samsung.sra.pointprocess;

import org.apache.commons.math3.distribution.NormalDistribution;

import java.util.SplittableRandom;

/**
 * <p>One stream of pseudo-random numbers, shared by every generator call in a simulation session. Each draw advances
 * the stream, so consecutive calls against the same engine see continuing, non-overlapping randomness.</p>
 *
 * <p>Pass the same instance explicitly into every call that needs randomness. Never share an engine between threads:
 * use one engine per thread instead. Calling {@link #reset} rewinds the stream to the construction seed, after which
 * the exact same draws are replayed.</p>
 */
public class RandomEngine {
    private static final NormalDistribution standardNormal = new NormalDistribution(0, 1);

    private final long seed;
    private SplittableRandom random;

    public RandomEngine(long seed) {
        this.seed = seed;
        this.random = new SplittableRandom(seed);
    }

    public long getSeed() {
        return seed;
    }

    /** Rewind to the construction seed */
    public void reset() {
        random = new SplittableRandom(seed);
    }

    /** Uniform in [0, 1) */
    public double nextUniform() {
        return random.nextDouble();
    }

    /** Uniform in [lo, hi) */
    public double nextUniform(double lo, double hi) {
        if (!(lo < hi)) {
            throw new IllegalArgumentException("expected lo < hi, got [" + lo + ", " + hi + ")");
        }
        return lo + (hi - lo) * random.nextDouble();
    }

    /**
     * Exponential with mean 1/rate, by inversion of a uniform in (0, 1). The result is finite and non-negative; it is
     * positive unless a huge rate makes it underflow to 0.
     */
    public double nextExponential(double rate) {
        if (!(rate > 0) || Double.isInfinite(rate)) {
            throw new IllegalArgumentException("exponential rate must be positive and finite, got " + rate);
        }
        double u;
        do {
            u = random.nextDouble();
        } while (u == 0); // -log(0) is +inf
        return -Math.log(u) / rate;
    }

    /** true with probability p */
    public boolean nextBernoulli(double p) {
        if (!(p >= 0 && p <= 1)) {
            throw new IllegalArgumentException("probability must be in [0, 1], got " + p);
        }
        return random.nextDouble() < p;
    }

    /** Normal(mean, sd^2) via the inverse CDF of one uniform draw */
    public double nextGaussian(double mean, double sd) {
        if (!(sd >= 0) || Double.isInfinite(sd)) {
            throw new IllegalArgumentException("standard deviation must be non-negative and finite, got " + sd);
        }
        double u;
        do {
            u = random.nextDouble();
        } while (u == 0); // inverse CDF is -inf at 0
        return mean + sd * standardNormal.inverseCumulativeProbability(u);
    }

    @Override
    public String toString() {
        return "RandomEngine{seed=" + seed + "}";
    }
}
