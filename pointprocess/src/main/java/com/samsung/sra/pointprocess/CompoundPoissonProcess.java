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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compound Poisson process Y(t) = X_1 + ... + X_N(t): arrivals of a homogeneous Poisson process, each carrying an
 * i.i.d. jump drawn independently of the arrivals. The sample path holds the running sum after every arrival.
 */
public class CompoundPoissonProcess {
    private static final Logger logger = LoggerFactory.getLogger(CompoundPoissonProcess.class);

    private final double rate;
    private final JumpSampler jumps;

    public CompoundPoissonProcess(double rate, JumpSampler jumps) {
        HomogeneousPoissonProcess.checkRate("rate", rate);
        checkJumps(jumps);
        this.rate = rate;
        this.jumps = jumps;
    }

    public double getRate() {
        return rate;
    }

    public CompoundPath generate(double horizon, RandomEngine engine) {
        return generate(rate, horizon, engine, jumps);
    }

    public static CompoundPath generate(double rate, double horizon, RandomEngine engine, JumpSampler jumps) {
        checkJumps(jumps);
        ArrivalSequence arrivals = HomogeneousPoissonProcess.generate(rate, horizon, engine);
        return accumulate(arrivals, jumps, engine);
    }

    /**
     * Attach one jump per arrival, in chronological order, and sum them up. Arrivals are all drawn before the first
     * jump, so a sampler sharing the engine never perturbs the arrival times.
     */
    public static CompoundPath accumulate(ArrivalSequence arrivals, JumpSampler jumps, RandomEngine engine) {
        if (arrivals == null) {
            throw new IllegalArgumentException("arrivals must be non-null");
        }
        checkJumps(jumps);
        double[] values = new double[arrivals.size()];
        double sum = 0;
        for (int i = 0; i < values.length; ++i) {
            sum += jumps.sample(engine);
            values[i] = sum;
        }
        logger.trace("accumulated {} jumps, final value {}", values.length, values.length > 0 ? sum : "n/a");
        return new CompoundPath(arrivals, values);
    }

    private static void checkJumps(JumpSampler jumps) {
        if (jumps == null) {
            throw new IllegalArgumentException("jump sampler must be non-null");
        }
    }
}
