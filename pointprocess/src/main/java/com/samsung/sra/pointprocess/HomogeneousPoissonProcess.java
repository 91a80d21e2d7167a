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

import java.util.Arrays;

/**
 * <p>Constant-rate Poisson process on [0, horizon], built from i.i.d. exponential interarrival gaps with mean
 * 1/rate. The clock starts at 0; each gap is added to it and the new time is kept while it is &lt;= horizon. The
 * first time beyond the horizon is dropped and ends the run.</p>
 *
 * <p>The number of returned arrivals is Poisson distributed with mean rate * horizon.</p>
 */
public class HomogeneousPoissonProcess {
    private static final Logger logger = LoggerFactory.getLogger(HomogeneousPoissonProcess.class);

    private final double rate;

    public HomogeneousPoissonProcess(double rate) {
        checkRate("rate", rate);
        this.rate = rate;
    }

    public double getRate() {
        return rate;
    }

    public ArrivalSequence generate(double horizon, RandomEngine engine) {
        return generate(rate, horizon, engine);
    }

    /**
     * @param rate     events per unit time. Must be positive and finite: rate 0 is rejected rather than treated as
     *                 an empty process
     * @param horizon  simulate [0, horizon]. Must be non-negative and finite
     * @param engine   random stream to draw from; advanced by at least one draw per arrival plus one
     */
    public static ArrivalSequence generate(double rate, double horizon, RandomEngine engine) {
        checkRate("rate", rate);
        checkHorizon(horizon);
        checkEngine(engine);

        double[] buffer = new double[16];
        int n = 0;
        double t = 0;
        while (true) {
            double next = t + engine.nextExponential(rate);
            if (next > horizon) {
                break;
            }
            if (next == t) {
                // gap too small to move the clock; keep times strictly increasing and > 0
                continue;
            }
            if (n == buffer.length) {
                buffer = Arrays.copyOf(buffer, 2 * n);
            }
            buffer[n++] = next;
            t = next;
        }
        logger.trace("rate = {}, horizon = {}: {} arrivals", rate, horizon, n);
        return ArrivalSequence.wrap(buffer, n);
    }

    static void checkRate(String name, double rate) {
        if (!(rate > 0) || Double.isInfinite(rate)) {
            throw new IllegalArgumentException(name + " must be positive and finite, got " + rate);
        }
    }

    static void checkHorizon(double horizon) {
        if (!(horizon >= 0) || Double.isInfinite(horizon)) {
            throw new IllegalArgumentException("horizon must be non-negative and finite, got " + horizon);
        }
    }

    static void checkEngine(RandomEngine engine) {
        if (engine == null) {
            throw new IllegalArgumentException("random engine must be non-null");
        }
    }
}
