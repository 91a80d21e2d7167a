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
 * <p>Non-homogeneous Poisson process with intensity lambda(t), simulated by thinning. We draw a homogeneous candidate
 * stream at the dominating rate lambdaMax over the horizon, then keep each candidate t independently with
 * probability lambda(t) / lambdaMax. Filtering keeps the candidates in chronological order.</p>
 *
 * <p>Requires 0 &lt;= lambda(t) &lt;= lambdaMax at every candidate time; a violation fails the whole call with an
 * {@link IntensityBoundException}. Each candidate costs one intensity evaluation and one uniform draw, whether it is
 * kept or not.</p>
 */
public class ThinningPoissonProcess {
    private static final Logger logger = LoggerFactory.getLogger(ThinningPoissonProcess.class);

    private final IntensityFunction intensity;
    private final double dominatingRate;

    public ThinningPoissonProcess(IntensityFunction intensity, double dominatingRate) {
        checkIntensity(intensity);
        HomogeneousPoissonProcess.checkRate("dominating rate", dominatingRate);
        this.intensity = intensity;
        this.dominatingRate = dominatingRate;
    }

    public IntensityFunction getIntensity() {
        return intensity;
    }

    public double getDominatingRate() {
        return dominatingRate;
    }

    public ArrivalSequence generate(double horizon, RandomEngine engine) {
        return generate(intensity, dominatingRate, horizon, engine);
    }

    public static ArrivalSequence generate(IntensityFunction intensity, double dominatingRate, double horizon,
                                           RandomEngine engine) {
        checkIntensity(intensity);
        HomogeneousPoissonProcess.checkRate("dominating rate", dominatingRate);
        HomogeneousPoissonProcess.checkHorizon(horizon);
        HomogeneousPoissonProcess.checkEngine(engine);

        ArrivalSequence candidates = HomogeneousPoissonProcess.generate(dominatingRate, horizon, engine);
        double[] accepted = new double[candidates.size()];
        int n = 0;
        for (int i = 0; i < candidates.size(); ++i) {
            double t = candidates.get(i);
            double lambda = intensity.rateAt(t);
            if (!(lambda >= 0 && lambda <= dominatingRate)) { // also catches NaN
                throw new IntensityBoundException(t, lambda, dominatingRate);
            }
            if (engine.nextUniform() < lambda / dominatingRate) {
                accepted[n++] = t;
            }
        }
        logger.debug("thinning at dominating rate {} over [0, {}]: accepted {} of {} candidates",
                dominatingRate, horizon, n, candidates.size());
        return ArrivalSequence.wrap(accepted, n);
    }

    private static void checkIntensity(IntensityFunction intensity) {
        if (intensity == null) {
            throw new IllegalArgumentException("intensity function must be non-null");
        }
    }
}
