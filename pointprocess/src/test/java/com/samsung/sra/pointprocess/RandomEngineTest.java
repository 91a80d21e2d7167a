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

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.junit.Test;

import static com.samsung.sra.pointprocess.HomogeneousPoissonProcessTest.assertRejected;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class RandomEngineTest {
    @Test
    public void resetReplaysStream() throws Exception {
        RandomEngine engine = new RandomEngine(123);
        double[] first = new double[100];
        for (int i = 0; i < first.length; ++i) {
            first[i] = engine.nextUniform();
        }
        engine.reset();
        for (double v : first) {
            assertEquals(v, engine.nextUniform(), 0);
        }
        assertEquals(123, engine.getSeed());
    }

    @Test
    public void distributionMoments() throws Exception {
        RandomEngine engine = new RandomEngine(2);
        int n = 100_000;
        SummaryStatistics exp = new SummaryStatistics(), unif = new SummaryStatistics(), gauss = new SummaryStatistics();
        int heads = 0;
        for (int i = 0; i < n; ++i) {
            double x = engine.nextExponential(4);
            assertTrue(x > 0 && !Double.isInfinite(x));
            exp.addValue(x);
            double u = engine.nextUniform(-3, 5);
            assertTrue(u >= -3 && u < 5);
            unif.addValue(u);
            gauss.addValue(engine.nextGaussian(10, 2));
            if (engine.nextBernoulli(0.3)) ++heads;
        }
        assertEquals(0.25, exp.getMean(), 0.005);
        assertEquals(1, unif.getMean(), 0.05);
        assertEquals(10, gauss.getMean(), 0.05);
        assertEquals(2, gauss.getStandardDeviation(), 0.05);
        assertEquals(0.3, (double) heads / n, 0.01);
    }

    @Test
    public void exponentialIsPositiveWhenUniformIsZero() throws Exception {
        RandomEngine engine = new RandomEngine(HomogeneousPoissonProcessTest.FIRST_DRAW_ZERO_SEED);
        double gap = engine.nextExponential(1);
        assertTrue(gap > 0 && !Double.isInfinite(gap));
    }

    @Test
    public void rejectsInvalidParameters() throws Exception {
        RandomEngine engine = new RandomEngine(0);
        assertRejected(() -> engine.nextExponential(0), "rate");
        assertRejected(() -> engine.nextUniform(1, 1), "lo < hi");
        assertRejected(() -> engine.nextBernoulli(1.5), "probability");
        assertRejected(() -> engine.nextGaussian(0, -1), "standard deviation");
    }
}
