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

import static org.hamcrest.CoreMatchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class HomogeneousPoissonProcessTest {
    @Test
    public void arrivalsIncreaseAndStayWithinHorizon() throws Exception {
        double[] rates = {0.01, 0.5, 1, 7.5, 100};
        double[] horizons = {0.1, 1, 10, 250};
        for (long seed = 0; seed < 20; ++seed) {
            RandomEngine engine = new RandomEngine(seed);
            for (double rate : rates) {
                for (double horizon : horizons) {
                    ArrivalSequence arrivals = HomogeneousPoissonProcess.generate(rate, horizon, engine);
                    double prev = 0;
                    for (int i = 0; i < arrivals.size(); ++i) {
                        double t = arrivals.get(i);
                        assertTrue("arrival " + t + " not after " + prev, i == 0 ? t >= 0 : t > prev);
                        assertTrue("arrival " + t + " beyond horizon " + horizon, t <= horizon);
                        prev = t;
                    }
                }
            }
        }
    }

    @Test
    public void sameSeedGivesSameArrivals() throws Exception {
        RandomEngine engine = new RandomEngine(42);
        ArrivalSequence first = HomogeneousPoissonProcess.generate(3, 50, engine);
        ArrivalSequence second = HomogeneousPoissonProcess.generate(3, 50, engine);
        assertTrue(!first.equals(second)); // the stream moved on

        engine.reset();
        assertEquals(first, HomogeneousPoissonProcess.generate(3, 50, engine));
        assertEquals(second, HomogeneousPoissonProcess.generate(3, 50, engine));

        assertEquals(first, new HomogeneousPoissonProcess(3).generate(50, new RandomEngine(42)));
    }

    @Test
    public void meanCountIsRateTimesHorizon() throws Exception {
        final double rate = 2, horizon = 100;
        final int runs = 2000;
        RandomEngine engine = new RandomEngine(7);
        SummaryStatistics counts = new SummaryStatistics();
        for (int r = 0; r < runs; ++r) {
            counts.addValue(HomogeneousPoissonProcess.generate(rate, horizon, engine).size());
        }
        double expected = rate * horizon;
        // Poisson: variance == mean, so the standard error of the sample mean is sqrt(mean / runs)
        double stderr = Math.sqrt(expected / runs);
        assertEquals(expected, counts.getMean(), 5 * stderr);
        assertEquals(expected, counts.getVariance(), 0.15 * expected);
    }

    @Test
    public void zeroHorizonIsEmpty() throws Exception {
        RandomEngine engine = new RandomEngine(0);
        for (double rate : new double[]{1e-3, 1, 1e6}) {
            assertTrue(HomogeneousPoissonProcess.generate(rate, 0, engine).isEmpty());
        }
    }

    /** SplittableRandom's first nextDouble() is exactly 0 when seed + golden gamma == 0 */
    static final long FIRST_DRAW_ZERO_SEED = -0x9e3779b97f4a7c15L;
    static final long SECOND_DRAW_ZERO_SEED = -2 * 0x9e3779b97f4a7c15L;

    @Test
    public void zeroUniformDrawNeverGivesZeroGap() throws Exception {
        assertEquals(0, new RandomEngine(FIRST_DRAW_ZERO_SEED).nextUniform(), 0);

        assertTrue(HomogeneousPoissonProcess.generate(1, 0, new RandomEngine(FIRST_DRAW_ZERO_SEED)).isEmpty());
        ArrivalSequence first = HomogeneousPoissonProcess.generate(1, 10, new RandomEngine(FIRST_DRAW_ZERO_SEED));
        assertTrue(first.isEmpty() || first.get(0) > 0);

        ArrivalSequence arrivals = HomogeneousPoissonProcess.generate(1, 1e6, new RandomEngine(SECOND_DRAW_ZERO_SEED));
        assertTrue(arrivals.size() > 2);
        assertTrue(arrivals.get(1) > arrivals.get(0));
        // generator output must pass the same validation as caller-supplied times
        assertEquals(arrivals, ArrivalSequence.of(arrivals.toArray()));
    }

    @Test
    public void hugeRateStillStrictlyIncreasing() throws Exception {
        ArrivalSequence arrivals = HomogeneousPoissonProcess.generate(1e15, 1e-9, new RandomEngine(5));
        assertEquals(arrivals, ArrivalSequence.of(arrivals.toArray()));
    }

    @Test
    public void rejectsInvalidParameters() throws Exception {
        RandomEngine engine = new RandomEngine(0);
        assertRejected(() -> HomogeneousPoissonProcess.generate(0, 10, engine), "rate");
        assertRejected(() -> HomogeneousPoissonProcess.generate(-1, 10, engine), "rate");
        assertRejected(() -> HomogeneousPoissonProcess.generate(Double.NaN, 10, engine), "rate");
        assertRejected(() -> HomogeneousPoissonProcess.generate(Double.POSITIVE_INFINITY, 10, engine), "rate");
        assertRejected(() -> HomogeneousPoissonProcess.generate(1, -0.5, engine), "horizon");
        assertRejected(() -> HomogeneousPoissonProcess.generate(1, Double.NaN, engine), "horizon");
        assertRejected(() -> HomogeneousPoissonProcess.generate(1, 10, null), "engine");
        assertRejected(() -> new HomogeneousPoissonProcess(0), "rate");
    }

    static void assertRejected(Runnable call, String messageFragment) {
        try {
            call.run();
        } catch (IllegalArgumentException e) {
            assertThat(e.getMessage(), containsString(messageFragment));
            return;
        }
        fail("expected IllegalArgumentException mentioning " + messageFragment);
    }
}
