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
package com.samsung.sra.pointprocess.discrete;

import com.samsung.sra.pointprocess.RandomEngine;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.containsString;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class MarkovChainTest {
    private static final double[][] P = {
            {0.2, 0.3, 0.5},
            {0.0, 0.3, 0.7},
            {0.5, 0.4, 0.1}
    };

    @Test
    public void transitionFrequencies() throws Exception {
        MarkovChain chain = new MarkovChain(P);
        RandomEngine engine = new RandomEngine(0);
        int n = 100_000;
        for (int from = 0; from < P.length; ++from) {
            int[] counts = new int[P.length];
            for (int i = 0; i < n; ++i) {
                ++counts[chain.step(from, engine)];
            }
            for (int to = 0; to < P.length; ++to) {
                assertEquals(P[from][to], (double) counts[to] / n, 0.01);
            }
        }
    }

    @Test
    public void simulate() throws Exception {
        MarkovChain chain = new MarkovChain(P);
        int[] path = chain.simulate(1, 20, new RandomEngine(4));
        assertEquals(21, path.length);
        assertEquals(1, path[0]);
        for (int i = 1; i < path.length; ++i) {
            if (path[i - 1] == 1) {
                assertNotEquals(0, path[i]); // p[1][0] == 0
            }
        }
        assertArrayEquals(path, chain.simulate(1, 20, new RandomEngine(4)));
        assertArrayEquals(new int[]{2}, chain.simulate(2, 0, new RandomEngine(4)));
    }

    @Test
    public void absorbingState() throws Exception {
        MarkovChain chain = new MarkovChain(new double[][]{{1, 0}, {0.5, 0.5}});
        assertArrayEquals(new int[]{0, 0, 0, 0, 0, 0}, chain.simulate(0, 5, new RandomEngine(0)));
    }

    @Test
    public void rejectsMalformedMatrices() throws Exception {
        assertRejected(new double[][]{}, "non-empty");
        assertRejected(new double[][]{{0.5, 0.5}, {1}}, "square");
        assertRejected(new double[][]{{0.5, 0.6}, {0, 1}}, "sums to");
        assertRejected(new double[][]{{1.5, -0.5}, {0, 1}}, "invalid transition probability");
        MarkovChain chain = new MarkovChain(P);
        try {
            chain.simulate(3, 1, new RandomEngine(0));
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertThat(e.getMessage(), containsString("outside"));
        }
    }

    private static void assertRejected(double[][] p, String messageFragment) {
        try {
            new MarkovChain(p);
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertThat(e.getMessage(), containsString(messageFragment));
        }
    }
}
