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

/** Simple random walk on the integers started at 0: +1 with probability p, -1 otherwise */
public class RandomWalk {
    private final double p;

    public RandomWalk(double p) {
        if (!(p >= 0 && p <= 1)) {
            throw new IllegalArgumentException("step probability must be in [0, 1], got " + p);
        }
        this.p = p;
    }

    public double getUpProbability() {
        return p;
    }

    /** Positions s_0 = 0, s_1, ..., s_steps */
    public int[] simulate(int steps, RandomEngine engine) {
        if (steps < 0) {
            throw new IllegalArgumentException("number of steps must be non-negative, got " + steps);
        }
        int[] positions = new int[steps + 1];
        for (int i = 1; i <= steps; ++i) {
            positions[i] = positions[i - 1] + (engine.nextBernoulli(p) ? 1 : -1);
        }
        return positions;
    }
}
