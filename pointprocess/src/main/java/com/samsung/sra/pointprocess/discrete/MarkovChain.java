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

/**
 * Finite-state, discrete-time Markov chain. transitions[i][j] = P(next state = j | current state = i).
 */
public class MarkovChain {
    private static final double ROW_SUM_TOLERANCE = 1e-9;

    private final double[][] transitions;

    public MarkovChain(double[][] transitions) {
        if (transitions == null || transitions.length == 0) {
            throw new IllegalArgumentException("transition matrix must be non-empty");
        }
        int n = transitions.length;
        this.transitions = new double[n][];
        for (int i = 0; i < n; ++i) {
            double[] row = transitions[i];
            if (row == null || row.length != n) {
                throw new IllegalArgumentException("transition matrix must be square, row " + i + " has wrong length");
            }
            double sum = 0;
            for (int j = 0; j < n; ++j) {
                if (!(row[j] >= 0) || Double.isInfinite(row[j])) {
                    throw new IllegalArgumentException("invalid transition probability p[" + i + "][" + j + "] = " + row[j]);
                }
                sum += row[j];
            }
            if (Math.abs(sum - 1) > ROW_SUM_TOLERANCE) {
                throw new IllegalArgumentException("row " + i + " of transition matrix sums to " + sum + ", not 1");
            }
            this.transitions[i] = row.clone();
        }
    }

    public int getNumStates() {
        return transitions.length;
    }

    public double getTransitionProbability(int from, int to) {
        return transitions[from][to];
    }

    /** Sample the state following {@code state}, inverting the row CDF against one uniform draw */
    public int step(int state, RandomEngine engine) {
        checkState(state);
        double[] row = transitions[state];
        double u = engine.nextUniform();
        double cumulative = 0;
        int last = -1;
        for (int j = 0; j < row.length; ++j) {
            if (row[j] == 0) {
                continue;
            }
            cumulative += row[j];
            last = j;
            if (u < cumulative) {
                return j;
            }
        }
        // rounding left u just above the row total
        return last;
    }

    /** States x_0 = initialState, x_1, ..., x_steps */
    public int[] simulate(int initialState, int steps, RandomEngine engine) {
        checkState(initialState);
        if (steps < 0) {
            throw new IllegalArgumentException("number of steps must be non-negative, got " + steps);
        }
        int[] path = new int[steps + 1];
        path[0] = initialState;
        for (int i = 1; i <= steps; ++i) {
            path[i] = step(path[i - 1], engine);
        }
        return path;
    }

    private void checkState(int state) {
        if (state < 0 || state >= transitions.length) {
            throw new IllegalArgumentException("state " + state + " outside [0, " + transitions.length + ")");
        }
    }
}
