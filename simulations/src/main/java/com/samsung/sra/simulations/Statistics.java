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
package com.samsung.sra.simulations;

/** Count/mean/standard deviation/min/max over a set of numeric observations, e.g. one value per replication */
public class Statistics {
    private long N = 0;
    private double sum = 0, sqsum = 0;
    private double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;

    public void addObservation(double obs) {
        ++N;
        sum += obs;
        sqsum += obs * obs;
        min = Math.min(min, obs);
        max = Math.max(max, obs);
    }

    public long getCount() {
        return N;
    }

    public double getMean() {
        return N > 0 ? sum / N : 0;
    }

    /** Sample standard deviation (N - 1 denominator) */
    public double getStandardDeviation() {
        if (N < 2) {
            return 0;
        }
        double var = (sqsum - sum * sum / N) / (N - 1);
        return var > 0 ? Math.sqrt(var) : 0; // rounding can push var of identical observations below 0
    }

    public double getMin() {
        return N > 0 ? min : Double.NaN;
    }

    public double getMax() {
        return N > 0 ? max : Double.NaN;
    }

    @Override
    public String toString() {
        return String.format("mean %.4f, sd %.4f, range [%.4f, %.4f] over %d runs",
                getMean(), getStandardDeviation(), getMin(), getMax(), N);
    }
}
