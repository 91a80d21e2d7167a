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

public class MonteCarloPi {
    private MonteCarloPi() {}

    /** 4 * (fraction of uniform points in [-1, 1]^2 that land inside the unit circle) */
    public static double estimate(long samples, RandomEngine engine) {
        if (samples <= 0) {
            throw new IllegalArgumentException("number of samples must be positive, got " + samples);
        }
        long inside = 0;
        for (long i = 0; i < samples; ++i) {
            double x = 2 * engine.nextUniform() - 1;
            double y = 2 * engine.nextUniform() - 1;
            if (x * x + y * y <= 1) {
                ++inside;
            }
        }
        return 4.0 * inside / samples;
    }
}
