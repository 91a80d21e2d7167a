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

import com.moandjiezana.toml.Toml;
import com.samsung.sra.pointprocess.RandomEngine;

/** Exponential with rate lambda, i.e. mean 1 / lambda */
public class ExponentialDistribution implements Distribution {
    private final double lambda;

    public ExponentialDistribution(Toml conf) {
        this.lambda = Configuration.getDouble(conf, "lambda");
        if (!(lambda > 0)) {
            throw new IllegalArgumentException("exponential distribution needs lambda > 0, got " + lambda);
        }
    }

    @Override
    public double sample(RandomEngine engine) {
        return engine.nextExponential(lambda);
    }
}
