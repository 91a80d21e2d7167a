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

/**
 * intercept + slope * t. A negative slope is accepted, but the intensity drops below 0 after t = -intercept / slope;
 * a run whose horizon reaches past that point fails with an IntensityBoundException during thinning.
 */
public class LinearIntensity implements Intensity {
    private final double intercept, slope;

    public LinearIntensity(Toml conf) {
        this.intercept = Configuration.getDouble(conf, "intercept");
        this.slope = Configuration.getDouble(conf, "slope", 0.0);
        if (!(intercept >= 0)) {
            throw new IllegalArgumentException("linear intensity needs intercept >= 0, got " + intercept);
        }
    }

    @Override
    public double rateAt(double t) {
        return intercept + slope * t;
    }

    @Override
    public double getUpperBound(double horizon) {
        return Math.max(intercept, intercept + slope * horizon);
    }
}
