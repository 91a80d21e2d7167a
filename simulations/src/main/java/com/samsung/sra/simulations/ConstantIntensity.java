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

public class ConstantIntensity implements Intensity {
    private final double rate;

    public ConstantIntensity(Toml conf) {
        this.rate = Configuration.getDouble(conf, "rate");
        if (!(rate >= 0)) {
            throw new IllegalArgumentException("constant intensity must be non-negative, got " + rate);
        }
    }

    @Override
    public double rateAt(double t) {
        return rate;
    }

    @Override
    public double getUpperBound(double horizon) {
        return rate;
    }
}
