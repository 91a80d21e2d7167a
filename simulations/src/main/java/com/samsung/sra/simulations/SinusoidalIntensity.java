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
 * base + amplitude * sin(2 pi t / period). Needs amplitude &lt;= base to stay non-negative; base = amplitude = 2,
 * period = 20 oscillates between 0 and 4.
 */
public class SinusoidalIntensity implements Intensity {
    private final double base, amplitude, period;

    public SinusoidalIntensity(double base, double amplitude, double period) {
        if (!(period > 0)) {
            throw new IllegalArgumentException("period must be positive, got " + period);
        }
        if (!(Math.abs(amplitude) <= base)) {
            throw new IllegalArgumentException("sinusoidal intensity goes negative: |amplitude| " + amplitude
                    + " > base " + base);
        }
        this.base = base;
        this.amplitude = amplitude;
        this.period = period;
    }

    public SinusoidalIntensity(Toml conf) {
        this(Configuration.getDouble(conf, "base"),
                Configuration.getDouble(conf, "amplitude"),
                Configuration.getDouble(conf, "period"));
    }

    @Override
    public double rateAt(double t) {
        return base + amplitude * Math.sin(2 * Math.PI * t / period);
    }

    @Override
    public double getUpperBound(double horizon) {
        // crude but safe: the peak may lie outside [0, horizon]
        return base + Math.abs(amplitude);
    }
}
