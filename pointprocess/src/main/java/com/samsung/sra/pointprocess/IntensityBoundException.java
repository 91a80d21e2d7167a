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

/**
 * Raised when an intensity function returns a value outside [0, dominatingRate] (or NaN) at some candidate arrival
 * time during thinning.
 */
public class IntensityBoundException extends IllegalArgumentException {
    private final double time, intensity, dominatingRate;

    public IntensityBoundException(double time, double intensity, double dominatingRate) {
        super(String.format("intensity %s at t = %s is outside [0, %s]", intensity, time, dominatingRate));
        this.time = time;
        this.intensity = intensity;
        this.dominatingRate = dominatingRate;
    }

    public double getTime() {
        return time;
    }

    public double getIntensity() {
        return intensity;
    }

    public double getDominatingRate() {
        return dominatingRate;
    }
}
