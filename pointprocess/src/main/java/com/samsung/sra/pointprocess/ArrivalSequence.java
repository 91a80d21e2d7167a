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

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

import java.util.Arrays;
import java.util.OptionalDouble;
import java.util.stream.DoubleStream;

/**
 * Immutable, strictly increasing sequence of arrival times. Generators create a fresh instance per call and hand it
 * over to the caller.
 */
public final class ArrivalSequence {
    private static final ArrivalSequence EMPTY = new ArrivalSequence(new double[0]);

    private final double[] times;

    /** Takes ownership of times, which must already be non-negative and strictly increasing */
    private ArrivalSequence(double[] times) {
        this.times = times;
    }

    public static ArrivalSequence empty() {
        return EMPTY;
    }

    /** Copy and validate caller-supplied times */
    public static ArrivalSequence of(double... times) {
        if (times == null) {
            throw new IllegalArgumentException("times must be non-null");
        }
        double prev = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < times.length; ++i) {
            double t = times[i];
            if (!(t >= 0) || Double.isInfinite(t)) {
                throw new IllegalArgumentException("arrival time must be non-negative and finite, got " + t + " at index " + i);
            }
            if (t <= prev) {
                throw new IllegalArgumentException("arrival times must be strictly increasing, got " + prev + " then " + t);
            }
            prev = t;
        }
        return times.length == 0 ? EMPTY : new ArrivalSequence(times.clone());
    }

    /** Wrap the first n entries of a buffer the generators have filled in increasing order */
    static ArrivalSequence wrap(double[] buffer, int n) {
        return n == 0 ? EMPTY : new ArrivalSequence(Arrays.copyOf(buffer, n));
    }

    public int size() {
        return times.length;
    }

    public boolean isEmpty() {
        return times.length == 0;
    }

    public double get(int i) {
        return times[i];
    }

    public OptionalDouble getLast() {
        return times.length == 0 ? OptionalDouble.empty() : OptionalDouble.of(times[times.length - 1]);
    }

    public double[] toArray() {
        return times.clone();
    }

    public DoubleStream stream() {
        return Arrays.stream(times);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArrivalSequence)) return false;
        return new EqualsBuilder().append(times, ((ArrivalSequence) o).times).isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder().append(times).toHashCode();
    }

    @Override
    public String toString() {
        return Arrays.toString(times);
    }
}
