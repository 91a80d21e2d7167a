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
import org.apache.commons.lang3.tuple.ImmutablePair;
import org.apache.commons.lang3.tuple.Pair;

import java.util.OptionalDouble;

/**
 * Sample path of a compound Poisson process: (arrival time, cumulative jump sum) pairs in chronological order. The
 * time component is exactly the underlying {@link ArrivalSequence}. The value component is only monotone if every
 * jump was non-negative.
 */
public final class CompoundPath {
    private final ArrivalSequence arrivals;
    private final double[] values;

    CompoundPath(ArrivalSequence arrivals, double[] values) {
        assert arrivals.size() == values.length;
        this.arrivals = arrivals;
        this.values = values;
    }

    public int size() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public double getTime(int i) {
        return arrivals.get(i);
    }

    public double getValue(int i) {
        return values[i];
    }

    public Pair<Double, Double> get(int i) {
        return new ImmutablePair<>(arrivals.get(i), values[i]);
    }

    public ArrivalSequence getArrivals() {
        return arrivals;
    }

    /** Value of the process after the last jump; empty if there were no arrivals */
    public OptionalDouble getFinalValue() {
        return values.length == 0 ? OptionalDouble.empty() : OptionalDouble.of(values[values.length - 1]);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompoundPath)) return false;
        CompoundPath other = (CompoundPath) o;
        return new EqualsBuilder()
                .append(arrivals, other.arrivals)
                .append(values, other.values)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder().append(arrivals).append(values).toHashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < values.length; ++i) {
            if (i > 0) sb.append(", ");
            sb.append('(').append(arrivals.get(i)).append(", ").append(values[i]).append(')');
        }
        return sb.append(']').toString();
    }
}
