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
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class MonteCarloPiTest {
    @Test
    public void estimate() throws Exception {
        assertEquals(Math.PI, MonteCarloPi.estimate(1_000_000, new RandomEngine(12345)), 0.01);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNoSamples() throws Exception {
        MonteCarloPi.estimate(0, new RandomEngine(0));
    }
}
