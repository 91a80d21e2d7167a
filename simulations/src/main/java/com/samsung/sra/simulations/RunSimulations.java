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

import com.samsung.sra.pointprocess.ArrivalSequence;
import com.samsung.sra.pointprocess.CompoundPath;
import com.samsung.sra.pointprocess.CompoundPoissonProcess;
import com.samsung.sra.pointprocess.HomogeneousPoissonProcess;
import com.samsung.sra.pointprocess.RandomEngine;
import com.samsung.sra.pointprocess.ThinningPoissonProcess;
import com.samsung.sra.pointprocess.discrete.MarkovChain;
import com.samsung.sra.pointprocess.discrete.MonteCarloPi;
import com.samsung.sra.pointprocess.discrete.RandomWalk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Simulate every process configured in a Toml file and print a summary per process. All sections draw from a single
 * RandomEngine seeded from the config, in the order homogeneous, nonhomogeneous, compound, markov, random-walk,
 * monte-carlo.
 */
public class RunSimulations {
    private static final Logger logger = LoggerFactory.getLogger(RunSimulations.class);

    private final Configuration config;
    private final PrintStream out;
    private final RandomEngine engine;

    public RunSimulations(Configuration config, PrintStream out) {
        this.config = config;
        this.out = out;
        this.engine = new RandomEngine(config.getRandomSeed());
    }

    public static void main(String[] args) throws Exception {
        File configFile;
        if (args.length != 1 || !(configFile = new File(args[0])).isFile()) {
            System.err.println("SYNTAX: RunSimulations config.toml");
            System.exit(2);
            return;
        }
        new RunSimulations(new Configuration(configFile), System.out).run();
    }

    public void run() {
        logger.info("Run {}: seed = {}, horizon = {}, {} replication(s)",
                config.getHash(), engine.getSeed(), config.getHorizon(), config.getReplications());
        if (config.hasSection("homogeneous")) {
            runHomogeneous();
        }
        if (config.hasSection("nonhomogeneous")) {
            runNonHomogeneous();
        }
        if (config.hasSection("compound")) {
            runCompound();
        }
        if (config.hasSection("markov")) {
            runMarkovChain();
        }
        if (config.hasSection("random-walk")) {
            runRandomWalk();
        }
        if (config.hasSection("monte-carlo")) {
            runMonteCarlo();
        }
    }

    private void runHomogeneous() {
        double rate = config.getHomogeneousRate(), T = config.getHorizon();
        HomogeneousPoissonProcess process = new HomogeneousPoissonProcess(rate);
        Statistics counts = new Statistics();
        for (int r = 0; r < config.getReplications(); ++r) {
            counts.addObservation(process.generate(T, engine).size());
        }
        logger.info("Homogeneous: {} (expected mean {})", counts, rate * T);
        printCounts(String.format("Homogeneous Poisson (rate=%s, T=%s)", rate, T), counts);
    }

    private void runNonHomogeneous() {
        double T = config.getHorizon();
        Intensity intensity = config.getIntensity();
        double lambdaMax = config.getDominatingRate();
        ThinningPoissonProcess process = new ThinningPoissonProcess(intensity, lambdaMax);
        Statistics counts = new Statistics();
        for (int r = 0; r < config.getReplications(); ++r) {
            counts.addObservation(process.generate(T, engine).size());
        }
        logger.info("Non-homogeneous ({}, dominating rate {}): {}",
                intensity.getClass().getSimpleName(), lambdaMax, counts);
        printCounts(String.format("Non-homogeneous Poisson (lambdaMax=%s, T=%s)", lambdaMax, T), counts);
    }

    private void runCompound() {
        double rate = config.getCompoundRate(), T = config.getHorizon();
        CompoundPoissonProcess process = new CompoundPoissonProcess(rate, config.getJumpDistribution());
        Statistics jumps = new Statistics(), finalValues = new Statistics();
        CompoundPath path = null;
        for (int r = 0; r < config.getReplications(); ++r) {
            path = process.generate(T, engine);
            jumps.addObservation(path.size());
            // an empty path has not moved from 0
            finalValues.addObservation(path.getFinalValue().orElse(0));
        }
        logger.info("Compound: jumps {}; final value {}", jumps, finalValues);
        if (config.getReplications() == 1) {
            out.println("Compound Poisson process had " + path.size() + " jumps.");
            if (path.getFinalValue().isPresent()) {
                out.println("Final value at time T=" + T + " is " + path.getFinalValue().getAsDouble());
            }
        } else {
            out.println(String.format("Compound Poisson (rate=%s, T=%s) jumps: %s", rate, T, jumps));
            out.println(String.format("Compound Poisson (rate=%s, T=%s) final value: %s", rate, T, finalValues));
        }
    }

    private void runMarkovChain() {
        MarkovChain chain = config.getMarkovChain();
        int[] states = chain.simulate(config.getMarkovInitialState(), config.getMarkovSteps(), engine);
        out.println("Simulated Markov chain states: "
                + Arrays.stream(states).mapToObj(Integer::toString).collect(Collectors.joining(" -> ")));
    }

    private void runRandomWalk() {
        RandomWalk walk = new RandomWalk(config.getRandomWalkUpProbability());
        int steps = config.getRandomWalkSteps();
        Statistics finalPositions = new Statistics();
        for (int r = 0; r < config.getReplications(); ++r) {
            finalPositions.addObservation(walk.simulate(steps, engine)[steps]);
        }
        out.println(String.format("Random walk (p=%s, %d steps) final position: %s",
                walk.getUpProbability(), steps, finalPositions));
    }

    private void runMonteCarlo() {
        long samples = config.getMonteCarloSamples();
        double estimate = MonteCarloPi.estimate(samples, engine);
        logger.info("Monte-Carlo pi with {} samples: error {}", samples, Math.abs(estimate - Math.PI));
        out.println("Estimated Pi = " + estimate);
    }

    private void printCounts(String label, Statistics counts) {
        if (counts.getCount() == 1) {
            out.println(label + " generated " + (long) counts.getMean() + " arrivals.");
        } else {
            out.println(label + " arrivals: " + counts);
        }
    }
}
