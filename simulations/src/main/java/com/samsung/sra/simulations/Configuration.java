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
import com.samsung.sra.pointprocess.discrete.MarkovChain;
import org.apache.commons.lang3.builder.HashCodeBuilder;

import java.io.File;
import java.util.List;
import java.util.Map;

/**
 * Configuration of one simulation run, backed by a Toml file. See example.toml for a sample config.
 *
 * Every process section ([homogeneous], [nonhomogeneous], [compound], [markov], [random-walk], [monte-carlo]) is
 * optional; the runner simulates the ones present. Raises IllegalArgumentException on missing keys and unknown
 * distribution/intensity names.
 */
public class Configuration {
    private final Toml toml;

    public Configuration(File file) {
        if (!file.isFile()) throw new IllegalArgumentException("invalid or non-existent config file " + file);
        toml = new Toml().read(file);
    }

    public Configuration(String tomlText) {
        toml = new Toml().read(tomlText);
    }

    /** Seed of the one RandomEngine shared by all sections of the run */
    public long getRandomSeed() {
        return toml.getLong("random-seed", 0L);
    }

    /** Simulate every continuous-time process over [0, horizon] */
    public double getHorizon() {
        return getDouble(toml, "horizon");
    }

    /** Number of independent paths to draw per section */
    public int getReplications() {
        return getInt(toml, "replications", 1, 1);
    }

    public boolean hasSection(String name) {
        return toml.containsTable(name);
    }

    public double getHomogeneousRate() {
        return getDouble(section("homogeneous"), "rate");
    }

    public Intensity getIntensity() {
        return parseIntensity(section("nonhomogeneous").getTable("intensity"));
    }

    /** Explicit dominating-rate if set, else the intensity's own upper bound over the horizon */
    public double getDominatingRate() {
        Toml conf = section("nonhomogeneous");
        return conf.contains("dominating-rate")
                ? getDouble(conf, "dominating-rate")
                : getIntensity().getUpperBound(getHorizon());
    }

    public double getCompoundRate() {
        return getDouble(section("compound"), "rate");
    }

    public Distribution getJumpDistribution() {
        return parseDistribution(section("compound").getTable("jumps"));
    }

    public MarkovChain getMarkovChain() {
        List<List<Object>> rows = section("markov").getList("transitions");
        if (rows == null) throw new IllegalArgumentException("missing key transitions in [markov]");
        double[][] p = new double[rows.size()][];
        for (int i = 0; i < p.length; ++i) {
            List<Object> row = rows.get(i);
            p[i] = new double[row.size()];
            for (int j = 0; j < p[i].length; ++j) {
                p[i][j] = toDouble(row.get(j), "transitions[" + i + "][" + j + "]");
            }
        }
        return new MarkovChain(p);
    }

    public int getMarkovInitialState() {
        return getInt(section("markov"), "initial-state", 0, 0);
    }

    public int getMarkovSteps() {
        return getInt(section("markov"), "steps", 20, 0);
    }

    public double getRandomWalkUpProbability() {
        return getDouble(section("random-walk"), "p", 0.5);
    }

    public int getRandomWalkSteps() {
        return getInt(section("random-walk"), "steps", 100, 0);
    }

    public long getMonteCarloSamples() {
        return section("monte-carlo").getLong("samples", 1_000_000L);
    }

    /**
     * Deterministic hash of the whole config. Two runs with the same hash (which includes the seed) produce identical
     * output, so the runner logs it to identify a run.
     */
    public String getHash() {
        return getHash(toml);
    }

    public static String getHash(Object node) {
        HashCodeBuilder builder = new HashCodeBuilder();
        buildHash(node, builder);
        return Long.toString((long) builder.toHashCode() - (long) Integer.MIN_VALUE);
    }

    @SuppressWarnings("unchecked")
    private static void buildHash(Object node, HashCodeBuilder builder) {
        if (node instanceof List) {
            for (Object entry : (List<Object>) node) { // Array. Hash entries in sequence
                buildHash(entry, builder);
            }
        } else if (node instanceof Toml || node instanceof Map) { // Table. Hash entries in key-sorted order
            Map<String, Object> map = node instanceof Toml ?
                    ((Toml) node).toMap() :
                    (Map<String, Object>) node;
            map.entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .forEach(e -> {
                        builder.append(e.getKey());
                        buildHash(e.getValue(), builder);
                    });
        } else { // a primitive
            builder.append(node);
        }
    }

    public static Distribution parseDistribution(Toml conf) {
        if (conf == null) throw new IllegalArgumentException("missing jump distribution table");
        return constructObjectViaReflection(conf.getString("distribution"), Distribution.class, conf);
    }

    public static Intensity parseIntensity(Toml conf) {
        if (conf == null) throw new IllegalArgumentException("missing intensity table");
        return constructObjectViaReflection(conf.getString("function"), Intensity.class, conf);
    }

    private static <T> T constructObjectViaReflection(String simpleName, Class<T> type, Toml conf) {
        if (simpleName == null) throw new IllegalArgumentException("missing " + type.getSimpleName() + " class name");
        String className = "com.samsung.sra.simulations." + simpleName;
        try {
            Class<?> cls = Class.forName(className);
            if (!type.isAssignableFrom(cls)) {
                throw new IllegalArgumentException(className + " is not a " + type.getSimpleName());
            }
            return type.cast(cls.getConstructor(Toml.class).newInstance(conf));
        } catch (java.lang.reflect.InvocationTargetException e) {
            if (e.getCause() instanceof IllegalArgumentException) {
                throw (IllegalArgumentException) e.getCause();
            }
            throw new IllegalArgumentException("could not construct object of type " + className, e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("could not construct object of type " + className, e);
        }
    }

    private Toml section(String name) {
        Toml conf = toml.getTable(name);
        if (conf == null) throw new IllegalArgumentException("missing section [" + name + "]");
        return conf;
    }

    /** Integer value in [min, Integer.MAX_VALUE] */
    static int getInt(Toml conf, String key, int defaultValue, int min) {
        long value = conf.getLong(key, (long) defaultValue);
        if (value < min || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(key + " must be in [" + min + ", " + Integer.MAX_VALUE + "], got " + value);
        }
        return (int) value;
    }

    /** Toml keeps integer literals as Long and float literals as Double; accept either */
    static double getDouble(Toml conf, String key) {
        Object value = conf.toMap().get(key);
        if (value == null) throw new IllegalArgumentException("missing key " + key);
        return toDouble(value, key);
    }

    static double getDouble(Toml conf, String key, double defaultValue) {
        Object value = conf.toMap().get(key);
        return value == null ? defaultValue : toDouble(value, key);
    }

    private static double toDouble(Object value, String key) {
        if (!(value instanceof Number)) throw new IllegalArgumentException("expected a number for " + key + ", got " + value);
        return ((Number) value).doubleValue();
    }
}
