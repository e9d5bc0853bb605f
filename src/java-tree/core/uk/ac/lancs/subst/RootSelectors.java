/*
 * Copyright 2017, Regents of the University of Lancaster
 * All rights reserved.
 * 
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are
 * met:
 * 
 *  * Redistributions of source code must retain the above copyright
 *    notice, this list of conditions and the following disclaimer.
 * 
 *  * Redistributions in binary form must reproduce the above copyright
 *    notice, this list of conditions and the following disclaimer in the
 *    documentation and/or other materials provided with the
 *    distribution.
 * 
 *  * Neither the name of the University of Lancaster nor the names of
 *    its contributors may be used to endorse or promote products derived
 *    from this software without specific prior written permission.
 * 
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS
 * "AS IS" AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT
 * LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR
 * A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT
 * OWNER OR CONTRIBUTORS BE LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL,
 * SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT
 * LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE,
 * DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY
 * THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 *
 *
 * Author: Steven Simpson <s.simpson@lancaster.ac.uk>
 */
package uk.ac.lancs.subst;

import java.util.Objects;
import java.util.Random;

import uk.ac.lancs.subst.config.Configuration;

/**
 * Provides standard ways of choosing a root vertex.
 * 
 * @author simpsons
 */
public final class RootSelectors {
    private RootSelectors() {}

    /**
     * The configuration key selecting the strategy, namely {@value}
     */
    public static final String SELECTION_KEY = "root.selection";

    /**
     * The configuration key supplying a random seed, namely {@value}
     */
    public static final String SEED_KEY = "root.seed";

    /**
     * Choose the first vertex.
     * 
     * @param <V> the vertex type
     * 
     * @return a selector always choosing the first candidate
     */
    public static <V> RootSelector<V> first() {
        return vertices -> vertices.get(0);
    }

    /**
     * Choose a vertex uniformly at random from a fixed seed. The
     * generator is re-seeded on every selection, so the same candidates
     * always yield the same root.
     * 
     * @param seed the random seed
     * 
     * @param <V> the vertex type
     * 
     * @return a reproducible random selector
     */
    public static <V> RootSelector<V> random(long seed) {
        return vertices -> vertices
            .get(new Random(seed).nextInt(vertices.size()));
    }

    /**
     * Choose a vertex uniformly at random from a supplied generator.
     * 
     * @param rng the source of randomness
     * 
     * @param <V> the vertex type
     * 
     * @return a selector drawing from the generator on each selection
     */
    public static <V> RootSelector<V> random(Random rng) {
        Objects.requireNonNull(rng, "rng");
        return vertices -> vertices.get(rng.nextInt(vertices.size()));
    }

    /**
     * Choose a vertex uniformly at random, without a fixed seed.
     * 
     * @param <V> the vertex type
     * 
     * @return an unseeded random selector
     */
    public static <V> RootSelector<V> random() {
        return random(new Random());
    }

    /**
     * Create a selector from configuration. The parameter
     * <samp>root.selection</samp> may be <samp>first</samp> (the
     * default) or <samp>random</samp>. With <samp>random</samp>, a
     * numeric <samp>root.seed</samp> makes selection reproducible.
     * 
     * @param conf the configuration
     * 
     * @param <V> the vertex type
     * 
     * @return the configured selector
     * 
     * @throws IllegalArgumentException if the selection is unknown, or
     * the seed is not a number
     */
    public static <V> RootSelector<V> fromConfiguration(Configuration conf) {
        String selection = conf.get(SELECTION_KEY, "first").trim();
        switch (selection) {
        case "first":
            return first();

        case "random":
            String seedText = conf.get(SEED_KEY);
            if (seedText == null) return random();
            try {
                return random(Long.parseLong(seedText.trim()));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException(SEED_KEY + ": "
                    + seedText, ex);
            }

        default:
            throw new IllegalArgumentException(SELECTION_KEY + ": "
                + selection);
        }
    }
}
