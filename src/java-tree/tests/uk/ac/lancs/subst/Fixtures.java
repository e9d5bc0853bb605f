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

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import uk.ac.lancs.subst.json.GraphJson;

/**
 * Builds graphs, trees and expected results for tests.
 *
 * @author simpsons
 */
final class Fixtures {
    private Fixtures() {}

    static Edge<Integer> e(int a, int b) {
        return Edge.of(a, b);
    }

    /**
     * Build a graph from triples of (vertex, vertex, weight).
     */
    static MapGraph<Integer> graph(int... triples) {
        Map<Edge<Integer>, Number> links = new LinkedHashMap<>();
        for (int i = 0; i + 2 < triples.length; i += 3)
            links.put(e(triples[i], triples[i + 1]), (double) triples[i + 2]);
        return MapGraph.of(links);
    }

    /**
     * Build a tree from pairs of vertices, with weights from a graph.
     */
    static MapGraph<Integer> tree(WeightedGraph<Integer> graph,
                                  int... pairs) {
        List<Edge<Integer>> edges = new ArrayList<>();
        for (int i = 0; i + 1 < pairs.length; i += 2)
            edges.add(e(pairs[i], pairs[i + 1]));
        return Graphs.subgraph(graph, edges);
    }

    /**
     * Get the path 1-2-3-4 closed into a cycle by 1-4, all edges
     * weighing 1.
     */
    static MapGraph<Integer> cycle() {
        return graph(1, 2, 1, 2, 3, 1, 3, 4, 1, 1, 4, 1);
    }

    static MapGraph<Integer> cyclePath() {
        return tree(cycle(), 1, 2, 2, 3, 3, 4);
    }

    /**
     * Load the six-vertex example graph.
     */
    static MapGraph<Integer> example() {
        InputStream in =
            Fixtures.class.getResourceAsStream("example-graph.json");
        try (Reader r = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return GraphJson.read(r, Integer::valueOf);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    /**
     * Get the minimum spanning tree of the example graph.
     */
    static MapGraph<Integer> exampleTree() {
        return tree(example(), 1, 2, 1, 3, 2, 4, 4, 5, 4, 6);
    }

    /**
     * A generated graph with a spanning tree and constraints
     */
    static final class Case {
        final MapGraph<Integer> graph;
        final MapGraph<Integer> tree;
        final EdgeConstraints<Integer> constraints;

        Case(MapGraph<Integer> graph, MapGraph<Integer> tree,
             EdgeConstraints<Integer> constraints) {
            this.graph = graph;
            this.tree = tree;
            this.constraints = constraints;
        }
    }

    /**
     * Generate a connected graph with small integer weights, so that
     * equal-weight alternatives are common. The tree attaches each
     * vertex to a random earlier one, and is not necessarily minimal.
     * Some tree edges are fixed, and some non-tree edges restricted.
     */
    static Case randomCase(long seed, int vertices, int extraEdges) {
        Random rng = new Random(seed);
        Map<Edge<Integer>, Number> links = new LinkedHashMap<>();
        List<Edge<Integer>> treeEdges = new ArrayList<>();
        for (int v = 2; v <= vertices; v++) {
            Edge<Integer> edge = e(1 + rng.nextInt(v - 1), v);
            links.put(edge, (double) (1 + rng.nextInt(3)));
            treeEdges.add(edge);
        }
        Collection<Edge<Integer>> fixed = new HashSet<>();
        for (Edge<Integer> edge : treeEdges)
            if (rng.nextInt(5) == 0) fixed.add(edge);
        Collection<Edge<Integer>> restricted = new HashSet<>();
        for (int i = 0; i < extraEdges; i++) {
            int a = 1 + rng.nextInt(vertices);
            int b = 1 + rng.nextInt(vertices);
            if (a == b) continue;
            Edge<Integer> edge = e(a, b);
            if (links.containsKey(edge)) continue;
            links.put(edge, (double) (1 + rng.nextInt(3)));
            if (rng.nextInt(6) == 0) restricted.add(edge);
        }
        MapGraph<Integer> graph = MapGraph.of(links);
        return new Case(graph, Graphs.subgraph(graph, treeEdges),
                        EdgeConstraints.of(fixed, restricted));
    }

    /**
     * Find every valid substitute for a tree edge by trying each
     * exchange.
     */
    static <V> Collection<Edge<V>>
        bruteForce(WeightedGraph<V> graph, WeightedGraph<V> tree,
                   EdgeConstraints<V> constraints, Edge<V> treeEdge) {
        Collection<Edge<V>> result = new HashSet<>();
        if (constraints.isFixed(treeEdge)) return result;
        Number weight = tree.weightOf(treeEdge);
        for (Edge<V> cand : graph.edges()) {
            if (tree.contains(cand) || constraints.isRestricted(cand))
                continue;
            if (!Weights.equal(graph.weightOf(cand), weight)) continue;
            if (Graphs.isTree(Graphs.exchange(tree, treeEdge, cand, graph)))
                result.add(cand);
        }
        return result;
    }
}
