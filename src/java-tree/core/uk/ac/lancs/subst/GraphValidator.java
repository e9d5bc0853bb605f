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

/**
 * Checks the structural preconditions on a graph and a proposed
 * spanning tree of it.
 *
 * @author simpsons
 */
public final class GraphValidator {
    private GraphValidator() {}

    /**
     * Ensure that a graph is connected, has no loops, and is weighted.
     *
     * @param graph the graph to check
     *
     * @param <V> the vertex type
     *
     * @throws InvalidGraphException if the graph is disconnected,
     * contains a loop, or has an edge without a weight
     */
    public static <V> void checkGraph(WeightedGraph<V> graph)
        throws InvalidGraphException {
        if (!Graphs.isConnected(graph))
            throw new InvalidGraphException("graph not connected");
        Edge<V> loop = Graphs.findLoop(graph);
        if (loop != null)
            throw new InvalidGraphException("graph has loop " + loop);
        Edge<V> unweighted = Graphs.findUnweighted(graph);
        if (unweighted != null)
            throw new InvalidGraphException("graph edge " + unweighted
                + " has no weight");
    }

    /**
     * Ensure that a proposed tree is a spanning tree of a graph. The
     * tree is first checked as a graph in its own right. Each of its
     * edges must then appear in the graph with the same weight, it must
     * touch every vertex of the graph, and it must be acyclic.
     *
     * @param tree the proposed tree
     *
     * @param graph the graph the tree must span
     *
     * @param <V> the vertex type
     *
     * @throws InvalidTreeException if the tree is not a spanning tree
     * of the graph
     */
    public static <V> void checkTree(WeightedGraph<V> tree,
                                     WeightedGraph<V> graph)
        throws InvalidTreeException {
        try {
            checkGraph(tree);
        } catch (InvalidGraphException ex) {
            throw new InvalidTreeException("tree invalid as graph: "
                + ex.getMessage(), ex);
        }

        for (Edge<V> edge : tree.edges()) {
            if (!graph.contains(edge))
                throw new InvalidTreeException("tree edge " + edge
                    + " not in graph");
            Number tw = tree.weightOf(edge);
            Number gw = graph.weightOf(edge);
            if (gw == null || !Weights.equal(tw, gw))
                throw new InvalidTreeException("tree edge " + edge
                    + " weighs " + tw + "; graph has " + gw);
        }

        for (V v : graph.vertices())
            if (!tree.vertices().contains(v))
                throw new InvalidTreeException("tree does not reach " + v);

        if (!Graphs.isTree(tree))
            throw new InvalidTreeException("not a tree: "
                + tree.edges().size() + " edges for "
                + tree.vertices().size() + " vertices");
    }

    /**
     * Ensure that both a graph and a proposed spanning tree of it are
     * valid.
     *
     * @param graph the graph
     *
     * @param tree the proposed tree
     *
     * @param <V> the vertex type
     *
     * @throws InvalidGraphException if the graph is invalid
     *
     * @throws InvalidTreeException if the tree is not a spanning tree
     * of the graph
     */
    public static <V> void check(WeightedGraph<V> graph,
                                 WeightedGraph<V> tree)
        throws InvalidGraphException {
        checkGraph(Objects.requireNonNull(graph, "graph"));
        checkTree(Objects.requireNonNull(tree, "tree"), graph);
    }
}
