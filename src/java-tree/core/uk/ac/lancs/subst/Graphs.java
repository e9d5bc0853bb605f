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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Holds structural tests and traversals over weighted graphs. These
 * back the validation performed before substitutes are computed, and
 * the rooted traversal used to index a tree.
 *
 * <p>
 * A caller stepping from one spanning tree to another would typically
 * do the following:
 *
 * <pre>
 * SubstituteMapping&lt;String&gt; subs = computer.substitute();
 * Edge&lt;String&gt; out = <var>...</var>;
 * Edge&lt;String&gt; in = subs.substitute(out);
 * WeightedGraph&lt;String&gt; next = Graphs.exchange(tree, out, in, graph);
 * </pre>
 *
 * @author simpsons
 */
public final class Graphs {
    private Graphs() {}

    /**
     * Determine whether every vertex of a graph can be reached from
     * every other. A graph with no vertices is considered connected.
     *
     * @param graph the graph to test
     *
     * @param <V> the vertex type
     *
     * @return {@code true} if the graph is connected
     */
    public static <V> boolean isConnected(WeightedGraph<V> graph) {
        Iterator<V> iter = graph.vertices().iterator();
        if (!iter.hasNext()) return true;
        return reach(graph, iter.next()).size() == graph.vertices().size();
    }

    /**
     * Get the set of vertices reachable from a starting vertex.
     *
     * @param graph the graph to explore
     *
     * @param start the starting vertex
     *
     * @param <V> the vertex type
     *
     * @return the reachable vertices, including the start
     */
    public static <V> Collection<V> reach(WeightedGraph<V> graph, V start) {
        Collection<V> reached = new HashSet<>();
        Collection<V> remaining = new HashSet<>();
        remaining.add(start);
        while (!remaining.isEmpty()) {
            V rem = next(remaining);
            if (!reached.add(rem)) continue;
            for (V neigh : graph.neighbours(rem))
                if (!reached.contains(neigh)) remaining.add(neigh);
        }
        return reached;
    }

    /**
     * Find an edge joining a vertex to itself.
     *
     * @param graph the graph to search
     *
     * @param <V> the vertex type
     *
     * @return the first loop found, or {@code null} if there are none
     */
    public static <V> Edge<V> findLoop(WeightedGraph<V> graph) {
        for (Edge<V> edge : graph.edges())
            if (edge.isLoop()) return edge;
        return null;
    }

    /**
     * Find an edge that carries no usable weight. A weight is unusable
     * if it is absent, or is a floating-point NaN.
     *
     * @param graph the graph to search
     *
     * @param <V> the vertex type
     *
     * @return the first unweighted edge found, or {@code null} if all
     * edges are weighted
     */
    public static <V> Edge<V> findUnweighted(WeightedGraph<V> graph) {
        for (Edge<V> edge : graph.edges()) {
            Number w = graph.weightOf(edge);
            if (!Weights.isWeight(w)) return edge;
        }
        return null;
    }

    /**
     * Determine whether a graph is a tree, i.e., connected and acyclic.
     * A connected graph is acyclic exactly when it has one edge fewer
     * than it has vertices.
     *
     * @param graph the graph to test
     *
     * @param <V> the vertex type
     *
     * @return {@code true} if the graph is a tree
     */
    public static <V> boolean isTree(WeightedGraph<V> graph) {
        if (graph.vertices().isEmpty()) return false;
        if (graph.edges().size() != graph.vertices().size() - 1)
            return false;
        return isConnected(graph);
    }

    /**
     * List the vertices reachable from a root in depth-first postorder.
     * Each vertex appears after all vertices first discovered through
     * it. Neighbours are visited in the graph's neighbour order.
     *
     * @param graph the graph to traverse
     *
     * @param root the starting vertex
     *
     * @param <V> the vertex type
     *
     * @return the reachable vertices in postorder, ending with the root
     */
    public static <V> List<V> postorder(WeightedGraph<V> graph, V root) {
        List<V> result = new ArrayList<>(graph.vertices().size());
        Collection<V> visited = new HashSet<>();
        Deque<Map.Entry<V, Iterator<V>>> stack = new ArrayDeque<>();
        visited.add(root);
        stack.push(Map.entry(root, graph.neighbours(root).iterator()));
        while (!stack.isEmpty()) {
            Map.Entry<V, Iterator<V>> top = stack.peek();
            Iterator<V> iter = top.getValue();
            V descent = null;
            while (iter.hasNext()) {
                V cand = iter.next();
                if (visited.add(cand)) {
                    descent = cand;
                    break;
                }
            }
            if (descent == null) {
                /* All neighbours are done, so this vertex can be
                 * listed. */
                stack.pop();
                result.add(top.getKey());
            } else {
                stack.push(Map.entry(descent,
                                     graph.neighbours(descent).iterator()));
            }
        }
        return result;
    }

    /**
     * Create a graph from a subset of another graph's edges, taking the
     * weights from the other graph.
     *
     * @param graph the graph supplying weights
     *
     * @param edges the edges to retain
     *
     * @param <V> the vertex type
     *
     * @return a new graph with the specified edges and their weights
     *
     * @throws NoSuchElementException if an edge is not in the graph
     */
    public static <V> MapGraph<V>
        subgraph(WeightedGraph<V> graph,
                 Collection<? extends Edge<V>> edges) {
        Map<Edge<V>, Number> links = new LinkedHashMap<>();
        for (Edge<V> edge : edges)
            links.put(edge, graph.weightOf(edge));
        return MapGraph.of(links);
    }

    /**
     * Exchange one edge of a tree for another.
     *
     * @param tree the original tree
     *
     * @param removed the edge to be removed from the tree
     *
     * @param added the edge to be added to the tree
     *
     * @param graph the graph supplying the weight of the added edge
     *
     * @param <V> the vertex type
     *
     * @return a new graph with the edge removed and the other added,
     * and with the same vertices as the original tree
     *
     * @throws NoSuchElementException if the removed edge is not in the
     * tree, or the added edge is not in the graph
     */
    public static <V> MapGraph<V> exchange(WeightedGraph<V> tree,
                                           Edge<V> removed, Edge<V> added,
                                           WeightedGraph<V> graph) {
        if (!tree.contains(removed))
            throw new NoSuchElementException("not in tree: " + removed);
        Map<Edge<V>, Number> links = new LinkedHashMap<>();
        for (Edge<V> edge : tree.edges())
            if (!edge.equals(removed)) links.put(edge, tree.weightOf(edge));
        links.put(added, graph.weightOf(added));
        return MapGraph.of(tree.vertices(), links);
    }

    /**
     * Remove and acquire an arbitrary element from a collection.
     *
     * @param coll the collection to be modified
     *
     * @return the removed element
     *
     * @throws NoSuchElementException if the collection is empty
     */
    private static <E> E next(Collection<E> coll) {
        Iterator<E> iter = coll.iterator();
        E r = iter.next();
        iter.remove();
        return r;
    }
}
