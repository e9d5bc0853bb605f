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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Holds an undirected weighted graph as a map from edge to weight.
 * Insertion order is retained for vertices, edges and neighbours. A
 * {@code null} weight marks an edge as unweighted.
 *
 * <p>
 * The graph is immutable once built.
 *
 * <pre>
 * Map&lt;Edge&lt;String&gt;, Double&gt; links = new LinkedHashMap&lt;&gt;();
 * links.put(Edge.of("A", "B"), 1.0);
 * links.put(Edge.of("B", "C"), 2.0);
 * WeightedGraph&lt;String&gt; graph = MapGraph.of(links);
 * </pre>
 *
 * @param <V> the vertex type
 *
 * @author simpsons
 */
public final class MapGraph<V> implements WeightedGraph<V> {
    private final Map<Edge<V>, Number> weights;
    private final Map<V, Collection<V>> neighbours;

    private MapGraph(Collection<? extends V> vertices,
                     Map<? extends Edge<V>, ? extends Number> links) {
        Map<Edge<V>, Number> weights = new LinkedHashMap<>();
        Map<V, Collection<V>> neighbours = new LinkedHashMap<>();
        for (V v : vertices)
            neighbours.computeIfAbsent(v, k -> new LinkedHashSet<>());
        for (Map.Entry<? extends Edge<V>, ? extends Number> entry : links
            .entrySet()) {
            Edge<V> link = entry.getKey();
            weights.put(link, entry.getValue());
            neighbours.computeIfAbsent(link.first(), k -> new LinkedHashSet<>())
                .add(link.second());
            neighbours
                .computeIfAbsent(link.second(), k -> new LinkedHashSet<>())
                .add(link.first());
        }
        for (Map.Entry<V, Collection<V>> entry : neighbours.entrySet())
            entry.setValue(Collections.unmodifiableCollection(entry
                .getValue()));
        this.weights = weights;
        this.neighbours = neighbours;
    }

    /**
     * Create a graph from weighted edges. The vertices are those
     * mentioned by the edges.
     *
     * @param links a map from each edge to its weight
     *
     * @param <V> the vertex type
     *
     * @return the new graph
     */
    public static <V> MapGraph<V>
        of(Map<? extends Edge<V>, ? extends Number> links) {
        return new MapGraph<>(Collections.emptySet(), links);
    }

    /**
     * Create a graph from weighted edges and additional vertices.
     * Vertices listed explicitly come first in iteration order, and may
     * be isolated.
     *
     * @param vertices vertices to include, whether or not they have
     * edges
     *
     * @param links a map from each edge to its weight
     *
     * @param <V> the vertex type
     *
     * @return the new graph
     */
    public static <V> MapGraph<V>
        of(Collection<? extends V> vertices,
           Map<? extends Edge<V>, ? extends Number> links) {
        return new MapGraph<>(vertices, links);
    }

    @Override
    public Collection<V> vertices() {
        return Collections.unmodifiableSet(neighbours.keySet());
    }

    @Override
    public Collection<Edge<V>> edges() {
        return Collections.unmodifiableSet(weights.keySet());
    }

    @Override
    public Collection<V> neighbours(V vertex) {
        return neighbours.getOrDefault(vertex, Collections.emptySet());
    }

    @Override
    public Number weightOf(Edge<V> edge) {
        Number result = weights.get(edge);
        if (result == null && !weights.containsKey(edge))
            throw new NoSuchElementException("no edge " + edge);
        return result;
    }

    @Override
    public boolean contains(Edge<V> edge) {
        return weights.containsKey(edge);
    }

    /**
     * Get the edges and weights as a map.
     *
     * @return an unmodifiable view of the weights of each edge
     */
    public Map<Edge<V>, Number> asMap() {
        return Collections.unmodifiableMap(weights);
    }

    @Override
    public String toString() {
        return weights.toString();
    }
}
