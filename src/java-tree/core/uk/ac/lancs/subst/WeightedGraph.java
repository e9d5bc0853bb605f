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
import java.util.NoSuchElementException;

/**
 * Presents an undirected graph whose edges carry weights. Iteration
 * orders of vertices, edges and neighbours are stable, so algorithms
 * that walk the graph behave reproducibly.
 *
 * @param <V> the vertex type
 *
 * @author simpsons
 */
public interface WeightedGraph<V> {
    /**
     * Get the vertices of the graph.
     *
     * @return an unmodifiable view of the vertices
     */
    Collection<V> vertices();

    /**
     * Get the edges of the graph.
     *
     * @return an unmodifiable view of the edges
     */
    Collection<Edge<V>> edges();

    /**
     * Get the vertices adjacent to a given vertex.
     *
     * @param vertex the vertex whose neighbours are sought
     *
     * @return an unmodifiable view of the neighbours, or an empty
     * collection if the vertex is not in the graph
     */
    Collection<V> neighbours(V vertex);

    /**
     * Get the weight of an edge.
     *
     * @param edge the edge whose weight is sought
     *
     * @return the edge's weight, or {@code null} if the edge carries no
     * weight
     *
     * @throws NoSuchElementException if the edge is not in the graph
     */
    Number weightOf(Edge<V> edge);

    /**
     * Determine whether an edge is in the graph.
     *
     * @param edge the edge to test
     *
     * @return {@code true} if the graph contains the edge
     */
    default boolean contains(Edge<V> edge) {
        return edges().contains(edge);
    }

    /**
     * Determine whether two vertices are adjacent.
     *
     * @param a one vertex
     *
     * @param b another vertex
     *
     * @return {@code true} if an edge joins the vertices
     */
    default boolean contains(V a, V b) {
        return contains(Edge.of(a, b));
    }

    /**
     * Get the weight of the edge joining two vertices.
     *
     * @param a one vertex
     *
     * @param b another vertex
     *
     * @return the weight of the edge, as stored
     *
     * @throws NoSuchElementException if no edge joins the vertices, or
     * the edge carries no weight
     */
    default Number weight(V a, V b) {
        Edge<V> edge = Edge.of(a, b);
        Number w = weightOf(edge);
        if (w == null) throw new NoSuchElementException("unweighted: " + edge);
        return w;
    }
}
