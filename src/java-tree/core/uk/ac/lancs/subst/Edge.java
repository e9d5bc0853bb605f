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

import java.util.AbstractList;
import java.util.NoSuchElementException;

/**
 * Describes an undirected edge between two vertices and is suitable as
 * a hash key. This class defines a canonical order for vertices, based
 * simply on their hash codes. Two edges are equal if they join the same
 * pair of vertices, regardless of the order in which the vertices were
 * supplied.
 *
 * <p>
 * An edge may join a vertex to itself, so that such loops can be
 * detected and rejected by {@link GraphValidator}.
 *
 * @param <V> the vertex type
 *
 * @author simpsons
 */
public final class Edge<V> extends AbstractList<V> {
    private final V first, second;

    /**
     * The stored hash code of a vertex
     */
    private final int firstHash, secondHash;

    /**
     * Create an undirected edge between two vertices. The supplied
     * arguments are canonicalized, and so might not match the eventual
     * field values.
     *
     * @param first a vertex
     *
     * @param second another vertex
     *
     * @param <V> the vertex type
     *
     * @return an edge connecting the two vertices
     */
    public static <V> Edge<V> of(V first, V second) {
        return new Edge<>(first, second);
    }

    private Edge(V first, V second) {
        if (first == null) throw new NullPointerException("first");
        if (second == null) throw new NullPointerException("second");
        int firstHash = first.hashCode();
        int secondHash = second.hashCode();
        if (firstHash <= secondHash) {
            this.first = first;
            this.second = second;
            this.firstHash = firstHash;
            this.secondHash = secondHash;
        } else {
            this.first = second;
            this.second = first;
            this.firstHash = secondHash;
            this.secondHash = firstHash;
        }
    }

    /**
     * Get the hash code of this edge.
     *
     * @return the hash code of this edge, a combination of the hash
     * codes of the vertices
     */
    @Override
    public int hashCode() {
        return firstHash * 31 + secondHash;
    }

    /**
     * Determine whether another object describes this edge.
     *
     * @param other the other object
     *
     * @return {@code true} iff the other object is an edge joining the
     * same two vertices
     */
    @Override
    public boolean equals(Object other) {
        if (other == this) return true;
        if (!(other instanceof Edge)) return false;
        Edge<?> p = (Edge<?>) other;
        /* Vertices with colliding hash codes might have been stored in
         * either order. */
        return (first.equals(p.first) && second.equals(p.second))
            || (first.equals(p.second) && second.equals(p.first));
    }

    /**
     * Get the first vertex.
     *
     * @return the first vertex
     */
    public V first() {
        return first;
    }

    /**
     * Get the second vertex.
     *
     * @return the second vertex
     */
    public V second() {
        return second;
    }

    /**
     * Get the vertex at the other end of this edge.
     *
     * @param vertex one of the ends of this edge
     *
     * @return the other end
     *
     * @throws IllegalArgumentException if the supplied vertex is not
     * an end of this edge
     */
    public V other(V vertex) {
        if (first.equals(vertex)) return second;
        if (second.equals(vertex)) return first;
        throw new IllegalArgumentException("not on " + this + ": " + vertex);
    }

    /**
     * Determine whether this edge joins a vertex to itself.
     *
     * @return {@code true} if both ends are the same vertex
     */
    public boolean isLoop() {
        return first.equals(second);
    }

    /**
     * Get a string representation of this edge.
     *
     * @return string representations of the two vertices, separated by
     * a comma, and surrounded by angle brackets
     */
    @Override
    public String toString() {
        return "<" + first + "," + second + ">";
    }

    /**
     * Get the number of elements in the edge.
     *
     * @return 2
     */
    @Override
    public int size() {
        return 2;
    }

    /**
     * Get a vertex.
     *
     * @param index 0 or 1
     *
     * @return one of the vertices forming this edge, in canonical order
     */
    @Override
    public V get(int index) {
        switch (index) {
        case 0:
            return first;
        case 1:
            return second;
        default:
            throw new NoSuchElementException("index: " + index);
        }
    }
}
