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
 * Describes a non-tree edge as a directed candidate for bridging the
 * cut formed by removing a tree edge. The source lies on the side of
 * the cut being processed.
 * 
 * @param <V> the vertex type
 * 
 * @author simpsons
 */
public final class QuasiCutEntry<V> {
    /**
     * The weight of the edge
     */
    public final Number weight;

    /**
     * The end of the edge on the processed side
     */
    public final V source;

    /**
     * The other end of the edge
     */
    public final V target;

    /**
     * Create an entry.
     * 
     * @param weight the weight of the edge, compared by numeric value
     * 
     * @param source the end of the edge on the processed side
     * 
     * @param target the other end of the edge
     */
    public QuasiCutEntry(Number weight, V source, V target) {
        this.weight = weight;
        this.source = source;
        this.target = target;
    }

    /**
     * Get the entry for the same edge in the opposite direction.
     * 
     * @return the reversed entry
     */
    public QuasiCutEntry<V> reverse() {
        return new QuasiCutEntry<>(weight, target, source);
    }

    /**
     * Get the undirected edge.
     * 
     * @return the edge joining source and target
     */
    public Edge<V> edge() {
        return Edge.of(source, target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Weights.hash(weight), source, target);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null) return false;
        if (getClass() != obj.getClass()) return false;
        QuasiCutEntry<?> other = (QuasiCutEntry<?>) obj;
        return Weights.equal(weight, other.weight)
            && Objects.equals(source, other.source)
            && Objects.equals(target, other.target);
    }

    @Override
    public String toString() {
        return "(" + weight + ", " + source + ", " + target + ")";
    }
}
