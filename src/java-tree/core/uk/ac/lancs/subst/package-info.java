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
/**
 * Computes substitute edges for spanning trees subject to fixed and
 * restricted edges, after Yamada, Kataoka and Watanabe, <cite>Listing
 * all the minimum spanning trees in an undirected graph</cite>, 2010.
 * 
 * <p>
 * A graph is presented as a {@link uk.ac.lancs.subst.WeightedGraph},
 * usually a {@link uk.ac.lancs.subst.MapGraph} built from a map of
 * {@link uk.ac.lancs.subst.Edge} to weight. A spanning tree is another
 * such graph, whose edges are drawn from the first. Both are checked by
 * {@link uk.ac.lancs.subst.GraphValidator} when a
 * {@link uk.ac.lancs.subst.SubstituteComputer} is created.
 * 
 * <p>
 * The computer ranks the tree's vertices in postorder
 * ({@link uk.ac.lancs.subst.PostorderIndex}), then walks the tree edges
 * bottom-up, keeping candidate edges in a
 * {@link uk.ac.lancs.subst.QuasiCutSet}. The result is a
 * {@link uk.ac.lancs.subst.SubstituteMapping}.
 * 
 * @author simpsons
 */
package uk.ac.lancs.subst;
