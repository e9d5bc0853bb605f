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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static uk.ac.lancs.subst.Fixtures.e;

import java.net.URI;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import uk.ac.lancs.subst.config.Configuration;
import uk.ac.lancs.subst.config.ConfigurationContext;

class RootSelectorsTest {
    private static final List<String> VERTICES =
        Arrays.asList("a", "b", "c", "d", "e", "f", "g");

    private ConfigurationContext context;

    private URI settings;

    @BeforeEach
    void locateSettings() throws Exception {
        context = new ConfigurationContext();
        settings = RootSelectorsTest.class
            .getResource("config/substitutes.properties").toURI();
    }

    private Configuration section(String name) throws Exception {
        return context.get(URI.create(settings + "#" + name));
    }

    @Test
    void firstTakesHeadOfList() {
        assertEquals("a", RootSelectors.<String> first().selectRoot(VERTICES));
    }

    @Test
    void seededSelectionRepeats() {
        RootSelector<String> selector = RootSelectors.random(99L);
        String root = selector.selectRoot(VERTICES);
        for (int i = 0; i < 5; i++)
            assertEquals(root, selector.selectRoot(VERTICES));
        assertEquals(VERTICES.get(new Random(99L).nextInt(VERTICES.size())),
                     root);
    }

    @Test
    void sharedGeneratorAdvances() {
        Random mine = new Random(5L);
        RootSelector<String> selector = RootSelectors.random(new Random(5L));
        for (int i = 0; i < 5; i++)
            assertEquals(VERTICES.get(mine.nextInt(VERTICES.size())),
                         selector.selectRoot(VERTICES));
    }

    @Test
    void configuredRandomSelection() throws Exception {
        RootSelector<String> selector =
            RootSelectors.fromConfiguration(section("substitutes"));
        assertEquals(RootSelectors.<String> random(17L).selectRoot(VERTICES),
                     selector.selectRoot(VERTICES));
    }

    @Test
    void configurationDefaultsToFirst() throws Exception {
        assertEquals("a", RootSelectors.<String> fromConfiguration(section(
            "trusted")).selectRoot(VERTICES));
    }

    @Test
    void malformedSettingsRejected() throws Exception {
        Configuration broken = section("broken");
        IllegalArgumentException ex =
            assertThrows(IllegalArgumentException.class,
                         () -> RootSelectors.fromConfiguration(broken));
        assertTrue(ex.getMessage().contains("central"));

        Configuration badSeed = section("badseed");
        ex = assertThrows(IllegalArgumentException.class,
                          () -> RootSelectors.fromConfiguration(badSeed));
        assertTrue(ex.getCause() instanceof NumberFormatException);
    }

    @Test
    void builderReadsPostorderSetting() throws Exception {
        Map<Edge<Integer>, Number> links = new LinkedHashMap<>();
        links.put(e(1, 2), 1.0);
        links.put(e(2, 3), 1.0);
        links.put(e(3, 4), 1.0);
        MapGraph<Integer> path = MapGraph.of(Arrays.asList(4, 3, 2, 1), links);

        SubstituteComputer<Integer> computer = SubstituteComputer
            .start(Integer.class).withGraph(Fixtures.cycle()).withTree(path)
            .rootedBy(vertices -> 3).configuredBy(section("trusted"))
            .create();
        assertEquals(Arrays.asList(4, 3, 2, 1), computer.index().order());

        Properties props = new Properties();
        props.setProperty("postordered", "maybe");
        Configuration odd = context.get(props);
        assertThrows(IllegalArgumentException.class,
                     () -> SubstituteComputer.start(Integer.class)
                         .configuredBy(odd));
    }
}
