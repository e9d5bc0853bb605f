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
package uk.ac.lancs.subst.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConfigurationTest {
    private ConfigurationContext context;

    private URI settings;

    @BeforeEach
    void locateSettings() throws Exception {
        context = new ConfigurationContext();
        settings = ConfigurationTest.class
            .getResource("substitutes.properties").toURI();
    }

    @Test
    void keysNormalized() {
        assertEquals("root.seed", Configuration.normalizeKey("..root...seed."));
        assertEquals("root.", Configuration.normalizePrefix("root"));
        assertEquals("", Configuration.normalizePrefix("..."));
        assertNull(Configuration.normalizeKey(null));
    }

    @Test
    void subviewStripsPrefix() throws Exception {
        Configuration conf = context.get(settings);
        Configuration sub = conf.subview("substitutes");
        assertEquals("random", sub.get("root.selection"));
        assertEquals("17", sub.subview("root").get("seed"));
        assertEquals("substitutes.root.", sub.subview("root").prefix());
        assertEquals("first", sub.get("root.missing", "first"));
        assertSame(conf, conf.subview(""));

        List<String> keys = new ArrayList<>();
        sub.keys().forEach(keys::add);
        keys.sort(null);
        assertEquals(Arrays.asList("postordered", "root.seed",
                                   "root.selection"),
                     keys);
        assertEquals("false", sub.toProperties().getProperty("postordered"));
    }

    @Test
    void fragmentSelectsSubview() throws Exception {
        Configuration sub = context.get(URI.create(settings + "#trusted"));
        assertEquals("true", sub.get("postordered"));
        assertEquals("trusted.", sub.prefix());
    }

    @Test
    void loadedFilesCached() throws Exception {
        assertSame(context.get(settings), context.get(settings));
    }

    @Test
    void defaultsFillGaps() {
        Properties defaults = new Properties();
        defaults.setProperty("root.selection", "first");
        ConfigurationContext ctxt = new ConfigurationContext(defaults);
        Properties props = new Properties();
        props.setProperty("root.seed", "4");
        Configuration conf = ctxt.get(props);
        assertEquals("first", conf.get("root.selection"));
        assertEquals("4", conf.get("root.seed"));
    }

    @Test
    void missingFileReported() {
        assertThrows(IOException.class,
                     () -> context.get("no-such-settings.properties"));
    }
}
