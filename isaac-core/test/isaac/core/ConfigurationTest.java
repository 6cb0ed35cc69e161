/*
 *  Licensed to the Apache Software Foundation (ASF) under one
 *  or more contributor license agreements.  See the NOTICE file
 *  distributed with this work for additional information
 *  regarding copyright ownership.  The ASF licenses this file
 *  to you under the Apache License, Version 2.0 (the
 *  "License"); you may not use this file except in compliance
 *  with the License.  You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package isaac.core;

import java.io.File;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Assert;
import org.junit.Test;

import isaac.generators.Isaac32;
import isaac.generators.Isaac64;
import isaac.generators.IsaacEngine;
import isaac.generators.SeedSequence;
import isaac.generators.StandardSeedSequence;

public class ConfigurationTest
{
    @Test
    public void testFromYaml()
    {
        Configuration config = Configuration.fromYamlString("generator:\n" +
                                                            "  isaac64:\n" +
                                                            "    alpha: 4\n" +
                                                            "seed:\n" +
                                                            "  word:\n" +
                                                            "    value: 1234\n");
        IsaacEngine engine = config.createGenerator();
        Assert.assertEquals(new Isaac64(4, 1234), engine);
    }

    @Test
    public void testFromFile() throws Exception
    {
        File file = new File(ConfigurationTest.class.getResource("/isaac64.yaml").toURI());
        IsaacEngine engine = Configuration.fromFile(file).createGenerator();
        Assert.assertEquals(new Isaac64(4, new StandardSeedSequence(1, 2, 3, 4, 5)), engine);
        Assert.assertEquals(engine, Configuration.fromFile(file.getPath()).createGenerator());
    }

    @Test
    public void testDefaults()
    {
        Configuration config = Configuration.fromYamlString("generator:\n" +
                                                            "  isaac32: {}\n");
        IsaacEngine engine = config.createGenerator();
        Assert.assertEquals(IsaacEngine.DEFAULT_ALPHA, engine.alpha());
        Assert.assertEquals(new Isaac32(), engine);

        Assert.assertEquals(new Isaac32(), new Configuration.ConfigurationBuilder().build().createGenerator());
    }

    @Test
    public void testWordsSeed()
    {
        Configuration config = Configuration.fromYamlString("generator:\n" +
                                                            "  isaac32:\n" +
                                                            "    alpha: 3\n" +
                                                            "seed:\n" +
                                                            "  words:\n" +
                                                            "    words: [1, 2, 3]\n");
        Assert.assertEquals(new Isaac32(3, new long[]{ 1, 2, 3 }), config.createGenerator());
    }

    @Test
    public void testYamlRoundTrip()
    {
        Configuration[] configs = new Configuration[]{
        new Configuration.ConfigurationBuilder()
        .setGenerator(new Configuration.Isaac64Configuration(5))
        .setSeed(42)
        .build(),
        new Configuration.ConfigurationBuilder()
        .setGenerator(new Configuration.Isaac32Configuration(6))
        .setSeed(new Configuration.SequenceSeedConfiguration(Arrays.asList(7L, 8L, 9L)))
        .build(),
        new Configuration.ConfigurationBuilder()
        .setSeed(new Configuration.WordsSeedConfiguration(Arrays.asList(10L, 11L)))
        .build()
        };

        for (Configuration config : configs)
        {
            String yaml = Configuration.toYamlString(config);
            Configuration parsed = Configuration.fromYamlString(yaml);
            Assert.assertEquals(yaml, Configuration.toYamlString(parsed));
            Assert.assertEquals(config.createGenerator(), parsed.createGenerator());
        }
    }

    @Test
    public void testInvalidConfiguration()
    {
        Assert.assertThrows(NullPointerException.class,
                            () -> new Configuration.ConfigurationBuilder().setGenerator(null).build().createGenerator());
        Assert.assertThrows(RuntimeException.class,
                            () -> Configuration.fromYamlString("generator:\n  isaac128: {}\n"));
        Assert.assertThrows(IllegalArgumentException.class,
                            () -> Configuration.fromYamlString("generator:\n  isaac32:\n    alpha: 2\n").createGenerator());
        Assert.assertThrows(IllegalArgumentException.class,
                            () -> Configuration.fromYamlString("generator:\n  isaac32: {}\nseed:\n  words:\n    words: []\n").createGenerator());
    }

    @Test
    public void testGeneratorIsSeededOnce()
    {
        AtomicInteger calls = new AtomicInteger();
        SeedSequence counting = words -> {
            calls.incrementAndGet();
            new StandardSeedSequence(1, 2, 3).generate(words);
        };

        IsaacEngine engine = new Configuration.Isaac64Configuration(5).make(counting);
        Assert.assertEquals(1, calls.get());
        Assert.assertEquals(new Isaac64(5, new StandardSeedSequence(1, 2, 3)), engine);
    }

    @Test
    public void testSeedSectionsMatchEngineSeeding()
    {
        Configuration.GeneratorConfiguration generator = new Configuration.Isaac32Configuration(4);
        Assert.assertEquals(new Isaac32(4, 0x1_0000_0007L),
                            generator.make(new Configuration.WordSeedConfiguration(0x1_0000_0007L).sequence()));
        Assert.assertEquals(new Isaac32(4, new long[]{ 3, 1, 4 }),
                            generator.make(new Configuration.WordsSeedConfiguration(Arrays.asList(3L, 1L, 4L)).sequence()));
        Assert.assertEquals(new Isaac32(4, new StandardSeedSequence(9, 8)),
                            generator.make(new Configuration.SequenceSeedConfiguration(Arrays.asList(9L, 8L)).sequence()));
    }
}
