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
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.google.common.base.Preconditions;
import isaac.generators.Isaac32;
import isaac.generators.Isaac64;
import isaac.generators.IsaacEngine;
import isaac.generators.SeedSequence;
import isaac.generators.StandardSeedSequence;

/**
 * YAML description of a generator: which ISAAC variant to build, its alpha, and how to seed it.
 *
 * <pre>
 * generator:
 *   isaac64:
 *     alpha: 8
 * seed:
 *   sequence:
 *     entropy: [1, 2, 3]
 * </pre>
 */
public class Configuration
{
    private static final Logger logger = LoggerFactory.getLogger(Configuration.class);

    private static final ObjectMapper mapper;

    static
    {
        mapper = new ObjectMapper(new YAMLFactory()
                                  .disable(YAMLGenerator.Feature.USE_NATIVE_TYPE_ID)
                                  .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                                  .disable(YAMLGenerator.Feature.CANONICAL_OUTPUT)
                                  .enable(YAMLGenerator.Feature.INDENT_ARRAYS));
        mapper.registerSubtypes(Isaac32Configuration.class);
        mapper.registerSubtypes(Isaac64Configuration.class);

        mapper.registerSubtypes(WordSeedConfiguration.class);
        mapper.registerSubtypes(SequenceSeedConfiguration.class);
        mapper.registerSubtypes(WordsSeedConfiguration.class);
    }

    public final GeneratorConfiguration generator;
    public final SeedConfiguration seed;

    @JsonCreator
    public Configuration(@JsonProperty("generator") GeneratorConfiguration generator,
                         @JsonProperty("seed") SeedConfiguration seed)
    {
        this.generator = generator;
        this.seed = seed;
    }

    public static String toYamlString(Configuration config)
    {
        try
        {
            return mapper.writeValueAsString(config);
        }
        catch (Throwable t)
        {
            throw new RuntimeException(t);
        }
    }

    public static Configuration fromYamlString(String config)
    {
        try
        {
            return mapper.readValue(config, Configuration.class);
        }
        catch (Throwable t)
        {
            throw new RuntimeException(t);
        }
    }

    public static Configuration fromFile(String path)
    {
        return fromFile(new File(path));
    }

    public static Configuration fromFile(File file)
    {
        try
        {
            logger.debug("Loading generator configuration from {}", file);
            return mapper.readValue(file, Configuration.class);
        }
        catch (Throwable t)
        {
            throw new RuntimeException(t);
        }
    }

    public static void validate(Configuration config)
    {
        Objects.requireNonNull(config.generator, "Generator should not be null");
    }

    public IsaacEngine createGenerator()
    {
        return createGenerator(this);
    }

    /**
     * Builds the configured generator. Without a seed section the generator is seeded with zero, same as a
     * generator built with a default constructor.
     */
    public static IsaacEngine createGenerator(Configuration config)
    {
        validate(config);

        SeedConfiguration seed = config.seed == null ? new WordSeedConfiguration(0) : config.seed;
        IsaacEngine engine = config.generator.make(seed.sequence());

        logger.debug("Created {} seeded by {}", engine, seed);
        return engine;
    }

    public static class ConfigurationBuilder
    {
        GeneratorConfiguration generator = new Isaac32Configuration(IsaacEngine.DEFAULT_ALPHA);
        SeedConfiguration seed;

        public ConfigurationBuilder setGenerator(GeneratorConfiguration generator)
        {
            this.generator = generator;
            return this;
        }

        public ConfigurationBuilder setSeed(SeedConfiguration seed)
        {
            this.seed = seed;
            return this;
        }

        public ConfigurationBuilder setSeed(long seed)
        {
            this.seed = new WordSeedConfiguration(seed);
            return this;
        }

        public Configuration build()
        {
            return new Configuration(generator, seed);
        }
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
    public interface GeneratorConfiguration
    {
        /**
         * Builds an engine seeded once, from the given sequence.
         */
        IsaacEngine make(SeedSequence seed);
    }

    @JsonTypeName("isaac32")
    public static class Isaac32Configuration implements GeneratorConfiguration
    {
        public final int alpha;

        @JsonCreator
        public Isaac32Configuration(@JsonProperty(value = "alpha", defaultValue = "8") Integer alpha)
        {
            this.alpha = alpha == null ? IsaacEngine.DEFAULT_ALPHA : alpha;
        }

        public IsaacEngine make(SeedSequence seed)
        {
            return new Isaac32(alpha, seed);
        }
    }

    @JsonTypeName("isaac64")
    public static class Isaac64Configuration implements GeneratorConfiguration
    {
        public final int alpha;

        @JsonCreator
        public Isaac64Configuration(@JsonProperty(value = "alpha", defaultValue = "8") Integer alpha)
        {
            this.alpha = alpha == null ? IsaacEngine.DEFAULT_ALPHA : alpha;
        }

        public IsaacEngine make(SeedSequence seed)
        {
            return new Isaac64(alpha, seed);
        }
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
    public interface SeedConfiguration
    {
        SeedSequence sequence();
    }

    @JsonTypeName("word")
    public static class WordSeedConfiguration implements SeedConfiguration
    {
        public final long value;

        @JsonCreator
        public WordSeedConfiguration(@JsonProperty(value = "value", defaultValue = "0") long value)
        {
            this.value = value;
        }

        public SeedSequence sequence()
        {
            return words -> Arrays.fill(words, value);
        }

        public String toString()
        {
            return "word " + value;
        }
    }

    /**
     * Entropy values are expanded with {@link StandardSeedSequence}; only their low 32 bits are used.
     */
    @JsonTypeName("sequence")
    public static class SequenceSeedConfiguration implements SeedConfiguration
    {
        public final List<Long> entropy;

        @JsonCreator
        public SequenceSeedConfiguration(@JsonProperty("entropy") List<Long> entropy)
        {
            this.entropy = entropy;
        }

        public SeedSequence sequence()
        {
            Objects.requireNonNull(entropy, "Entropy should not be null");
            return StandardSeedSequence.of(entropy);
        }

        public String toString()
        {
            return "sequence " + entropy;
        }
    }

    /**
     * Seed words copied into the seed block as is, repeated when there are fewer of them than the state holds.
     */
    @JsonTypeName("words")
    public static class WordsSeedConfiguration implements SeedConfiguration
    {
        public final List<Long> words;

        @JsonCreator
        public WordsSeedConfiguration(@JsonProperty("words") List<Long> words)
        {
            this.words = words;
        }

        public SeedSequence sequence()
        {
            Preconditions.checkArgument(words != null && !words.isEmpty(), "Seed words should not be empty");
            return block -> {
                for (int i = 0; i < block.length; i++)
                    block[i] = words.get(i % words.size());
            };
        }

        public String toString()
        {
            return "words " + words;
        }
    }
}
