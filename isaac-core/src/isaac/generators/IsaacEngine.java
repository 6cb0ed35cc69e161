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

package isaac.generators;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;

/**
 * State scaffold shared by both ISAAC word widths: seeding, buffered consumption, equality and the
 * textual state format. Word-width specific operations are delegated to an {@link IsaacVariant}.
 *
 * Words are handed out from the tail of the output buffer towards its head, so the last word computed by a
 * generation pass is the first one returned.
 *
 * Instances are not thread-safe.
 */
public abstract class IsaacEngine implements RandomGenerator
{
    private static final Logger logger = LoggerFactory.getLogger(IsaacEngine.class);

    public static final int MIN_ALPHA = 3;
    public static final int MAX_ALPHA = 16;
    public static final int DEFAULT_ALPHA = 8;

    private static final int REGISTERS = 8;
    private static final int WARM_UP_ROUNDS = 4;

    private static final Splitter FIELD_SPLITTER = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    final IsaacVariant variant;
    final int alpha;
    final int stateSize;

    final long[] results;
    final long[] memory;
    long a;
    long b;
    long c;
    int count;

    /**
     * Allocates the state arrays. Subclasses are expected to seed the engine before handing it out.
     */
    protected IsaacEngine(IsaacVariant variant, int alpha)
    {
        Preconditions.checkArgument(alpha >= MIN_ALPHA && alpha <= MAX_ALPHA,
                                    "Alpha should be between %s and %s, but was %s", MIN_ALPHA, MAX_ALPHA, alpha);
        this.variant = variant;
        this.alpha = alpha;
        this.stateSize = 1 << alpha;
        this.results = new long[stateSize];
        this.memory = new long[stateSize];
    }

    protected IsaacEngine(IsaacEngine other)
    {
        this.variant = other.variant;
        this.alpha = other.alpha;
        this.stateSize = other.stateSize;
        this.results = other.results.clone();
        this.memory = other.memory.clone();
        this.a = other.a;
        this.b = other.b;
        this.c = other.c;
        this.count = other.count;
    }

    public abstract IsaacEngine copy();

    public int alpha()
    {
        return alpha;
    }

    public int stateSize()
    {
        return stateSize;
    }

    public int wordBits()
    {
        return variant.wordBits();
    }

    public long minimum()
    {
        return 0;
    }

    public long maximum()
    {
        return variant.mask();
    }

    /**
     * Fills the whole seed block with a single word, truncated to the word width.
     */
    public final void seed(long seed)
    {
        Arrays.fill(results, seed & variant.mask());
        initialize();
        logger.trace("Seeded {} with a single word {}", this, seed);
    }

    /**
     * Pulls exactly {@link #stateSize()} words out of the given sequence.
     */
    public final void seed(SeedSequence sequence)
    {
        Objects.requireNonNull(sequence, "Seed sequence should not be null");
        long[] words = new long[stateSize];
        sequence.generate(words);
        load(words);
        initialize();
        logger.trace("Seeded {} from {}", this, sequence);
    }

    /**
     * Loads the seed block from the given words, reading them again from the start as many times as needed to
     * fill it. The iterable has to be restartable, and can not be empty.
     */
    public final void seed(Iterable<Long> words)
    {
        Objects.requireNonNull(words, "Seed words should not be null");
        Iterator<Long> iter = words.iterator();
        Preconditions.checkArgument(iter.hasNext(), "Seed words should not be empty");
        long[] block = new long[stateSize];
        for (int i = 0; i < stateSize; i++)
        {
            if (!iter.hasNext())
            {
                iter = words.iterator();
                Preconditions.checkArgument(iter.hasNext(), "Seed words could not be read again after %s words", i);
            }
            block[i] = iter.next();
        }
        load(block);
        initialize();
        logger.trace("Seeded {} from {}", this, words);
    }

    public final void seed(long[] words)
    {
        Objects.requireNonNull(words, "Seed words should not be null");
        Preconditions.checkArgument(words.length > 0, "Seed words should not be empty");
        for (int i = 0; i < stateSize; i++)
            results[i] = words[i % words.length] & variant.mask();
        initialize();
        logger.trace("Seeded {} from {} words", this, words.length);
    }

    /**
     * Same as {@link #seed(long[])}, reading every element as an unsigned 32-bit word.
     */
    public final void seed(int[] words)
    {
        Objects.requireNonNull(words, "Seed words should not be null");
        Preconditions.checkArgument(words.length > 0, "Seed words should not be empty");
        for (int i = 0; i < stateSize; i++)
            results[i] = Integer.toUnsignedLong(words[i % words.length]) & variant.mask();
        initialize();
        logger.trace("Seeded {} from {} unsigned int words", this, words.length);
    }

    private void load(long[] words)
    {
        for (int i = 0; i < stateSize; i++)
            results[i] = words[i] & variant.mask();
    }

    /**
     * Diffuses the seed block held in the output buffer into the memory array, and produces the first batch.
     */
    private void initialize()
    {
        long[] registers = new long[REGISTERS];
        Arrays.fill(registers, variant.golden());

        a = 0;
        b = 0;
        c = 0;

        for (int i = 0; i < WARM_UP_ROUNDS; i++)
            variant.mix(registers);

        absorb(results, registers);
        // Second pass, so that every seed word affects all of the memory
        absorb(memory, registers);

        variant.generate(this);
        count = stateSize;
    }

    private void absorb(long[] source, long[] registers)
    {
        for (int i = 0; i < stateSize; i += REGISTERS)
        {
            for (int j = 0; j < REGISTERS; j++)
                registers[j] += source[i + j];

            variant.mix(registers);

            System.arraycopy(registers, 0, memory, i, REGISTERS);
        }
    }

    public long next()
    {
        if (count == 0)
        {
            variant.generate(this);
            count = stateSize;
        }
        return results[--count];
    }

    public String serialize()
    {
        StringBuilder sb = new StringBuilder();
        sb.append(count);
        for (long word : results)
            sb.append(' ').append(Long.toUnsignedString(word));
        for (long word : memory)
            sb.append(' ').append(Long.toUnsignedString(word));
        sb.append(' ').append(Long.toUnsignedString(a))
          .append(' ').append(Long.toUnsignedString(b))
          .append(' ').append(Long.toUnsignedString(c));
        return sb.toString();
    }

    /**
     * Replaces the state of this engine with the one described by {@code text}, in the format written by
     * {@link #serialize()}. The engine is left untouched if the text can not be read in full.
     *
     * @throws MalformedStateException if a field is missing, is not an unsigned decimal within the word range, or
     *                                 if there are more fields than the state of this engine holds
     */
    public void deserialize(String text)
    {
        Objects.requireNonNull(text, "State should not be null");
        List<String> fields = FIELD_SPLITTER.splitToList(text);
        int expected = fieldCount();

        int pos = 0;
        int newCount = (int) parse(fields, pos++, stateSize);

        long[] newResults = new long[stateSize];
        for (int i = 0; i < stateSize; i++)
            newResults[i] = parse(fields, pos++, variant.mask());

        long[] newMemory = new long[stateSize];
        for (int i = 0; i < stateSize; i++)
            newMemory[i] = parse(fields, pos++, variant.mask());

        long newA = parse(fields, pos++, variant.mask());
        long newB = parse(fields, pos++, variant.mask());
        long newC = parse(fields, pos, variant.mask());

        if (fields.size() > expected)
            throw new MalformedStateException("Expected %d fields, but got %d", expected, fields.size());

        System.arraycopy(newResults, 0, results, 0, stateSize);
        System.arraycopy(newMemory, 0, memory, 0, stateSize);
        a = newA;
        b = newB;
        c = newC;
        count = newCount;
    }

    private int fieldCount()
    {
        return 1 + 2 * stateSize + 3;
    }

    private static long parse(List<String> fields, int pos, long max)
    {
        if (pos >= fields.size())
            throw new MalformedStateException("State ended after %d fields, but field %d was expected", fields.size(), pos);

        String field = fields.get(pos);
        long value;
        try
        {
            value = Long.parseUnsignedLong(field);
        }
        catch (NumberFormatException e)
        {
            throw new MalformedStateException(e, "Field %d is not an unsigned decimal: '%s'", pos, field);
        }

        if (Long.compareUnsigned(value, max) > 0)
            throw new MalformedStateException("Field %d is out of range: %s > %s", pos, field, Long.toUnsignedString(max));
        return value;
    }

    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        IsaacEngine other = (IsaacEngine) o;
        return alpha == other.alpha &&
               a == other.a &&
               b == other.b &&
               c == other.c &&
               count == other.count &&
               Arrays.equals(results, other.results) &&
               Arrays.equals(memory, other.memory);
    }

    public int hashCode()
    {
        int result = Objects.hash(alpha, a, b, c, count);
        result = 31 * result + Arrays.hashCode(results);
        result = 31 * result + Arrays.hashCode(memory);
        return result;
    }

    public String toString()
    {
        return getClass().getSimpleName() + "(alpha=" + alpha + ", count=" + count + ", c=" + Long.toUnsignedString(c) + ')';
    }
}
