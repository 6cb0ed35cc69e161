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

/**
 * ISAAC random number generator over 32-bit words, by Bob Jenkins. Every word it returns lies in
 * {@code [0, 0xFFFFFFFF]}.
 *
 * Alpha fixes the size of the state to {@code 2^alpha} words; 8 is the size of the published algorithm. Engines
 * with a different alpha produce different streams and can not read each other's state.
 */
public class Isaac32 extends IsaacEngine
{
    public Isaac32()
    {
        this(DEFAULT_ALPHA, 0);
    }

    public Isaac32(long seed)
    {
        this(DEFAULT_ALPHA, seed);
    }

    public Isaac32(int alpha, long seed)
    {
        super(Isaac32Variant.INSTANCE, alpha);
        seed(seed);
    }

    public Isaac32(SeedSequence sequence)
    {
        this(DEFAULT_ALPHA, sequence);
    }

    public Isaac32(int alpha, SeedSequence sequence)
    {
        super(Isaac32Variant.INSTANCE, alpha);
        seed(sequence);
    }

    public Isaac32(int alpha, Iterable<Long> words)
    {
        super(Isaac32Variant.INSTANCE, alpha);
        seed(words);
    }

    public Isaac32(int alpha, long[] words)
    {
        super(Isaac32Variant.INSTANCE, alpha);
        seed(words);
    }

    public Isaac32(Isaac32 other)
    {
        super(other);
    }

    public Isaac32 copy()
    {
        return new Isaac32(this);
    }
}
