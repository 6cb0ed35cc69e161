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
 * ISAAC-64, the 64-bit word version of ISAAC. Words are unsigned and span the whole {@code long} range.
 */
public class Isaac64 extends IsaacEngine
{
    public Isaac64()
    {
        this(DEFAULT_ALPHA, 0);
    }

    public Isaac64(long seed)
    {
        this(DEFAULT_ALPHA, seed);
    }

    public Isaac64(int alpha, long seed)
    {
        super(Isaac64Variant.INSTANCE, alpha);
        seed(seed);
    }

    public Isaac64(SeedSequence sequence)
    {
        this(DEFAULT_ALPHA, sequence);
    }

    public Isaac64(int alpha, SeedSequence sequence)
    {
        super(Isaac64Variant.INSTANCE, alpha);
        seed(sequence);
    }

    public Isaac64(int alpha, Iterable<Long> words)
    {
        super(Isaac64Variant.INSTANCE, alpha);
        seed(words);
    }

    public Isaac64(int alpha, long[] words)
    {
        super(Isaac64Variant.INSTANCE, alpha);
        seed(words);
    }

    public Isaac64(Isaac64 other)
    {
        super(other);
    }

    public Isaac64 copy()
    {
        return new Isaac64(this);
    }
}
