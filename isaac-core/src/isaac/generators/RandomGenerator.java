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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;

/**
 * Source of uniformly distributed unsigned words, as consumed by distributions and samplers:
 * * Reproducible from a seed
 * * Bounded by a fixed word range {@code [minimum(), maximum()]}
 * * Skip-ahead by literally advancing the stream
 *
 * Words are carried in a {@code long} and must be read as unsigned values.
 */
public interface RandomGenerator
{
    Logger logger = LoggerFactory.getLogger(RandomGenerator.class);

    long next();

    default long[] next(int n)
    {
        long[] next = new long[n];
        for (int i = 0; i < n; i++)
            next[i] = next();
        return next;
    }

    void seed(long seed);

    default void seed()
    {
        seed(0);
    }

    /**
     * Advances the stream by {@code steps} words. {@code steps} is an unsigned count.
     */
    default void discard(long steps)
    {
        for (; steps != 0; steps--)
            next();
    }

    long minimum();

    long maximum();

    /**
     * Width of a generated word in bits.
     */
    int wordBits();

    /**
     * Independent generator holding the same state: both will produce the same words from here on.
     */
    RandomGenerator copy();

    @VisibleForTesting
    public static RandomGenerator forTests()
    {
        return forTests(System.currentTimeMillis());
    }

    @VisibleForTesting
    public static RandomGenerator forTests(long seed)
    {
        logger.info("Seed: {}", seed);
        return new Isaac64(seed);
    }
}
