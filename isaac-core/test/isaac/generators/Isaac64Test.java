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

import java.util.HashSet;
import java.util.Set;

import org.junit.Assert;
import org.junit.Test;

public class Isaac64Test
{
    // Words returned by a zero-seeded engine; the same words open the Polyglot opening book key table
    private static final long[] REFERENCE = new long[]{ 0x9d39247e33776d41L, 0x2af7398005aaa5c7L, 0x44db015024623547L,
                                                        0x9c15f73e62a76ae2L, 0x75834465489c0c89L, 0x3290ac3a203001bfL };

    @Test
    public void testReferenceVector()
    {
        Isaac64 rng = new Isaac64();
        for (long expected : REFERENCE)
            Assert.assertEquals(Long.toHexString(expected), Long.toHexString(rng.next()));
    }

    @Test
    public void testWordRange()
    {
        RandomGenerator rng = RandomGenerator.forTests();
        Assert.assertEquals(0, rng.minimum());
        Assert.assertEquals(-1L, rng.maximum());
        Assert.assertEquals("18446744073709551615", Long.toUnsignedString(rng.maximum()));
        Assert.assertEquals(64, rng.wordBits());

        boolean wideSeen = false;
        boolean signSeen = false;
        for (int i = 0; i < 10_000; i++)
        {
            long next = rng.next();
            wideSeen |= (next >>> 32) != 0;
            signSeen |= next < 0;
        }
        Assert.assertTrue(wideSeen);
        Assert.assertTrue(signSeen);
    }

    @Test
    public void testDeterminism()
    {
        for (long seed : new long[]{ 0, 1, 1234, -1L, Long.MIN_VALUE })
        {
            RandomGenerator first = RandomGenerator.forTests(seed);
            Isaac64 second = new Isaac64(seed);
            Assert.assertEquals(second, first);
            for (int i = 0; i < 2 * second.stateSize(); i++)
                Assert.assertEquals(first.next(), second.next());
            Assert.assertEquals(first, second);
        }
    }

    @Test
    public void testSeedIsNotTruncated()
    {
        Assert.assertNotEquals(new Isaac64(5), new Isaac64(0x1_0000_0005L));
    }

    @Test
    public void testDiffersFromNarrowVariant()
    {
        Isaac64 wide = new Isaac64(1234);
        Isaac32 narrow = new Isaac32(1234);
        Assert.assertNotEquals(wide, narrow);
        Assert.assertNotEquals(narrow, wide);
    }

    @Test
    public void testDifferentSeedsDiverge()
    {
        Isaac64 first = new Isaac64(1234);
        Isaac64 second = new Isaac64(1235);

        boolean differ = false;
        for (int i = 0; i < 10; i++)
            differ |= first.next() != second.next();
        Assert.assertTrue(differ);
    }

    @Test
    public void testNoRepeatsAcrossBatches()
    {
        Isaac64 rng = new Isaac64(IsaacEngine.MIN_ALPHA, 7);
        Set<Long> seen = new HashSet<>();
        for (int i = 0; i < 10_000; i++)
            Assert.assertTrue(seen.add(rng.next()));
    }

    @Test
    public void testDifferentAlphaDifferentStream()
    {
        Isaac64 small = new Isaac64(4, 1234);
        Isaac64 large = new Isaac64(8, 1234);
        Assert.assertNotEquals(small, large);
        Assert.assertNotEquals(small.next(), large.next());
    }
}
