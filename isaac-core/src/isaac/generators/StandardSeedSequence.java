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
import java.util.List;

/**
 * Seed sequence with the mixing scheme of the C++ {@code std::seed_seq}: any number of 32-bit entropy values are
 * spread over a block of 32-bit words, so that short or low-quality entropy still produces a well distributed
 * seed block. Generated words always fit in 32 bits.
 */
public class StandardSeedSequence implements SeedSequence
{
    private static final int FILL = 0x8b8b8b8b;
    private static final int FIRST_MULTIPLIER = 1664525;
    private static final int SECOND_MULTIPLIER = 1566083941;

    private final int[] entropy;

    public StandardSeedSequence(int... entropy)
    {
        this.entropy = entropy.clone();
    }

    /**
     * Only the low 32 bits of every value are kept.
     */
    public static StandardSeedSequence of(List<Long> entropy)
    {
        int[] values = new int[entropy.size()];
        for (int i = 0; i < values.length; i++)
            values[i] = entropy.get(i).intValue();
        return new StandardSeedSequence(values);
    }

    public int size()
    {
        return entropy.length;
    }

    public int[] param()
    {
        return entropy.clone();
    }

    public void generate(long[] words)
    {
        int n = words.length;
        if (n == 0)
            return;

        int[] block = new int[n];
        Arrays.fill(block, FILL);

        int s = entropy.length;
        int t = (n >= 623) ? 11 : (n >= 68) ? 7 : (n >= 39) ? 5 : (n >= 7) ? 3 : (n - 1) / 2;
        int p = (n - t) / 2;
        int q = p + t;
        int m = Math.max(s + 1, n);

        for (int k = 0; k < m; k++)
        {
            int r1 = FIRST_MULTIPLIER * tempering(block[k % n] ^ block[(k + p) % n] ^ block[(k + n - 1) % n]);
            int r2 = r1;
            if (k == 0)
                r2 += s;
            else if (k <= s)
                r2 += k % n + entropy[k - 1];
            else
                r2 += k % n;

            block[(k + p) % n] += r1;
            block[(k + q) % n] += r2;
            block[k % n] = r2;
        }

        for (int k = m; k < m + n; k++)
        {
            int r3 = SECOND_MULTIPLIER * tempering(block[k % n] + block[(k + p) % n] + block[(k + n - 1) % n]);
            int r4 = r3 - k % n;

            block[(k + p) % n] ^= r3;
            block[(k + q) % n] ^= r4;
            block[k % n] = r4;
        }

        for (int i = 0; i < n; i++)
            words[i] = Integer.toUnsignedLong(block[i]);
    }

    private static int tempering(int x)
    {
        return x ^ (x >>> 27);
    }

    public String toString()
    {
        return "StandardSeedSequence(" + entropy.length + " entropy words)";
    }
}
