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
 * ISAAC-64. Same skeleton as {@link Isaac32Variant}, with its own mixing network and accumulator transforms.
 */
enum Isaac64Variant implements IsaacVariant
{
    INSTANCE;

    private static final long GOLDEN_RATIO = 0x9e3779b97f4a7c13L;

    // log2(Long.BYTES)
    private static final int WORD_SHIFT = 3;

    public int wordBits()
    {
        return Long.SIZE;
    }

    public long mask()
    {
        return -1L;
    }

    public long golden()
    {
        return GOLDEN_RATIO;
    }

    public void mix(long[] registers)
    {
        long a = registers[0];
        long b = registers[1];
        long c = registers[2];
        long d = registers[3];
        long e = registers[4];
        long f = registers[5];
        long g = registers[6];
        long h = registers[7];

        a -= e; f ^= h >>> 9;  h += a;
        b -= f; g ^= a << 9;   a += b;
        c -= g; h ^= b >>> 23; b += c;
        d -= h; a ^= c << 15;  c += d;
        e -= a; b ^= d >>> 14; d += e;
        f -= b; c ^= e << 20;  e += f;
        g -= c; d ^= f >>> 17; f += g;
        h -= d; e ^= g << 14;  g += h;

        registers[0] = a;
        registers[1] = b;
        registers[2] = c;
        registers[3] = d;
        registers[4] = e;
        registers[5] = f;
        registers[6] = g;
        registers[7] = h;
    }

    public void generate(IsaacEngine engine)
    {
        long[] mm = engine.memory;
        long[] r = engine.results;
        int alpha = engine.alpha;
        int size = engine.stateSize;
        int half = size >>> 1;
        int indexMask = size - 1;

        long c = engine.c + 1;
        long a = engine.a;
        long b = engine.b + c;

        for (int i = 0; i < size; i++)
        {
            long x = mm[i];
            switch (i & 3)
            {
                case 0:
                    a = ~(a ^ (a << 21));
                    break;
                case 1:
                    a ^= a >>> 5;
                    break;
                case 2:
                    a ^= a << 12;
                    break;
                default:
                    a ^= a >>> 33;
            }
            a += mm[(i + half) & indexMask];

            long y = mm[(int) (x >>> WORD_SHIFT) & indexMask] + a + b;
            mm[i] = y;
            b = mm[(int) ((y >>> alpha) >>> WORD_SHIFT) & indexMask] + x;
            r[i] = b;
        }

        engine.a = a;
        engine.b = b;
        engine.c = c;
    }
}
