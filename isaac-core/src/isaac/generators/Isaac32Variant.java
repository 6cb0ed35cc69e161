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
 * ISAAC over 32-bit words.
 */
enum Isaac32Variant implements IsaacVariant
{
    INSTANCE;

    private static final long GOLDEN_RATIO = 0x9e3779b9L;
    private static final long WORD_MASK = 0xffffffffL;

    // log2(Integer.BYTES), turns a byte offset into a word index
    private static final int WORD_SHIFT = 2;

    public int wordBits()
    {
        return Integer.SIZE;
    }

    public long mask()
    {
        return WORD_MASK;
    }

    public long golden()
    {
        return GOLDEN_RATIO;
    }

    public void mix(long[] registers)
    {
        int a = (int) registers[0];
        int b = (int) registers[1];
        int c = (int) registers[2];
        int d = (int) registers[3];
        int e = (int) registers[4];
        int f = (int) registers[5];
        int g = (int) registers[6];
        int h = (int) registers[7];

        a ^= b << 11;  d += a; b += c;
        b ^= c >>> 2;  e += b; c += d;
        c ^= d << 8;   f += c; d += e;
        d ^= e >>> 16; g += d; e += f;
        e ^= f << 10;  h += e; f += g;
        f ^= g >>> 4;  a += f; g += h;
        g ^= h << 8;   b += g; h += a;
        h ^= a >>> 9;  c += h; a += b;

        registers[0] = Integer.toUnsignedLong(a);
        registers[1] = Integer.toUnsignedLong(b);
        registers[2] = Integer.toUnsignedLong(c);
        registers[3] = Integer.toUnsignedLong(d);
        registers[4] = Integer.toUnsignedLong(e);
        registers[5] = Integer.toUnsignedLong(f);
        registers[6] = Integer.toUnsignedLong(g);
        registers[7] = Integer.toUnsignedLong(h);
    }

    public void generate(IsaacEngine engine)
    {
        long[] mm = engine.memory;
        long[] r = engine.results;
        int alpha = engine.alpha;
        int size = engine.stateSize;
        int half = size >>> 1;
        int indexMask = size - 1;

        int c = (int) engine.c + 1;
        int a = (int) engine.a;
        int b = (int) engine.b + c;

        // The first half is paired with the second one, and the second half with the first
        for (int i = 0; i < size; i++)
        {
            int x = (int) mm[i];
            switch (i & 3)
            {
                case 0:
                    a ^= a << 13;
                    break;
                case 1:
                    a ^= a >>> 6;
                    break;
                case 2:
                    a ^= a << 2;
                    break;
                default:
                    a ^= a >>> 16;
            }
            a += (int) mm[(i + half) & indexMask];

            int y = (int) mm[(x >>> WORD_SHIFT) & indexMask] + a + b;
            mm[i] = Integer.toUnsignedLong(y);
            b = (int) mm[((y >>> alpha) >>> WORD_SHIFT) & indexMask] + x;
            r[i] = Integer.toUnsignedLong(b);
        }

        engine.a = Integer.toUnsignedLong(a);
        engine.b = Integer.toUnsignedLong(b);
        engine.c = Integer.toUnsignedLong(c);
    }
}
