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
 * Word-width specific half of the ISAAC algorithm. The scaffold in {@link IsaacEngine} owns all state
 * and calls into the variant for the three operations that differ between 32-bit and 64-bit words.
 *
 * Words are passed around in {@code long} slots; a variant narrower than 64 bits keeps every slot it writes
 * zero-extended to its width, and is free to ignore the upper bits of slots it reads.
 */
interface IsaacVariant
{
    int wordBits();

    /**
     * Largest word value, which doubles as the mask truncating a {@code long} to the word width.
     */
    long mask();

    long golden();

    /**
     * Scrambles eight registers {@code a..h} in place.
     */
    void mix(long[] registers);

    /**
     * Runs one generation pass: advances the memory array and the accumulators, and refills the whole
     * output buffer. Does not touch the consumption cursor.
     */
    void generate(IsaacEngine engine);
}
