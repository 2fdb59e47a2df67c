/*
Copyright 2011-2025 Frederic Langlet
Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
you may obtain a copy of the License at

                http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package io.github.retrolz;

/**
 * The {@code FlagReader} interface defines methods for reading the decision
 * bits (literal or match, encoding arm, ...) that LZ formats interleave with
 * their payload bytes.
 */
public interface FlagReader {

    /**
     * Reads a single flag bit. A new flag unit is pulled from the source when
     * all bits of the current one have been consumed.
     *
     * @return {@code true} if the bit is set
     * @throws BitStreamException
     *             if the source is exhausted or cannot be read
     */
    public boolean readBit() throws BitStreamException;

    /**
     * Reads {@code bits} flag bits and composes them into an unsigned integer,
     * first bit read as the most significant one.
     *
     * @param bits
     *            the number of bits to read (between 0 and 32)
     * @return the value read
     * @throws BitStreamException
     *             if the source is exhausted or cannot be read
     */
    public int readInt(int bits) throws BitStreamException;

    /**
     * Reads {@code bits} flag bits and composes them into an unsigned integer.
     *
     * @param bits
     *            the number of bits to read (between 0 and 32)
     * @param lsbFirst
     *            if {@code true}, the first bit read is the least significant one
     * @return the value read
     * @throws BitStreamException
     *             if the source is exhausted or cannot be read
     */
    public int readInt(int bits, boolean lsbFirst) throws BitStreamException;

    /**
     * Discards the bits left in the current flag unit. The next read pulls a
     * new unit from the source.
     */
    public void reset();

    /**
     * Returns the total number of flag bits read so far.
     *
     * @return the number of bits read
     */
    public long read();
}
