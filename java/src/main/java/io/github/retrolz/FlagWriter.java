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

import java.io.OutputStream;

/**
 * The {@code FlagWriter} interface defines methods for writing decision bits
 * grouped in flag units. Payload bytes written to {@link #getPayload()} are
 * emitted after the flag unit they belong to, once that unit is complete.
 */
public interface FlagWriter extends AutoCloseable {

    /**
     * Appends a flag bit to the current unit. The unit and its pending payload
     * are written out once the unit is full.
     *
     * @param bit
     *            the bit to write
     * @throws BitStreamException
     *             if the destination cannot be written
     */
    public void writeBit(boolean bit) throws BitStreamException;

    /**
     * Writes the {@code bits} lowest bits of {@code value}, most significant
     * bit first.
     *
     * @param value
     *            the value to write
     * @param bits
     *            the number of bits to write (between 0 and 32)
     * @throws BitStreamException
     *             if the destination cannot be written
     */
    public void writeInt(int value, int bits) throws BitStreamException;

    /**
     * Writes the {@code bits} lowest bits of {@code value}.
     *
     * @param value
     *            the value to write
     * @param bits
     *            the number of bits to write (between 0 and 32)
     * @param lsbFirst
     *            if {@code true}, the least significant bit is written first
     * @throws BitStreamException
     *             if the destination cannot be written
     */
    public void writeInt(int value, int bits, boolean lsbFirst) throws BitStreamException;

    /**
     * Returns the buffer receiving the payload bytes of the current flag unit.
     *
     * @return the payload buffer
     */
    public OutputStream getPayload();

    /**
     * Writes the pending payload if the current flag unit is empty. Used at
     * natural boundaries to bound the amount of buffered payload.
     *
     * @throws BitStreamException
     *             if the destination cannot be written
     */
    public void flushIfNecessary() throws BitStreamException;

    /**
     * Writes the current flag unit, padded with 0 bits, followed by the
     * pending payload.
     *
     * @throws BitStreamException
     *             if the destination cannot be written
     */
    public void flush() throws BitStreamException;

    /**
     * Flushes the writer. The underlying stream is not closed.
     *
     * @throws BitStreamException
     *             if the destination cannot be written
     */
    @Override
    public void close() throws BitStreamException;

    /**
     * Returns the total number of flag bits written so far (padding excluded).
     *
     * @return the number of bits written
     */
    public long written();
}
