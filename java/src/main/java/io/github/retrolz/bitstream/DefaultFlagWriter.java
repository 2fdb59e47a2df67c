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

package io.github.retrolz.bitstream;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteOrder;
import io.github.retrolz.BitStreamException;
import io.github.retrolz.FlagWriter;


/**
 * A default implementation of the {@link FlagWriter} interface. Flag bits are
 * accumulated in a unit of 1 to 4 bytes while the matching payload is kept in
 * an auxiliary buffer. When the unit is complete, the unit is written to the
 * output stream followed by its payload.
 * <p>
 * The writer must be flushed (or closed) once the last bit has been written,
 * a try-with-resources block does it on every exit path.
 * </p>
 */
public final class DefaultFlagWriter implements FlagWriter {
  private static final int DEFAULT_BUFFER_CAPACITY = 256;

  private final OutputStream os;
  private final ByteArrayOutputStream payload;
  private final BitOrder bitOrder;
  private final ByteOrder byteOrder;
  private final byte[] unit;
  private final int unitBits;
  private int current; // Flag bits of the current unit
  private int availBits; // Bits still free in the current unit
  private long written; // Total bits written so far
  private boolean closed;


  /**
   * Constructs a writer of single byte flag units.
   *
   * @param os the OutputStream to write flags and payload to
   * @param bitOrder the order of the bits within a flag unit
   */
  public DefaultFlagWriter(OutputStream os, BitOrder bitOrder) {
    this(os, bitOrder, 1, ByteOrder.LITTLE_ENDIAN, DEFAULT_BUFFER_CAPACITY);
  }


  /**
   * Constructs a DefaultFlagWriter with the default payload buffer capacity.
   *
   * @param os the OutputStream to write flags and payload to
   * @param bitOrder the order of the bits within a flag unit
   * @param unitSize the size of a flag unit in bytes (1 to 4)
   * @param byteOrder the byte order of multi-byte flag units
   */
  public DefaultFlagWriter(OutputStream os, BitOrder bitOrder, int unitSize, ByteOrder byteOrder) {
    this(os, bitOrder, unitSize, byteOrder, DEFAULT_BUFFER_CAPACITY);
  }


  /**
   * Constructs a DefaultFlagWriter.
   *
   * @param os the OutputStream to write flags and payload to
   * @param bitOrder the order of the bits within a flag unit
   * @param unitSize the size of a flag unit in bytes (1 to 4)
   * @param byteOrder the byte order of multi-byte flag units
   * @param bufferCapacity the initial capacity of the payload buffer
   * @throws NullPointerException if a parameter is null
   * @throws IllegalArgumentException if the unit size or the capacity is invalid
   */
  public DefaultFlagWriter(OutputStream os, BitOrder bitOrder, int unitSize, ByteOrder byteOrder, int bufferCapacity) {
    if (os == null)
      throw new NullPointerException("Invalid null output stream parameter");

    if (bitOrder == null)
      throw new NullPointerException("Invalid null bit order parameter");

    if (byteOrder == null)
      throw new NullPointerException("Invalid null byte order parameter");

    if ((unitSize < 1) || (unitSize > 4))
      throw new IllegalArgumentException("Invalid flag unit size: " + unitSize + " (must be in [1..4])");

    if (bufferCapacity < 0)
      throw new IllegalArgumentException("Invalid buffer capacity: " + bufferCapacity);

    this.os = os;
    this.payload = new ByteArrayOutputStream(bufferCapacity);
    this.bitOrder = bitOrder;
    this.byteOrder = byteOrder;
    this.unit = new byte[unitSize];
    this.unitBits = unitSize << 3;
    this.availBits = this.unitBits;
  }


  @Override
  public void writeBit(boolean bit) {
    if (this.closed == true)
      throw new BitStreamException("Stream closed", BitStreamException.STREAM_CLOSED);

    if (bit == true) {
      final int shift = (this.bitOrder == BitOrder.LSB_FIRST) ? this.unitBits - this.availBits : this.availBits - 1;
      this.current |= (1 << shift);
    }

    this.written++;

    if (--this.availBits == 0)
      this.flush();
  }


  @Override
  public void writeInt(int value, int bits) {
    this.writeInt(value, bits, false);
  }


  @Override
  public void writeInt(int value, int bits, boolean lsbFirst) {
    if ((bits < 0) || (bits > 32))
      throw new IllegalArgumentException("Invalid bit count: " + bits + " (must be in [0..32])");

    if (lsbFirst == true) {
      for (int i = 0; i < bits; i++)
        this.writeBit(((value >>> i) & 1) == 1);
    } else {
      for (int i = bits - 1; i >= 0; i--)
        this.writeBit(((value >>> i) & 1) == 1);
    }
  }


  @Override
  public OutputStream getPayload() {
    return this.payload;
  }


  @Override
  public void flushIfNecessary() {
    if ((this.availBits == this.unitBits) && (this.payload.size() != 0))
      this.pushPayload();
  }


  @Override
  public void flush() {
    if (this.availBits != this.unitBits)
      this.pushCurrent();

    if (this.payload.size() != 0)
      this.pushPayload();
  }


  @Override
  public void close() {
    if (this.closed == true)
      return;

    this.flush();
    this.closed = true;
  }


  @Override
  public long written() {
    return this.written;
  }


  /**
   * Returns the number of payload bytes waiting for the current flag unit.
   *
   * @return the size of the pending payload
   */
  public int pending() {
    return this.payload.size();
  }


  // Write the current unit (free bits are 0) and reset it
  private void pushCurrent() {
    final int val = this.current;
    final int n = this.unit.length;

    if (this.byteOrder == ByteOrder.BIG_ENDIAN) {
      for (int i = 0; i < n; i++)
        this.unit[i] = (byte) (val >>> ((n - 1 - i) << 3));
    } else {
      for (int i = 0; i < n; i++)
        this.unit[i] = (byte) (val >>> (i << 3));
    }

    try {
      this.os.write(this.unit, 0, n);
    } catch (IOException e) {
      throw new BitStreamException(e.getMessage(), e, BitStreamException.INPUT_OUTPUT);
    }

    this.current = 0;
    this.availBits = this.unitBits;
  }


  private void pushPayload() {
    try {
      this.payload.writeTo(this.os);
    } catch (IOException e) {
      throw new BitStreamException(e.getMessage(), e, BitStreamException.INPUT_OUTPUT);
    }

    this.payload.reset();
  }
}
