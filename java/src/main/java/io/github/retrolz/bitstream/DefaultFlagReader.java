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

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteOrder;
import io.github.retrolz.BitStreamException;
import io.github.retrolz.FlagReader;


/**
 * A default implementation of the {@link FlagReader} interface that pulls flag
 * units of 1 to 4 bytes from an input stream.
 * <p>
 * Unlike a buffered bit stream, exactly one unit is read from the source at a
 * time, so the caller can read the payload bytes that follow each unit from
 * the same stream.
 * </p>
 */
public final class DefaultFlagReader implements FlagReader {
    private final InputStream is;
    private final BitOrder bitOrder;
    private final ByteOrder byteOrder;
    private final byte[] unit;
    private final int unitBits;
    private int current;    // Value of the current flag unit
    private int availBits;  // Bits not consumed in current
    private long read;      // Total bits read so far


    /**
     * Constructs a reader of single byte flag units.
     *
     * @param is the InputStream to read flags from
     * @param bitOrder the order of the bits within a flag unit
     */
    public DefaultFlagReader(InputStream is, BitOrder bitOrder) {
       this(is, bitOrder, 1, ByteOrder.LITTLE_ENDIAN);
    }


    /**
     * Constructs a DefaultFlagReader.
     *
     * @param is the InputStream to read flags from
     * @param bitOrder the order of the bits within a flag unit
     * @param unitSize the size of a flag unit in bytes (1 to 4)
     * @param byteOrder the byte order of multi-byte flag units
     * @throws NullPointerException if a parameter is null
     * @throws IllegalArgumentException if the unit size is invalid
     */
    public DefaultFlagReader(InputStream is, BitOrder bitOrder, int unitSize, ByteOrder byteOrder) {
       if (is == null)
          throw new NullPointerException("Invalid null input stream parameter");

       if (bitOrder == null)
          throw new NullPointerException("Invalid null bit order parameter");

       if (byteOrder == null)
          throw new NullPointerException("Invalid null byte order parameter");

       if ((unitSize < 1) || (unitSize > 4))
          throw new IllegalArgumentException("Invalid flag unit size: "+unitSize+" (must be in [1..4])");

       this.is = is;
       this.bitOrder = bitOrder;
       this.byteOrder = byteOrder;
       this.unit = new byte[unitSize];
       this.unitBits = unitSize << 3;
    }


    @Override
    public boolean readBit() throws BitStreamException {
       if (this.availBits == 0)
          this.pullCurrent();

       final int shift = (this.bitOrder == BitOrder.LSB_FIRST) ? this.unitBits - this.availBits : this.availBits - 1;
       this.availBits--;
       this.read++;
       return ((this.current >>> shift) & 1) != 0;
    }


    @Override
    public int readInt(int bits) throws BitStreamException {
       return this.readInt(bits, false);
    }


    @Override
    public int readInt(int bits, boolean lsbFirst) throws BitStreamException {
       if ((bits < 0) || (bits > 32))
          throw new IllegalArgumentException("Invalid bit count: "+bits+" (must be in [0..32])");

       int value = 0;

       if (lsbFirst == true) {
          for (int i=0; i<bits; i++) {
             if (this.readBit() == true)
                value |= (1 << i);
          }
       }
       else {
          for (int i=0; i<bits; i++)
             value = (value << 1) | (this.readBit() ? 1 : 0);
       }

       return value;
    }


    @Override
    public void reset() {
       this.availBits = 0;
    }


    @Override
    public long read() {
       return this.read;
    }


    /**
     * Pulls the next flag unit from the input stream.
     */
    private void pullCurrent() {
       int n = 0;

       try {
          while (n < this.unit.length) {
             final int r = this.is.read(this.unit, n, this.unit.length-n);

             if (r < 0)
                throw new BitStreamException("No more data to read in the flag stream", BitStreamException.END_OF_STREAM);

             n += r;
          }
       }
       catch (IOException e) {
          throw new BitStreamException(e.getMessage(), e, BitStreamException.INPUT_OUTPUT);
       }

       int val = 0;

       if (this.byteOrder == ByteOrder.BIG_ENDIAN) {
          for (int i=0; i<this.unit.length; i++)
             val = (val << 8) | (this.unit[i] & 0xFF);
       }
       else {
          for (int i=this.unit.length-1; i>=0; i--)
             val = (val << 8) | (this.unit[i] & 0xFF);
       }

       this.current = val;
       this.availBits = this.unitBits;
    }
}
