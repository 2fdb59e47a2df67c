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

package io.github.retrolz.codec;

import io.github.retrolz.DecompressedSizeException;
import io.github.retrolz.FlagReader;
import io.github.retrolz.FlagWriter;
import io.github.retrolz.bitstream.BitOrder;
import io.github.retrolz.bitstream.DefaultFlagReader;
import io.github.retrolz.bitstream.DefaultFlagWriter;
import io.github.retrolz.io.IOUtil;
import io.github.retrolz.io.LzWindow;
import io.github.retrolz.match.CompressionLevel;
import io.github.retrolz.match.LZMatchFinder;
import io.github.retrolz.match.Match;
import io.github.retrolz.match.MatchConstraints;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;


/**
 * Okumura style LZSS with a 16 byte header:
 * <pre>
 * "LZSS" | decompressed size (u32 BE) | compressed size (u32 BE) | 0 (u32)
 * </pre>
 * Flags are read least significant bit first, a set bit announces a literal.
 * A match is a 2 byte token holding an absolute offset in a ring buffer whose
 * write cursor starts at {@link MatchConstraints#getWindowStart()}: the low
 * byte carries the low 8 bits of the offset, the high byte the remaining
 * offset bits above the length bits.
 */
public final class LZSSCodec extends AbstractCodec
{
   public static final byte[] IDENTIFIER = "LZSS".getBytes(StandardCharsets.US_ASCII);
   public static final MatchConstraints DEFAULT_CONSTRAINTS = MatchConstraints.fromBits(12, 4, 2);

   private final MatchConstraints constraints;


   public LZSSCodec()
   {
      this(DEFAULT_CONSTRAINTS, new HashMap<String, Object>());
   }


   public LZSSCodec(Map<String, Object> ctx)
   {
      this(DEFAULT_CONSTRAINTS, ctx);
   }


   public LZSSCodec(MatchConstraints constraints, Map<String, Object> ctx)
   {
      super(ctx);

      if (constraints == null)
         throw new NullPointerException("Invalid null constraints parameter");

      final int offsetBits = constraints.getDistanceBits();

      // The offset is split between the 2 bytes of a token
      if ((offsetBits < 8) || (offsetBits + constraints.getLengthBits() > 16))
         throw new IllegalArgumentException("Invalid LZSS constraints: " + constraints);

      if (constraints.getWindowSize() != (1 << offsetBits))
         throw new IllegalArgumentException("The LZSS window size must be a power of 2: " + constraints);

      this.constraints = constraints;
   }


   @Override
   protected void encode(byte[] src, OutputStream os, CompressionLevel level) throws IOException
   {
      final ByteArrayOutputStream body = new ByteArrayOutputStream(Math.max(src.length / 2, 64));
      final LZMatchFinder finder = new LZMatchFinder(this.constraints, this.lookAhead, level);
      final int mask = this.constraints.getWindowMask();
      final int lengthBits = this.constraints.getLengthBits();
      final int lengthMask = this.constraints.getLengthMask();
      final int minLength = this.constraints.getMinLength();
      final int start = this.constraints.getWindowStart();

      try (FlagWriter flags = new DefaultFlagWriter(body, BitOrder.LSB_FIRST))
      {
         final OutputStream payload = flags.getPayload();
         int pos = 0;

         while (pos < src.length)
         {
            final Match m = finder.tryFindMatch(src, pos);

            if (m.isNone() == true)
            {
               payload.write(src[pos++]);
               flags.writeBit(true);
               continue;
            }

            final int offset = (start + pos - m.getDistance()) & mask;
            payload.write(offset & 0xFF);
            payload.write(((offset >> 8) << lengthBits) | ((m.getLength() - minLength) & lengthMask));
            pos += m.getLength();
            flags.writeBit(false);
         }
      }

      os.write(IDENTIFIER);
      IOUtil.writeInt32(os, src.length, ByteOrder.BIG_ENDIAN);
      IOUtil.writeInt32(os, body.size(), ByteOrder.BIG_ENDIAN);
      IOUtil.writeInt32(os, 0, ByteOrder.BIG_ENDIAN);
      body.writeTo(os);
   }


   @Override
   protected long decode(InputStream is, OutputStream os) throws IOException
   {
      IOUtil.checkIdentifier(is, IDENTIFIER);
      final int size = checkSize(IOUtil.readInt32(is, ByteOrder.BIG_ENDIAN));
      IOUtil.readInt32(is, ByteOrder.BIG_ENDIAN); // compressed size
      IOUtil.readInt32(is, ByteOrder.BIG_ENDIAN);

      final FlagReader flags = new DefaultFlagReader(is, BitOrder.LSB_FIRST);
      final int lengthBits = this.constraints.getLengthBits();
      final int lengthMask = this.constraints.getLengthMask();
      final int minLength = this.constraints.getMinLength();

      try (LzWindow window = new LzWindow(os, this.constraints.getWindowSize(), this.constraints.getWindowStart()))
      {
         while (window.getPosition() < size)
         {
            if (flags.readBit() == true)
            {
               window.write(IOUtil.readUInt8(is));
               continue;
            }

            final int b1 = IOUtil.readUInt8(is);
            final int b2 = IOUtil.readUInt8(is);
            window.offsetCopy(((b2 >> lengthBits) << 8) | b1, (b2 & lengthMask) + minLength);
         }

         DecompressedSizeException.throwIfMismatch(window.getPosition(), size);
      }

      return size;
   }


   public MatchConstraints getConstraints()
   {
      return this.constraints;
   }


   @Override
   public String getName()
   {
      return "LZSS";
   }
}
