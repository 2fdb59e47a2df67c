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
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteOrder;
import java.util.HashMap;
import java.util.Map;


// Nintendo LZ10 (GBA/DS BIOS). Groups of 8 items preceded by a flag byte,
// a set bit announces a 2 byte match: 4 bits of length, 12 bits of distance.
public final class LZ10Codec extends AbstractCodec
{
   public static final int TYPE = 0x10;
   public static final MatchConstraints CONSTRAINTS = new MatchConstraints(0x1000, 3, 18);


   public LZ10Codec()
   {
      this(new HashMap<String, Object>());
   }


   public LZ10Codec(Map<String, Object> ctx)
   {
      super(ctx);
   }


   @Override
   protected void encode(byte[] src, OutputStream os, CompressionLevel level) throws IOException
   {
      writeSizeHeader(os, TYPE, src.length);
      final LZMatchFinder finder = new LZMatchFinder(CONSTRAINTS, this.lookAhead, level);

      try (FlagWriter flags = new DefaultFlagWriter(os, BitOrder.MSB_FIRST))
      {
         final OutputStream payload = flags.getPayload();
         int pos = 0;

         while (pos < src.length)
         {
            final Match m = finder.tryFindMatch(src, pos);

            if (m.isNone() == true)
            {
               payload.write(src[pos++]);
               flags.writeBit(false);
               continue;
            }

            final int token = ((m.getLength() - 3) << 12) | ((m.getDistance() - 1) & 0xFFF);
            IOUtil.writeInt16(payload, token, ByteOrder.BIG_ENDIAN);
            pos += m.getLength();
            flags.writeBit(true);
         }
      }
   }


   @Override
   protected long decode(InputStream is, OutputStream os) throws IOException
   {
      final int size = readSizeHeader(is, TYPE);
      final FlagReader flags = new DefaultFlagReader(is, BitOrder.MSB_FIRST);

      try (LzWindow window = new LzWindow(os, CONSTRAINTS.getWindowSize()))
      {
         while (window.getPosition() < size)
         {
            if (flags.readBit() == false)
            {
               window.write(IOUtil.readUInt8(is));
               continue;
            }

            final int b1 = IOUtil.readUInt8(is);
            final int b2 = IOUtil.readUInt8(is);
            window.backCopy((((b1 & 0x0F) << 8) | b2) + 1, (b1 >> 4) + 3);
         }

         DecompressedSizeException.throwIfMismatch(window.getPosition(), size);
      }

      return size;
   }


   @Override
   public String getName()
   {
      return "LZ10";
   }
}
