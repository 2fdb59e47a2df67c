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
import io.github.retrolz.Listener;
import io.github.retrolz.bitstream.BitOrder;
import io.github.retrolz.bitstream.DefaultFlagReader;
import io.github.retrolz.bitstream.DefaultFlagWriter;
import io.github.retrolz.io.IOUtil;
import io.github.retrolz.io.LzWindow;
import io.github.retrolz.match.CompressionLevel;
import io.github.retrolz.match.Match;
import io.github.retrolz.match.MatchConstraints;
import io.github.retrolz.match.ParallelMatchFinder;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteOrder;
import java.util.HashMap;
import java.util.List;
import java.util.Map;


/**
 * Nintendo LZ11 (DS). Same layout as LZ10 with three match token sizes:
 * <pre>
 * LLLLDDDD DDDDDDDD                     length 3..16
 * 0000LLLL LLLLDDDD DDDDDDDD            length 17..272
 * 0001LLLL LLLLLLLL LLLLDDDD DDDDDDDD   length 273..65808
 * </pre>
 * The whole input is searched upfront with the {@link ParallelMatchFinder},
 * configured through the context ("jobs", "pool", "blockSize").
 */
public final class LZ11Codec extends AbstractCodec
{
   public static final int TYPE = 0x11;
   public static final MatchConstraints CONSTRAINTS = new MatchConstraints(0x1000, 3, 0x4000);


   public LZ11Codec()
   {
      this(new HashMap<String, Object>());
   }


   public LZ11Codec(Map<String, Object> ctx)
   {
      super(ctx);
   }


   @Override
   protected void encode(byte[] src, OutputStream os, CompressionLevel level) throws IOException
   {
      writeSizeHeader(os, TYPE, src.length);
      final ParallelMatchFinder finder = new ParallelMatchFinder(CONSTRAINTS, this.lookAhead, level, this.ctx);

      for (Listener bl : this.getListeners())
         finder.addListener(bl);

      final List<Match> matches = finder.findMatches(src);

      try (FlagWriter flags = new DefaultFlagWriter(os, BitOrder.MSB_FIRST))
      {
         final OutputStream payload = flags.getPayload();
         int pos = 0;
         int next = 0;

         while (pos < src.length)
         {
            if ((next >= matches.size()) || (matches.get(next).getOffset() != pos))
            {
               payload.write(src[pos++]);
               flags.writeBit(false);
               continue;
            }

            final Match m = matches.get(next++);
            writeMatch(payload, m.getDistance() - 1, m.getLength());
            pos += m.getLength();
            flags.writeBit(true);
         }
      }
   }


   private static void writeMatch(OutputStream os, int dist, int length) throws IOException
   {
      if (length <= 16)
      {
         IOUtil.writeInt16(os, ((length - 1) << 12) | (dist & 0xFFF), ByteOrder.BIG_ENDIAN);
      }
      else if (length <= 272)
      {
         os.write((length - 17) >> 4);
         IOUtil.writeInt16(os, (((length - 17) & 0x0F) << 12) | (dist & 0xFFF), ByteOrder.BIG_ENDIAN);
      }
      else
      {
         IOUtil.writeInt32(os, 0x10000000 | (((length - 273) & 0xFFFF) << 12) | (dist & 0xFFF), ByteOrder.BIG_ENDIAN);
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
            final int distance;
            final int length;

            switch (b1 >> 4)
            {
               case 0:
               {
                  final int b3 = IOUtil.readUInt8(is);
                  distance = (((b2 & 0x0F) << 8) | b3) + 1;
                  length = (((b1 & 0x0F) << 4) | (b2 >> 4)) + 17;
                  break;
               }

               case 1:
               {
                  final int b3 = IOUtil.readUInt8(is);
                  final int b4 = IOUtil.readUInt8(is);
                  distance = (((b3 & 0x0F) << 8) | b4) + 1;
                  length = (((b1 & 0x0F) << 12) | (b2 << 4) | (b3 >> 4)) + 273;
                  break;
               }

               default:
                  distance = (((b1 & 0x0F) << 8) | b2) + 1;
                  length = (b1 >> 4) + 1;
            }

            window.backCopy(distance, length);
         }

         DecompressedSizeException.throwIfMismatch(window.getPosition(), size);
      }

      return size;
   }


   @Override
   public String getName()
   {
      return "LZ11";
   }
}
