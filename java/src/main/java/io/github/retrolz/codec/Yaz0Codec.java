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
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;


/**
 * Nintendo Yaz0 (GameCube, Wii, Switch). The Yay0 match tokens interleaved
 * with the literals in groups of 8 items after a flag byte:
 * <pre>
 * "Yaz0" | decompressed size (u32 BE) | memory alignment (u32 BE) | 0 (u32)
 * </pre>
 * The memory alignment is taken from the "alignment" context key (Integer,
 * default 0) and is available after decompression with {@link #getAlignment()}.
 */
public final class Yaz0Codec extends AbstractCodec
{
   public static final byte[] IDENTIFIER = "Yaz0".getBytes(StandardCharsets.US_ASCII);

   private int alignment;


   public Yaz0Codec()
   {
      this(new HashMap<String, Object>());
   }


   public Yaz0Codec(Map<String, Object> ctx)
   {
      super(ctx);
      this.alignment = (Integer) ctx.getOrDefault("alignment", 0);
   }


   @Override
   protected void encode(byte[] src, OutputStream os, CompressionLevel level) throws IOException
   {
      os.write(IDENTIFIER);
      IOUtil.writeInt32(os, src.length, ByteOrder.BIG_ENDIAN);
      IOUtil.writeInt32(os, this.alignment, ByteOrder.BIG_ENDIAN);
      IOUtil.writeInt32(os, 0, ByteOrder.BIG_ENDIAN);

      final LZMatchFinder finder = new LZMatchFinder(Yay0Codec.CONSTRAINTS, this.lookAhead, level);

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
               flags.writeBit(true);
               continue;
            }

            Yay0Codec.encodeMatch(m, payload, payload);
            pos += m.getLength();
            flags.writeBit(false);
         }
      }
   }


   @Override
   protected long decode(InputStream is, OutputStream os) throws IOException
   {
      IOUtil.checkIdentifier(is, IDENTIFIER);
      final int size = checkSize(IOUtil.readInt32(is, ByteOrder.BIG_ENDIAN));
      this.alignment = IOUtil.readInt32(is, ByteOrder.BIG_ENDIAN);
      IOUtil.readInt32(is, ByteOrder.BIG_ENDIAN);

      final FlagReader flags = new DefaultFlagReader(is, BitOrder.MSB_FIRST);

      try (LzWindow window = new LzWindow(os, Yay0Codec.CONSTRAINTS.getWindowSize()))
      {
         while (window.getPosition() < size)
         {
            if (flags.readBit() == true)
               window.write(IOUtil.readUInt8(is));
            else
               Yay0Codec.decodeMatch(is, is, window);
         }

         DecompressedSizeException.throwIfMismatch(window.getPosition(), size);
      }

      return size;
   }


   public int getAlignment()
   {
      return this.alignment;
   }


   @Override
   public String getName()
   {
      return "YAZ0";
   }
}
