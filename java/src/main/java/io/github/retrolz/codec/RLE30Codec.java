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
import io.github.retrolz.io.IOUtil;
import io.github.retrolz.match.CompressionLevel;
import io.github.retrolz.match.RleMatchFinder;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;


/**
 * Nintendo run length encoding (GBA/DS BIOS). Each chunk starts with a
 * control byte: bit 7 set announces a run of {@code (flag & 0x7F) + 3} copies
 * of the next byte, otherwise {@code (flag & 0x7F) + 1} literal bytes follow.
 */
public final class RLE30Codec extends AbstractCodec
{
   public static final int TYPE = 0x30;
   private static final int RUN_FLAG = 0x80;
   private static final int MIN_RUN = 3;
   private static final int MAX_CHUNK = 0x80;


   public RLE30Codec()
   {
      this(new HashMap<String, Object>());
   }


   public RLE30Codec(Map<String, Object> ctx)
   {
      super(ctx);
   }


   @Override
   protected void encode(byte[] src, OutputStream os, CompressionLevel level) throws IOException
   {
      writeSizeHeader(os, TYPE, src.length);
      final RleMatchFinder finder = new RleMatchFinder(MIN_RUN, MAX_CHUNK);
      int pos = 0;

      while (pos < src.length)
      {
         int n = finder.tryFindMatch(src, pos);

         if ((n > 0) && (level != CompressionLevel.NONE))
         {
            os.write(RUN_FLAG | (n - MIN_RUN));
            os.write(src[pos]);
            pos += n;
            continue;
         }

         // Level NONE stores everything as literals
         if (n > 0)
            n = Math.min(src.length - pos, MAX_CHUNK);
         else
            n = -n;

         os.write(n - 1);
         os.write(src, pos, n);
         pos += n;
      }
   }


   @Override
   protected long decode(InputStream is, OutputStream os) throws IOException
   {
      final int size = readSizeHeader(is, TYPE);
      final byte[] buf = new byte[MAX_CHUNK + MIN_RUN];
      long written = 0;

      while (written < size)
      {
         final int flag = IOUtil.readUInt8(is);
         final int length;

         if ((flag & RUN_FLAG) != 0)
         {
            length = (flag & 0x7F) + MIN_RUN;
            Arrays.fill(buf, 0, length, (byte) IOUtil.readUInt8(is));
         }
         else
         {
            length = (flag & 0x7F) + 1;
            IOUtil.readFully(is, buf, 0, length);
         }

         os.write(buf, 0, length);
         written += length;
      }

      DecompressedSizeException.throwIfMismatch(written, size);
      return size;
   }


   @Override
   public String getName()
   {
      return "RLE30";
   }
}
