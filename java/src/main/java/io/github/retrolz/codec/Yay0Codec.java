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

import io.github.retrolz.io.IOUtil;
import io.github.retrolz.io.LzWindow;
import io.github.retrolz.match.Match;
import io.github.retrolz.match.MatchConstraints;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;


/**
 * GameCube Yay0. A match is a 2 byte token {@code LLLLDDDD DDDDDDDD}
 * (length 3..17 stored as length-2); a null length nibble means the length
 * minus 18 follows in the literal section (length 18..273).
 */
public final class Yay0Codec extends SectionedCodec
{
   public static final byte[] IDENTIFIER = "Yay0".getBytes(StandardCharsets.US_ASCII);
   public static final MatchConstraints CONSTRAINTS = new MatchConstraints(0x1000, 3, 0xFF + 0x12);


   public Yay0Codec()
   {
      this(new HashMap<String, Object>());
   }


   public Yay0Codec(Map<String, Object> ctx)
   {
      super(IDENTIFIER, CONSTRAINTS, ctx);
   }


   @Override
   protected void writeMatch(Match m, OutputStream tokens, OutputStream literals) throws IOException
   {
      encodeMatch(m, tokens, literals);
   }


   @Override
   protected void readMatch(InputStream tokens, InputStream literals, LzWindow window)
   {
      decodeMatch(tokens, literals, window);
   }


   // Shared with Yaz0 where both streams are the same
   static void encodeMatch(Match m, OutputStream tokens, OutputStream lengths) throws IOException
   {
      final int dist = m.getDistance() - 1;

      if (m.getLength() < 0x12)
      {
         IOUtil.writeInt16(tokens, dist | ((m.getLength() - 2) << 12), ByteOrder.BIG_ENDIAN);
         return;
      }

      IOUtil.writeInt16(tokens, dist & 0xFFF, ByteOrder.BIG_ENDIAN);
      lengths.write(m.getLength() - 0x12);
   }


   static void decodeMatch(InputStream tokens, InputStream lengths, LzWindow window)
   {
      final int b1 = IOUtil.readUInt8(tokens);
      final int b2 = IOUtil.readUInt8(tokens);
      final int distance = (((b1 & 0x0F) << 8) | b2) + 1;
      int length = b1 >> 4;

      if (length == 0)
         length = IOUtil.readUInt8(lengths) + 0x12;
      else
         length += 2;

      window.backCopy(distance, length);
   }


   @Override
   public String getName()
   {
      return "YAY0";
   }
}
