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


// Nintendo 64 MIO0: 2 byte match tokens, 4 bits of length and 12 bits of distance
public final class MIO0Codec extends SectionedCodec
{
   public static final byte[] IDENTIFIER = "MIO0".getBytes(StandardCharsets.US_ASCII);
   public static final MatchConstraints CONSTRAINTS = new MatchConstraints(0x1000, 3, 18);


   public MIO0Codec()
   {
      this(new HashMap<String, Object>());
   }


   public MIO0Codec(Map<String, Object> ctx)
   {
      super(IDENTIFIER, CONSTRAINTS, ctx);
   }


   @Override
   protected void writeMatch(Match m, OutputStream tokens, OutputStream literals) throws IOException
   {
      IOUtil.writeInt16(tokens, (m.getDistance() - 1) | ((m.getLength() - 3) << 12), ByteOrder.BIG_ENDIAN);
   }


   @Override
   protected void readMatch(InputStream tokens, InputStream literals, LzWindow window)
   {
      final int token = IOUtil.readInt16(tokens, ByteOrder.BIG_ENDIAN);
      window.backCopy((token & 0xFFF) + 1, (token >> 12) + 3);
   }


   @Override
   public String getName()
   {
      return "MIO0";
   }
}
