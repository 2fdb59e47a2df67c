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
import io.github.retrolz.Error;
import io.github.retrolz.FlagReader;
import io.github.retrolz.FlagWriter;
import io.github.retrolz.bitstream.BitOrder;
import io.github.retrolz.bitstream.DefaultFlagReader;
import io.github.retrolz.bitstream.DefaultFlagWriter;
import io.github.retrolz.io.FormatException;
import io.github.retrolz.io.IOUtil;
import io.github.retrolz.io.LzWindow;
import io.github.retrolz.match.CompressionLevel;
import io.github.retrolz.match.LZMatchFinder;
import io.github.retrolz.match.Match;
import io.github.retrolz.match.MatchConstraints;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteOrder;
import java.util.Map;


/**
 * Formats storing flags, match tokens and literals in three separate
 * sections (Nintendo 64 MIO0, GameCube Yay0):
 * <pre>
 * identifier (4) | decompressed size (u32 BE) | token offset (u32 BE) | literal offset (u32 BE)
 * flag words | match tokens | literals
 * </pre>
 * Offsets are relative to the start of the header. Flags are 32 bit big
 * endian words read most significant bit first, a set bit announces a
 * literal.
 */
public abstract class SectionedCodec extends AbstractCodec
{
   private static final int HEADER_SIZE = 16;

   private final byte[] identifier;
   private final MatchConstraints constraints;


   protected SectionedCodec(byte[] identifier, MatchConstraints constraints, Map<String, Object> ctx)
   {
      super(ctx);
      this.identifier = identifier;
      this.constraints = constraints;
   }


   protected abstract void writeMatch(Match m, OutputStream tokens, OutputStream literals) throws IOException;


   protected abstract void readMatch(InputStream tokens, InputStream literals, LzWindow window);


   @Override
   protected void encode(byte[] src, OutputStream os, CompressionLevel level) throws IOException
   {
      final ByteArrayOutputStream flagData = new ByteArrayOutputStream(512);
      final ByteArrayOutputStream tokens = new ByteArrayOutputStream(1024);
      final ByteArrayOutputStream literals = new ByteArrayOutputStream(1024);
      final LZMatchFinder finder = new LZMatchFinder(this.constraints, this.lookAhead, level);

      try (FlagWriter flags = new DefaultFlagWriter(flagData, BitOrder.MSB_FIRST, 4, ByteOrder.BIG_ENDIAN))
      {
         int pos = 0;

         while (pos < src.length)
         {
            final Match m = finder.tryFindMatch(src, pos);

            if (m.isNone() == true)
            {
               literals.write(src[pos++]);
               flags.writeBit(true);
               continue;
            }

            this.writeMatch(m, tokens, literals);
            pos += m.getLength();
            flags.writeBit(false);
         }
      }

      final int tokenOffset = HEADER_SIZE + flagData.size();
      os.write(this.identifier);
      IOUtil.writeInt32(os, src.length, ByteOrder.BIG_ENDIAN);
      IOUtil.writeInt32(os, tokenOffset, ByteOrder.BIG_ENDIAN);
      IOUtil.writeInt32(os, tokenOffset + tokens.size(), ByteOrder.BIG_ENDIAN);
      flagData.writeTo(os);
      tokens.writeTo(os);
      literals.writeTo(os);
   }


   @Override
   protected long decode(InputStream is, OutputStream os) throws IOException
   {
      IOUtil.checkIdentifier(is, this.identifier);
      final int size = checkSize(IOUtil.readInt32(is, ByteOrder.BIG_ENDIAN));
      final int tokenOffset = IOUtil.readInt32(is, ByteOrder.BIG_ENDIAN);
      final int literalOffset = IOUtil.readInt32(is, ByteOrder.BIG_ENDIAN);

      if ((tokenOffset < HEADER_SIZE) || (literalOffset < tokenOffset))
         throw new FormatException("Invalid section offsets: " + tokenOffset + ", " + literalOffset,
            Error.ERR_INVALID_FILE);

      final byte[] flagData = IOUtil.readSection(is, tokenOffset - HEADER_SIZE);
      final byte[] tokenData = IOUtil.readSection(is, literalOffset - tokenOffset);

      // Single byte units read the same bits as 32 bit big endian words
      final FlagReader flags = new DefaultFlagReader(new ByteArrayInputStream(flagData), BitOrder.MSB_FIRST);
      final InputStream tokens = new ByteArrayInputStream(tokenData);

      try (LzWindow window = new LzWindow(os, this.constraints.getWindowSize()))
      {
         while (window.getPosition() < size)
         {
            if (flags.readBit() == true)
               window.write(IOUtil.readUInt8(is));
            else
               this.readMatch(tokens, is, window);
         }

         DecompressedSizeException.throwIfMismatch(window.getPosition(), size);
      }

      return size;
   }


   public MatchConstraints getConstraints()
   {
      return this.constraints;
   }
}
