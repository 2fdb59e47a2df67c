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

package io.github.retrolz.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import io.github.retrolz.BitStreamException;
import io.github.retrolz.Error;
import io.github.retrolz.Memory;


/**
 * Stream helpers used by the codecs to read and write header fields and
 * payload bytes. Reads fail with a {@link BitStreamException} when the source
 * is exhausted, so truncated data is never mistaken for valid data.
 */
public class IOUtil
{
    private static final int SECTION_CHUNK = 1 << 16;

    private IOUtil()
    {
    }


    public static int readUInt8(InputStream is)
    {
       final int b;

       try
       {
          b = is.read();
       }
       catch (IOException e)
       {
          throw new BitStreamException(e.getMessage(), e, BitStreamException.INPUT_OUTPUT);
       }

       if (b < 0)
          throw new BitStreamException("Unexpected end of compressed data", BitStreamException.END_OF_STREAM);

       return b;
    }


    public static void readFully(InputStream is, byte[] buf, int offset, int length)
    {
       int n = 0;

       try
       {
          while (n < length)
          {
             final int r = is.read(buf, offset+n, length-n);

             if (r < 0)
                throw new BitStreamException("Unexpected end of compressed data", BitStreamException.END_OF_STREAM);

             n += r;
          }
       }
       catch (IOException e)
       {
          throw new BitStreamException(e.getMessage(), e, BitStreamException.INPUT_OUTPUT);
       }
    }


    /**
     * Reads a section of {@code length} bytes whose size comes from untrusted
     * header data. The buffer grows with the bytes actually read, so a bogus
     * length ends with END_OF_STREAM instead of a huge allocation.
     *
     * @param is the source
     * @param length the declared section length
     * @return the section bytes
     */
    public static byte[] readSection(InputStream is, int length)
    {
       if (length < 0)
          throw new BitStreamException("Invalid section length: " + length, BitStreamException.INVALID_STREAM);

       byte[] buf = new byte[Math.min(length, SECTION_CHUNK)];
       int n = 0;

       while (n < length)
       {
          if (n == buf.length)
             buf = Arrays.copyOf(buf, (int) Math.min((long) length, 2L * buf.length));

          final int chunk = Math.min(buf.length - n, SECTION_CHUNK);
          readFully(is, buf, n, chunk);
          n += chunk;
       }

       return buf;
    }


    public static int readInt16(InputStream is, ByteOrder order)
    {
       final byte[] buf = new byte[2];
       readFully(is, buf, 0, 2);
       return (order == ByteOrder.BIG_ENDIAN) ? Memory.BigEndian.readInt16(buf, 0) :
          Memory.LittleEndian.readInt16(buf, 0);
    }


    public static int readInt32(InputStream is, ByteOrder order)
    {
       final byte[] buf = new byte[4];
       readFully(is, buf, 0, 4);
       return (order == ByteOrder.BIG_ENDIAN) ? Memory.BigEndian.readInt32(buf, 0) :
          Memory.LittleEndian.readInt32(buf, 0);
    }


    public static void writeInt16(OutputStream os, int value, ByteOrder order) throws IOException
    {
       final byte[] buf = new byte[2];

       if (order == ByteOrder.BIG_ENDIAN)
          Memory.BigEndian.writeInt16(buf, 0, value);
       else
          Memory.LittleEndian.writeInt16(buf, 0, value);

       os.write(buf, 0, 2);
    }


    public static void writeInt32(OutputStream os, int value, ByteOrder order) throws IOException
    {
       final byte[] buf = new byte[4];

       if (order == ByteOrder.BIG_ENDIAN)
          Memory.BigEndian.writeInt32(buf, 0, value);
       else
          Memory.LittleEndian.writeInt32(buf, 0, value);

       os.write(buf, 0, 4);
    }


    /**
     * Reads the identifier at the start of a header and checks it.
     *
     * @param is the compressed data
     * @param identifier the expected identifier
     * @throws FormatException if the identifier does not match
     */
    public static void checkIdentifier(InputStream is, byte[] identifier) throws FormatException
    {
       final byte[] buf = new byte[identifier.length];

       try
       {
          readFully(is, buf, 0, buf.length);
       }
       catch (BitStreamException e)
       {
          throw new FormatException("Header too short: missing identifier", Error.ERR_INVALID_FILE);
       }

       if (Arrays.equals(buf, identifier) == false)
          throw new FormatException("Invalid identifier: expected '" + new String(identifier, StandardCharsets.US_ASCII) + "'",
             Error.ERR_INVALID_FILE);
    }
}
