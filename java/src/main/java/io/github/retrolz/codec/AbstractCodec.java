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

import io.github.retrolz.Error;
import io.github.retrolz.Event;
import io.github.retrolz.Listener;
import io.github.retrolz.io.FormatException;
import io.github.retrolz.io.IOUtil;
import io.github.retrolz.match.CompressionLevel;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteOrder;
import java.util.HashMap;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;


/**
 * Common part of the codecs: context parameters, listeners and the
 * one byte type + 24 bit size header shared by the Nintendo formats.
 * <p>
 * Supported context keys: "lookAhead" (Boolean, default true). Codecs using
 * the parallel match finder also honor its keys.
 * </p>
 */
public abstract class AbstractCodec implements CompressionCodec
{
   private final Queue<Listener> listeners;
   protected final Map<String, Object> ctx;
   protected final boolean lookAhead;


   protected AbstractCodec(Map<String, Object> ctx)
   {
      if (ctx == null)
         throw new NullPointerException("Invalid null context parameter");

      this.ctx = new HashMap<>(ctx);
      this.lookAhead = (Boolean) ctx.getOrDefault("lookAhead", true);
      this.listeners = new ConcurrentLinkedQueue<>();
   }


   public boolean addListener(Listener bl)
   {
      return (bl != null) ? this.listeners.add(bl) : false;
   }


   public boolean removeListener(Listener bl)
   {
      return (bl != null) ? this.listeners.remove(bl) : false;
   }


   protected Listener[] getListeners()
   {
      return this.listeners.toArray(new Listener[0]);
   }


   @Override
   public final void compress(byte[] src, OutputStream os, CompressionLevel level) throws IOException
   {
      if (src == null)
         throw new NullPointerException("Invalid null source buffer");

      if (os == null)
         throw new NullPointerException("Invalid null output stream");

      if (level == null)
         throw new NullPointerException("Invalid null compression level");

      final Listener[] blockListeners = this.getListeners();
      notifyListeners(blockListeners, new Event(Event.Type.COMPRESSION_START, -1, src.length));
      final CountingOutputStream cos = new CountingOutputStream(os);
      this.encode(src, cos, level);
      cos.flush();
      notifyListeners(blockListeners, new Event(Event.Type.COMPRESSION_END, -1, cos.written));
   }


   @Override
   public final void decompress(InputStream is, OutputStream os) throws IOException
   {
      if (is == null)
         throw new NullPointerException("Invalid null input stream");

      if (os == null)
         throw new NullPointerException("Invalid null output stream");

      final Listener[] blockListeners = this.getListeners();
      notifyListeners(blockListeners, new Event(Event.Type.DECOMPRESSION_START, -1, 0));
      final long decoded = this.decode(is, os);
      os.flush();
      notifyListeners(blockListeners, new Event(Event.Type.DECOMPRESSION_END, -1, decoded));
   }


   protected abstract void encode(byte[] src, OutputStream os, CompressionLevel level) throws IOException;


   // Returns the number of decompressed bytes
   protected abstract long decode(InputStream is, OutputStream os) throws IOException;


   /**
    * Writes a type byte followed by the size on 24 bits (little endian).
    * Sizes that do not fit (and 0) are written as a null 24 bit field
    * followed by the size on 32 bits.
    *
    * @param os the output
    * @param type the format type byte
    * @param size the decompressed size
    * @throws IOException if the output cannot be written
    */
   protected static void writeSizeHeader(OutputStream os, int type, int size) throws IOException
   {
      if ((size > 0) && (size <= 0xFFFFFF))
      {
         IOUtil.writeInt32(os, (size << 8) | (type & 0xFF), ByteOrder.LITTLE_ENDIAN);
         return;
      }

      IOUtil.writeInt32(os, type & 0xFF, ByteOrder.LITTLE_ENDIAN);
      IOUtil.writeInt32(os, size, ByteOrder.LITTLE_ENDIAN);
   }


   /**
    * Reads a header written by {@link #writeSizeHeader(OutputStream, int, int)}.
    *
    * @param is the compressed data
    * @param type the expected type byte
    * @return the decompressed size
    * @throws FormatException if the type byte or the size is not valid
    */
   protected static int readSizeHeader(InputStream is, int type) throws FormatException
   {
      final int header;

      try
      {
         header = IOUtil.readInt32(is, ByteOrder.LITTLE_ENDIAN);
      }
      catch (io.github.retrolz.BitStreamException e)
      {
         throw new FormatException("Header too short", Error.ERR_INVALID_FILE);
      }

      if ((header & 0xFF) != (type & 0xFF))
         throw new FormatException(String.format("Invalid type: expected 0x%02X, got 0x%02X", type & 0xFF,
            header & 0xFF), Error.ERR_INVALID_FILE);

      int size = header >>> 8;

      if (size == 0)
         size = IOUtil.readInt32(is, ByteOrder.LITTLE_ENDIAN);

      return checkSize(size);
   }


   protected static int checkSize(int size) throws FormatException
   {
      if (size < 0)
         throw new FormatException("Invalid decompressed size: " + (size & 0xFFFFFFFFL), Error.ERR_INVALID_FILE);

      return size;
   }


   static void notifyListeners(Listener[] listeners, Event evt)
   {
      for (Listener bl : listeners)
      {
         try
         {
            bl.processEvent(evt);
         }
         catch (Exception e)
         {
            // Ignore exceptions in listeners
         }
      }
   }


   private static final class CountingOutputStream extends FilterOutputStream
   {
      long written;


      CountingOutputStream(OutputStream os)
      {
         super(os);
      }


      @Override
      public void write(int b) throws IOException
      {
         this.out.write(b);
         this.written++;
      }


      @Override
      public void write(byte[] array, int off, int len) throws IOException
      {
         this.out.write(array, off, len);
         this.written += len;
      }
   }
}
