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
import io.github.retrolz.BitStreamException;


/**
 * Sliding window used by LZ decoders. The last {@code capacity} bytes produced
 * are kept in a ring so that back-references can be replayed, and completed
 * parts of the ring are forwarded to the sink. The sink is only appended to,
 * it does not need to support seeking.
 * <p>
 * A back-reference longer than its distance copies bytes it has just produced
 * (e.g. distance 1 repeats the last byte), the copy is therefore performed one
 * byte at a time, front to back.
 * </p>
 * <p>
 * Closing the window writes the pending bytes but leaves the sink open.
 * Instances are not thread safe.
 * </p>
 */
public final class LzWindow extends OutputStream
{
   private final OutputStream sink;
   private final byte[] buffer;
   private final int windowStart;
   private int index;     // ring index of the next byte to write
   private int mark;      // ring index of the first byte not yet written to the sink
   private long position; // total number of bytes produced
   private boolean closed;


   public LzWindow(OutputStream sink, int capacity)
   {
      this(sink, capacity, 0);
   }


   /**
    * Creates a new window.
    *
    * @param sink the stream receiving the decompressed bytes
    * @param capacity the window size (maximum back-reference distance)
    * @param windowStart bias of the absolute ring offsets used by {@link #offsetCopy(int, int)}
    */
   public LzWindow(OutputStream sink, int capacity, int windowStart)
   {
      if (sink == null)
         throw new NullPointerException("Invalid null output stream parameter");

      if (capacity < 1)
         throw new IllegalArgumentException("Invalid window capacity: " + capacity + " (must be at least 1)");

      if (windowStart < 0)
         throw new IllegalArgumentException("Invalid window start: " + windowStart + " (must be positive or null)");

      this.sink = sink;
      this.buffer = new byte[capacity];
      this.windowStart = windowStart;
   }


   @Override
   public void write(int b)
   {
      if (this.closed == true)
         throw new BitStreamException("Stream closed", BitStreamException.STREAM_CLOSED);

      this.buffer[this.index] = (byte) b;
      this.position++;

      if (++this.index == this.buffer.length)
         this.wrap();
   }


   @Override
   public void write(byte[] array, int offset, int length)
   {
      if (this.closed == true)
         throw new BitStreamException("Stream closed", BitStreamException.STREAM_CLOSED);

      if ((offset < 0) || (length < 0) || (offset + length > array.length))
         throw new IndexOutOfBoundsException("Invalid range: offset=" + offset + ", length=" + length);

      while (length > 0)
      {
         final int n = Math.min(length, this.buffer.length - this.index);
         System.arraycopy(array, offset, this.buffer, this.index, n);
         this.index += n;
         this.position += n;
         offset += n;
         length -= n;

         if (this.index == this.buffer.length)
            this.wrap();
      }
   }


   /**
    * Copies {@code length} bytes starting {@code distance} bytes behind the
    * current position.
    *
    * @param distance the back-reference distance, in [1..capacity]
    * @param length the number of bytes to copy
    * @throws BitStreamException if the distance points outside of the window
    * or before the first byte produced
    */
   public void backCopy(int distance, int length)
   {
      if (this.closed == true)
         throw new BitStreamException("Stream closed", BitStreamException.STREAM_CLOSED);

      if ((distance < 1) || (distance > this.buffer.length) || (distance > this.position))
         throw new BitStreamException("Invalid back-reference distance " + distance + " at position " +
            this.position + " (window size " + this.buffer.length + ")", BitStreamException.INVALID_STREAM);

      if (length < 0)
         throw new IllegalArgumentException("Invalid back-reference length: " + length);

      int src = this.index - distance;

      if (src < 0)
         src += this.buffer.length;

      for (int i=0; i<length; i++)
      {
         this.buffer[this.index] = this.buffer[src];
         this.position++;

         if (++this.index == this.buffer.length)
            this.wrap();

         if (++src == this.buffer.length)
            src = 0;
      }
   }


   /**
    * Copies {@code length} bytes from an absolute offset in the ring. The
    * offset is relative to the window start given at construction (some LZSS
    * variants start writing at a non null ring offset).
    *
    * @param offset the absolute ring offset
    * @param length the number of bytes to copy
    * @throws BitStreamException if the offset refers to a byte not produced yet
    */
   public void offsetCopy(int offset, int length)
   {
      final int cap = this.buffer.length;
      final int src = Math.floorMod(offset - this.windowStart, cap);
      int distance = this.index - src;

      if (distance <= 0)
         distance += cap;

      this.backCopy(distance, length);
   }


   /**
    * Copies {@code length} literal bytes from a stream.
    *
    * @param is the source of the literal bytes
    * @param length the number of bytes to copy
    * @throws BitStreamException if the source is exhausted
    */
   public void copyFrom(InputStream is, int length)
   {
      if (this.closed == true)
         throw new BitStreamException("Stream closed", BitStreamException.STREAM_CLOSED);

      while (length > 0)
      {
         final int n = Math.min(length, this.buffer.length - this.index);
         IOUtil.readFully(is, this.buffer, this.index, n);
         this.index += n;
         this.position += n;
         length -= n;

         if (this.index == this.buffer.length)
            this.wrap();
      }
   }


   /**
    * Writes the bytes not yet forwarded to the sink.
    */
   @Override
   public void flush()
   {
      if (this.index > this.mark)
      {
         this.writeToSink(this.mark, this.index - this.mark);
         this.mark = this.index;
      }
   }


   @Override
   public void close()
   {
      if (this.closed == true)
         return;

      this.flush();
      this.closed = true;
   }


   /**
    * Returns the total number of bytes produced so far.
    *
    * @return the logical write position
    */
   public long getPosition()
   {
      return this.position;
   }


   public int getCapacity()
   {
      return this.buffer.length;
   }


   // The ring is full: forward the pending part and restart at index 0
   private void wrap()
   {
      this.writeToSink(this.mark, this.buffer.length - this.mark);
      this.index = 0;
      this.mark = 0;
   }


   private void writeToSink(int offset, int length)
   {
      try
      {
         this.sink.write(this.buffer, offset, length);
      }
      catch (IOException e)
      {
         throw new BitStreamException(e.getMessage(), e, BitStreamException.INPUT_OUTPUT);
      }
   }
}
