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

package io.github.retrolz.test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import io.github.retrolz.BitStreamException;
import io.github.retrolz.io.LzWindow;
import org.junit.Assert;
import org.junit.Test;


public class TestLzWindow
{
   @Test
   public void testOverlappingCopy()
   {
      ByteArrayOutputStream sink = new ByteArrayOutputStream();

      try (LzWindow window = new LzWindow(sink, 0x1000))
      {
         window.write(0x41);
         window.backCopy(1, 99);
         Assert.assertEquals(100, window.getPosition());
      }

      byte[] expected = new byte[100];
      Arrays.fill(expected, (byte) 0x41);
      Assert.assertArrayEquals(expected, sink.toByteArray());
   }


   @Test
   public void testWrapAround()
   {
      ByteArrayOutputStream sink = new ByteArrayOutputStream();
      byte[] expected = new byte[120];

      for (int i=0; i<100; i++)
         expected[i] = (byte) i;

      for (int i=100; i<120; i++)
         expected[i] = expected[i-16];

      try (LzWindow window = new LzWindow(sink, 16))
      {
         for (int i=0; i<100; i++)
            window.write(i);

         // Completed rings are forwarded without flush
         Assert.assertEquals(96, sink.size());
         window.backCopy(16, 20);
      }

      Assert.assertArrayEquals(expected, sink.toByteArray());
   }


   @Test
   public void testBlockWrite()
   {
      ByteArrayOutputStream sink = new ByteArrayOutputStream();
      byte[] data = new byte[1000];

      for (int i=0; i<data.length; i++)
         data[i] = (byte) (i * 7);

      try (LzWindow window = new LzWindow(sink, 64))
      {
         window.write(data, 0, 10);
         window.write(data, 10, data.length - 10);
      }

      Assert.assertArrayEquals(data, sink.toByteArray());
   }


   @Test
   public void testInvalidDistances()
   {
      LzWindow window = new LzWindow(new ByteArrayOutputStream(), 16);
      Assert.assertEquals(16, window.getCapacity());
      window.write(new byte[4], 0, 4);
      checkInvalid(window, 0);
      checkInvalid(window, 5);
      window.write(new byte[40], 0, 40);
      checkInvalid(window, 17);
      window.backCopy(16, 1);
      window.close();
   }


   private static void checkInvalid(LzWindow window, int distance)
   {
      try
      {
         window.backCopy(distance, 3);
         Assert.fail("Distance " + distance + " should be rejected at position " + window.getPosition());
      }
      catch (BitStreamException e)
      {
         Assert.assertEquals(BitStreamException.INVALID_STREAM, e.getErrorCode());
      }
   }


   @Test
   public void testOffsetCopy()
   {
      ByteArrayOutputStream sink = new ByteArrayOutputStream();

      try (LzWindow window = new LzWindow(sink, 0x1000, 0xFEE))
      {
         window.write("ABCD".getBytes(StandardCharsets.US_ASCII), 0, 4);
         window.offsetCopy(0xFEE, 4);
         window.offsetCopy(0xFEF, 2);

         try
         {
            // Ring bytes before the window start were never written
            window.offsetCopy(0, 3);
            Assert.fail("Offset before the first byte should be rejected");
         }
         catch (BitStreamException e)
         {
            Assert.assertEquals(BitStreamException.INVALID_STREAM, e.getErrorCode());
         }
      }

      Assert.assertEquals("ABCDABCDBC", new String(sink.toByteArray(), StandardCharsets.US_ASCII));
   }


   @Test
   public void testCopyFrom()
   {
      ByteArrayOutputStream sink = new ByteArrayOutputStream();
      LzWindow window = new LzWindow(sink, 8);
      window.copyFrom(new ByteArrayInputStream(new byte[] { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10 }), 10);
      Assert.assertEquals(10, window.getPosition());

      try
      {
         window.copyFrom(new ByteArrayInputStream(new byte[] { 1 }), 2);
         Assert.fail("Reading past the end of the source should fail");
      }
      catch (BitStreamException e)
      {
         Assert.assertEquals(BitStreamException.END_OF_STREAM, e.getErrorCode());
      }
   }


   @Test
   public void testFlushAndClose()
   {
      ByteArrayOutputStream sink = new ByteArrayOutputStream();
      LzWindow window = new LzWindow(sink, 0x1000);
      window.write(new byte[] { 1, 2, 3 }, 0, 3);
      Assert.assertEquals(0, sink.size());
      window.flush();
      Assert.assertEquals(3, sink.size());
      window.write(4);
      window.close();
      Assert.assertArrayEquals(new byte[] { 1, 2, 3, 4 }, sink.toByteArray());

      try
      {
         window.write(5);
         Assert.fail("Writing to a closed window should fail");
      }
      catch (BitStreamException e)
      {
         Assert.assertEquals(BitStreamException.STREAM_CLOSED, e.getErrorCode());
      }
   }
}
