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
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import io.github.retrolz.BitStreamException;
import io.github.retrolz.DecompressedSizeException;
import io.github.retrolz.Error;
import io.github.retrolz.codec.AbstractCodec;
import io.github.retrolz.codec.CodecFactory;
import io.github.retrolz.codec.CompressionCodec;
import io.github.retrolz.codec.LZ10Codec;
import io.github.retrolz.codec.LZSSCodec;
import io.github.retrolz.codec.RLE30Codec;
import io.github.retrolz.codec.Yaz0Codec;
import io.github.retrolz.io.FormatException;
import io.github.retrolz.match.CompressionLevel;
import io.github.retrolz.match.MatchConstraints;
import io.github.retrolz.util.InfoPrinter;
import org.junit.Assert;
import org.junit.Test;


public class TestCodecs
{
   private static final String[] NAMES = { "LZ10", "LZ11", "LZSS", "MIO0", "YAY0", "YAZ0", "RLE30" };


   public static void main(String[] args)
   {
      CodecFactory factory = new CodecFactory();
      byte[] buf = TestMatchFinder.generate(new Random(), 1024 * 1024, 12);

      for (String name : NAMES)
      {
         AbstractCodec codec = factory.newCodec(new HashMap<String, Object>(), name);
         codec.addListener(new InfoPrinter(1, InfoPrinter.Type.ENCODING, System.out));
         System.out.print(name + ": ");

         try
         {
            codec.compress(buf, new ByteArrayOutputStream(), CompressionLevel.OPTIMAL);
         }
         catch (IOException e)
         {
            System.out.println(e.getMessage());
         }
      }
   }


   private static List<byte[]> inputs()
   {
      Random rnd = new Random(4321);
      List<byte[]> res = new ArrayList<>();
      res.add(new byte[0]);
      res.add(new byte[] { 42 });
      res.add(bytes("ABCABCABC"));
      byte[] run = new byte[70000];
      Arrays.fill(run, (byte) 'A');
      res.add(run);
      StringBuilder sb = new StringBuilder();

      while (sb.length() < 10000)
         sb.append("The quick brown fox jumps over the lazy dog ").append(sb.length() % 7).append(". ");

      res.add(bytes(sb.toString()));
      res.add(TestMatchFinder.generate(rnd, 50000, 5));
      byte[] noise = new byte[5000];
      rnd.nextBytes(noise);
      res.add(noise);
      return res;
   }


   @Test
   public void testRoundTrip() throws IOException
   {
      CodecFactory factory = new CodecFactory();
      List<byte[]> inputs = inputs();

      for (String name : NAMES)
      {
         for (CompressionLevel level : CompressionLevel.values())
         {
            for (byte[] input : inputs)
            {
               CompressionCodec codec = factory.newCodec(new HashMap<String, Object>(), name);
               byte[] output = roundTrip(codec, input, level);
               Assert.assertArrayEquals(name + " " + level + " " + input.length + " bytes", input, output);
            }
         }
      }
   }


   @Test
   public void testRoundTripWithoutLookAhead() throws IOException
   {
      CodecFactory factory = new CodecFactory();
      Map<String, Object> ctx = new HashMap<>();
      ctx.put("lookAhead", false);
      byte[] input = TestMatchFinder.generate(new Random(8), 30000, 4);

      for (String name : NAMES)
         Assert.assertArrayEquals(name, input, roundTrip(factory.newCodec(ctx, name), input, CompressionLevel.OPTIMAL));
   }


   @Test
   public void testParallelLZ11() throws IOException
   {
      byte[] input = TestMatchFinder.generate(new Random(77), 300000, 6);
      byte[] reference = null;

      for (int jobs : new int[] { 1, 4 })
      {
         Map<String, Object> ctx = new HashMap<>();
         ctx.put("jobs", jobs);
         ctx.put("blockSize", 0x400);
         CompressionCodec codec = new CodecFactory().newCodec(ctx, "LZ11");
         ByteArrayOutputStream baos = new ByteArrayOutputStream();
         codec.compress(input, baos, CompressionLevel.SMALLEST_SIZE);
         byte[] compressed = baos.toByteArray();
         ByteArrayOutputStream decompressed = new ByteArrayOutputStream();
         codec.decompress(new ByteArrayInputStream(compressed), decompressed);
         Assert.assertArrayEquals(input, decompressed.toByteArray());

         if (reference == null)
            reference = compressed;
         else
            Assert.assertArrayEquals(reference, compressed);
      }
   }


   @Test
   public void testCustomLZSSConstraints() throws IOException
   {
      LZSSCodec codec = new LZSSCodec(MatchConstraints.fromBits(10, 6, 2), new HashMap<String, Object>());
      Assert.assertEquals(66, codec.getConstraints().getMaxLength());
      byte[] input = TestMatchFinder.generate(new Random(3), 20000, 4);
      Assert.assertArrayEquals(input, roundTrip(codec, input, CompressionLevel.OPTIMAL));
   }


   @Test(expected = IllegalArgumentException.class)
   public void testInvalidLZSSConstraints()
   {
      new LZSSCodec(MatchConstraints.fromBits(12, 5, 2), new HashMap<String, Object>());
   }


   @Test
   public void testLZ10Layout() throws IOException
   {
      ByteArrayOutputStream baos = new ByteArrayOutputStream();
      new LZ10Codec().compress(bytes("ABCABCABC"), baos, CompressionLevel.OPTIMAL);
      byte[] expected = new byte[] { 0x10, 9, 0, 0, 0x10, 'A', 'B', 'C', 0x30, 0x02 };
      Assert.assertArrayEquals(expected, baos.toByteArray());
   }


   @Test
   public void testRLE30Layout() throws IOException
   {
      ByteArrayOutputStream baos = new ByteArrayOutputStream();
      new RLE30Codec().compress(bytes("AAAAA"), baos, CompressionLevel.OPTIMAL);
      Assert.assertArrayEquals(new byte[] { 0x30, 5, 0, 0, (byte) 0x82, 'A' }, baos.toByteArray());

      baos.reset();
      new RLE30Codec().compress(bytes("AAAAA"), baos, CompressionLevel.NONE);
      Assert.assertArrayEquals(new byte[] { 0x30, 5, 0, 0, 4, 'A', 'A', 'A', 'A', 'A' }, baos.toByteArray());
   }


   @Test
   public void testTruncatedInput() throws IOException
   {
      CodecFactory factory = new CodecFactory();
      byte[] input = inputs().get(4);

      for (String name : NAMES)
      {
         CompressionCodec codec = factory.newCodec(new HashMap<String, Object>(), name);
         ByteArrayOutputStream baos = new ByteArrayOutputStream();
         codec.compress(input, baos, CompressionLevel.OPTIMAL);
         byte[] compressed = baos.toByteArray();
         byte[] truncated = Arrays.copyOf(compressed, compressed.length - 2);

         try
         {
            codec.decompress(new ByteArrayInputStream(truncated), new ByteArrayOutputStream());
            Assert.fail(name + ": truncated data should not decompress");
         }
         catch (BitStreamException e)
         {
            Assert.assertEquals(name, BitStreamException.END_OF_STREAM, e.getErrorCode());
         }
      }
   }


   @Test
   public void testOversizedSectionOffsets() throws IOException
   {
      CodecFactory factory = new CodecFactory();

      for (String name : new String[] { "MIO0", "Yay0" })
      {
         // Sections declared near 2 GB, followed by a few bytes only
         byte[] header = new byte[24];
         System.arraycopy(name.getBytes(StandardCharsets.US_ASCII), 0, header, 0, 4);
         header[7] = 1;
         header[8] = 0x7F; header[9] = (byte) 0xFF; header[10] = (byte) 0xFF; header[11] = (byte) 0xF0;
         header[12] = 0x7F; header[13] = (byte) 0xFF; header[14] = (byte) 0xFF; header[15] = (byte) 0xF0;
         CompressionCodec codec = factory.newCodec(new HashMap<String, Object>(), name);

         try
         {
            codec.decompress(new ByteArrayInputStream(header), new ByteArrayOutputStream());
            Assert.fail(name + ": bogus section offsets should not decompress");
         }
         catch (BitStreamException e)
         {
            Assert.assertEquals(name, BitStreamException.END_OF_STREAM, e.getErrorCode());
         }
      }
   }


   @Test
   public void testInvalidIdentifier() throws IOException
   {
      CodecFactory factory = new CodecFactory();

      for (String name : NAMES)
      {
         CompressionCodec codec = factory.newCodec(new HashMap<String, Object>(), name);
         ByteArrayOutputStream baos = new ByteArrayOutputStream();
         codec.compress(bytes("ABCABCABC"), baos, CompressionLevel.OPTIMAL);
         byte[] compressed = baos.toByteArray();
         compressed[0] ^= 0x01;

         try
         {
            codec.decompress(new ByteArrayInputStream(compressed), new ByteArrayOutputStream());
            Assert.fail(name + ": a wrong identifier should be rejected");
         }
         catch (FormatException e)
         {
            Assert.assertEquals(Error.ERR_INVALID_FILE, e.getErrorCode());
         }
      }
   }


   @Test
   public void testSizeMismatch() throws IOException
   {
      ByteArrayOutputStream baos = new ByteArrayOutputStream();
      new LZ10Codec().compress(bytes("AAAAAAAAAA"), baos, CompressionLevel.OPTIMAL);
      byte[] compressed = baos.toByteArray();

      // One literal and one match of 9 bytes
      Assert.assertEquals(0x40, compressed[4]);
      compressed[1] = 5;

      try
      {
         new LZ10Codec().decompress(new ByteArrayInputStream(compressed), new ByteArrayOutputStream());
         Assert.fail("A size mismatch should be reported");
      }
      catch (DecompressedSizeException e)
      {
         Assert.assertEquals(5, e.getExpected());
         Assert.assertEquals(10, e.getActual());
         Assert.assertEquals(BitStreamException.SIZE_MISMATCH, e.getErrorCode());
      }
   }


   @Test
   public void testYaz0Alignment() throws IOException
   {
      Map<String, Object> ctx = new HashMap<>();
      ctx.put("alignment", 0x80);
      ByteArrayOutputStream baos = new ByteArrayOutputStream();
      new Yaz0Codec(ctx).compress(bytes("ABCABCABC"), baos, CompressionLevel.OPTIMAL);
      Yaz0Codec decoder = new Yaz0Codec();
      ByteArrayOutputStream decompressed = new ByteArrayOutputStream();
      decoder.decompress(new ByteArrayInputStream(baos.toByteArray()), decompressed);
      Assert.assertEquals(0x80, decoder.getAlignment());
      Assert.assertEquals("ABCABCABC", new String(decompressed.toByteArray(), StandardCharsets.US_ASCII));
   }


   @Test
   public void testFactory()
   {
      CodecFactory factory = new CodecFactory();

      for (String name : NAMES)
      {
         int type = factory.getType(name.toLowerCase());
         Assert.assertEquals(name, factory.getName(type));
         Assert.assertEquals(name, factory.newCodec(new HashMap<String, Object>(), type).getName());
      }

      try
      {
         factory.getType("LZ77");
         Assert.fail("Unknown codec name should be rejected");
      }
      catch (IllegalArgumentException e)
      {
         // expected
      }
   }


   @Test
   public void testInfoPrinter() throws IOException
   {
      ByteArrayOutputStream log = new ByteArrayOutputStream();
      PrintStream ps = new PrintStream(log, true, "UTF-8");
      Map<String, Object> ctx = new HashMap<>();
      ctx.put("jobs", 2);
      ctx.put("blockSize", 0x400);
      AbstractCodec codec = new CodecFactory().newCodec(ctx, "LZ11");
      codec.addListener(new InfoPrinter(4, InfoPrinter.Type.ENCODING, ps));
      codec.compress(TestMatchFinder.generate(new Random(1), 0x1000, 4), new ByteArrayOutputStream(),
         CompressionLevel.OPTIMAL);
      String text = new String(log.toByteArray(), "UTF-8");
      Assert.assertTrue(text, text.contains("Compressed 4096 => "));
      Assert.assertTrue(text, text.contains("Match search: "));
      Assert.assertTrue(text, text.contains("Block 3: "));
   }


   private static byte[] roundTrip(CompressionCodec codec, byte[] input, CompressionLevel level) throws IOException
   {
      ByteArrayOutputStream baos = new ByteArrayOutputStream();
      codec.compress(input, baos, level);
      ByteArrayOutputStream decompressed = new ByteArrayOutputStream();
      codec.decompress(new ByteArrayInputStream(baos.toByteArray()), decompressed);
      return decompressed.toByteArray();
   }


   private static byte[] bytes(String s)
   {
      return s.getBytes(StandardCharsets.US_ASCII);
   }
}
