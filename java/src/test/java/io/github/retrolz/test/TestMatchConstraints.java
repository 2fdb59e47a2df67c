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

import io.github.retrolz.match.CompressionLevel;
import io.github.retrolz.match.Match;
import io.github.retrolz.match.MatchConstraints;
import org.junit.Assert;
import org.junit.Test;


public class TestMatchConstraints
{
   @Test
   public void testFromBits()
   {
      MatchConstraints c = MatchConstraints.fromBits(12, 4, 2);
      Assert.assertEquals(0x1000, c.getWindowSize());
      Assert.assertEquals(3, c.getMinLength());
      Assert.assertEquals(18, c.getMaxLength());
      Assert.assertEquals(0xFEE, c.getWindowStart());
      Assert.assertEquals(12, c.getDistanceBits());
      Assert.assertEquals(4, c.getLengthBits());
      Assert.assertEquals(0xFFF, c.getWindowMask());
      Assert.assertEquals(0xF, c.getLengthMask());
   }


   @Test
   public void testDerivedBits()
   {
      MatchConstraints c = new MatchConstraints(0x1000, 3, 0x111);
      Assert.assertEquals(12, c.getDistanceBits());
      Assert.assertEquals(9, c.getLengthBits());
      Assert.assertEquals(0, c.getWindowStart());

      c = new MatchConstraints(1000, 18);
      Assert.assertEquals(10, c.getDistanceBits());
      Assert.assertEquals(3, c.getMinLength());
      Assert.assertEquals(4, c.getLengthBits());

      // 17 distinct lengths do not fit on 4 bits
      c = new MatchConstraints(0x1000, 3, 19);
      Assert.assertEquals(5, c.getLengthBits());
      Assert.assertEquals(0x1F, c.getLengthMask());
   }


   @Test
   public void testWithLevel()
   {
      MatchConstraints c = new MatchConstraints(0x10000, 3, 0x111);
      Assert.assertEquals(0x4000, c.withLevel(CompressionLevel.FASTEST).getWindowSize());
      Assert.assertSame(c, c.withLevel(CompressionLevel.OPTIMAL));
      Assert.assertSame(c, c.withLevel(CompressionLevel.SMALLEST_SIZE));
      Assert.assertEquals(0x111, c.withLevel(CompressionLevel.FASTEST).getMaxLength());
   }


   @Test
   public void testAccepts()
   {
      MatchConstraints c = new MatchConstraints(0x1000, 3, 18);
      Assert.assertTrue(c.accepts(new Match(10, 1, 3)));
      Assert.assertTrue(c.accepts(new Match(0x2000, 0x1000, 18)));
      Assert.assertFalse(c.accepts(new Match(10, 1, 2)));
      Assert.assertFalse(c.accepts(new Match(10, 1, 19)));
      Assert.assertFalse(c.accepts(new Match(0x2000, 0x1001, 3)));
      Assert.assertFalse(c.accepts(Match.NONE));
   }


   @Test
   public void testValidation()
   {
      checkInvalid(0, 3, 18, 0);
      checkInvalid(0x1000, 0, 18, 0);
      checkInvalid(0x1000, 19, 18, 0);
      checkInvalid(0x1000, 3, 18, -1);
   }


   private static void checkInvalid(int window, int min, int max, int start)
   {
      try
      {
         new MatchConstraints(window, min, max, start);
         Assert.fail("Constraints should be rejected: " + window + ", " + min + ", " + max + ", " + start);
      }
      catch (IllegalArgumentException e)
      {
         // expected
      }
   }
}
