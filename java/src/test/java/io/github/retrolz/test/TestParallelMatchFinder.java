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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import io.github.retrolz.Event;
import io.github.retrolz.Listener;
import io.github.retrolz.match.CompressionLevel;
import io.github.retrolz.match.Match;
import io.github.retrolz.match.MatchConstraints;
import io.github.retrolz.match.ParallelMatchFinder;
import org.junit.Assert;
import org.junit.Test;


public class TestParallelMatchFinder
{
   private static final MatchConstraints LZ11 = new MatchConstraints(0x1000, 3, 0x4000);
   private static final MatchConstraints LZ10 = new MatchConstraints(0x1000, 3, 18);


   public static void main(String[] args)
   {
      byte[] buf = TestMatchFinder.generate(new Random(), 8 * 1024 * 1024, 8);

      for (int jobs=1; jobs<=8; jobs*=2)
      {
         Map<String, Object> ctx = new HashMap<>();
         ctx.put("jobs", jobs);
         ParallelMatchFinder finder = new ParallelMatchFinder(LZ10, true, CompressionLevel.OPTIMAL, ctx);
         long before = System.nanoTime();
         List<Match> matches = finder.findMatches(buf);
         long after = System.nanoTime();
         System.out.println("Jobs=" + jobs + ": " + matches.size() + " matches [" + (after - before) / 1000000L + " ms]");
      }
   }


   @Test
   public void testDeterminism()
   {
      byte[] buf = TestMatchFinder.generate(new Random(12345), 200000, 6);
      List<Match> reference = null;

      for (int jobs : new int[] { 1, 2, 8 })
      {
         Map<String, Object> ctx = new HashMap<>();
         ctx.put("jobs", jobs);
         ctx.put("blockSize", 0x400);
         List<Match> matches = new ParallelMatchFinder(LZ10, true, CompressionLevel.OPTIMAL, ctx).findMatches(buf);
         TestMatchFinder.checkMatches(buf, matches, LZ10);
         Assert.assertArrayEquals(buf, TestMatchFinder.replay(buf, matches, LZ10));

         if (reference == null)
            reference = matches;
         else
            Assert.assertEquals("Different matches with " + jobs + " jobs", reference, matches);
      }
   }


   @Test
   public void testExternalPool() throws Exception
   {
      byte[] buf = TestMatchFinder.generate(new Random(777), 100000, 5);
      ExecutorService pool = Executors.newFixedThreadPool(4);

      try
      {
         Map<String, Object> ctx = new HashMap<>();
         ctx.put("jobs", 4);
         ctx.put("pool", pool);
         ctx.put("blockSize", 0x1000);
         List<Match> matches = new ParallelMatchFinder(LZ11, true, CompressionLevel.SMALLEST_SIZE, ctx).findMatches(buf);

         ctx.put("jobs", 1);
         ctx.remove("pool");
         List<Match> expected = new ParallelMatchFinder(LZ11, true, CompressionLevel.SMALLEST_SIZE, ctx).findMatches(buf);
         Assert.assertEquals(expected, matches);
         Assert.assertFalse(pool.isShutdown());
      }
      finally
      {
         pool.shutdown();
      }
   }


   @Test
   public void testBlockBoundaryMerge()
   {
      byte[] buf = new byte[0x800];
      Arrays.fill(buf, (byte) 'A');
      Map<String, Object> ctx = new HashMap<>();
      ctx.put("jobs", 2);
      ctx.put("blockSize", 0x400);
      List<Match> matches = new ParallelMatchFinder(LZ11, true, CompressionLevel.OPTIMAL, ctx).findMatches(buf);
      Assert.assertEquals(Arrays.asList(new Match(1, 1, 0x7FF)), matches);

      // The combined length would be too long
      matches = new ParallelMatchFinder(LZ10, true, CompressionLevel.OPTIMAL, ctx).findMatches(buf);
      TestMatchFinder.checkMatches(buf, matches, LZ10);
      Assert.assertArrayEquals(buf, TestMatchFinder.replay(buf, matches, LZ10));
   }


   @Test
   public void testEvents()
   {
      byte[] buf = TestMatchFinder.generate(new Random(31), 10 * 0x400 + 17, 4);
      final List<Event> events = Collections.synchronizedList(new ArrayList<Event>());
      Map<String, Object> ctx = new HashMap<>();
      ctx.put("jobs", 3);
      ctx.put("blockSize", 0x400);
      ParallelMatchFinder finder = new ParallelMatchFinder(LZ10, true, CompressionLevel.OPTIMAL, ctx);
      Listener listener = new Listener()
      {
         @Override
         public void processEvent(Event evt)
         {
            events.add(evt);
         }
      };

      Assert.assertTrue(finder.addListener(listener));

      // A failing listener does not break the search
      finder.addListener(new Listener()
      {
         @Override
         public void processEvent(Event evt)
         {
            throw new IllegalStateException("listener failure");
         }
      });

      List<Match> matches = finder.findMatches(buf);
      Assert.assertEquals(13, events.size());
      Assert.assertEquals(Event.Type.MATCH_SEARCH_START, events.get(0).getType());
      Assert.assertEquals(buf.length, events.get(0).getSize());
      Assert.assertEquals(Event.Type.MATCH_SEARCH_END, events.get(12).getType());
      Assert.assertEquals(matches.size(), events.get(12).getSize());
      boolean[] seen = new boolean[11];

      for (Event evt : events.subList(1, 12))
      {
         Assert.assertEquals(Event.Type.BLOCK_INFO, evt.getType());
         seen[evt.getId()] = true;
      }

      for (boolean b : seen)
         Assert.assertTrue(b);

      Assert.assertTrue(finder.removeListener(listener));
      events.clear();
      finder.findMatches(buf);
      Assert.assertTrue(events.isEmpty());
   }


   @Test
   public void testLevelNoneAndEmptyInput()
   {
      byte[] buf = TestMatchFinder.generate(new Random(5), 5000, 3);
      Assert.assertTrue(ParallelMatchFinder.findMatchesParallel(buf, LZ10, true, CompressionLevel.NONE).isEmpty());
      Assert.assertTrue(ParallelMatchFinder.findMatchesParallel(new byte[0], LZ10, true, CompressionLevel.OPTIMAL).isEmpty());
   }


   @Test
   public void testContextSettings()
   {
      ParallelMatchFinder finder = new ParallelMatchFinder(LZ10, true, CompressionLevel.OPTIMAL);
      int cores = Runtime.getRuntime().availableProcessors();
      Assert.assertEquals(Math.min(cores, ParallelMatchFinder.MAX_CONCURRENCY), finder.getJobs());
      Assert.assertEquals(ParallelMatchFinder.DEFAULT_BLOCK_SIZE, finder.getBlockSize());

      Map<String, Object> ctx = new HashMap<>();
      ctx.put("jobs", 3);
      ctx.put("blockSize", ParallelMatchFinder.MIN_BLOCK_SIZE);
      finder = new ParallelMatchFinder(LZ10, true, CompressionLevel.OPTIMAL, ctx);
      Assert.assertEquals(3, finder.getJobs());
      Assert.assertEquals(ParallelMatchFinder.MIN_BLOCK_SIZE, finder.getBlockSize());
   }


   @Test
   public void testInvalidContext()
   {
      Map<String, Object> ctx = new HashMap<>();
      ctx.put("jobs", 0);

      try
      {
         new ParallelMatchFinder(LZ10, true, CompressionLevel.OPTIMAL, ctx);
         Assert.fail("0 jobs should be rejected");
      }
      catch (IllegalArgumentException e)
      {
         // expected
      }

      ctx.put("jobs", 2);
      ctx.put("blockSize", 0x100);

      try
      {
         new ParallelMatchFinder(LZ10, true, CompressionLevel.OPTIMAL, ctx);
         Assert.fail("A block size below the minimum should be rejected");
      }
      catch (IllegalArgumentException e)
      {
         // expected
      }
   }
}
