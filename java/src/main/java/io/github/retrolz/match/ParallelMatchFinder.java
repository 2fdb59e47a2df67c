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

package io.github.retrolz.match;

import io.github.retrolz.Event;
import io.github.retrolz.Global;
import io.github.retrolz.Listener;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;


/**
 * Match search over a whole buffer split into fixed size blocks searched
 * concurrently. Each block is searched by its own {@link LZMatchFinder}
 * seeded with the window that precedes the block, matches never cross the
 * end of a block. The block size does not depend on the number of jobs, so
 * the result is identical for any number of jobs.
 * <p>
 * Matches of adjacent blocks are merged when the last match of a block and
 * the first match of the next one share the same distance and their combined
 * length is still valid.
 * </p>
 * <p>
 * Supported context keys: "jobs" (Integer, number of concurrent tasks),
 * "pool" (ExecutorService used to run the tasks, a private pool is created
 * when missing), "blockSize" (Integer, size of a searched block).
 * </p>
 */
public class ParallelMatchFinder
{
   public static final int DEFAULT_BLOCK_SIZE = 0x8000;
   public static final int MIN_BLOCK_SIZE = 0x400;
   public static final int MAX_CONCURRENCY = 64;

   private final MatchConstraints constraints;
   private final boolean lookAhead;
   private final CompressionLevel level;
   private final int jobs;
   private final int blockSize;
   private final ExecutorService pool;
   private final Queue<Listener> listeners;


   public ParallelMatchFinder(MatchConstraints constraints, boolean lookAhead, CompressionLevel level)
   {
      this(constraints, lookAhead, level, new HashMap<String, Object>());
   }


   public ParallelMatchFinder(MatchConstraints constraints, boolean lookAhead, CompressionLevel level,
      Map<String, Object> ctx)
   {
      if (constraints == null)
         throw new NullPointerException("Invalid null constraints parameter");

      if (level == null)
         throw new NullPointerException("Invalid null compression level parameter");

      if (ctx == null)
         throw new NullPointerException("Invalid null context parameter");

      final int defaultJobs = Math.min(Runtime.getRuntime().availableProcessors(), MAX_CONCURRENCY);
      final int tasks = (Integer) ctx.getOrDefault("jobs", defaultJobs);

      if ((tasks <= 0) || (tasks > MAX_CONCURRENCY))
         throw new IllegalArgumentException("The number of jobs must be in [1.." + MAX_CONCURRENCY + "]");

      final int bSize = (Integer) ctx.getOrDefault("blockSize", DEFAULT_BLOCK_SIZE);

      if (bSize < MIN_BLOCK_SIZE)
         throw new IllegalArgumentException("The block size must be at least " + MIN_BLOCK_SIZE);

      this.constraints = constraints.withLevel(level);
      this.lookAhead = lookAhead;
      this.level = level;
      this.jobs = tasks;
      this.blockSize = bSize;
      this.pool = (ExecutorService) ctx.get("pool");
      this.listeners = new ConcurrentLinkedQueue<>();
   }


   /**
    * Finds all matches of a buffer using the default context.
    *
    * @param src the input buffer
    * @param constraints the constraints of the target format
    * @param lookAhead enables the one step look-ahead
    * @param level the compression level
    * @return the matches ordered by offset
    */
   public static List<Match> findMatchesParallel(byte[] src, MatchConstraints constraints,
      boolean lookAhead, CompressionLevel level)
   {
      return new ParallelMatchFinder(constraints, lookAhead, level).findMatches(src);
   }


   public boolean addListener(Listener bl)
   {
      return (bl != null) ? this.listeners.add(bl) : false;
   }


   public boolean removeListener(Listener bl)
   {
      return (bl != null) ? this.listeners.remove(bl) : false;
   }


   /**
    * Finds all matches of a buffer.
    *
    * @param src the input buffer
    * @return the matches ordered by offset, never overlapping
    */
   public List<Match> findMatches(byte[] src)
   {
      if (src == null)
         throw new NullPointerException("Invalid null source buffer");

      // Protect against future concurrent modification of the list of listeners
      final Listener[] blockListeners = this.listeners.toArray(new Listener[0]);
      notifyListeners(blockListeners, new Event(Event.Type.MATCH_SEARCH_START, -1, src.length));

      if ((this.level == CompressionLevel.NONE) || (src.length == 0))
      {
         notifyListeners(blockListeners, new Event(Event.Type.MATCH_SEARCH_END, -1, 0));
         return new ArrayList<>();
      }

      final int nbBlocks = (int) (((long) src.length + this.blockSize - 1) / this.blockSize);
      final int nbTasks = Math.min(nbBlocks, this.jobs);
      final int[] blocksPerTask = Global.computeJobsPerTask(new int[nbTasks], nbBlocks, nbTasks);
      final List<Callable<List<List<Match>>>> tasks = new ArrayList<>(nbTasks);
      int firstBlock = 0;

      for (int taskId=0; taskId<nbTasks; taskId++)
      {
         tasks.add(new SearchTask(src, firstBlock, blocksPerTask[taskId], this.blockSize,
            this.constraints, this.lookAhead, this.level, blockListeners));
         firstBlock += blocksPerTask[taskId];
      }

      final List<List<Match>> blocks = new ArrayList<>(nbBlocks);

      try
      {
         if (tasks.size() == 1)
         {
            // Synchronous call
            blocks.addAll(tasks.get(0).call());
         }
         else
         {
            final ExecutorService executor = (this.pool != null) ? this.pool : Executors.newFixedThreadPool(nbTasks);

            try
            {
               // Results are collected in task order
               for (Future<List<List<Match>>> result : executor.invokeAll(tasks))
                  blocks.addAll(result.get());
            }
            finally
            {
               if (executor != this.pool)
                  executor.shutdown();
            }
         }
      }
      catch (InterruptedException e)
      {
         Thread.currentThread().interrupt();
         throw new IllegalStateException("Match search interrupted", e);
      }
      catch (ExecutionException e)
      {
         final Throwable cause = e.getCause();

         if (cause instanceof RuntimeException)
            throw (RuntimeException) cause;

         if (cause instanceof java.lang.Error)
            throw (java.lang.Error) cause;

         throw new IllegalStateException("Match search failed", cause);
      }
      catch (RuntimeException e)
      {
         throw e;
      }
      catch (Exception e)
      {
         throw new IllegalStateException("Match search failed", e);
      }

      final List<Match> matches = this.merge(blocks);
      notifyListeners(blockListeners, new Event(Event.Type.MATCH_SEARCH_END, -1, matches.size()));
      return matches;
   }


   private List<Match> merge(List<List<Match>> blocks)
   {
      final List<Match> res = new ArrayList<>();
      final int maxLength = this.constraints.getMaxLength();

      for (List<Match> block : blocks)
      {
         if (block.isEmpty() == true)
            continue;

         int start = 0;

         if (res.isEmpty() == false)
         {
            final Match last = res.get(res.size()-1);
            final Match first = block.get(0);

            if ((last.end() == first.getOffset()) && (last.getDistance() == first.getDistance())
               && (last.getLength() + first.getLength() <= maxLength))
            {
               res.set(res.size()-1, new Match(last.getOffset(), last.getDistance(),
                  last.getLength() + first.getLength()));
               start = 1;
            }
         }

         res.addAll(block.subList(start, block.size()));
      }

      return res;
   }


   public int getJobs()
   {
      return this.jobs;
   }


   public int getBlockSize()
   {
      return this.blockSize;
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


   // Searches a run of consecutive blocks
   static class SearchTask implements Callable<List<List<Match>>>
   {
      private final byte[] src;
      private final int firstBlock;
      private final int nbBlocks;
      private final int blockSize;
      private final MatchConstraints constraints;
      private final boolean lookAhead;
      private final CompressionLevel level;
      private final Listener[] listeners;


      SearchTask(byte[] src, int firstBlock, int nbBlocks, int blockSize, MatchConstraints constraints,
         boolean lookAhead, CompressionLevel level, Listener[] listeners)
      {
         this.src = src;
         this.firstBlock = firstBlock;
         this.nbBlocks = nbBlocks;
         this.blockSize = blockSize;
         this.constraints = constraints;
         this.lookAhead = lookAhead;
         this.level = level;
         this.listeners = listeners;
      }


      @Override
      public List<List<Match>> call()
      {
         final LZMatchFinder finder = new LZMatchFinder(this.constraints, this.lookAhead, this.level);
         final List<List<Match>> res = new ArrayList<>(this.nbBlocks);
         final int window = this.constraints.getWindowSize();

         for (int i=0; i<this.nbBlocks; i++)
         {
            final int blockId = this.firstBlock + i;
            final int start = (int) ((long) blockId * this.blockSize);
            final int end = (int) Math.min((long) start + this.blockSize, this.src.length);

            // Seed the dictionary with the window preceding the block
            final int ctxStart = Math.max(0, start - window);
            finder.reset(ctxStart);
            finder.addEntryRange(this.src, ctxStart, start - ctxStart);

            final List<Match> matches = new ArrayList<>();
            finder.findMatches(this.src, start, end, matches);
            res.add(Collections.unmodifiableList(matches));

            if (this.listeners.length > 0)
               notifyListeners(this.listeners, new Event(Event.Type.BLOCK_INFO, blockId, matches.size()));
         }

         return res;
      }
   }
}
