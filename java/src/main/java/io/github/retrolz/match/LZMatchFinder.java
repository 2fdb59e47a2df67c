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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;


/**
 * Hash chain match finder. Every indexed position is linked to the previous
 * position sharing the same first bytes, chains are walked from the most
 * recent position backwards, so the first longest match found is also the
 * closest one.
 * <p>
 * The finder is bound to one input buffer at a time: positions are indexed in
 * ascending order and a search at position {@code p} sees every position
 * below {@code p}. Positions skipped by the caller are indexed on the next
 * call, {@link #addEntry(byte[], int)} and {@link #addEntryRange(byte[], int, int)}
 * index positions explicitly without searching.
 * </p>
 * <p>
 * Instances are not thread safe, each worker owns its own finder.
 * </p>
 */
public final class LZMatchFinder
{
   private static final int HASH_SEED = 0x1E35A7BD;
   private static final int HASH_LOG = 16;
   private static final int HASH_RSHIFT = 32 - HASH_LOG;
   private static final int MAX_CHAIN_SIZE = (1 << 24) + 1;

   private final MatchConstraints constraints;
   private final CompressionLevel level;
   private final boolean lookAhead;
   private final int keyLength;
   private final int maxCandidates;
   private final int[] heads;
   private final int[] chain;
   private int indexed; // positions below are in the dictionary


   /**
    * Creates a match finder.
    *
    * @param constraints the constraints of the target format
    * @param lookAhead enables the one step look-ahead (ignored if the level does not allow it)
    * @param level the compression level
    */
   public LZMatchFinder(MatchConstraints constraints, boolean lookAhead, CompressionLevel level)
   {
      if (constraints == null)
         throw new NullPointerException("Invalid null constraints parameter");

      if (level == null)
         throw new NullPointerException("Invalid null compression level parameter");

      this.constraints = constraints.withLevel(level);
      this.level = level;
      this.lookAhead = lookAhead && level.isLookAheadAllowed();
      this.maxCandidates = level.getMaxCandidates();
      this.keyLength = Math.min(this.constraints.getMinLength(), 3);
      this.heads = new int[(this.keyLength == 1) ? 256 : ((this.keyLength == 2) ? 65536 : 1 << HASH_LOG)];
      this.chain = new int[(int) Math.min((long) this.constraints.getWindowSize() + 1, MAX_CHAIN_SIZE)];
      Arrays.fill(this.heads, -1);
   }


   /**
    * Finds all matches of a buffer with a greedy parse.
    *
    * @param src the input buffer
    * @param constraints the constraints of the target format
    * @param lookAhead enables the one step look-ahead
    * @param level the compression level
    * @return the matches ordered by offset
    */
   public static List<Match> findMatches(byte[] src, MatchConstraints constraints, boolean lookAhead,
      CompressionLevel level)
   {
      final List<Match> matches = new ArrayList<>();

      if (level == CompressionLevel.NONE)
         return matches;

      new LZMatchFinder(constraints, lookAhead, level).findMatches(src, 0, src.length, matches);
      return matches;
   }


   /**
    * Greedy parse of {@code src[start..end[}: matches found are appended to
    * {@code matches}, no match extends past {@code end}.
    *
    * @param src the input buffer
    * @param start first position to search
    * @param end end of the searched range
    * @param matches receives the matches
    * @return the number of matches appended
    */
   public int findMatches(byte[] src, int start, int end, List<Match> matches)
   {
      if ((start < 0) || (end > src.length) || (start > end))
         throw new IllegalArgumentException("Invalid range: [" + start + ".." + end + "[");

      int pos = start;
      int count = 0;

      while (pos < end)
      {
         final Match m = this.tryFindMatch(src, pos, end);

         if (m.isNone() == true)
         {
            pos++;
            continue;
         }

         matches.add(m);
         pos += m.getLength();
         count++;
      }

      return count;
   }


   public Match tryFindMatch(byte[] src, int position)
   {
      return this.tryFindMatch(src, position, src.length);
   }


   /**
    * Returns the best match at {@code position}: the longest one, the closest
    * one among matches of equal length. With look-ahead, {@link Match#NONE} is
    * returned when a strictly longer match starts at the next position.
    *
    * @param src the input buffer
    * @param position the position to search
    * @param limit no match extends past this position
    * @return the match found or {@link Match#NONE}
    */
   public Match tryFindMatch(byte[] src, int position, int limit)
   {
      if (position < 0)
         throw new IllegalArgumentException("Invalid position: " + position);

      limit = Math.min(limit, src.length);

      if ((this.level == CompressionLevel.NONE) || (position >= limit))
         return Match.NONE;

      this.catchUp(src, position);
      final Match m = this.search(src, position, limit);

      if (this.indexed == position)
      {
         this.insert(src, position);
         this.indexed = position + 1;
      }

      if (m.isNone() == true)
         return Match.NONE;

      if ((this.lookAhead == true) && (m.getLength() < this.constraints.getMaxLength())
         && (position + 1 + m.getLength() < limit))
      {
         final Match next = this.search(src, position + 1, limit);

         if (next.getLength() > m.getLength())
            return Match.NONE;
      }

      return m;
   }


   /**
    * Indexes a position without searching.
    *
    * @param src the input buffer
    * @param position the position to index
    */
   public void addEntry(byte[] src, int position)
   {
      this.catchUp(src, position + 1);
   }


   /**
    * Indexes {@code length} positions starting at {@code position} without
    * searching. Positions already indexed are ignored.
    *
    * @param src the input buffer
    * @param position the first position to index
    * @param length the number of positions
    */
   public void addEntryRange(byte[] src, int position, int length)
   {
      this.catchUp(src, position + length);
   }


   /**
    * Empties the dictionary. The next indexed position is {@code position}.
    *
    * @param position the dictionary cursor
    */
   public void reset(int position)
   {
      if (position < 0)
         throw new IllegalArgumentException("Invalid position: " + position);

      Arrays.fill(this.heads, -1);
      this.indexed = position;
   }


   public MatchConstraints getConstraints()
   {
      return this.constraints;
   }


   private void catchUp(byte[] src, int end)
   {
      for (int p=this.indexed; p<end; p++)
         this.insert(src, p);

      if (end > this.indexed)
         this.indexed = end;
   }


   private void insert(byte[] src, int pos)
   {
      if (pos + this.keyLength > src.length)
         return;

      final int h = this.hash(src, pos);
      this.chain[pos % this.chain.length] = this.heads[h];
      this.heads[h] = pos;
   }


   private Match search(byte[] src, int pos, int limit)
   {
      final int maxLen = Math.min(this.constraints.getMaxLength(), limit - pos);

      if ((maxLen < this.constraints.getMinLength()) || (pos + this.keyLength > src.length))
         return Match.NONE;

      final int minPos = pos - Math.min(this.constraints.getWindowSize(), this.chain.length - 1);
      int candidate = this.heads[this.hash(src, pos)];
      int previous = Integer.MAX_VALUE;
      int attempts = this.maxCandidates;
      int bestLength = 0;
      int bestDistance = 0;

      while ((candidate >= minPos) && (candidate >= 0) && (candidate < previous) && (attempts > 0))
      {
         // Positions indexed past the searched one are not candidates
         if (candidate >= pos)
         {
            previous = candidate;
            candidate = this.chain[candidate % this.chain.length];
            continue;
         }

         attempts--;

         // Reject quickly candidates that cannot beat the best match
         if (src[candidate+bestLength] == src[pos+bestLength])
         {
            int len = 0;

            while ((len < maxLen) && (src[candidate+len] == src[pos+len]))
               len++;

            if (len > bestLength)
            {
               bestLength = len;
               bestDistance = pos - candidate;

               if (len == maxLen)
                  break;
            }
         }

         previous = candidate;
         candidate = this.chain[candidate % this.chain.length];
      }

      if (bestLength < this.constraints.getMinLength())
         return Match.NONE;

      return new Match(pos, bestDistance, bestLength);
   }


   private int hash(byte[] src, int pos)
   {
      if (this.keyLength == 1)
         return src[pos] & 0xFF;

      if (this.keyLength == 2)
         return ((src[pos] & 0xFF) << 8) | (src[pos+1] & 0xFF);

      final int key = ((src[pos] & 0xFF) << 16) | ((src[pos+1] & 0xFF) << 8) | (src[pos+2] & 0xFF);
      return (key * HASH_SEED) >>> HASH_RSHIFT;
   }
}
