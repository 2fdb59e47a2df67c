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


/**
 * Coarse effort knob of the match finders. Each level bounds the number of
 * dictionary candidates inspected per position, the window searched and
 * whether the one step look-ahead may be used.
 */
public enum CompressionLevel
{
   /** No search: every byte is stored as a literal. */
   NONE(0, 0, false),

   /** Short candidate chains, window capped at 16 KiB, no look-ahead. */
   FASTEST(16, 0x4000, false),

   /** Default trade-off, window capped at 64 KiB. */
   OPTIMAL(256, 0x10000, true),

   /** Inspects every candidate of the window. */
   SMALLEST_SIZE(Integer.MAX_VALUE, Integer.MAX_VALUE, true);

   private final int maxCandidates;
   private final int maxWindowSize;
   private final boolean lookAheadAllowed;


   CompressionLevel(int maxCandidates, int maxWindowSize, boolean lookAheadAllowed)
   {
      this.maxCandidates = maxCandidates;
      this.maxWindowSize = maxWindowSize;
      this.lookAheadAllowed = lookAheadAllowed;
   }


   public int getMaxCandidates()
   {
      return this.maxCandidates;
   }


   public int getMaxWindowSize()
   {
      return this.maxWindowSize;
   }


   public boolean isLookAheadAllowed()
   {
      return this.lookAheadAllowed;
   }
}
