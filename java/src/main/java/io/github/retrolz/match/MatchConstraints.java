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

import io.github.retrolz.Global;


/**
 * Immutable description of the matches a format can represent: the window
 * size (maximum distance), the inclusive length bounds and the initial ring
 * offset used by formats that encode absolute window positions.
 */
public final class MatchConstraints
{
   private final int windowSize;
   private final int minLength;
   private final int maxLength;
   private final int windowStart;
   private final int distanceBits;
   private final int lengthBits;


   public MatchConstraints(int windowSize, int maxLength)
   {
      this(windowSize, 3, maxLength, 0);
   }


   public MatchConstraints(int windowSize, int minLength, int maxLength)
   {
      this(windowSize, minLength, maxLength, 0);
   }


   /**
    * Creates constraints.
    *
    * @param windowSize the maximum back-reference distance
    * @param minLength the minimum match length
    * @param maxLength the maximum match length
    * @param windowStart the initial ring offset (0 for most formats)
    * @throws IllegalArgumentException if the values are inconsistent
    */
   public MatchConstraints(int windowSize, int minLength, int maxLength, int windowStart)
   {
      if (windowSize < 1)
         throw new IllegalArgumentException("Invalid window size: " + windowSize + " (must be at least 1)");

      if (minLength < 1)
         throw new IllegalArgumentException("Invalid minimum match length: " + minLength + " (must be at least 1)");

      if (minLength > maxLength)
         throw new IllegalArgumentException("Invalid match lengths: minimum " + minLength +
            " is greater than maximum " + maxLength);

      if (windowStart < 0)
         throw new IllegalArgumentException("Invalid window start: " + windowStart + " (must be positive or null)");

      this.windowSize = windowSize;
      this.minLength = minLength;
      this.maxLength = maxLength;
      this.windowStart = windowStart;
      this.distanceBits = Global.log2Ceil(windowSize);
      this.lengthBits = Global.log2Ceil(maxLength - minLength + 1);
   }


   /**
    * Creates the constraints of an LZSS ring buffer of {@code 1 << distanceBits}
    * bytes where lengths are stored on {@code lengthBits} bits above the
    * threshold. Writing starts {@code F + threshold} bytes before the end of
    * the ring, {@code F} being {@code 1 << lengthBits}.
    *
    * @param distanceBits number of bits of a ring offset
    * @param lengthBits number of bits of a length
    * @param threshold longest length that is not worth a match
    * @return the constraints
    */
   public static MatchConstraints fromBits(int distanceBits, int lengthBits, int threshold)
   {
      if ((distanceBits < 1) || (distanceBits > 30))
         throw new IllegalArgumentException("Invalid number of distance bits: " + distanceBits + " (must be in [1..30])");

      if ((lengthBits < 0) || (lengthBits > 30))
         throw new IllegalArgumentException("Invalid number of length bits: " + lengthBits + " (must be in [0..30])");

      final int windowSize = 1 << distanceBits;
      final int f = 1 << lengthBits;
      return new MatchConstraints(windowSize, threshold + 1, f + threshold, Math.max(0, windowSize - f - threshold));
   }


   /**
    * Returns these constraints with the window capped for the given level.
    *
    * @param level the compression level
    * @return constraints with a window of at most {@code level.getMaxWindowSize()} bytes
    */
   public MatchConstraints withLevel(CompressionLevel level)
   {
      if (this.windowSize <= level.getMaxWindowSize())
         return this;

      return new MatchConstraints(Math.max(1, level.getMaxWindowSize()), this.minLength, this.maxLength, this.windowStart);
   }


   public int getWindowSize()
   {
      return this.windowSize;
   }


   public int getMinLength()
   {
      return this.minLength;
   }


   public int getMaxLength()
   {
      return this.maxLength;
   }


   public int getWindowStart()
   {
      return this.windowStart;
   }


   public int getDistanceBits()
   {
      return this.distanceBits;
   }


   public int getLengthBits()
   {
      return this.lengthBits;
   }


   public int getWindowMask()
   {
      return this.windowSize - 1;
   }


   public int getLengthMask()
   {
      return (1 << this.lengthBits) - 1;
   }


   /**
    * Checks that a match can be represented with these constraints.
    *
    * @param m the match to check
    * @return {@code true} if distance and length are within bounds
    */
   public boolean accepts(Match m)
   {
      return (m.getDistance() >= 1) && (m.getDistance() <= this.windowSize) &&
         (m.getLength() >= this.minLength) && (m.getLength() <= this.maxLength);
   }


   @Override
   public String toString()
   {
      return "[ window=" + this.windowSize + ", min=" + this.minLength + ", max=" + this.maxLength +
         ", start=" + this.windowStart + "]";
   }
}
