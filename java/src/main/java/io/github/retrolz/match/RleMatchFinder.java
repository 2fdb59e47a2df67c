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


// Finds runs of a repeated byte and the literal stretches between them
public final class RleMatchFinder
{
   private final int minLength;
   private final int maxLength;


   public RleMatchFinder()
   {
      this(3, 127);
   }


   public RleMatchFinder(int minLength, int maxLength)
   {
      if (minLength < 1)
         throw new IllegalArgumentException("Invalid minimum run length: " + minLength);

      if (maxLength < minLength)
         throw new IllegalArgumentException("Invalid maximum run length: " + maxLength);

      this.minLength = minLength;
      this.maxLength = maxLength;
   }


   /**
    * Measures the sequence starting at {@code offset}.
    *
    * @param src the input buffer
    * @param offset the position to inspect
    * @return a positive run length if at least minLength copies of the same
    * byte start at offset, otherwise the negated number of literal bytes up to
    * the next run (at most maxLength), 0 at the end of the buffer
    */
   public int tryFindMatch(byte[] src, int offset)
   {
      if ((offset < 0) || (offset > src.length))
         throw new IllegalArgumentException("Invalid offset: " + offset);

      if (offset == src.length)
         return 0;

      final int run = runLength(src, offset, this.maxLength);

      if (run >= this.minLength)
         return run;

      int literals = 1;

      while ((literals < this.maxLength) && (offset + literals < src.length))
      {
         if (runLength(src, offset + literals, this.minLength) == this.minLength)
            break;

         literals++;
      }

      return -literals;
   }


   public int getMinLength()
   {
      return this.minLength;
   }


   public int getMaxLength()
   {
      return this.maxLength;
   }


   private static int runLength(byte[] src, int offset, int limit)
   {
      final int end = (int) Math.min((long) offset + limit, src.length);
      final byte val = src[offset];
      int i = offset + 1;

      while ((i < end) && (src[i] == val))
         i++;

      return i - offset;
   }
}
