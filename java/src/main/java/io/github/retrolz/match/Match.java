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
 * A back-reference: at input position {@code offset}, {@code length} bytes
 * equal to the bytes found {@code distance} bytes earlier. The length may
 * exceed the distance (self-overlapping match).
 */
public final class Match
{
   /** Sentinel returned when no match has been found. */
   public static final Match NONE = new Match(0, 0, 0);

   private final int offset;
   private final int distance;
   private final int length;


   public Match(int offset, int distance, int length)
   {
      this.offset = offset;
      this.distance = distance;
      this.length = length;
   }


   public int getOffset()
   {
      return this.offset;
   }


   public int getDistance()
   {
      return this.distance;
   }


   public int getLength()
   {
      return this.length;
   }


   /**
    * Returns the input position right after the match.
    *
    * @return offset + length
    */
   public int end()
   {
      return this.offset + this.length;
   }


   public boolean isNone()
   {
      return this.length == 0;
   }


   @Override
   public boolean equals(Object o)
   {
      if (this == o)
         return true;

      if ((o instanceof Match) == false)
         return false;

      final Match m = (Match) o;
      return (this.offset == m.offset) && (this.distance == m.distance) && (this.length == m.length);
   }


   @Override
   public int hashCode()
   {
      return (31 * (31 * this.offset + this.distance)) + this.length;
   }


   @Override
   public String toString()
   {
      StringBuilder builder = new StringBuilder(64);
      builder.append("[ offset=");
      builder.append(this.offset);
      builder.append(", dist=");
      builder.append(this.distance);
      builder.append(", len=");
      builder.append(this.length);
      builder.append("]");
      return builder.toString();
   }
}
