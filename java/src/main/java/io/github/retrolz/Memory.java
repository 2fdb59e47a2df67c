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

package io.github.retrolz;


/**
 * Reads and writes multi-byte integers in byte arrays, in big endian or
 * little endian order.
 */
public final class Memory {

   private Memory() {
   }


   public static final class BigEndian {

      private BigEndian() {
      }

      public static int readInt16(byte[] buf, int offset) {
         return ((buf[offset] & 0xFF) << 8) | (buf[offset+1] & 0xFF);
      }


      public static int readInt32(byte[] buf, int offset) {
         return ((buf[offset] & 0xFF) << 24) | ((buf[offset+1] & 0xFF) << 16) |
                ((buf[offset+2] & 0xFF) << 8) | (buf[offset+3] & 0xFF);
      }

      public static void writeInt16(byte[] buf, int offset, int value) {
         buf[offset]   = (byte) (value >> 8);
         buf[offset+1] = (byte) value;
      }


      public static void writeInt32(byte[] buf, int offset, int value) {
         buf[offset]   = (byte) (value >> 24);
         buf[offset+1] = (byte) (value >> 16);
         buf[offset+2] = (byte) (value >> 8);
         buf[offset+3] = (byte) value;
      }
   }


   public static final class LittleEndian {

      private LittleEndian() {
      }

      public static int readInt16(byte[] buf, int offset) {
         return (buf[offset] & 0xFF) | ((buf[offset+1] & 0xFF) << 8);
      }


      public static int readInt32(byte[] buf, int offset) {
         return (buf[offset] & 0xFF) | ((buf[offset+1] & 0xFF) << 8) |
                ((buf[offset+2] & 0xFF) << 16) | ((buf[offset+3] & 0xFF) << 24);
      }

      public static void writeInt16(byte[] buf, int offset, int value) {
         buf[offset]   = (byte) value;
         buf[offset+1] = (byte) (value >> 8);
      }


      public static void writeInt32(byte[] buf, int offset, int value) {
         buf[offset]   = (byte) value;
         buf[offset+1] = (byte) (value >> 8);
         buf[offset+2] = (byte) (value >> 16);
         buf[offset+3] = (byte) (value >> 24);
      }
   }
}
