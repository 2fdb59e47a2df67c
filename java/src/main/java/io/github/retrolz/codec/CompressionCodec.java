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

package io.github.retrolz.codec;

import io.github.retrolz.match.CompressionLevel;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;


/**
 * A compression format: a header followed by a stream of literals and
 * matches encoded the way the format requires.
 */
public interface CompressionCodec
{
   /**
    * Compresses a buffer.
    *
    * @param src the data to compress
    * @param os receives the compressed data (header included)
    * @param level the compression level
    * @throws IOException if the output cannot be written
    */
   public void compress(byte[] src, OutputStream os, CompressionLevel level) throws IOException;


   /**
    * Decompresses data produced by {@link #compress(byte[], OutputStream, CompressionLevel)}.
    * Corrupt or truncated data raises a {@link io.github.retrolz.BitStreamException}.
    *
    * @param is the compressed data
    * @param os receives the decompressed data
    * @throws io.github.retrolz.io.FormatException if the header is not valid
    * @throws IOException if the output cannot be written
    */
   public void decompress(InputStream is, OutputStream os) throws IOException;


   public String getName();
}
