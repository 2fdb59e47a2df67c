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
 * Raised when a decoder produced a different number of bytes than the size
 * declared in the header of the compressed data.
 */
public class DecompressedSizeException extends BitStreamException {

    private static final long serialVersionUID = 2395130470165627761L;

    private final long expected;
    private final long actual;

    /**
     * Constructs a {@code DecompressedSizeException}.
     *
     * @param expected the declared decompressed size
     * @param actual the number of bytes actually produced
     */
    public DecompressedSizeException(long expected, long actual) {
        super("Expected " + expected + " decompressed bytes but got " + actual, SIZE_MISMATCH);
        this.expected = expected;
        this.actual = actual;
    }

    public long getExpected() {
        return this.expected;
    }

    public long getActual() {
        return this.actual;
    }

    /**
     * Throws a {@code DecompressedSizeException} if both sizes differ.
     *
     * @param actual the number of bytes produced
     * @param expected the declared number of bytes
     * @throws DecompressedSizeException if {@code actual != expected}
     */
    public static void throwIfMismatch(long actual, long expected) {
        if (actual != expected)
            throw new DecompressedSizeException(expected, actual);
    }
}
