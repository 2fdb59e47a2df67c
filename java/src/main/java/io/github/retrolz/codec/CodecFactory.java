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

import java.util.Map;


/**
 * Factory class to create codecs based on their name or type.
 */
public class CodecFactory {
    public static final int LZ10_TYPE = 0;
    public static final int LZ11_TYPE = 1;
    public static final int LZSS_TYPE = 2;
    public static final int MIO0_TYPE = 3;
    public static final int YAY0_TYPE = 4;
    public static final int YAZ0_TYPE = 5;
    public static final int RLE30_TYPE = 6;

    /**
     * Get the type of a codec based on its name (case insensitive).
     *
     * @param name
     *            the name of the codec
     * @return the type of the codec
     */
    public int getType(String name) {
        name = String.valueOf(name).toUpperCase();

        switch (name) {
            case "LZ10" :
                return LZ10_TYPE;

            case "LZ11" :
                return LZ11_TYPE;

            case "LZSS" :
                return LZSS_TYPE;

            case "MIO0" :
                return MIO0_TYPE;

            case "YAY0" :
                return YAY0_TYPE;

            case "YAZ0" :
                return YAZ0_TYPE;

            case "RLE30" :
                return RLE30_TYPE;

            default :
                throw new IllegalArgumentException("Unknown codec type: '" + name + "'");
        }
    }

    /**
     * Get the name of a codec based on its type.
     *
     * @param type
     *            the type of the codec
     * @return the name of the codec
     */
    public String getName(int type) {
        switch (type) {
            case LZ10_TYPE :
                return "LZ10";

            case LZ11_TYPE :
                return "LZ11";

            case LZSS_TYPE :
                return "LZSS";

            case MIO0_TYPE :
                return "MIO0";

            case YAY0_TYPE :
                return "YAY0";

            case YAZ0_TYPE :
                return "YAZ0";

            case RLE30_TYPE :
                return "RLE30";

            default :
                throw new IllegalArgumentException("Unknown codec type: '" + type + "'");
        }
    }

    /**
     * Create a codec based on its name.
     *
     * @param ctx
     *            the context map passed to the codec
     * @param name
     *            the name of the codec
     * @return the codec
     */
    public AbstractCodec newCodec(Map<String, Object> ctx, String name) {
        return this.newCodec(ctx, this.getType(name));
    }

    /**
     * Create a codec based on its type.
     *
     * @param ctx
     *            the context map passed to the codec
     * @param type
     *            the type of the codec
     * @return the codec
     */
    public AbstractCodec newCodec(Map<String, Object> ctx, int type) {
        switch (type) {
            case LZ10_TYPE :
                return new LZ10Codec(ctx);

            case LZ11_TYPE :
                return new LZ11Codec(ctx);

            case LZSS_TYPE :
                return new LZSSCodec(ctx);

            case MIO0_TYPE :
                return new MIO0Codec(ctx);

            case YAY0_TYPE :
                return new Yay0Codec(ctx);

            case YAZ0_TYPE :
                return new Yaz0Codec(ctx);

            case RLE30_TYPE :
                return new RLE30Codec(ctx);

            default :
                throw new IllegalArgumentException("Unknown codec type: '" + type + "'");
        }
    }
}
