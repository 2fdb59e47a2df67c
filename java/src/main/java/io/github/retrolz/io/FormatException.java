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

package io.github.retrolz.io;


/**
 * Checked exception raised by the codecs when the header of the compressed
 * data is not valid. It carries one of the {@link io.github.retrolz.Error}
 * codes.
 */
public class FormatException extends java.io.IOException {
    private static final long serialVersionUID = -3410920736158325462L;

    private final int code;

    /**
     * Constructs a new {@code FormatException} with the specified detail message
     * and error code.
     *
     * @param msg the detail message explaining the reason for the exception
     * @param code an error code from {@link io.github.retrolz.Error}
     */
    public FormatException(String msg, int code) {
        super(msg);
        this.code = code;
    }

    /**
     * Returns the error code associated with this exception.
     *
     * @return the error code
     */
    public int getErrorCode() {
        return this.code;
    }
}
