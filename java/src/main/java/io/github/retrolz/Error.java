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
 * This final class defines constants for the error codes carried by the
 * checked exceptions of the codecs.
 */
public final class Error {

    /**
     *  Missing or invalid identifier, size or offset in the header
     */
    public static final int ERR_INVALID_FILE = 15;

    /**
     * Private constructor to prevent instantiation.
     */
    private Error() {
    }
}
