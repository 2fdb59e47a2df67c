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
 * The {@code Listener} interface defines a contract for objects that need to handle and process
 * events.
 * <p>
 * Listeners are registered on a codec or on the parallel match finder. Codecs
 * report the start and end of compression and decompression. The match finder
 * reports the start of a search, each searched block and the end of the search.
 * LZ11 forwards its codec listeners to the match finder.
 * </p>
 *
 */
public interface Listener {

  /**
   * Processes the given event.
   *
   * @param evt The event to be processed. Cannot be {@code null}.
   */
  public void processEvent(Event evt);
}
