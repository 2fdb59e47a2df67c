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
 * This class represents events that occur while matches are searched and while
 * data is compressed or decompressed. Each event includes a type, an id, a size
 * and a timestamp.
 */
public class Event {

    /**
     * Enum representing the types of events that can occur.
     */
    public enum Type {
        /**
         * Beginning of a match search over a whole buffer
         */
        MATCH_SEARCH_START,

        /**
         * End of a match search over a whole buffer
         */
        MATCH_SEARCH_END,

        /**
         * Beginning of compression
         */
        COMPRESSION_START,

        /**
         * End of compression
         */
        COMPRESSION_END,

        /**
         * Beginning of decompression
         */
        DECOMPRESSION_START,

        /**
         * End of decompression
         */
        DECOMPRESSION_END,

        /**
         * Block information
         */
        BLOCK_INFO
    }

    private final int id;
    private final long size;
    private final Type type;
    private final long time;

    /**
     * Constructs an Event with the specified type, id, and size.
     * The event is timestamped with {@link System#nanoTime()}.
     *
     * @param type
     *            the type of event
     * @param id
     *            the event id
     * @param size
     *            the size of the event
     */
    public Event(Type type, int id, long size) {
        this.id = id;
        this.size = size;
        this.type = type;
        this.time = System.nanoTime();
    }

    /**
     * Returns the event id.
     *
     * @return the event id
     */
    public int getId() {
        return this.id;
    }

    /**
     * Returns the size of the event.
     *
     * @return the event size
     */
    public long getSize() {
        return this.size;
    }

    /**
     * Returns the timestamp of the event.
     *
     * @return the event timestamp
     */
    public long getTime() {
        return this.time;
    }

    /**
     * Returns the type of the event.
     *
     * @return the event type
     */
    public Type getType() {
        return this.type;
    }

    /**
     * Returns a string representation of the event.
     *
     * @return a string representation of the event
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(200);
        sb.append("{ \"type\":\"").append(this.getType()).append("\"");
        if (this.id >= 0) {
            sb.append(", \"id\":").append(this.getId());
        }
        sb.append(", \"size\":").append(this.getSize());
        sb.append(", \"time\":").append(this.getTime());
        sb.append(" }");
        return sb.toString();
    }
}
