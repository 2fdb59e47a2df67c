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

package io.github.retrolz.util;

import io.github.retrolz.Event;
import io.github.retrolz.Listener;
import java.io.PrintStream;


/**
 * The {@code InfoPrinter} class implements the {@code Listener} interface and
 * prints information about compression, decompression and match searches.
 * <p>
 * Verbosity: 1 prints a summary when the process ends, 3 adds the match
 * search summary, 4 adds one line per searched block, 5 prints every event.
 * </p>
 */
public class InfoPrinter implements Listener {
    /**
     * Enum representing the type of information to be printed.
     */
    public enum Type {
        /** Represents encoding information. */
        ENCODING,
        /** Represents decoding information. */
        DECODING
    }

    private final PrintStream ps;
    private final Event.Type[] thresholds;
    private final Type type;
    private final int level;
    private volatile long startTime;
    private volatile long startSize;
    private volatile long searchTime;

    /**
     * Constructs an {@code InfoPrinter} with the specified information level, type,
     * and output stream.
     *
     * @param infoLevel
     *            the level of information to be printed
     * @param type
     *            the type of information (encoding or decoding)
     * @param ps
     *            the {@code PrintStream} to which information will be printed
     */
    public InfoPrinter(int infoLevel, Type type, PrintStream ps) {
        if (ps == null)
            throw new NullPointerException("Invalid null print stream parameter");

        this.ps = ps;
        this.level = infoLevel;
        this.type = type;
        this.thresholds = (type == Type.ENCODING)
                ? new Event.Type[]{Event.Type.COMPRESSION_START, Event.Type.COMPRESSION_END}
                : new Event.Type[]{Event.Type.DECOMPRESSION_START, Event.Type.DECOMPRESSION_END};
    }

    /**
     * Processes an event and prints the lines allowed by the verbosity level.
     *
     * @param evt
     *            the {@code Event} to be processed
     */
    @Override
    public void processEvent(Event evt) {
        if (this.level >= 5)
            this.ps.println(evt);

        if (evt.getType() == this.thresholds[0]) {
            this.startTime = evt.getTime();
            this.startSize = evt.getSize();
        } else if (evt.getType() == this.thresholds[1]) {
            if (this.level < 1)
                return;

            long duration_ms = (evt.getTime() - this.startTime) / 1000000L;
            StringBuilder msg = new StringBuilder();

            if (this.type == Type.ENCODING) {
                msg.append(String.format("Compressed %d => %d bytes [%d ms]", this.startSize, evt.getSize(), duration_ms));

                // Add compression ratio
                if (this.startSize != 0)
                    msg.append(String.format(" (%d%%)", (evt.getSize() * 100L / this.startSize)));
            } else {
                msg.append(String.format("Decompressed %d bytes [%d ms]", evt.getSize(), duration_ms));
            }

            this.ps.println(msg.toString());
        } else if (evt.getType() == Event.Type.MATCH_SEARCH_START) {
            this.searchTime = evt.getTime();
        } else if ((evt.getType() == Event.Type.MATCH_SEARCH_END) && (this.level >= 3)) {
            long duration_ms = (evt.getTime() - this.searchTime) / 1000000L;
            this.ps.println(String.format("Match search: %d matches [%d ms]", evt.getSize(), duration_ms));
        } else if ((evt.getType() == Event.Type.BLOCK_INFO) && (this.level == 4)) {
            this.ps.println(String.format("Block %d: %d matches", evt.getId(), evt.getSize()));
        }
    }
}
