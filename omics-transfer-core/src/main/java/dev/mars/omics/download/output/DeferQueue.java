/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.omics.download.output;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reorders out-of-order chunks into a contiguous byte stream.
 *
 * <p>Chunks before the next expected offset are dropped (or trimmed when they
 * overlap it). Chunks after it are held until the gap is filled. When two
 * chunks start at the same offset the longer one is kept.</p>
 *
 * <p>Not thread safe; the owner serializes calls.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class DeferQueue {

    private final TreeMap<Long, byte[]> pending = new TreeMap<>();
    private long nextOffset;

    /**
     * Offers a chunk and returns the chunks that can now be written, in order.
     */
    public List<byte[]> requestWrites(long offset, byte[] data) {
        if (offset + data.length <= nextOffset) {
            return List.of();
        }
        byte[] queued = pending.get(offset);
        if (queued == null || queued.length < data.length) {
            pending.put(offset, data);
        }
        List<byte[]> writes = new ArrayList<>();
        while (!pending.isEmpty() && pending.firstKey() <= nextOffset) {
            Map.Entry<Long, byte[]> first = pending.pollFirstEntry();
            long start = first.getKey();
            byte[] chunk = first.getValue();
            if (start + chunk.length <= nextOffset) {
                continue;
            }
            if (start < nextOffset) {
                chunk = Arrays.copyOfRange(chunk, (int) (nextOffset - start), chunk.length);
            }
            writes.add(chunk);
            nextOffset += chunk.length;
        }
        return writes;
    }

    public long getNextOffset() {
        return nextOffset;
    }

    public int pendingCount() {
        return pending.size();
    }
}
