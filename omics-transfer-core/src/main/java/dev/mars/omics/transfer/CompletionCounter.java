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

package dev.mars.omics.transfer;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Counts outstanding units and fires a callback exactly once when the count is
 * finalized and has dropped back to zero.
 *
 * <p>The submission task increments once per part task before submitting it,
 * each part decrements in a done callback, and the submission task finalizes
 * once every part is submitted.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class CompletionCounter {

    private final ReentrantLock lock = new ReentrantLock();
    private final Runnable callback;
    private int count;
    private boolean finalized;

    public CompletionCounter(Runnable callback) {
        this.callback = callback;
    }

    public void increment() {
        lock.lock();
        try {
            if (finalized) {
                throw new IllegalStateException("Counter is finalized and cannot be incremented");
            }
            count++;
        } finally {
            lock.unlock();
        }
    }

    public void decrement() {
        boolean fire;
        lock.lock();
        try {
            if (count == 0) {
                throw new IllegalStateException("Counter is already at zero");
            }
            count--;
            fire = finalized && count == 0;
        } finally {
            lock.unlock();
        }
        if (fire) {
            callback.run();
        }
    }

    public void finalizeCount() {
        boolean fire;
        lock.lock();
        try {
            if (finalized) {
                return;
            }
            finalized = true;
            fire = count == 0;
        } finally {
            lock.unlock();
        }
        if (fire) {
            callback.run();
        }
    }

    public int getCount() {
        lock.lock();
        try {
            return count;
        } finally {
            lock.unlock();
        }
    }
}
