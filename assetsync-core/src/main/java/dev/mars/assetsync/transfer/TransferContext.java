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


package dev.mars.assetsync.transfer;

import java.util.concurrent.atomic.AtomicBoolean;

public class TransferContext {
    private final String requestId;
    private final AtomicBoolean cancelled;
    private volatile int retryCount;
    private volatile Process process;

    public TransferContext(String requestId) {
        this.requestId = requestId;
        this.cancelled = new AtomicBoolean(false);
    }

    public String getRequestId() {
        return requestId;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Marks the transfer cancelled and kills the external process if one is running.
     */
    public void cancel() {
        cancelled.set(true);
        Process running = process;
        if (running != null && running.isAlive()) {
            running.destroyForcibly();
        }
    }

    // External process tracking
    public void attachProcess(Process process) {
        this.process = process;
        if (cancelled.get() && process.isAlive()) {
            process.destroyForcibly();
        }
    }

    public void detachProcess() {
        this.process = null;
    }

    // Retry management
    public int getRetryCount() {
        return retryCount;
    }

    public void incrementRetryCount() {
        this.retryCount++;
    }

    public boolean shouldContinue() {
        return !cancelled.get();
    }
}
