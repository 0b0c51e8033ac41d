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

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable result of one asset folder transfer, possibly after several attempts.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class TransferResult {

    private final String requestId;
    private final boolean successful;
    private final int exitCode;
    private final int attempts;
    private final Instant startTime;
    private final Instant endTime;
    private final String errorMessage;

    private TransferResult(Builder builder) {
        this.requestId = Objects.requireNonNull(builder.requestId, "Request ID cannot be null");
        this.successful = builder.successful;
        this.exitCode = builder.exitCode;
        this.attempts = builder.attempts;
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.errorMessage = builder.errorMessage;
    }

    public String getRequestId() { return requestId; }

    public boolean isSuccessful() { return successful; }

    /**
     * Exit code of the external tool on the last attempt, -1 when it never exited normally.
     */
    public int getExitCode() { return exitCode; }

    public int getAttempts() { return attempts; }

    public Optional<Instant> getStartTime() { return Optional.ofNullable(startTime); }

    public Optional<Instant> getEndTime() { return Optional.ofNullable(endTime); }

    public Optional<String> getErrorMessage() { return Optional.ofNullable(errorMessage); }

    public Optional<Duration> getDuration() {
        if (startTime != null && endTime != null) {
            return Optional.of(Duration.between(startTime, endTime));
        }
        return Optional.empty();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Copy of this result carrying a different attempt count.
     */
    public TransferResult withAttempts(int attemptCount) {
        return builder().requestId(requestId).successful(successful).exitCode(exitCode)
                .attempts(attemptCount).startTime(startTime).endTime(endTime)
                .errorMessage(errorMessage).build();
    }

    @Override
    public String toString() {
        return "TransferResult{" + requestId + ", successful=" + successful + ", attempts=" + attempts
                + (errorMessage != null ? ", error='" + errorMessage + "'" : "") + "}";
    }

    public static class Builder {
        private String requestId;
        private boolean successful;
        private int exitCode = -1;
        private int attempts = 1;
        private Instant startTime;
        private Instant endTime;
        private String errorMessage;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder exitCode(int exitCode) {
            this.exitCode = exitCode;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public TransferResult build() {
            return new TransferResult(this);
        }
    }
}
