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

import dev.mars.assetsync.core.exceptions.TransferException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a {@link TransferProtocol} with retries and linear backoff.
 *
 * <p>Attempt {@code n} that fails is followed by a pause of {@code retryDelayMs * n}
 * before the next attempt, up to {@code maxAttempts} attempts. Interruption during the
 * pause cancels the transfer. Failures are returned as unsuccessful results, never thrown.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class RetryingTransferExecutor {

    private static final Logger logger = LoggerFactory.getLogger(RetryingTransferExecutor.class);

    private final TransferProtocol protocol;
    private final int maxAttempts;
    private final long retryDelayMs;

    public RetryingTransferExecutor(TransferProtocol protocol, int maxAttempts, long retryDelayMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got: " + maxAttempts);
        }
        this.protocol = protocol;
        this.maxAttempts = maxAttempts;
        this.retryDelayMs = retryDelayMs;
    }

    public TransferResult execute(TransferRequest request, TransferContext context) {
        int attempt = 0;
        Exception lastException = null;

        while (attempt < maxAttempts && context.shouldContinue()) {
            attempt++;
            try {
                TransferResult result = protocol.transfer(request, context);
                if (result.isSuccessful()) {
                    if (attempt > 1) {
                        logger.info("Transfer {} succeeded on attempt {}", request.getRequestId(), attempt);
                    }
                    return result.withAttempts(attempt);
                }
                throw new TransferException(request.getRequestId(),
                        result.getErrorMessage().orElse("Unknown error"));
            } catch (TransferException | RuntimeException e) {
                lastException = e;
                context.incrementRetryCount();
                logger.warn("Transfer attempt {}/{} failed for {}: {}",
                        attempt, maxAttempts, request.getRequestId(), e.getMessage());

                if (attempt < maxAttempts && context.shouldContinue()) {
                    try {
                        Thread.sleep(retryDelayMs * attempt);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        context.cancel();
                        break;
                    }
                }
            }
        }

        String errorMessage = lastException != null
                ? lastException.getMessage()
                : "Transfer cancelled before it started";
        logger.error("Transfer failed permanently: {} - {}", request.getRequestId(), errorMessage);
        return TransferResult.builder()
                .requestId(request.getRequestId())
                .successful(false)
                .attempts(attempt)
                .errorMessage(errorMessage)
                .build();
    }
}
