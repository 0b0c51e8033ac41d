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


package dev.mars.assetsync.cli;

import dev.mars.assetsync.core.exceptions.TransferException;
import dev.mars.assetsync.transfer.TransferContext;
import dev.mars.assetsync.transfer.TransferProtocol;
import dev.mars.assetsync.transfer.TransferRequest;
import dev.mars.assetsync.transfer.TransferResult;

import java.io.IOException;
import java.nio.file.Files;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Protocol that materialises each remote folder as a single local file, or fails every
 * attempt when built failing.
 */
class CopyingTransferProtocol implements TransferProtocol {

    private final boolean failing;
    private final AtomicInteger calls = new AtomicInteger();
    private volatile Runnable onTransfer = () -> { };

    CopyingTransferProtocol(boolean failing) {
        this.failing = failing;
    }

    void onTransfer(Runnable action) {
        this.onTransfer = action;
    }

    int getCalls() {
        return calls.get();
    }

    @Override
    public String getProtocolName() {
        return "copying";
    }

    @Override
    public boolean canHandle(TransferRequest request) {
        return true;
    }

    @Override
    public TransferResult transfer(TransferRequest request, TransferContext context) throws TransferException {
        calls.incrementAndGet();
        onTransfer.run();
        if (failing) {
            throw new TransferException(request.getRequestId(), "Exit code 7: quota exceeded");
        }
        try {
            Files.createDirectories(request.getDestination());
            Files.writeString(request.getDestination().resolve("content.bin"), request.getLink().getUrl());
        } catch (IOException e) {
            throw new TransferException(request.getRequestId(), e.getMessage(), e);
        }
        return TransferResult.builder().requestId(request.getRequestId()).successful(true).exitCode(0).build();
    }
}
