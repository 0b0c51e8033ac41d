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

/**
 * Transfer primitive that copies one remote asset folder into a local folder.
 * Implementations wrap the external tool that actually moves the bytes.
 */
public interface TransferProtocol {

    /**
     * Get the protocol name/identifier
     */
    String getProtocolName();

    /**
     * Check if this protocol can handle the given request
     */
    boolean canHandle(TransferRequest request);

    /**
     * Execute one transfer attempt.
     *
     * @param request the transfer request
     * @param context the transfer context for cancellation
     * @return the successful transfer result
     * @throws TransferException if the attempt fails
     */
    TransferResult transfer(TransferRequest request, TransferContext context) throws TransferException;
}
