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
import dev.mars.assetsync.storage.FileManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Copies a remote drive folder with the external {@code rclone} tool.
 *
 * <p>Each attempt runs
 * {@code <command> copy <remote>: <destination> --drive-root-folder-id=<folder id> <extra args>}.
 * Output is streamed to the debug log; the last lines are kept for the error message
 * when the tool exits non-zero. An attempt that outlives the timeout is killed.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class RcloneTransferProtocol implements TransferProtocol {

    private static final Logger logger = LoggerFactory.getLogger(RcloneTransferProtocol.class);

    private static final int OUTPUT_TAIL_LINES = 10;

    private final String command;
    private final String remote;
    private final List<String> extraArgs;
    private final Duration timeout;

    public RcloneTransferProtocol(String command, String remote, List<String> extraArgs, Duration timeout) {
        this.command = command;
        this.remote = remote;
        this.extraArgs = List.copyOf(extraArgs);
        this.timeout = timeout;
    }

    @Override
    public String getProtocolName() {
        return "rclone";
    }

    @Override
    public boolean canHandle(TransferRequest request) {
        return request.getLink().getFolderId().isPresent();
    }

    /**
     * Builds the command line for one attempt.
     *
     * @throws TransferException if the link carries no remote folder id
     */
    public List<String> buildCommand(TransferRequest request) throws TransferException {
        String folderId = request.getLink().getFolderId()
                .orElseThrow(() -> new TransferException(request.getRequestId(),
                        "Cannot extract a remote folder id from " + request.getLink().getUrl()));
        List<String> cmd = new ArrayList<>();
        cmd.add(command);
        cmd.add("copy");
        cmd.add(remote + ":");
        cmd.add(request.getDestination().toString());
        cmd.add("--drive-root-folder-id=" + folderId);
        cmd.addAll(extraArgs);
        return cmd;
    }

    @Override
    public TransferResult transfer(TransferRequest request, TransferContext context) throws TransferException {
        List<String> cmd = buildCommand(request);
        Instant start = Instant.now();
        try {
            FileManager.ensureDirectoryExists(request.getDestination());
        } catch (IOException e) {
            throw new TransferException(request.getRequestId(),
                    "Cannot create destination " + request.getDestination() + ": " + e.getMessage(), e);
        }

        logger.info("Transferring {} into {}", request.getRequestId(), request.getDestination());
        logger.debug("Running: {}", String.join(" ", cmd));

        Process process;
        try {
            ProcessBuilder pb = new ProcessBuilder(cmd);
            pb.redirectErrorStream(true);
            process = pb.start();
        } catch (IOException e) {
            throw new TransferException(request.getRequestId(),
                    "Cannot start " + command + ": " + e.getMessage(), e);
        }
        context.attachProcess(process);

        Deque<String> tail = new ArrayDeque<>();
        Thread pump = new Thread(() -> pumpOutput(process, tail, request.getRequestId()),
                "rclone-output-" + request.getAssetType());
        pump.setDaemon(true);
        pump.start();

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new TransferException(request.getRequestId(),
                        "Timed out after " + timeout.toMinutes() + " minutes");
            }
            pump.join(TimeUnit.SECONDS.toMillis(5));
            if (context.isCancelled()) {
                throw new TransferException(request.getRequestId(), "Cancelled");
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new TransferException(request.getRequestId(),
                        "Exit code " + exitCode + ": " + describeTail(tail));
            }
            return TransferResult.builder()
                    .requestId(request.getRequestId())
                    .successful(true)
                    .exitCode(exitCode)
                    .startTime(start)
                    .endTime(Instant.now())
                    .build();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            context.cancel();
            throw new TransferException(request.getRequestId(), "Interrupted", e);
        } finally {
            context.detachProcess();
        }
    }

    private static void pumpOutput(Process process, Deque<String> tail, String requestId) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                logger.debug("[{}] {}", requestId, line);
                synchronized (tail) {
                    tail.addLast(line);
                    if (tail.size() > OUTPUT_TAIL_LINES) {
                        tail.removeFirst();
                    }
                }
            }
        } catch (IOException e) {
            logger.debug("Output stream of {} closed: {}", requestId, e.getMessage());
        }
    }

    private static String describeTail(Deque<String> tail) {
        synchronized (tail) {
            return tail.isEmpty() ? "no output" : String.join(" | ", tail);
        }
    }
}
