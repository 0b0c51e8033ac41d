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

import dev.mars.assetsync.core.AssetLink;
import dev.mars.assetsync.core.AssetType;
import dev.mars.assetsync.core.exceptions.TransferException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link RcloneTransferProtocol}. Process tests run small system commands in
 * place of rclone.
 */
class RcloneTransferProtocolTest {

    @TempDir
    Path tempDir;

    private TransferRequest request(String url) {
        return TransferRequest.builder()
                .courseName("Physics")
                .assetType(AssetType.FINAL_VIDEOS)
                .link(AssetLink.parse(url).orElseThrow())
                .destination(tempDir.resolve("Physics/Final Videos"))
                .build();
    }

    @Test
    void testBuildCommand() throws TransferException {
        RcloneTransferProtocol protocol = new RcloneTransferProtocol("rclone", "gdrive",
                List.of("--transfers=4", "--stats=10s"), Duration.ofMinutes(10));

        List<String> cmd = protocol.buildCommand(
                request("https://drive.google.com/drive/folders/1FinalVideosXyz?usp=sharing"));

        assertEquals(List.of("rclone", "copy", "gdrive:", tempDir.resolve("Physics/Final Videos").toString(),
                "--drive-root-folder-id=1FinalVideosXyz", "--transfers=4", "--stats=10s"), cmd);
    }

    @Test
    void testLinkWithoutFolderIdCannotBeHandled() {
        RcloneTransferProtocol protocol = new RcloneTransferProtocol("rclone", "gdrive", List.of(),
                Duration.ofMinutes(10));
        TransferRequest unparseable = request("ask the course lead");

        assertFalse(protocol.canHandle(unparseable));
        TransferException e = assertThrows(TransferException.class, () -> protocol.buildCommand(unparseable));
        assertEquals("Physics/FINAL_VIDEOS", e.getTransferId());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void testZeroExitIsSuccess() throws TransferException {
        RcloneTransferProtocol protocol = new RcloneTransferProtocol("true", "gdrive", List.of(),
                Duration.ofMinutes(1));
        TransferRequest request = request("https://drive.google.com/drive/folders/1FinalVideosXyz");
        TransferContext context = new TransferContext(request.getRequestId());

        TransferResult result = protocol.transfer(request, context);

        assertTrue(result.isSuccessful());
        assertEquals(0, result.getExitCode());
        assertTrue(Files.isDirectory(request.getDestination()));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void testNonZeroExitFails() {
        RcloneTransferProtocol protocol = new RcloneTransferProtocol("false", "gdrive", List.of(),
                Duration.ofMinutes(1));
        TransferRequest request = request("https://drive.google.com/drive/folders/1FinalVideosXyz");

        TransferException e = assertThrows(TransferException.class,
                () -> protocol.transfer(request, new TransferContext(request.getRequestId())));
        assertTrue(e.getMessage().contains("Exit code 1"));
    }

    @Test
    void testMissingExecutableFails() {
        RcloneTransferProtocol protocol = new RcloneTransferProtocol("assetsync-no-such-binary", "gdrive",
                List.of(), Duration.ofMinutes(1));
        TransferRequest request = request("https://drive.google.com/drive/folders/1FinalVideosXyz");

        TransferException e = assertThrows(TransferException.class,
                () -> protocol.transfer(request, new TransferContext(request.getRequestId())));
        assertTrue(e.getMessage().contains("Cannot start assetsync-no-such-binary"));
    }
}
