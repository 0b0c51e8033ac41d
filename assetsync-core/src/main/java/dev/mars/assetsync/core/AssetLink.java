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


package dev.mars.assetsync.core;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable reference from a course asset slot to a remote folder.
 *
 * <p>The remote folder id is extracted once, when the link is parsed. A link whose id
 * cannot be extracted is still kept so that the reconciliation report can show it; a
 * transfer of such a link fails with a data error.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class AssetLink {

    private static final List<Pattern> FOLDER_ID_PATTERNS = List.of(
            Pattern.compile("/file/d/([a-zA-Z0-9_-]{10,})"),
            Pattern.compile("/folders/([a-zA-Z0-9_-]{10,})"),
            Pattern.compile("/open\\?id=([a-zA-Z0-9_-]{10,})"),
            Pattern.compile("[?&]id=([a-zA-Z0-9_-]{10,})"),
            Pattern.compile("/d/([a-zA-Z0-9_-]{10,})"),
            Pattern.compile("^([a-zA-Z0-9_-]{25,})$"));

    private final String url;
    private final String folderId;

    private AssetLink(String url, String folderId) {
        this.url = url;
        this.folderId = folderId;
    }

    /**
     * Parses a manifest cell into a link.
     *
     * @param raw the cell value
     * @return the link, or empty when the cell is null or blank
     */
    public static Optional<AssetLink> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String url = raw.trim();
        return Optional.of(new AssetLink(url, extractFolderId(url)));
    }

    static String extractFolderId(String url) {
        for (Pattern pattern : FOLDER_ID_PATTERNS) {
            Matcher matcher = pattern.matcher(url);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return null;
    }

    public String getUrl() {
        return url;
    }

    public Optional<String> getFolderId() {
        return Optional.ofNullable(folderId);
    }

    /**
     * Key used to detect two slots pointing at the same remote folder. Falls back to
     * the raw URL when no folder id could be extracted.
     */
    public String getRemoteKey() {
        return folderId != null ? folderId : url;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AssetLink)) return false;
        AssetLink that = (AssetLink) o;
        return url.equals(that.url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url);
    }

    @Override
    public String toString() {
        return "AssetLink{url='" + url + "', folderId=" + folderId + "}";
    }
}
