package me.golemcore.converse.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.converse.domain.model.MediaAnalysis;
import me.golemcore.converse.domain.model.MediaDescriptor;

import java.util.concurrent.CompletableFuture;

/**
 * Port for media and link analysis.
 */
public interface MediaAnalysisPort {

    /**
     * Whether {@link #analyze} needs the downloaded bytes for this media.
     * Links are analyzed from their URL alone.
     */
    boolean requiresContent(MediaDescriptor media);

    /**
     * @param content
     *            downloaded media bytes, or {@code null} when not required
     */
    CompletableFuture<MediaAnalysis> analyze(MediaDescriptor media, byte[] content);
}
