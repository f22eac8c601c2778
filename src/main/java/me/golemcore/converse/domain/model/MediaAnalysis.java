package me.golemcore.converse.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of analyzing a media attachment or link. Only the description and
 * the structured hints are consumed; raw media is never parsed here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MediaAnalysis {

    private MediaKind kind;
    private String description;
    private String extractedText;
    private String title;
    private String price;
    private String category;
    private String domain;
    private String url;
    private String filename;

    public static MediaAnalysis describeOnly(MediaDescriptor media) {
        String caption = media.getCaption();
        return MediaAnalysis.builder()
                .kind(media.getKind())
                .description(caption != null && !caption.isBlank() ? caption : "no description available")
                .filename(media.getFilename())
                .url(media.getKind() == MediaKind.LINK ? media.getReference() : null)
                .build();
    }
}
