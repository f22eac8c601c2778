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
 * A document of a knowledge base, already extracted to plain text by the
 * ingestion pipeline.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgeDocument {

    private String id;
    private String knowledgeBaseId;
    private String title;
    private String content;

    @Builder.Default
    private Status status = Status.PROCESSED;

    /**
     * {@code UPLOADED} documents already carry their raw text and are usable
     * before processing finishes.
     */
    public enum Status {
        PENDING, UPLOADED, PROCESSING, PROCESSED, FAILED;

        public boolean isSearchable() {
            return this == UPLOADED || this == PROCESSED;
        }
    }
}
