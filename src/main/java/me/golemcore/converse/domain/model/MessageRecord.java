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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single persisted turn.
 *
 * <p>
 * {@code sequenceNumber} is assigned by the durable tier on insertion and is
 * strictly increasing within a conversation; {@code 0} marks a turn that only
 * exists in memory so far. Everything except {@code deliveryStatus} and its
 * error metadata is immutable once persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageRecord {

    public static final String META_ERROR = "error";
    public static final String META_ERROR_AT = "errorAt";
    public static final String META_EXTERNAL_ID = "externalId";

    private String id;
    private String conversationId;
    private long sequenceNumber;
    private String content;
    private MessageRole role;
    private MediaDescriptor media;
    private ReplyContext replyContext;
    private Instant createdAt;

    @Builder.Default
    private DeliveryStatus deliveryStatus = DeliveryStatus.PENDING;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @JsonIgnore
    public boolean isDurable() {
        return sequenceNumber > 0;
    }

    public MessageRecord copy() {
        return new MessageRecord(id, conversationId, sequenceNumber, content, role, media, replyContext,
                createdAt, deliveryStatus, metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>());
    }
}
