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

/**
 * A conversation between an owner and one channel address.
 *
 * <p>
 * The same record lives in two tiers: the durable copy is the source of truth
 * for identity, the memory copy may carry fresher values for individual
 * fields. Each mutable field group has its own timestamp so that both copies
 * can be merged field by field:
 * <ul>
 * <li>{@code lastMessageText} - {@code lastMessageAt}</li>
 * <li>{@code unreadCount} - {@code unreadUpdatedAt}</li>
 * <li>{@code online} - {@code presenceUpdatedAt}</li>
 * <li>{@code displayName}, {@code linkedChannelSessionId} -
 * {@code updatedAt}</li>
 * </ul>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationRecord {

    private String id;
    private String ownerId;
    private String normalizedAddress;
    private String displayName;
    private boolean group;

    private String lastMessageText;
    private Instant lastMessageAt;

    private int unreadCount;
    private Instant unreadUpdatedAt;

    private boolean online;
    private Instant presenceUpdatedAt;

    private String linkedChannelSessionId;

    private Instant createdAt;
    private Instant updatedAt;

    @JsonIgnore
    public ConversationIdentity.IdentityKey identityKey() {
        return new ConversationIdentity.IdentityKey(ownerId, normalizedAddress);
    }

    public ConversationRecord copy() {
        return new ConversationRecord(id, ownerId, normalizedAddress, displayName, group,
                lastMessageText, lastMessageAt, unreadCount, unreadUpdatedAt, online, presenceUpdatedAt,
                linkedChannelSessionId, createdAt, updatedAt);
    }
}
