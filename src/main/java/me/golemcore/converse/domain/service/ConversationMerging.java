package me.golemcore.converse.domain.service;

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

import me.golemcore.converse.domain.model.ConversationRecord;

import java.time.Instant;

/**
 * Per-field last-writer-wins merge of two copies of one conversation.
 *
 * <p>
 * Identity fields ({@code id}, owner, address, creation time) always come from
 * the target. Every other field group is taken from whichever copy updated it
 * last, independently of the others, so a fresher unread counter in memory
 * never overwrites a fresher last message already committed durably.
 */
final class ConversationMerging {

    private ConversationMerging() {
    }

    static ConversationRecord merged(ConversationRecord base, ConversationRecord other) {
        ConversationRecord result = base.copy();
        mergeInto(result, other);
        return result;
    }

    static void mergeInto(ConversationRecord target, ConversationRecord other) {
        if (other == null) {
            return;
        }
        if (isNewer(other.getLastMessageAt(), target.getLastMessageAt())) {
            target.setLastMessageText(other.getLastMessageText());
            target.setLastMessageAt(other.getLastMessageAt());
        }
        if (isNewer(other.getUnreadUpdatedAt(), target.getUnreadUpdatedAt())) {
            target.setUnreadCount(other.getUnreadCount());
            target.setUnreadUpdatedAt(other.getUnreadUpdatedAt());
        }
        if (isNewer(other.getPresenceUpdatedAt(), target.getPresenceUpdatedAt())) {
            target.setOnline(other.isOnline());
            target.setPresenceUpdatedAt(other.getPresenceUpdatedAt());
        }
        if (isNewer(other.getUpdatedAt(), target.getUpdatedAt())) {
            if (other.getDisplayName() != null) {
                target.setDisplayName(other.getDisplayName());
            }
            if (other.getLinkedChannelSessionId() != null) {
                target.setLinkedChannelSessionId(other.getLinkedChannelSessionId());
            }
            target.setUpdatedAt(other.getUpdatedAt());
        }
        if (target.getDisplayName() == null) {
            target.setDisplayName(other.getDisplayName());
        }
        if (target.getLinkedChannelSessionId() == null) {
            target.setLinkedChannelSessionId(other.getLinkedChannelSessionId());
        }
    }

    private static boolean isNewer(Instant candidate, Instant current) {
        return candidate != null && (current == null || candidate.isAfter(current));
    }
}
