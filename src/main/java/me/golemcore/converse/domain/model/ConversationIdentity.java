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

import java.util.Objects;

/**
 * Canonical identity of a conversation partner for one owner. Two inbound
 * events belong to the same conversation exactly when their identities are
 * equal.
 *
 * @param channelAddress
 *            the raw address as delivered by the channel
 * @param normalizedAddress
 *            canonical key; group addresses carry the {@code group:} prefix
 * @param ownerId
 *            the account operating the bot
 * @param group
 *            whether the address denotes a group chat
 */
public record ConversationIdentity(String channelAddress, String normalizedAddress, String ownerId, boolean group) {

    public ConversationIdentity {
        Objects.requireNonNull(normalizedAddress, "normalizedAddress");
        Objects.requireNonNull(ownerId, "ownerId");
    }

    public IdentityKey key() {
        return new IdentityKey(ownerId, normalizedAddress);
    }

    /**
     * Equality key used for memory indexes and run serialization.
     */
    public record IdentityKey(String ownerId, String normalizedAddress) {

        public IdentityKey {
            Objects.requireNonNull(ownerId, "ownerId");
            Objects.requireNonNull(normalizedAddress, "normalizedAddress");
        }
    }
}
