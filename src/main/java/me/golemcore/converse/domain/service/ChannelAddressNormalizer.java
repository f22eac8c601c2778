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

import me.golemcore.converse.domain.exception.IdentityNotResolvableException;
import me.golemcore.converse.domain.model.ConversationIdentity;
import me.golemcore.converse.domain.model.ConversationRecord;

import java.util.Comparator;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes channel addresses into conversation identity keys.
 *
 * <p>
 * Individual addresses normalize to their bare alphanumeric id, so
 * {@code "+237 691 234 567"}, {@code "237691234567@s.whatsapp.net"} and
 * {@code "237691234567:3@s.whatsapp.net"} all become {@code "237691234567"}.
 * Group addresses ({@code @g.us} suffix) normalize into the {@code group:}
 * namespace and can never collide with an individual.
 *
 * <p>
 * {@link #normalize(String)} is total and idempotent.
 */
public final class ChannelAddressNormalizer {

    public static final String GROUP_PREFIX = "group:";

    private static final String GROUP_SUFFIX = "@g.us";
    private static final String INDIVIDUAL_SUFFIX = "@s.whatsapp.net";
    private static final int MAX_ID_LENGTH = 64;

    private static final Pattern INDIVIDUAL_STRIP = Pattern.compile("[^a-z0-9]");
    private static final Pattern GROUP_STRIP = Pattern.compile("[^a-z0-9-]");

    private ChannelAddressNormalizer() {
    }

    public static String normalize(String rawAddress) {
        if (rawAddress == null) {
            return "";
        }
        String candidate = rawAddress.trim().toLowerCase(Locale.ROOT);
        boolean group = false;
        if (candidate.startsWith(GROUP_PREFIX)) {
            group = true;
            candidate = candidate.substring(GROUP_PREFIX.length());
        } else if (candidate.contains(GROUP_SUFFIX)) {
            group = true;
        }

        int at = candidate.indexOf('@');
        if (at >= 0) {
            candidate = candidate.substring(0, at);
        }
        if (!group) {
            // device suffix, e.g. 237691234567:3
            int colon = candidate.indexOf(':');
            if (colon >= 0) {
                candidate = candidate.substring(0, colon);
            }
            return INDIVIDUAL_STRIP.matcher(candidate).replaceAll("");
        }
        return GROUP_PREFIX + GROUP_STRIP.matcher(candidate).replaceAll("");
    }

    public static boolean isGroup(String address) {
        return normalize(address).startsWith(GROUP_PREFIX);
    }

    /**
     * Resolves a raw address into an identity for the given owner.
     *
     * @throws IdentityNotResolvableException
     *             if the owner is missing or the address has no usable id
     */
    public static ConversationIdentity resolve(String ownerId, String rawAddress) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IdentityNotResolvableException(rawAddress, "owner is missing");
        }
        String normalized = normalize(rawAddress);
        boolean group = normalized.startsWith(GROUP_PREFIX);
        String id = group ? normalized.substring(GROUP_PREFIX.length()) : normalized;
        if (id.isEmpty() || id.chars().noneMatch(Character::isLetterOrDigit)) {
            throw new IdentityNotResolvableException(rawAddress, "no usable id");
        }
        if (id.length() > MAX_ID_LENGTH) {
            throw new IdentityNotResolvableException(rawAddress, "id longer than " + MAX_ID_LENGTH);
        }
        return new ConversationIdentity(rawAddress, normalized, ownerId.trim(), group);
    }

    /**
     * Default display name when the channel did not supply a sender name.
     */
    public static String displayName(String normalizedAddress) {
        if (normalizedAddress.startsWith(GROUP_PREFIX)) {
            return "Group " + normalizedAddress.substring(GROUP_PREFIX.length());
        }
        return "+" + normalizedAddress;
    }

    /**
     * Maps a normalized address back to the channel's address format.
     */
    public static String toChannelAddress(String normalizedAddress) {
        if (normalizedAddress.startsWith(GROUP_PREFIX)) {
            return normalizedAddress.substring(GROUP_PREFIX.length()) + GROUP_SUFFIX;
        }
        return normalizedAddress + INDIVIDUAL_SUFFIX;
    }

    /**
     * Ordering for conversation lists: most recent activity first.
     */
    public static Comparator<ConversationRecord> byRecentActivity() {
        return Comparator.comparing(ConversationRecord::getLastMessageAt,
                Comparator.nullsLast(Comparator.reverseOrder()));
    }
}
