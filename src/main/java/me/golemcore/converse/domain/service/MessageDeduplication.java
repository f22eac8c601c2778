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

import me.golemcore.converse.domain.model.MessageRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Duplicate detection for double-delivered events: two messages are the same
 * turn if they share an id, or carry identical content created within a short
 * window of each other.
 */
final class MessageDeduplication {

    private MessageDeduplication() {
    }

    static boolean isDuplicate(MessageRecord existing, MessageRecord candidate, Duration window) {
        if (existing.getId() != null && existing.getId().equals(candidate.getId())) {
            return true;
        }
        return isSameContentWithin(existing, candidate, window);
    }

    static boolean isSameContentWithin(MessageRecord existing, MessageRecord candidate, Duration window) {
        if (existing.getRole() != candidate.getRole()
                || !Objects.equals(existing.getContent(), candidate.getContent())) {
            return false;
        }
        if (existing.getContent() == null || existing.getContent().isEmpty()) {
            // media-only turns have no content to compare
            return false;
        }
        return withinWindow(existing.getCreatedAt(), candidate.getCreatedAt(), window);
    }

    static boolean withinWindow(Instant a, Instant b, Duration window) {
        if (a == null || b == null) {
            return false;
        }
        return Duration.between(a, b).abs().compareTo(window) <= 0;
    }
}
