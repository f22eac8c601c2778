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

/**
 * Short text shown as a conversation's last message.
 */
final class MessagePreview {

    private static final int MAX_LENGTH = 200;

    private MessagePreview() {
    }

    static String of(MessageRecord message) {
        String content = message.getContent();
        if ((content == null || content.isBlank()) && message.getMedia() != null
                && message.getMedia().getKind() != null) {
            return message.getMedia().getKind().getLabel();
        }
        if (content == null) {
            return "";
        }
        return content.length() <= MAX_LENGTH ? content : content.substring(0, MAX_LENGTH) + "...";
    }
}
