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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * A message received from the channel, before it is bound to a conversation.
 * {@code messageId} is the channel's own id and stays the same when the
 * channel redelivers the event.
 */
@Data
@Builder
public class InboundMessage {

    private String messageId;
    private String ownerId;
    private String channelSessionId;
    private String rawAddress;
    private String senderName;
    private String content;
    private MediaDescriptor media;
    private ReplyContext replyContext;
    private Instant timestamp;

    public boolean hasMedia() {
        return media != null && media.getKind() != null;
    }
}
