package me.golemcore.converse.domain.exception;

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

/**
 * Raised when a channel address cannot be turned into a conversation
 * identity. The inbound event is dropped.
 */
public class IdentityNotResolvableException extends RuntimeException {

    private final String rawAddress;

    public IdentityNotResolvableException(String rawAddress, String reason) {
        super("Cannot resolve identity from address '" + rawAddress + "': " + reason);
        this.rawAddress = rawAddress;
    }

    public String getRawAddress() {
        return rawAddress;
    }
}
