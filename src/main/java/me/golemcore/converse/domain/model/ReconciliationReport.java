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

import java.util.Map;

/**
 * Outcome of a duplicate-conversation reconciliation pass.
 *
 * @param ownerId
 *            owner that was reconciled, or {@code null} for a pass over all
 *            owners
 * @param mergedGroups
 *            number of addresses that had more than one conversation
 * @param messagesReparented
 *            messages moved onto canonical conversations
 * @param redirects
 *            superseded conversation id to canonical conversation id
 */
public record ReconciliationReport(String ownerId, int mergedGroups, int messagesReparented,
        Map<String, String> redirects) {

    public static ReconciliationReport empty(String ownerId) {
        return new ReconciliationReport(ownerId, 0, 0, Map.of());
    }

    public int conversationsRemoved() {
        return redirects.size();
    }
}
