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

/**
 * Result of a pre-flight quota check.
 *
 * <p>
 * {@code limit} and {@code current} are {@code null} when the owner has no
 * limit. Factory methods {@link #unlimited()}, {@link #allowed(long, long)} and
 * {@link #denied(long, long)} cover the common shapes.
 */
@Data
@Builder
public class QuotaCheckResult {

    private boolean allowed;
    private Long limit;
    private Long current;
    private Long remaining;

    public static QuotaCheckResult unlimited() {
        return QuotaCheckResult.builder()
                .allowed(true)
                .build();
    }

    public static QuotaCheckResult allowed(long limit, long current) {
        return QuotaCheckResult.builder()
                .allowed(true)
                .limit(limit)
                .current(current)
                .remaining(Math.max(0, limit - current))
                .build();
    }

    public static QuotaCheckResult denied(long limit, long current) {
        return QuotaCheckResult.builder()
                .allowed(false)
                .limit(limit)
                .current(current)
                .remaining(0L)
                .build();
    }
}
