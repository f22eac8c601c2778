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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.converse.domain.model.QuotaCheckResult;
import me.golemcore.converse.infrastructure.config.ConverseProperties;
import me.golemcore.converse.port.outbound.QuotaPort;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Pre-flight check of the owner's message quota.
 *
 * <p>
 * When the quota service cannot answer in time the gate fails open unless
 * {@code converse.quota.fail-open} is false.
 */
@Service
@Slf4j
public class QuotaGate {

    private final QuotaPort quotaPort;
    private final ConverseProperties properties;

    public QuotaGate(QuotaPort quotaPort, ConverseProperties properties) {
        this.quotaPort = quotaPort;
        this.properties = properties;
    }

    public QuotaCheckResult check(String ownerId) {
        ConverseProperties.QuotaProperties config = properties.getQuota();
        if (!config.isEnabled()) {
            return QuotaCheckResult.unlimited();
        }
        CompletableFuture<QuotaCheckResult> future = null;
        try {
            future = quotaPort.check(ownerId);
            QuotaCheckResult result = future.get(config.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return onFailure(ownerId, "empty response");
            }
            if (!result.isAllowed()) {
                log.info("[Quota] Owner {} reached the limit ({}/{})", ownerId, result.getCurrent(),
                        result.getLimit());
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return onFailure(ownerId, "interrupted");
        } catch (ExecutionException | TimeoutException e) {
            if (future != null) {
                future.cancel(true);
            }
            return onFailure(ownerId, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    public String limitReachedNotice() {
        return properties.getQuota().getLimitReachedMessage();
    }

    private QuotaCheckResult onFailure(String ownerId, String reason) {
        boolean failOpen = properties.getQuota().isFailOpen();
        log.warn("[Quota] Check failed for owner {} ({}), {}", ownerId, reason,
                failOpen ? "allowing" : "denying");
        return failOpen ? QuotaCheckResult.unlimited() : QuotaCheckResult.denied(0, 0);
    }
}
