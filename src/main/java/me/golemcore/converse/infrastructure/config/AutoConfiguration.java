package me.golemcore.converse.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.converse.port.inbound.ChannelPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure beans and startup logging.
 *
 * <p>
 * Provides the {@link Clock} every time-dependent component uses, the Jackson
 * {@link ObjectMapper} for durable documents and HTTP payloads, and the two
 * worker pools:
 * <ul>
 * <li>{@code conversationRunExecutor} - per-identity pipeline runs</li>
 * <li>{@code durableWriteExecutor} - asynchronous durable-tier writes</li>
 * </ul>
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final ConverseProperties properties;
    private final List<ChannelPort> channelPorts;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService conversationRunExecutor() {
        int threads = Math.max(1, properties.getPipeline().getWorkerThreads());
        return Executors.newFixedThreadPool(threads, daemonThreads("conversation-run"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService durableWriteExecutor() {
        int threads = Math.max(1, properties.getPersistence().getWriterThreads());
        return Executors.newFixedThreadPool(threads, daemonThreads("durable-writer"));
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Converse starting...");
        log.info("Generation model: {}", properties.getGeneration().getModel());
        log.info("Storage path: {}", properties.getStorage().getBasePath());
        log.info("Memory tier: ttl={}, maxConversations={}, maxMessagesPerConversation={}",
                properties.getMemory().getConversationTtl(),
                properties.getMemory().getMaxConversations(),
                properties.getMemory().getMaxMessagesPerConversation());
        for (ChannelPort channel : channelPorts) {
            log.info("Channel registered: {}", channel.getChannelType());
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
