package com.dsync.config;

import jakarta.websocket.ContainerProvider;
import jakarta.websocket.WebSocketContainer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

/**
 * Threads and client used by the Discord gateway connection and the syncs it triggers.
 */
@Configuration
public class GatewayConfig {

    @Value("${discord.gateway.max-message-bytes:4194304}")
    private int maxMessageBytes;

    @Value("${sync.executor.pool-size:4}")
    private int syncPoolSize;

    @Value("${sync.executor.queue-capacity:500}")
    private int syncQueueCapacity;

    @Bean
    public WebSocketClient gatewayWebSocketClient() {
        // READY and GUILD_CREATE payloads are far larger than the default 8 KB buffer
        WebSocketContainer container = ContainerProvider.getWebSocketContainer();
        container.setDefaultMaxTextMessageBufferSize(maxMessageBytes);
        return new StandardWebSocketClient(container);
    }

    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler gatewayTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("gateway-");
        scheduler.initialize();
        return scheduler;
    }

    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor syncTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(syncPoolSize);
        executor.setMaxPoolSize(syncPoolSize);
        executor.setQueueCapacity(syncQueueCapacity);
        executor.setThreadNamePrefix("sync-");
        executor.initialize();
        return executor;
    }
}
