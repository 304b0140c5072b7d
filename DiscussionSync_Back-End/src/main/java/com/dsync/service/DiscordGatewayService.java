package com.dsync.service;

import com.dsync.repo.domain.ForumThread;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Connection to the Discord gateway. Thread and message creations are republished as Spring
 * application events ({@link ThreadCreatedEvent}, {@link ThreadMessageCreatedEvent}).
 * <p>
 * Sessions are not resumed: after a disconnect the service identifies again and the events
 * missed in between are only caught up by the next trigger of the affected pair.
 */
@Service
public class DiscordGatewayService extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(DiscordGatewayService.class);

    static final int OP_DISPATCH = 0;
    static final int OP_HEARTBEAT = 1;
    static final int OP_IDENTIFY = 2;
    static final int OP_RECONNECT = 7;
    static final int OP_INVALID_SESSION = 9;
    static final int OP_HELLO = 10;
    static final int OP_HEARTBEAT_ACK = 11;

    // GUILDS | GUILD_MESSAGES | MESSAGE_CONTENT
    static final int INTENTS = 1 | (1 << 9) | (1 << 15);

    private final WebSocketClient webSocketClient;

    private final TaskScheduler taskScheduler;

    private final ApplicationEventPublisher eventPublisher;

    private final ObjectMapper objectMapper;

    @Value("${discord.token:}")
    private String token;

    @Value("${discord.gateway.url:wss://gateway.discord.gg/?v=10&encoding=json}")
    private String gatewayUrl;

    @Value("${discord.gateway.reconnect-delay-ms:5000}")
    private long reconnectDelayMillis;

    private volatile WebSocketSession session;

    private volatile ScheduledFuture<?> heartbeatTask;

    private volatile Long lastSequence;

    private volatile boolean heartbeatAcked = true;

    private volatile boolean running;

    private volatile boolean ready;

    public DiscordGatewayService(@Qualifier("gatewayWebSocketClient") WebSocketClient webSocketClient,
                                 @Qualifier("gatewayTaskScheduler") TaskScheduler taskScheduler,
                                 ApplicationEventPublisher eventPublisher,
                                 ObjectMapper objectMapper) {
        this.webSocketClient = webSocketClient;
        this.taskScheduler = taskScheduler;
        this.eventPublisher = eventPublisher;
        this.objectMapper = objectMapper;
    }

    public void start() {
        if (running) {
            return;
        }
        running = true;
        connect();
    }

    @PreDestroy
    public void stop() {
        running = false;
        stopHeartbeat();
        closeSession(CloseStatus.NORMAL);
    }

    public boolean isConnected() {
        WebSocketSession current = session;
        return current != null && current.isOpen();
    }

    public boolean isReady() {
        return ready;
    }

    private void connect() {
        log.info("Connecting to Discord gateway {}", gatewayUrl);
        webSocketClient.execute(this, gatewayUrl).whenComplete((connected, error) -> {
            if (error != null) {
                log.error("Could not connect to Discord gateway: {}", error.getMessage());
                scheduleReconnect();
            }
        });
    }

    private void scheduleReconnect() {
        if (!running) {
            return;
        }
        log.info("Reconnecting to Discord gateway in {} ms", reconnectDelayMillis);
        taskScheduler.schedule(this::connect, Instant.now().plusMillis(reconnectDelayMillis));
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        this.session = session;
        this.heartbeatAcked = true;
        log.info("Discord gateway connection opened");
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws IOException {
        JsonNode payload = objectMapper.readTree(message.getPayload());
        JsonNode sequence = payload.path("s");
        if (sequence.isNumber()) {
            lastSequence = sequence.asLong();
        }

        int op = payload.path("op").asInt(-1);
        switch (op) {
            case OP_HELLO:
                startHeartbeat(payload.path("d").path("heartbeat_interval").asLong(41250));
                identify();
                break;
            case OP_HEARTBEAT_ACK:
                heartbeatAcked = true;
                break;
            case OP_HEARTBEAT:
                sendHeartbeat();
                break;
            case OP_RECONNECT:
                log.info("Discord gateway requested a reconnect");
                closeSession(CloseStatus.SERVICE_RESTARTED);
                break;
            case OP_INVALID_SESSION:
                log.warn("Discord gateway invalidated the session");
                closeSession(CloseStatus.SERVICE_RESTARTED);
                break;
            case OP_DISPATCH:
                dispatch(payload.path("t").asText(""), payload.path("d"));
                break;
            default:
                log.debug("Ignoring gateway opcode {}", op);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("Discord gateway transport error: {}", exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.warn("Discord gateway connection closed: {}", status);
        ready = false;
        stopHeartbeat();
        if (this.session == session) {
            this.session = null;
        }
        // 4004 is an invalid token, retrying cannot help
        if (status.getCode() == 4004) {
            log.error("Discord rejected the bot token, gateway disabled");
            running = false;
            return;
        }
        scheduleReconnect();
    }

    void dispatch(String type, JsonNode data) {
        switch (type) {
            case "READY":
                ready = true;
                log.info("Discord gateway ready as {}", data.path("user").path("username").asText("?"));
                break;
            case "THREAD_CREATE":
                ForumThread thread = new ForumThread(
                        data.path("id").asText(),
                        data.path("name").asText(""),
                        data.path("parent_id").asText(null),
                        data.path("guild_id").asText(null));
                eventPublisher.publishEvent(new ThreadCreatedEvent(this, thread,
                        data.path("owner_id").asText(null), data.path("newly_created").asBoolean(false)));
                break;
            case "MESSAGE_CREATE":
                JsonNode author = data.path("author");
                eventPublisher.publishEvent(new ThreadMessageCreatedEvent(this,
                        data.path("channel_id").asText(),
                        data.path("id").asText(),
                        author.path("id").asText(null),
                        author.path("bot").asBoolean(false),
                        data.path("content").asText("")));
                break;
            default:
                log.trace("Ignoring gateway dispatch {}", type);
        }
    }

    private void startHeartbeat(long intervalMillis) {
        stopHeartbeat();
        // first beat after a random fraction of the interval
        long firstDelay = (long) (intervalMillis * ThreadLocalRandom.current().nextDouble());
        heartbeatTask = taskScheduler.scheduleAtFixedRate(this::heartbeatTick,
                Instant.now().plusMillis(firstDelay), Duration.ofMillis(intervalMillis));
    }

    private void stopHeartbeat() {
        ScheduledFuture<?> task = heartbeatTask;
        if (task != null) {
            task.cancel(false);
            heartbeatTask = null;
        }
    }

    private void heartbeatTick() {
        if (!heartbeatAcked) {
            log.warn("No heartbeat acknowledgement from Discord, reconnecting");
            closeSession(CloseStatus.SESSION_NOT_RELIABLE);
            return;
        }
        heartbeatAcked = false;
        sendHeartbeat();
    }

    private void sendHeartbeat() {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("op", OP_HEARTBEAT);
        Long sequence = lastSequence;
        if (sequence == null) {
            payload.putNull("d");
        } else {
            payload.put("d", sequence);
        }
        send(payload);
    }

    private void identify() {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("op", OP_IDENTIFY);
        ObjectNode data = payload.putObject("d");
        data.put("token", token.trim());
        data.put("intents", INTENTS);
        ObjectNode properties = data.putObject("properties");
        properties.put("os", System.getProperty("os.name", "linux"));
        properties.put("browser", "discussion-sync");
        properties.put("device", "discussion-sync");
        send(payload);
    }

    private void send(JsonNode payload) {
        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            log.debug("Gateway session closed, dropping payload op {}", payload.path("op").asInt());
            return;
        }
        try {
            synchronized (current) {
                current.sendMessage(new TextMessage(objectMapper.writeValueAsString(payload)));
            }
        } catch (IOException e) {
            log.error("Could not send payload to Discord gateway: {}", e.getMessage());
        }
    }

    private void closeSession(CloseStatus status) {
        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            return;
        }
        try {
            current.close(status);
        } catch (IOException e) {
            log.warn("Error closing Discord gateway session: {}", e.getMessage());
        }
    }
}
