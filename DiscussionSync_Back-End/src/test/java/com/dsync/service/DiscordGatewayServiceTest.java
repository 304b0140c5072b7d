package com.dsync.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DiscordGatewayServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private TaskScheduler taskScheduler;
    private ApplicationEventPublisher eventPublisher;
    private WebSocketSession session;
    private DiscordGatewayService gateway;

    @BeforeEach
    void setUp() {
        taskScheduler = mock(TaskScheduler.class);
        eventPublisher = mock(ApplicationEventPublisher.class);
        session = mock(WebSocketSession.class);
        when(session.isOpen()).thenReturn(true);

        gateway = new DiscordGatewayService(mock(WebSocketClient.class), taskScheduler, eventPublisher, objectMapper);
        ReflectionTestUtils.setField(gateway, "token", "bot-token");
        ReflectionTestUtils.setField(gateway, "reconnectDelayMillis", 5000L);
        gateway.afterConnectionEstablished(session);
    }

    @Test
    void shouldIdentifyAndStartHeartbeatOnHello() throws Exception {
        gateway.handleTextMessage(session, new TextMessage("{\"op\":10,\"d\":{\"heartbeat_interval\":41250}}"));

        verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), eq(Duration.ofMillis(41250)));
        ArgumentCaptor<TextMessage> sent = ArgumentCaptor.forClass(TextMessage.class);
        verify(session).sendMessage(sent.capture());
        JsonNode identify = objectMapper.readTree(sent.getValue().getPayload());
        assertEquals(2, identify.path("op").asInt());
        assertEquals("bot-token", identify.path("d").path("token").asText());
        assertEquals(33281, identify.path("d").path("intents").asInt());
    }

    @Test
    void shouldAnswerHeartbeatRequestWithLastSequence() throws Exception {
        gateway.handleTextMessage(session, new TextMessage("{\"op\":0,\"s\":12,\"t\":\"TYPING_START\",\"d\":{}}"));
        gateway.handleTextMessage(session, new TextMessage("{\"op\":1,\"d\":null}"));

        ArgumentCaptor<TextMessage> sent = ArgumentCaptor.forClass(TextMessage.class);
        verify(session).sendMessage(sent.capture());
        JsonNode heartbeat = objectMapper.readTree(sent.getValue().getPayload());
        assertEquals(1, heartbeat.path("op").asInt());
        assertEquals(12, heartbeat.path("d").asInt());
    }

    @Test
    void shouldPublishThreadCreation() throws Exception {
        gateway.handleTextMessage(session, new TextMessage("{\"op\":0,\"s\":3,\"t\":\"THREAD_CREATE\",\"d\":"
                + "{\"id\":\"1000\",\"name\":\"Help\",\"parent_id\":\"900\",\"guild_id\":\"7\","
                + "\"owner_id\":\"55\",\"newly_created\":true}}"));

        ArgumentCaptor<ThreadCreatedEvent> event = ArgumentCaptor.forClass(ThreadCreatedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertEquals("1000", event.getValue().getThread().getId());
        assertEquals("900", event.getValue().getThread().getParentId());
        assertEquals("55", event.getValue().getOwnerId());
        assertTrue(event.getValue().isNewlyCreated());
    }

    @Test
    void shouldPublishMessageCreation() throws Exception {
        gateway.handleTextMessage(session, new TextMessage("{\"op\":0,\"s\":4,\"t\":\"MESSAGE_CREATE\",\"d\":"
                + "{\"id\":\"1001\",\"channel_id\":\"1000\",\"content\":\"hi\","
                + "\"author\":{\"id\":\"55\",\"username\":\"alice\",\"bot\":false}}}"));

        ArgumentCaptor<ThreadMessageCreatedEvent> event = ArgumentCaptor.forClass(ThreadMessageCreatedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertEquals("1000", event.getValue().getChannelId());
        assertEquals("55", event.getValue().getAuthorId());
        assertFalse(event.getValue().isAuthorBot());
        assertEquals("hi", event.getValue().getContent());
    }

    @Test
    void shouldCloseSessionWhenReconnectIsRequested() throws Exception {
        gateway.handleTextMessage(session, new TextMessage("{\"op\":7,\"d\":null}"));

        verify(session).close(CloseStatus.SERVICE_RESTARTED);
    }

    @Test
    void shouldNotReconnectAfterInvalidToken() {
        gateway.afterConnectionClosed(session, new CloseStatus(4004, "Authentication failed"));

        verify(taskScheduler, never()).schedule(any(Runnable.class), any(Instant.class));
        assertFalse(gateway.isReady());
    }
}
