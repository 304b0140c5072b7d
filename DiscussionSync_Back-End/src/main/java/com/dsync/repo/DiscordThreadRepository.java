package com.dsync.repo;

import com.dsync.repo.domain.ForumThread;
import com.dsync.repo.domain.SyncMessage;
import com.dsync.service.MessageTransformer;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Repository;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link ThreadRepository} backed by the Discord REST API (v10).
 * <p>
 * Only the active threads of the forum are listed: archived threads come back into play as soon
 * as someone posts in them, which also triggers a sync through the gateway.
 */
@Repository
public class DiscordThreadRepository implements ThreadRepository {

    private static final Logger log = LoggerFactory.getLogger(DiscordThreadRepository.class);

    static final int PAGE_SIZE = 100;

    static final int MAX_THREAD_NAME_LENGTH = 100;

    // announcement, public and private threads
    private static final Set<Integer> THREAD_TYPES = Set.of(10, 11, 12);

    // default and reply messages; pins, renames and other system messages are not part of a conversation
    private static final Set<Integer> CONVERSATION_MESSAGE_TYPES = Set.of(0, 19);

    private final RestTemplate restTemplate;

    private final MessageTransformer transformer;

    private final String apiUrl;

    private final String webUrl;

    private final Map<String, String> guildIdByChannel = new HashMap<>();

    private volatile String currentUserId;

    public DiscordThreadRepository(@Qualifier("discordRestTemplate") RestTemplate restTemplate,
                                   MessageTransformer transformer,
                                   @Value("${discord.api.url:https://discord.com/api/v10}") String apiUrl,
                                   @Value("${discord.web.url:https://discord.com}") String webUrl) {
        this.restTemplate = restTemplate;
        this.transformer = transformer;
        this.apiUrl = apiUrl;
        this.webUrl = webUrl;
    }

    @Override
    public List<ForumThread> listThreads(String forumChannelId) {
        String guildId = guildIdOf(forumChannelId);
        JsonNode response = get(apiUrl + "/guilds/" + guildId + "/threads/active");

        List<ForumThread> threads = new ArrayList<>();
        for (JsonNode channel : response.path("threads")) {
            if (forumChannelId.equals(channel.path("parent_id").asText(null))) {
                threads.add(toThread(channel));
            }
        }
        log.debug("Listed {} active threads of forum {}", threads.size(), forumChannelId);
        return threads;
    }

    @Override
    public Optional<ForumThread> findThread(String threadId) {
        JsonNode channel;
        try {
            channel = get(apiUrl + "/channels/" + threadId);
        } catch (CollaboratorException e) {
            if (e.isNotFound()) {
                return Optional.empty();
            }
            throw e;
        }
        if (!THREAD_TYPES.contains(channel.path("type").asInt(-1))) {
            return Optional.empty();
        }
        return Optional.of(toThread(channel));
    }

    @Override
    public List<SyncMessage> listThreadMessages(String threadId) {
        String selfId = currentUserId();
        List<JsonNode> newestFirst = new ArrayList<>();
        String before = null;
        while (true) {
            UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(apiUrl + "/channels/" + threadId + "/messages")
                    .queryParam("limit", PAGE_SIZE);
            if (before != null) {
                uri.queryParam("before", before);
            }
            JsonNode page = get(uri.toUriString());
            for (JsonNode message : page) {
                newestFirst.add(message);
            }
            if (page.size() < PAGE_SIZE) {
                break;
            }
            before = page.get(page.size() - 1).path("id").asText();
        }
        Collections.reverse(newestFirst);

        List<SyncMessage> messages = new ArrayList<>();
        for (JsonNode message : newestFirst) {
            String id = message.path("id").asText();
            // the starter message of a forum post shares the id of the thread
            if (id.equals(threadId)) {
                continue;
            }
            if (!CONVERSATION_MESSAGE_TYPES.contains(message.path("type").asInt(0))) {
                continue;
            }
            String content = contentOf(message);
            boolean ownMessage = selfId.equals(message.path("author").path("id").asText());
            boolean mirrored = transformer.hasAttributionHeader(content);
            // replies of the bot itself, such as failure notices, have no counterpart
            if (ownMessage && !mirrored) {
                continue;
            }
            messages.add(toMessage(message, content, mirrored, messages.size()));
        }
        return messages;
    }

    @Override
    public Optional<SyncMessage> findSeedMessage(String threadId) {
        JsonNode message;
        try {
            message = get(apiUrl + "/channels/" + threadId + "/messages/" + threadId);
        } catch (CollaboratorException e) {
            if (e.isNotFound()) {
                return Optional.empty();
            }
            throw e;
        }
        String content = contentOf(message);
        return Optional.of(toMessage(message, content, transformer.hasAttributionHeader(content), -1));
    }

    @Override
    public ForumThread createThread(String forumChannelId, String title, String seedBody) {
        Map<String, Object> message = new HashMap<>();
        message.put("content", seedBody);
        message.put("allowed_mentions", noMentions());

        Map<String, Object> request = new HashMap<>();
        request.put("name", threadName(title));
        request.put("message", message);

        JsonNode channel = post(apiUrl + "/channels/" + forumChannelId + "/threads", request);
        ForumThread thread = toThread(channel);
        if (thread.getGuildId() == null) {
            thread.setGuildId(guildIdOf(forumChannelId));
        }
        log.info("Created thread {} ({}) in forum {}", thread.getId(), thread.getName(), forumChannelId);
        return thread;
    }

    @Override
    public SyncMessage sendThreadMessage(String threadId, String body) {
        Map<String, Object> request = new HashMap<>();
        request.put("content", body);
        request.put("allowed_mentions", noMentions());

        JsonNode message = post(apiUrl + "/channels/" + threadId + "/messages", request);
        return toMessage(message, contentOf(message), true, -1);
    }

    @Override
    public String currentUserId() {
        String id = currentUserId;
        if (id == null) {
            id = get(apiUrl + "/users/@me").path("id").asText();
            currentUserId = id;
            log.info("Logged in to Discord as user {}", id);
        }
        return id;
    }

    @Override
    public String messageUrl(ForumThread thread, String messageId) {
        String guildId = thread.getGuildId() != null ? thread.getGuildId() : guildIdOf(thread.getParentId());
        return webUrl + "/channels/" + guildId + "/" + thread.getId() + "/" + messageId;
    }

    static String threadName(String title) {
        String name = title == null || title.isBlank() ? "Untitled discussion" : title.strip();
        if (name.length() <= MAX_THREAD_NAME_LENGTH) {
            return name;
        }
        return name.substring(0, MAX_THREAD_NAME_LENGTH - 3) + "...";
    }

    private String guildIdOf(String channelId) {
        synchronized (guildIdByChannel) {
            String cached = guildIdByChannel.get(channelId);
            if (cached != null) {
                return cached;
            }
        }
        String guildId = get(apiUrl + "/channels/" + channelId).path("guild_id").asText(null);
        if (guildId == null) {
            throw new CollaboratorException(CollaboratorException.Kind.INVALID_RESPONSE,
                    "Channel " + channelId + " is not part of a guild");
        }
        synchronized (guildIdByChannel) {
            guildIdByChannel.put(channelId, guildId);
        }
        return guildId;
    }

    private JsonNode get(String url) {
        return exchange(url, HttpMethod.GET, new HttpEntity<>(jsonHeaders()));
    }

    private JsonNode post(String url, Map<String, Object> body) {
        return exchange(url, HttpMethod.POST, new HttpEntity<>(body, jsonHeaders()));
    }

    private JsonNode exchange(String url, HttpMethod method, HttpEntity<?> entity) {
        ResponseEntity<JsonNode> response;
        try {
            response = restTemplate.exchange(url, method, entity, JsonNode.class);
        } catch (HttpClientErrorException.TooManyRequests e) {
            throw new CollaboratorException(CollaboratorException.Kind.TRANSIENT,
                    "Discord rate limit hit on " + method + " " + url, e);
        } catch (HttpStatusCodeException e) {
            throw CollaboratorException.fromStatus(e.getStatusCode().value(),
                    "Discord API call " + method + " " + url + " failed", e);
        } catch (ResourceAccessException e) {
            throw new CollaboratorException(CollaboratorException.Kind.TRANSIENT,
                    "Discord API unreachable: " + e.getMessage(), e);
        }
        JsonNode body = response.getBody();
        if (body == null) {
            throw new CollaboratorException(CollaboratorException.Kind.INVALID_RESPONSE,
                    "Empty Discord API response for " + method + " " + url);
        }
        return body;
    }

    private static HttpHeaders jsonHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return headers;
    }

    // mirrored text must never ping @everyone or roles
    private static Map<String, Object> noMentions() {
        Map<String, Object> allowedMentions = new HashMap<>();
        allowedMentions.put("parse", List.of());
        return allowedMentions;
    }

    private ForumThread toThread(JsonNode channel) {
        return new ForumThread(
                channel.path("id").asText(),
                channel.path("name").asText(""),
                channel.path("parent_id").asText(null),
                channel.path("guild_id").asText(null));
    }

    private static SyncMessage toMessage(JsonNode message, String content, boolean mirrored, int position) {
        JsonNode author = message.path("author");
        String handle = author.path("username").asText(null);
        return new SyncMessage(message.path("id").asText(), handle, content, mirrored, position);
    }

    /**
     * Message text with the URL of each attachment on its own line.
     */
    private static String contentOf(JsonNode message) {
        StringBuilder content = new StringBuilder(message.path("content").asText(""));
        for (JsonNode attachment : message.path("attachments")) {
            String url = attachment.path("url").asText(null);
            if (url == null) {
                continue;
            }
            if (content.length() > 0) {
                content.append('\n');
            }
            content.append(url);
        }
        return content.toString();
    }
}
