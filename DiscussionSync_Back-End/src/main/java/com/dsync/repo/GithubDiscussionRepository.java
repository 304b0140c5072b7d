package com.dsync.repo;

import com.dsync.config.SyncConfigurationException;
import com.dsync.repo.domain.Discussion;
import com.dsync.repo.domain.SyncMessage;
import com.dsync.service.MessageTransformer;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Repository;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link DiscussionRepository} backed by the GitHub GraphQL API.
 */
@Repository
public class GithubDiscussionRepository implements DiscussionRepository {

    private static final Logger log = LoggerFactory.getLogger(GithubDiscussionRepository.class);

    static final int PAGE_SIZE = 100;

    private static final String GHOST = "ghost";

    private static final String DISCUSSION_FIELDS =
            "id number title body url author { login } category { name }";

    private static final String REPOSITORY_QUERY =
            "query($owner: String!, $name: String!) {"
                    + " repository(owner: $owner, name: $name) {"
                    + " id hasDiscussionsEnabled"
                    + " discussionCategories(first: 100) { nodes { id name } } } }";

    private static final String DISCUSSIONS_QUERY =
            "query($owner: String!, $name: String!, $categoryId: ID!, $cursor: String) {"
                    + " repository(owner: $owner, name: $name) {"
                    + " discussions(categoryId: $categoryId, first: " + PAGE_SIZE + ", after: $cursor,"
                    + " orderBy: {field: CREATED_AT, direction: ASC}) {"
                    + " nodes { " + DISCUSSION_FIELDS + " }"
                    + " pageInfo { hasNextPage endCursor } } } }";

    private static final String COMMENTS_QUERY =
            "query($owner: String!, $name: String!, $number: Int!, $cursor: String) {"
                    + " repository(owner: $owner, name: $name) {"
                    + " discussion(number: $number) {"
                    + " comments(first: " + PAGE_SIZE + ", after: $cursor) {"
                    + " nodes { id body url author { login } }"
                    + " pageInfo { hasNextPage endCursor } } } } }";

    private static final String CREATE_DISCUSSION_MUTATION =
            "mutation($repositoryId: ID!, $categoryId: ID!, $title: String!, $body: String!) {"
                    + " createDiscussion(input: {repositoryId: $repositoryId, categoryId: $categoryId,"
                    + " title: $title, body: $body}) {"
                    + " discussion { " + DISCUSSION_FIELDS + " } } }";

    private static final String ADD_COMMENT_MUTATION =
            "mutation($discussionId: ID!, $body: String!) {"
                    + " addDiscussionComment(input: {discussionId: $discussionId, body: $body}) {"
                    + " comment { id body url author { login } } } }";

    private static final String UPDATE_DISCUSSION_MUTATION =
            "mutation($discussionId: ID!, $body: String!) {"
                    + " updateDiscussion(input: {discussionId: $discussionId, body: $body}) {"
                    + " discussion { id } } }";

    private final RestTemplate restTemplate;

    private final MessageTransformer transformer;

    private final String owner;

    private final String repo;

    private final String apiUrl;

    private final String webUrl;

    private volatile String repositoryId;

    public GithubDiscussionRepository(@Qualifier("githubRestTemplate") RestTemplate restTemplate,
                                      MessageTransformer transformer,
                                      @Value("${github.owner:}") String owner,
                                      @Value("${github.repo:}") String repo,
                                      @Value("${github.api.url:https://api.github.com/graphql}") String apiUrl,
                                      @Value("${github.web.url:https://github.com}") String webUrl) {
        this.restTemplate = restTemplate;
        this.transformer = transformer;
        this.owner = owner;
        this.repo = repo;
        this.apiUrl = apiUrl;
        this.webUrl = webUrl;
    }

    /**
     * Also checks that the repository exists and has discussions enabled.
     */
    @Override
    public String resolveCategoryId(String categoryName) {
        JsonNode repository = fetchRepository();
        if (!repository.path("hasDiscussionsEnabled").asBoolean(false)) {
            throw new SyncConfigurationException("Discussions are not enabled on " + owner + "/" + repo);
        }

        List<String> available = new ArrayList<>();
        for (JsonNode category : repository.path("discussionCategories").path("nodes")) {
            String name = category.path("name").asText();
            if (name.equals(categoryName)) {
                log.info("Discussion category '{}' of {}/{} resolved to {}", categoryName, owner, repo,
                        category.path("id").asText());
                return category.path("id").asText();
            }
            available.add(name);
        }
        throw new SyncConfigurationException("Discussion category '" + categoryName + "' not found in "
                + owner + "/" + repo + ", available categories: " + available);
    }

    @Override
    public List<Discussion> listDiscussions(String categoryId) {
        List<Discussion> discussions = new ArrayList<>();
        String cursor = null;
        do {
            Map<String, Object> variables = repositoryVariables();
            variables.put("categoryId", categoryId);
            variables.put("cursor", cursor);
            JsonNode connection = execute(DISCUSSIONS_QUERY, variables)
                    .path("repository").path("discussions");
            if (connection.isMissingNode() || connection.isNull()) {
                throw new CollaboratorException(CollaboratorException.Kind.INVALID_RESPONSE,
                        "No discussions connection returned for " + owner + "/" + repo);
            }
            for (JsonNode node : connection.path("nodes")) {
                discussions.add(toDiscussion(node));
            }
            cursor = nextCursor(connection);
        } while (cursor != null);

        log.debug("Listed {} discussions of category {}", discussions.size(), categoryId);
        return discussions;
    }

    @Override
    public List<SyncMessage> listComments(int discussionNumber) {
        List<SyncMessage> comments = new ArrayList<>();
        String cursor = null;
        do {
            Map<String, Object> variables = repositoryVariables();
            variables.put("number", discussionNumber);
            variables.put("cursor", cursor);
            JsonNode discussion = execute(COMMENTS_QUERY, variables).path("repository").path("discussion");
            if (discussion.isMissingNode() || discussion.isNull()) {
                throw new CollaboratorException(CollaboratorException.Kind.NOT_FOUND,
                        "Discussion #" + discussionNumber + " not found in " + owner + "/" + repo);
            }
            JsonNode connection = discussion.path("comments");
            for (JsonNode node : connection.path("nodes")) {
                comments.add(toMessage(node, comments.size()));
            }
            cursor = nextCursor(connection);
        } while (cursor != null);
        return comments;
    }

    @Override
    public Discussion createDiscussion(String categoryId, String title, String body) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("repositoryId", getRepositoryId());
        variables.put("categoryId", categoryId);
        variables.put("title", title);
        variables.put("body", body);
        JsonNode discussion = execute(CREATE_DISCUSSION_MUTATION, variables)
                .path("createDiscussion").path("discussion");
        if (discussion.isMissingNode() || discussion.isNull()) {
            throw new CollaboratorException(CollaboratorException.Kind.INVALID_RESPONSE,
                    "createDiscussion returned no discussion");
        }
        return toDiscussion(discussion);
    }

    @Override
    public SyncMessage addComment(String discussionId, String body) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("discussionId", discussionId);
        variables.put("body", body);
        JsonNode comment = execute(ADD_COMMENT_MUTATION, variables).path("addDiscussionComment").path("comment");
        if (comment.isMissingNode() || comment.isNull()) {
            throw new CollaboratorException(CollaboratorException.Kind.INVALID_RESPONSE,
                    "addDiscussionComment returned no comment");
        }
        return toMessage(comment, -1);
    }

    @Override
    public void updateDiscussionBody(String discussionId, String newBody) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("discussionId", discussionId);
        variables.put("body", newBody);
        execute(UPDATE_DISCUSSION_MUTATION, variables);
    }

    @Override
    public String discussionUrl(int discussionNumber) {
        return webUrl + "/" + owner + "/" + repo + "/discussions/" + discussionNumber;
    }

    private JsonNode fetchRepository() {
        JsonNode repository = execute(REPOSITORY_QUERY, repositoryVariables()).path("repository");
        if (repository.isMissingNode() || repository.isNull()) {
            throw new CollaboratorException(CollaboratorException.Kind.NOT_FOUND,
                    "Repository " + owner + "/" + repo + " not found");
        }
        repositoryId = repository.path("id").asText();
        return repository;
    }

    private String getRepositoryId() {
        String id = repositoryId;
        if (id == null) {
            id = fetchRepository().path("id").asText();
        }
        return id;
    }

    private Map<String, Object> repositoryVariables() {
        Map<String, Object> variables = new HashMap<>();
        variables.put("owner", owner);
        variables.put("name", repo);
        return variables;
    }

    /**
     * Posts a GraphQL document and returns its {@code data} node.
     */
    private JsonNode execute(String query, Map<String, Object> variables) {
        Map<String, Object> request = new HashMap<>();
        request.put("query", query);
        request.put("variables", variables);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<JsonNode> response;
        try {
            response = restTemplate.postForEntity(apiUrl, new HttpEntity<>(request, headers), JsonNode.class);
        } catch (HttpStatusCodeException e) {
            throw CollaboratorException.fromStatus(e.getStatusCode().value(),
                    "GitHub API call failed: " + e.getStatusText(), e);
        } catch (ResourceAccessException e) {
            throw new CollaboratorException(CollaboratorException.Kind.TRANSIENT,
                    "GitHub API unreachable: " + e.getMessage(), e);
        }

        JsonNode root = response.getBody();
        if (root == null) {
            throw new CollaboratorException(CollaboratorException.Kind.INVALID_RESPONSE, "Empty GitHub API response");
        }
        JsonNode errors = root.path("errors");
        if (errors.isArray() && errors.size() > 0) {
            JsonNode first = errors.get(0);
            String message = "GitHub API error: " + first.path("message").asText("unknown error");
            throw new CollaboratorException(errorKind(first.path("type").asText("")), message);
        }
        return root.path("data");
    }

    private static CollaboratorException.Kind errorKind(String type) {
        switch (type) {
            case "NOT_FOUND":
                return CollaboratorException.Kind.NOT_FOUND;
            case "FORBIDDEN":
            case "INSUFFICIENT_SCOPES":
                return CollaboratorException.Kind.PERMISSION_DENIED;
            case "RATE_LIMITED":
                return CollaboratorException.Kind.TRANSIENT;
            default:
                return CollaboratorException.Kind.INVALID_RESPONSE;
        }
    }

    private static String nextCursor(JsonNode connection) {
        JsonNode pageInfo = connection.path("pageInfo");
        if (pageInfo.path("hasNextPage").asBoolean(false)) {
            return pageInfo.path("endCursor").asText(null);
        }
        return null;
    }

    private Discussion toDiscussion(JsonNode node) {
        Discussion discussion = new Discussion(
                node.path("id").asText(),
                node.path("number").asInt(),
                node.path("title").asText(""),
                node.path("body").asText(""),
                authorOf(node),
                node.path("category").path("name").asText(null));
        discussion.setUrl(node.path("url").asText(null));
        return discussion;
    }

    private SyncMessage toMessage(JsonNode node, int position) {
        String body = node.path("body").asText("");
        SyncMessage message = new SyncMessage(node.path("id").asText(), authorOf(node), body,
                transformer.hasAttributionHeader(body), position);
        message.setUrl(node.path("url").asText(null));
        return message;
    }

    // deleted accounts come back with a null author
    private static String authorOf(JsonNode node) {
        JsonNode login = node.path("author").path("login");
        return login.isTextual() ? login.asText() : GHOST;
    }
}
