package com.dsync.service;

import com.dsync.repo.domain.SyncDirection;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text transformations applied to every message mirrored from one platform to the other.
 * <p>
 * All methods are pure. {@link #imageNormalize} is not idempotent: the orchestrator calls each
 * transformation exactly once per outgoing message.
 */
@Component
public class MessageTransformer {

    public static final String CONTINUATION_MARKER = "\n(continued...)";

    static final String SPEECH_BALLOON = "\uD83D\uDCAC";

    static final String GENERIC_IMAGE_LABEL = "Image";

    private static final Pattern ATTRIBUTION_HEADER = Pattern.compile(
            "^" + SPEECH_BALLOON + " \\*\\*[^\\n]*?\\*\\* on \\[(?:GitHub|Discord)]\\([^\\n]*\\) wrote:");

    private static final String ATTACHMENT_URL = "https://github\\.com/user-attachments/assets/[A-Za-z0-9-]+";

    // GitHub markdown -> Discord, one alternative per token kind
    private static final Pattern TO_DISCORD_TOKENS = Pattern.compile(
            "(?<mdImage>!\\[[^\\]\\n]*]\\((?<mdUrl>https?://[^\\s)]+)(?:\\s+\"[^\"\\n]*\")?\\))"
                    + "|(?<html><img\\b[^>]*>)"
                    + "|(?<attachment>" + ATTACHMENT_URL + ")",
            Pattern.CASE_INSENSITIVE);

    // Discord -> GitHub markdown. Existing markdown images, links and <url> are copied as they are.
    private static final Pattern TO_GITHUB_TOKENS = Pattern.compile(
            "(?<verbatim>!\\[[^\\]\\n]*]\\([^)\\s]+(?:\\s+\"[^\"\\n]*\")?\\)"
                    + "|\\[[^\\]\\n]*]\\([^)\\s]+\\)"
                    + "|<https?://[^>\\s]+>)"
                    + "|(?<html><img\\b[^>]*>)"
                    + "|(?<url>https?://[^\\s<>\\[\\]()]*[^\\s<>\\[\\]().,;:!?'\"])",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern SRC_ATTRIBUTE = Pattern.compile(
            "\\bsrc\\s*=\\s*[\"'](https?://[^\"']+)[\"']", Pattern.CASE_INSENSITIVE);

    private static final Pattern ALT_ATTRIBUTE = Pattern.compile(
            "\\balt\\s*=\\s*[\"']([^\"']*)[\"']", Pattern.CASE_INSENSITIVE);

    private static final Pattern IMAGE_URL = Pattern.compile(
            "^(?:" + ATTACHMENT_URL + "|https?://[^\\s?#]+\\.(?:png|jpe?g|gif|webp|bmp|svg)(?:[?#]\\S*)?)$",
            Pattern.CASE_INSENSITIVE);

    /**
     * Prefix line naming the source platform, the author and a link back to the original.
     */
    public String attributionHeader(SyncDirection direction, String authorHandle, String backLinkUrl) {
        String author = sanitizeAuthor(authorHandle);
        String url = backLinkUrl == null ? "" : backLinkUrl;
        switch (direction) {
            case GITHUB_TO_DISCORD:
                // <...> keeps Discord from rendering a preview of the GitHub page
                return SPEECH_BALLOON + " **" + author + "** on [GitHub](<" + url + ">) wrote:\n";
            case DISCORD_TO_GITHUB:
                return SPEECH_BALLOON + " **" + author + "** on [Discord](" + url + ") wrote:\n\n";
            default:
                throw new IllegalArgumentException("No attribution header for direction " + direction);
        }
    }

    /**
     * True when the text starts with a header produced by {@link #attributionHeader}.
     */
    public boolean hasAttributionHeader(String text) {
        return text != null && ATTRIBUTION_HEADER.matcher(text).find();
    }

    public String imageNormalize(SyncDirection direction, String body) {
        if (body == null || body.isEmpty()) {
            return "";
        }
        switch (direction) {
            case GITHUB_TO_DISCORD:
                return toDiscordImages(body);
            case DISCORD_TO_GITHUB:
                return toGithubImages(body);
            default:
                return body;
        }
    }

    /**
     * Joins header and body so that the result never exceeds {@code maxLength}.
     * Only the body is shortened, and {@link #CONTINUATION_MARKER} is appended when it is.
     */
    public String lengthClamp(String header, String body, int maxLength) {
        String safeHeader = header == null ? "" : header;
        String safeBody = body == null ? "" : body;
        if (maxLength <= 0) {
            return "";
        }
        if (safeHeader.length() + safeBody.length() <= maxLength) {
            return safeHeader + safeBody;
        }

        int bodyBudget = maxLength - safeHeader.length() - CONTINUATION_MARKER.length();
        if (bodyBudget >= 0) {
            return safeHeader + cut(safeBody, bodyBudget) + CONTINUATION_MARKER;
        }

        // the header alone does not leave room for the marker
        String whole = safeHeader + safeBody;
        if (maxLength >= CONTINUATION_MARKER.length()) {
            return cut(whole, maxLength - CONTINUATION_MARKER.length()) + CONTINUATION_MARKER;
        }
        return cut(whole, maxLength);
    }

    private String toDiscordImages(String body) {
        IsolatingBuilder out = new IsolatingBuilder();
        Matcher matcher = TO_DISCORD_TOKENS.matcher(body);
        int last = 0;
        while (matcher.find()) {
            out.appendText(body.substring(last, matcher.start()));
            if (matcher.group("mdImage") != null) {
                out.appendIsolated(matcher.group("mdUrl"));
            } else if (matcher.group("html") != null) {
                Matcher src = SRC_ATTRIBUTE.matcher(matcher.group("html"));
                if (src.find()) {
                    out.appendIsolated(src.group(1));
                } else {
                    out.appendText(matcher.group("html"));
                }
            } else {
                out.appendIsolated(matcher.group("attachment"));
            }
            last = matcher.end();
        }
        out.appendText(body.substring(last));
        return out.toString();
    }

    private String toGithubImages(String body) {
        StringBuilder out = new StringBuilder(body.length() + 32);
        Matcher matcher = TO_GITHUB_TOKENS.matcher(body);
        int last = 0;
        while (matcher.find()) {
            out.append(body, last, matcher.start());
            if (matcher.group("verbatim") != null) {
                out.append(matcher.group("verbatim"));
            } else if (matcher.group("html") != null) {
                String tag = matcher.group("html");
                Matcher src = SRC_ATTRIBUTE.matcher(tag);
                if (src.find()) {
                    Matcher alt = ALT_ATTRIBUTE.matcher(tag);
                    String label = alt.find() && !alt.group(1).isBlank() ? alt.group(1) : GENERIC_IMAGE_LABEL;
                    out.append(markdownImage(label, src.group(1)));
                } else {
                    out.append(tag);
                }
            } else {
                String url = matcher.group("url");
                out.append(isImageUrl(url) ? markdownImage(GENERIC_IMAGE_LABEL, url) : url);
            }
            last = matcher.end();
        }
        out.append(body, last, body.length());
        return out.toString();
    }

    boolean isImageUrl(String url) {
        return url != null && IMAGE_URL.matcher(url).matches();
    }

    private static String markdownImage(String label, String url) {
        return "![" + label.replace("]", "") + "](" + url + ")";
    }

    private static String sanitizeAuthor(String authorHandle) {
        if (authorHandle == null || authorHandle.isBlank()) {
            return "unknown";
        }
        return authorHandle.replace('\n', ' ').replace("**", "");
    }

    private static String cut(String value, int length) {
        if (value.length() <= length) {
            return value;
        }
        int end = length;
        if (end > 0 && Character.isHighSurrogate(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(0, end);
    }

    /**
     * Builder that keeps isolated URLs on a line of their own.
     */
    private static final class IsolatingBuilder {

        private final StringBuilder out = new StringBuilder();

        private boolean breakPending;

        void appendText(String text) {
            if (text.isEmpty()) {
                return;
            }
            if (breakPending && text.charAt(0) != '\n') {
                out.append('\n');
            }
            out.append(text);
            breakPending = false;
        }

        void appendIsolated(String url) {
            if (out.length() > 0 && out.charAt(out.length() - 1) != '\n') {
                out.append('\n');
            }
            out.append(url);
            breakPending = true;
        }

        @Override
        public String toString() {
            return out.toString();
        }
    }
}
