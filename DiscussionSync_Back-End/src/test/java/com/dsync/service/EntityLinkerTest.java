package com.dsync.service;

import com.dsync.repo.ThreadRepository;
import com.dsync.repo.domain.Discussion;
import com.dsync.repo.domain.ForumThread;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EntityLinkerTest {

    private ThreadRepository threadRepository;
    private DiscussionListingCache cache;
    private EntityLinker linker;

    @BeforeEach
    void setUp() {
        threadRepository = mock(ThreadRepository.class);
        cache = mock(DiscussionListingCache.class);
        linker = new EntityLinker(threadRepository, cache, new SyncContext("900", "General", false));
    }

    private static Discussion discussion(String id, String body) {
        return new Discussion(id, 1, "title", body, "octocat", "General");
    }

    @Test
    void shouldExtractThreadIdFromMarker() {
        assertEquals(Optional.of("123456789"),
                EntityLinker.extractThreadId("Some text\n\n<!-- Discord:123456789 -->"));
    }

    @Test
    void shouldIgnoreMissingOrMalformedMarker() {
        assertTrue(EntityLinker.extractThreadId("no marker").isEmpty());
        assertTrue(EntityLinker.extractThreadId("<!-- Discord:abc -->").isEmpty());
        assertTrue(EntityLinker.extractThreadId("<!--Discord:123-->").isEmpty());
        assertTrue(EntityLinker.extractThreadId(null).isEmpty());
    }

    @Test
    void shouldUseFirstOfSeveralMarkers() {
        assertEquals(Optional.of("1"),
                EntityLinker.extractThreadId("<!-- Discord:1 -->\ntext\n<!-- Discord:2 -->"));
    }

    @Test
    void shouldReplaceExistingMarkerWhenEmbedding() {
        assertEquals("body\n\n<!-- Discord:2 -->", EntityLinker.embedMarker("body\n\n<!-- Discord:1 -->", "2"));
        assertEquals("<!-- Discord:5 -->", EntityLinker.embedMarker("", "5"));
        assertEquals("<!-- Discord:5 -->", EntityLinker.embedMarker(null, "5"));
    }

    @Test
    void shouldStripMarkerAndTrailingBlankLines() {
        assertEquals("body", EntityLinker.stripMarker("body\n\n<!-- Discord:1 -->\n"));
    }

    @Test
    void shouldResolveThreadFromMarker() {
        ForumThread thread = new ForumThread("1000", "Bug", "900", "7");
        when(threadRepository.listThreads("900")).thenReturn(List.of(new ForumThread("999", "x", "900", "7"), thread));

        Optional<ForumThread> resolved = linker.resolveThreadFor(discussion("D_1", "text\n\n<!-- Discord:1000 -->"));

        assertEquals(Optional.of(thread), resolved);
    }

    @Test
    void shouldTreatDanglingMarkerAsUnlinked() {
        when(threadRepository.listThreads("900")).thenReturn(List.of(new ForumThread("999", "x", "900", "7")));
        when(threadRepository.findThread("1000")).thenReturn(Optional.empty());

        assertTrue(linker.resolveThreadFor(discussion("D_1", "<!-- Discord:1000 -->")).isEmpty());
    }

    @Test
    void shouldResolveArchivedThreadMissingFromActiveListing() {
        ForumThread archived = new ForumThread("1000", "Old bug", "900", "7");
        when(threadRepository.listThreads("900")).thenReturn(List.of(new ForumThread("999", "x", "900", "7")));
        when(threadRepository.findThread("1000")).thenReturn(Optional.of(archived));

        Optional<ForumThread> resolved = linker.resolveThreadFor(discussion("D_1", "text\n\n<!-- Discord:1000 -->"));

        assertEquals(Optional.of(archived), resolved);
    }

    @Test
    void shouldIgnoreMarkedThreadOfAnotherChannel() {
        when(threadRepository.listThreads("900")).thenReturn(List.of());
        when(threadRepository.findThread("1000")).thenReturn(Optional.of(new ForumThread("1000", "x", "555", "7")));

        assertTrue(linker.resolveThreadFor(discussion("D_1", "<!-- Discord:1000 -->")).isEmpty());
    }

    @Test
    void shouldNotListThreadsWithoutMarker() {
        assertTrue(linker.resolveThreadFor(discussion("D_1", "plain")).isEmpty());

        verify(threadRepository, never()).listThreads(anyString());
    }

    @Test
    void shouldResolveDiscussionFromCachedListing() {
        Discussion linked = discussion("D_2", "x\n\n<!-- Discord:1000 -->");
        when(cache.getDiscussions()).thenReturn(List.of(discussion("D_1", "unlinked"), linked));

        assertEquals(Optional.of(linked), linker.resolveDiscussionFor(new ForumThread("1000", "Bug", "900", "7")));
        assertTrue(linker.resolveDiscussionFor(new ForumThread("1001", "Other", "900", "7")).isEmpty());
    }
}
