package com.dsync.service;

import com.dsync.repo.DiscussionRepository;
import com.dsync.repo.domain.Discussion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DiscussionListingCacheTest {

    private DiscussionRepository repository;
    private DiscussionListingCache cache;

    @BeforeEach
    void setUp() {
        repository = mock(DiscussionRepository.class);
        SyncContext context = new SyncContext("900", "General", false);
        context.setCategoryId("DIC_1");
        cache = new DiscussionListingCache(repository, context);
    }

    private static Discussion discussion(String id, int number, String body) {
        return new Discussion(id, number, "title " + number, body, "octocat", "General");
    }

    @Test
    void shouldLoadListingOnceOnFirstRead() {
        when(repository.listDiscussions("DIC_1")).thenReturn(List.of(discussion("D_1", 1, "a")));

        assertFalse(cache.isLoaded());
        assertEquals(1, cache.getDiscussions().size());
        assertEquals(1, cache.getDiscussions().size());

        assertTrue(cache.isLoaded());
        verify(repository, times(1)).listDiscussions("DIC_1");
    }

    @Test
    void shouldReplaceDiscussionWithSameId() {
        when(repository.listDiscussions("DIC_1")).thenReturn(List.of(discussion("D_1", 1, "a"), discussion("D_2", 2, "b")));

        cache.put(discussion("D_1", 1, "a\n\n<!-- Discord:1000 -->"));

        List<Discussion> discussions = cache.getDiscussions();
        assertEquals(2, discussions.size());
        assertEquals("a\n\n<!-- Discord:1000 -->", discussions.get(0).getBody());
    }

    @Test
    void shouldAppendNewDiscussion() {
        when(repository.listDiscussions("DIC_1")).thenReturn(List.of(discussion("D_1", 1, "a")));

        cache.put(discussion("D_9", 9, "created"));

        assertEquals(2, cache.getDiscussions().size());
        assertEquals("D_9", cache.getDiscussions().get(1).getId());
    }

    @Test
    void shouldNotExposeMutableListing() {
        when(repository.listDiscussions("DIC_1")).thenReturn(List.of());

        assertThrows(UnsupportedOperationException.class, () -> cache.getDiscussions().add(discussion("D_1", 1, "a")));
    }
}
