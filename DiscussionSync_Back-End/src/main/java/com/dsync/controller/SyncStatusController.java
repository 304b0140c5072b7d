package com.dsync.controller;

import com.dsync.service.DiscordGatewayService;
import com.dsync.service.DiscussionListingCache;
import com.dsync.service.StartupReconciler;
import com.dsync.service.SyncContext;
import com.dsync.service.SyncStatisticsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller exposing the state of the synchronization.
 */
@RestController
@RequestMapping("/api/sync")
public class SyncStatusController {

    private static final Logger log = LoggerFactory.getLogger(SyncStatusController.class);

    @Autowired
    private SyncStatisticsService statistics;

    @Autowired
    private SyncContext syncContext;

    @Autowired
    private DiscussionListingCache discussionListingCache;

    @Autowired
    private DiscordGatewayService gatewayService;

    @Autowired
    private StartupReconciler startupReconciler;

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("forumChannelId", syncContext.getForumChannelId());
        status.put("categoryName", syncContext.getCategoryName());
        status.put("categoryResolved", syncContext.isCategoryResolved());
        status.put("dryRun", syncContext.isDryRun());
        status.put("discussionListingLoaded", discussionListingCache.isLoaded());
        status.put("gatewayConnected", gatewayService.isConnected());
        status.put("gatewayReady", gatewayService.isReady());
        status.put("reconciliationRunning", startupReconciler.isRunning());
        status.put("counters", statistics.getCounters());
        return ResponseEntity.ok(status);
    }

    @GetMapping("/failures")
    public ResponseEntity<Map<String, Object>> getFailures() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("total", statistics.getFailures());
        response.put("recent", statistics.getRecentFailures());
        return ResponseEntity.ok(response);
    }

    /**
     * Starts a full reconciliation in the background, as done at startup.
     */
    @PostMapping("/reconcile")
    public ResponseEntity<Map<String, Object>> reconcile() {
        boolean started = startupReconciler.reconcileInBackground();
        log.info("Manual reconciliation requested, started: {}", started);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("started", started);
        return ResponseEntity.status(started ? HttpStatus.ACCEPTED : HttpStatus.CONFLICT).body(response);
    }
}
