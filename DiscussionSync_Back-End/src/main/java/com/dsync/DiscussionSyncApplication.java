package com.dsync;

import com.dsync.service.DiscordGatewayService;
import com.dsync.service.StartupReconciler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

@SpringBootApplication(scanBasePackages = {"com.dsync"})
public class DiscussionSyncApplication {

    private static final Logger log = LoggerFactory.getLogger(DiscussionSyncApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(DiscussionSyncApplication.class, args);
    }

    @Autowired(required = false)
    private DiscordGatewayService gatewayService;

    @Autowired(required = false)
    private StartupReconciler startupReconciler;

    @Value("${discord.gateway.enabled:true}")
    private Boolean gatewayEnabled;

    @Value("${sync.startup.reconcile:true}")
    private Boolean reconcileOnStartup;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        // Gateway first so that nothing posted during the reconciliation is missed
        if (gatewayEnabled != null && gatewayEnabled && gatewayService != null) {
            gatewayService.start();
        } else {
            log.info("Discord gateway is disabled (discord.gateway.enabled=false)");
        }

        if (reconcileOnStartup != null && reconcileOnStartup && startupReconciler != null) {
            log.info("Application is ready. Starting the reconciliation of existing threads and discussions...");
            startupReconciler.reconcileInBackground();
        } else {
            log.info("Startup reconciliation is disabled (sync.startup.reconcile=false)");
        }
    }
}
