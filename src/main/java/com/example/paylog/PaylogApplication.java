package com.example.paylog;

import com.example.paylog.service.ConnectivityMonitor;
import com.example.paylog.service.SmsIngestionService;
import com.example.paylog.sync.DrainReport;
import com.example.paylog.sync.SyncQueueManager;
import lombok.extern.slf4j.Slf4j;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

@Slf4j
@SpringBootApplication
@MapperScan("com.example.paylog.mapper")
public class PaylogApplication {

    @Value("${paylog.sync.drain-on-startup:true}")
    private boolean drainOnStartup;

    public static void main(String[] args) {
        System.setProperty("spring.main.register-shutdown-hook", "true");
        SpringApplication.run(PaylogApplication.class, args);
        log.info("Paylog started. Press Ctrl+C to shut down.");
    }

    /**
     * Unsynced records a previous run left without a queue entry are re-queued, then the queue is
     * delivered as soon as the remote store answers.
     */
    @Bean
    public CommandLineRunner drainLeftoverQueue(SyncQueueManager syncQueueManager,
                                                ConnectivityMonitor connectivityMonitor,
                                                SmsIngestionService ingestionService) {
        return args -> {
            ingestionService.recoverUnfinished();
            int queued = syncQueueManager.queueSize();
            if (!connectivityMonitor.isReachable()) {
                log.warn("Remote store is not reachable at startup; {} queued transaction(s) wait for the next drain", queued);
                return;
            }
            log.info("Remote store connection verified.");
            if (drainOnStartup && queued > 0) {
                DrainReport report = syncQueueManager.drainQueueNow();
                log.info("Startup drain: confirmed {} of {} queued transaction(s)", report.getConfirmed(), queued);
            }
        };
    }
}
