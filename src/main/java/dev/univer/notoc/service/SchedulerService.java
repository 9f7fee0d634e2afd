package dev.univer.notoc.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class SchedulerService {

    private final PendingDecisionService pendingDecisionService;

    // Every minute: drop candidate choices nobody answered
    @Scheduled(cron = "0 * * * * *")
    public void tick() {
        int removed = pendingDecisionService.purgeExpired();
        if (removed > 0) log.debug("Purged {} expired pending decisions", removed);
    }
}
