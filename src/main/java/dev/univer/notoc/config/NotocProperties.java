package dev.univer.notoc.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "notoc")
@Getter @Setter
public class NotocProperties {
    private Match match = new Match();
    private Pending pending = new Pending();
    private History history = new History();
    private Deadlines deadlines = new Deadlines();

    @Getter @Setter
    public static class Match {
        // minimum score for a fuzzy candidate
        private int threshold = 60;
        // stricter score used when auto-linking a telegram account to an existing debtor
        private int linkThreshold = 80;
        private int maxCandidates = 5;
    }

    @Getter @Setter
    public static class Pending {
        private Duration ttl = Duration.ofMinutes(10);
    }

    @Getter @Setter
    public static class History {
        private int defaultLimit = 10;
    }

    @Getter @Setter
    public static class Deadlines {
        private int defaultLimit = 20;
    }
}
