package dev.univer.notoc.config;

import dev.univer.notoc.bot.TelegramWrapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

/** Starts long polling. Off with {@code bot.enabled=false}; the services work without it. */
@Configuration
@ConditionalOnProperty(prefix = "bot", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class TelegramBotConfig {

    @Bean
    public TelegramBotsApi telegramBotsApi(TelegramWrapper bot, TelegramProperties props) {
        if (props.getToken() == null || props.getToken().isBlank()) {
            throw new IllegalStateException("bot.token is empty; set BOT_TOKEN or bot.enabled=false");
        }
        try {
            TelegramBotsApi api = new TelegramBotsApi(DefaultBotSession.class);
            api.registerBot(bot);
            bot.installCommands();
            log.info("Telegram bot @{} registered", props.getUsername());
            return api;
        } catch (TelegramApiException e) {
            throw new IllegalStateException("Failed to register Telegram bot", e);
        }
    }
}
