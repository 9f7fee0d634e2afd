package dev.univer.notoc.bot;

import dev.univer.notoc.config.TelegramProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.methods.commands.SetMyCommands;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.commands.BotCommand;
import org.telegram.telegrambots.meta.api.objects.commands.scope.BotCommandScopeDefault;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.Arrays;
import java.util.List;

/** Long-polling endpoint; every update is re-published as a Spring event for {@link DebtBot}. */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramWrapper extends TelegramLongPollingBot {

    private final TelegramProperties props;
    private final ApplicationEventPublisher publisher;

    @Override public String getBotUsername() { return props.getUsername(); }
    @Override public String getBotToken() { return props.getToken(); }

    @Override
    public void onUpdateReceived(Update update) {
        log.debug("Incoming update: {}", update.getUpdateId());
        publisher.publishEvent(update);
    }

    public void installCommands() {
        List<BotCommand> commands = Arrays.asList(
                new BotCommand("/help", "Help"),
                new BotCommand("/add", "Record a debt"),
                new BotCommand("/paid", "Record a repayment"),
                new BotCommand("/balance", "Balances"),
                new BotCommand("/history", "History of a person"),
                new BotCommand("/alias", "Add a nickname"),
                new BotCommand("/link", "Link a person to a Telegram account"),
                new BotCommand("/deadline", "Set or clear a due date"),
                new BotCommand("/deadlines", "Upcoming due dates"),
                new BotCommand("/deltx", "Delete a transaction"),
                new BotCommand("/deldebtor", "Delete a person"),
                new BotCommand("/delall", "Delete everything")
                                                 );
        SetMyCommands set = new SetMyCommands();
        set.setCommands(commands);
        set.setScope(new BotCommandScopeDefault());
        try { execute(set); log.info("Bot commands installed: {}", commands.size()); }
        catch (TelegramApiException e) { log.warn("Failed to set bot commands", e); }
    }
}
