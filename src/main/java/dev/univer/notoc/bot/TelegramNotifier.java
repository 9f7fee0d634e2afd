package dev.univer.notoc.bot;

import dev.univer.notoc.exception.NotificationException;
import dev.univer.notoc.service.Notifier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

/** Private chat id equals the telegram user id, so the debtor's external id is the target chat. */
@Component
@RequiredArgsConstructor
public class TelegramNotifier implements Notifier {
    private final TelegramSender sender;

    @Override
    public void notify(Long externalId, String message) {
        try {
            sender.send(externalId, message);
        } catch (TelegramApiException e) {
            throw new NotificationException("Telegram refused message to " + externalId, e);
        }
    }
}
