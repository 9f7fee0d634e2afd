package dev.univer.notoc.bot;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

@Service
@RequiredArgsConstructor
public class TelegramSender {
    private final TelegramWrapper wrapper;

    public void send(Long chatId, String text) throws TelegramApiException {
        SendMessage sm = SendMessage.builder()
                .chatId(chatId.toString())
                .text(text)
                .build();
        wrapper.execute(sm);
    }

    public void send(Long chatId, String text, InlineKeyboardMarkup keyboard) throws TelegramApiException {
        SendMessage sm = SendMessage.builder()
                .chatId(chatId.toString())
                .text(text)
                .replyMarkup(keyboard)
                .build();
        wrapper.execute(sm);
    }

    public void edit(Long chatId, Integer messageId, String text) throws TelegramApiException {
        EditMessageText em = EditMessageText.builder()
                .chatId(chatId.toString())
                .messageId(messageId)
                .text(text)
                .build();
        wrapper.execute(em);
    }

    public void answer(String callbackQueryId) throws TelegramApiException {
        wrapper.execute(AnswerCallbackQuery.builder().callbackQueryId(callbackQueryId).build());
    }
}
