package dev.univer.fintrack.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class TelegramTransport implements ChatTransport {
    private final TelegramWrapper wrapper;

    @Override
    public void deliver(long chatId, String text) {
        SendMessage sm = SendMessage.builder()
                .chatId(String.valueOf(chatId))
                .text(text)
                .build();
        execute(sm, chatId);
    }

    @Override
    public void presentChoice(long chatId, String prompt, List<ChoiceOption> options) {
        List<List<InlineKeyboardButton>> rows = new ArrayList<>();
        for (ChoiceOption option : options) {
            InlineKeyboardButton button = new InlineKeyboardButton();
            button.setText(option.label());
            button.setCallbackData(option.token());
            rows.add(List.of(button));
        }
        InlineKeyboardMarkup markup = new InlineKeyboardMarkup();
        markup.setKeyboard(rows);
        SendMessage sm = SendMessage.builder()
                .chatId(String.valueOf(chatId))
                .text(prompt)
                .replyMarkup(markup)
                .build();
        execute(sm, chatId);
    }

    @Override
    public void acknowledge(String callbackQueryId) {
        try {
            wrapper.execute(AnswerCallbackQuery.builder().callbackQueryId(callbackQueryId).build());
        } catch (TelegramApiException e) {
            log.warn("Failed to answer callback query {}: {}", callbackQueryId, e.getMessage());
        }
    }

    private void execute(SendMessage sm, long chatId) {
        try {
            wrapper.execute(sm);
        } catch (TelegramApiException e) {
            log.warn("Failed to send message to chat {}: {}", chatId, e.getMessage());
        }
    }
}
