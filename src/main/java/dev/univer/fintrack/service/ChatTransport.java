package dev.univer.fintrack.service;

import java.util.List;

/**
 * Outbound side of the chat. Delivery is best effort; implementations log failures instead of
 * reporting them back.
 */
public interface ChatTransport {

    void deliver(long chatId, String text);

    /** Sends {@code prompt} with one button per option; a press comes back as the option's token. */
    void presentChoice(long chatId, String prompt, List<ChoiceOption> options);

    /** Stops the client-side spinner of a pressed button. */
    void acknowledge(String callbackQueryId);
}
