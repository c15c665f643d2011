package dev.univer.fintrack.exception;

/**
 * Base type for failures the command handler turns into a chat reply.
 */
public abstract class ExpenseBotException extends RuntimeException {
    protected ExpenseBotException(String message) {
        super(message);
    }

    protected ExpenseBotException(String message, Throwable cause) {
        super(message, cause);
    }
}
