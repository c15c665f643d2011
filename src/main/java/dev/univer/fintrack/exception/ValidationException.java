package dev.univer.fintrack.exception;

/** Bad user input. The dialogue stays on the same step and the user is asked again. */
public class ValidationException extends ExpenseBotException {
    public ValidationException(String message) {
        super(message);
    }
}
