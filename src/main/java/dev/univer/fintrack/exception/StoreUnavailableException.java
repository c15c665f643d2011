package dev.univer.fintrack.exception;

/** The persistence layer failed; the current operation is aborted and may be retried by the user. */
public class StoreUnavailableException extends ExpenseBotException {
    public StoreUnavailableException(String operation, Throwable cause) {
        super("Record store failed during " + operation, cause);
    }
}
