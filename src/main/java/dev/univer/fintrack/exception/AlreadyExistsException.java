package dev.univer.fintrack.exception;

import lombok.Getter;

@Getter
public class AlreadyExistsException extends ExpenseBotException {
    private final String name;

    public AlreadyExistsException(String name) {
        super("Category already exists: " + name);
        this.name = name;
    }
}
