package dev.univer.fintrack.service;

/**
 * One button of a single-select list. The token embeds the option text after a fixed prefix,
 * so the text chosen is recovered exactly by {@link #textOf(String, String)}.
 */
public record ChoiceOption(String label, String token) {

    public static final String CATEGORY_PREFIX = "cat_";
    public static final String DELETE_PREFIX = "del_";

    public static ChoiceOption category(String name) {
        return new ChoiceOption(name, CATEGORY_PREFIX + name);
    }

    public static ChoiceOption deletion(String name) {
        return new ChoiceOption("Delete: " + name, DELETE_PREFIX + name);
    }

    /** Option text carried by {@code token}, or {@code null} if the token has another prefix. */
    public static String textOf(String token, String prefix) {
        if (token == null || !token.startsWith(prefix)) return null;
        return token.substring(prefix.length());
    }
}
