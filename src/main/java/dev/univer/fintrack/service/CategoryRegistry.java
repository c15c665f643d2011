package dev.univer.fintrack.service;

import dev.univer.fintrack.exception.AlreadyExistsException;
import dev.univer.fintrack.exception.ValidationException;
import dev.univer.fintrack.model.Category;
import dev.univer.fintrack.model.CategoryScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Deduplicated category list per scope, seeded with the defaults on the first empty read.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CategoryRegistry {

    public static final List<String> DEFAULT_CATEGORIES = List.of(
            "Food", "Transport", "Housing", "Entertainment", "Shopping", "Health", "Other");

    // Telegram callback_data holds at most 64 bytes and the longest prefix is "cat_"/"del_"
    public static final int MAX_NAME_BYTES = 60;

    private final RecordStore store;

    /**
     * Distinct names of the scope in insertion order. Two concurrent first reads may both seed;
     * the duplicate rows are folded away here.
     */
    public List<String> listCategories(CategoryScope scope) {
        List<Category> rows = store.listCategoryRows(scope);
        if (rows.isEmpty()) {
            store.createCategories(scope, DEFAULT_CATEGORIES);
            log.info("Seeded default categories for scope {}", scope.ownerId());
            return DEFAULT_CATEGORIES;
        }
        Set<String> names = new LinkedHashSet<>();
        for (Category c : rows) names.add(c.getName());
        return List.copyOf(names);
    }

    public String addCategory(CategoryScope scope, String rawName) {
        String name = rawName == null ? "" : rawName.trim();
        if (name.isEmpty()) {
            throw new ValidationException("Category name cannot be empty.");
        }
        if (name.getBytes(StandardCharsets.UTF_8).length > MAX_NAME_BYTES) {
            throw new ValidationException("Category name is too long.");
        }
        if (listCategories(scope).contains(name)) {
            throw new AlreadyExistsException(name);
        }
        store.createCategory(scope, name);
        log.info("Category '{}' added to scope {}", name, scope.ownerId());
        return name;
    }

    /** Removes every row of the scope named exactly {@code name}; missing names are not an error. */
    public void removeCategory(CategoryScope scope, String name) {
        long removed = store.deleteCategory(scope, name);
        log.info("Category '{}' removed from scope {} ({} rows)", name, scope.ownerId(), removed);
    }
}
