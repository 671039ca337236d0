package com.flagship.contractor_ledger.category;

import com.flagship.contractor_ledger.exception.ConstraintViolationException;
import com.flagship.contractor_ledger.exception.NotFoundException;
import com.flagship.contractor_ledger.exception.ValidationException;
import com.flagship.contractor_ledger.persistence.LedgerTransactionBoundary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * JDBC store for transaction categories. Default categories are read-only.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class CategoryStore {

    private static final Pattern HEX_COLOR = Pattern.compile("^#[0-9a-fA-F]{6}$");
    private static final String COLUMNS = "id, name, type, color, is_default, created_at";

    private final JdbcTemplate jdbcTemplate;
    private final LedgerTransactionBoundary boundary;

    public Category create(String name, CategoryType type, String color) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Category name is required");
        }
        if (type == null) {
            throw new ValidationException("Category type is required");
        }

        Category category = Category.builder()
            .id(UUID.randomUUID())
            .name(name.trim())
            .type(type)
            .color(color != null ? validColor(color) : DefaultCategories.DEFAULT_COLOR)
            .defaultCategory(false)
            .createdAt(Instant.now())
            .build();
        insert(category);
        return category;
    }

    /**
     * Renames or recolors a custom category.
     *
     * @throws ConstraintViolationException if the category is a default one
     */
    public Category update(UUID id, String name, String color) {
        Category current = getById(id);
        if (current.isDefaultCategory()) {
            throw new ConstraintViolationException("Default categories cannot be modified");
        }
        if (name != null && name.isBlank()) {
            throw new ValidationException("Category name cannot be blank");
        }

        Category updated = current.toBuilder()
            .name(name != null ? name.trim() : current.getName())
            .color(color != null ? validColor(color) : current.getColor())
            .build();

        boundary.recordMutation();
        jdbcTemplate.update("UPDATE categories SET name = ?, color = ? WHERE id = ?",
            updated.getName(), updated.getColor(), id);
        return updated;
    }

    /**
     * Deletes a custom category. Transactions that referenced it keep no category.
     */
    public void delete(UUID id) {
        Category current = getById(id);
        if (current.isDefaultCategory()) {
            throw new ConstraintViolationException("Default categories cannot be deleted");
        }
        boundary.recordMutation();
        jdbcTemplate.update("DELETE FROM categories WHERE id = ?", id);
        log.info("Deleted category {}", current.getName());
    }

    public void insert(Category category) {
        boundary.recordMutation();
        jdbcTemplate.update(
            "INSERT INTO categories (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?)",
            category.getId(),
            category.getName(),
            category.getType().code(),
            category.getColor(),
            category.isDefaultCategory(),
            Timestamp.from(category.getCreatedAt())
        );
    }

    public Optional<Category> findById(UUID id) {
        List<Category> categories = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM categories WHERE id = ?", categoryRowMapper(), id);
        return categories.stream().findFirst();
    }

    public Category getById(UUID id) {
        return findById(id).orElseThrow(() -> NotFoundException.of("Category", id));
    }

    /**
     * Lists categories, defaults first, optionally limited to one group.
     */
    public List<Category> findAll(CategoryType type) {
        if (type == null) {
            return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM categories ORDER BY is_default DESC, type, name",
                categoryRowMapper());
        }
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM categories WHERE type = ? ORDER BY is_default DESC, name",
            categoryRowMapper(), type.code());
    }

    public List<Category> findAllOrderedById() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM categories ORDER BY id", categoryRowMapper());
    }

    private static String validColor(String color) {
        if (!HEX_COLOR.matcher(color).matches()) {
            throw new ValidationException("Category color must be a #rrggbb hex value");
        }
        return color;
    }

    private RowMapper<Category> categoryRowMapper() {
        return (rs, rowNum) -> Category.builder()
            .id(rs.getObject("id", UUID.class))
            .name(rs.getString("name"))
            .type(CategoryType.fromCode(rs.getString("type")))
            .color(rs.getString("color"))
            .defaultCategory(rs.getBoolean("is_default"))
            .createdAt(rs.getTimestamp("created_at").toInstant())
            .build();
    }
}
