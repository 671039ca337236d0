package com.flagship.contractor_ledger.category;

import com.flagship.contractor_ledger.LedgerFixtures;
import com.flagship.contractor_ledger.exception.ConstraintViolationException;
import com.flagship.contractor_ledger.exception.ValidationException;
import com.flagship.contractor_ledger.ledger.LedgerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class CategoryStoreTest {

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        new LedgerFixtures(ledgerService, jdbcTemplate).reset();
    }

    @Test
    @DisplayName("Default categories are seeded and protected")
    void testDefaultsAreProtected() {
        List<Category> defaults = ledgerService.listCategories(null);
        assertEquals(DefaultCategories.all().size(), defaults.size());

        Category seeded = defaults.get(0);
        assertTrue(seeded.isDefaultCategory());
        assertThrows(ConstraintViolationException.class, () -> ledgerService.deleteCategory(seeded.getId()));
        assertThrows(ConstraintViolationException.class,
            () -> ledgerService.updateCategory(seeded.getId(), "Yeni", null));
    }

    @Test
    @DisplayName("Custom categories can be recolored and deleted")
    void testCustomCategoryLifecycle() {
        Category created = ledgerService.createCategory("Iskele", CategoryType.INVOICE_IN, null);
        assertEquals(DefaultCategories.DEFAULT_COLOR, created.getColor());

        assertThrows(ValidationException.class, () -> ledgerService.updateCategory(created.getId(), null, "red"));

        Category recolored = ledgerService.updateCategory(created.getId(), null, "#ABCDEF");
        assertEquals("Iskele", recolored.getName());

        ledgerService.deleteCategory(created.getId());
        assertEquals(DefaultCategories.all().size(), ledgerService.listCategories(null).size());
    }

    @Test
    @DisplayName("Listing by group only returns that group")
    void testListByType() {
        List<Category> payments = ledgerService.listCategories(CategoryType.PAYMENT);
        assertFalse(payments.isEmpty());
        assertTrue(payments.stream().allMatch(category -> category.getType() == CategoryType.PAYMENT));
    }
}
