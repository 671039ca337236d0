package com.flagship.contractor_ledger.category;

import java.util.List;

/**
 * The category set every ledger starts with. Seeded once by schema migration and protected
 * from edits afterwards.
 */
public final class DefaultCategories {

    public static final String DEFAULT_COLOR = "#6366f1";

    private DefaultCategories() {
    }

    public static List<Seed> all() {
        return List.of(
            // Sales and progress billing
            new Seed("Hakediş", CategoryType.INVOICE_OUT, "#22c55e"),
            new Seed("Daire Satışı", CategoryType.INVOICE_OUT, "#10b981"),
            new Seed("Dükkan Satışı", CategoryType.INVOICE_OUT, "#14b8a6"),
            new Seed("Kira Geliri", CategoryType.INVOICE_OUT, "#06b6d4"),
            new Seed("Danışmanlık", CategoryType.INVOICE_OUT, "#0ea5e9"),
            new Seed("Diğer Gelir", CategoryType.INVOICE_OUT, "#84cc16"),

            // Purchases and subcontracting
            new Seed("Malzeme", CategoryType.INVOICE_IN, "#ef4444"),
            new Seed("Beton", CategoryType.INVOICE_IN, "#f97316"),
            new Seed("Demir", CategoryType.INVOICE_IN, "#78716c"),
            new Seed("Taşeron", CategoryType.INVOICE_IN, "#f59e0b"),
            new Seed("İşçilik", CategoryType.INVOICE_IN, "#eab308"),
            new Seed("Makine Kiralama", CategoryType.INVOICE_IN, "#a855f7"),
            new Seed("Nakliye", CategoryType.INVOICE_IN, "#8b5cf6"),
            new Seed("Elektrik Tesisatı", CategoryType.INVOICE_IN, "#6366f1"),
            new Seed("Sıhhi Tesisat", CategoryType.INVOICE_IN, "#3b82f6"),
            new Seed("Ruhsat ve Harçlar", CategoryType.INVOICE_IN, "#64748b"),
            new Seed("Proje ve Mühendislik", CategoryType.INVOICE_IN, "#0891b2"),
            new Seed("Ofis Giderleri", CategoryType.INVOICE_IN, "#ec4899"),
            new Seed("Akaryakıt", CategoryType.INVOICE_IN, "#dc2626"),
            new Seed("Sigorta", CategoryType.INVOICE_IN, "#be185d"),
            new Seed("Vergi", CategoryType.INVOICE_IN, "#9f1239"),
            new Seed("Diğer Gider", CategoryType.INVOICE_IN, "#94a3b8"),

            // Cash movements
            new Seed("Nakit", CategoryType.PAYMENT, "#16a34a"),
            new Seed("Banka Havalesi", CategoryType.PAYMENT, "#2563eb"),
            new Seed("Çek", CategoryType.PAYMENT, "#7c3aed"),
            new Seed("Senet", CategoryType.PAYMENT, "#c026d3"),
            new Seed("Kredi Kartı", CategoryType.PAYMENT, "#db2777"),
            new Seed("Avans", CategoryType.PAYMENT, "#ea580c"),
            new Seed("Mahsup", CategoryType.PAYMENT, "#475569")
        );
    }

    /**
     * Name, group and color of one default category.
     */
    public static final class Seed {
        private final String name;
        private final CategoryType type;
        private final String color;

        Seed(String name, CategoryType type, String color) {
            this.name = name;
            this.type = type;
            this.color = color;
        }

        public String getName() {
            return name;
        }

        public CategoryType getType() {
            return type;
        }

        public String getColor() {
            return color;
        }
    }
}
