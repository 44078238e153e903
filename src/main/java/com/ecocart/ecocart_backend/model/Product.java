package com.ecocart.ecocart_backend.model;

import java.util.Locale;

/**
 * Read-only product record as supplied by the catalog/pricing layer. Every field except metadata may be null;
 * defaults are applied through the named accessors, never by mutating the record.
 */
public record Product(
        String id,
        String barcode,
        String name,
        String category,
        Double price,
        String currency,
        Double carbonFootprint,
        Grade ecoScore,
        Grade nutritionGrade,
        Integer quantity,
        ProductMetadata metadata
) {

    public Product {
        metadata = metadata == null ? ProductMetadata.empty() : metadata;
    }

    public boolean hasPrice() {
        return price != null && Double.isFinite(price);
    }

    public double priceOrZero() {
        return hasPrice() ? price : 0.0;
    }

    public boolean hasCarbonFootprint() {
        return carbonFootprint != null && Double.isFinite(carbonFootprint);
    }

    public double carbonOrZero() {
        return hasCarbonFootprint() ? carbonFootprint : 0.0;
    }

    public int quantityOrDefault() {
        return quantity == null || quantity < 1 ? 1 : quantity;
    }

    public double lineCost() {
        return priceOrZero() * quantityOrDefault();
    }

    public String normalizedName() {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    public String identityKey() {
        if (id != null && !id.isBlank()) {
            return "id:" + id;
        }
        if (barcode != null && !barcode.isBlank()) {
            return "barcode:" + barcode;
        }
        return "name:" + normalizedName();
    }

    public Product withQuantity(int newQuantity) {
        return new Product(id, barcode, name, category, price, currency, carbonFootprint,
                ecoScore, nutritionGrade, newQuantity, metadata);
    }
}
