package com.ecocart.ecocart_backend.service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.ecocart.ecocart_backend.model.Grade;
import com.ecocart.ecocart_backend.model.Product;
import com.ecocart.ecocart_backend.model.ProductMetadata;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads catalog product records (snake_case, Open Food Facts style metadata) into {@link Product}.
 * Malformed fields degrade to absent values instead of failing the whole record.
 */
@Component
public class ProductJsonMapper {

    private static final Logger log = LoggerFactory.getLogger(ProductJsonMapper.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    public List<Product> readProducts(InputStream inputStream) throws IOException {
        JsonNode records = objectMapper.readTree(inputStream);
        if (records != null && records.isObject()) {
            records = records.path("products");
        }
        if (records == null || !records.isArray()) {
            log.warn("Catalog payload has no product array; nothing imported.");
            return List.of();
        }

        List<Product> products = new ArrayList<>();
        for (JsonNode record : records) {
            if (record.isObject()) {
                products.add(fromJson(record));
            }
        }
        log.info("Catalog import finished: products={}", products.size());
        return products;
    }

    public Product fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        return new Product(
                text(node.path("id")),
                text(node.path("barcode")),
                text(node.path("name")),
                text(node.path("category")),
                number(node.path("price")),
                text(node.path("currency")),
                number(node.path("carbon_footprint")),
                Grade.fromCode(text(node.path("eco_score"))),
                Grade.fromCode(text(node.path("nutrition_grade"))),
                quantity(node.path("quantity")),
                metadata(node.path("openfoodfacts_data"))
        );
    }

    private ProductMetadata metadata(JsonNode node) {
        JsonNode data = node;
        if (data.isTextual()) {
            try {
                data = objectMapper.readTree(data.asText());
            } catch (JsonProcessingException ex) {
                log.debug("Ignoring malformed openfoodfacts_data: {}", ex.getOriginalMessage());
                return ProductMetadata.empty();
            }
        }
        if (data == null || !data.isObject()) {
            return ProductMetadata.empty();
        }
        JsonNode additives = data.has("additives") ? data.path("additives") : data.path("additives_tags");
        return new ProductMetadata(
                text(data.path("packaging")),
                text(data.path("origins")),
                textList(data.path("labels_tags")),
                text(data.path("ingredients_text")),
                textList(additives),
                textList(data.path("categories_tags"))
        );
    }

    private String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String value = node.asText("").trim();
        return value.isEmpty() ? null : value;
    }

    private Double number(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return finiteOrNull(node.asDouble());
        }
        String value = text(node);
        if (value == null) {
            return null;
        }
        try {
            return finiteOrNull(Double.parseDouble(value));
        } catch (NumberFormatException ex) {
            log.debug("Ignoring non-numeric value '{}'", value);
            return null;
        }
    }

    private Integer quantity(JsonNode node) {
        Double value = number(node);
        return value == null ? null : (int) Math.round(value);
    }

    private Double finiteOrNull(double value) {
        return Double.isFinite(value) ? value : null;
    }

    private List<String> textList(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            String value = text(item);
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }
}
