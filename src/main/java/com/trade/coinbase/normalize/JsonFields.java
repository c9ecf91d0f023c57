package com.trade.coinbase.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.trade.coinbase.core.Decimal;

import java.math.BigDecimal;

/**
 * Optional field lookups over untyped exchange records.
 * Missing, null and blank fields read as null, never as an exception.
 */
public final class JsonFields {

    private JsonFields() {}

    public static boolean isSet(JsonNode node, String field) {
        if (node == null || !node.isObject()) {
            return false;
        }
        JsonNode value = node.get(field);
        return value != null && !value.isNull() && !value.isMissingNode();
    }

    public static String text(JsonNode node, String field) {
        if (!isSet(node, field)) {
            return null;
        }
        JsonNode value = node.get(field);
        return value.isValueNode() ? value.asText() : null;
    }

    /**
     * Numbers may come as JSON numbers or as strings ("6.798").
     */
    public static BigDecimal decimal(JsonNode node, String field) {
        if (!isSet(node, field)) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value.isNumber()) {
            return value.decimalValue();
        }
        if (value.isTextual()) {
            return Decimal.parseOrNull(value.asText());
        }
        return null;
    }

    public static Long longValue(JsonNode node, String field) {
        if (!isSet(node, field)) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value.canConvertToLong()) {
            return value.asLong();
        }
        if (value.isTextual()) {
            try {
                return Long.parseLong(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static boolean isBlankText(JsonNode node, String field) {
        String value = text(node, field);
        return value == null || value.isBlank();
    }
}
