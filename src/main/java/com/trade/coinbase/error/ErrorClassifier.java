package com.trade.coinbase.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Maps exchange error texts to {@link ErrorCategory} using a signature table.
 * <p>
 * Categories are tested in table order and the first matching category wins.
 * The table is plain data: new exchange wordings are added with
 * {@link #withAdditionalSignatures(ErrorCategory, List)} or through configuration.
 */
public final class ErrorClassifier {

    private final Map<ErrorCategory, List<ErrorSignature>> signatures;

    public ErrorClassifier(Map<ErrorCategory, List<ErrorSignature>> signatures) {
        Map<ErrorCategory, List<ErrorSignature>> copy = new LinkedHashMap<>();
        for (Map.Entry<ErrorCategory, List<ErrorSignature>> entry : signatures.entrySet()) {
            if (entry.getKey() == ErrorCategory.UNCLASSIFIED) {
                throw new IllegalArgumentException("UNCLASSIFIED is the fallback category and takes no signature");
            }
            copy.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        this.signatures = Collections.unmodifiableMap(copy);
    }

    public static ErrorClassifier defaults() {
        return new ErrorClassifier(defaultSignatures());
    }

    /**
     * Coinbase wordings, in priority order.
     */
    public static Map<ErrorCategory, List<ErrorSignature>> defaultSignatures() {
        Map<ErrorCategory, List<ErrorSignature>> table = new LinkedHashMap<>();
        // {"error":"NOT_FOUND","error_details":"order with this orderID was not found", ...}
        table.put(ErrorCategory.ORDER_NOT_FOUND, List.of(
                ErrorSignature.of("not_found", "order")));
        // {"error":"PERMISSION_DENIED","error_details":"Missing required scopes", ...}
        table.put(ErrorCategory.PERMISSION_DENIED, List.of(
                ErrorSignature.of("missing required scopes")));
        table.put(ErrorCategory.SYMBOL_NOT_TRADABLE, List.of(
                ErrorSignature.of("target is not enabled for trading"),
                ErrorSignature.of("user is not allowed to convert crypto")));
        // {"error":"INVALID_ARGUMENT","error_details":"account is not available", ...}
        table.put(ErrorCategory.ACCOUNT_SYNC_PENDING, List.of(
                ErrorSignature.of("account is not available")));
        table.put(ErrorCategory.INSUFFICIENT_FUNDS, List.of(
                ErrorSignature.of("insufficient balance in source account")));
        return table;
    }

    /**
     * Total and side-effect free: null or unmatched text yields {@link ErrorCategory#UNCLASSIFIED}.
     */
    public ErrorCategory classify(String errorText) {
        if (errorText == null || errorText.isEmpty()) {
            return ErrorCategory.UNCLASSIFIED;
        }
        String lowered = errorText.toLowerCase(Locale.ROOT);
        for (Map.Entry<ErrorCategory, List<ErrorSignature>> entry : signatures.entrySet()) {
            for (ErrorSignature signature : entry.getValue()) {
                if (signature.matches(lowered)) {
                    return entry.getKey();
                }
            }
        }
        return ErrorCategory.UNCLASSIFIED;
    }

    /**
     * Classifies the first message of the cause chain that matches a category.
     */
    public ErrorCategory classify(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 8) {
            ErrorCategory category = classify(current.getMessage());
            if (category != ErrorCategory.UNCLASSIFIED) {
                return category;
            }
            current = current.getCause();
            depth++;
        }
        return ErrorCategory.UNCLASSIFIED;
    }

    public boolean isCategory(String errorText, ErrorCategory category) {
        return classify(errorText) == category;
    }

    public ErrorClassifier withAdditionalSignatures(ErrorCategory category, List<ErrorSignature> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        Map<ErrorCategory, List<ErrorSignature>> table = new LinkedHashMap<>(signatures);
        List<ErrorSignature> merged = new ArrayList<>(table.getOrDefault(category, List.of()));
        merged.addAll(extra);
        table.put(category, merged);
        return new ErrorClassifier(table);
    }

    /**
     * Appends signatures read from a text source keyed by category name, using the
     * "a&amp;b|c" format: signatures separated by '|', fragments by '&amp;'.
     */
    public ErrorClassifier withConfiguredSignatures(Function<String, String> source) {
        ErrorClassifier result = this;
        for (ErrorCategory category : ErrorCategory.values()) {
            if (category == ErrorCategory.UNCLASSIFIED) {
                continue;
            }
            result = result.withAdditionalSignatures(category, parseSignatures(source.apply(category.name())));
        }
        return result;
    }

    static List<ErrorSignature> parseSignatures(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        List<ErrorSignature> parsed = new ArrayList<>();
        for (String signature : raw.split("\\|")) {
            if (signature.isBlank()) {
                continue;
            }
            List<String> fragments = new ArrayList<>();
            for (String fragment : signature.split("&")) {
                if (!fragment.isBlank()) {
                    fragments.add(fragment);
                }
            }
            if (!fragments.isEmpty()) {
                parsed.add(ErrorSignature.of(fragments.toArray(new String[0])));
            }
        }
        return parsed;
    }

    public Map<ErrorCategory, List<ErrorSignature>> getSignatures() {
        return signatures;
    }
}
