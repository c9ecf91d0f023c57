package com.trade.coinbase.error;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Set of lowercase substrings that must all appear in an error text.
 */
public final class ErrorSignature {

    private final List<String> fragments;

    private ErrorSignature(List<String> fragments) {
        this.fragments = fragments;
    }

    public static ErrorSignature of(String... fragments) {
        if (fragments == null || fragments.length == 0) {
            throw new IllegalArgumentException("error signature needs at least one fragment");
        }
        String[] lowered = new String[fragments.length];
        for (int i = 0; i < fragments.length; i++) {
            if (fragments[i] == null || fragments[i].isBlank()) {
                throw new IllegalArgumentException("blank error signature fragment");
            }
            lowered[i] = fragments[i].trim().toLowerCase(Locale.ROOT);
        }
        return new ErrorSignature(List.of(lowered));
    }

    /**
     * @param loweredText error text, already lowercased
     */
    public boolean matches(String loweredText) {
        for (String fragment : fragments) {
            if (!loweredText.contains(fragment)) {
                return false;
            }
        }
        return true;
    }

    public List<String> getFragments() {
        return fragments;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return fragments.equals(((ErrorSignature) o).fragments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fragments);
    }

    @Override
    public String toString() {
        return fragments.toString();
    }
}
