package com.questrail.tracker.protocol.suntech.config;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Hex prefixes identifying tracker tags of interest among all BLE addresses.
 *
 * <p>Prefixes are matched against the 12-digit upper-case hex rendering of an
 * address, so a prefix need not be a whole number of bytes ({@code C3000}
 * matches {@code C30000...} through {@code C3000F...}).</p>
 */
public final class TargetPrefixes {

    private static final TargetPrefixes DEFAULTS = of("AC233F", "C3000");

    private final List<String> prefixes;

    private TargetPrefixes(Collection<String> prefixes) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String p : prefixes) {
            normalized.add(normalize(p));
        }
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("At least one target prefix required");
        }
        this.prefixes = List.copyOf(normalized);
    }

    public static TargetPrefixes of(String... prefixes) {
        return new TargetPrefixes(Arrays.asList(prefixes));
    }

    public static TargetPrefixes of(Collection<String> prefixes) {
        return new TargetPrefixes(prefixes);
    }

    /**
     * The vendor prefixes deployed tags are known to use.
     */
    public static TargetPrefixes defaults() {
        return DEFAULTS;
    }

    /**
     * Parses a comma-separated list such as {@code "AC233F, C3000"}.
     */
    public static TargetPrefixes parse(String csv) {
        Objects.requireNonNull(csv, "csv");
        return new TargetPrefixes(Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList()));
    }

    /**
     * @param addressHex 12 upper-case hex digits, no separators
     */
    public boolean matches(String addressHex) {
        for (String p : prefixes) {
            if (addressHex.startsWith(p)) {
                return true;
            }
        }
        return false;
    }

    public List<String> prefixes() {
        return prefixes;
    }

    private static String normalize(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        String p = prefix.replace(":", "").trim().toUpperCase(Locale.ROOT);
        if (p.isEmpty() || p.length() > 12) {
            throw new IllegalArgumentException("Target prefix must be 1-12 hex digits: '" + prefix + "'");
        }
        for (int i = 0; i < p.length(); i++) {
            if (Character.digit(p.charAt(i), 16) < 0) {
                throw new IllegalArgumentException("Target prefix is not hex: '" + prefix + "'");
            }
        }
        return p;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TargetPrefixes that)) return false;
        return prefixes.equals(that.prefixes);
    }

    @Override
    public int hashCode() {
        return prefixes.hashCode();
    }

    @Override
    public String toString() {
        return "TargetPrefixes" + prefixes;
    }
}
