package io.surfworks.gatekeeper.core.tier;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The single, versioned definition of what each {@link Tier} contains.
 *
 * <p>Both the license authority and the client enforcement read feature lists
 * and limits from here, so the two sides cannot drift apart. The table is
 * declared as increments: each tier lists only the features it adds on top of
 * the tier below it, which makes FREE &sube; PRO &sube; ENTERPRISE hold by
 * construction. Loading also rejects a table whose limits shrink from one tier
 * to the next.
 *
 * <p>Usage:
 * <pre>{@code
 * TierTable tiers = TierTable.standard();
 * if (!tiers.allows(Tier.FREE, "write_file")) {
 *     Tier needed = tiers.requiredTierFor("write_file").orElseThrow();
 * }
 * }</pre>
 */
public final class TierTable {

    private static final String RESOURCE = "tiers.json";
    private static final Gson GSON = new Gson();

    private final int version;
    private final String upgradeUrl;
    private final Map<Tier, List<String>> features;
    private final Map<Tier, TierLimits> limits;

    private TierTable(int version, String upgradeUrl,
                      Map<Tier, List<String>> features, Map<Tier, TierLimits> limits) {
        this.version = version;
        this.upgradeUrl = upgradeUrl;
        this.features = features;
        this.limits = limits;
    }

    /**
     * The table bundled with this library, loaded once.
     */
    public static TierTable standard() {
        return Holder.STANDARD;
    }

    /**
     * Parse a tier table from JSON.
     *
     * @throws IllegalArgumentException if the table is malformed or not nested
     */
    public static TierTable parse(String json) {
        return parse(new StringReader(json));
    }

    static TierTable parse(Reader reader) {
        TableData data;
        try {
            data = GSON.fromJson(reader, TableData.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed tier table: " + e.getMessage(), e);
        }
        if (data == null || data.tiers == null) {
            throw new IllegalArgumentException("Tier table has no tiers");
        }

        Tier[] order = Tier.values();
        if (data.tiers.size() != order.length) {
            throw new IllegalArgumentException(
                "Tier table must define " + order.length + " tiers, found " + data.tiers.size());
        }

        Map<Tier, List<String>> features = new EnumMap<>(Tier.class);
        Map<Tier, TierLimits> limits = new EnumMap<>(Tier.class);
        Set<String> cumulative = new LinkedHashSet<>();
        TierLimits previous = null;

        for (int i = 0; i < order.length; i++) {
            TierData entry = data.tiers.get(i);
            Tier expected = order[i];
            if (entry.tier != expected) {
                throw new IllegalArgumentException(
                    "Tier #" + i + " must be " + expected + ", found " + entry.tier);
            }
            if (entry.limits == null) {
                throw new IllegalArgumentException("Tier " + expected + " has no limits");
            }
            if (entry.adds != null) {
                for (String feature : entry.adds) {
                    if (!cumulative.add(feature)) {
                        throw new IllegalArgumentException(
                            "Feature '" + feature + "' declared twice (at " + expected + ")");
                    }
                }
            }
            TierLimits tierLimits = new TierLimits(
                entry.limits.dailyCalls, entry.limits.maxMachines, entry.limits.concurrentSessions);
            if (previous != null && !tierLimits.covers(previous)) {
                throw new IllegalArgumentException(
                    "Limits of " + expected + " are lower than those of " + order[i - 1]);
            }
            features.put(expected, Collections.unmodifiableList(new ArrayList<>(cumulative)));
            limits.put(expected, tierLimits);
            previous = tierLimits;
        }

        return new TierTable(data.version, data.upgradeUrl, features, limits);
    }

    public int version() {
        return version;
    }

    /**
     * Where users are pointed to buy or upgrade a license.
     */
    public String upgradeUrl() {
        return upgradeUrl;
    }

    /**
     * All features of a tier, including those inherited from lower tiers.
     */
    public List<String> features(Tier tier) {
        return features.get(tier);
    }

    public TierLimits limits(Tier tier) {
        return limits.get(tier);
    }

    public boolean allows(Tier tier, String feature) {
        return features.get(tier).contains(feature);
    }

    /**
     * The smallest tier whose feature set contains {@code feature}.
     *
     * @return the tier, or empty if no tier offers the feature
     */
    public Optional<Tier> requiredTierFor(String feature) {
        for (Tier tier : Tier.values()) {
            if (allows(tier, feature)) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }

    private static final class Holder {
        static final TierTable STANDARD = load();

        private static TierTable load() {
            InputStream in = TierTable.class.getResourceAsStream(RESOURCE);
            if (in == null) {
                throw new IllegalStateException("Missing tier table resource " + RESOURCE);
            }
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                return parse(reader);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + RESOURCE, e);
            }
        }
    }

    private static class TableData {
        int version;
        String upgradeUrl;
        List<TierData> tiers;
    }

    private static class TierData {
        Tier tier;
        List<String> adds;
        LimitsData limits;
    }

    private static class LimitsData {
        int dailyCalls;
        int maxMachines;
        int concurrentSessions;
    }
}
