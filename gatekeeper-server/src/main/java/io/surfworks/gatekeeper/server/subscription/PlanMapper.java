package io.surfworks.gatekeeper.server.subscription;

import io.surfworks.gatekeeper.core.tier.Tier;

import java.util.Locale;
import java.util.Map;

/**
 * Maps payment-provider plan ids to tiers.
 *
 * <p>Each provider names its plans differently. Implementations translate
 * them so the rest of the system only deals with {@link Tier}.
 */
public interface PlanMapper {

    /**
     * @param planId the provider's plan id (may be null)
     * @return the tier, FREE if the plan is unknown
     */
    Tier mapPlan(String planId);

    /**
     * Keyword matching: "enterprise" or "team" gives ENTERPRISE, "pro" gives PRO.
     */
    PlanMapper KEYWORDS = planId -> {
        if (planId == null) {
            return Tier.FREE;
        }

        String name = planId.toLowerCase(Locale.ROOT);

        if (name.contains("enterprise") || name.contains("team")) {
            return Tier.ENTERPRISE;
        }
        if (name.contains("pro")) {
            return Tier.PRO;
        }

        return Tier.FREE;
    };

    /**
     * The standard plan catalog, falling back to keyword matching.
     */
    PlanMapper DEFAULT = catalog(Map.of(
        "gatekeeper_free", Tier.FREE,
        "gatekeeper_pro_monthly", Tier.PRO,
        "gatekeeper_pro_yearly", Tier.PRO,
        "gatekeeper_enterprise_monthly", Tier.ENTERPRISE,
        "gatekeeper_enterprise_yearly", Tier.ENTERPRISE
    ));

    /**
     * Explicit catalog lookup with keyword fallback for unlisted plans.
     */
    static PlanMapper catalog(Map<String, Tier> plans) {
        Map<String, Tier> copy = Map.copyOf(plans);
        return planId -> {
            Tier tier = planId != null ? copy.get(planId) : null;
            return tier != null ? tier : KEYWORDS.mapPlan(planId);
        };
    }
}
