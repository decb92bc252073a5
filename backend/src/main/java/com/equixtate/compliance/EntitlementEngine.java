package com.equixtate.compliance;

import com.equixtate.domain.Cap;
import com.equixtate.domain.ComplianceFlags;
import com.equixtate.domain.Entitlements;
import com.equixtate.domain.KycTier;
import org.springframework.stereotype.Component;

/**
 * Maps a KYC tier to entitlements and baseline compliance flags. Pure: no I/O, no state.
 * Total over every tier; null falls back to the NONE row.
 */
@Component
public class EntitlementEngine {

    static final Entitlements NONE = new Entitlements(Cap.ZERO, Cap.ZERO, false, false);
    static final Entitlements BASIC = new Entitlements(Cap.of(10_000), Cap.of(5), false, true);
    static final Entitlements STANDARD = new Entitlements(Cap.of(50_000), Cap.of(20), false, true);
    static final Entitlements ENHANCED = new Entitlements(Cap.UNLIMITED, Cap.UNLIMITED, true, true);

    public Entitlements entitlementsForTier(KycTier tier) {
        if (tier == null) {
            return NONE;
        }
        return switch (tier) {
            case NONE -> NONE;
            case BASIC -> BASIC;
            case STANDARD -> STANDARD;
            case ENHANCED -> ENHANCED;
        };
    }

    /**
     * Baseline flags after a positive verification. Sanctions and AML default to passed here;
     * {@link ComplianceScreening} runs afterwards and may revoke them.
     */
    public ComplianceFlags complianceForTier(KycTier tier) {
        return new ComplianceFlags(tier == KycTier.ENHANCED, false, true, true);
    }
}
