package com.equixtate.domain;

import com.equixtate.common.OnboardingException;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * KYC record, one per wallet principal. Persisted in user_onboardings keyed by the lower-cased principal.
 * tier and entitlements change together through {@link #assignTier}; EXPIRED is derived, never stored.
 */
@Document(collection = "user_onboardings")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class UserOnboarding implements OnboardingRecord<UserOnboarding> {

    @Id
    @EqualsAndHashCode.Include
    @Setter(AccessLevel.NONE)
    private String id;
    @Setter(AccessLevel.NONE)
    private String walletPrincipal;
    @Setter(AccessLevel.NONE)
    private UserVerificationStatus status;
    @Setter(AccessLevel.NONE)
    private KycTier tier;
    @Setter(AccessLevel.NONE)
    private Entitlements entitlements;
    private PersonalInfo personalInfo = PersonalInfo.EMPTY;
    private UserDocuments documents = UserDocuments.EMPTY;
    private VerificationRecord verification;
    private ComplianceFlags compliance = ComplianceFlags.NOT_SCREENED;
    @Setter(AccessLevel.NONE)
    private List<StatusChange> statusHistory = new ArrayList<>();
    @Version
    private Long version;
    private Instant createdAt;
    private Instant updatedAt;

    public static UserOnboarding unverified(String walletPrincipal, Function<KycTier, Entitlements> policy,
                                            Instant now) {
        UserOnboarding onboarding = new UserOnboarding();
        onboarding.id = key(walletPrincipal);
        onboarding.walletPrincipal = walletPrincipal.trim();
        onboarding.status = UserVerificationStatus.UNVERIFIED;
        onboarding.statusHistory.add(new StatusChange(null, UserVerificationStatus.UNVERIFIED.name(), now));
        onboarding.assignTier(KycTier.NONE, policy);
        onboarding.createdAt = now;
        onboarding.updatedAt = now;
        return onboarding;
    }

    /** Store key for a principal: trimmed and lower-cased. */
    public static String key(String principal) {
        return principal == null ? null : principal.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Moves to next along the transition table.
     *
     * @throws OnboardingException TRANSITION / INVALID_TRANSITION if the edge does not exist; status unchanged
     */
    public void transitionTo(UserVerificationStatus next, Instant at) {
        if (status == null || !status.canTransitionTo(next)) {
            throw OnboardingException.transition(OnboardingException.INVALID_TRANSITION,
                    "User " + walletPrincipal + " cannot move from " + status + " to " + next);
        }
        statusHistory.add(new StatusChange(status.name(), next.name(), at));
        status = next;
    }

    /** Sets tier and recomputes entitlements from the same policy in one step. */
    public void assignTier(KycTier newTier, Function<KycTier, Entitlements> policy) {
        this.tier = newTier == null ? KycTier.NONE : newTier;
        this.entitlements = policy.apply(this.tier);
    }

    /** Stored status, except VERIFIED past its expiry reads as EXPIRED. */
    public UserVerificationStatus effectiveStatus(Instant now) {
        if (status == UserVerificationStatus.VERIFIED
                && (verification == null || verification.isExpiredAt(now))) {
            return UserVerificationStatus.EXPIRED;
        }
        return status;
    }

    public boolean isVerifiedAt(Instant now) {
        return effectiveStatus(now) == UserVerificationStatus.VERIFIED;
    }

    @Override
    public String getPrincipal() {
        return walletPrincipal;
    }

    @Override
    public UserOnboarding copy() {
        UserOnboarding c = new UserOnboarding();
        c.id = id;
        c.walletPrincipal = walletPrincipal;
        c.status = status;
        c.tier = tier;
        c.entitlements = entitlements;
        c.personalInfo = personalInfo;
        c.documents = documents;
        c.verification = verification;
        c.compliance = compliance;
        c.statusHistory = new ArrayList<>(statusHistory);
        c.version = version;
        c.createdAt = createdAt;
        c.updatedAt = updatedAt;
        return c;
    }
}
