package com.equixtate.domain;

import com.equixtate.common.OnboardingException;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Property listing moving through verification and tokenization. Persisted in property_onboardings.
 * status only changes through {@link #transitionTo}; tokenization only through {@link #markListed}.
 * Once LISTED or REJECTED the status is frozen, but admin notes may still be appended.
 */
@Document(collection = "property_onboardings")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PropertyOnboarding implements OnboardingRecord<PropertyOnboarding> {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Setter(AccessLevel.NONE)
    private String ownerPrincipal;
    /** Lower-cased owner for case-insensitive lookup. */
    @Indexed
    @Setter(AccessLevel.NONE)
    private String ownerKey;
    @Setter(AccessLevel.NONE)
    private PropertyStatus status;
    private PropertyFields propertyFields;
    private PropertyDocuments documents;
    private VerificationRecord verification;
    @Setter(AccessLevel.NONE)
    private Tokenization tokenization;
    @Setter(AccessLevel.NONE)
    private List<AdminNote> adminNotes = new ArrayList<>();
    @Setter(AccessLevel.NONE)
    private List<StatusChange> statusHistory = new ArrayList<>();
    @Version
    private Long version;
    private Instant createdAt;
    private Instant updatedAt;

    public static PropertyOnboarding draft(String id, String ownerPrincipal, PropertyFields fields,
                                           PropertyDocuments documents, Instant now) {
        PropertyOnboarding onboarding = new PropertyOnboarding();
        onboarding.id = id;
        onboarding.setOwner(ownerPrincipal);
        onboarding.propertyFields = fields;
        onboarding.documents = documents;
        onboarding.status = PropertyStatus.DRAFT;
        onboarding.statusHistory.add(new StatusChange(null, PropertyStatus.DRAFT.name(), now));
        onboarding.createdAt = now;
        onboarding.updatedAt = now;
        return onboarding;
    }

    public static String ownerKey(String principal) {
        return principal == null ? null : principal.trim().toLowerCase(Locale.ROOT);
    }

    private void setOwner(String principal) {
        this.ownerPrincipal = principal == null ? null : principal.trim();
        this.ownerKey = ownerKey(principal);
    }

    /**
     * Moves to next along the transition table.
     *
     * @throws OnboardingException TRANSITION / INVALID_TRANSITION if the edge does not exist; status unchanged
     */
    public void transitionTo(PropertyStatus next, Instant at) {
        if (status == null || !status.canTransitionTo(next)) {
            throw OnboardingException.transition(OnboardingException.INVALID_TRANSITION,
                    "Property " + id + " cannot move from " + status + " to " + next);
        }
        statusHistory.add(new StatusChange(status.name(), next.name(), at));
        status = next;
    }

    /** TOKENIZATION_IN_PROGRESS -> LISTED, recording the registry receipt. */
    public void markListed(Tokenization listing, Instant at) {
        transitionTo(PropertyStatus.LISTED, at);
        this.tokenization = listing;
    }

    public void addAdminNote(String note, Instant at) {
        adminNotes.add(new AdminNote(at, note));
    }

    @Override
    public String getPrincipal() {
        return ownerPrincipal;
    }

    @Override
    public PropertyOnboarding copy() {
        PropertyOnboarding c = new PropertyOnboarding();
        c.id = id;
        c.ownerPrincipal = ownerPrincipal;
        c.ownerKey = ownerKey;
        c.status = status;
        c.propertyFields = propertyFields;
        c.documents = documents;
        c.verification = verification;
        c.tokenization = tokenization;
        c.adminNotes = new ArrayList<>(adminNotes);
        c.statusHistory = new ArrayList<>(statusHistory);
        c.version = version;
        c.createdAt = createdAt;
        c.updatedAt = updatedAt;
        return c;
    }
}
