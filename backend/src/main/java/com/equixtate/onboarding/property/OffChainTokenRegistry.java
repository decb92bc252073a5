package com.equixtate.onboarding.property;

import com.equixtate.common.ContentHash;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * Registry used when no on-chain registry is wired. The token id and pseudo transaction hash are
 * derived from the deed fingerprint, so re-registering the same deed yields the same token id.
 */
@Slf4j
public class OffChainTokenRegistry implements TokenRegistry {

    static final String REFERENCE_PREFIX = "offchain:";

    private final Clock clock;

    public OffChainTokenRegistry(Clock clock) {
        this.clock = clock;
    }

    @Override
    public TokenizationReceipt register(TokenizationRequest request) {
        String anchor = request.deedHash() != null
                ? request.deedHash()
                : ContentHash.of(request.ownerPrincipal() + ":" + request.name() + ":" + request.location());
        String tokenId = anchor.substring(2, 18);
        String txHash = ContentHash.of("register:" + request.propertyId() + ":" + anchor + ":" + clock.millis());
        log.info("Off-chain registration of {} as token {} ({} tokens)", request.propertyId(), tokenId,
                request.totalTokens());
        return new TokenizationReceipt(REFERENCE_PREFIX + request.propertyId(), tokenId, txHash);
    }
}
