package com.equixtate.onboarding;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Writes one audit log line per persisted status change.
 */
@Component
@Slf4j
public class OnboardingAuditListener {

    @EventListener
    public void onStatusChanged(OnboardingStatusChangedEvent event) {
        log.info("audit {} {} {} -> {} (v{}) at {}", event.subjectKind(), event.recordId(), event.from(),
                event.to(), event.version(), event.at());
    }
}
