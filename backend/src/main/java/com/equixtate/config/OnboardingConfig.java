package com.equixtate.config;

import com.equixtate.compliance.ComplianceScreening;
import com.equixtate.compliance.PassThroughComplianceScreening;
import com.equixtate.domain.PropertyOnboarding;
import com.equixtate.domain.UserOnboarding;
import com.equixtate.onboarding.config.OnboardingProperties;
import com.equixtate.onboarding.property.OffChainTokenRegistry;
import com.equixtate.onboarding.property.TokenRegistry;
import com.equixtate.store.InMemoryOnboardingStore;
import com.equixtate.store.MongoOnboardingStore;
import com.equixtate.store.OnboardingStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;

/**
 * Wires the onboarding stores (mongo or memory, from equixtate.onboarding.store) and the replaceable
 * collaborators: clock, token registry and compliance screening.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(OnboardingProperties.class)
public class OnboardingConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public OnboardingStore<PropertyOnboarding> propertyOnboardingStore(OnboardingProperties properties,
                                                                       MongoTemplate mongoTemplate, Clock clock) {
        if (properties.getStore() == OnboardingProperties.StoreType.MEMORY) {
            log.warn("Property onboardings are kept in memory and lost on restart");
            return new InMemoryOnboardingStore<>(clock);
        }
        return new MongoOnboardingStore<>(mongoTemplate, PropertyOnboarding.class, "ownerKey", clock);
    }

    @Bean
    public OnboardingStore<UserOnboarding> userOnboardingStore(OnboardingProperties properties,
                                                               MongoTemplate mongoTemplate, Clock clock) {
        if (properties.getStore() == OnboardingProperties.StoreType.MEMORY) {
            log.warn("User onboardings are kept in memory and lost on restart");
            return new InMemoryOnboardingStore<>(clock);
        }
        return new MongoOnboardingStore<>(mongoTemplate, UserOnboarding.class, "_id", clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenRegistry tokenRegistry(Clock clock) {
        return new OffChainTokenRegistry(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ComplianceScreening complianceScreening() {
        return new PassThroughComplianceScreening();
    }
}
