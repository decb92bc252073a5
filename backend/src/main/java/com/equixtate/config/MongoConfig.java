package com.equixtate.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

/**
 * Registers the Decimal128 money codecs for prices and entitlement caps.
 * Indexes come from @Indexed on the onboarding documents at startup.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(MoneyConverters.all());
    }
}
