package com.equixtate.config;

import com.equixtate.domain.Cap;
import org.bson.types.Decimal128;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class MoneyConvertersTest {

    @Test
    @DisplayName("unlimited cap is written as Decimal128 +Infinity and read back as UNLIMITED")
    void unlimitedCap() {
        Decimal128 stored = new MoneyConverters.CapWriter().convert(Cap.UNLIMITED);

        assertThat(stored).isEqualTo(Decimal128.POSITIVE_INFINITY);
        assertThat(new MoneyConverters.CapReader().convert(stored)).isEqualTo(Cap.UNLIMITED);
    }

    @Test
    @DisplayName("finite cap and price keep their exact value")
    void finiteValues() {
        Decimal128 cap = new MoneyConverters.CapWriter().convert(Cap.of(50_000));
        Decimal128 price = new MoneyConverters.AmountWriter().convert(new BigDecimal("100000.25"));

        assertThat(new MoneyConverters.CapReader().convert(cap)).isEqualTo(Cap.of(50_000));
        assertThat(new MoneyConverters.AmountReader().convert(price)).isEqualByComparingTo("100000.25");
        assertThat(MoneyConverters.all()).hasSize(4);
    }
}
