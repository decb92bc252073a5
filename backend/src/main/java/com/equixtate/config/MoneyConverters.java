package com.equixtate.config;

import com.equixtate.domain.Cap;
import org.bson.types.Decimal128;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;

import java.math.BigDecimal;
import java.util.List;

/**
 * Decimal128 codecs for money. Prices and declared values are plain BigDecimal; entitlement caps are
 * stored as a single Decimal128 where +Infinity means unlimited.
 */
final class MoneyConverters {

    private MoneyConverters() {
    }

    static List<Converter<?, ?>> all() {
        return List.of(new AmountWriter(), new AmountReader(), new CapWriter(), new CapReader());
    }

    @WritingConverter
    static class AmountWriter implements Converter<BigDecimal, Decimal128> {
        @Override
        public Decimal128 convert(BigDecimal source) {
            return new Decimal128(source);
        }
    }

    @ReadingConverter
    static class AmountReader implements Converter<Decimal128, BigDecimal> {
        @Override
        public BigDecimal convert(Decimal128 source) {
            return source.bigDecimalValue();
        }
    }

    @WritingConverter
    static class CapWriter implements Converter<Cap, Decimal128> {
        @Override
        public Decimal128 convert(Cap source) {
            return source.isUnlimited() ? Decimal128.POSITIVE_INFINITY : new Decimal128(source.amount());
        }
    }

    @ReadingConverter
    static class CapReader implements Converter<Decimal128, Cap> {
        @Override
        public Cap convert(Decimal128 source) {
            if (source.isInfinite()) {
                return Cap.UNLIMITED;
            }
            return new Cap(source.bigDecimalValue());
        }
    }
}
