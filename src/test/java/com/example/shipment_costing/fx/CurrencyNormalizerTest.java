package com.example.shipment_costing.fx;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

import com.example.shipment_costing.entity.Currency;
import com.example.shipment_costing.exception.ValidationException;

class CurrencyNormalizerTest {

    private final CurrencyNormalizer normalizer = new CurrencyNormalizer();

    @Test
    void egpPassesThroughWithoutRate() {
        NormalizedAmount n = normalizer.normalize(Currency.EGP, new BigDecimal("400"), new BigDecimal("9.99"));

        assertThat(n.amountEgp()).isEqualByComparingTo("400.00");
        assertThat(n.amountOriginal()).isEqualByComparingTo("400.00");
        assertThat(n.exchangeRateToEgp()).isNull();
    }

    @Test
    void rmbIsConvertedAndRoundedHalfUp() {
        NormalizedAmount n = normalizer.normalize(Currency.RMB, new BigDecimal("100"), new BigDecimal("7"));

        assertThat(n.amountEgp()).isEqualByComparingTo("700.00");
        assertThat(n.exchangeRateToEgp()).isEqualTo(new BigDecimal("7.0000"));

        // 33.33 * 7.1505 = 238.326165 -> 238.33
        NormalizedAmount odd = normalizer.normalize(Currency.RMB, new BigDecimal("33.33"), new BigDecimal("7.1505"));
        assertThat(odd.amountEgp()).isEqualTo(new BigDecimal("238.33"));
    }

    @Test
    void rateIsStoredAtFourDecimals() {
        NormalizedAmount n = normalizer.normalize(Currency.RMB, new BigDecimal("10"), new BigDecimal("7.15005"));

        assertThat(n.exchangeRateToEgp()).isEqualTo(new BigDecimal("7.1501"));
        assertThat(n.amountEgp()).isEqualTo(new BigDecimal("71.50"));
    }

    @Test
    void usdNeedsAnExplicitRate() {
        NormalizedAmount n = normalizer.normalize(Currency.USD, new BigDecimal("10"), new BigDecimal("48.5"));
        assertThat(n.amountEgp()).isEqualByComparingTo("485.00");

        assertThrows(ValidationException.class,
                () -> normalizer.normalize(Currency.USD, new BigDecimal("10"), null));
    }

    @Test
    void rmbWithoutRateIsRejected() {
        assertThrows(ValidationException.class,
                () -> normalizer.normalize(Currency.RMB, new BigDecimal("100"), null));
        assertThrows(ValidationException.class,
                () -> normalizer.normalize(Currency.RMB, new BigDecimal("100"), BigDecimal.ZERO));
        assertThrows(ValidationException.class,
                () -> normalizer.normalize(Currency.RMB, new BigDecimal("100"), new BigDecimal("-7")));
    }

    @Test
    void nonPositiveAmountsAreRejected() {
        assertThrows(ValidationException.class,
                () -> normalizer.normalize(Currency.EGP, BigDecimal.ZERO, null));
        assertThrows(ValidationException.class,
                () -> normalizer.normalize(Currency.EGP, new BigDecimal("-1"), null));
        assertThrows(ValidationException.class,
                () -> normalizer.normalize(Currency.EGP, new BigDecimal("0.001"), null));
        assertThrows(ValidationException.class,
                () -> normalizer.normalize(null, BigDecimal.TEN, null));
    }
}
