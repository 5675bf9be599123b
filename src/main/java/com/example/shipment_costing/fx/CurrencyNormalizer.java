package com.example.shipment_costing.fx;

import static com.example.shipment_costing.costing.Money.isPositive;
import static com.example.shipment_costing.costing.Money.round2;
import static com.example.shipment_costing.costing.Money.round4;

import java.math.BigDecimal;

import org.springframework.stereotype.Component;

import com.example.shipment_costing.entity.Currency;
import com.example.shipment_costing.exception.ValidationException;

/**
 * Converts an entered payment amount into EGP. No I/O.
 */
@Component
public class CurrencyNormalizer {

    public NormalizedAmount normalize(Currency currency, BigDecimal amountOriginal, BigDecimal exchangeRateToEgp) {
        if (currency == null) {
            throw new ValidationException("paymentCurrency is required");
        }
        if (!isPositive(amountOriginal)) {
            throw new ValidationException("amountOriginal must be positive");
        }
        BigDecimal original = round2(amountOriginal);
        if (original.signum() <= 0) {
            throw new ValidationException("amountOriginal must be at least 0.01");
        }

        if (currency == Currency.EGP) {
            return new NormalizedAmount(original, original, null);
        }

        if (!isPositive(exchangeRateToEgp)) {
            throw new ValidationException(
                    "exchangeRateToEgp must be a positive number for " + currency + " payments");
        }
        BigDecimal rate = round4(exchangeRateToEgp);
        if (rate.signum() <= 0) {
            throw new ValidationException("exchangeRateToEgp rounds to zero: " + exchangeRateToEgp.toPlainString());
        }
        return new NormalizedAmount(original, round2(original.multiply(rate)), rate);
    }
}
