package com.example.shipment_costing.fx;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.reactive.function.client.WebClient;

import com.example.shipment_costing.audit.AuditEvent;
import com.example.shipment_costing.audit.AuditSink;
import com.example.shipment_costing.entity.Currency;
import com.example.shipment_costing.entity.ExchangeRate;
import com.example.shipment_costing.exception.ValidationException;
import com.example.shipment_costing.repo.ExchangeRateRepository;

class ExchangeRateServiceTest {

    private ExchangeRateRepository repo;
    private WebClient.Builder webClientBuilder;
    private AuditSink audit;
    private ExchangeRateService service;

    @BeforeEach
    void setUp() {
        repo = mock(ExchangeRateRepository.class);
        webClientBuilder = mock(WebClient.Builder.class);
        audit = mock(AuditSink.class);
        service = new ExchangeRateService(repo, webClientBuilder, audit);
        ReflectionTestUtils.setField(service, "apiKey", "");
        ReflectionTestUtils.setField(service, "apiBaseUrl", "https://fx.invalid/v6");
        ReflectionTestUtils.setField(service, "zone", "Africa/Cairo");
        ReflectionTestUtils.setField(service, "defaultRmbEgp", new BigDecimal("7.0000"));
        ReflectionTestUtils.setField(service, "defaultUsdRmb", new BigDecimal("7.2000"));
        ReflectionTestUtils.setField(service, "anomalyThresholdPercent", new BigDecimal("5.0"));

        when(repo.save(any(ExchangeRate.class))).thenAnswer(inv -> inv.getArgument(0));
        when(repo.findTopByFromCurrencyAndToCurrencyOrderByRateDateDescIdDesc(any(), any()))
                .thenReturn(Optional.empty());
    }

    @Test
    void jumpAboveThresholdIsFlaggedAsAnomaly() {
        latestRmbEgp("7.0000");

        ExchangeRate saved = service.recordRate(LocalDate.of(2024, 3, 1), Currency.RMB, Currency.EGP,
                new BigDecimal("7.5"), null, "accountant");

        assertTrue(saved.isAnomaly());
        assertThat(saved.getChangePercent()).isEqualByComparingTo("7.1429");
        assertEquals("MANUAL", saved.getSource());
        assertThat(saved.getRateValue()).isEqualByComparingTo("7.5000");
        verify(audit).record(any(AuditEvent.class));
    }

    @Test
    void smallMoveIsNotAnomaly() {
        latestRmbEgp("7.0000");

        ExchangeRate saved = service.recordRate(LocalDate.of(2024, 3, 1), Currency.RMB, Currency.EGP,
                new BigDecimal("7.10"), "MANUAL", "accountant");

        assertFalse(saved.isAnomaly());
        assertThat(saved.getChangePercent()).isEqualByComparingTo("1.4286");
    }

    @Test
    void firstRateHasNoChange() {
        ExchangeRate saved = service.recordRate(null, Currency.USD, Currency.RMB, new BigDecimal("7.2"), null,
                "accountant");

        assertNull(saved.getChangePercent());
        assertFalse(saved.isAnomaly());
        assertEquals(LocalDate.now(ZoneId.of("Africa/Cairo")), saved.getRateDate());
    }

    @Test
    void invalidRatesAreRejected() {
        assertThrows(ValidationException.class, () -> service.recordRate(null, Currency.EGP, Currency.EGP,
                BigDecimal.ONE, null, "accountant"));
        assertThrows(ValidationException.class, () -> service.recordRate(null, Currency.RMB, Currency.EGP,
                BigDecimal.ZERO, null, "accountant"));
        assertThrows(ValidationException.class, () -> service.recordRate(null, Currency.RMB, Currency.EGP,
                new BigDecimal("0.00001"), null, "accountant"));
        assertThrows(ValidationException.class, () -> service.recordRate(null, null, Currency.EGP,
                BigDecimal.ONE, null, "accountant"));
        verify(repo, never()).save(any());
    }

    @Test
    void refreshWithoutApiKeyReusesLatestOrDefault() {
        latestRmbEgp("7.1500");

        List<ExchangeRate> rates = service.refreshRates("SYSTEM");

        assertEquals(2, rates.size());
        assertThat(rates.get(0).getRateValue()).isEqualByComparingTo("7.1500");
        assertEquals(Currency.RMB, rates.get(0).getFromCurrency());
        assertThat(rates.get(1).getRateValue()).isEqualByComparingTo("7.2000");
        assertEquals(Currency.USD, rates.get(1).getFromCurrency());
        assertThat(rates).allMatch(r -> ExchangeRateService.SOURCE_AUTO.equals(r.getSource()));
        verify(webClientBuilder, never()).build();
    }

    @Test
    void refreshFallsBackWhenApiFails() {
        ReflectionTestUtils.setField(service, "apiKey", "test-key");
        when(webClientBuilder.build()).thenThrow(new IllegalStateException("connection refused"));

        List<ExchangeRate> rates = service.refreshRates("SYSTEM");

        assertThat(rates.get(0).getRateValue()).isEqualByComparingTo("7.0000");
        assertEquals(ExchangeRateService.SOURCE_AUTO, rates.get(0).getSource());
    }

    @Test
    void snapshotLeavesMissingPairsNull() {
        latestRmbEgp("7.1500");

        RateSnapshot snap = service.currentSnapshot();

        assertThat(snap.rmbToEgp()).isEqualByComparingTo("7.1500");
        assertNull(snap.usdToRmb());
        assertEquals(LocalDate.of(2024, 2, 1), snap.asOf());
    }

    private void latestRmbEgp(String value) {
        ExchangeRate last = new ExchangeRate();
        last.setId(1L);
        last.setRateDate(LocalDate.of(2024, 2, 1));
        last.setFromCurrency(Currency.RMB);
        last.setToCurrency(Currency.EGP);
        last.setRateValue(new BigDecimal(value));
        when(repo.findTopByFromCurrencyAndToCurrencyOrderByRateDateDescIdDesc(Currency.RMB, Currency.EGP))
                .thenReturn(Optional.of(last));
    }
}
