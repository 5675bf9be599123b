package com.example.shipment_costing.fx;

import static com.example.shipment_costing.costing.Money.HUNDRED;
import static com.example.shipment_costing.costing.Money.isPositive;
import static com.example.shipment_costing.costing.Money.round4;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.reactive.function.client.WebClient;

import com.example.shipment_costing.audit.AuditAction;
import com.example.shipment_costing.audit.AuditEvent;
import com.example.shipment_costing.audit.AuditSink;
import com.example.shipment_costing.entity.Currency;
import com.example.shipment_costing.entity.ExchangeRate;
import com.example.shipment_costing.exception.ValidationException;
import com.example.shipment_costing.repo.ExchangeRateRepository;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class ExchangeRateService {

    private static final Logger log = LoggerFactory.getLogger(ExchangeRateService.class);
    static final String SOURCE_API = "ExchangeRate-API";
    static final String SOURCE_AUTO = "AUTO_REFRESH";
    static final String SOURCE_MANUAL = "MANUAL";

    private final ExchangeRateRepository repo;
    private final WebClient.Builder webClientBuilder;
    private final AuditSink audit;

    @Value("${fx.api-key:}")
    private String apiKey;

    @Value("${fx.api-base-url:https://v6.exchangerate-api.com/v6}")
    private String apiBaseUrl;

    @Value("${fx.zone:Africa/Cairo}")
    private String zone;

    @Value("${fx.default-rmb-egp:7.0000}")
    private BigDecimal defaultRmbEgp;

    @Value("${fx.default-usd-rmb:7.2000}")
    private BigDecimal defaultUsdRmb;

    @Value("${fx.anomaly-threshold-percent:5.0}")
    private BigDecimal anomalyThresholdPercent;

    /**
     * Daily refresh of RMB->EGP and USD->RMB.
     */
    @Scheduled(cron = "${fx.refresh-cron:0 0 9 * * *}", zone = "${fx.zone:Africa/Cairo}")
    public void scheduledRefresh() {
        log.info("Scheduled exchange rate refresh starting...");
        try {
            refreshRates("SYSTEM");
        } catch (Exception e) {
            log.error("Scheduled exchange rate refresh failed", e);
        }
    }

    public Optional<ExchangeRate> latest(Currency from, Currency to) {
        return repo.findTopByFromCurrencyAndToCurrencyOrderByRateDateDescIdDesc(from, to);
    }

    /**
     * Rates read once for a calculation. A pair with no recorded rate is null.
     */
    public RateSnapshot currentSnapshot() {
        Optional<ExchangeRate> rmbEgp = latest(Currency.RMB, Currency.EGP);
        Optional<ExchangeRate> usdRmb = latest(Currency.USD, Currency.RMB);
        return new RateSnapshot(
                rmbEgp.map(ExchangeRate::getRateValue).orElse(null),
                usdRmb.map(ExchangeRate::getRateValue).orElse(null),
                rmbEgp.map(ExchangeRate::getRateDate).orElse(null));
    }

    public List<ExchangeRate> list() {
        return repo.findAllByOrderByRateDateDescIdDesc();
    }

    public List<ExchangeRate> anomalies() {
        return repo.findTop100ByAnomalyTrueOrderByRateDateDescIdDesc();
    }

    @Transactional
    public ExchangeRate recordRate(LocalDate rateDate, Currency from, Currency to, BigDecimal value,
            String source, String userId) {
        if (from == null || to == null) {
            throw new ValidationException("fromCurrency and toCurrency are required");
        }
        if (from == to) {
            throw new ValidationException("fromCurrency and toCurrency must differ");
        }
        if (!isPositive(value) || round4(value).signum() <= 0) {
            throw new ValidationException("rateValue must be positive");
        }

        ExchangeRate row = new ExchangeRate();
        row.setRateDate(rateDate != null ? rateDate : today());
        row.setFromCurrency(from);
        row.setToCurrency(to);
        row.setRateValue(round4(value));
        row.setSource(source == null || source.isBlank() ? SOURCE_MANUAL : source);

        // change against the previous rate of the pair
        latest(from, to).ifPresent(last -> {
            BigDecimal lastRate = last.getRateValue();
            if (!isPositive(lastRate)) {
                return;
            }
            BigDecimal changePercent = row.getRateValue().subtract(lastRate)
                    .divide(lastRate, 6, RoundingMode.HALF_UP)
                    .multiply(HUNDRED)
                    .setScale(4, RoundingMode.HALF_UP);
            row.setChangePercent(changePercent);
            if (changePercent.abs().compareTo(anomalyThresholdPercent) >= 0) {
                row.setAnomaly(true);
                log.error("Exchange rate ANOMALY: 1 {} = {} {} (change {}%, previous {}) - manual review needed",
                        from, row.getRateValue(), to, changePercent.setScale(2, RoundingMode.HALF_UP), lastRate);
            }
        });

        ExchangeRate saved = repo.save(row);
        log.info("Exchange rate recorded: 1 {} = {} {} on {} ({})",
                from, saved.getRateValue(), to, saved.getRateDate(), saved.getSource());

        Map<String, Object> details = new HashMap<>();
        details.put("pair", from + "/" + to);
        details.put("rateValue", saved.getRateValue().toPlainString());
        details.put("rateDate", saved.getRateDate().toString());
        details.put("source", saved.getSource());
        details.put("anomaly", saved.isAnomaly());
        audit.record(AuditEvent.of(userId, "EXCHANGE_RATE", saved.getId(), AuditAction.CREATE, details));
        return saved;
    }

    /**
     * Appends today's RMB->EGP and USD->RMB rates. Each pair comes from the
     * external API when a key is configured, else from the latest known rate
     * or the configured default.
     */
    @Transactional
    public List<ExchangeRate> refreshRates(String userId) {
        List<ExchangeRate> out = new ArrayList<>();
        out.add(refreshPair(Currency.RMB, Currency.EGP, defaultRmbEgp, userId));
        out.add(refreshPair(Currency.USD, Currency.RMB, defaultUsdRmb, userId));
        return out;
    }

    private ExchangeRate refreshPair(Currency from, Currency to, BigDecimal fallback, String userId) {
        if (apiKey != null && !apiKey.isBlank()) {
            try {
                BigDecimal fetched = fetchRateFromApi(from, to);
                return recordRate(today(), from, to, fetched, SOURCE_API, userId);
            } catch (RuntimeException e) {
                log.warn("Exchange rate fetch failed for {}/{}, falling back: {}", from, to, e.getMessage());
            }
        } else {
            log.debug("fx.api-key not configured, re-recording latest {}/{}", from, to);
        }
        BigDecimal rate = latest(from, to).map(ExchangeRate::getRateValue).orElse(fallback);
        return recordRate(today(), from, to, rate, SOURCE_AUTO, userId);
    }

    private BigDecimal fetchRateFromApi(Currency from, Currency to) {
        String url = String.format("%s/%s/pair/%s/%s", apiBaseUrl, apiKey, isoCode(from), isoCode(to));

        @SuppressWarnings("unchecked")
        Map<String, Object> response = webClientBuilder.build()
                .get()
                .uri(url)
                .retrieve()
                .bodyToMono(Map.class)
                .block();

        if (response == null) {
            throw new IllegalStateException("Empty response from exchange rate API");
        }
        if (!"success".equals(response.get("result"))) {
            throw new IllegalStateException("Exchange rate API error: " + response.get("error-type"));
        }
        Object rateObj = response.get("conversion_rate");
        if (rateObj == null) {
            throw new IllegalStateException("Exchange rate API returned no conversion_rate");
        }
        // via String to keep the decimal digits as sent
        BigDecimal rate = new BigDecimal(String.valueOf(rateObj));
        if (rate.signum() <= 0) {
            throw new IllegalStateException("Invalid rate received: " + rate);
        }
        return rate;
    }

    private static String isoCode(Currency c) {
        return c == Currency.RMB ? "CNY" : c.name();
    }

    private LocalDate today() {
        return LocalDate.now(ZoneId.of(zone));
    }
}
