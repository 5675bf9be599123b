package com.example.shipment_costing.fx;

import java.security.Principal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.shipment_costing.entity.ExchangeRate;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/exchange-rates")
@RequiredArgsConstructor
public class ExchangeRateController {

    private final ExchangeRateService exchangeRateService;

    @GetMapping
    public ResponseEntity<List<ExchangeRate>> list() {
        return ResponseEntity.ok(exchangeRateService.list());
    }

    /**
     * Current RMB->EGP and USD->RMB rates. Missing pairs are null.
     */
    @GetMapping("/latest")
    public ResponseEntity<?> latest() {
        RateSnapshot snapshot = exchangeRateService.currentSnapshot();
        Map<String, Object> body = new HashMap<>();
        body.put("rmbToEgp", snapshot.rmbToEgp());
        body.put("usdToRmb", snapshot.usdToRmb());
        body.put("asOf", snapshot.asOf());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/anomalies")
    public ResponseEntity<List<ExchangeRate>> anomalies() {
        return ResponseEntity.ok(exchangeRateService.anomalies());
    }

    @PostMapping
    public ResponseEntity<ExchangeRate> create(@Valid @RequestBody ExchangeRateRequest req, Principal principal) {
        ExchangeRate saved = exchangeRateService.recordRate(req.getRateDate(), req.getFromCurrency(),
                req.getToCurrency(), req.getRateValue(), req.getSource(), principal.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(saved);
    }

    @PostMapping("/refresh")
    public ResponseEntity<?> refresh(Principal principal) {
        List<ExchangeRate> rates = exchangeRateService.refreshRates(principal.getName());
        return ResponseEntity.ok(Map.of(
                "rates", rates,
                "message", "Exchange rates refreshed"));
    }
}
