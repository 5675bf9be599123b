package com.example.shipment_costing.repo;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.shipment_costing.entity.Currency;
import com.example.shipment_costing.entity.ExchangeRate;

@Repository
public interface ExchangeRateRepository extends JpaRepository<ExchangeRate, Long> {

    /**
     * Latest rate for a pair: newest rate date, ties broken by insertion order.
     */
    Optional<ExchangeRate> findTopByFromCurrencyAndToCurrencyOrderByRateDateDescIdDesc(
            Currency fromCurrency, Currency toCurrency);

    List<ExchangeRate> findAllByOrderByRateDateDescIdDesc();

    List<ExchangeRate> findTop100ByAnomalyTrueOrderByRateDateDescIdDesc();
}
