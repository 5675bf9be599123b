package com.example.shipment_costing.costing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.example.shipment_costing.entity.Shipment;
import com.example.shipment_costing.entity.ShipmentItem;
import com.example.shipment_costing.entity.ShippingDetails;
import com.example.shipment_costing.exception.ValidationException;
import com.example.shipment_costing.fx.RateSnapshot;

class ShipmentCostAggregatorTest {

    private final ShipmentCostAggregator aggregator = new ShipmentCostAggregator();

    @Test
    void deriveLineTotals_multipliesCartonsPiecesAndPrice() {
        ShipmentItem item = item(10, 12, "5.00");

        aggregator.deriveLineTotals(item);

        assertEquals(120, item.getTotalPieces());
        assertThat(item.getLineTotalRmb()).isEqualTo(new BigDecimal("600.00"));
    }

    @Test
    void deriveLineTotals_rejectsPieceCountBeyondIntRange() {
        ShipmentItem item = item(50_000, 50_000, "1.00");

        assertThrows(ValidationException.class, () -> aggregator.deriveLineTotals(item));
        assertEquals(0, item.getTotalPieces());
    }

    @Test
    void commissionUsesRateAtShipping() {
        ShippingDetails shipping = shipping("5", null, null, null, "7.15");

        CostBreakdown b = aggregator.aggregate(List.of(item(10, 12, "5.00")), shipping, null);

        assertThat(b.getPurchaseCostRmb()).isEqualTo(new BigDecimal("600.00"));
        assertThat(b.getCommissionCostRmb()).isEqualTo(new BigDecimal("30.00"));
        assertThat(b.getCommissionCostEgp()).isEqualTo(new BigDecimal("214.50"));
        assertThat(b.getPurchaseCostEgp()).isEqualTo(new BigDecimal("4290.00"));
        assertThat(b.getFinalTotalCostEgp()).isEqualTo(new BigDecimal("4504.50"));
        assertFalse(b.isPreliminary());
    }

    @Test
    void shippingConvertsUsdToRmbToEgp() {
        ShippingDetails shipping = shipping("0", "12.5", "80", "7.2", "6.9");

        CostBreakdown b = aggregator.aggregate(List.of(), shipping, null);

        assertThat(b.getShippingCostUsd()).isEqualTo(new BigDecimal("1000.00"));
        assertThat(b.getShippingCostRmb()).isEqualTo(new BigDecimal("7200.00"));
        assertThat(b.getShippingCostEgp()).isEqualTo(new BigDecimal("49680.00"));
        assertThat(b.getFinalTotalCostEgp()).isEqualTo(new BigDecimal("49680.00"));
    }

    @Test
    void customsAndTakhreegArePerCarton() {
        ShipmentItem a = item(10, 12, "5.00");
        a.setCustomsCostPerCartonEgp(new BigDecimal("50"));
        a.setTakhreegCostPerCartonEgp(new BigDecimal("20.5"));
        ShipmentItem b = item(3, 1, "1.00");
        b.setCustomsCostPerCartonEgp(new BigDecimal("10"));

        CostBreakdown out = aggregator.aggregate(List.of(a, b), shipping("0", null, null, null, "7"), null);

        assertThat(out.getCustomsCostEgp()).isEqualTo(new BigDecimal("530.00"));
        assertThat(out.getTakhreegCostEgp()).isEqualTo(new BigDecimal("205.00"));
        // purchase 603 RMB * 7 = 4221
        assertThat(out.getFinalTotalCostEgp()).isEqualTo(new BigDecimal("4956.00"));
    }

    @Test
    void withoutShippingDetailsPurchaseIsPreliminaryAtLatestRate() {
        RateSnapshot latest = new RateSnapshot(new BigDecimal("7.0000"), new BigDecimal("7.2000"), LocalDate.now());

        CostBreakdown b = aggregator.aggregate(List.of(item(10, 12, "5.00")), null, latest);

        assertTrue(b.isPreliminary());
        assertThat(b.getPurchaseCostEgp()).isEqualTo(new BigDecimal("4200.00"));
        assertThat(b.getCommissionCostEgp()).isEqualByComparingTo("0");
        assertThat(b.getShippingCostEgp()).isEqualByComparingTo("0");
        assertThat(b.getFinalTotalCostEgp()).isEqualTo(new BigDecimal("4200.00"));
    }

    @Test
    void missingInputsGiveZeroComponents() {
        CostBreakdown noRate = aggregator.aggregate(List.of(item(1, 1, "10")), null, null);
        assertThat(noRate.getPurchaseCostRmb()).isEqualTo(new BigDecimal("10.00"));
        assertThat(noRate.getPurchaseCostEgp()).isEqualByComparingTo("0");

        CostBreakdown emptyShipping = aggregator.aggregate(List.of(item(1, 1, "10")), new ShippingDetails(), null);
        assertThat(emptyShipping.getShippingCostUsd()).isEqualByComparingTo("0");
        assertThat(emptyShipping.getCommissionCostRmb()).isEqualByComparingTo("0");
        assertThat(emptyShipping.getFinalTotalCostEgp()).isEqualByComparingTo("0");
    }

    @Test
    void purchaseIsRoundedSumOfExactLines() {
        // exact sum 0.015 rounds to 0.02; rounding each line first would give 0.03
        List<ShipmentItem> items = List.of(item(1, 1, "0.005"), item(1, 1, "0.005"), item(1, 1, "0.005"));

        CostBreakdown b = aggregator.aggregate(items, null, null);

        assertThat(b.getPurchaseCostRmb()).isEqualTo(new BigDecimal("0.02"));
    }

    @Test
    void recomputingTwiceGivesTheSameTotal() {
        List<ShipmentItem> items = List.of(item(7, 13, "3.3333"), item(2, 50, "0.77"));
        ShippingDetails shipping = shipping("3.5", "4.25", "95.5", "7.1888", "6.8321");

        CostBreakdown first = aggregator.aggregate(items, shipping, null);
        CostBreakdown second = aggregator.aggregate(items, shipping, null);

        assertEquals(first, second);
    }

    @Test
    void applyToSetsComponentsAndClampsBalance() {
        Shipment s = new Shipment();
        s.setTotalPaidEgp(new BigDecimal("5000.00"));

        aggregator.aggregate(List.of(item(10, 12, "5.00")), shipping("5", null, null, null, "7.15"), null).applyTo(s);

        assertThat(s.getFinalTotalCostEgp()).isEqualTo(new BigDecimal("4504.50"));
        assertThat(s.getBalanceEgp()).isEqualByComparingTo("0");
        assertFalse(s.isCostPreliminary());
    }

    private static ShipmentItem item(int cartons, int perCarton, String unitPrice) {
        ShipmentItem i = new ShipmentItem();
        i.setCartons(cartons);
        i.setPiecesPerCarton(perCarton);
        i.setUnitPriceRmb(new BigDecimal(unitPrice));
        return i;
    }

    private static ShippingDetails shipping(String commission, String area, String perSqm, String usdRmb,
            String rmbEgp) {
        ShippingDetails d = new ShippingDetails();
        d.setCommissionRatePercent(commission == null ? null : new BigDecimal(commission));
        d.setShippingAreaSqm(area == null ? null : new BigDecimal(area));
        d.setShippingCostPerSqmUsd(perSqm == null ? null : new BigDecimal(perSqm));
        d.setUsdToRmbRateAtShipping(usdRmb == null ? null : new BigDecimal(usdRmb));
        d.setRmbToEgpRateAtShipping(rmbEgp == null ? null : new BigDecimal(rmbEgp));
        return d;
    }
}
