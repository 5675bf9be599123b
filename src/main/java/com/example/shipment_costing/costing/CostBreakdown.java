package com.example.shipment_costing.costing;

import java.math.BigDecimal;

import com.example.shipment_costing.entity.Shipment;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CostBreakdown {
    BigDecimal purchaseCostRmb;
    BigDecimal purchaseCostEgp;
    BigDecimal commissionCostRmb;
    BigDecimal commissionCostEgp;
    BigDecimal shippingCostUsd;
    BigDecimal shippingCostRmb;
    BigDecimal shippingCostEgp;
    BigDecimal customsCostEgp;
    BigDecimal takhreegCostEgp;
    BigDecimal finalTotalCostEgp;
    boolean preliminary; // purchase EGP estimated from the latest rate, not the rate at shipping

    /**
     * Copies every component onto the shipment and re-derives its balance from
     * the shipment's current paid total.
     */
    public void applyTo(Shipment shipment) {
        shipment.setPurchaseCostRmb(purchaseCostRmb);
        shipment.setPurchaseCostEgp(purchaseCostEgp);
        shipment.setCommissionCostRmb(commissionCostRmb);
        shipment.setCommissionCostEgp(commissionCostEgp);
        shipment.setShippingCostUsd(shippingCostUsd);
        shipment.setShippingCostRmb(shippingCostRmb);
        shipment.setShippingCostEgp(shippingCostEgp);
        shipment.setCustomsCostEgp(customsCostEgp);
        shipment.setTakhreegCostEgp(takhreegCostEgp);
        shipment.setFinalTotalCostEgp(finalTotalCostEgp);
        shipment.setCostPreliminary(preliminary);
        shipment.setBalanceEgp(Money.balance(finalTotalCostEgp, shipment.getTotalPaidEgp()));
    }
}
