package com.example.shipment_costing.costing;

import static com.example.shipment_costing.costing.Money.nz;
import static com.example.shipment_costing.costing.Money.round2;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.stereotype.Component;

import com.example.shipment_costing.entity.ShipmentItem;
import com.example.shipment_costing.entity.ShippingDetails;
import com.example.shipment_costing.exception.ValidationException;
import com.example.shipment_costing.fx.RateSnapshot;

/**
 * Recomputes a shipment's cost breakdown from its items and shipping details.
 * Always a full reduction over the current inputs, never an incremental patch.
 */
@Component
public class ShipmentCostAggregator {

    /**
     * totalPieces = cartons * piecesPerCarton, lineTotalRmb = totalPieces * unitPriceRmb.
     *
     * @throws ValidationException when the piece count does not fit an int
     */
    public void deriveLineTotals(ShipmentItem item) {
        int totalPieces;
        try {
            totalPieces = Math.multiplyExact(Math.max(0, item.getCartons()), Math.max(0, item.getPiecesPerCarton()));
        } catch (ArithmeticException e) {
            throw new ValidationException("cartons * piecesPerCarton is too large for item '"
                    + item.getProductName() + "'");
        }
        item.setTotalPieces(totalPieces);
        item.setLineTotalRmb(round2(exactLineTotal(item)));
    }

    /**
     * @param shipping null until the shipping step has been saved
     * @param latest   rates used for the preliminary purchase estimate; may be null
     */
    public CostBreakdown aggregate(List<ShipmentItem> items, ShippingDetails shipping, RateSnapshot latest) {
        BigDecimal purchaseExact = BigDecimal.ZERO;
        BigDecimal customsExact = BigDecimal.ZERO;
        BigDecimal takhreegExact = BigDecimal.ZERO;
        for (ShipmentItem item : items) {
            BigDecimal cartons = BigDecimal.valueOf(Math.max(0, item.getCartons()));
            purchaseExact = purchaseExact.add(exactLineTotal(item));
            customsExact = customsExact.add(cartons.multiply(nz(item.getCustomsCostPerCartonEgp())));
            takhreegExact = takhreegExact.add(cartons.multiply(nz(item.getTakhreegCostPerCartonEgp())));
        }

        BigDecimal purchaseRmb = round2(purchaseExact);
        BigDecimal customsEgp = round2(customsExact);
        BigDecimal takhreegEgp = round2(takhreegExact);

        BigDecimal purchaseEgp;
        BigDecimal commissionRmb = round2(BigDecimal.ZERO);
        BigDecimal commissionEgp = round2(BigDecimal.ZERO);
        BigDecimal shippingUsd = round2(BigDecimal.ZERO);
        BigDecimal shippingRmb = round2(BigDecimal.ZERO);
        BigDecimal shippingEgp = round2(BigDecimal.ZERO);
        boolean preliminary = shipping == null;

        if (shipping == null) {
            BigDecimal rate = latest == null ? BigDecimal.ZERO : nz(latest.rmbToEgp());
            purchaseEgp = round2(purchaseRmb.multiply(rate));
        } else {
            BigDecimal rmbToEgp = nz(shipping.getRmbToEgpRateAtShipping());
            BigDecimal usdToRmb = nz(shipping.getUsdToRmbRateAtShipping());

            purchaseEgp = round2(purchaseRmb.multiply(rmbToEgp));

            commissionRmb = round2(purchaseRmb.multiply(nz(shipping.getCommissionRatePercent()))
                    .divide(Money.HUNDRED));
            commissionEgp = round2(commissionRmb.multiply(rmbToEgp));

            shippingUsd = round2(nz(shipping.getShippingAreaSqm()).multiply(nz(shipping.getShippingCostPerSqmUsd())));
            shippingRmb = round2(shippingUsd.multiply(usdToRmb));
            shippingEgp = round2(shippingRmb.multiply(rmbToEgp));
        }

        BigDecimal finalTotal = round2(purchaseEgp
                .add(commissionEgp)
                .add(shippingEgp)
                .add(customsEgp)
                .add(takhreegEgp));

        return CostBreakdown.builder()
                .purchaseCostRmb(purchaseRmb)
                .purchaseCostEgp(purchaseEgp)
                .commissionCostRmb(commissionRmb)
                .commissionCostEgp(commissionEgp)
                .shippingCostUsd(shippingUsd)
                .shippingCostRmb(shippingRmb)
                .shippingCostEgp(shippingEgp)
                .customsCostEgp(customsEgp)
                .takhreegCostEgp(takhreegEgp)
                .finalTotalCostEgp(finalTotal)
                .preliminary(preliminary)
                .build();
    }

    private static BigDecimal exactLineTotal(ShipmentItem item) {
        long pieces = (long) Math.max(0, item.getCartons()) * Math.max(0, item.getPiecesPerCarton());
        return BigDecimal.valueOf(pieces).multiply(nz(item.getUnitPriceRmb()));
    }
}
