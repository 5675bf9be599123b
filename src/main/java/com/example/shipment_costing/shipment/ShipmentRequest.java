package com.example.shipment_costing.shipment;

import java.time.LocalDate;
import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * One wizard step. Create always behaves as step 1.
 *
 * <ul>
 * <li>1: header and items</li>
 * <li>2: shipping details</li>
 * <li>3: customs and takhreeg per item</li>
 * <li>4: final save, marks the shipment received</li>
 * </ul>
 */
@Data
public class ShipmentRequest {
    @Min(1)
    @Max(4)
    private Integer step;

    @Size(max = 50)
    private String shipmentCode;

    private String shipmentName;
    private LocalDate purchaseDate;

    @Valid
    private List<ItemRequest> items;

    @Valid
    private ShippingRequest shipping;

    @Valid
    private List<CustomsRequest> customs;
}
