package com.example.shipment_costing.shipment;

import com.example.shipment_costing.entity.ShipmentStatus;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class StatusChangeRequest {
    @NotNull
    private ShipmentStatus status;
}
