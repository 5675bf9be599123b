package com.example.shipment_costing.supplier;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class SupplierRequest {

    @NotBlank(message = "name is required")
    private String name;

    @Size(max = 50)
    private String country;

    @Size(max = 50)
    private String phone;
}
