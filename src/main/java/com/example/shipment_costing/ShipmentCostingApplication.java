package com.example.shipment_costing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.web.bind.annotation.RestController;

@EnableScheduling
@SpringBootApplication
public class ShipmentCostingApplication {

    private static final Logger log = LoggerFactory.getLogger(ShipmentCostingApplication.class);

    public static void main(String[] args) {
        var ctx = SpringApplication.run(ShipmentCostingApplication.class, args);
        String[] controllers = ctx.getBeanNamesForAnnotation(RestController.class);
        log.info("RestControllers: {}", java.util.Arrays.toString(controllers));
    }
}
