package com.example.shipment_costing;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;

import com.example.shipment_costing.entity.UserRole;
import com.example.shipment_costing.security.JwtTokenService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * End-to-end flow over HTTP: create a shipment, add shipping, pay, get
 * rejected for overpaying, then receive into inventory.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
public class ScenarioTest {

    @LocalServerPort
    private int port;

    @Autowired
    private JwtTokenService jwtTokenService;

    @Autowired
    private ObjectMapper objectMapper;

    private final HttpClient client = HttpClient.newHttpClient();

    @Test
    void shipmentLifecycle_costPayOverpayReceive() throws Exception {
        String admin = "Bearer " + jwtTokenService.generateToken("admin", UserRole.ADMIN);
        String code = "SC-" + UUID.randomUUID().toString().substring(0, 8);

        // step 1: 10 cartons x 12 pieces x 5.00 RMB
        String createBody = """
                {"shipmentCode":"%s","shipmentName":"Scenario order","purchaseDate":"2024-01-15",
                 "items":[{"productName":"Ceramic mug","cartons":10,"piecesPerCarton":12,"unitPriceRmb":5.00}]}
                """.formatted(code);
        HttpResponse<String> created = send("POST", "/shipments", createBody, admin);
        assertThat(created.statusCode()).isEqualTo(201);
        JsonNode shipment = objectMapper.readTree(created.body());
        long id = shipment.get("shipmentId").asLong();
        assertThat(shipment.get("status").asText()).isEqualTo("NEW");
        assertThat(shipment.get("purchaseCostRmb").decimalValue()).isEqualByComparingTo("600.00");

        // step 2: 5% commission, no freight, rates locked at 7.15 / 7.2
        String shippingBody = """
                {"step":2,"shipping":{"commissionRatePercent":5,"shippingAreaSqm":0,"shippingCostPerSqmUsd":0,
                 "usdToRmbRateAtShipping":7.2,"rmbToEgpRateAtShipping":7.15}}
                """;
        HttpResponse<String> shipped = send("PATCH", "/shipments/" + id, shippingBody, admin);
        assertThat(shipped.statusCode()).isEqualTo(200);
        shipment = objectMapper.readTree(shipped.body());
        assertThat(shipment.get("status").asText()).isEqualTo("READY_FOR_RECEIPT");
        assertThat(shipment.get("finalTotalCostEgp").decimalValue()).isEqualByComparingTo("4504.50");

        // partial payment
        String payBody = """
                {"shipmentId":%d,"paymentDate":"2024-02-01","paymentCurrency":"EGP","amountOriginal":4000,
                 "costComponent":"PURCHASE","paymentMethod":"CASH","cashReceiverName":"Hassan"}
                """.formatted(id);
        HttpResponse<String> paid = send("POST", "/payments", payBody, admin);
        assertThat(paid.statusCode()).isEqualTo(201);
        JsonNode settlement = objectMapper.readTree(paid.body());
        assertThat(settlement.get("balanceEgp").decimalValue()).isEqualByComparingTo("504.50");
        assertThat(settlement.get("paymentState").asText()).isEqualTo("PARTIALLY_PAID");

        // 100 RMB at 7.15 = 715 EGP, more than the 504.50 left
        String overBody = """
                {"shipmentId":%d,"paymentCurrency":"RMB","amountOriginal":100,"exchangeRateToEgp":7.15,
                 "costComponent":"SHIPPING","paymentMethod":"BANK_TRANSFER"}
                """.formatted(id);
        HttpResponse<String> over = send("POST", "/payments", overBody, admin);
        assertThat(over.statusCode()).isEqualTo(409);
        JsonNode error = objectMapper.readTree(over.body());
        assertThat(error.get("error").asText()).isEqualTo("OVERPAYMENT");
        assertThat(error.get("remainingBalanceEgp").decimalValue()).isEqualByComparingTo("504.50");

        // viewers read but cannot write, anonymous callers get nothing
        String viewer = "Bearer " + jwtTokenService.generateToken("viewer", UserRole.VIEWER);
        assertThat(send("POST", "/payments", payBody, viewer).statusCode()).isEqualTo(403);
        assertThat(send("GET", "/shipments/" + id, null, viewer).statusCode()).isEqualTo(200);
        assertThat(send("GET", "/shipments/" + id, null, null).statusCode()).isEqualTo(401);

        // step 4: receive
        HttpResponse<String> received = send("PATCH", "/shipments/" + id, "{\"step\":4}", admin);
        assertThat(received.statusCode()).isEqualTo(200);
        assertThat(objectMapper.readTree(received.body()).get("status").asText()).isEqualTo("RECEIVED");

        HttpResponse<String> inventory = send("GET", "/inventory", null, admin);
        assertThat(inventory.statusCode()).isEqualTo(200);
        assertThat(inventory.body()).contains(code);

        HttpResponse<String> history = send("GET", "/shipments/" + id + "/payments", null, viewer);
        assertThat(objectMapper.readTree(history.body()).size()).isEqualTo(1);
    }

    private HttpResponse<String> send(String method, String path, String json, String auth) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + port + path))
                .header("Content-Type", "application/json");
        if (auth != null) {
            builder.header("Authorization", auth);
        }
        HttpRequest.BodyPublisher body = json == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(json);
        return client.send(builder.method(method, body).build(), HttpResponse.BodyHandlers.ofString());
    }
}
