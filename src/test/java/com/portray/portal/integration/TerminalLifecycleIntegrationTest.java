package com.portray.portal.integration;

import io.restassured.http.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Organization, port and terminal setup followed by SystemAdmin activation.
 */
public class TerminalLifecycleIntegrationTest extends BaseIntegrationTest {

    private String adminToken;
    private Integer portId;

    @BeforeEach
    void setUp() {
        adminToken = adminToken();

        String code = unique("O");
        Integer organizationId = given()
                .header("Authorization", "Bearer " + adminToken)
                .contentType(ContentType.JSON)
                .body(Map.of(
                        "organizationName", "Harbour Board " + code,
                        "displayName", "HB " + code,
                        "organizationCode", code,
                        "registerOffice", "1 Marine Drive, Mumbai",
                        "country", "India"))
                .post("/api/organizations")
                .then()
                .statusCode(201)
                .extract()
                .path("id");

        portId = given()
                .header("Authorization", "Bearer " + adminToken)
                .contentType(ContentType.JSON)
                .body(Map.of(
                        "portName", "Nhava Sheva",
                        "displayName", "INNSA",
                        "organizationId", organizationId,
                        "address", "JNPT, Navi Mumbai",
                        "country", "India",
                        "state", "Maharashtra"))
                .post("/api/ports")
                .then()
                .statusCode(201)
                .extract()
                .path("id");
    }

    private Integer submitTerminal(String shortCode) {
        Map<String, Object> body = new HashMap<>();
        body.put("terminalName", "Container Terminal " + shortCode);
        body.put("shortCode", shortCode);
        body.put("timezone", "Asia/Kolkata");
        body.put("billingAddress", "Gate 1, JNPT");
        body.put("billingCity", "Navi Mumbai");
        body.put("billingPinCode", "400707");
        body.put("billingPhone", "+91-22-5550100");
        body.put("sameAsBilling", true);

        return given()
                .header("Authorization", "Bearer " + adminToken)
                .contentType(ContentType.JSON)
                .body(body)
                .post("/api/ports/" + portId + "/terminals")
                .then()
                .statusCode(201)
                .body("status", equalTo("Processing for activation"))
                .body("shippingAddress", equalTo("Gate 1, JNPT"))
                .extract()
                .path("id");
    }

    private static String shortCode() {
        String code = unique("T");
        return code.substring(code.length() - 6);
    }

    @Test
    void shouldActivateTerminalForTwelveMonths() {
        // 1. Submit terminal
        Integer terminalId = submitTerminal(shortCode());

        // 2. It shows up in the pending queue
        given()
                .header("Authorization", "Bearer " + adminToken)
                .get("/api/terminals/pending-activation")
                .then()
                .statusCode(200)
                .body("id", hasItem(terminalId));

        // 3. Activate from 2025-01-01 with the 12 month subscription
        given()
                .header("Authorization", "Bearer " + adminToken)
                .contentType(ContentType.JSON)
                .body(Map.of("activationStartDate", "2025-01-01", "subscriptionTypeId", 2))
                .put("/api/terminals/" + terminalId + "/activate")
                .then()
                .statusCode(200)
                .body("status", equalTo("Active"))
                .body("isActive", equalTo(true))
                .body("activationStartDate", equalTo("2025-01-01"))
                .body("activationEndDate", equalTo("2026-01-01"));

        // 4. Exactly one activated entry in the activation log
        await().atMost(Duration.ofSeconds(10))
                .pollInterval(Duration.ofMillis(200))
                .untilAsserted(() -> {
                    List<String> actions = given()
                            .header("Authorization", "Bearer " + adminToken)
                            .get("/api/terminals/" + terminalId + "/activation-log")
                            .then()
                            .statusCode(200)
                            .extract()
                            .path("action");
                    assertEquals(1, actions.stream().filter("activated"::equals).count());
                    assertTrue(actions.contains("submitted"));
                });
    }

    @Test
    void shouldRejectActivationOfRejectedTerminal() {
        Integer terminalId = submitTerminal(shortCode());

        given()
                .header("Authorization", "Bearer " + adminToken)
                .contentType(ContentType.JSON)
                .body(Map.of("status", "Rejected"))
                .put("/api/terminals/" + terminalId + "/status")
                .then()
                .statusCode(200)
                .body("status", equalTo("Rejected"));

        given()
                .header("Authorization", "Bearer " + adminToken)
                .contentType(ContentType.JSON)
                .body(Map.of("activationStartDate", "2025-01-01", "subscriptionTypeId", 2))
                .put("/api/terminals/" + terminalId + "/activate")
                .then()
                .statusCode(409);
    }

    @Test
    void shouldRefuseDuplicateShortCode() {
        String code = shortCode();
        submitTerminal(code);

        Map<String, Object> body = new HashMap<>();
        body.put("terminalName", "Duplicate");
        body.put("shortCode", code);
        body.put("timezone", "Asia/Kolkata");
        body.put("billingAddress", "x");
        body.put("billingCity", "x");
        body.put("billingPinCode", "x");
        body.put("billingPhone", "x");
        body.put("sameAsBilling", true);

        given()
                .header("Authorization", "Bearer " + adminToken)
                .contentType(ContentType.JSON)
                .body(body)
                .post("/api/ports/" + portId + "/terminals")
                .then()
                .statusCode(400)
                .body("code", equalTo("CONFLICT"));
    }

    @Test
    void shouldRequireAuthentication() {
        given()
                .get("/api/ports/" + portId + "/terminals")
                .then()
                .statusCode(401);
    }
}
