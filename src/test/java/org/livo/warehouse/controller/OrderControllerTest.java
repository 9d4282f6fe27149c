package org.livo.warehouse.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.livo.warehouse.filter.TraceIdFilter;
import org.livo.warehouse.security.ActingUserResolver;
import org.livo.warehouse.security.PasswordHasher;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP mapping of the order and flow endpoints. Runs on its own in-memory database.
 */
@SpringBootTest(properties = "spring.datasource.url=jdbc:h2:mem:warehouse_web;MODE=PostgreSQL;"
        + "DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH;DB_CLOSE_DELAY=-1")
@AutoConfigureMockMvc
@ActiveProfiles("test")
class OrderControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private PasswordHasher passwordHasher;

    @BeforeEach
    void setPasswords() {
        jdbcTemplate.update("UPDATE users SET password = ? WHERE username IN ('coord', 'admin1')",
                passwordHasher.hash("approve-123"));
    }

    private long orderInPicking(String pickerUsername) {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        jdbcTemplate.update("INSERT INTO orders (order_ginee_id, processing_status, tracking, picked_by) "
                + "VALUES (?, 'picking process', ?, ?)", "GINEE-M-" + suffix, "JNE-M-" + suffix, userId(pickerUsername));
        long orderId = jdbcTemplate.queryForObject("SELECT id FROM orders WHERE order_ginee_id = ?", Long.class,
                "GINEE-M-" + suffix);
        jdbcTemplate.update("INSERT INTO order_details (order_id, sku, product_name, quantity) "
                + "VALUES (?, 'SKU-RED-01', 'Satin Ribbon Red', 1)", orderId);
        return orderId;
    }

    private static String approval(String username, String password) {
        return "{\"username\": \"" + username + "\", \"password\": \"" + password + "\"}";
    }

    private String processingStatusOf(long orderId) {
        return jdbcTemplate.queryForObject("SELECT processing_status FROM orders WHERE id = ?", String.class, orderId);
    }

    private long userId(String username) {
        return jdbcTemplate.queryForObject("SELECT id FROM users WHERE username = ?", Long.class, username);
    }

    private long seededOrderId() {
        return jdbcTemplate.queryForObject("SELECT id FROM orders WHERE order_ginee_id = 'GINEE-FLOW-001'", Long.class);
    }

    @Test
    void missingUserHeaderIsUnauthenticated() throws Exception {
        mockMvc.perform(get("/api/orders/{id}", seededOrderId()))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHENTICATED"));
    }

    @Test
    void unknownOrderIsNotFound() throws Exception {
        mockMvc.perform(get("/api/orders/{id}", Long.MAX_VALUE)
                        .header(ActingUserResolver.USER_ID_HEADER, userId("admin1")))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void pickerCannotCancel() throws Exception {
        mockMvc.perform(put("/api/orders/{id}/cancel", seededOrderId())
                        .header(ActingUserResolver.USER_ID_HEADER, userId("picker1")))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));
    }

    @Test
    void invalidStateReportsCurrentStatus() throws Exception {
        mockMvc.perform(put("/api/orders/{id}/assign-picker", seededOrderId())
                        .header(ActingUserResolver.USER_ID_HEADER, userId("coord"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pickerId\": " + userId("picker1") + "}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_STATE"))
                .andExpect(jsonPath("$.currentStatus").value("completed"));
    }

    @Test
    void unknownActorIsForbidden() throws Exception {
        mockMvc.perform(get("/api/orders/{id}", seededOrderId())
                        .header(ActingUserResolver.USER_ID_HEADER, Long.MAX_VALUE))
                .andExpect(status().isForbidden());
    }

    @Test
    void traceIdIsEchoed() throws Exception {
        mockMvc.perform(get("/api/orders/{id}", seededOrderId())
                        .header(ActingUserResolver.USER_ID_HEADER, userId("admin1"))
                        .header(TraceIdFilter.TRACE_ID_HEADER, "trace-123"))
                .andExpect(status().isOk())
                .andExpect(header().string(TraceIdFilter.TRACE_ID_HEADER, "trace-123"))
                .andExpect(jsonPath("$.data.orderGineeId").value("GINEE-FLOW-001"))
                .andExpect(jsonPath("$.traceId").value("trace-123"));
    }

    @Test
    void ribbonFlowIsServed() throws Exception {
        mockMvc.perform(get("/api/ribbons/ribbon-flows")
                        .header(ActingUserResolver.USER_ID_HEADER, userId("qc1"))
                        .param("start_date", "2025-03-01")
                        .param("end_date", "2025-03-02"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.total").value(2))
                .andExpect(jsonPath("$.data.items[0].order.complained").value(true));
    }

    @Test
    void malformedDateIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/ribbons/ribbon-flows")
                        .header(ActingUserResolver.USER_ID_HEADER, userId("qc1"))
                        .param("start_date", "03/01/2025"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void pickerSetsPendingWithCoordinatorApproval() throws Exception {
        long orderId = orderInPicking("picker1");
        long pickerId = userId("picker1");

        mockMvc.perform(put("/api/mobile/orders/{id}/pending-pick", orderId)
                        .header(ActingUserResolver.USER_ID_HEADER, pickerId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(approval("coord", "approve-123")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.processingStatus").value("pending picking"))
                .andExpect(jsonPath("$.data.pendingBy").value(pickerId))
                .andExpect(jsonPath("$.data.pickedBy").doesNotExist());
    }

    @Test
    void wrongApprovalPasswordIsUnauthenticated() throws Exception {
        long orderId = orderInPicking("picker1");

        mockMvc.perform(put("/api/mobile/orders/{id}/pending-pick", orderId)
                        .header(ActingUserResolver.USER_ID_HEADER, userId("picker1"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(approval("coord", "wrong-pass")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHENTICATED"));
        assertEquals("picking process", processingStatusOf(orderId));
    }

    @Test
    void approverBelowCoordinatorIsForbidden() throws Exception {
        long orderId = orderInPicking("picker1");

        mockMvc.perform(put("/api/mobile/orders/{id}/pending-pick", orderId)
                        .header(ActingUserResolver.USER_ID_HEADER, userId("picker1"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(approval("admin1", "approve-123")))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));
    }

    @Test
    void pendingWithoutApprovalIsBadRequest() throws Exception {
        mockMvc.perform(put("/api/mobile/orders/{id}/pending-pick", orderInPicking("picker2"))
                        .header(ActingUserResolver.USER_ID_HEADER, userId("picker2")))
                .andExpect(status().isBadRequest());
    }
}
