package org.livo.warehouse.controller;

import org.junit.jupiter.api.Test;
import org.livo.warehouse.security.ActingUserResolver;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "spring.datasource.url=jdbc:h2:mem:warehouse_web;MODE=PostgreSQL;"
        + "DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH;DB_CLOSE_DELAY=-1")
@AutoConfigureMockMvc
@ActiveProfiles("test")
class UserManagerControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private long userId(String username) {
        return jdbcTemplate.queryForObject("SELECT id FROM users WHERE username = ?", Long.class, username);
    }

    @Test
    void rolesAreListed() throws Exception {
        mockMvc.perform(get("/api/user-manager/roles")
                        .header(ActingUserResolver.USER_ID_HEADER, userId("coord")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].name").value("superadmin"));
    }

    @Test
    void passwordIsNeverSerialized() throws Exception {
        mockMvc.perform(get("/api/user-manager/users/{id}", userId("qc1"))
                        .header(ActingUserResolver.USER_ID_HEADER, userId("coord")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.username").value("qc1"))
                .andExpect(jsonPath("$.data.roles").value(hasItem("qc-ribbon")))
                .andExpect(jsonPath("$.data.password").doesNotExist());
    }

    @Test
    void grantingAboveOwnRankIsForbidden() throws Exception {
        mockMvc.perform(post("/api/user-manager/users/{id}/roles", userId("picker2"))
                        .header(ActingUserResolver.USER_ID_HEADER, userId("admin1"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"roleName\": \"coordinator\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));
    }

    @Test
    void invalidCreateBodyIsRejected() throws Exception {
        mockMvc.perform(post("/api/user-manager/users")
                        .header(ActingUserResolver.USER_ID_HEADER, userId("coord"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\": \"x\", \"email\": \"not-an-email\", \"password\": \"123\", \"fullName\": \"X\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
    }

    @Test
    void unknownReceiptIsNotFound() throws Exception {
        mockMvc.perform(get("/api/mobile/orders/picked-orders/{id}", Long.MAX_VALUE)
                        .header(ActingUserResolver.USER_ID_HEADER, userId("picker1")))
                .andExpect(status().isNotFound());
    }
}
