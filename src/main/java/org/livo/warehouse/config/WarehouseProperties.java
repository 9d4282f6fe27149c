package org.livo.warehouse.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code warehouse.*} settings
 */
@Data
@ConfigurationProperties(prefix = "warehouse")
public class WarehouseProperties {

    private Roles roles = new Roles();
    private Fulfillment fulfillment = new Fulfillment();
    private Users users = new Users();

    @Data
    public static class Roles {
        /**
         * role name -> rank, higher ranks manage lower ones
         */
        private Map<String, Integer> ranks = new LinkedHashMap<>();
    }

    @Data
    public static class Fulfillment {
        /**
         * Minimum role (by rank) per gated transition
         */
        private String assignPickerRole = "coordinator";
        private String pendingRole = "coordinator";
        private String cancelRole = "admin";
        private String duplicateRole = "admin";

        private String duplicateIdSuffix = "-X2";
        private String duplicateTrackingPrefix = "X-";
    }

    @Data
    public static class Users {
        private String defaultRole = "guest";

        /**
         * Minimum role to activate or deactivate accounts
         */
        private String statusRole = "coordinator";
    }
}
