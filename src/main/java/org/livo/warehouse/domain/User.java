package org.livo.warehouse.domain;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableLogic;
import com.baomidou.mybatisplus.annotation.TableName;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Operator account. Roles are attached through {@link UserRole} rows.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("users")
public class User {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String username;
    private String email;

    /**
     * Password hash, never the plain text
     */
    @JsonIgnore
    private String password;

    private String fullName;
    private Boolean isActive;

    @JsonIgnore
    private String refreshToken;

    @TableLogic
    @JsonIgnore
    private Integer deleted;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    /**
     * Role names held by the user, loaded on demand
     */
    @TableField(exist = false)
    @Builder.Default
    private List<String> roles = new ArrayList<>();

    public boolean hasRole(String roleName) {
        return roles.contains(roleName);
    }
}
