package com.apigw.auth;

import lombok.Value;

import java.util.Set;

/**
 * 认证通过后的身份信息
 */
@Value
public class AuthenticatedPrincipal {

    String subject;

    Set<String> roles;

    public AuthenticatedPrincipal(String subject, Set<String> roles) {
        this.subject = subject;
        this.roles = roles != null ? Set.copyOf(roles) : Set.of();
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }
}
