package com.campussso.authserver.model;

import java.time.Instant;

// validate の結果。リソースサーバーへ渡す subject/scope/role。
public record TokenIntrospection(
    String subjectId, String scope, UserRole role, String clientId, Instant expiresAt) {}
