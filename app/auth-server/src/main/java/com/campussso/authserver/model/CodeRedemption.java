package com.campussso.authserver.model;

// redeem 成功時に token 発行へ引き渡す値。
public record CodeRedemption(
    String subjectId, String clientId, String scope, String certificateFingerprint) {}
