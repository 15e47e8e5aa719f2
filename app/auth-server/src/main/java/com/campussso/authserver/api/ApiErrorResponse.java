/*
 * どこで: auth-server API
 * 何を: OAuth 形式のエラー応答 DTO
 * なぜ: リソースサーバーの back-channel クライアントが error コードで機械的に分岐できるようにするため
 */
package com.campussso.authserver.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ApiErrorResponse(
    String error, @JsonProperty("error_description") String errorDescription) {}
