package com.lettergrid.dto;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;

/** Join by 4-digit code or by lobby id; exactly one should be set. */
public record JoinLobbyRequest(
    String code, String lobbyId, @NotBlank String userId, @NotBlank String username) {

  @AssertTrue(message = "code or lobbyId is required")
  public boolean isTargetGiven() {
    return (code != null && !code.isBlank()) || (lobbyId != null && !lobbyId.isBlank());
  }
}
