package com.lettergrid.dto;

import jakarta.validation.constraints.NotBlank;

public record MatchmakingRequest(@NotBlank String userId, @NotBlank String username, String serverId) {}
