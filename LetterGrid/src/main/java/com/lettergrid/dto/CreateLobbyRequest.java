package com.lettergrid.dto;

import com.lettergrid.domain.Visibility;
import jakarta.validation.constraints.NotBlank;

public record CreateLobbyRequest(
    @NotBlank String userId, @NotBlank String username, Visibility visibility, String serverId) {}
