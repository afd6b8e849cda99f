package com.lettergrid.dto;

import jakarta.validation.constraints.NotBlank;

public record RemovePlayerRequest(@NotBlank String requestedBy, @NotBlank String targetUserId) {}
