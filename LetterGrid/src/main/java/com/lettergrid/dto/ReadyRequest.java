package com.lettergrid.dto;

import jakarta.validation.constraints.NotBlank;

public record ReadyRequest(@NotBlank String userId, boolean ready) {}
