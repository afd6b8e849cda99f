package com.lettergrid.dto;

import jakarta.validation.constraints.NotBlank;

public record PlayerRequest(@NotBlank String userId) {}
