package com.lettergrid.dto;

import com.lettergrid.domain.grid.TilePosition;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;

public record SubmitWordRequest(
    @NotBlank String playerId, @NotNull @Size(max = 64) List<TilePosition> tiles) {}
