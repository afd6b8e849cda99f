package com.lettergrid.interfaces.rest;

import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ConfigController {
  private final int minPlayers;
  private final int maxPlayers;
  private final int roundsPerPlayer;
  private final int gridRows;
  private final int gridCols;

  public ConfigController(
      @Value("${lettergrid.min-players:2}") int minPlayers,
      @Value("${lettergrid.max-players:8}") int maxPlayers,
      @Value("${lettergrid.rounds-per-player:4}") int roundsPerPlayer,
      @Value("${lettergrid.grid-rows:5}") int gridRows,
      @Value("${lettergrid.grid-cols:5}") int gridCols) {
    this.minPlayers = minPlayers;
    this.maxPlayers = maxPlayers;
    this.roundsPerPlayer = roundsPerPlayer;
    this.gridRows = gridRows;
    this.gridCols = gridCols;
  }

  @GetMapping("/config")
  public Map<String, Object> config() {
    return Map.of(
        "minPlayers", minPlayers,
        "maxPlayers", maxPlayers,
        "roundsPerPlayer", roundsPerPlayer,
        "gridRows", gridRows,
        "gridCols", gridCols,
        "protocolVersion", 1);
  }
}
