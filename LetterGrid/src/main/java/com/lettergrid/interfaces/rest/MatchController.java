package com.lettergrid.interfaces.rest;

import com.lettergrid.application.MatchService;
import com.lettergrid.dto.PlayerRequest;
import com.lettergrid.dto.SubmitWordRequest;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/matches")
public class MatchController {
  private final MatchService matches;

  public MatchController(MatchService matches) {
    this.matches = matches;
  }

  @GetMapping("/{id}")
  public ResponseEntity<?> get(@PathVariable String id) {
    return matches.get(id)
        .<ResponseEntity<?>>map(ResponseEntity::ok)
        .orElseGet(() -> Responses.notFound("Match not found"));
  }

  @PostMapping("/{id}/words")
  public ResponseEntity<?> submitWord(
      @PathVariable String id, @Valid @RequestBody SubmitWordRequest req) {
    return Responses.of(matches.submitWord(id, req.playerId(), req.tiles()));
  }

  @PostMapping("/{id}/shuffle")
  public ResponseEntity<?> shuffle(@PathVariable String id, @Valid @RequestBody PlayerRequest req) {
    return Responses.of(matches.shuffleGrid(id, req.userId()));
  }
}
