package com.lettergrid.interfaces.rest;

import com.lettergrid.application.MatchmakingResult;
import com.lettergrid.application.MatchmakingService;
import com.lettergrid.domain.QueueSnapshot;
import com.lettergrid.dto.MatchmakingRequest;
import com.lettergrid.dto.PlayerRequest;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/matchmaking")
public class MatchmakingController {
  private final MatchmakingService matchmaking;

  public MatchmakingController(MatchmakingService matchmaking) {
    this.matchmaking = matchmaking;
  }

  @PostMapping("/join")
  public MatchmakingResult join(@Valid @RequestBody MatchmakingRequest req) {
    return matchmaking.join(req.userId(), req.username(), req.serverId());
  }

  @PostMapping("/leave")
  public ResponseEntity<Void> leave(@Valid @RequestBody PlayerRequest req) {
    matchmaking.leave(req.userId());
    return ResponseEntity.noContent().build();
  }

  @GetMapping
  public QueueSnapshot queue() {
    return matchmaking.snapshot();
  }
}
