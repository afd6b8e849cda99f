package com.lettergrid.interfaces.rest;

import com.lettergrid.application.LobbyService;
import com.lettergrid.domain.LobbySnapshot;
import com.lettergrid.domain.Visibility;
import com.lettergrid.dto.CreateLobbyRequest;
import com.lettergrid.dto.JoinLobbyRequest;
import com.lettergrid.dto.PlayerRequest;
import com.lettergrid.dto.ReadyRequest;
import com.lettergrid.dto.RemovePlayerRequest;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/lobbies")
public class LobbyController {
  private final LobbyService lobbies;

  public LobbyController(LobbyService lobbies) {
    this.lobbies = lobbies;
  }

  @PostMapping
  public ResponseEntity<LobbySnapshot> create(@Valid @RequestBody CreateLobbyRequest req) {
    Visibility visibility = req.visibility() == null ? Visibility.PUBLIC : req.visibility();
    LobbySnapshot lobby = lobbies.create(req.userId(), req.username(), visibility, req.serverId());
    return ResponseEntity.status(HttpStatus.CREATED).body(lobby);
  }

  @GetMapping
  public List<LobbySnapshot> listOpen(@RequestParam(required = false) String serverId) {
    return lobbies.listOpen(serverId);
  }

  @GetMapping("/{id}")
  public ResponseEntity<?> get(@PathVariable String id) {
    return lobbies.get(id)
        .<ResponseEntity<?>>map(ResponseEntity::ok)
        .orElseGet(() -> Responses.notFound("Lobby not found"));
  }

  @GetMapping("/code/{code}")
  public ResponseEntity<?> getByCode(@PathVariable String code) {
    return lobbies.getByCode(code)
        .<ResponseEntity<?>>map(ResponseEntity::ok)
        .orElseGet(() -> Responses.notFound("Lobby not found"));
  }

  @PostMapping("/join")
  public ResponseEntity<?> join(@Valid @RequestBody JoinLobbyRequest req) {
    if (req.lobbyId() != null && !req.lobbyId().isBlank()) {
      return Responses.of(lobbies.join(req.lobbyId(), req.userId(), req.username()));
    }
    return Responses.of(lobbies.joinByCode(req.code(), req.userId(), req.username()));
  }

  @PostMapping("/{id}/ready")
  public ResponseEntity<?> ready(@PathVariable String id, @Valid @RequestBody ReadyRequest req) {
    return Responses.of(lobbies.setReady(id, req.userId(), req.ready()));
  }

  @PostMapping("/{id}/leave")
  public ResponseEntity<?> leave(@PathVariable String id, @Valid @RequestBody PlayerRequest req) {
    return Responses.of(lobbies.leave(id, req.userId()));
  }

  @PostMapping("/{id}/remove")
  public ResponseEntity<?> remove(
      @PathVariable String id, @Valid @RequestBody RemovePlayerRequest req) {
    return Responses.of(lobbies.removePlayer(id, req.targetUserId(), req.requestedBy()));
  }

  @PostMapping("/{id}/start")
  public ResponseEntity<?> start(@PathVariable String id, @Valid @RequestBody PlayerRequest req) {
    return Responses.of(lobbies.start(id, req.userId()));
  }
}
