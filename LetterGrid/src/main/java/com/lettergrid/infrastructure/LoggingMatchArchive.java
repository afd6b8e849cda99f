package com.lettergrid.infrastructure;

import com.lettergrid.application.port.MatchArchive;
import com.lettergrid.domain.MatchPlayer;
import com.lettergrid.domain.MatchSnapshot;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Writes the final standings of each completed match to the log. */
@Component
public class LoggingMatchArchive implements MatchArchive {
  private static final Logger log = LoggerFactory.getLogger(LoggingMatchArchive.class);

  @Override
  public void archive(MatchSnapshot match) {
    List<String> standings =
        match.players().stream()
            .sorted(Comparator.comparingInt(MatchPlayer.Snapshot::score).reversed())
            .map(p -> p.username() + "=" + p.score())
            .toList();
    log.info(
        "Match {} (lobby {}) final standings {} over {} words",
        match.id(),
        match.lobbyId(),
        standings,
        match.wordsFound().size());
  }
}
