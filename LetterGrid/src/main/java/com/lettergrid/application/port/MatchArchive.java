package com.lettergrid.application.port;

import com.lettergrid.domain.MatchSnapshot;

/**
 * Long-term storage for finished matches. Called once per completed match; the caller does not
 * retry when this throws.
 */
public interface MatchArchive {
  void archive(MatchSnapshot match);
}
