package com.lettergrid.application.port;

import com.lettergrid.dto.ServerMessage;

/**
 * Fan-out of a frame to every connection subscribed to its channel. Best effort: a connection that
 * cannot take the frame misses it, and publish itself does not throw.
 */
public interface Broadcaster {
  void publish(ServerMessage message);
}
