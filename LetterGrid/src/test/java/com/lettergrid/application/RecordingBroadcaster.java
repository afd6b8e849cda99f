package com.lettergrid.application;

import com.lettergrid.application.port.Broadcaster;
import com.lettergrid.dto.ServerMessage;
import java.util.ArrayList;
import java.util.List;

/** Keeps every published frame in order. */
class RecordingBroadcaster implements Broadcaster {
  private final List<ServerMessage> sent = new ArrayList<>();

  @Override
  public synchronized void publish(ServerMessage message) {
    sent.add(message);
  }

  synchronized List<ServerMessage> all() {
    return List.copyOf(sent);
  }

  synchronized List<ServerMessage> on(String channel) {
    return sent.stream().filter(m -> m.channel().equals(channel)).toList();
  }

  synchronized <T extends ServerMessage> List<T> ofType(Class<T> type) {
    return sent.stream().filter(type::isInstance).map(type::cast).toList();
  }

  synchronized ServerMessage last() {
    return sent.isEmpty() ? null : sent.get(sent.size() - 1);
  }

  synchronized int size() {
    return sent.size();
  }

  synchronized void clear() {
    sent.clear();
  }
}
