package com.lettergrid.domain;

public enum LobbyStatus {
  WAITING,
  PLAYING,
  FINISHED
}
