package com.lettergrid.domain;

public enum Visibility {
  PUBLIC,
  PRIVATE
}
