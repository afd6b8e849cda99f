package com.lettergrid.dto;

public record ErrorMessage(String type, String reason, String message) {
  public ErrorMessage(String reason, String message) {
    this("error", reason, message);
  }
}
