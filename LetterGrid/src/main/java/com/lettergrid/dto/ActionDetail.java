package com.lettergrid.dto;

/**
 * Ephemeral "what is the active player doing" indicator, e.g. live typing.
 *
 * @param kind free-form action name such as {@code selecting} or {@code submitting}
 * @param at client timestamp in epoch millis
 */
public record ActionDetail(String kind, String selectedLetters, String word, long at) {}
