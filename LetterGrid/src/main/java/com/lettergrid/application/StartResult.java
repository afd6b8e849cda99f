package com.lettergrid.application;

import com.lettergrid.domain.LobbySnapshot;
import com.lettergrid.domain.MatchSnapshot;

public record StartResult(LobbySnapshot lobby, MatchSnapshot match) {}
