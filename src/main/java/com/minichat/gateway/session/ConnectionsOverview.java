package com.minichat.gateway.session;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ConnectionsOverview(
        @JsonProperty("total_users") int totalUsers,
        @JsonProperty("total_connections") int totalConnections,
        List<ConnectionStats> connections
) {
}
