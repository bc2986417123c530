package com.portray.portal.features.ports.api.dto;

import com.portray.portal.features.ports.domain.Port;

import java.time.Instant;

public record PortView(
    Long id,
    String portName,
    String displayName,
    Long organizationId,
    String address,
    String country,
    String state,
    boolean isActive,
    Instant createdAt,
    Instant updatedAt
) {
    public static PortView from(Port port) {
        return new PortView(
            port.getId(),
            port.getPortName(),
            port.getDisplayName(),
            port.getOrganizationId(),
            port.getAddress(),
            port.getCountry(),
            port.getState(),
            port.isActive(),
            port.getCreatedAt(),
            port.getUpdatedAt()
        );
    }
}
