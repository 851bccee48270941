package fr.imt.shellbridge.shellbridge.presentation.web.dto;

public record DisconnectResponse(String connectionId, boolean removed) {
}
