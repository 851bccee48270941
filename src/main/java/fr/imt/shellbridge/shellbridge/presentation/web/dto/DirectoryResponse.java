package fr.imt.shellbridge.shellbridge.presentation.web.dto;

public record DirectoryResponse(String connectionId, String currentDirectory) {
}
