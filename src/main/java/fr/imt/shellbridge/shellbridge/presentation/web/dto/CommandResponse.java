package fr.imt.shellbridge.shellbridge.presentation.web.dto;

import lombok.Data;

@Data
public class CommandResponse {
    private String stdout;
    private String stderr;
    private int exitStatus;
    private boolean success;
    private String currentDirectory;
}
