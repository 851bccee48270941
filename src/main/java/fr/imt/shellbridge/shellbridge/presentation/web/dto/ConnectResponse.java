package fr.imt.shellbridge.shellbridge.presentation.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConnectResponse {
    private boolean success;
    private String message;
    private String connectionId;
    private String errorCode;
}
