package fr.imt.shellbridge.shellbridge.presentation.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.ToString;

@Data
public class ConnectionRequest {

    @NotBlank
    private String host;

    @NotNull
    @Min(1)
    @Max(65535)
    private Integer port = 22;

    @NotBlank
    private String username;

    @ToString.Exclude
    private String password;

    private String privateKeyPath;

    @ToString.Exclude
    private String passphrase;
}
