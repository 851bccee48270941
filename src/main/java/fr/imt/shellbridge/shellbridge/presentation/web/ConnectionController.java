package fr.imt.shellbridge.shellbridge.presentation.web;

import fr.imt.shellbridge.shellbridge.business.model.CommandResult;
import fr.imt.shellbridge.shellbridge.business.model.ConnectionOutcome;
import fr.imt.shellbridge.shellbridge.business.service.RemoteShellService;
import fr.imt.shellbridge.shellbridge.presentation.web.dto.CommandRequest;
import fr.imt.shellbridge.shellbridge.presentation.web.dto.CommandResponse;
import fr.imt.shellbridge.shellbridge.presentation.web.dto.ConnectResponse;
import fr.imt.shellbridge.shellbridge.presentation.web.dto.ConnectionRequest;
import fr.imt.shellbridge.shellbridge.presentation.web.dto.DirectoryResponse;
import fr.imt.shellbridge.shellbridge.presentation.web.dto.DisconnectResponse;
import fr.imt.shellbridge.shellbridge.presentation.web.dto.mappers.CommandResultMapper;
import fr.imt.shellbridge.shellbridge.presentation.web.dto.mappers.ConnectionMapper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/connections")
@RequiredArgsConstructor
public class ConnectionController {

    private final RemoteShellService remoteShellService;
    private final ConnectionMapper connectionMapper;
    private final CommandResultMapper commandResultMapper;

    /**
     * Opens a connection. Network and authentication failures come back with
     * {@code success=false}, not as an error status.
     */
    @PostMapping
    public ResponseEntity<ConnectResponse> connect(@Valid @RequestBody ConnectionRequest request) {
        ConnectionOutcome outcome = remoteShellService.connect(connectionMapper.toConfig(request));
        return ResponseEntity.ok(connectionMapper.toResponse(outcome));
    }

    @GetMapping
    public ResponseEntity<List<String>> listConnections() {
        return ResponseEntity.ok(remoteShellService.listConnections());
    }

    @PostMapping("/{connectionId}/commands")
    public ResponseEntity<CommandResponse> execute(@PathVariable String connectionId,
                                                   @Valid @RequestBody CommandRequest request) {
        CommandResult result = remoteShellService.execute(connectionId, request.getCommand());
        return ResponseEntity.ok(commandResultMapper.toResponse(result));
    }

    @GetMapping("/{connectionId}/directory")
    public ResponseEntity<DirectoryResponse> getDirectory(@PathVariable String connectionId) {
        return ResponseEntity.ok(new DirectoryResponse(connectionId, remoteShellService.getDirectory(connectionId)));
    }

    @DeleteMapping("/{connectionId}")
    public ResponseEntity<DisconnectResponse> disconnect(@PathVariable String connectionId) {
        return ResponseEntity.ok(new DisconnectResponse(connectionId, remoteShellService.disconnect(connectionId)));
    }
}
