package fr.imt.shellbridge.shellbridge.presentation.web.dto.mappers;

import fr.imt.shellbridge.shellbridge.business.model.ConnectionConfig;
import fr.imt.shellbridge.shellbridge.business.model.ConnectionId;
import fr.imt.shellbridge.shellbridge.business.model.ConnectionOutcome;
import fr.imt.shellbridge.shellbridge.presentation.web.dto.ConnectResponse;
import fr.imt.shellbridge.shellbridge.presentation.web.dto.ConnectionRequest;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface ConnectionMapper {

    ConnectionConfig toConfig(ConnectionRequest request);

    ConnectResponse toResponse(ConnectionOutcome outcome);

    default String map(ConnectionId connectionId) {
        return connectionId == null ? null : connectionId.value();
    }
}
