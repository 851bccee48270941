package fr.imt.shellbridge.shellbridge.presentation.web.dto.mappers;

import fr.imt.shellbridge.shellbridge.business.model.CommandResult;
import fr.imt.shellbridge.shellbridge.presentation.web.dto.CommandResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface CommandResultMapper {

    @Mapping(target = "success", expression = "java(result.success())")
    CommandResponse toResponse(CommandResult result);
}
