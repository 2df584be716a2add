package com.nosota.wagerbook.mapper;

import com.nosota.wagerbook.api.dto.LineDTO;
import com.nosota.wagerbook.model.Line;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface LineMapper {

    LineMapper INSTANCE = Mappers.getMapper(LineMapper.class);

    LineDTO toDTO(Line line);

    List<LineDTO> toDTOList(List<Line> lines);
}
