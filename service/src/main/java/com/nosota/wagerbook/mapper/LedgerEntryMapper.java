package com.nosota.wagerbook.mapper;

import com.nosota.wagerbook.api.dto.LedgerEntryDTO;
import com.nosota.wagerbook.model.LedgerEntry;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface LedgerEntryMapper {

    LedgerEntryMapper INSTANCE = Mappers.getMapper(LedgerEntryMapper.class);

    LedgerEntryDTO toDTO(LedgerEntry ledgerEntry);

    List<LedgerEntryDTO> toDTOList(List<LedgerEntry> ledgerEntries);
}
