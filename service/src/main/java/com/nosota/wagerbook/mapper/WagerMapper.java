package com.nosota.wagerbook.mapper;

import com.nosota.wagerbook.api.response.WagerResponse;
import com.nosota.wagerbook.model.Wager;
import com.nosota.wagerbook.service.PayoutCalculator;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper(imports = PayoutCalculator.class)
public interface WagerMapper {

    WagerMapper INSTANCE = Mappers.getMapper(WagerMapper.class);

    @Mapping(target = "wagerId", source = "id")
    @Mapping(target = "potentialPayoutCents",
            expression = "java(PayoutCalculator.calculatePayout(wager.getStakeCents(), wager.getAcceptedPrice()))")
    WagerResponse toResponse(Wager wager);

    List<WagerResponse> toResponseList(List<Wager> wagers);
}
