package com.nosota.xswap.mapper;

import com.nosota.xswap.api.dto.SwapTransitionDTO;
import com.nosota.xswap.api.response.RefundResponse;
import com.nosota.xswap.api.response.StepResponse;
import com.nosota.xswap.api.response.SwapResponse;
import com.nosota.xswap.model.Swap;
import com.nosota.xswap.model.SwapTransition;
import com.nosota.xswap.service.StepResult;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper for swap entities and step results to API records.
 */
@Mapper
public interface SwapMapper {

    SwapMapper INSTANCE = Mappers.getMapper(SwapMapper.class);

    SwapResponse toResponse(Swap swap);

    List<SwapResponse> toResponseList(List<Swap> swaps);

    /**
     * Maps a refunded swap. The refund timestamp is the time of the REFUNDED transition.
     *
     * @param swap Swap in REFUNDED state
     * @return RefundResponse
     */
    @Mapping(target = "swapId", source = "id")
    @Mapping(target = "refundedAt", source = "updatedAt")
    RefundResponse toRefundResponse(Swap swap);

    SwapTransitionDTO toDTO(SwapTransition transition);

    List<SwapTransitionDTO> toDTOList(List<SwapTransition> transitions);

    StepResponse toStepResponse(StepResult result);
}
