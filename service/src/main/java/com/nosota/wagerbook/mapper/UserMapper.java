package com.nosota.wagerbook.mapper;

import com.nosota.wagerbook.api.response.UserResponse;
import com.nosota.wagerbook.model.User;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface UserMapper {

    UserMapper INSTANCE = Mappers.getMapper(UserMapper.class);

    @Mapping(target = "userId", source = "id")
    UserResponse toResponse(User user);

    List<UserResponse> toResponseList(List<User> users);
}
