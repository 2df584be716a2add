package com.nosota.wagerbook.controller;

import com.nosota.wagerbook.api.UserApi;
import com.nosota.wagerbook.api.request.CreateUserRequest;
import com.nosota.wagerbook.api.response.UserResponse;
import com.nosota.wagerbook.api.response.UserStatisticsResponse;
import com.nosota.wagerbook.mapper.UserMapper;
import com.nosota.wagerbook.model.User;
import com.nosota.wagerbook.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class UserController implements UserApi {

    private final UserService userService;

    @Override
    public ResponseEntity<UserResponse> createUser(CreateUserRequest request) throws Exception {
        User user = userService.createUser(request.displayName(), request.initialBalance());
        return ResponseEntity.status(HttpStatus.CREATED).body(UserMapper.INSTANCE.toResponse(user));
    }

    @Override
    public ResponseEntity<List<UserResponse>> getUsers() {
        return ResponseEntity.ok(UserMapper.INSTANCE.toResponseList(userService.getUsers()));
    }

    @Override
    public ResponseEntity<UserResponse> getUser(Long userId) throws Exception {
        return ResponseEntity.ok(UserMapper.INSTANCE.toResponse(userService.getUser(userId)));
    }

    @Override
    public ResponseEntity<UserStatisticsResponse> getStatistics(Long userId) throws Exception {
        return ResponseEntity.ok(userService.getStatistics(userId));
    }
}
