package com.nosota.wagerbook.api;

import com.nosota.wagerbook.api.request.CreateUserRequest;
import com.nosota.wagerbook.api.response.UserResponse;
import com.nosota.wagerbook.api.response.UserStatisticsResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * User API interface for bettor accounts.
 */
@RequestMapping("/api/v1/users")
public interface UserApi {

    /**
     * Creates a bettor. The opening balance is booked as a DEPOSIT ledger entry.
     */
    @PostMapping
    ResponseEntity<UserResponse> createUser(@RequestBody @Valid CreateUserRequest request) throws Exception;

    @GetMapping
    ResponseEntity<List<UserResponse>> getUsers();

    @GetMapping("/{userId}")
    ResponseEntity<UserResponse> getUser(@PathVariable("userId") Long userId) throws Exception;

    @GetMapping("/{userId}/statistics")
    ResponseEntity<UserStatisticsResponse> getStatistics(@PathVariable("userId") Long userId) throws Exception;
}
