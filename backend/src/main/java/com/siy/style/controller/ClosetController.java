package com.siy.style.controller;

import com.siy.style.dto.MatchingItemsRequest;
import com.siy.style.dto.MatchingItemsResponse;
import com.siy.style.service.ClosetMatchService;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/closet")
public class ClosetController {

    static final String USER_ID_HEADER = "X-User-Id";

    private final ClosetMatchService closetMatchService;

    public ClosetController(ClosetMatchService closetMatchService) {
        this.closetMatchService = closetMatchService;
    }

    @PostMapping("/matching-items")
    public MatchingItemsResponse findMatchingItems(
        @RequestHeader(USER_ID_HEADER) UUID userId,
        @Valid @RequestBody MatchingItemsRequest request
    ) {
        return closetMatchService.findMatchingItems(userId, request);
    }
}
