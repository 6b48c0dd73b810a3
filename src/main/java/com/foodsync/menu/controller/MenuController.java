package com.foodsync.menu.controller;

import com.foodsync.common.dto.ApiResponse;
import com.foodsync.menu.dto.MenuTreeResponse;
import com.foodsync.menu.service.MenuQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/menu")
@RequiredArgsConstructor
public class MenuController {

    private final MenuQueryService menuQueryService;

    /** 전체 트리. 캐시에 있으면 캐시에서 */
    @GetMapping
    public ApiResponse<MenuTreeResponse> getMenu() {
        return ApiResponse.ok(menuQueryService.getFullMenu());
    }
}
