package com.layeredapi.backend.modules.user.presentation.dto;

import java.util.List;

import com.layeredapi.backend.global.common.response.PageMeta;

public record UserListResponse(List<UserResponse> items, PageMeta meta) {
}
