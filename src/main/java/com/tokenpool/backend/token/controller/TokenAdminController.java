package com.tokenpool.backend.token.controller;

import com.tokenpool.backend.token.dto.TokenAdminRequests;
import com.tokenpool.backend.token.dto.TokenListResponse;
import com.tokenpool.backend.token.model.TokenListFilters;
import com.tokenpool.backend.token.model.TokenType;
import com.tokenpool.backend.token.service.TokenAdminService;
import com.tokenpool.backend.token.service.TokenQueryService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * admin 介面（驗證由外層 gateway 處理，這裡不管）
 */
@Tag(name = "TokenAdmin", description = "Token pool admin: add/delete/tag/note/limits + list/filter")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/admin/tokens")
public class TokenAdminController {

    private final TokenAdminService adminService;
    private final TokenQueryService queryService;

    @GetMapping
    public TokenListResponse list(
            @RequestParam(value = "page", required = false) Integer page,
            @RequestParam(value = "per_page", required = false) String perPage,
            @RequestParam(value = "token_type", required = false) String tokenType,
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "nsfw", required = false) String nsfw,
            @RequestParam(value = "search", required = false) String search,
            @RequestParam(value = "tag", required = false) String tag
    ) {
        TokenListFilters filters = TokenListFilters.parse(tokenType, status, nsfw, search, tag);
        return queryService.page(filters, page, perPage);
    }

    @PostMapping
    public TokenAdminRequests.CountResponse add(@Valid @RequestBody TokenAdminRequests.AddTokens body) {
        int n = adminService.addTokens(body.tokens(), TokenType.parse(body.tokenType()));
        return new TokenAdminRequests.CountResponse(n);
    }

    @PostMapping("/delete")
    public TokenAdminRequests.CountResponse delete(@Valid @RequestBody TokenAdminRequests.DeleteTokens body) {
        int n = adminService.deleteTokens(body.tokens(), TokenType.parse(body.tokenType()));
        return new TokenAdminRequests.CountResponse(n);
    }

    @PutMapping("/tags")
    public void updateTags(@Valid @RequestBody TokenAdminRequests.UpdateTags body) {
        adminService.updateTags(body.token(), TokenType.parse(body.tokenType()), body.tags());
    }

    @GetMapping("/tags")
    public List<String> allTags() {
        return adminService.allTags();
    }

    @PutMapping("/note")
    public void updateNote(@Valid @RequestBody TokenAdminRequests.UpdateNote body) {
        adminService.updateNote(body.token(), TokenType.parse(body.tokenType()), body.note());
    }

    @PutMapping("/limits")
    public void updateLimits(@Valid @RequestBody TokenAdminRequests.UpdateLimits body) {
        adminService.updateLimits(body.token(), body.remainingQueries(), body.heavyRemainingQueries());
    }

    @PostMapping("/reset-health")
    public void resetHealth(@Valid @RequestBody TokenAdminRequests.ResetHealth body) {
        adminService.resetHealth(body.token());
    }
}
