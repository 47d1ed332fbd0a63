package com.dating.discovery.controller;

import com.dating.discovery.dto.*;
import com.dating.discovery.dto.enums.InteractionType;
import com.dating.discovery.service.DiscoveryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/discovery")
@RequiredArgsConstructor
@Tag(name = "Discovery", description = "Candidates, swipes, matches and favorites")
public class DiscoveryController {
    private final DiscoveryService discoveryService;

    @GetMapping("/candidates")
    @Operation(summary = "Ranked candidates for a user")
    public ResponseEntity<List<CandidateView>> getCandidates(@RequestParam long userId,
                                                             @RequestParam(required = false) Integer pageSize) {
        return ResponseEntity.ok(discoveryService.getCandidates(userId, pageSize));
    }

    @PostMapping("/swipe")
    @Operation(summary = "Record a like, pass, superlike, block or report")
    public ResponseEntity<SwipeResponse> swipe(@Valid @RequestBody SwipeRequest request) {
        InteractionType type = InteractionType.fromValue(request.getType());
        return ResponseEntity.ok(discoveryService.swipe(request.getUserId(), request.getTargetId(), type));
    }

    @GetMapping("/matches")
    @Operation(summary = "Matches of a user, newest first")
    public ResponseEntity<List<MatchView>> getMatches(@RequestParam long userId,
                                                      @RequestParam(defaultValue = "0") int page,
                                                      @RequestParam(required = false) Integer size) {
        return ResponseEntity.ok(discoveryService.getMatches(userId, page, size));
    }

    @GetMapping("/likes")
    @Operation(summary = "Unanswered likes received by a user")
    public ResponseEntity<List<IncomingLikeView>> getIncomingLikes(@RequestParam long userId,
                                                                   @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(discoveryService.getIncomingLikes(userId, limit));
    }

    @GetMapping("/settings/{userId}")
    public ResponseEntity<DiscoverySettings> getSettings(@PathVariable long userId) {
        return ResponseEntity.ok(discoveryService.getSettings(userId));
    }

    @PutMapping("/settings/{userId}")
    @Operation(summary = "Partially update discovery settings")
    public ResponseEntity<DiscoverySettings> updateSettings(@PathVariable long userId,
                                                            @Valid @RequestBody SettingsUpdateRequest request) {
        return ResponseEntity.ok(discoveryService.updateSettings(userId, request));
    }

    @PostMapping("/favorites")
    @Operation(summary = "Add a profile to favorites (idempotent)")
    public ResponseEntity<FavoriteView> addFavorite(@Valid @RequestBody FavoriteRequest request) {
        return ResponseEntity.ok(discoveryService.addFavorite(request.getUserId(), request.getTargetId()));
    }

    @DeleteMapping("/favorites/{targetId}")
    @Operation(summary = "Remove a profile from favorites")
    public ResponseEntity<Void> removeFavorite(@PathVariable long targetId, @RequestParam long userId) {
        discoveryService.removeFavorite(userId, targetId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/favorites")
    @Operation(summary = "Favorites of a user, newest first")
    public ResponseEntity<List<FavoriteView>> getFavorites(@RequestParam long userId,
                                                           @RequestParam(defaultValue = "0") int page,
                                                           @RequestParam(required = false) Integer size) {
        return ResponseEntity.ok(discoveryService.getFavorites(userId, page, size));
    }

    @GetMapping("/quotas/{quota}")
    public ResponseEntity<QuotaStatus> getQuotaStatus(@PathVariable String quota, @RequestParam long userId) {
        return ResponseEntity.ok(discoveryService.getQuotaStatus(userId, quota));
    }
}
