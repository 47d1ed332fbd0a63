package com.dating.discovery.controller;

import com.dating.discovery.dto.CandidateView;
import com.dating.discovery.dto.FavoriteView;
import com.dating.discovery.dto.SwipeResponse;
import com.dating.discovery.dto.enums.Gender;
import com.dating.discovery.dto.enums.InteractionType;
import com.dating.discovery.exceptions.InvalidOperationException;
import com.dating.discovery.exceptions.NotFoundException;
import com.dating.discovery.exceptions.QuotaExceededException;
import com.dating.discovery.service.DiscoveryService;
import com.dating.discovery.utils.basic.Constant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DiscoveryController.class)
class DiscoveryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DiscoveryService discoveryService;

    @Test
    void swipe_ReturnsMatchOutcome() throws Exception {
        given(discoveryService.swipe(1L, 2L, InteractionType.LIKE)).willReturn(SwipeResponse.builder()
                .matched(true).matchId("42").newMatch(true).recordedType(InteractionType.LIKE).build());

        mockMvc.perform(post("/api/v1/discovery/swipe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":1,\"targetId\":2,\"type\":\"Like\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.matched").value(true))
                .andExpect(jsonPath("$.matchId").value("42"))
                .andExpect(jsonPath("$.recordedType").value("like"));
    }

    @Test
    @DisplayName("Unknown interaction types are rejected before reaching the engine")
    void swipe_UnknownType() throws Exception {
        mockMvc.perform(post("/api/v1/discovery/swipe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":1,\"targetId\":2,\"type\":\"wink\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorMsg").value(containsString("type")));

        verifyNoInteractions(discoveryService);
    }

    @Test
    void swipe_MissingUser() throws Exception {
        mockMvc.perform(post("/api/v1/discovery/swipe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetId\":2,\"type\":\"like\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(discoveryService);
    }

    @Test
    void swipe_SelfIsBadRequest() throws Exception {
        given(discoveryService.swipe(1L, 1L, InteractionType.LIKE))
                .willThrow(new InvalidOperationException("User 1 cannot interact with themselves"));

        mockMvc.perform(post("/api/v1/discovery/swipe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":1,\"targetId\":1,\"type\":\"like\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("BAD_REQUEST"));
    }

    @Test
    @DisplayName("Quota exhaustion maps to 429 with Retry-After")
    void swipe_QuotaExceeded() throws Exception {
        given(discoveryService.swipe(1L, 2L, InteractionType.SUPERLIKE))
                .willThrow(new QuotaExceededException(Constant.SUPERLIKE_DAILY, Duration.ofHours(4)));

        mockMvc.perform(post("/api/v1/discovery/swipe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":1,\"targetId\":2,\"type\":\"superlike\"}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string(HttpHeaders.RETRY_AFTER, "14400"))
                .andExpect(jsonPath("$.retryAfterSeconds").value(14400));
    }

    @Test
    void swipe_UnknownTarget() throws Exception {
        given(discoveryService.swipe(1L, 9L, InteractionType.PASS))
                .willThrow(new NotFoundException("Profile 9 not found"));

        mockMvc.perform(post("/api/v1/discovery/swipe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":1,\"targetId\":9,\"type\":\"pass\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorMsg").value("Profile 9 not found"));
    }

    @Test
    void getCandidates_ReturnsViews() throws Exception {
        given(discoveryService.getCandidates(1L, 5)).willReturn(List.of(CandidateView.builder()
                .userId(2L).name("Bob").age(27).gender(Gender.MALE)
                .interests(Set.of("hiking")).sharedInterests(Set.of("hiking"))
                .distanceLabel("hidden").compatibilityScore(63).build()));

        mockMvc.perform(get("/api/v1/discovery/candidates").param("userId", "1").param("pageSize", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].userId").value(2))
                .andExpect(jsonPath("$[0].compatibilityScore").value(63))
                .andExpect(jsonPath("$[0].distanceLabel").value("hidden"))
                .andExpect(jsonPath("$[0].distanceKm").doesNotExist());
    }

    @Test
    void getCandidates_NonNumericUser() throws Exception {
        mockMvc.perform(get("/api/v1/discovery/candidates").param("userId", "abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.parameter").value("userId"));
    }

    @Test
    void updateSettings_RejectsUnderageMinimum() throws Exception {
        mockMvc.perform(put("/api/v1/discovery/settings/1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"minAge\":17}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorMsg").value(containsString("minAge")));

        verify(discoveryService, never()).updateSettings(anyLong(), any());
    }

    @Test
    void addFavorite_ReturnsEntry() throws Exception {
        given(discoveryService.addFavorite(1L, 2L)).willReturn(FavoriteView.builder()
                .userId(2L).name("Bob").favoritedAt(LocalDateTime.of(2025, 6, 1, 12, 0)).build());

        mockMvc.perform(post("/api/v1/discovery/favorites")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":1,\"targetId\":2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value(2))
                .andExpect(jsonPath("$.name").value("Bob"));
    }

    @Test
    void addFavorite_MissingTarget() throws Exception {
        mockMvc.perform(post("/api/v1/discovery/favorites")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorMsg").value(containsString("targetId")));

        verifyNoInteractions(discoveryService);
    }

    @Test
    void removeFavorite_NoContent() throws Exception {
        mockMvc.perform(delete("/api/v1/discovery/favorites/2").param("userId", "1"))
                .andExpect(status().isNoContent());

        verify(discoveryService).removeFavorite(1L, 2L);
    }

    @Test
    void removeFavorite_Unknown() throws Exception {
        willThrow(new NotFoundException("Favorite not found"))
                .given(discoveryService).removeFavorite(1L, 3L);

        mockMvc.perform(delete("/api/v1/discovery/favorites/3").param("userId", "1"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getFavorites_PassesPaging() throws Exception {
        given(discoveryService.getFavorites(1L, 2, 5)).willReturn(List.of(FavoriteView.builder()
                .userId(4L).name("Dana").favoritedAt(LocalDateTime.of(2025, 6, 1, 12, 0)).build()));

        mockMvc.perform(get("/api/v1/discovery/favorites")
                        .param("userId", "1").param("page", "2").param("size", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].userId").value(4))
                .andExpect(jsonPath("$[0].name").value("Dana"));
    }
}
