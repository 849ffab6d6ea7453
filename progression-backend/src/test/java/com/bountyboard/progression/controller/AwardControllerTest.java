package com.bountyboard.progression.controller;

import com.bountyboard.progression.dto.AwardEventDTO;
import com.bountyboard.progression.dto.HunterStateDTO;
import com.bountyboard.progression.exception.DuplicateEventException;
import com.bountyboard.progression.exception.InvalidAwardEventException;
import com.bountyboard.progression.exception.UnknownActionKindException;
import com.bountyboard.progression.publish.BadgeDocumentStore;
import com.bountyboard.progression.service.BadgeService;
import com.bountyboard.progression.service.LeaderboardService;
import com.bountyboard.progression.service.LedgerService;
import com.bountyboard.progression.util.RebuildStatusManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AwardController.class)
class AwardControllerTest {

    private static final String BODY =
            "{\"hunterId\":\"@alice\",\"actionKind\":\"pr-merged\",\"referenceAmount\":25,\"sourceRef\":\"repo#12\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LedgerService ledgerService;

    @MockBean
    private LeaderboardService leaderboardService;

    @MockBean
    private BadgeService badgeService;

    @MockBean
    private BadgeDocumentStore badgeDocumentStore;

    @MockBean
    private RebuildStatusManager rebuildStatusManager;

    @Test
    void testAppendReturnsHunterState() throws Exception {
        HunterStateDTO state = HunterStateDTO.builder()
                .hunterId("alice").handle("alice").cumulativeXp(220).level(2).title("Basic Hunter")
                .badges(List.of()).newlyGrantedBadges(List.of("FIRST_BLOOD"))
                .build();
        when(ledgerService.append(any(AwardEventDTO.class))).thenReturn(state);

        mockMvc.perform(post("/api/awards").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.cumulativeXp").value(220))
                .andExpect(jsonPath("$.data.title").value("Basic Hunter"))
                .andExpect(jsonPath("$.data.newlyGrantedBadges[0]").value("FIRST_BLOOD"));
    }

    @Test
    void testDuplicateIsConflict() throws Exception {
        when(ledgerService.append(any(AwardEventDTO.class))).thenThrow(new DuplicateEventException("k", "repo#12"));

        mockMvc.perform(post("/api/awards").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value(409))
                .andExpect(jsonPath("$.errorKind").value("DUPLICATE_EVENT"));
    }

    @Test
    void testUnknownActionIsBadRequest() throws Exception {
        when(ledgerService.append(any(AwardEventDTO.class))).thenThrow(new UnknownActionKindException("dance", "repo#12"));

        mockMvc.perform(post("/api/awards").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorKind").value("UNKNOWN_ACTION_KIND"));
    }

    @Test
    void testInvalidEventIsBadRequest() throws Exception {
        when(ledgerService.append(any(AwardEventDTO.class))).thenThrow(new InvalidAwardEventException("sourceRef is required"));

        mockMvc.perform(post("/api/awards").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorKind").value("INVALID_EVENT"));
    }

    @Test
    void testUnreadableBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/awards").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testUnexpectedErrorIsHidden() throws Exception {
        when(ledgerService.append(any(AwardEventDTO.class))).thenThrow(new IllegalStateException("db password leaked"));

        mockMvc.perform(post("/api/awards").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("系统发生错误，请稍后重试"));
    }
}
