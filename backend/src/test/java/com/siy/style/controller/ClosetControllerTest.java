package com.siy.style.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.siy.style.domain.Category;
import com.siy.style.domain.CategoryL1;
import com.siy.style.domain.GarmentColor;
import com.siy.style.domain.Hsl;
import com.siy.style.dto.ClosetItemResponse;
import com.siy.style.dto.MatchingItemsRequest;
import com.siy.style.dto.MatchingItemsResponse;
import com.siy.style.service.ClosetMatchService;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@ExtendWith(MockitoExtension.class)
class ClosetControllerTest {

    private static final UUID USER_ID = UUID.fromString("0f8c7a52-3b0e-4a4e-9d8e-2b5b0f7f4c11");

    private static final String REQUEST = """
        {
          "category_l1": "Bottoms",
          "recommended_colors": [{"hex": "#3366CC", "name": "Blue", "harmony_type": "analogous"}],
          "formality_range": {"min": 1, "max": 3},
          "limit": %d
        }
        """;

    @Mock
    private ClosetMatchService closetMatchService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcSupport.mockMvc(new ClosetController(closetMatchService));
    }

    @Test
    void findMatchingItems_should_return_ranked_items_for_the_caller() throws Exception {
        ClosetItemResponse chinos = new ClosetItemResponse(
            "item-1",
            "https://img.example/chinos",
            new GarmentColor("#3366CC", new Hsl(220, 60, 50), "Blue", false),
            new Category(CategoryL1.BOTTOMS, "Chinos"),
            2.0,
            Set.of("Preppy"),
            100,
            Instant.parse("2026-03-01T12:00:00Z")
        );
        when(closetMatchService.findMatchingItems(eq(USER_ID), any(MatchingItemsRequest.class)))
            .thenReturn(new MatchingItemsResponse(List.of(chinos), 4));

        mockMvc.perform(post("/api/closet/matching-items")
                .header(ClosetController.USER_ID_HEADER, USER_ID.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(REQUEST.formatted(5)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_in_category").value(4))
            .andExpect(jsonPath("$.items[0].match_score").value(100))
            .andExpect(jsonPath("$.items[0].color.is_neutral").value(false))
            .andExpect(jsonPath("$.items[0].category.l1").value("Bottoms"));
    }

    @Test
    void findMatchingItems_should_require_the_user_header() throws Exception {
        mockMvc.perform(post("/api/closet/matching-items")
                .contentType(MediaType.APPLICATION_JSON)
                .content(REQUEST.formatted(5)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("MALFORMED_REQUEST"));

        verifyNoInteractions(closetMatchService);
    }

    @Test
    void findMatchingItems_should_reject_a_limit_above_ten() throws Exception {
        mockMvc.perform(post("/api/closet/matching-items")
                .header(ClosetController.USER_ID_HEADER, USER_ID.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(REQUEST.formatted(11)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("OUT_OF_RANGE_VALUE"));

        verifyNoInteractions(closetMatchService);
    }

    @Test
    void findMatchingItems_should_reject_a_null_recommended_color() throws Exception {
        String body = """
            {
              "category_l1": "Bottoms",
              "recommended_colors": [null],
              "formality_range": {"min": 1, "max": 3}
            }
            """;

        mockMvc.perform(post("/api/closet/matching-items")
                .header(ClosetController.USER_ID_HEADER, USER_ID.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("OUT_OF_RANGE_VALUE"));

        verifyNoInteractions(closetMatchService);
    }
}
