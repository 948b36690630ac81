package com.siy.style.controller;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.siy.style.engine.AestheticMatcher;
import com.siy.style.engine.ColorHarmonyEngine;
import com.siy.style.engine.ColorModel;
import com.siy.style.engine.FormalityRules;
import com.siy.style.engine.OutfitValidator;
import com.siy.style.engine.StyleEngineProperties;
import com.siy.style.service.OutfitValidationService;
import com.siy.style.service.StyleRequestMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

class ValidationControllerTest {

    private static final String BLUE_TEE = """
        {"color": {"hex": "#3366CC"}, "category": {"l1": "Tops", "l2": "T-Shirts"}, "formality": 2}
        """;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        StyleEngineProperties properties = new StyleEngineProperties();
        ColorModel colorModel = new ColorModel(properties);
        OutfitValidator validator = new OutfitValidator(
            new ColorHarmonyEngine(colorModel, properties),
            new FormalityRules(properties),
            new AestheticMatcher(),
            properties
        );
        OutfitValidationService service = new OutfitValidationService(new StyleRequestMapper(colorModel), validator);
        mockMvc = MockMvcSupport.mockMvc(new ValidationController(service));
    }

    @Test
    void validateOutfit_should_score_the_outfit() throws Exception {
        String body = """
            {
              "base_item": %s,
              "outfit": [
                {"color": {"hex": "#000000"}, "category": {"l1": "Shoes", "l2": "Oxfords"}, "formality": 5}
              ]
            }
            """.formatted(BLUE_TEE);

        mockMvc.perform(post("/api/validate-outfit").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cohesion_score").value(65))
            .andExpect(jsonPath("$.verdict").value("Works, with caveats"))
            .andExpect(jsonPath("$.formality_status").value("mismatch"))
            .andExpect(jsonPath("$.aesthetic_status").value("cohesive"))
            .andExpect(jsonPath("$.is_complete").value(false))
            .andExpect(jsonPath("$.missing_categories", contains("Bottoms")))
            .andExpect(jsonPath("$.color_strip", contains("#3366CC", "#000000")));
    }

    @Test
    void validateOutfit_should_score_a_base_only_outfit_as_incomplete() throws Exception {
        String body = """
            {"base_item": %s, "outfit": []}
            """.formatted(BLUE_TEE);

        mockMvc.perform(post("/api/validate-outfit").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cohesion_score").value(100))
            .andExpect(jsonPath("$.verdict").value("Great fit"))
            .andExpect(jsonPath("$.is_complete").value(false))
            .andExpect(jsonPath("$.missing_categories", contains("Bottoms", "Shoes")))
            .andExpect(jsonPath("$.color_strip", contains("#3366CC")));
    }

    @Test
    void validateOutfit_should_reject_a_missing_base_item() throws Exception {
        mockMvc.perform(post("/api/validate-outfit").contentType(MediaType.APPLICATION_JSON).content("{\"outfit\": []}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("OUT_OF_RANGE_VALUE"))
            .andExpect(jsonPath("$.message", startsWith("baseItem ")));
    }

    @Test
    void validateOutfit_should_reject_a_null_outfit_entry() throws Exception {
        String body = """
            {"base_item": %s, "outfit": [null]}
            """.formatted(BLUE_TEE);

        mockMvc.perform(post("/api/validate-outfit").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("OUT_OF_RANGE_VALUE"))
            .andExpect(jsonPath("$.message", startsWith("outfit")));
    }

    @Test
    void validateItem_should_report_each_axis() throws Exception {
        String body = """
            {
              "base_item": %s,
              "current_outfit": [
                {"color": {"hex": "#1E3A5F"}, "category": {"l1": "Bottoms", "l2": "Jeans"}, "formality": 1.5}
              ],
              "new_item": {"color": {"hex": "#000000"}, "category": {"l1": "Shoes", "l2": "Oxfords"}, "formality": 2}
            }
            """.formatted(BLUE_TEE);

        mockMvc.perform(post("/api/validate-item").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.color_status").value("ok"))
            .andExpect(jsonPath("$.formality_status").value("ok"))
            .andExpect(jsonPath("$.aesthetic_status").value("cohesive"))
            .andExpect(jsonPath("$.pairing_status").value("warning"))
            .andExpect(jsonPath("$.warnings", contains("Oxfords typically don't pair with Jeans")));
    }

    @Test
    void validateItem_should_reject_a_missing_new_item() throws Exception {
        String body = """
            {"base_item": %s}
            """.formatted(BLUE_TEE);

        mockMvc.perform(post("/api/validate-item").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("OUT_OF_RANGE_VALUE"))
            .andExpect(jsonPath("$.message", startsWith("newItem ")));
    }

    @Test
    void validateItem_should_reject_a_null_entry_in_the_current_outfit() throws Exception {
        String body = """
            {
              "base_item": %s,
              "current_outfit": [null],
              "new_item": {"color": {"hex": "#000000"}, "category": {"l1": "Shoes", "l2": "Oxfords"}, "formality": 2}
            }
            """.formatted(BLUE_TEE);

        mockMvc.perform(post("/api/validate-item").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("OUT_OF_RANGE_VALUE"))
            .andExpect(jsonPath("$.message", startsWith("currentOutfit")));
    }

    @Test
    void validateItem_should_reject_unreadable_json() throws Exception {
        mockMvc.perform(post("/api/validate-item").contentType(MediaType.APPLICATION_JSON).content("{not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("MALFORMED_REQUEST"));
    }
}
