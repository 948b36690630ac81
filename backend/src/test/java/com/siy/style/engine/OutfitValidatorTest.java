package com.siy.style.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.siy.style.domain.AestheticStatus;
import com.siy.style.domain.CategoryL1;
import com.siy.style.domain.ClothingAttributes;
import com.siy.style.domain.ColorStatus;
import com.siy.style.domain.FormalityStatus;
import com.siy.style.domain.OutfitValidation;
import com.siy.style.domain.PairingStatus;
import com.siy.style.domain.StyleErrorCode;
import com.siy.style.domain.ValidationStatus;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class OutfitValidatorTest {

    private final StyleFixtures fixtures = new StyleFixtures();
    private final OutfitValidator validator = fixtures.outfitValidator;

    private final ClothingAttributes blueTee = fixtures.item("#3366CC", CategoryL1.TOPS, "T-Shirts", 2);

    @Test
    void validate_should_charge_the_full_formality_share_for_a_mismatch() {
        ClothingAttributes oxfords = fixtures.item("#000000", CategoryL1.SHOES, "Oxfords", 5);

        OutfitValidation validation = validator.validate(blueTee, List.of(oxfords));

        assertThat(validation.formalityStatus()).isEqualTo(FormalityStatus.MISMATCH);
        assertThat(validation.cohesionScore()).isEqualTo(65);
        assertThat(validation.verdict()).isEqualTo("Works, with caveats");
        assertThat(validation.warnings())
            .containsExactly("Oxfords: formality mismatch, 3.0 levels apart from the base item");
    }

    @Test
    void validate_should_treat_untagged_outfits_as_cohesive() {
        OutfitValidation validation = validator.validate(blueTee, List.of(
            fixtures.item("#1E3A5F", CategoryL1.BOTTOMS, "Chinos", 2.5),
            fixtures.item("#FFFFFF", CategoryL1.SHOES, "Sneakers", 1.5)
        ));

        assertThat(validation.aestheticStatus()).isEqualTo(AestheticStatus.COHESIVE);
        assertThat(validation.cohesionScore()).isEqualTo(100);
        assertThat(validation.verdict()).isEqualTo("Great fit");
        assertThat(validation.complete()).isTrue();
        assertThat(validation.missingCategories()).isEmpty();
        assertThat(validation.warnings()).isEmpty();
    }

    @Test
    void validate_should_penalize_a_color_outside_the_harmony() {
        ClothingAttributes greenChinos = fixtures.item("#33CC73", CategoryL1.BOTTOMS, "Chinos", 2);

        OutfitValidation validation = validator.validate(blueTee, List.of(greenChinos));

        assertThat(validation.colorStatus()).isEqualTo(ColorStatus.WARNING);
        assertThat(validation.cohesionScore()).isEqualTo(60);
        assertThat(validation.warnings()).containsExactly("Chinos: color Green sits outside the base color's harmony");
    }

    @Test
    void validate_should_clamp_the_score_at_zero() {
        ClothingAttributes base = fixtures.item("#3366CC", CategoryL1.TOPS, "Hoodies", 1);

        OutfitValidation validation = validator.validate(base, List.of(
            fixtures.item("#000000", CategoryL1.BOTTOMS, "Dress Pants", 5),
            fixtures.item("#000000", CategoryL1.SHOES, "Oxfords", 5),
            fixtures.item("#000000", CategoryL1.OUTERWEAR, "Coats", 5),
            fixtures.item("#000000", CategoryL1.ACCESSORIES, "Watches", 5)
        ));

        assertThat(validation.cohesionScore()).isZero();
        assertThat(validation.verdict()).isEqualTo("Needs rework");
    }

    @Test
    void validate_should_flag_two_pairs_of_shoes() {
        OutfitValidation validation = validator.validate(blueTee, List.of(
            fixtures.item("#FFFFFF", CategoryL1.SHOES, "Sneakers", 2),
            fixtures.item("#000000", CategoryL1.SHOES, "Boots", 2)
        ));

        assertThat(validation.pairingStatus()).isEqualTo(PairingStatus.WARNING);
        assertThat(validation.warnings()).containsExactly("Boots: more than 1 Shoes item in one outfit");
        assertThat(validation.cohesionScore()).isEqualTo(100);
    }

    @Test
    void validate_should_flag_shoes_that_do_not_suit_the_bottoms() {
        OutfitValidation validation = validator.validate(blueTee, List.of(
            fixtures.item("#1E3A5F", CategoryL1.BOTTOMS, "Jeans", 1.5),
            fixtures.item("#000000", CategoryL1.SHOES, "Oxfords", 2)
        ));

        assertThat(validation.pairingStatus()).isEqualTo(PairingStatus.WARNING);
        assertThat(validation.warnings()).containsExactly("Oxfords typically don't pair with Jeans");
        assertThat(validation.complete()).isTrue();
    }

    @Test
    void validate_should_warn_when_the_outfit_exceeds_the_item_cap() {
        OutfitValidation validation = validator.validate(blueTee, List.of(
            fixtures.item("#1E3A5F", CategoryL1.BOTTOMS, "Jeans", 2),
            fixtures.item("#FFFFFF", CategoryL1.SHOES, "Sneakers", 2),
            fixtures.item("#000000", CategoryL1.OUTERWEAR, "Jackets", 2),
            fixtures.item("#000000", CategoryL1.ACCESSORIES, "Watches", 2.5),
            fixtures.item("#000000", CategoryL1.ACCESSORIES, "Belts", 2.5),
            fixtures.item("#000000", CategoryL1.ACCESSORIES, "Bags", 2.5)
        ));

        assertThat(validation.pairingStatus()).isEqualTo(PairingStatus.WARNING);
        assertThat(validation.warnings()).containsExactly("Outfit has 7 items (max 6)");
        assertThat(validation.colorStrip()).hasSize(7);
    }

    @Test
    void validate_should_report_missing_categories() {
        OutfitValidation validation = validator.validate(blueTee, List.of(
            fixtures.item("#000000", CategoryL1.ACCESSORIES, "Watches", 2)
        ));

        assertThat(validation.complete()).isFalse();
        assertThat(validation.missingCategories()).containsExactly(CategoryL1.BOTTOMS, CategoryL1.SHOES);
    }

    @Test
    void validate_should_accept_a_full_body_base_with_shoes_as_complete() {
        ClothingAttributes dress = fixtures.item("#C0392B", CategoryL1.FULL_BODY, "Dresses", 3);

        OutfitValidation validation = validator.validate(dress, List.of(
            fixtures.item("#000000", CategoryL1.SHOES, "Heels", 4)
        ));

        assertThat(validation.complete()).isTrue();
        assertThat(validation.pairingStatus()).isEqualTo(PairingStatus.OK);
    }

    @Test
    void validate_should_list_warnings_item_by_item_in_axis_order() {
        ClothingAttributes base = fixtures.item("#3366CC", CategoryL1.TOPS, "T-Shirts", 2, "Streetwear");

        OutfitValidation validation = validator.validate(base, List.of(
            fixtures.item("#33CC73", CategoryL1.BOTTOMS, "Dress Pants", 4.5, "Classic"),
            fixtures.item("#000000", CategoryL1.SHOES, "Sandals", 1, "Streetwear")
        ));

        assertThat(validation.warnings()).containsExactly(
            "Dress Pants: color Green sits outside the base color's harmony",
            "Dress Pants: formality mismatch, 2.5 levels apart from the base item",
            "Dress Pants: shares too few aesthetic tags with the base item",
            "Sandals typically don't pair with Dress Pants"
        );
    }

    @Test
    void validate_should_build_the_color_strip_base_first() {
        OutfitValidation validation = validator.validate(blueTee, List.of(
            fixtures.item("#1e3a5f", CategoryL1.BOTTOMS, "Chinos", 2),
            fixtures.item("#fff", CategoryL1.SHOES, "Loafers", 2.5)
        ));

        assertThat(validation.colorStrip()).containsExactly("#3366CC", "#1E3A5F", "#FFFFFF");
    }

    @Test
    void validate_should_score_a_base_only_outfit_as_incomplete() {
        for (List<ClothingAttributes> items : Arrays.asList(List.<ClothingAttributes>of(), null)) {
            OutfitValidation validation = validator.validate(blueTee, items);

            assertThat(validation.cohesionScore()).isEqualTo(100);
            assertThat(validation.verdict()).isEqualTo("Great fit");
            assertThat(validation.complete()).isFalse();
            assertThat(validation.colorStrip()).containsExactly("#3366CC");
            assertThat(validation.missingCategories()).containsExactly(CategoryL1.BOTTOMS, CategoryL1.SHOES);
            assertThat(validation.warnings()).isEmpty();
        }
    }

    @Test
    void validate_should_reject_a_missing_base() {
        assertThat(StyleFixtures.errorCodeOf(() -> validator.validate(null, List.of(blueTee))))
            .isEqualTo(StyleErrorCode.EMPTY_OUTFIT);
    }

    @Test
    void validate_should_score_the_same_whatever_the_base_color_is_called() {
        ClothingAttributes tealChinos = fixtures.item("#00AA80", CategoryL1.BOTTOMS, "Chinos", 2);
        ClothingAttributes unnamed = fixtures.item("#0000AA", CategoryL1.TOPS, "T-Shirts", 2);
        ClothingAttributes cobalt = new ClothingAttributes(
            fixtures.colorModel.fromHex("#0000AA", "Cobalt"),
            unnamed.category(),
            2,
            Set.of()
        );

        for (ClothingAttributes base : List.of(unnamed, cobalt)) {
            OutfitValidation validation = validator.validate(base, List.of(tealChinos));

            assertThat(validation.colorStatus()).isEqualTo(ColorStatus.WARNING);
            assertThat(validation.cohesionScore()).isEqualTo(60);
        }
    }

    @Test
    void verdictFor_should_map_score_brackets() {
        assertThat(validator.verdictFor(100)).isEqualTo("Great fit");
        assertThat(validator.verdictFor(85)).isEqualTo("Great fit");
        assertThat(validator.verdictFor(84)).isEqualTo("Works, with caveats");
        assertThat(validator.verdictFor(60)).isEqualTo("Works, with caveats");
        assertThat(validator.verdictFor(59)).isEqualTo("Needs rework");
        assertThat(validator.verdictFor(0)).isEqualTo("Needs rework");
    }

    @Test
    void validateItem_should_check_the_new_item_against_base_and_outfit() {
        ClothingAttributes base = fixtures.item("#3366CC", CategoryL1.TOPS, "T-Shirts", 2, "Streetwear");
        ClothingAttributes jeans = fixtures.item("#1E3A5F", CategoryL1.BOTTOMS, "Jeans", 1.5);
        ClothingAttributes oxfords = fixtures.item("#000000", CategoryL1.SHOES, "Oxfords", 4.5, "Classic");

        ValidationStatus status = validator.validateItem(oxfords, base, List.of(jeans));

        assertThat(status.colorStatus()).isEqualTo(ColorStatus.OK);
        assertThat(status.formalityStatus()).isEqualTo(FormalityStatus.MISMATCH);
        assertThat(status.aestheticStatus()).isEqualTo(AestheticStatus.WARNING);
        assertThat(status.pairingStatus()).isEqualTo(PairingStatus.WARNING);
        assertThat(status.warnings()).containsExactly(
            "Oxfords: formality mismatch, 2.5 levels apart from the base item",
            "Oxfords: formality mismatch, 3.0 levels apart from Jeans",
            "Oxfords: shares too few aesthetic tags with the base item",
            "Oxfords typically don't pair with Jeans"
        );
    }

    @Test
    void validateItem_should_pass_a_compatible_item() {
        ClothingAttributes chinos = fixtures.item("#CC9933", CategoryL1.BOTTOMS, "Chinos", 2.5);

        ValidationStatus status = validator.validateItem(chinos, blueTee, null);

        assertThat(status.colorStatus()).isEqualTo(ColorStatus.OK);
        assertThat(status.formalityStatus()).isEqualTo(FormalityStatus.OK);
        assertThat(status.aestheticStatus()).isEqualTo(AestheticStatus.COHESIVE);
        assertThat(status.pairingStatus()).isEqualTo(PairingStatus.OK);
        assertThat(status.warnings()).isEmpty();
    }

    @Test
    void validateItem_should_warn_about_a_color_clash_with_an_outfit_item() {
        ClothingAttributes gray = fixtures.item("#808080", CategoryL1.TOPS, "Sweaters", 2.5);
        ClothingAttributes redSkirt = fixtures.item("#C0392B", CategoryL1.BOTTOMS, "Skirts", 2.5);
        ClothingAttributes greenShoes = fixtures.item("#33CC73", CategoryL1.SHOES, "Sneakers", 2);

        ValidationStatus status = validator.validateItem(greenShoes, gray, List.of(redSkirt));

        assertThat(status.colorStatus()).isEqualTo(ColorStatus.WARNING);
        assertThat(status.warnings()).containsExactly(
            "Sneakers: color Green may clash with Skirts",
            "Sneakers typically don't pair with Skirts"
        );
    }
}
