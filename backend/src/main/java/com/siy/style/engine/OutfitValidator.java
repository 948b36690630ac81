package com.siy.style.engine;

import com.siy.style.catalog.PairingRules;
import com.siy.style.domain.AestheticStatus;
import com.siy.style.domain.CategoryL1;
import com.siy.style.domain.ClothingAttributes;
import com.siy.style.domain.ColorStatus;
import com.siy.style.domain.FormalityStatus;
import com.siy.style.domain.OutfitValidation;
import com.siy.style.domain.PairingStatus;
import com.siy.style.domain.StyleEngineException;
import com.siy.style.domain.StyleErrorCode;
import com.siy.style.domain.ValidationStatus;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Checks candidate items against the base item on four axes (color, formality, aesthetics,
 * pairing) and folds the per-item penalties into a 0-100 cohesion score.
 */
@Component
public class OutfitValidator {

    static final String VERDICT_GREAT = "Great fit";
    static final String VERDICT_CAVEATS = "Works, with caveats";
    static final String VERDICT_REWORK = "Needs rework";

    private static final int GREAT_FIT_MIN_SCORE = 85;
    private static final int CAVEATS_MIN_SCORE = 60;

    private final ColorHarmonyEngine colorHarmonyEngine;
    private final FormalityRules formalityRules;
    private final AestheticMatcher aestheticMatcher;
    private final StyleEngineProperties properties;

    public OutfitValidator(
        ColorHarmonyEngine colorHarmonyEngine,
        FormalityRules formalityRules,
        AestheticMatcher aestheticMatcher,
        StyleEngineProperties properties
    ) {
        this.colorHarmonyEngine = colorHarmonyEngine;
        this.formalityRules = formalityRules;
        this.aestheticMatcher = aestheticMatcher;
        this.properties = properties;
    }

    /**
     * Validates {@code items}, in the order they were added, against {@code base}. A base with no
     * further items is a valid, incomplete outfit.
     */
    public OutfitValidation validate(ClothingAttributes base, List<ClothingAttributes> items) {
        if (base == null) {
            throw new StyleEngineException(StyleErrorCode.EMPTY_OUTFIT, "base item is missing");
        }

        List<ClothingAttributes> outfit = new ArrayList<>();
        outfit.add(base);
        if (items != null) {
            outfit.addAll(items);
        }

        ColorStatus colorStatus = ColorStatus.OK;
        FormalityStatus formalityStatus = FormalityStatus.OK;
        AestheticStatus aestheticStatus = AestheticStatus.COHESIVE;
        PairingStatus pairingStatus = PairingStatus.OK;
        List<String> warnings = new ArrayList<>();
        double penalty = 0;

        for (int index = 1; index < outfit.size(); index++) {
            ClothingAttributes item = outfit.get(index);
            ItemAssessment assessment = assess(base, item, outfit.subList(0, index));

            colorStatus = colorStatus.worse(assessment.colorStatus());
            formalityStatus = formalityStatus.worse(assessment.formalityStatus());
            aestheticStatus = aestheticStatus.worse(assessment.aestheticStatus());
            pairingStatus = pairingStatus.worse(assessment.pairingStatus());
            warnings.addAll(assessment.warnings());
            penalty += assessment.penalty();
        }

        if (outfit.size() > PairingRules.MAX_OUTFIT_ITEMS) {
            pairingStatus = PairingStatus.WARNING;
            warnings.add(String.format(
                Locale.ROOT,
                "Outfit has %d items (max %d)",
                outfit.size(),
                PairingRules.MAX_OUTFIT_ITEMS
            ));
        }

        int score = cohesionScore(penalty);
        return new OutfitValidation(
            isComplete(outfit),
            score,
            verdictFor(score),
            colorStatus,
            formalityStatus,
            aestheticStatus,
            pairingStatus,
            warnings,
            outfit.stream().map(attributes -> attributes.color().hex()).toList(),
            missingCategories(outfit)
        );
    }

    /**
     * Checks one new item against the base item and the items already in the outfit.
     */
    public ValidationStatus validateItem(
        ClothingAttributes newItem,
        ClothingAttributes base,
        List<ClothingAttributes> currentOutfit
    ) {
        List<ClothingAttributes> current = currentOutfit == null ? List.of() : currentOutfit;
        String label = labelOf(newItem);

        ColorStatus colorStatus = ColorStatus.OK;
        List<String> colorWarnings = new ArrayList<>();
        if (!colorHarmonyEngine.isCompatible(base.color(), newItem.color())) {
            colorStatus = ColorStatus.WARNING;
            colorWarnings.add(label + ": color " + newItem.color().name() + " may clash with the base item");
        }
        for (ClothingAttributes other : current) {
            if (!colorHarmonyEngine.isCompatible(other.color(), newItem.color())) {
                colorStatus = ColorStatus.WARNING;
                colorWarnings.add(label + ": color " + newItem.color().name() + " may clash with " + labelOf(other));
            }
        }

        FormalityStatus formalityStatus = formalityRules.statusFor(base.formality(), newItem.formality());
        List<String> formalityWarnings = new ArrayList<>();
        formalityMessage(label, "the base item", base.formality(), newItem.formality(), formalityStatus)
            .ifPresent(formalityWarnings::add);
        for (ClothingAttributes other : current) {
            FormalityStatus status = formalityRules.statusFor(other.formality(), newItem.formality());
            formalityStatus = formalityStatus.worse(status);
            formalityMessage(label, labelOf(other), other.formality(), newItem.formality(), status)
                .ifPresent(formalityWarnings::add);
        }

        AestheticStatus aestheticStatus = aestheticMatcher.statusFor(base.aesthetics(), newItem.aesthetics());

        List<ClothingAttributes> earlier = new ArrayList<>();
        earlier.add(base);
        earlier.addAll(current);
        List<String> pairingIssues = pairingIssues(newItem, earlier);

        List<String> warnings = new ArrayList<>(colorWarnings);
        warnings.addAll(formalityWarnings);
        if (aestheticStatus == AestheticStatus.WARNING) {
            warnings.add(aestheticMessage(label));
        }
        warnings.addAll(pairingIssues);

        return new ValidationStatus(
            colorStatus,
            formalityStatus,
            aestheticStatus,
            pairingIssues.isEmpty() ? PairingStatus.OK : PairingStatus.WARNING,
            warnings
        );
    }

    public String verdictFor(int score) {
        if (score >= GREAT_FIT_MIN_SCORE) {
            return VERDICT_GREAT;
        }
        if (score >= CAVEATS_MIN_SCORE) {
            return VERDICT_CAVEATS;
        }
        return VERDICT_REWORK;
    }

    private ItemAssessment assess(ClothingAttributes base, ClothingAttributes item, List<ClothingAttributes> earlier) {
        StyleEngineProperties.Scoring scoring = properties.getScoring();
        String label = labelOf(item);
        List<String> warnings = new ArrayList<>();

        double colorPenalty = colorHarmonyEngine.colorPenalty(base.color(), item.color());
        ColorStatus colorStatus = colorPenalty > 0 ? ColorStatus.WARNING : ColorStatus.OK;
        if (colorStatus == ColorStatus.WARNING) {
            warnings.add(label + ": color " + item.color().name() + " sits outside the base color's harmony");
        }

        FormalityStatus formalityStatus = formalityRules.statusFor(base.formality(), item.formality());
        formalityMessage(label, "the base item", base.formality(), item.formality(), formalityStatus)
            .ifPresent(warnings::add);

        AestheticStatus aestheticStatus = aestheticMatcher.statusFor(base.aesthetics(), item.aesthetics());
        if (aestheticStatus == AestheticStatus.WARNING) {
            warnings.add(aestheticMessage(label));
        }

        List<String> pairingIssues = pairingIssues(item, earlier);
        PairingStatus pairingStatus = PairingStatus.OK;
        if (!pairingIssues.isEmpty()) {
            pairingStatus = PairingStatus.WARNING;
            warnings.add(String.join("; ", pairingIssues));
        }

        double penalty = scoring.getColorWeight() * colorPenalty
            + scoring.getFormalityWeight() * formalityRules.penaltyFor(formalityStatus)
            + scoring.getAestheticWeight() * aestheticMatcher.penalty(base.aesthetics(), item.aesthetics());

        return new ItemAssessment(colorStatus, formalityStatus, aestheticStatus, pairingStatus, warnings, penalty);
    }

    /**
     * Shoe/bottom pairing problems between {@code item} and the items before it, and a
     * category-limit problem when {@code item} is one piece too many of its category.
     */
    private List<String> pairingIssues(ClothingAttributes item, List<ClothingAttributes> earlier) {
        List<String> issues = new ArrayList<>();
        for (ClothingAttributes other : earlier) {
            shoeBottomIssue(item, other).ifPresent(issues::add);
        }

        CategoryL1 category = item.l1();
        long sameCategory = earlier.stream().filter(other -> other.l1() == category).count() + 1;
        int limit = PairingRules.maxItemsPerCategory(category);
        if (sameCategory > limit) {
            issues.add(String.format(
                Locale.ROOT,
                "%s: more than %d %s item%s in one outfit",
                labelOf(item),
                limit,
                category.label(),
                limit == 1 ? "" : "s"
            ));
        }
        return issues;
    }

    private static Optional<String> shoeBottomIssue(ClothingAttributes first, ClothingAttributes second) {
        ClothingAttributes shoes;
        ClothingAttributes bottom;
        if (first.l1() == CategoryL1.SHOES && isBottom(second)) {
            shoes = first;
            bottom = second;
        } else if (second.l1() == CategoryL1.SHOES && isBottom(first)) {
            shoes = second;
            bottom = first;
        } else {
            return Optional.empty();
        }

        String bottomL2 = bottom.category().l2();
        if (bottomL2.isEmpty()) {
            return Optional.empty();
        }
        return PairingRules.allowedBottomsFor(shoes.category().l2())
            .filter(allowed -> allowed.stream().noneMatch(bottomL2::equalsIgnoreCase))
            .map(allowed -> shoes.category().l2() + " typically don't pair with " + bottomL2);
    }

    private static boolean isBottom(ClothingAttributes item) {
        return item.l1() == CategoryL1.BOTTOMS || item.l1() == CategoryL1.FULL_BODY;
    }

    private static Optional<String> formalityMessage(
        String label,
        String otherLabel,
        double otherFormality,
        double formality,
        FormalityStatus status
    ) {
        double gap = Math.abs(otherFormality - formality);
        return switch (status) {
            case OK -> Optional.empty();
            case WARNING -> Optional.of(String.format(
                Locale.ROOT, "%s: formality gap of %.1f levels with %s", label, gap, otherLabel));
            case MISMATCH -> Optional.of(String.format(
                Locale.ROOT, "%s: formality mismatch, %.1f levels apart from %s", label, gap, otherLabel));
        };
    }

    private static String aestheticMessage(String label) {
        return label + ": shares too few aesthetic tags with the base item";
    }

    private static int cohesionScore(double penalty) {
        long rounded = Math.round(penalty);
        return (int) (100 - Math.max(0, Math.min(100, rounded)));
    }

    private static boolean isComplete(List<ClothingAttributes> outfit) {
        return missingCategories(outfit).isEmpty();
    }

    private static List<CategoryL1> missingCategories(List<ClothingAttributes> outfit) {
        Set<CategoryL1> present = EnumSet.noneOf(CategoryL1.class);
        outfit.forEach(item -> present.add(item.l1()));

        return PairingRules.requiredCategories(present.contains(CategoryL1.FULL_BODY))
            .stream()
            .filter(category -> !present.contains(category))
            .toList();
    }

    private static String labelOf(ClothingAttributes item) {
        String l2 = item.category().l2();
        return l2.isEmpty() ? item.l1().label() : l2;
    }

    private record ItemAssessment(
        ColorStatus colorStatus,
        FormalityStatus formalityStatus,
        AestheticStatus aestheticStatus,
        PairingStatus pairingStatus,
        List<String> warnings,
        double penalty
    ) {
    }
}
