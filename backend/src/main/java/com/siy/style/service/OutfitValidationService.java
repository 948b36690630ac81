package com.siy.style.service;

import com.siy.style.domain.ClothingAttributes;
import com.siy.style.domain.OutfitValidation;
import com.siy.style.domain.ValidationStatus;
import com.siy.style.dto.ValidateItemRequest;
import com.siy.style.dto.ValidateOutfitRequest;
import com.siy.style.engine.OutfitValidator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class OutfitValidationService {

    private static final Logger log = LoggerFactory.getLogger(OutfitValidationService.class);

    private final StyleRequestMapper requestMapper;
    private final OutfitValidator outfitValidator;

    public OutfitValidationService(StyleRequestMapper requestMapper, OutfitValidator outfitValidator) {
        this.requestMapper = requestMapper;
        this.outfitValidator = outfitValidator;
    }

    public ValidationStatus validateItem(ValidateItemRequest request) {
        ClothingAttributes newItem = requestMapper.toAttributes(request.newItem());
        ClothingAttributes base = requestMapper.toAttributes(request.baseItem());
        List<ClothingAttributes> currentOutfit = requestMapper.toAttributes(request.currentOutfit());

        ValidationStatus status = outfitValidator.validateItem(newItem, base, currentOutfit);
        log.debug("Validated {} against base and {} outfit items: {} warnings",
            newItem.l1().label(), currentOutfit.size(), status.warnings().size());
        return status;
    }

    public OutfitValidation validateOutfit(ValidateOutfitRequest request) {
        ClothingAttributes base = requestMapper.toAttributes(request.baseItem());
        List<ClothingAttributes> outfit = requestMapper.toAttributes(request.outfit());

        OutfitValidation validation = outfitValidator.validate(base, outfit);
        log.debug("Validated outfit of {} items (score={}, complete={})",
            outfit.size() + 1, validation.cohesionScore(), validation.complete());
        return validation;
    }
}
