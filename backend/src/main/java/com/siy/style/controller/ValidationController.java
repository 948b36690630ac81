package com.siy.style.controller;

import com.siy.style.domain.OutfitValidation;
import com.siy.style.domain.ValidationStatus;
import com.siy.style.dto.ValidateItemRequest;
import com.siy.style.dto.ValidateOutfitRequest;
import com.siy.style.service.OutfitValidationService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class ValidationController {

    private final OutfitValidationService outfitValidationService;

    public ValidationController(OutfitValidationService outfitValidationService) {
        this.outfitValidationService = outfitValidationService;
    }

    @PostMapping("/validate-item")
    public ValidationStatus validateItem(@Valid @RequestBody ValidateItemRequest request) {
        return outfitValidationService.validateItem(request);
    }

    @PostMapping("/validate-outfit")
    public OutfitValidation validateOutfit(@Valid @RequestBody ValidateOutfitRequest request) {
        return outfitValidationService.validateOutfit(request);
    }
}
