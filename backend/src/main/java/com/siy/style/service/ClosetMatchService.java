package com.siy.style.service;

import com.siy.closet.entity.ClothingItemEntity;
import com.siy.closet.repository.ClothingItemRepository;
import com.siy.style.domain.Category;
import com.siy.style.domain.CategoryL1;
import com.siy.style.domain.ClothingAttributes;
import com.siy.style.domain.InventoryMatchResult;
import com.siy.style.domain.MatchCriteria;
import com.siy.style.domain.RankedItem;
import com.siy.style.domain.StoredItem;
import com.siy.style.domain.StyleEngineException;
import com.siy.style.dto.ClosetItemResponse;
import com.siy.style.dto.MatchingItemsRequest;
import com.siy.style.dto.MatchingItemsResponse;
import com.siy.style.engine.ColorModel;
import com.siy.style.engine.InventoryMatcher;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ClosetMatchService {

    private static final Logger log = LoggerFactory.getLogger(ClosetMatchService.class);

    static final int DEFAULT_LIMIT = 5;

    private final ClothingItemRepository clothingItemRepository;
    private final StyleRequestMapper requestMapper;
    private final ColorModel colorModel;
    private final InventoryMatcher inventoryMatcher;

    public ClosetMatchService(
        ClothingItemRepository clothingItemRepository,
        StyleRequestMapper requestMapper,
        ColorModel colorModel,
        InventoryMatcher inventoryMatcher
    ) {
        this.clothingItemRepository = clothingItemRepository;
        this.requestMapper = requestMapper;
        this.colorModel = colorModel;
        this.inventoryMatcher = inventoryMatcher;
    }

    @Transactional(readOnly = true)
    public MatchingItemsResponse findMatchingItems(UUID userId, MatchingItemsRequest request) {
        MatchCriteria criteria = requestMapper.toCriteria(request);
        int limit = request.limit() == null ? DEFAULT_LIMIT : request.limit();

        List<StoredItem> ownedItems = clothingItemRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
            .filter(ClothingItemEntity::isOwned)
            .map(this::toStoredItem)
            .flatMap(Optional::stream)
            .toList();

        InventoryMatchResult result = inventoryMatcher.matches(criteria, ownedItems, limit);
        log.debug("Matched {} of {} {} items for user {}",
            result.items().size(), result.totalInCategory(), criteria.categoryL1().label(), userId);

        return new MatchingItemsResponse(
            result.items().stream().map(ClosetMatchService::toResponse).toList(),
            result.totalInCategory()
        );
    }

    private Optional<StoredItem> toStoredItem(ClothingItemEntity entity) {
        try {
            ClothingAttributes attributes = new ClothingAttributes(
                colorModel.fromHex(entity.getColorHex(), entity.getColorName()),
                new Category(CategoryL1.fromLabel(entity.getCategoryL1()), entity.getCategoryL2()),
                entity.getFormality(),
                new LinkedHashSet<>(entity.getAesthetics())
            );
            return Optional.of(new StoredItem(
                entity.getId().toString(),
                attributes,
                entity.getImageUrl(),
                entity.getCreatedAt() == null ? null : entity.getCreatedAt().toInstant()
            ));
        } catch (StyleEngineException exception) {
            log.warn("Skipping stored item {} with unusable attributes: {}", entity.getId(), exception.getMessage());
            return Optional.empty();
        }
    }

    private static ClosetItemResponse toResponse(RankedItem ranked) {
        StoredItem item = ranked.item();
        ClothingAttributes attributes = item.attributes();
        return new ClosetItemResponse(
            item.id(),
            item.imageUrl(),
            attributes.color(),
            attributes.category(),
            attributes.formality(),
            attributes.aesthetics(),
            ranked.score(),
            item.createdAt()
        );
    }
}
