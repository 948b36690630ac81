package com.siy.closet.repository;

import com.siy.closet.entity.ClothingItemEntity;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ClothingItemRepository extends JpaRepository<ClothingItemEntity, UUID> {

    List<ClothingItemEntity> findByUserIdOrderByCreatedAtDesc(UUID userId);
}
