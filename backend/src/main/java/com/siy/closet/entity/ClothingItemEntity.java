package com.siy.closet.entity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Entity
@Table(name = "clothing_items")
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ClothingItemEntity {

    @Id
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "image_url", length = 2048)
    private String imageUrl;

    @Column(name = "color_hex", nullable = false, length = 7)
    private String colorHex;

    @Column(name = "color_name", nullable = false, length = 60)
    private String colorName;

    @Column(name = "category_l1", nullable = false, length = 20)
    private String categoryL1;

    @Column(name = "category_l2", nullable = false, length = 60)
    private String categoryL2;

    @Column(nullable = false)
    private double formality;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "clothing_item_aesthetic", joinColumns = @JoinColumn(name = "clothing_item_id"))
    @OrderColumn(name = "tag_order")
    @Column(name = "aesthetic", nullable = false, length = 40)
    private List<String> aesthetics = new ArrayList<>();

    @Column(nullable = false, length = 20)
    private String ownership;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    public ClothingItemEntity(
        UUID id,
        UUID userId,
        String imageUrl,
        String colorHex,
        String colorName,
        String categoryL1,
        String categoryL2,
        double formality,
        List<String> aesthetics,
        String ownership,
        OffsetDateTime createdAt
    ) {
        this.id = id;
        this.userId = userId;
        this.imageUrl = imageUrl;
        this.colorHex = colorHex;
        this.colorName = colorName;
        this.categoryL1 = categoryL1;
        this.categoryL2 = categoryL2;
        this.formality = formality;
        this.aesthetics = new ArrayList<>(aesthetics);
        this.ownership = ownership;
        this.createdAt = createdAt;
    }

    public boolean isOwned() {
        return "owned".equalsIgnoreCase(ownership);
    }
}
