package dev.univer.fintrack.model;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(indexes = {
        @Index(name = "idx_category_scope_name", columnList = "ownerScope, name")
})
public class Category {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // 0 = shared by every contributor, otherwise the owning contributor id
    @Column(nullable = false)
    private Long ownerScope;

    @Column(nullable = false)
    private String name;
}
