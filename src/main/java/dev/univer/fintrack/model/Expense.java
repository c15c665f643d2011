package dev.univer.fintrack.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(indexes = {
        @Index(name = "idx_expense_contributor", columnList = "contributorId"),
        @Index(name = "idx_expense_occurred_on", columnList = "occurredOn")
})
public class Expense {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long contributorId;

    @Column(precision = 19, scale = 2, nullable = false)
    private BigDecimal amount;

    @Column(nullable = false)
    private String category;

    // MM/dd/yyyy, kept as text so /month can match on it directly
    @Column(length = 10, nullable = false)
    private String occurredOn;

    private String displayName;
}
