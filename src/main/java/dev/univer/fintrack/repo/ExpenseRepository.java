package dev.univer.fintrack.repo;

import dev.univer.fintrack.model.Expense;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

public interface ExpenseRepository extends JpaRepository<Expense, Long> {
    List<Expense> findAllByOrderByIdDesc();
    List<Expense> findAllByOccurredOnLikeOrderByIdDesc(String pattern);
    @Transactional
    long deleteAllByContributorId(Long contributorId);
}
