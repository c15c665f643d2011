package dev.univer.fintrack.repo;

import dev.univer.fintrack.model.Category;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

public interface CategoryRepository extends JpaRepository<Category, Long> {
    List<Category> findAllByOwnerScopeOrderByIdAsc(Long ownerScope);
    List<Category> findAllByOrderByIdAsc();
    @Transactional
    long deleteAllByOwnerScopeAndName(Long ownerScope, String name);
}
