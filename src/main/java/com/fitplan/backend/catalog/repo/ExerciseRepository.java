package com.fitplan.backend.catalog.repo;

import com.fitplan.backend.catalog.entity.ExerciseEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface ExerciseRepository extends JpaRepository<ExerciseEntity, Long> {

    List<ExerciseEntity> findAllByIdInOrderByIdAsc(Collection<Long> ids);

    List<ExerciseEntity> findAllByOrderByIdAsc();
}
