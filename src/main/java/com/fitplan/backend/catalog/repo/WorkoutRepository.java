package com.fitplan.backend.catalog.repo;

import com.fitplan.backend.catalog.entity.WorkoutEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface WorkoutRepository extends JpaRepository<WorkoutEntity, Long> {

    List<WorkoutEntity> findAllByOrderByIdAsc();
}
