package com.fitplan.backend.performance.repo;

import com.fitplan.backend.performance.entity.PerformanceEntryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface PerformanceEntryRepository extends JpaRepository<PerformanceEntryEntity, Long> {

    List<PerformanceEntryEntity> findByExerciseIdOrderBySessionDateAscIdAsc(Long exerciseId);

    List<PerformanceEntryEntity> findByWorkoutIdOrderBySessionDateAscIdAsc(Long workoutId);

    /** 有紀錄的動作 id（畫圖用） */
    @Query("select distinct p.exerciseId from PerformanceEntryEntity p order by p.exerciseId")
    List<Long> findDistinctExerciseIds();

    /** 兩個條件都可選（null = 不過濾） */
    @Query("""
        select p from PerformanceEntryEntity p
        where (:workoutId is null or p.workoutId = :workoutId)
          and (:exerciseId is null or p.exerciseId = :exerciseId)
        order by p.sessionDate asc, p.id asc
        """)
    List<PerformanceEntryEntity> search(@Param("workoutId") Long workoutId, @Param("exerciseId") Long exerciseId);
}
