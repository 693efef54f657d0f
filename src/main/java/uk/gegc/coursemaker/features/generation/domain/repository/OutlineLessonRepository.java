package uk.gegc.coursemaker.features.generation.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.coursemaker.features.generation.domain.model.OutlineLesson;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OutlineLessonRepository extends JpaRepository<OutlineLesson, UUID> {

    List<OutlineLesson> findByTenantIdAndCourseIdOrderByPositionAsc(UUID tenantId, UUID courseId);

    Optional<OutlineLesson> findByIdAndTenantIdAndCourseId(UUID id, UUID tenantId, UUID courseId);

    @Modifying
    @Query("DELETE FROM OutlineLesson l WHERE l.tenantId = :tenantId AND l.courseId = :courseId")
    int deleteByCourse(@Param("tenantId") UUID tenantId, @Param("courseId") UUID courseId);
}
