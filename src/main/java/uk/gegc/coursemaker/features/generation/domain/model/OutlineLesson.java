package uk.gegc.coursemaker.features.generation.domain.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * One lesson slot of a course outline. Its id is the {@code lessonId} that lesson generation
 * jobs refer to.
 */
@Entity
@Table(name = "outline_lessons", indexes = {
        @Index(name = "idx_outline_lessons_course", columnList = "tenant_id, course_id, position")
})
@Data
@NoArgsConstructor
public class OutlineLesson {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "course_id", nullable = false)
    private UUID courseId;

    @Column(name = "section_title", nullable = false)
    private String sectionTitle;

    @Column(name = "position", nullable = false)
    private int position;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "summary", columnDefinition = "TEXT")
    private String summary;
}
