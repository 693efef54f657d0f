package uk.gegc.coursemaker.features.job.domain.repository;

import org.springframework.data.jpa.domain.Specification;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJob;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobStatus;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobType;

import java.util.UUID;

public final class GenerationJobSpecifications {

    private GenerationJobSpecifications() {
    }

    public static Specification<GenerationJob> build(UUID tenantId, GenerationJobType type,
                                                     GenerationJobStatus status, UUID courseId) {
        Specification<GenerationJob> spec = belongsToTenant(tenantId);
        if (type != null) {
            spec = spec.and(hasType(type));
        }
        if (status != null) {
            spec = spec.and(hasStatus(status));
        }
        if (courseId != null) {
            spec = spec.and(forCourse(courseId));
        }
        return spec;
    }

    public static Specification<GenerationJob> belongsToTenant(UUID tenantId) {
        return (root, query, cb) -> cb.equal(root.get("tenantId"), tenantId);
    }

    public static Specification<GenerationJob> hasType(GenerationJobType type) {
        return (root, query, cb) -> cb.equal(root.get("type"), type);
    }

    public static Specification<GenerationJob> hasStatus(GenerationJobStatus status) {
        return (root, query, cb) -> cb.equal(root.get("status"), status);
    }

    public static Specification<GenerationJob> forCourse(UUID courseId) {
        return (root, query, cb) -> cb.equal(root.get("courseId"), courseId);
    }
}
