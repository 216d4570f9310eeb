package uk.gegc.schoolwork.features.activity.domain.repository;

import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;
import uk.gegc.schoolwork.features.activity.api.dto.ActivityLogFilter;
import uk.gegc.schoolwork.features.activity.domain.model.ActivityLog;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class ActivityLogSpecifications {

    private ActivityLogSpecifications() {
    }

    /**
     * Every non-null field of the filter narrows the result; the time window is inclusive of
     * {@code from} and exclusive of {@code to}.
     */
    public static Specification<ActivityLog> matching(ActivityLogFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (filter.actorId() != null) {
                predicates.add(cb.equal(root.get("actorId"), filter.actorId()));
            }
            if (filter.type() != null) {
                predicates.add(cb.equal(root.get("type"), filter.type()));
            }
            if (filter.assignmentId() != null) {
                predicates.add(cb.equal(root.get("assignmentId"), filter.assignmentId()));
            }
            if (filter.classId() != null) {
                predicates.add(cb.equal(root.get("classId"), filter.classId()));
            }
            if (filter.from() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<Instant>get("createdAt"), filter.from()));
            }
            if (filter.to() != null) {
                predicates.add(cb.lessThan(root.<Instant>get("createdAt"), filter.to()));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
