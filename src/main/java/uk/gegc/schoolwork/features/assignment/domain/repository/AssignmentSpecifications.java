package uk.gegc.schoolwork.features.assignment.domain.repository;

import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import org.springframework.data.jpa.domain.Specification;
import uk.gegc.schoolwork.features.assignment.api.dto.AssignmentSearchCriteria;
import uk.gegc.schoolwork.features.assignment.domain.model.Assignment;
import uk.gegc.schoolwork.features.classroom.domain.model.SchoolClass;
import uk.gegc.schoolwork.features.user.domain.model.User;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

public final class AssignmentSpecifications {

    private AssignmentSpecifications() {
    }

    public static Specification<Assignment> build(AssignmentSearchCriteria criteria) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (criteria == null) {
                return cb.and(predicates.toArray(new Predicate[0]));
            }

            if (criteria.type() != null) {
                predicates.add(cb.equal(root.get("type"), criteria.type()));
            }

            if (criteria.isActive() != null) {
                predicates.add(cb.equal(root.get("active"), criteria.isActive()));
            }

            if (criteria.teacherId() != null) {
                predicates.add(cb.equal(root.get("teacher").get("id"), criteria.teacherId()));
            }

            // Subqueries keep the page free of join duplicates
            if (criteria.classId() != null) {
                Subquery<UUID> sub = query.subquery(UUID.class);
                Root<Assignment> a = sub.from(Assignment.class);
                Join<Assignment, SchoolClass> classes = a.join("classes");
                sub.select(a.get("id")).where(cb.equal(classes.get("id"), criteria.classId()));
                predicates.add(root.get("id").in(sub));
            }

            if (criteria.studentId() != null) {
                Subquery<UUID> sub = query.subquery(UUID.class);
                Root<Assignment> a = sub.from(Assignment.class);
                Join<Assignment, User> students = a.join("students");
                sub.select(a.get("id")).where(cb.equal(students.get("id"), criteria.studentId()));
                predicates.add(root.get("id").in(sub));
            }

            if (criteria.search() != null && !criteria.search().isBlank()) {
                String like = "%" + criteria.search().toLowerCase(Locale.ROOT) + "%";
                predicates.add(cb.like(cb.lower(root.get("topic")), like));
            }

            if (criteria.languageId() != null) {
                predicates.add(cb.equal(root.get("language").get("id"), criteria.languageId()));
            }

            if (criteria.isScheduled() != null) {
                if (criteria.isScheduled()) {
                    predicates.add(cb.isNotNull(root.get("scheduledPublishAt")));
                    predicates.add(cb.isFalse(root.get("active")));
                } else {
                    predicates.add(cb.or(cb.isNull(root.get("scheduledPublishAt")), cb.isTrue(root.get("active"))));
                }
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    public static Specification<Assignment> ownedBy(UUID teacherId) {
        return (root, query, cb) -> cb.equal(root.get("teacher").get("id"), teacherId);
    }

    /**
     * Assignments that reach the student through a class membership or an individual link.
     */
    public static Specification<Assignment> inScopeOf(UUID studentId) {
        return (root, query, cb) -> {
            Subquery<UUID> viaClass = query.subquery(UUID.class);
            Root<Assignment> a1 = viaClass.from(Assignment.class);
            Join<SchoolClass, User> members = a1.join("classes").join("members");
            viaClass.select(a1.get("id")).where(cb.equal(members.get("id"), studentId));

            Subquery<UUID> viaLink = query.subquery(UUID.class);
            Root<Assignment> a2 = viaLink.from(Assignment.class);
            Join<Assignment, User> students = a2.join("students");
            viaLink.select(a2.get("id")).where(cb.equal(students.get("id"), studentId));

            return cb.or(root.get("id").in(viaClass), root.get("id").in(viaLink));
        };
    }

    public static Specification<Assignment> active() {
        return (root, query, cb) -> cb.isTrue(root.get("active"));
    }

    /**
     * Inactive assignments still waiting for their scheduled publish time.
     */
    public static Specification<Assignment> awaitingPublish() {
        return (root, query, cb) -> cb.and(
                cb.isFalse(root.get("active")),
                cb.isNotNull(root.get("scheduledPublishAt"))
        );
    }

    public static Specification<Assignment> visibleToStudent(UUID studentId) {
        return active().and(inScopeOf(studentId));
    }
}
