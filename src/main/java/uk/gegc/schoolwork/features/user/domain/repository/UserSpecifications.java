package uk.gegc.schoolwork.features.user.domain.repository;

import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import org.springframework.data.jpa.domain.Specification;
import uk.gegc.schoolwork.features.classroom.domain.model.SchoolClass;
import uk.gegc.schoolwork.features.user.domain.model.User;
import uk.gegc.schoolwork.features.user.domain.model.UserRole;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

public final class UserSpecifications {

    private UserSpecifications() {
    }

    /**
     * Optional role, username/e-mail search and class membership filters; nulls are ignored.
     */
    public static Specification<User> filter(UserRole role, String search, UUID classId) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (role != null) {
                predicates.add(cb.equal(root.get("role"), role));
            }

            if (search != null && !search.isBlank()) {
                String like = "%" + search.trim().toLowerCase(Locale.ROOT) + "%";
                predicates.add(cb.or(
                        cb.like(cb.lower(root.get("username")), like),
                        cb.like(cb.lower(root.get("email")), like)));
            }

            if (classId != null) {
                Subquery<UUID> sub = query.subquery(UUID.class);
                Root<SchoolClass> c = sub.from(SchoolClass.class);
                Join<SchoolClass, User> members = c.join("members");
                sub.select(members.get("id")).where(cb.equal(c.get("id"), classId));
                predicates.add(root.get("id").in(sub));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
