package uk.gegc.schoolwork.features.user.domain.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "users")
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @NotBlank
    @Size(min = 3, max = 50, message = "Username must be 3-50 characters")
    @Column(name = "username", unique = true, nullable = false, length = 50)
    private String username;

    @Email
    @Column(name = "email")
    private String email;

    @Column(name = "password", nullable = false)
    private String hashedPassword;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    private UserRole role;

    @Column(name = "confirmed", nullable = false)
    private boolean confirmed;

    @Column(name = "blocked", nullable = false)
    private boolean blocked;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public boolean hasRole(UserRole candidate) {
        return role == candidate;
    }

    public boolean isStudent() {
        return role == UserRole.STUDENT;
    }

    /**
     * Teachers and admins manage assignments and classes.
     */
    public boolean isStaff() {
        return role == UserRole.TEACHER || role == UserRole.ADMIN;
    }
}
