package com.agrilink.community.repository;

import com.agrilink.community.domain.model.User;
import com.agrilink.community.domain.model.User.Role;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for User entity.
 *
 * @author AgriLink Team
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    /**
     * Find a user by e-mail, case-insensitively.
     *
     * @param email E-mail address
     * @return Optional containing the user if found
     */
    Optional<User> findByEmailIgnoreCase(String email);

    boolean existsByEmailIgnoreCase(String email);

    /**
     * Find all users with the given role ordered by name (expert directory).
     *
     * @param role User role
     * @return Users with the role
     */
    List<User> findByRoleOrderByNameAsc(Role role);

    long countByRole(Role role);

    /**
     * Current role of a user, read on every authenticated request so role changes apply at once.
     *
     * @param id User ID
     * @return The role, or empty if the user no longer exists
     */
    @Query("SELECT u.role FROM User u WHERE u.id = :id")
    Optional<Role> findRoleById(@Param("id") Long id);
}
