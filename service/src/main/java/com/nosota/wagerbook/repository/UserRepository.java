package com.nosota.wagerbook.repository;

import com.nosota.wagerbook.model.User;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {
    /**
     * Retrieves the {@link User} with the given ID and locks the row for update.
     * <p>
     * Every balance change goes through this lock, so two transactions touching the same user's
     * balance are serialized. Keep the surrounding transaction short.
     * </p>
     *
     * @param id user ID
     * @return the locked user, or empty if no such user exists
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM User u WHERE u.id = :id")
    Optional<User> findByIdForUpdate(@Param("id") Long id);

    List<User> findAllByOrderByCreatedAtDescIdDesc();
}
