package com.facilityops.backend.modules.account.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.facilityops.backend.modules.account.domain.Account;
import com.facilityops.backend.modules.account.domain.AccountRole;
import com.facilityops.backend.modules.account.domain.AccountStatus;

import jakarta.persistence.LockModeType;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AccountRepository extends JpaRepository<Account, UUID> {

    Optional<Account> findByIdAndDeletedFalse(UUID id);

    Optional<Account> findByIdAndDeletedTrue(UUID id);

    @Query("select a from Account a where lower(a.email) = lower(:email) and a.deleted = false")
    Optional<Account> findActiveByEmail(@Param("email") String email);

    @Query("select a from Account a where a.username = :username and a.deleted = false")
    Optional<Account> findActiveByUsername(@Param("username") String username);

    /**
     * 세션 목록과 실패 카운터를 고치는 흐름용. 같은 계정의 동시 로그인/갱신을 직렬화한다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from Account a where a.id = :id and a.deleted = false")
    Optional<Account> findActiveByIdForUpdate(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from Account a where lower(a.email) = lower(:email) and a.deleted = false")
    Optional<Account> findActiveByEmailForUpdate(@Param("email") String email);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from Account a where a.username = :username and a.deleted = false")
    Optional<Account> findActiveByUsernameForUpdate(@Param("username") String username);

    @Query("""
            select case when count(a) > 0 then true else false end
              from Account a
             where lower(a.email) = lower(:email)
               and a.deleted = false
               and (:excludeId is null or a.id <> :excludeId)
            """)
    boolean existsActiveEmail(@Param("email") String email, @Param("excludeId") UUID excludeId);

    @Query("""
            select case when count(a) > 0 then true else false end
              from Account a
             where a.username = :username
               and a.deleted = false
               and (:excludeId is null or a.id <> :excludeId)
            """)
    boolean existsActiveUsername(@Param("username") String username, @Param("excludeId") UUID excludeId);

    @Query("""
            select a
              from Account a
             where a.deleted = false
               and (:role is null or a.role = :role)
               and (:status is null or a.status = :status)
               and (
                    :searchPattern is null
                 or lower(a.firstName) like :searchPattern
                 or lower(a.lastName) like :searchPattern
                 or lower(a.email) like :searchPattern
                 or lower(a.username) like :searchPattern
               )
            """)
    Page<Account> findByFilters(
            @Param("role") AccountRole role,
            @Param("status") AccountStatus status,
            @Param("searchPattern") String searchPattern,
            Pageable pageable
    );

    @Query("""
            select a
              from Account a
             where a.role = :role
               and a.status = com.facilityops.backend.modules.account.domain.AccountStatus.ACTIVE
               and a.deleted = false
             order by a.lastName, a.firstName
            """)
    List<Account> findActiveByRole(@Param("role") AccountRole role);

    @Query("""
            select a
              from Account a
              join a.managedFacilities facility
             where facility = :facilityId
               and a.status = com.facilityops.backend.modules.account.domain.AccountStatus.ACTIVE
               and a.deleted = false
             order by a.lastName, a.firstName
            """)
    List<Account> findActiveByManagedFacility(@Param("facilityId") UUID facilityId);

    @Query("""
            select a
              from Account a
             where a.emailVerificationTokenHash = :tokenHash
               and a.emailVerificationExpiresAt > :now
               and a.deleted = false
            """)
    Optional<Account> findByPendingEmailVerification(@Param("tokenHash") String tokenHash,
                                                     @Param("now") OffsetDateTime now);

    @Query("""
            select a
              from Account a
             where a.passwordResetTokenHash = :tokenHash
               and a.passwordResetExpiresAt > :now
               and a.deleted = false
            """)
    Optional<Account> findByPendingPasswordReset(@Param("tokenHash") String tokenHash,
                                                 @Param("now") OffsetDateTime now);

    boolean existsByRoleAndDeletedFalse(AccountRole role);
}
