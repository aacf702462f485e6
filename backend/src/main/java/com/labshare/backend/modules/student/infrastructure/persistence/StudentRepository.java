package com.labshare.backend.modules.student.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.labshare.backend.modules.student.domain.Student;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface StudentRepository extends JpaRepository<Student, UUID> {

    @Query("select s from Student s where lower(s.email) = lower(:email)")
    Optional<Student> findByEmailIgnoreCase(@Param("email") String email);

    /**
     * Serializes writers that act on one student's credentials for the rest of the transaction.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from Student s where s.id = :id")
    Optional<Student> lockById(@Param("id") UUID id);
}
