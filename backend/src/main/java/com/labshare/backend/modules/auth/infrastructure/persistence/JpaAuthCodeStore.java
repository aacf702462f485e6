package com.labshare.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.labshare.backend.modules.auth.application.AuthCodeStore;
import com.labshare.backend.modules.auth.domain.AuthCode;
import com.labshare.backend.modules.student.infrastructure.persistence.StudentRepository;

import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class JpaAuthCodeStore implements AuthCodeStore {

    private final AuthCodeRepository authCodeRepository;
    private final StudentRepository studentRepository;

    public JpaAuthCodeStore(AuthCodeRepository authCodeRepository, StudentRepository studentRepository) {
        this.authCodeRepository = authCodeRepository;
        this.studentRepository = studentRepository;
    }

    @Override
    @Transactional
    public void replaceActiveCode(AuthCode code) {
        // 학생 행 잠금: 동시에 두 코드가 살아남지 않도록 발급을 직렬화한다.
        studentRepository.lockById(code.getStudentId())
                .orElseThrow(() -> new DataRetrievalFailureException("student not found: " + code.getStudentId()));
        authCodeRepository.consumeActiveCodes(code.getStudentId(), code.getCreatedAt());
        authCodeRepository.saveAndFlush(code);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AuthCode> findLatest(UUID studentId, String code, OffsetDateTime issuedAfter) {
        return authCodeRepository.findFirstByStudentIdAndCodeAndCreatedAtAfterOrderByCreatedAtDesc(
                studentId, code, issuedAfter);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AuthCode> findLatestAnyAge(UUID studentId, String code) {
        return authCodeRepository.findFirstByStudentIdAndCodeOrderByCreatedAtDesc(studentId, code);
    }

    @Override
    @Transactional
    public boolean markConsumed(UUID codeId, OffsetDateTime consumedAt) {
        return authCodeRepository.consumeIfUnconsumed(codeId, consumedAt) == 1;
    }

    @Override
    @Transactional
    public void delete(UUID codeId) {
        authCodeRepository.deleteById(codeId);
    }

    @Override
    @Transactional(readOnly = true)
    public long countIssuedSince(UUID studentId, OffsetDateTime since) {
        return authCodeRepository.countByStudentIdAndCreatedAtGreaterThanEqual(studentId, since);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<OffsetDateTime> findEarliestIssuedSince(UUID studentId, OffsetDateTime since) {
        return Optional.ofNullable(authCodeRepository.findEarliestCreatedAtSince(studentId, since));
    }

    @Override
    @Transactional
    public int deleteExpiredBefore(OffsetDateTime cutoff) {
        return authCodeRepository.deleteExpiredBefore(cutoff);
    }
}
