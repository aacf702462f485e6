package com.labshare.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.labshare.backend.modules.auth.application.OtpService.IssuedCode;
import com.labshare.backend.modules.auth.domain.AuthCode;
import com.labshare.backend.support.InMemoryAuthCodeStore;
import com.labshare.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OtpServiceTest {

    private static final UUID STUDENT_ID = UUID.fromString("00000000-0000-0000-0000-0000000000aa");

    private InMemoryAuthCodeStore store;
    private MutableClock clock;
    private OtpService otpService;

    @BeforeEach
    void setUp() {
        store = new InMemoryAuthCodeStore();
        clock = MutableClock.at("2025-03-01T09:00:00Z");
        otpService = new OtpService(store, clock, Duration.ofMinutes(10), Duration.ofMinutes(15));
    }

    @Test
    void issuedCodeIsSixDigitsAndExpiresAfterTenMinutes() {
        IssuedCode issued = issue();

        assertThat(issued.code()).matches("\\d{6}");
        assertThat(issued.expiresAt().toInstant()).isEqualTo(clock.instant().plus(Duration.ofMinutes(10)));
        assertThat(store.all()).singleElement().satisfies(code -> assertThat(code.isConsumed()).isFalse());
    }

    @Test
    void issuedCodeToStringDoesNotRevealValue() {
        IssuedCode issued = issue();

        assertThat(issued.toString()).doesNotContain(issued.code());
    }

    @Test
    @DisplayName("새 코드를 발급하면 이전 코드는 더 이상 검증되지 않는다")
    void issuingNewCodeInvalidatesPreviousOne() {
        IssuedCode first = issue();
        clock.advance(Duration.ofSeconds(30));
        IssuedCode second = issue();
        while (second.code().equals(first.code())) {
            clock.advance(Duration.ofSeconds(1));
            second = issue();
        }

        assertThat(store.all()).filteredOn(code -> !code.isConsumed()).hasSize(1);
        assertThat(otpService.verify(first.code(), STUDENT_ID)).isEqualTo(AuthOutcome.invalid(InvalidReason.CONSUMED));
        assertThat(otpService.verify(second.code(), STUDENT_ID)).isEqualTo(AuthOutcome.ok(STUDENT_ID));
    }

    @Test
    void validCodeVerifiesExactlyOnce() {
        IssuedCode issued = issue();

        clock.advance(Duration.ofMinutes(9));
        assertThat(otpService.verify(issued.code(), STUDENT_ID)).isEqualTo(AuthOutcome.ok(STUDENT_ID));

        clock.advance(Duration.ofSeconds(30));
        assertThat(otpService.verify(issued.code(), STUDENT_ID)).isEqualTo(AuthOutcome.invalid(InvalidReason.CONSUMED));
    }

    @Test
    void expiredCodeFailsAndIsDeleted() {
        IssuedCode issued = issue();
        UUID codeId = store.all().get(0).getId();

        clock.advance(Duration.ofMinutes(11));

        assertThat(otpService.verify(issued.code(), STUDENT_ID)).isEqualTo(AuthOutcome.invalid(InvalidReason.EXPIRED));
        assertThat(store.find(codeId)).isEmpty();
    }

    @Test
    void codeOlderThanLookupWindowIsTreatedAsNotFound() {
        IssuedCode issued = issue();

        clock.advance(Duration.ofMinutes(16));

        assertThat(otpService.verify(issued.code(), STUDENT_ID)).isEqualTo(AuthOutcome.invalid(InvalidReason.NOT_FOUND));
        assertThat(store.all()).hasSize(1);
    }

    @Test
    void wrongCodeOrOtherStudentIsNotFound() {
        IssuedCode issued = issue();
        String wrong = issued.code().equals("123456") ? "654321" : "123456";

        assertThat(otpService.verify(wrong, STUDENT_ID)).isEqualTo(AuthOutcome.invalid(InvalidReason.NOT_FOUND));
        assertThat(otpService.verify(issued.code(), UUID.randomUUID())).isEqualTo(AuthOutcome.invalid(InvalidReason.NOT_FOUND));
    }

    @Test
    void malformedCodeIsRejectedWithoutDatastoreCall() {
        AuthCodeStore untouched = mock(AuthCodeStore.class);
        OtpService service = new OtpService(untouched, clock, Duration.ofMinutes(10), Duration.ofMinutes(15));

        for (String code : new String[] {null, "", "12345", "1234567", "12a456", " 123456"}) {
            assertThat(service.verify(code, STUDENT_ID)).isEqualTo(AuthOutcome.invalid(InvalidReason.MALFORMED_INPUT));
        }
        verifyNoInteractions(untouched);
    }

    @Test
    void concurrentVerificationSucceedsExactlyOnce() throws Exception {
        IssuedCode issued = issue();
        int attempts = 8;
        ExecutorService pool = Executors.newFixedThreadPool(attempts);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<AuthOutcome<UUID>>> futures = new ArrayList<>();
            for (int i = 0; i < attempts; i++) {
                Callable<AuthOutcome<UUID>> task = () -> {
                    start.await();
                    return otpService.verify(issued.code(), STUDENT_ID);
                };
                futures.add(pool.submit(task));
            }
            start.countDown();

            int successes = 0;
            for (Future<AuthOutcome<UUID>> future : futures) {
                if (future.get(5, TimeUnit.SECONDS).isOk()) {
                    successes++;
                }
            }
            assertThat(successes).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void datastoreFailureIsReportedAsCollaboratorError() {
        IssuedCode issued = issue();
        store.failAllCalls(true);

        assertThat(otpService.verify(issued.code(), STUDENT_ID)).isInstanceOf(AuthOutcome.CollaboratorError.class);
        assertThat(otpService.issue(STUDENT_ID)).isInstanceOf(AuthOutcome.CollaboratorError.class);
    }

    @Test
    void verifyConsumesTheMatchingRow() {
        IssuedCode issued = issue();

        otpService.verify(issued.code(), STUDENT_ID);

        AuthCode stored = store.all().get(0);
        assertThat(stored.isConsumed()).isTrue();
        assertThat(stored.getConsumedAt().toInstant()).isEqualTo(clock.instant());
    }

    private IssuedCode issue() {
        AuthOutcome<IssuedCode> outcome = otpService.issue(STUDENT_ID);
        assertThat(outcome).isInstanceOf(AuthOutcome.Ok.class);
        return ((AuthOutcome.Ok<IssuedCode>) outcome).value();
    }
}
