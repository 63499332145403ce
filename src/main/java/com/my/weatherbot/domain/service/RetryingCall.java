package com.my.weatherbot.domain.service;

import com.my.weatherbot.domain.model.CallResult;
import io.smallrye.faulttolerance.api.FaultTolerance;
import org.eclipse.microprofile.faulttolerance.exceptions.FaultToleranceException;

import java.time.temporal.ChronoUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * 왜: {@link RetryPolicy}를 SmallRye Fault Tolerance 재시도 가드로 옮겨, 포트가 돌려준 {@link CallResult} 중 일시 실패만 재시도하기 위함.
 *
 * <p>가드는 한 번 만들어 여러 스레드가 함께 쓴다. 인터럽트되면 재시도를 멈추고 마지막 결과를 돌려준다.</p>
 */
public final class RetryingCall<T> {

    private final FaultTolerance<CallResult<T>> guard;

    public RetryingCall(RetryPolicy policy) {
        var retry = FaultTolerance.<CallResult<T>>create()
                .withRetry()
                .maxRetries(policy.maxRetries())
                .delay(policy.initialDelay().toMillis(), ChronoUnit.MILLIS)
                .jitter(0, ChronoUnit.MILLIS)
                .retryOn(TransientResultException.class);
        if (policy.backsOff()) {
            retry = retry.withExponentialBackoff()
                    .factor(policy.multiplier())
                    .maxDelay(policy.maxDelay().toMillis(), ChronoUnit.MILLIS)
                    .done();
        }
        this.guard = retry.done().build();
    }

    public RetryResult<T> execute(Supplier<CallResult<T>> call) {
        AtomicInteger attempts = new AtomicInteger();
        AtomicReference<CallResult<T>> last = new AtomicReference<>();
        try {
            CallResult<T> result = guard.call(() -> {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("재시도 전에 인터럽트되었습니다.");
                }
                CallResult<T> current = invoke(call);
                attempts.incrementAndGet();
                last.set(current);
                if (current.isTransient()) {
                    throw new TransientResultException(current.reason());
                }
                return current;
            });
            return new RetryResult<>(result, attempts.get(), false);
        } catch (TransientResultException e) {
            if (Thread.currentThread().isInterrupted()) {
                return interrupted(last.get(), attempts.get());
            }
            return new RetryResult<>(last.get(), attempts.get(), false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return interrupted(last.get(), attempts.get());
        } catch (FaultToleranceException e) {
            return new RetryResult<>(orFailure(last.get(), e.getMessage()), attempts.get(), false);
        } catch (Exception e) {
            if (Thread.currentThread().isInterrupted()) {
                return interrupted(last.get(), attempts.get());
            }
            return new RetryResult<>(orFailure(last.get(), e.getClass().getSimpleName() + ": " + e.getMessage()),
                    attempts.get(), false);
        }
    }

    private static <T> CallResult<T> invoke(Supplier<CallResult<T>> call) {
        try {
            CallResult<T> result = call.get();
            return result != null ? result : CallResult.transientFailure("호출 결과가 null입니다.");
        } catch (RuntimeException e) {
            return CallResult.transientFailure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private static <T> CallResult<T> orFailure(CallResult<T> last, String reason) {
        return last != null ? last : CallResult.transientFailure(reason);
    }

    private static <T> RetryResult<T> interrupted(CallResult<T> last, int attempts) {
        return new RetryResult<>(orFailure(last, "마감 시각 초과로 중단되었습니다."), attempts, true);
    }

    /**
     * 가드가 재시도 대상으로 인식하도록 일시 실패 결과를 예외로 바꾼다.
     */
    static final class TransientResultException extends RuntimeException {
        TransientResultException(String reason) {
            super(reason, null, false, false);
        }
    }
}
