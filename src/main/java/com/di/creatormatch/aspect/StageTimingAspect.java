package com.di.creatormatch.aspect;

import com.di.creatormatch.util.SearchMetrics;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * AOP aspect for methods annotated with {@link LogStage}: logs stage start, completion and failure
 * with duration, and records the stage timer.
 */
@Slf4j
@Aspect
@Component
public class StageTimingAspect {

    private final SearchMetrics metrics;

    public StageTimingAspect(SearchMetrics metrics) {
        this.metrics = metrics;
    }

    @Around("@annotation(com.di.creatormatch.aspect.LogStage)")
    public Object timeStage(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        LogStage annotation = signature.getMethod().getAnnotation(LogStage.class);
        String stage = annotation.value();
        String searchId = MDC.get("searchId");
        long start = System.nanoTime();

        log.debug("[STAGE] {}_STARTED searchId={} method={}", stage, searchId, signature.getName());
        try {
            Object result = joinPoint.proceed();
            long durationNanos = System.nanoTime() - start;
            metrics.recordStage(stage, durationNanos, true);
            log.info("[STAGE] {}_COMPLETED searchId={} durationMs={}", stage, searchId, durationNanos / 1_000_000);
            return result;
        } catch (Throwable e) {
            long durationNanos = System.nanoTime() - start;
            metrics.recordStage(stage, durationNanos, false);
            ErrorCategory category = ErrorCategory.categorize(e);
            log.warn("[STAGE] {}_FAILED searchId={} durationMs={} category={} error={}", stage, searchId,
                    durationNanos / 1_000_000, category.name(),
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            throw e;
        }
    }
}
