package com.di.creatormatch.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a pipeline stage method for automatic stage logging and timing.
 * <p>{@link StageTimingAspect} logs {@code <STAGE>_STARTED}, {@code _COMPLETED} (with duration) or
 * {@code _FAILED} (with {@link ErrorCategory}) and records a {@code creatormatch.stage.duration} timer
 * tagged with the stage name. MDC (e.g. {@code searchId}) is read, never modified.
 *
 * <pre>
 * {@code
 * @LogStage("VERIFY")
 * public VerificationResult verify(List<CreatorRecord> selected, int verifyCap, Instant deadline) { ... }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface LogStage {

    /** Stage name, e.g. "DISCOVERY", "PREFILTER", "VERIFY", "FILTER", "RANK". */
    String value();
}
