package com.geoindex.aspect;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

/**
 * Logs the execution time of methods annotated with {@link Timed}
 */
@Aspect
@Component
@Slf4j
public class TimingAspect {

    @Around("@annotation(timed)")
    public Object measureExecutionTime(ProceedingJoinPoint joinPoint, Timed timed) throws Throwable {
        long startTime = System.nanoTime();
        String operation = describe(joinPoint, timed);

        try {
            Object result = joinPoint.proceed();
            long micros = (System.nanoTime() - startTime) / 1_000L;

            switch (timed.logLevel()) {
                case INFO:
                    log.info("{} executed in {}us", operation, micros);
                    break;
                default:
                    log.debug("{} executed in {}us", operation, micros);
            }
            return result;
        } catch (Exception e) {
            long micros = (System.nanoTime() - startTime) / 1_000L;
            log.warn("{} failed after {}us: {}", operation, micros, e.getMessage());
            throw e;
        }
    }

    private static String describe(ProceedingJoinPoint joinPoint, Timed timed) {
        String method = joinPoint.getSignature().getDeclaringType().getSimpleName()
                + "#" + joinPoint.getSignature().getName();
        return timed.value().isEmpty() ? method : method + " (" + timed.value() + ")";
    }
}
