package com.example.demo.docexport.aspect;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

@Slf4j
@Aspect
@Component
public class ExecutionTimeAspect {

    @Around("@annotation(logExecutionTime)")
    public Object logExecutionTime(ProceedingJoinPoint joinPoint, LogExecutionTime logExecutionTime) throws Throwable {
        String operation = logExecutionTime.value().isEmpty()
                ? joinPoint.getSignature().toShortString()
                : logExecutionTime.value();
        long startTime = System.currentTimeMillis();
        try {
            Object result = joinPoint.proceed();
            log.info("{} completed in {}ms", operation, System.currentTimeMillis() - startTime);
            return result;
        } catch (Throwable t) {
            log.error("{} failed after {}ms: {}", operation, System.currentTimeMillis() - startTime, t.getMessage());
            throw t;
        }
    }
}
