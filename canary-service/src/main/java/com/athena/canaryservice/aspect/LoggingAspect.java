package com.athena.canaryservice.aspect;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Pointcut;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.concurrent.CompletableFuture;

@Aspect
@Component
@Slf4j
public class LoggingAspect {

    @Pointcut("within(@org.springframework.web.bind.annotation.RestController *)")
    public void controllerMethods() {}

    @Around("controllerMethods()")
    public Object logAround(ProceedingJoinPoint joinPoint) throws Throwable {
        long start = System.currentTimeMillis();

        ServletRequestAttributes attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        HttpServletRequest request = attrs != null ? attrs.getRequest() : null;

        String method = joinPoint.getSignature().getName();
        String className = joinPoint.getTarget().getClass().getSimpleName();
        String uri = request != null ? request.getRequestURI() : "UNKNOWN";
        String httpMethod = request != null ? request.getMethod() : "UNKNOWN";

        log.info(">> {} {} | {}.{}", httpMethod, uri, className, method);

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - start;
            String status;
            if (result instanceof ResponseEntity) {
                status = ((ResponseEntity<?>) result).getStatusCode().toString();
            } else if (result instanceof CompletableFuture) {
                status = "ASYNC";
            } else {
                status = "OK";
            }
            log.info("<< {} {} {} {}ms", httpMethod, uri, status, duration);
            return result;
        } catch (Throwable e) {
            long duration = System.currentTimeMillis() - start;
            log.error("!! {} {} {}ms | {}", uri, method, duration, e.getMessage());
            throw e;
        }
    }
}
