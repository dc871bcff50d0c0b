package com.sandy.aiot.vision.sentinel.aspect;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Logs every REST call into the monitor API: request line, bound arguments, status and duration.
 * Bodies are serialised with the application's ObjectMapper and cut at {@code monitor.api-log.max-body-chars}.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class ApiLoggingAspect {

    private final ObjectMapper objectMapper;

    @Value("${monitor.api-log.max-body-chars:2000}")
    private int maxBodyChars;

    @Around("within(com.sandy.aiot.vision.sentinel.controller..*)")
    public Object logApiCall(ProceedingJoinPoint pjp) throws Throwable {
        long start = System.currentTimeMillis();
        ServletRequestAttributes attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        HttpServletRequest request = attrs != null ? attrs.getRequest() : null;
        String call = request == null ? "-" : request.getMethod() + " " + request.getRequestURI()
                + (request.getQueryString() == null ? "" : "?" + request.getQueryString());
        MethodSignature sig = (MethodSignature) pjp.getSignature();
        String handler = sig.toShortString();

        log.info("API Request: {} handler={} args={}", call, handler, abbreviate(toJson(boundArgs(sig, pjp.getArgs()))));
        try {
            Object result = pjp.proceed();
            long cost = System.currentTimeMillis() - start;
            if (result instanceof ResponseEntity<?> re) {
                log.info("API Response: {} status={} durationMs={} body={}", call, re.getStatusCode().value(), cost, abbreviate(toJson(re.getBody())));
            } else {
                log.info("API Response: {} durationMs={} result={}", call, cost, abbreviate(toJson(result)));
            }
            return result;
        } catch (Throwable t) {
            log.error("API Error: {} handler={} durationMs={} errorType={} message={}", call, handler,
                    System.currentTimeMillis() - start, t.getClass().getSimpleName(), t.getMessage());
            throw t;
        }
    }

    private Map<String, Object> boundArgs(MethodSignature sig, Object[] args) {
        String[] names = sig.getParameterNames();
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            if (args[i] instanceof HttpServletRequest || args[i] instanceof HttpServletResponse) continue;
            map.put(names != null && i < names.length ? names[i] : "arg" + i, args[i]);
        }
        return map;
    }

    private String toJson(Object obj) {
        if (obj == null) return "null";
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            return String.valueOf(obj);
        }
    }

    private String abbreviate(String s) {
        if (s.length() <= maxBodyChars) return s;
        return s.substring(0, maxBodyChars) + "...(" + (s.length() - maxBodyChars) + " more chars)";
    }
}
