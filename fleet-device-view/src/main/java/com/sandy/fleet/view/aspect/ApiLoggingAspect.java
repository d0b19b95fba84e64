package com.sandy.fleet.view.aspect;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * Logs every API call with its arguments, result and duration. Results of calls still in flight on the
 * RPC transport are logged once they settle.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class ApiLoggingAspect {

    private static final int MAX_LOGGED_CHARS = 2000;

    private final ObjectMapper objectMapper;

    @Around("within(com.sandy.fleet.view.controller..*) && execution(public * *(..))")
    public Object logApiCall(ProceedingJoinPoint pjp) throws Throwable {
        long start = System.currentTimeMillis();
        ServletRequestAttributes attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        HttpServletRequest request = attrs != null ? attrs.getRequest() : null;
        String method = request != null ? request.getMethod() : "";
        String uri = request != null ? request.getRequestURI() : "";
        String query = request != null ? request.getQueryString() : null;

        MethodSignature sig = (MethodSignature) pjp.getSignature();
        String handler = sig.toShortString();
        Object[] args = pjp.getArgs();
        String[] paramNames = sig.getParameterNames();

        Map<String, Object> argMap = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            Object a = args[i];
            if (a instanceof HttpServletRequest || a instanceof HttpServletResponse) continue;
            String name = paramNames != null && i < paramNames.length ? paramNames[i] : ("arg" + i);
            argMap.put(name, a);
        }

        log.info("API Request: method={} uri={} query={} handler={} args={}", method, uri, query, handler, toJson(argMap));

        Object result;
        try {
            result = pjp.proceed();
        } catch (Throwable t) {
            log.error("API Error: method={} uri={} handler={} durationMs={} errorType={} message={}",
                    method, uri, handler, System.currentTimeMillis() - start, t.getClass().getSimpleName(), t.getMessage());
            throw t;
        }
        if (result instanceof CompletionStage<?> stage) {
            stage.whenComplete((value, error) -> {
                long cost = System.currentTimeMillis() - start;
                if (error != null) {
                    log.error("API Error: method={} uri={} handler={} durationMs={} errorType={} message={}",
                            method, uri, handler, cost, error.getClass().getSimpleName(), error.getMessage());
                } else {
                    log.info("API Response: method={} uri={} handler={} durationMs={} result={}", method, uri, handler, cost, toJson(value));
                }
            });
        } else if (result instanceof ResponseEntity<?> re) {
            log.info("API Response: method={} uri={} handler={} status={} durationMs={} body={}",
                    method, uri, handler, re.getStatusCode(), System.currentTimeMillis() - start, toJson(re.getBody()));
        } else {
            log.info("API Response: method={} uri={} handler={} durationMs={} result={}",
                    method, uri, handler, System.currentTimeMillis() - start, toJson(result));
        }
        return result;
    }

    private String toJson(Object obj) {
        if (obj == null) return "null";
        try {
            String s = objectMapper.writeValueAsString(obj);
            if (s.length() > MAX_LOGGED_CHARS) {
                return s.substring(0, MAX_LOGGED_CHARS) + "...(" + (s.length() - MAX_LOGGED_CHARS) + " more chars)";
            }
            return s;
        } catch (Exception e) {
            return String.valueOf(obj);
        }
    }
}
