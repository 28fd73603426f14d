package com.weiwo.bridge.config;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Pointcut;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * 日志记录切面
 * 记录运维接口请求与定时任务的执行耗时
 */
@Slf4j
@Aspect
@Component
public class LoggingAspect {

    /**
     * 匹配Controller层所有方法
     */
    @Pointcut("execution(* com.weiwo.bridge.controller..*.*(..))")
    public void controllerLayer() {}

    /**
     * 匹配定时调度方法
     */
    @Pointcut("execution(* com.weiwo.bridge.service.SyncScheduler.scheduled*(..))")
    public void scheduledStage() {}

    /**
     * Controller层方法拦截，响应式返回值在完成时记录耗时
     */
    @Around("controllerLayer()")
    public Object logControllerMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String operation = joinPoint.getTarget().getClass().getSimpleName() + "." + signature.getMethod().getName();
        String params = describeArgs(joinPoint.getArgs());
        long start = System.currentTimeMillis();

        log.info("HTTP请求: {} 参数: [{}]", operation, params);
        Object result = joinPoint.proceed();

        if (result instanceof Mono<?> mono) {
            return mono
                .doOnSuccess(value -> log.debug("HTTP请求完成: {} 耗时: {}ms", operation, System.currentTimeMillis() - start))
                .doOnError(error -> log.warn("HTTP请求异常: {} 错误: {} 耗时: {}ms",
                    operation, error.getMessage(), System.currentTimeMillis() - start));
        }
        return result;
    }

    /**
     * 定时任务拦截
     */
    @Around("scheduledStage()")
    public Object logScheduledStage(ProceedingJoinPoint joinPoint) throws Throwable {
        String methodName = joinPoint.getSignature().getName();
        long start = System.currentTimeMillis();
        try {
            return joinPoint.proceed();
        } finally {
            log.debug("定时任务 {} 执行耗时: {}ms", methodName, System.currentTimeMillis() - start);
        }
    }

    /**
     * 只记录简单类型的值，其余记录类型名
     */
    private String describeArgs(Object[] args) {
        if (args == null || args.length == 0) {
            return "";
        }
        return Arrays.stream(args)
            .map(arg -> {
                if (arg == null) {
                    return "null";
                }
                if (arg instanceof String || arg instanceof Number || arg instanceof Boolean) {
                    return arg.toString();
                }
                return arg.getClass().getSimpleName();
            })
            .collect(Collectors.joining(", "));
    }
}
