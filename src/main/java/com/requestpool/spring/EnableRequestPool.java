package com.requestpool.spring;

import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable the request pool resolver in a Spring Boot application.
 *
 * Usage:
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnableRequestPool
 * public class MyApplication {
 *     public static void main(String[] args) {
 *         SpringApplication.run(MyApplication.class, args);
 *     }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(RequestPoolAutoConfiguration.class)
public @interface EnableRequestPool {
}
