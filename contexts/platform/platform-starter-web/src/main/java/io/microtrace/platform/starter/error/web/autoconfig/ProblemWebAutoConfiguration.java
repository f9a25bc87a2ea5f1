package io.microtrace.platform.starter.error.web.autoconfig;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Import;
import org.springframework.web.servlet.DispatcherServlet;

/**
 * Auto-config for Problem+JSON (RFC7807) wiring. Registers ProblemExceptionAdvice without relying
 * on component-scan.
 */
@AutoConfiguration
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnClass(DispatcherServlet.class)
@ConditionalOnProperty(
    prefix = "microtrace.web.problem",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
@Import(ProblemExceptionAdvice.class)
public class ProblemWebAutoConfiguration {}
