package com.agentgate.starter.configuration;

import com.agentgate.api.audit.AuditSink;
import com.agentgate.api.exception.PolicyConfigurationException;
import com.agentgate.api.security.AuthorizationService;
import com.agentgate.api.security.Persona;
import com.agentgate.api.security.ResourceKind;
import com.agentgate.api.tool.ToolInvoker;
import com.agentgate.core.audit.AsyncAuditSink;
import com.agentgate.core.audit.InMemoryAuditSink;
import com.agentgate.core.dispatch.ToolDispatcher;
import com.agentgate.core.kernel.GatewayKernel;
import com.agentgate.core.policy.PolicyStore;
import com.agentgate.starter.controller.AgentGateOpsController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.boot.test.util.TestPropertyValues;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AgentGateAutoConfiguration 单元测试")
class AgentGateAutoConfigurationTest {

    private static AnnotationConfigApplicationContext context(String... properties) {
        return context(new Class<?>[0], properties);
    }

    private static AnnotationConfigApplicationContext context(Class<?>[] userConfigs, String... properties) {
        AnnotationConfigApplicationContext ctx = new AnnotationConfigApplicationContext();
        TestPropertyValues.of(properties).applyTo(ctx);
        if (userConfigs.length > 0) {
            ctx.register(userConfigs);
        }
        ctx.register(AgentGateAutoConfiguration.class);
        ctx.refresh();
        return ctx;
    }

    @Configuration
    static class InvokerConfig {
        @Bean
        ToolInvoker toolInvoker() {
            return (target, input) -> Map.of("target", target);
        }
    }

    @Nested
    @DisplayName("默认装配")
    class Defaults {

        @Test
        @DisplayName("默认策略与鉴权服务")
        void wiresGateWithDefaultPolicy() {
            try (AnnotationConfigApplicationContext ctx = context()) {
                PolicyStore store = ctx.getBean(PolicyStore.class);
                assertEquals(Set.of(Persona.values()), store.personas());

                AuthorizationService gate = ctx.getBean(AuthorizationService.class);
                assertTrue(gate.accessibleResources("field_engineer", ResourceKind.OPERATION)
                        .contains("track_shipments"));

                assertNotNull(ctx.getBean(InMemoryAuditSink.class));
                assertNotNull(ctx.getBean(GatewayKernel.class));
                assertNotNull(ctx.getBean(AgentGateOpsController.class));
            }
        }

        @Test
        @DisplayName("没有下游调用器时不创建派发器")
        void noDispatcherWithoutInvoker() {
            try (AnnotationConfigApplicationContext ctx = context()) {
                assertTrue(ctx.getBeansOfType(ToolDispatcher.class).isEmpty());
            }
        }

        @Test
        @DisplayName("提供调用器时按属性创建派发器")
        void dispatcherFromProperties() {
            try (AnnotationConfigApplicationContext ctx = context(new Class<?>[]{InvokerConfig.class},
                    "agentgate.dispatcher.max-workers=3",
                    "agentgate.dispatcher.base-backoff=250ms")) {
                ToolDispatcher dispatcher = ctx.getBean(ToolDispatcher.class);
                assertEquals(3, dispatcher.config().getMaxWorkers());
                assertEquals(Duration.ofMillis(250), dispatcher.config().getBaseBackoff());
            }
        }
    }

    @Nested
    @DisplayName("属性开关")
    class Switches {

        @Test
        @DisplayName("enabled=false 时不装配")
        void disabled() {
            try (AnnotationConfigApplicationContext ctx = context("agentgate.enabled=false")) {
                assertTrue(ctx.getBeansOfType(AuthorizationService.class).isEmpty());
            }
        }

        @Test
        @DisplayName("自定义策略位置")
        void customPolicyLocation() {
            try (AnnotationConfigApplicationContext ctx = context(
                    "agentgate.policy-location=classpath:policy/test-policy.yml")) {
                PolicyStore store = ctx.getBean(PolicyStore.class);
                assertEquals(Set.of(Persona.PROCUREMENT_SPECIALIST), store.personas());
                assertEquals("buyers", store.groupOf(Persona.PROCUREMENT_SPECIALIST));
            }
        }

        @Test
        @DisplayName("策略文件不存在时启动失败")
        void missingPolicyFailsFast() {
            BeanCreationException e = assertThrows(BeanCreationException.class, () ->
                    context("agentgate.policy-location=classpath:policy/absent.yml").close());
            Throwable root = e.getMostSpecificCause();
            assertInstanceOf(PolicyConfigurationException.class, root);
        }

        @Test
        @DisplayName("关闭内存审计并开启异步写入")
        void asyncAuditWithoutMemory() {
            try (AnnotationConfigApplicationContext ctx = context(
                    "agentgate.audit.in-memory=false",
                    "agentgate.audit.async=true")) {
                assertTrue(ctx.getBeansOfType(InMemoryAuditSink.class).isEmpty());
                assertInstanceOf(AsyncAuditSink.class, ctx.getBean(AuditSink.class));
            }
        }

        @Test
        @DisplayName("内存审计容量可配置")
        void inMemoryCapacityIsBound() {
            try (AnnotationConfigApplicationContext ctx = context("agentgate.audit.in-memory-capacity=50")) {
                assertEquals(50, ctx.getBean(InMemoryAuditSink.class).getCapacity());
            }
        }
    }
}
