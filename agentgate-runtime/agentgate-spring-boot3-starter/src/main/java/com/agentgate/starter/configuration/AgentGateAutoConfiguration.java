package com.agentgate.starter.configuration;

import com.agentgate.api.audit.AuditSink;
import com.agentgate.api.exception.PolicyConfigurationException;
import com.agentgate.api.security.AuthorizationService;
import com.agentgate.api.security.RowFilterRewriter;
import com.agentgate.api.tool.ToolInvoker;
import com.agentgate.core.audit.InMemoryAuditSink;
import com.agentgate.core.config.AgentGateConfig;
import com.agentgate.core.dispatch.DispatcherConfig;
import com.agentgate.core.dispatch.ExecutionHistory;
import com.agentgate.core.dispatch.ToolDispatcher;
import com.agentgate.core.dispatch.event.DispatchEventBus;
import com.agentgate.core.kernel.GatewayKernel;
import com.agentgate.core.policy.PolicyLoader;
import com.agentgate.core.policy.PolicyStore;
import com.agentgate.core.rewrite.LexicalRowFilterRewriter;
import com.agentgate.core.security.DefaultAuthorizationGate;
import com.agentgate.core.sql.SqlStatementClassifier;
import com.agentgate.starter.config.AgentGateProperties;
import com.agentgate.starter.controller.AgentGateOpsController;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnSingleCandidate;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;

@Slf4j
@Configuration
@EnableConfigurationProperties(AgentGateProperties.class)
@ConditionalOnProperty(prefix = "agentgate", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AgentGateAutoConfiguration {

    @Bean
    public AgentGateConfig agentGateConfig(AgentGateProperties properties) {
        return properties.toCoreConfig();
    }

    // 策略只在启动时加载一次，之后只读
    @Bean
    @ConditionalOnMissingBean
    public PolicyStore policyStore(AgentGateConfig config, ResourceLoader resourceLoader) {
        String location = config.getPolicyLocation();
        if (location == null || location.isBlank()) {
            log.info("Loading default AgentGate policy");
            return PolicyLoader.loadDefault();
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new PolicyConfigurationException("Policy resource not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            log.info("Loading AgentGate policy from {}", location);
            return PolicyLoader.load(in);
        } catch (IOException e) {
            throw new PolicyConfigurationException("Failed to read policy resource: " + location, e);
        }
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "agentgate.audit", name = "in-memory", havingValue = "true", matchIfMissing = true)
    public InMemoryAuditSink inMemoryAuditSink(AgentGateConfig config) {
        return new InMemoryAuditSink(config.getAuditInMemoryCapacity());
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditSink auditSink(AgentGateConfig config, ObjectProvider<InMemoryAuditSink> inMemoryProvider) {
        return config.buildAuditSink(inMemoryProvider.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public AuthorizationService authorizationService(PolicyStore policyStore, AuditSink auditSink) {
        return new DefaultAuthorizationGate(policyStore, auditSink);
    }

    @Bean
    @ConditionalOnMissingBean
    public RowFilterRewriter rowFilterRewriter(PolicyStore policyStore, AuditSink auditSink) {
        return new LexicalRowFilterRewriter(policyStore, auditSink);
    }

    @Bean
    @ConditionalOnMissingBean
    public SqlStatementClassifier sqlStatementClassifier() {
        return new SqlStatementClassifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionHistory executionHistory() {
        return new ExecutionHistory();
    }

    // 将事件总线注册为 Bean (解耦)
    @Bean
    @ConditionalOnMissingBean
    public DispatchEventBus dispatchEventBus(AgentGateConfig config) {
        DispatcherConfig dispatcher = config.getDispatcher();
        return dispatcher.isAsyncEvents()
                ? DispatchEventBus.async("agentgate", dispatcher.getEventQueueCapacity())
                : new DispatchEventBus("agentgate");
    }

    // 只有宿主提供了下游调用器时才创建派发器
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnSingleCandidate(ToolInvoker.class)
    public ToolDispatcher toolDispatcher(ToolInvoker toolInvoker,
                                         AgentGateConfig config,
                                         ExecutionHistory history,
                                         DispatchEventBus eventBus) {
        ToolDispatcher dispatcher = new ToolDispatcher(toolInvoker, config.getDispatcher(), history);
        dispatcher.setEventBus(eventBus);
        return dispatcher;
    }

    @Bean
    @ConditionalOnMissingBean
    public GatewayKernel gatewayKernel(AuthorizationService authorizationService,
                                       RowFilterRewriter rowFilterRewriter,
                                       SqlStatementClassifier classifier,
                                       ObjectProvider<ToolDispatcher> dispatcherProvider) {
        return new GatewayKernel(authorizationService, rowFilterRewriter, classifier,
                dispatcherProvider.getIfAvailable());
    }

    @Configuration
    @ConditionalOnClass(name = "org.springframework.web.servlet.DispatcherServlet")
    static class OpsControllerConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public AgentGateOpsController agentGateOpsController(AuthorizationService authorizationService,
                                                             ObjectProvider<ToolDispatcher> dispatcherProvider,
                                                             ObjectProvider<InMemoryAuditSink> auditLogProvider) {
            return new AgentGateOpsController(authorizationService,
                    dispatcherProvider.getIfAvailable(), auditLogProvider.getIfAvailable());
        }
    }
}
