package com.rtcc.orchestrator.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rtcc.orchestrator.engine.catalog.StandardCatalog;
import com.rtcc.orchestrator.engine.condition.ConditionEvaluator;
import com.rtcc.orchestrator.engine.history.ExecutionHistoryService;
import com.rtcc.orchestrator.engine.kernel.OrchestrationKernel;
import com.rtcc.orchestrator.engine.metrics.OrchestrationMetrics;
import com.rtcc.orchestrator.engine.persistence.InMemoryAuditTrailRepository;
import com.rtcc.orchestrator.engine.persistence.InMemoryExecutionEventRepository;
import com.rtcc.orchestrator.engine.persistence.InMemoryGuardrailCheckRepository;
import com.rtcc.orchestrator.engine.persistence.InMemoryWorkflowExecutionRepository;
import com.rtcc.orchestrator.engine.persistence.InMemoryWorkflowRepository;
import com.rtcc.orchestrator.engine.policy.LoggingReviewChannel;
import com.rtcc.orchestrator.engine.policy.PolicyBindingEngine;
import com.rtcc.orchestrator.engine.policy.ReviewChannel;
import com.rtcc.orchestrator.engine.resource.ResourceManager;
import com.rtcc.orchestrator.engine.routing.EventRouter;
import com.rtcc.orchestrator.engine.subsystem.SubsystemHandler;
import com.rtcc.orchestrator.engine.workflow.WorkflowEngine;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Composition root: builds the orchestration components and wires them together.
 *
 * Every {@link SubsystemHandler} bean is registered with the kernel under its bean name.
 */
@Configuration
@EnableConfigurationProperties(OrchestrationProperties.class)
public class OrchestrationConfiguration {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationConfiguration.class);

    @Bean
    public ConditionEvaluator conditionEvaluator() {
        return new ConditionEvaluator();
    }

    @Bean
    public OrchestrationMetrics orchestrationMetrics(MeterRegistry meterRegistry) {
        return new OrchestrationMetrics(meterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public ReviewChannel reviewChannel() {
        return new LoggingReviewChannel();
    }

    @Bean
    public EventRouter eventRouter(ConditionEvaluator conditions, OrchestrationMetrics metrics,
                                   OrchestrationProperties properties) {
        return new EventRouter(conditions, metrics, properties.getHistoryLimit());
    }

    @Bean
    public PolicyBindingEngine policyBindingEngine(ConditionEvaluator conditions, ReviewChannel reviewChannel,
                                                   OrchestrationMetrics metrics, OrchestrationProperties properties) {
        return new PolicyBindingEngine(new InMemoryGuardrailCheckRepository(properties.getHistoryLimit()),
            conditions, reviewChannel, metrics);
    }

    @Bean
    public ResourceManager resourceManager(OrchestrationMetrics metrics, OrchestrationProperties properties) {
        return new ResourceManager(metrics, properties.getHistoryLimit());
    }

    @Bean(destroyMethod = "stop")
    public OrchestrationKernel orchestrationKernel(
            EventRouter router,
            PolicyBindingEngine policyEngine,
            ResourceManager resourceManager,
            OrchestrationMetrics metrics,
            ObjectMapper objectMapper,
            OrchestrationProperties properties,
            ListableBeanFactory beanFactory) {
        OrchestrationKernel kernel = new OrchestrationKernel(router, policyEngine, resourceManager,
            new InMemoryAuditTrailRepository(properties.getHistoryLimit()), metrics, objectMapper,
            properties.toKernelSettings());
        beanFactory.getBeansOfType(SubsystemHandler.class).forEach(kernel::registerSubsystem);
        return kernel;
    }

    @Bean
    public InMemoryWorkflowExecutionRepository workflowExecutionRepository(
            OrchestrationProperties properties, InMemoryExecutionEventRepository eventRepository) {
        return InMemoryWorkflowExecutionRepository.withEventLog(properties.getHistoryLimit(), eventRepository);
    }

    @Bean
    public InMemoryExecutionEventRepository executionEventRepository() {
        return new InMemoryExecutionEventRepository();
    }

    @Bean(destroyMethod = "shutdown")
    public WorkflowEngine workflowEngine(
            InMemoryWorkflowExecutionRepository executionRepository,
            InMemoryExecutionEventRepository eventRepository,
            ConditionEvaluator conditions,
            OrchestrationKernel kernel,
            OrchestrationMetrics metrics,
            ObjectMapper objectMapper) {
        WorkflowEngine engine = new WorkflowEngine(new InMemoryWorkflowRepository(), executionRepository,
            eventRepository, conditions, kernel, metrics, objectMapper);
        kernel.bindWorkflowEngine(engine);
        return engine;
    }

    @Bean
    public ExecutionHistoryService executionHistoryService(
            InMemoryWorkflowExecutionRepository executionRepository,
            InMemoryExecutionEventRepository eventRepository) {
        return new ExecutionHistoryService(executionRepository, eventRepository);
    }

    /**
     * Load the standard catalog and start dispatching once the context is ready.
     */
    @Bean
    public ApplicationRunner orchestrationStartup(
            OrchestrationProperties properties,
            EventRouter router,
            PolicyBindingEngine policyEngine,
            ResourceManager resourceManager,
            OrchestrationKernel kernel) {
        return args -> {
            if (properties.isLoadStandardCatalog()) {
                StandardCatalog.loadInto(router, policyEngine, resourceManager);
            }
            if (properties.isAutoStart()) {
                kernel.start();
            } else {
                log.info("Kernel auto-start disabled; start it through /api/v1/kernel/start");
            }
        };
    }
}
