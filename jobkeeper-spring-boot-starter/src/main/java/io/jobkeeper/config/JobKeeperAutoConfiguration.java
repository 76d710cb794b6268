package io.jobkeeper.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobkeeper.ExecutionListener;
import io.jobkeeper.JobHandler;
import io.jobkeeper.Scheduler;
import io.jobkeeper.core.JobHandlerRegistry;
import io.jobkeeper.internal.DefaultScheduler;
import io.jobkeeper.internal.memory.InMemoryExecutionTracker;
import io.jobkeeper.internal.memory.InMemoryJobStore;
import io.jobkeeper.internal.mongo.MongoExecutionTracker;
import io.jobkeeper.internal.mongo.MongoJobStore;
import io.jobkeeper.spi.ExecutionTracker;
import io.jobkeeper.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for the scheduler.
 *
 * <p>Uses the MongoDB store and tracker when a {@link MongoTemplate} bean exists and falls back
 * to the in-memory implementations otherwise. Any {@link JobStore} or {@link ExecutionTracker}
 * bean defined by the application wins over both.
 */
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration",
        "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration"
})
@ConditionalOnClass(Scheduler.class)
@ConditionalOnProperty(prefix = "jobkeeper", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties
public class JobKeeperAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(JobKeeperAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    @ConfigurationProperties(prefix = "jobkeeper")
    public SchedulerProperties jobKeeperProperties() {
        return new SchedulerProperties();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobHandlerRegistry jobHandlerRegistry(ObjectProvider<List<JobHandler<?>>> handlersProvider) {
        List<JobHandler<?>> handlers = handlersProvider.getIfAvailable(List::of);
        return new JobHandlerRegistry(handlers);
    }

    @Bean
    @ConditionalOnMissingBean
    public Scheduler jobKeeperScheduler(SchedulerProperties props,
                                        JobStore jobStore,
                                        ExecutionTracker tracker,
                                        JobHandlerRegistry registry,
                                        ObjectProvider<ObjectMapper> objectMapper,
                                        ObjectProvider<ExecutionListener> listeners) {
        return new DefaultScheduler(props, jobStore, tracker, registry,
                objectMapper.getIfAvailable(ObjectMapper::new),
                listeners.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobKeeperLifecycle jobKeeperLifecycle(Scheduler scheduler, SchedulerProperties props) {
        return new JobKeeperLifecycle(scheduler, props);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MongoTemplate.class)
    @ConditionalOnBean(MongoTemplate.class)
    static class MongoStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean(JobStore.class)
        MongoJobStore mongoJobStore(MongoTemplate mongoTemplate, ObjectProvider<ObjectMapper> objectMapper) {
            return new MongoJobStore(mongoTemplate, objectMapper.getIfAvailable(ObjectMapper::new));
        }

        @Bean
        @ConditionalOnMissingBean(ExecutionTracker.class)
        MongoExecutionTracker mongoExecutionTracker(MongoTemplate mongoTemplate, SchedulerProperties props) {
            return new MongoExecutionTracker(mongoTemplate, props.resolveOwnerId());
        }

        @Bean
        @ConditionalOnMissingBean
        JobKeeperMongoIndexConfig jobKeeperMongoIndexConfig(MongoTemplate mongoTemplate, SchedulerProperties props) {
            return new JobKeeperMongoIndexConfig(mongoTemplate, props.getExecutionRetention());
        }

        @Bean
        @ConditionalOnProperty(prefix = "jobkeeper", name = "ensure-indexes-on-startup", havingValue = "true")
        SmartInitializingSingleton jobKeeperIndexesInitializer(JobKeeperMongoIndexConfig indexConfig) {
            return indexConfig::ensureIndexes;
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnMissingBean(type = "org.springframework.data.mongodb.core.MongoTemplate")
    static class InMemoryStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean(JobStore.class)
        InMemoryJobStore inMemoryJobStore() {
            log.warn("jobkeeper no MongoTemplate found, using in-memory job store; jobs will not survive a restart");
            return new InMemoryJobStore();
        }

        @Bean
        @ConditionalOnMissingBean(ExecutionTracker.class)
        InMemoryExecutionTracker inMemoryExecutionTracker(SchedulerProperties props) {
            return new InMemoryExecutionTracker(props.resolveOwnerId());
        }
    }
}
