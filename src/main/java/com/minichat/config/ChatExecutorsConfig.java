package com.minichat.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableConfigurationProperties({
        ChatDbExecutorProperties.class,
        ChatDeliveryExecutorProperties.class
})
public class ChatExecutorsConfig {

    @Bean("chatDbExecutor")
    @Primary
    public Executor chatDbExecutor(ChatDbExecutorProperties props) {
        return newExecutor("chat-db-",
                props.corePoolSizeEffective(), props.maxPoolSizeEffective(), props.queueCapacityEffective());
    }

    @Bean("chatDeliveryExecutor")
    public Executor chatDeliveryExecutor(ChatDeliveryExecutorProperties props) {
        return newExecutor("chat-delivery-",
                props.corePoolSizeEffective(), props.maxPoolSizeEffective(), props.queueCapacityEffective());
    }

    private static ThreadPoolTaskExecutor newExecutor(String prefix, int core, int max, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(prefix);
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(Math.max(core, max));
        executor.setQueueCapacity(queueCapacity);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setAwaitTerminationSeconds(10);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
