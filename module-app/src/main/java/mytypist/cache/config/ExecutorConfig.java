package mytypist.cache.config;

import mytypist.cache.infrastructure.executor.DefaultLogicExecutor;
import mytypist.cache.infrastructure.executor.LogicExecutor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

  @Bean
  @ConditionalOnMissingBean
  public LogicExecutor logicExecutor() {
    return new DefaultLogicExecutor();
  }
}
