package io.github.cyfko.whereql.spring.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.whereql.core.compiler.ConditionCompiler;
import io.github.cyfko.whereql.core.config.QueryPolicy;
import io.github.cyfko.whereql.core.operator.OperatorTable;
import io.github.cyfko.whereql.core.pipeline.FilterDocumentReader;
import io.github.cyfko.whereql.spring.support.FilterStageRegistry;
import io.github.cyfko.whereql.spring.web.FilterRejectionHandler;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Wires the filter compiler into a Spring Boot application.
 * <p>
 * Every bean backs off when the application defines its own. The document reader reuses
 * the application's {@link ObjectMapper} when there is one.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@ConditionalOnClass(ConditionCompiler.class)
@EnableConfigurationProperties(WhereQlProperties.class)
public class WhereQlAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public QueryPolicy whereQlQueryPolicy(WhereQlProperties properties) {
        return properties.toPolicy();
    }

    @Bean
    @ConditionalOnMissingBean
    public ConditionCompiler whereQlConditionCompiler(QueryPolicy policy) {
        return new ConditionCompiler(OperatorTable.standard(), policy);
    }

    @Bean
    @ConditionalOnMissingBean
    public FilterDocumentReader whereQlFilterDocumentReader(QueryPolicy policy, ObjectProvider<ObjectMapper> objectMapper) {
        return new FilterDocumentReader(objectMapper.getIfAvailable(ObjectMapper::new), policy.maxFilterLength());
    }

    @Bean
    @ConditionalOnMissingBean
    public FilterStageRegistry filterStageRegistry(QueryPolicy policy, ConditionCompiler compiler, FilterDocumentReader reader) {
        return new FilterStageRegistry(policy, compiler, reader);
    }

    @Bean
    @ConditionalOnMissingBean
    public FilterRejectionHandler filterRejectionHandler() {
        return new FilterRejectionHandler();
    }
}
