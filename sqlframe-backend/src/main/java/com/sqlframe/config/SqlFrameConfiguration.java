package com.sqlframe.config;

import com.sqlframe.convert.FrameBuilder;
import com.sqlframe.convert.TypeRegistry;
import com.sqlframe.dialect.SqlDialect;
import com.sqlframe.dialect.SqlDialects;
import com.sqlframe.macro.Macros;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SqlFrameConfiguration {

    @Bean
    public TypeRegistry typeRegistry() {
        return TypeRegistry.defaults();
    }

    @Bean
    public FrameBuilder frameBuilder(TypeRegistry typeRegistry) {
        return new FrameBuilder(typeRegistry);
    }

    @Bean
    public SqlDialect sqlDialect(@Value("${sqlframe.dialect:postgres}") String dbType) {
        return SqlDialects.forDbType(dbType);
    }

    @Bean
    public Macros macros(SqlDialect sqlDialect) {
        return Macros.defaults(sqlDialect);
    }
}
