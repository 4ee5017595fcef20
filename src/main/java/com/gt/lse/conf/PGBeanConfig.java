package com.gt.lse.conf;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.lse.analytics.AnalyticsSink;
import com.gt.lse.analytics.impl.AnalyticsSinkPG;
import com.gt.lse.content.LearningItemDao;
import com.gt.lse.content.impl.LearningItemDaoPG;
import com.gt.lse.interaction.InteractionEventDao;
import com.gt.lse.interaction.impl.InteractionEventDaoPG;
import com.gt.lse.reviewState.ReviewStateDao;
import com.gt.lse.reviewState.impl.ReviewStateDaoPG;
import com.gt.lse.sessionState.SessionContextDao;
import com.gt.lse.sessionState.converter.SessionContextJsonConverter;
import com.gt.lse.sessionState.impl.SessionContextDaoPG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;

@Configuration
public class PGBeanConfig {

    @Bean
    public DataSource getDataSource(@Value("${lse.datasource.postgres.url}") String url,
                                    @Value("${lse.datasource.postgres.username}") String username,
                                    @Value("${lse.datasource.postgres.password}") String password) {
        return new DriverManagerDataSource(url, username, password);
    }

    @Bean
    public NamedParameterJdbcTemplate getNamedParameterJdbcTemplate(DataSource dataSource) {

        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public ReviewStateDao getReviewStateDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new ReviewStateDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public LearningItemDao getLearningItemDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new LearningItemDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public SessionContextDao getSessionContextDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate, ObjectMapper objectMapper) {
        return new SessionContextDaoPG(namedParameterJdbcTemplate, new SessionContextJsonConverter(objectMapper));
    }

    @Bean
    public InteractionEventDao getInteractionEventDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new InteractionEventDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public AnalyticsSink getAnalyticsSink(NamedParameterJdbcTemplate namedParameterJdbcTemplate, ObjectMapper objectMapper) {
        return new AnalyticsSinkPG(namedParameterJdbcTemplate, objectMapper);
    }
}
