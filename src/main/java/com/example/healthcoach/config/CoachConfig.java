package com.example.healthcoach.config;

import com.example.healthcoach.classifier.DateScopeResolver;
import com.example.healthcoach.classifier.IntentClassifier;
import com.example.healthcoach.classifier.IntentRuleTable;
import com.example.healthcoach.dao.HealthRecordDao;
import com.example.healthcoach.router.ModelRouter;
import com.example.healthcoach.scenario.ImpactCoefficientTable;
import com.example.healthcoach.scenario.ScenarioEngine;
import com.example.healthcoach.scenario.ScenarioParser;
import com.example.healthcoach.service.ContextRetriever;
import com.example.healthcoach.service.ConversationHistoryService;
import com.example.healthcoach.service.DailySummaryIndex;
import com.example.healthcoach.service.ScenarioService;
import com.example.healthcoach.service.SessionGate;
import com.example.healthcoach.service.UserProfileCache;
import com.example.healthcoach.service.UserProfileService;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Plain-Java collaborators of the query pipeline and the jobs.
 */
@Configuration
public class CoachConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public IntentRuleTable intentRuleTable(ObjectMapper objectMapper) {
        return IntentRuleTable.fromClasspath(objectMapper);
    }

    @Bean
    public DateScopeResolver dateScopeResolver(Clock clock) {
        return new DateScopeResolver(clock);
    }

    @Bean
    public IntentClassifier intentClassifier(IntentRuleTable rules, DateScopeResolver dates) {
        return new IntentClassifier(rules, dates);
    }

    @Bean
    public ModelRouter modelRouter(CoachProperties props) {
        return new ModelRouter(props.getRouter().isCostConstrained());
    }

    @Bean
    public ImpactCoefficientTable impactCoefficientTable(CoachProperties props) {
        return ImpactCoefficientTable.defaults(props.getScenario().getDiastolicRatio());
    }

    @Bean
    public ScenarioEngine scenarioEngine(ImpactCoefficientTable table) {
        return new ScenarioEngine(table);
    }

    @Bean
    public ScenarioParser scenarioParser() {
        return new ScenarioParser();
    }

    @Bean
    public ScenarioService scenarioService(ScenarioEngine engine, ScenarioParser parser, CoachProperties props) {
        return new ScenarioService(engine, parser, props.getScenario());
    }

    @Bean
    public UserProfileService userProfileService(HealthRecordDao dao, CoachProperties props, Clock clock) {
        return new UserProfileService(dao, props, clock);
    }

    @Bean
    public UserProfileCache userProfileCache(UserProfileService service, CoachProperties props, Clock clock) {
        return new UserProfileCache(service::load, props.getProfile().getTtl(), clock);
    }

    @Bean
    public DailySummaryIndex dailySummaryIndex(EmbeddingModel embeddingModel, EmbeddingStore<TextSegment> store) {
        return new DailySummaryIndex(embeddingModel, store);
    }

    @Bean
    public ContextRetriever contextRetriever(UserProfileCache profileCache,
                                             HealthRecordDao dao,
                                             DailySummaryIndex index,
                                             ConversationHistoryService history,
                                             CoachProperties props,
                                             Clock clock) {
        return new ContextRetriever(profileCache, dao, index, history, props.getRetrieval(), clock);
    }

    @Bean
    public SessionGate sessionGate() {
        return new SessionGate();
    }
}
