package com.huntflow.test.domain;

import com.huntflow.domain.rule.model.entity.RuleDraftEntity;
import com.huntflow.domain.rule.model.entity.SimilarityMatchEntity;
import com.huntflow.domain.rule.model.valobj.RuleValidationResult;
import com.huntflow.domain.rule.model.valobj.SimilarityCandidate;
import com.huntflow.domain.rule.model.valobj.SimilarityWeights;
import com.huntflow.domain.rule.service.RuleSectionDomainService;
import com.huntflow.domain.workflow.model.valobj.RetryPolicy;
import com.huntflow.test.support.WorkflowTestFixture;
import com.huntflow.types.enums.RuleSectionEnum;
import com.huntflow.types.enums.SimilarityClassEnum;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SimilarityMatchingDomainServiceTest {

    private final WorkflowTestFixture fixture = new WorkflowTestFixture();

    @AfterEach
    public void tearDown() {
        fixture.close();
    }

    @Test
    public void shouldClassifyAgainstThresholds() {
        assertEquals(SimilarityClassEnum.NOVEL, fixture.similarity.classify(0.3, fixture.config));
        assertEquals(SimilarityClassEnum.VARIANT, fixture.similarity.classify(0.5, fixture.config));
        assertEquals(SimilarityClassEnum.VARIANT, fixture.similarity.classify(0.94, fixture.config));
        assertEquals(SimilarityClassEnum.DUPLICATE, fixture.similarity.classify(0.95, fixture.config));
    }

    @Test
    public void shouldBreakTiesByRecencyThenRuleId() {
        LocalDateTime older = LocalDateTime.of(2026, 1, 1, 0, 0);
        LocalDateTime newer = older.plusDays(3);
        List<SimilarityCandidate> candidates = new ArrayList<>();
        candidates.add(candidate("rule-b", uniform(0.6), older));
        candidates.add(candidate("rule-a", uniform(0.6), older));
        candidates.add(candidate("rule-c", uniform(0.6), newer));
        candidates.add(candidate("rule-d", uniform(0.9), older));

        List<String> order = fixture.similarity.rank(candidates, SimilarityWeights.defaults()).stream()
                .map(SimilarityCandidate::getRuleId)
                .collect(Collectors.toList());

        assertEquals(List.of("rule-d", "rule-c", "rule-a", "rule-b"), order);
    }

    @Test
    public void shouldClassifyNovelWhenCorpusEmpty() {
        RuleDraftEntity draft = savedDraft();

        SimilarityMatchEntity match = fixture.similarity.match(draft, fixture.config);

        assertTrue(match.isNovel());
        assertNull(match.getMatchedRuleId());
        assertEquals(0.0, match.getAggregateScore(), 1e-9);
        assertEquals(4, match.getSectionScores().size());
    }

    @Test
    public void shouldDetectDuplicateOfIndexedRule() {
        RuleDraftEntity draft = savedDraft();
        RuleSectionDomainService sections = new RuleSectionDomainService();
        fixture.vectorIndex.upsert("existing-1", draft.getTitle(),
                fixture.similarity.embed(sections.sections(draft), RetryPolicy.builder().build()), LocalDateTime.now());

        SimilarityMatchEntity match = fixture.similarity.match(draft, fixture.config);

        assertEquals(SimilarityClassEnum.DUPLICATE, match.getClassification());
        assertEquals("existing-1", match.getMatchedRuleId());
        assertEquals(1.0, match.getSectionScores().get("signature"), 1e-6);
    }

    @Test
    public void shouldReuseExistingMatchForSameDraft() {
        RuleDraftEntity draft = savedDraft();
        SimilarityMatchEntity first = fixture.similarity.match(draft, fixture.config);
        int embeddingCalls = fixture.embeddingGateway.getCalls();

        SimilarityMatchEntity second = fixture.similarity.match(draft, fixture.config);

        assertEquals(first.getId(), second.getId());
        assertEquals(1, fixture.matchRepository.size());
        assertEquals(embeddingCalls, fixture.embeddingGateway.getCalls());
    }

    private RuleDraftEntity savedDraft() {
        RuleDraftEntity draft = fixture.ruleGeneration.buildDraft(61L,
                fixture.ruleDraftParser.parse(WorkflowTestFixture.VALID_RULE_YAML).getValue(), 1,
                RuleValidationResult.ok());
        return fixture.draftRepository.save(draft);
    }

    private SimilarityCandidate candidate(String ruleId, Map<RuleSectionEnum, Double> scores, LocalDateTime updatedAt) {
        return new SimilarityCandidate(ruleId, ruleId, scores, updatedAt, 0.0);
    }

    private Map<RuleSectionEnum, Double> uniform(double score) {
        Map<RuleSectionEnum, Double> scores = new EnumMap<>(RuleSectionEnum.class);
        for (RuleSectionEnum section : RuleSectionEnum.values()) {
            scores.put(section, score);
        }
        return scores;
    }
}
