package com.eainde.labaudit.workflow;

import com.eainde.labaudit.cache.CacheKeys;
import com.eainde.labaudit.cache.InMemoryAuditCache;
import com.eainde.labaudit.classify.ExperimentTypeClassifier;
import com.eainde.labaudit.classify.MismatchDetector;
import com.eainde.labaudit.inference.FallbackVisionAnalyzer;
import com.eainde.labaudit.inference.InferenceException;
import com.eainde.labaudit.inference.ProtocolComparisonClient;
import com.eainde.labaudit.inference.VisionInferenceClient;
import com.eainde.labaudit.model.AuditResult;
import com.eainde.labaudit.model.AuditStage;
import com.eainde.labaudit.model.AuditStatus;
import com.eainde.labaudit.model.Finding;
import com.eainde.labaudit.model.Severity;
import com.eainde.labaudit.normalize.AuditResponseNormalizer;
import com.eainde.labaudit.normalize.JsonExtraction;
import com.eainde.labaudit.normalize.VisionResponseNormalizer;
import com.eainde.labaudit.scoring.DeterministicScorer;
import com.eainde.labaudit.scoring.PhantomFindingFilter;
import com.eainde.labaudit.scoring.ScoringPolicy;
import com.eainde.labaudit.workflow.edges.QualityRoutingEdge;
import com.eainde.labaudit.workflow.edges.TerminalRecordEdge;
import com.eainde.labaudit.workflow.nodes.LowQualityNode;
import com.eainde.labaudit.workflow.nodes.MismatchOverrideNode;
import com.eainde.labaudit.workflow.nodes.NormalizeNode;
import com.eainde.labaudit.workflow.nodes.QualityGateNode;
import com.eainde.labaudit.workflow.nodes.ReasoningNode;
import com.eainde.labaudit.workflow.nodes.ScoreNode;
import com.eainde.labaudit.workflow.nodes.VisionNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AuditOrchestratorTest {

    private static final byte[] IMAGE = "plate-image-bytes".getBytes(StandardCharsets.UTF_8);
    private static final String MIME = "image/png";
    private static final String MTT_PROTOCOL = """
            SOP-CV-001: MTT Cell Viability Assay
            1. Seed 10,000 cells per well in a 96-well plate
            2. Incubate with MTT reagent for 4 hours at 37C
            3. Read absorbance at 570 nm
            """;

    private static final String MTT_VISION = """
            EXPERIMENT_TYPE: MTT_CELL_VIABILITY
            IMAGE_QUALITY: 8
            A 96-well plate with purple formazan in most wells. Row H appears lighter.
            """;

    private static final String ALL_COMPLIANT = """
            ```json
            {
              "summary": "Assay performed per SOP",
              "data_integrity_score": 12,
              "status": "FAIL",
              "findings": [],
              "sop_compliance_checklist": [
                {"criterion": "Plate format", "status": "COMPLIANT", "notes": ""},
                {"criterion": "Reagent color", "status": "COMPLIANT", "notes": ""},
                {"criterion": "Controls", "status": "COMPLIANT", "notes": ""},
                {"criterion": "Labels", "status": "COMPLIANT", "notes": ""}
              ],
              "risk_assessment": "Low",
              "recommended_actions": ["Archive"]
            }
            ```
            """;

    private VisionInferenceClient visionClient;
    private ProtocolComparisonClient comparisonClient;
    private InMemoryAuditCache cache;
    private AuditOrchestrator orchestrator;

    @BeforeEach
    void setUp() throws Exception {
        visionClient = mock(VisionInferenceClient.class);
        when(visionClient.modelName()).thenReturn("test-vlm");
        comparisonClient = mock(ProtocolComparisonClient.class);
        cache = new InMemoryAuditCache();

        MismatchDetector mismatchDetector = new MismatchDetector(new ExperimentTypeClassifier());
        AuditWorkflowGraph graph = new AuditWorkflowGraph(
                new VisionNode(cache, new FallbackVisionAnalyzer(List.of(visionClient))),
                new QualityGateNode(new VisionResponseNormalizer(), mismatchDetector),
                new LowQualityNode(),
                new ReasoningNode(cache, comparisonClient),
                new NormalizeNode(new AuditResponseNormalizer(new JsonExtraction(new ObjectMapper()))),
                new ScoreNode(new PhantomFindingFilter(), new DeterministicScorer(ScoringPolicy.defaults())),
                new MismatchOverrideNode(mismatchDetector),
                new QualityRoutingEdge(QualityRoutingEdge.DEFAULT_REJECT_AT_OR_BELOW),
                new TerminalRecordEdge());
        orchestrator = new AuditOrchestrator(graph.build());
    }

    @Nested
    @DisplayName("Happy path")
    class HappyPath {

        @Test
        @DisplayName("scores from the checklist and ignores the model's own verdict")
        void scoresDeterministically() {
            when(visionClient.analyzeImage(any(), eq(MIME))).thenReturn(MTT_VISION);
            when(comparisonClient.compare(MTT_VISION, MTT_PROTOCOL)).thenReturn(ALL_COMPLIANT);

            AuditResult result = orchestrator.audit(IMAGE, MIME, MTT_PROTOCOL);

            assertThat(result.record().score()).isEqualTo(100);
            assertThat(result.record().status()).isEqualTo(AuditStatus.PASS);
            assertThat(result.record().summary()).isEqualTo("Assay performed per SOP");
            assertThat(result.visionText()).isEqualTo(MTT_VISION);
            assertThat(result.reasoningText()).isEqualTo(ALL_COMPLIANT);
            assertThat(result.experimentCheck().mismatch()).isFalse();
            assertThat(result.trail()).containsExactly(
                    AuditStage.UPLOADED, AuditStage.VISION_PENDING, AuditStage.QUALITY_GATE,
                    AuditStage.REASONING_PENDING, AuditStage.NORMALIZED, AuditStage.SCORED,
                    AuditStage.COMPLETE);
            assertThat(result.stage()).isEqualTo(AuditStage.COMPLETE);
        }

        @Test
        @DisplayName("drops phantom findings before scoring")
        void filtersPhantomFindings() {
            String response = """
                    {"findings": [
                       {"id": "F001", "severity": "MINOR", "observation": "Incubation time cannot be verified from a static image"},
                       {"id": "F002", "severity": "MAJOR", "observation": "Row H shows uneven color"}
                     ],
                     "sop_compliance_checklist": [
                       {"criterion": "a", "status": "COMPLIANT"}, {"criterion": "b", "status": "COMPLIANT"},
                       {"criterion": "c", "status": "COMPLIANT"}, {"criterion": "d", "status": "COMPLIANT"}
                     ]}
                    """;
            when(visionClient.analyzeImage(any(), anyString())).thenReturn(MTT_VISION);
            when(comparisonClient.compare(anyString(), anyString())).thenReturn(response);

            AuditResult result = orchestrator.audit(IMAGE, MIME, MTT_PROTOCOL);

            assertThat(result.record().findings()).extracting(Finding::id).containsExactly("F002");
            assertThat(result.record().score()).isEqualTo(90);
            assertThat(result.record().status()).isEqualTo(AuditStatus.PASS);
        }

        @Test
        @DisplayName("blank MIME type defaults to JPEG")
        void defaultsMimeType() {
            when(visionClient.analyzeImage(any(), anyString())).thenReturn(MTT_VISION);
            when(comparisonClient.compare(anyString(), anyString())).thenReturn(ALL_COMPLIANT);

            orchestrator.audit(IMAGE, " ", MTT_PROTOCOL);

            verify(visionClient).analyzeImage(any(), eq("image/jpeg"));
        }
    }

    @Nested
    @DisplayName("Caching")
    class Caching {

        @Test
        @DisplayName("a warm cache reproduces the record without any inference call")
        void warmCacheRoundTrip() {
            when(visionClient.analyzeImage(any(), anyString())).thenReturn(MTT_VISION);
            when(comparisonClient.compare(anyString(), anyString())).thenReturn(ALL_COMPLIANT);

            AuditResult cold = orchestrator.audit(IMAGE, MIME, MTT_PROTOCOL);
            AuditResult warm = orchestrator.audit(IMAGE.clone(), MIME, MTT_PROTOCOL);

            assertThat(warm.record()).isEqualTo(cold.record());
            assertThat(warm.visionCached()).isTrue();
            assertThat(warm.reasoningCached()).isTrue();
            assertThat(warm.trail()).contains(AuditStage.VISION_CACHED, AuditStage.REASONING_CACHED);
            verify(visionClient, times(1)).analyzeImage(any(), anyString());
            verify(comparisonClient, times(1)).compare(anyString(), anyString());
        }

        @Test
        @DisplayName("a different protocol reuses the vision description only")
        void protocolChangeReusesVision() {
            String revisedProtocol = "SOP-CV-002: MTT Cell Viability Assay (revised)\n1. Seed 5,000 cells";
            when(visionClient.analyzeImage(any(), anyString())).thenReturn(MTT_VISION);
            when(comparisonClient.compare(anyString(), anyString())).thenReturn(ALL_COMPLIANT);

            orchestrator.audit(IMAGE, MIME, MTT_PROTOCOL);
            AuditResult second = orchestrator.audit(IMAGE, MIME, revisedProtocol);

            assertThat(second.visionCached()).isTrue();
            assertThat(second.reasoningCached()).isFalse();
            verify(visionClient, times(1)).analyzeImage(any(), anyString());
            verify(comparisonClient, times(2)).compare(anyString(), anyString());
        }

        @Test
        @DisplayName("a failed vision stage is not cached and neither is the comparison built on it")
        void visionFailureNotCached() {
            when(visionClient.analyzeImage(any(), anyString())).thenThrow(new InferenceException("all endpoints down"));
            when(comparisonClient.compare(startsWith("Vision analysis error"), anyString())).thenReturn(ALL_COMPLIANT);

            AuditResult first = orchestrator.audit(IMAGE, MIME, MTT_PROTOCOL);
            orchestrator.audit(IMAGE, MIME, MTT_PROTOCOL);

            assertThat(first.visionCached()).isFalse();
            assertThat(first.visionText()).startsWith("Vision analysis error: all endpoints down");
            assertThat(cache.size()).isZero();
            verify(visionClient, times(2)).analyzeImage(any(), anyString());
            verify(comparisonClient, times(2)).compare(anyString(), anyString());
        }
    }

    @Nested
    @DisplayName("Terminal outcomes")
    class TerminalOutcomes {

        @Test
        @DisplayName("low image quality skips the comparison")
        void lowQualitySkipsReasoning() {
            when(visionClient.analyzeImage(any(), anyString()))
                    .thenReturn("EXPERIMENT_TYPE: MTT_CELL_VIABILITY\nIMAGE_QUALITY: 2\nVery blurry.");

            AuditResult result = orchestrator.audit(IMAGE, MIME, MTT_PROTOCOL);

            assertThat(result.record().status()).isEqualTo(AuditStatus.INSUFFICIENT_QUALITY);
            assertThat(result.record().score()).isNull();
            assertThat(result.reasoningText()).isNull();
            assertThat(result.trail()).containsSubsequence(AuditStage.QUALITY_GATE, AuditStage.ABORTED_LOW_QUALITY);
            verifyNoInteractions(comparisonClient);
        }

        @Test
        @DisplayName("reasoning failure yields an ERROR record and caches nothing for the audit")
        void reasoningFailure() {
            when(visionClient.analyzeImage(any(), anyString())).thenReturn(MTT_VISION);
            when(comparisonClient.compare(anyString(), anyString())).thenThrow(new InferenceException("read timed out"));

            AuditResult result = orchestrator.audit(IMAGE, MIME, MTT_PROTOCOL);

            assertThat(result.record().status()).isEqualTo(AuditStatus.ERROR);
            assertThat(result.record().score()).isZero();
            assertThat(result.record().summary()).contains("read timed out");
            assertThat(cache.get(CacheKeys.auditKey(IMAGE, MTT_PROTOCOL))).isEmpty();
            assertThat(cache.get(CacheKeys.visionKey(IMAGE))).contains(MTT_VISION);
            assertThat(result.trail()).doesNotContain(AuditStage.NORMALIZED, AuditStage.SCORED);
        }

        @Test
        @DisplayName("unparseable reasoning output yields a PARSE_ERROR record with the raw text")
        void parseError() {
            String raw = "I am unable to produce the requested format.";
            when(visionClient.analyzeImage(any(), anyString())).thenReturn(MTT_VISION);
            when(comparisonClient.compare(anyString(), anyString())).thenReturn(raw);

            AuditResult result = orchestrator.audit(IMAGE, MIME, MTT_PROTOCOL);

            assertThat(result.record().status()).isEqualTo(AuditStatus.PARSE_ERROR);
            assertThat(result.record().score()).isNull();
            assertThat(result.record().rawResponse()).isEqualTo(raw);
            assertThat(result.trail()).doesNotContain(AuditStage.SCORED);
        }

        @Test
        @DisplayName("empty image or blank protocol is rejected without inference")
        void invalidInput() {
            AuditResult noImage = orchestrator.audit(new byte[0], MIME, MTT_PROTOCOL);
            AuditResult noProtocol = orchestrator.audit(IMAGE, MIME, "   ");

            assertThat(noImage.record().status()).isEqualTo(AuditStatus.ERROR);
            assertThat(noProtocol.record().status()).isEqualTo(AuditStatus.ERROR);
            verify(visionClient, never()).analyzeImage(any(), anyString());
            verifyNoInteractions(comparisonClient);
        }
    }

    @Nested
    @DisplayName("Experiment type mismatch")
    class Mismatch {

        @Test
        @DisplayName("caps the score and fails the audit")
        void capsScore() {
            String gelVision = "EXPERIMENT_TYPE: GEL_ELECTROPHORESIS\nIMAGE_QUALITY: 9\nSix lanes with sharp bands.";
            when(visionClient.analyzeImage(any(), anyString())).thenReturn(gelVision);
            when(comparisonClient.compare(anyString(), anyString())).thenReturn(ALL_COMPLIANT);

            AuditResult result = orchestrator.audit(IMAGE, MIME, MTT_PROTOCOL);

            assertThat(result.experimentCheck().mismatch()).isTrue();
            assertThat(result.record().score()).isLessThanOrEqualTo(MismatchDetector.DEFAULT_SCORE_CAP);
            assertThat(result.record().status()).isEqualTo(AuditStatus.FAIL);
            assertThat(result.record().findings()).first().satisfies(finding -> {
                assertThat(finding.id()).isEqualTo(MismatchDetector.MISMATCH_FINDING_ID);
                assertThat(finding.severity()).isEqualTo(Severity.CRITICAL);
            });
            assertThat(result.record().findings())
                    .filteredOn(f -> f.category().equals(MismatchDetector.MISMATCH_CATEGORY)).hasSize(1);
            assertThat(result.trail()).containsSubsequence(
                    AuditStage.SCORED, AuditStage.MISMATCH_OVERRIDDEN, AuditStage.COMPLETE);
        }

        @Test
        @DisplayName("a warm cache reproduces the overridden record")
        void overrideIsReproducible() {
            String gelVision = "EXPERIMENT_TYPE: GEL_ELECTROPHORESIS\nIMAGE_QUALITY: 9\nSix lanes with sharp bands.";
            when(visionClient.analyzeImage(any(), anyString())).thenReturn(gelVision);
            when(comparisonClient.compare(anyString(), anyString())).thenReturn(ALL_COMPLIANT);

            AuditResult cold = orchestrator.audit(IMAGE, MIME, MTT_PROTOCOL);
            AuditResult warm = orchestrator.audit(IMAGE, MIME, MTT_PROTOCOL);

            assertThat(warm.record()).isEqualTo(cold.record());
        }
    }
}
