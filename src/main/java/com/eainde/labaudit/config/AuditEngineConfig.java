package com.eainde.labaudit.config;

import com.eainde.labaudit.cache.AuditCache;
import com.eainde.labaudit.cache.DisabledAuditCache;
import com.eainde.labaudit.cache.FileSnapshotAuditCache;
import com.eainde.labaudit.classify.ExperimentTypeClassifier;
import com.eainde.labaudit.classify.MismatchDetector;
import com.eainde.labaudit.inference.AgentProtocolComparisonClient;
import com.eainde.labaudit.inference.ChatModelVisionClient;
import com.eainde.labaudit.inference.FallbackVisionAnalyzer;
import com.eainde.labaudit.inference.InferenceLoggingListener;
import com.eainde.labaudit.inference.ProtocolComparisonAgent;
import com.eainde.labaudit.inference.ProtocolComparisonClient;
import com.eainde.labaudit.inference.VisionInferenceClient;
import com.eainde.labaudit.model.Severity;
import com.eainde.labaudit.normalize.AuditResponseNormalizer;
import com.eainde.labaudit.normalize.JsonExtraction;
import com.eainde.labaudit.normalize.VisionResponseNormalizer;
import com.eainde.labaudit.scoring.DeterministicScorer;
import com.eainde.labaudit.scoring.PhantomFindingFilter;
import com.eainde.labaudit.scoring.ScoringPolicy;
import com.eainde.labaudit.workflow.AuditOrchestrator;
import com.eainde.labaudit.workflow.AuditWorkflowGraph;
import com.eainde.labaudit.workflow.edges.QualityRoutingEdge;
import com.eainde.labaudit.workflow.edges.TerminalRecordEdge;
import com.eainde.labaudit.workflow.nodes.LowQualityNode;
import com.eainde.labaudit.workflow.nodes.MismatchOverrideNode;
import com.eainde.labaudit.workflow.nodes.NormalizeNode;
import com.eainde.labaudit.workflow.nodes.QualityGateNode;
import com.eainde.labaudit.workflow.nodes.ReasoningNode;
import com.eainde.labaudit.workflow.nodes.ScoreNode;
import com.eainde.labaudit.workflow.nodes.VisionNode;
import com.eainde.labaudit.workflow.state.AuditState;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.service.AiServices;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Wires the audit engine. Inference endpoints, cache location and scoring knobs come from
 * {@code labaudit.*} properties; every engine component can be replaced by declaring a bean
 * of the same type.
 */
@Slf4j
@AutoConfiguration
public class AuditEngineConfig {

    // ── Inference ───────────────────────────────────────────────────────
    @Value("${labaudit.inference.base-url:https://integrate.api.nvidia.com/v1}")
    private String baseUrl;

    @Value("${labaudit.inference.api-key:${NVIDIA_API_KEY:}}")
    private String apiKey;

    @Value("${labaudit.inference.vision-models:nvidia/nemotron-nano-12b-v2-vl,nvidia/vlm-1b-instruct,google/gemma-3-27b-it,meta/llama-3.2-11b-vision-instruct}")
    private String[] visionModels;

    @Value("${labaudit.inference.reasoning-model:nvidia/nemotron-3-nano-30b-a3b}")
    private String reasoningModel;

    @Value("${labaudit.inference.timeout-seconds:120}")
    private long timeoutSeconds;

    @Value("${labaudit.inference.vision-max-tokens:2000}")
    private int visionMaxTokens;

    @Value("${labaudit.inference.reasoning-max-tokens:4000}")
    private int reasoningMaxTokens;

    // ── Cache ───────────────────────────────────────────────────────────
    @Value("${labaudit.cache.enabled:true}")
    private boolean cacheEnabled;

    @Value("${labaudit.cache.file:.labaudit_cache.json}")
    private String cacheFile;

    // ── Scoring ─────────────────────────────────────────────────────────
    @Value("${labaudit.scoring.unable-credit:0.25}")
    private double unableCredit;

    @Value("${labaudit.scoring.weight.critical:15}")
    private int criticalWeight;

    @Value("${labaudit.scoring.weight.major:10}")
    private int majorWeight;

    @Value("${labaudit.scoring.weight.minor:5}")
    private int minorWeight;

    @Value("${labaudit.scoring.weight.observation:2}")
    private int observationWeight;

    @Value("${labaudit.scoring.neutral-score:50}")
    private int neutralScore;

    @Value("${labaudit.scoring.pass-threshold:80}")
    private int passThreshold;

    @Value("${labaudit.scoring.investigate-threshold:50}")
    private int investigateThreshold;

    // ── Gates ───────────────────────────────────────────────────────────
    @Value("${labaudit.quality.reject-at-or-below:3}")
    private int rejectQualityAtOrBelow;

    @Value("${labaudit.mismatch.score-cap:15}")
    private int mismatchScoreCap;

    // =========================================================================
    //  Inference
    // =========================================================================

    @Bean
    public InferenceLoggingListener inferenceLoggingListener() {
        return new InferenceLoggingListener();
    }

    @Bean
    @ConditionalOnMissingBean
    public FallbackVisionAnalyzer fallbackVisionAnalyzer(InferenceLoggingListener listener) {
        List<VisionInferenceClient> clients = Arrays.stream(visionModels)
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .map(name -> (VisionInferenceClient) new ChatModelVisionClient(
                        name, chatModel(name, visionMaxTokens, listener)))
                .toList();
        log.info("Vision models in fallback order: {}", clients.stream().map(VisionInferenceClient::modelName).toList());
        return new FallbackVisionAnalyzer(clients);
    }

    @Bean("reasoningChatModel")
    @ConditionalOnMissingBean(name = "reasoningChatModel")
    public ChatModel reasoningChatModel(InferenceLoggingListener listener) {
        return chatModel(reasoningModel, reasoningMaxTokens, listener);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProtocolComparisonClient protocolComparisonClient(@Qualifier("reasoningChatModel") ChatModel reasoningChatModel) {
        ProtocolComparisonAgent agent = AiServices.builder(ProtocolComparisonAgent.class)
                .chatModel(reasoningChatModel)
                .build();
        return new AgentProtocolComparisonClient(agent);
    }

    private ChatModel chatModel(String modelName, int maxTokens, InferenceLoggingListener listener) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("No inference API key configured - calls to {} will be rejected by the endpoint", modelName);
        }
        return OpenAiChatModel.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .modelName(modelName)
                .temperature(0.0)
                .maxTokens(maxTokens)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .listeners(List.of(listener))
                .build();
    }

    // =========================================================================
    //  Cache, normalization, scoring, classification
    // =========================================================================

    @Bean
    @ConditionalOnMissingBean
    public AuditCache auditCache(ObjectProvider<ObjectMapper> objectMapper) {
        if (!cacheEnabled) {
            log.info("Audit cache disabled");
            return new DisabledAuditCache();
        }
        return new FileSnapshotAuditCache(Path.of(cacheFile), objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    public AuditResponseNormalizer auditResponseNormalizer(ObjectProvider<ObjectMapper> objectMapper) {
        return new AuditResponseNormalizer(new JsonExtraction(objectMapper.getIfAvailable(ObjectMapper::new)));
    }

    @Bean
    public VisionResponseNormalizer visionResponseNormalizer() {
        return new VisionResponseNormalizer();
    }

    @Bean
    @ConditionalOnMissingBean
    public ScoringPolicy scoringPolicy() {
        return new ScoringPolicy(
                unableCredit,
                Map.of(Severity.CRITICAL, criticalWeight,
                        Severity.MAJOR, majorWeight,
                        Severity.MINOR, minorWeight,
                        Severity.OBSERVATION, observationWeight),
                neutralScore,
                passThreshold,
                investigateThreshold);
    }

    @Bean
    public DeterministicScorer deterministicScorer(ScoringPolicy scoringPolicy) {
        return new DeterministicScorer(scoringPolicy);
    }

    @Bean
    @ConditionalOnMissingBean
    public PhantomFindingFilter phantomFindingFilter() {
        return new PhantomFindingFilter();
    }

    @Bean
    public MismatchDetector mismatchDetector() {
        return new MismatchDetector(new ExperimentTypeClassifier(), mismatchScoreCap);
    }

    // =========================================================================
    //  Workflow
    // =========================================================================

    @Bean("auditWorkflow")
    public CompiledGraph<AuditState> auditWorkflow(
            AuditCache auditCache,
            FallbackVisionAnalyzer visionAnalyzer,
            ProtocolComparisonClient comparisonClient,
            VisionResponseNormalizer visionNormalizer,
            AuditResponseNormalizer auditNormalizer,
            PhantomFindingFilter findingFilter,
            DeterministicScorer scorer,
            MismatchDetector mismatchDetector) throws GraphStateException {
        return new AuditWorkflowGraph(
                new VisionNode(auditCache, visionAnalyzer),
                new QualityGateNode(visionNormalizer, mismatchDetector),
                new LowQualityNode(),
                new ReasoningNode(auditCache, comparisonClient),
                new NormalizeNode(auditNormalizer),
                new ScoreNode(findingFilter, scorer),
                new MismatchOverrideNode(mismatchDetector),
                new QualityRoutingEdge(rejectQualityAtOrBelow),
                new TerminalRecordEdge()
        ).build();
    }

    @Bean
    public AuditOrchestrator auditOrchestrator(@Qualifier("auditWorkflow") CompiledGraph<AuditState> auditWorkflow) {
        return new AuditOrchestrator(auditWorkflow);
    }
}
