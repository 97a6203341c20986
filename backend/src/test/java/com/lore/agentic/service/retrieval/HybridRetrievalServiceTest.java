package com.lore.agentic.service.retrieval;

import com.lore.agentic.config.GraphRelevanceProperties;
import com.lore.agentic.model.ContextDocument;
import com.lore.agentic.model.GraphNodeInfo;
import com.lore.agentic.model.OptimizerPayload;
import com.lore.agentic.model.PayloadNode;
import com.lore.agentic.model.QueryDecomposition;
import com.lore.agentic.model.ScoredChunk;
import com.lore.agentic.service.graph.GraphQueryCache;
import com.lore.agentic.service.graph.GraphRelevanceScorer;
import com.lore.agentic.service.graph.InMemoryGraphStore;
import com.lore.agentic.service.graph.NodeInfoService;
import com.lore.agentic.service.orchestrator.GraphContextOptimizer;
import com.lore.service.ner.EntityNormalizationService;
import com.lore.service.ner.FuzzySpanMatcher;
import com.lore.service.ner.Gazetteer;
import com.lore.service.ner.PassThroughInflectionAdapter;
import com.lore.service.ner.SpanResolver;
import com.lore.service.ner.WordTokenizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class HybridRetrievalServiceTest {

    private ExecutorService executor;
    private QueryDecompositionService decomposition;
    private DocumentSearchPort search;
    private GraphContextOptimizer optimizer;
    private HybridRetrievalService service;

    @BeforeEach
    void setUp() {
        GraphRelevanceProperties properties = new GraphRelevanceProperties();
        InMemoryGraphStore store = new InMemoryGraphStore(properties);
        store.addNode("Horus", Arrays.asList("Primarch"), "Warmaster of the Imperium", "https://wiki.local/Horus");
        store.addNode("Sons of Horus", Arrays.asList("Legion"), "Sixteenth Legion", "https://wiki.local/Sons_of_Horus");
        store.addNode("Abaddon", Arrays.asList("Character"), "First Captain", "https://wiki.local/Abaddon");
        store.addNode("Terra", Arrays.asList("World"), "Throneworld", "https://wiki.local/Terra");
        store.addRelation("Horus", "LEADS", "Sons of Horus");
        store.addRelation("Abaddon", "MEMBER_OF", "Sons of Horus");

        executor = Executors.newFixedThreadPool(2);
        EntityNormalizationService normalization = new EntityNormalizationService(
            Gazetteer.of(Arrays.asList("Abaddon", "Horus")), new FuzzySpanMatcher(new WordTokenizer()),
            new SpanResolver(), new PassThroughInflectionAdapter(), 82);

        decomposition = mock(QueryDecompositionService.class);
        search = mock(DocumentSearchPort.class);
        optimizer = mock(GraphContextOptimizer.class);
        when(optimizer.optimize(anyString(), any(OptimizerPayload.class))).thenAnswer(inv -> inv.getArgument(1));
        when(search.similaritySearch(anyString(), anyInt())).thenReturn(Collections.<ScoredChunk>emptyList());

        service = new HybridRetrievalService(decomposition, search, normalization,
            new GraphRelevanceScorer(store, properties, executor),
            new NodeInfoService(store, new GraphQueryCache(60_000)), optimizer, 6, 10);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static ScoredChunk chunk(String title, String content, String source) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("title", title);
        if (source != null) {
            metadata.put("source", source);
        }
        return ScoredChunk.builder().title(title).content(content).metadata(metadata).score(0.3).build();
    }

    @Test
    @DisplayName("完整流程：检索、打分筛选、构建工作集、组装上下文")
    void retrievesAssemblesContextForSurvivingNodes() {
        when(decomposition.decompose("Who followed Horus?")).thenReturn(
            new QueryDecomposition(Collections.singletonList("Abadon"), Collections.singletonList("Who is Horus?")));
        when(search.similaritySearch("Who is Horus?", 6)).thenReturn(Arrays.asList(
            chunk("Horus", "Horus was the Warmaster.", "https://wiki.local/Horus"),
            chunk("Terra", "Terra is the Throneworld.", "https://wiki.local/Terra")));
        when(search.similaritySearch("Who followed Horus?", 6)).thenReturn(Arrays.asList(
            chunk("Horus", "Horus was the Warmaster.", "https://wiki.local/Horus"),
            chunk("Horus", "Horus fell to Chaos.", "https://wiki.local/Horus")));
        when(search.similaritySearch("Abaddon", 6)).thenReturn(Collections.singletonList(
            chunk("Abaddon", "Abaddon led the Black Legion.", "file:///archive/abaddon.txt")));

        List<ContextDocument> documents = service.retrieve("Who followed Horus?");

        verify(search).similaritySearch("Abaddon", 6);
        assertEquals(2, documents.size());

        ContextDocument horus = documents.get(0);
        assertEquals("Horus", horus.getTitle());
        assertEquals("=== ENTITY: Horus ===\n\n[DESCRIPTION]: Warmaster of the Imperium\n\n"
            + "[ADDITIONAL ARCHIVE DATA]:\n\nFragment 1:\nHorus was the Warmaster.\n\n"
            + "Fragment 2:\nHorus fell to Chaos.", horus.getContent());
        assertEquals("https://wiki.local/Horus", horus.getMetadata().get("source"));

        ContextDocument legion = documents.get(1);
        assertEquals("Sons of Horus", legion.getTitle());
        assertEquals("https://wiki.local/Sons_of_Horus", legion.getMetadata().get("source"));
    }

    @Test
    void payloadHoldsCandidatesThenIntermediatesWithSequentialIds() {
        when(decomposition.decompose(anyString())).thenReturn(QueryDecomposition.empty());
        when(search.similaritySearch("Horus and Abaddon", 6)).thenReturn(Arrays.asList(
            chunk("Horus", "a", "https://wiki.local/Horus"),
            chunk("Abaddon", "b", "https://wiki.local/Abaddon"),
            chunk("Unindexed", "c", "https://wiki.local/Unindexed"),
            chunk("Unindexed", "d", "https://wiki.local/Unindexed")));

        service.retrieve("Horus and Abaddon");

        ArgumentCaptor<OptimizerPayload> captor = ArgumentCaptor.forClass(OptimizerPayload.class);
        verify(optimizer).optimize(eq("Horus and Abaddon"), captor.capture());
        List<PayloadNode> nodes = captor.getValue().getNodes();

        assertEquals(3, nodes.size());
        assertEquals("node_1", nodes.get(0).getId());
        assertEquals(0.333, nodes.get(0).getScore(), 1e-9);
        assertFalse(nodes.get(0).getInfo().getOutgoing().isEmpty());
        assertEquals("node_2", nodes.get(1).getId());
        assertEquals("Abaddon", nodes.get(1).getTitle());
        // Unindexed 没有图谱节点，占用 node_3 但被跳过
        assertEquals("node_4", nodes.get(2).getId());
        assertEquals("Sons of Horus", nodes.get(2).getTitle());
        assertEquals(0.0, nodes.get(2).getScore(), 1e-9);
        assertTrue(nodes.get(2).getInfo().getOutgoing().isEmpty());
        assertEquals(2, captor.getValue().getPaths().size());
    }

    @Test
    void noChunksSkipsGraphAndOptimizer() {
        when(decomposition.decompose(anyString())).thenReturn(QueryDecomposition.empty());

        assertTrue(service.retrieve("Who is Horus?").isEmpty());
        verifyNoInteractions(optimizer);
    }

    @Test
    void mergeDropsDuplicateChunksPerTitle() {
        Map<String, List<ScoredChunk>> merged = service.mergeChunks(Arrays.asList(
            chunk("Horus", "text ", null),
            chunk("Horus", "text", null),
            chunk(null, "orphan", null),
            chunk("Terra", "text", null)));

        assertEquals(Arrays.asList("Horus", HybridRetrievalService.UNTITLED, "Terra"), new ArrayList<>(merged.keySet()));
        assertEquals(1, merged.get("Horus").size());
    }

    @Test
    void filterKeepsScoredOrMultiChunkTitlesAndFallsBackToAll() {
        Map<String, List<ScoredChunk>> docs = new LinkedHashMap<>();
        docs.put("A", Collections.singletonList(chunk("A", "1", null)));
        docs.put("B", Arrays.asList(chunk("B", "1", null), chunk("B", "2", null)));
        docs.put("C", Collections.singletonList(chunk("C", "1", null)));
        Map<String, Double> scores = new HashMap<>();
        scores.put("C", 0.5);

        assertEquals(Arrays.asList("B", "C"), service.filterTopK(docs, scores));
        assertEquals(Arrays.asList("A"), service.filterTopK(
            Collections.singletonMap("A", Collections.singletonList(chunk("A", "1", null))), new HashMap<>()));
    }

    @Test
    void filterTruncatesToTopKByScorePlusChunkCount() {
        HybridRetrievalService narrow = new HybridRetrievalService(decomposition, search, null, null, null,
            optimizer, 6, 1);
        Map<String, List<ScoredChunk>> docs = new LinkedHashMap<>();
        docs.put("A", Arrays.asList(chunk("A", "1", null), chunk("A", "2", null)));
        docs.put("B", Collections.singletonList(chunk("B", "1", null)));
        Map<String, Double> scores = new HashMap<>();
        scores.put("A", 0.1);
        scores.put("B", 1.5);

        assertEquals(Collections.singletonList("B"), narrow.filterTopK(docs, scores));
    }

    @Test
    void nodesWithoutHttpSourceOrContentAreSkipped() {
        OptimizerPayload payload = new OptimizerPayload(Arrays.asList(
            new PayloadNode("node_1", 0.0, GraphNodeInfo.builder()
                .title("NoSource").description("text").build()),
            new PayloadNode("node_2", 0.0, GraphNodeInfo.builder()
                .title("Empty").source("https://wiki.local/Empty").build())),
            Collections.emptyMap());

        assertTrue(service.assembleContext(payload, new HashMap<>()).isEmpty());
    }
}
