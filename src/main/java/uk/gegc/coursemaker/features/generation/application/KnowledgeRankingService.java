package uk.gegc.coursemaker.features.generation.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.coursemaker.features.generation.config.GenerationProperties;
import uk.gegc.coursemaker.features.generation.domain.model.KnowledgeChunk;
import uk.gegc.coursemaker.features.generation.domain.repository.KnowledgeChunkRepository;
import uk.gegc.coursemaker.shared.cache.TenantCache;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A tenant's most relevant knowledge passages, read through the tenant cache.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KnowledgeRankingService {

    static final String CACHE_KEY = "knowledge:ranked";

    private final KnowledgeChunkRepository chunkRepository;
    private final TenantCache tenantCache;
    private final GenerationProperties properties;

    @Transactional(readOnly = true)
    public RankedKnowledge rankedKnowledge(UUID tenantId) {
        Optional<RankedKnowledge> cached = tenantCache.get(tenantId, CACHE_KEY, RankedKnowledge.class);
        if (cached.isPresent()) {
            return cached.get();
        }

        List<String> passages = chunkRepository
                .findByTenantIdOrderByRelevanceScoreDescPositionAsc(tenantId,
                        PageRequest.of(0, properties.getRankedKnowledgeLimit()))
                .stream()
                .map(KnowledgeChunk::getContent)
                .toList();
        RankedKnowledge ranked = new RankedKnowledge(passages);
        tenantCache.put(tenantId, CACHE_KEY, ranked, properties.getKnowledgeCacheTtl());
        log.debug("Loaded {} ranked knowledge passage(s) for tenant {}", passages.size(), tenantId);
        return ranked;
    }

    /**
     * Drop the cached ranking after the tenant's knowledge changed.
     */
    public void invalidate(UUID tenantId) {
        tenantCache.evict(tenantId, CACHE_KEY);
    }

    public record RankedKnowledge(List<String> passages) {

        public boolean isEmpty() {
            return passages == null || passages.isEmpty();
        }

        /**
         * Passages as a numbered block for prompt templates.
         */
        public String asPromptBlock() {
            if (isEmpty()) {
                return "(no subject-matter knowledge available)";
            }
            StringBuilder block = new StringBuilder();
            for (int i = 0; i < passages.size(); i++) {
                block.append('[').append(i + 1).append("] ").append(passages.get(i)).append('\n');
            }
            return block.toString().trim();
        }
    }
}
