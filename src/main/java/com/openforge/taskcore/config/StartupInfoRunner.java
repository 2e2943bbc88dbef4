package com.openforge.taskcore.config;

import com.openforge.taskcore.embedding.EmbeddingProperties;
import com.openforge.taskcore.extraction.ExtractionProperties;
import com.openforge.taskcore.index.MilvusProperties;
import com.openforge.taskcore.llm.LlmProperties;
import com.openforge.taskcore.repair.RepairProperties;
import com.openforge.taskcore.template.TemplateMatchingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Checks performed:
 *   - MySQL: opens a real JDBC connection and reads the server version
 *   - Milvus: address and collection only; connectivity is reported by MilvusConfig
 *   - Matching / extraction / repair thresholds in effect
 *   - LLM providers and embedding model (API keys masked)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource                 dataSource;
    private final LlmProperties              llmProperties;
    private final EmbeddingProperties        embeddingProperties;
    private final MilvusProperties           milvusProperties;
    private final TemplateMatchingProperties matchingProperties;
    private final ExtractionProperties       extractionProperties;
    private final RepairProperties           repairProperties;
    private final Environment                env;

    @Override
    public void run(ApplicationArguments args) {
        LlmProperties.ProviderConfig primary  = llmProperties.primary();
        LlmProperties.ProviderConfig fallback = llmProperties.fallback();

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              TaskCore  —  Startup Summary                ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Template store (MySQL)                                  ║
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Template index (Milvus)                                 ║
                ║    Enabled        : {}
                ║    Address        : {}:{}
                ║    Collection     : {}  dim={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Matching                                                ║
                ║    Semantic       : {}
                ║    Threshold      : {}  name-priority={}  top-k={}
                ║  Extraction                                              ║
                ║    Temperature    : {}  max-tokens={}  default-range={}d
                ║  Repair                                                  ║
                ║    Max attempts   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  LLM Providers                                           ║
                ║    Primary        : {}  [{}]  key={}
                ║    Fallback       : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Embedding                                               ║
                ║    Model          : {}  dim={}
                ║    Endpoint       : {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                probeDatabase(),

                env.getProperty("agent.milvus.enabled", "true"),
                milvusProperties.host(), milvusProperties.port(),
                milvusProperties.collectionName(), milvusProperties.vectorDimensions(),

                matchingProperties.vectorSearchEnabled() ? "✔ enabled" : "✘ trigger patterns only",
                matchingProperties.similarityThreshold(),
                matchingProperties.namePriorityThreshold(),
                matchingProperties.topK(),

                extractionProperties.temperature(),
                extractionProperties.maxOutputTokens(),
                extractionProperties.defaultRangeDays(),

                repairProperties.maxAttempts(),

                primary.name(), primary.model() + (primary.jsonMode() ? ", json" : ""), maskKey(primary.apiKey()),
                !llmProperties.hasFallback()
                        ? "(none)"
                        : "%s  [%s]  key=%s".formatted(fallback.name(), fallback.model(), maskKey(fallback.apiKey())),

                embeddingProperties.model(),
                embeddingProperties.dimensions(),
                embeddingProperties.baseUrl()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String probeDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String version = conn.getMetaData().getDatabaseProductVersion();
            String safeUrl = url.replaceAll("password=[^&;]*", "password=***");
            return "✔ Connected  version=" + version + "  url=" + safeUrl;
        } catch (SQLException e) {
            log.warn("[Startup] Template store probe failed: {}", e.getMessage());
            return "✘ FAILED — " + e.getMessage();
        }
    }

    /** First 6 chars + "..." + last 4; "(not set)" for blanks and placeholders. */
    static String maskKey(String key) {
        if (key == null || key.isBlank() || key.startsWith("sk-placeholder")) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
